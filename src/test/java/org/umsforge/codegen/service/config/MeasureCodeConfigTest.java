package org.umsforge.codegen.service.config;

import org.junit.jupiter.api.Test;
import org.springframework.context.annotation.AnnotationConfigApplicationContext;
import org.springframework.core.env.MapPropertySource;
import org.umsforge.codegen.provider.r5.MeasureCodeProvider;
import org.umsforge.codegen.service.MeasureCodeOptions;
import org.umsforge.codegen.service.MeasureCodeService;
import org.umsforge.codegen.service.OutputFormat;
import org.umsforge.codegen.service.impl.MeasureCodeServiceFactory;
import org.umsforge.codegen.service.override.OverrideSaveResult;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MeasureCodeConfigTest {

	@Test
	void enabled_RegistersProviderAndAppliesProperties() {
		Map<String, Object> properties = new HashMap<>();
		properties.put(MeasureCodeConfigCondition.ENABLED_PROPERTY, "true");
		properties.put("hapi.fhir.measure_code.min_note_length", "20");
		properties.put("hapi.fhir.measure_code.population_id", "POP-2025");
		properties.put("hapi.fhir.measure_code.author", "quality-team");

		try (AnnotationConfigApplicationContext context = context(properties)) {
			assertNotNull(context.getBean(MeasureCodeProvider.class));
			MeasureCodeOptions options = context.getBean(MeasureCodeOptions.class);
			assertEquals(20, options.getMinNoteLength());
			assertEquals("POP-2025", options.defaultSqlConfig().getPopulationId());
			assertEquals("synapse", options.getDefaultDialect());

			MeasureCodeServiceFactory factory = context.getBean(MeasureCodeServiceFactory.class);
			MeasureCodeService first = factory.create(null);
			MeasureCodeService second = factory.create(null);
			OverrideSaveResult tooShort = first.saveOverride("M1", "e-1", OutputFormat.CQL, "true", "fifteen chars..", null);
			OverrideSaveResult saved = first.saveOverride("M1", "e-1", OutputFormat.CQL, "true", "long enough to pass the minimum", null);

			assertFalse(tooShort.isSuccess());
			assertTrue(saved.isSuccess());
			assertEquals("quality-team", saved.getOverride().getNotes().get(0).getAuthor());
			assertEquals(1, second.getOverridesForMeasure("M1", null).size());
			assertSame(options, second.getOptions());
		}
	}

	@Test
	void disabled_RegistersNothing() {
		try (AnnotationConfigApplicationContext context = context(Map.of(MeasureCodeConfigCondition.ENABLED_PROPERTY, "false"))) {
			assertEquals(0, context.getBeanNamesForType(MeasureCodeProvider.class).length);
		}
	}

	@Test
	void missingProperty_RegistersNothing() {
		try (AnnotationConfigApplicationContext context = context(Map.of())) {
			assertEquals(0, context.getBeanNamesForType(MeasureCodeServiceFactory.class).length);
		}
	}

	private static AnnotationConfigApplicationContext context(Map<String, Object> properties) {
		AnnotationConfigApplicationContext context = new AnnotationConfigApplicationContext();
		context.getEnvironment().getPropertySources().addFirst(new MapPropertySource("test", properties));
		context.register(MeasureCodeConfig.class);
		context.refresh();
		return context;
	}
}
