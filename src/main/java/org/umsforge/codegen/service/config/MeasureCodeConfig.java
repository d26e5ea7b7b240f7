package org.umsforge.codegen.service.config;

import org.umsforge.codegen.provider.r5.MeasureCodeProvider;
import org.umsforge.codegen.service.MeasureCodeOptions;
import org.umsforge.codegen.service.MeasureCodeService;
import org.umsforge.codegen.service.cql.CqlBoilerplateRegistry;
import org.umsforge.codegen.service.cql.CqlGenerator;
import org.umsforge.codegen.service.impl.MeasureCodeServiceFactory;
import org.umsforge.codegen.service.override.CodeOverrideStore;
import org.umsforge.codegen.service.override.InMemoryCodeOverrideStore;
import org.umsforge.codegen.service.sql.SqlGenerator;
import org.umsforge.codegen.service.utils.UmsJsonReader;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Conditional;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

import java.time.Clock;

@Configuration
@Conditional({MeasureCodeConfigCondition.class})
public class MeasureCodeConfig {

	@Bean
	Clock measureCodeClock() {
		return Clock.systemUTC();
	}

	@Bean
	MeasureCodeOptions measureCodeOptions(Environment theEnvironment) {
		MeasureCodeOptions options = MeasureCodeOptions.defaultOptions();
		options.setMinNoteLength(theEnvironment.getProperty("hapi.fhir.measure_code.min_note_length", Integer.class, options.getMinNoteLength()));
		options.setDefaultPopulationId(theEnvironment.getProperty("hapi.fhir.measure_code.population_id", options.getDefaultPopulationId()));
		options.setDefaultAuthor(theEnvironment.getProperty("hapi.fhir.measure_code.author", options.getDefaultAuthor()));
		options.setDefaultDialect(theEnvironment.getProperty("hapi.fhir.measure_code.dialect", options.getDefaultDialect()));
		return options;
	}

	@Bean
	CodeOverrideStore codeOverrideStore(Clock measureCodeClock, MeasureCodeOptions measureCodeOptions) {
		return new InMemoryCodeOverrideStore(measureCodeClock, measureCodeOptions.getMinNoteLength(), measureCodeOptions.getDefaultAuthor());
	}

	@Bean
	MeasureCodeServiceFactory measureCodeServiceFactory(Clock measureCodeClock, CodeOverrideStore codeOverrideStore,
			MeasureCodeOptions measureCodeOptions) {
		CqlBoilerplateRegistry registry = CqlBoilerplateRegistry.defaultRegistry();
		return (rd) -> new MeasureCodeService(new CqlGenerator(measureCodeClock, registry), new SqlGenerator(measureCodeClock),
			codeOverrideStore, measureCodeOptions);
	}

	@Bean
	UmsJsonReader umsJsonReader() {
		return new UmsJsonReader();
	}

	@Bean
	public MeasureCodeProvider measureCodeProvider(MeasureCodeServiceFactory measureCodeServiceFactory, UmsJsonReader umsJsonReader) {
		return new MeasureCodeProvider(measureCodeServiceFactory, umsJsonReader);
	}
}
