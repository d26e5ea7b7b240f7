package org.umsforge.codegen.provider.r5;

import ca.uhn.fhir.rest.api.server.RequestDetails;
import ca.uhn.fhir.rest.server.exceptions.InvalidRequestException;
import org.hl7.fhir.r5.model.BooleanType;
import org.hl7.fhir.r5.model.Enumerations;
import org.hl7.fhir.r5.model.Library;
import org.hl7.fhir.r5.model.Parameters;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.umsforge.codegen.service.MeasureCodeOptions;
import org.umsforge.codegen.service.MeasureCodeService;
import org.umsforge.codegen.service.MeasureFixtures;
import org.umsforge.codegen.service.cql.CqlBoilerplateRegistry;
import org.umsforge.codegen.service.cql.CqlGenerator;
import org.umsforge.codegen.service.impl.MeasureCodeServiceFactory;
import org.umsforge.codegen.service.override.InMemoryCodeOverrideStore;
import org.umsforge.codegen.service.sql.SqlGenerator;
import org.umsforge.codegen.service.utils.UmsJsonReader;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class MeasureCodeProviderTest {

	private static final String NOTE = "Broaden the encounter value set";

	private MeasureCodeServiceFactory factory;
	private UmsJsonReader jsonReader;
	private MeasureCodeProvider provider;
	private RequestDetails requestDetails;
	private String measureJson;

	@BeforeEach
	void setUp() throws Exception {
		CqlGenerator cqlGenerator = new CqlGenerator(MeasureFixtures.FIXED_CLOCK, CqlBoilerplateRegistry.defaultRegistry());
		MeasureCodeService service = new MeasureCodeService(cqlGenerator, new SqlGenerator(MeasureFixtures.FIXED_CLOCK),
			new InMemoryCodeOverrideStore(), MeasureCodeOptions.defaultOptions());
		factory = Mockito.mock(MeasureCodeServiceFactory.class);
		when(factory.create(any())).thenReturn(service);
		requestDetails = Mockito.mock(RequestDetails.class);
		jsonReader = new UmsJsonReader();
		provider = new MeasureCodeProvider(factory, jsonReader);
		measureJson = jsonReader.write(MeasureFixtures.diabetesEyeExam());
	}

	@Test
	void generateMeasureCode_Cql_ReturnsCodeAndLibrary() {
		Parameters result = provider.generateMeasureCode(measureJson, "cql", null, requestDetails);

		assertEquals("true", value(result, "success"));
		String code = value(result, "code");
		assertTrue(code.contains("library CMS131TEST version '2.1.0'"));

		Library library = (Library) result.getParameter("library").getResource();
		assertEquals("CMS131TEST", library.getName());
		assertEquals("2.1.0", library.getVersion());
		assertEquals(Enumerations.PublicationStatus.DRAFT, library.getStatus());
		assertEquals("logic-library", library.getType().getCodingFirstRep().getCode());
		assertEquals(MeasureCodeProvider.CQL_CONTENT_TYPE, library.getContentFirstRep().getContentType());
		assertEquals(code, new String(library.getContentFirstRep().getData(), StandardCharsets.UTF_8));
		verify(factory, times(1)).create(requestDetails);
	}

	@Test
	void generateMeasureCode_Sql_UsesRequestedPopulation() {
		Parameters result = provider.generateMeasureCode(measureJson, "synapse-sql", "POP-42", requestDetails);

		assertTrue(value(result, "code").contains("P.population_id = 'POP-42'"));
		assertFalse(result.getParameter().stream().anyMatch(p -> "library".equals(p.getName())));
	}

	@Test
	void generateMeasureCode_UnknownFormat_IsInvalidRequest() {
		InvalidRequestException e = assertThrows(InvalidRequestException.class,
			() -> provider.generateMeasureCode(measureJson, "fortran", null, requestDetails));

		assertTrue(e.getMessage().contains("Unsupported output format: fortran"));
	}

	@Test
	void generateMeasureCode_BrokenJson_IsInvalidRequest() {
		assertThrows(InvalidRequestException.class, () -> provider.generateMeasureCode("{\"id\":", "cql", null, requestDetails));
		assertThrows(InvalidRequestException.class, () -> provider.generateMeasureCode(null, "cql", null, requestDetails));
	}

	@Test
	void generateMeasureCode_MeasureWithoutPopulations_ReportsErrors() {
		Parameters result = provider.generateMeasureCode("{\"id\":\"EMPTY\"}", "cql", null, requestDetails);

		assertEquals("false", value(result, "success"));
		assertEquals(List.of("At least one population definition is required"), values(result, "error"));
	}

	@Test
	void validateMeasureCode_DetailedSql_ReturnsAnalysisAndScore() {
		String sql = value(provider.generateMeasureCode(measureJson, "synapse-sql", "POP-2025", requestDetails), "code");

		Parameters result = provider.validateMeasureCode(sql, "synapse-sql", "POP-2025", new BooleanType(true), requestDetails);

		assertEquals("true", value(result, "valid"));
		assertEquals("100", value(result, "score"));
		assertTrue(value(result, "analysis").contains("\"PRED_ENC_2\""));
	}

	@Test
	void validateMeasureCode_BrokenCql_ReturnsIssueParts() {
		Parameters result = provider.validateMeasureCode("define \"X\":\n  (true", "cql", null, null, requestDetails);

		assertEquals("false", value(result, "valid"));
		Parameters.ParametersParameterComponent issue = result.getParameter().stream()
			.filter(p -> "issue".equals(p.getName()))
			.filter(p -> "UNBALANCED_PARENS".equals(p.getPart().get(1).getValue().primitiveValue()))
			.findFirst()
			.orElse(null);
		assertNotNull(issue);
		assertEquals("error", issue.getPart().get(0).getValue().primitiveValue());
		assertEquals("line", issue.getPart().get(3).getName());
		assertEquals("2", issue.getPart().get(3).getValue().primitiveValue());
		assertFalse(values(result, "suggestion").isEmpty());
	}

	@Test
	void saveAndRevertCodeOverride_RoundTripThroughGeneration() {
		Parameters saved = provider.saveCodeOverride("CMS131-TEST", "e-office", "cql", "exists [Encounter]", NOTE, null, "codes", requestDetails);
		assertEquals("true", value(saved, "success"));
		assertTrue(value(saved, "override").contains("\"locked\":true"));

		Parameters generated = provider.generateMeasureCode(measureJson, "cql", null, requestDetails);
		assertEquals(List.of("e-office"), values(generated, "appliedOverride"));

		Parameters listed = provider.codeOverrides("CMS131-TEST", null, requestDetails);
		assertEquals(1, values(listed, "override").size());

		assertEquals("true", value(provider.revertCodeOverride("CMS131-TEST", "e-office", "cql", requestDetails), "reverted"));
		assertTrue(values(provider.generateMeasureCode(measureJson, "cql", null, requestDetails), "appliedOverride").isEmpty());
	}

	@Test
	void saveCodeOverride_ShortNote_ReportsError() {
		Parameters result = provider.saveCodeOverride("CMS131-TEST", "e-office", "cql", "true", "short", null, null, requestDetails);

		assertEquals("false", value(result, "success"));
		assertEquals(List.of("Edit note must be at least 10 characters"), values(result, "error"));
	}

	@Test
	void saveCodeOverride_UnknownChangeType_IsInvalidRequest() {
		assertThrows(InvalidRequestException.class,
			() -> provider.saveCodeOverride("CMS131-TEST", "e-office", "cql", "true", NOTE, null, "cosmetic", requestDetails));
	}

	@Test
	void codeOverrides_MissingMeasureId_IsInvalidRequest() {
		assertThrows(InvalidRequestException.class, () -> provider.codeOverrides(" ", "cql", requestDetails));
	}

	@Test
	void diffMeasure_ReturnsSummaryAndJson() throws Exception {
		String next = jsonReader.write(MeasureFixtures.diabetesEyeExam().setVersion("3.0.0"));

		Parameters result = provider.diffMeasure(measureJson, next, new BooleanType(false), requestDetails);

		assertEquals("1", value(result, "totalChanges"));
		assertTrue(value(result, "summary").startsWith("Measure Comparison: CMS131-TEST (2.1.0)"));
		assertTrue(value(result, "diff").contains("\"metadataChanges\""));
	}

	private static String value(Parameters parameters, String name) {
		Parameters.ParametersParameterComponent parameter = parameters.getParameter(name);
		assertNotNull(parameter, name);
		return parameter.getValue().primitiveValue();
	}

	private static List<String> values(Parameters parameters, String name) {
		return parameters.getParameter().stream()
			.filter(p -> name.equals(p.getName()))
			.map(p -> p.getValue().primitiveValue())
			.collect(Collectors.toList());
	}
}
