package org.umsforge.codegen.service.validation;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.umsforge.codegen.service.sql.SqlGenerationConfig;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SqlValidatorTest {

	private static final String VALID_SQL = "with\n"
		+ "ONT as (\n"
		+ "  select distinct O.* from ph_d_ontology O where O.context_name in ('HEALTHE INTENT Demographics')\n"
		+ "),\n"
		+ "DEMOG as (\n"
		+ "  select distinct\n"
		+ "    P.population_id\n"
		+ "    , P.empi_id\n"
		+ "    , GENDO.concept_name as gender_concept_name\n"
		+ "  from ph_d_person P\n"
		+ "  left join ONT GENDO\n"
		+ "    on P.gender_code = GENDO.code_oid\n"
		+ "  where P.population_id = 'POP-1'\n"
		+ "),\n"
		+ "PRED_ENC_1 as (\n"
		+ "  select distinct\n"
		+ "    E.population_id\n"
		+ "    , E.empi_id\n"
		+ "    , 'Encounter' as data_model\n"
		+ "  from ph_f_encounter E\n"
		+ "  where E.population_id = 'POP-1'\n"
		+ "),\n"
		+ "INITIAL_POPULATION as (\n"
		+ "  select distinct empi_id from PRED_ENC_1\n"
		+ ")\n"
		+ "select 'Initial Population' as population_type, empi_id from INITIAL_POPULATION";

	private SqlValidator validator;

	@BeforeEach
	void setUp() {
		validator = new SqlValidator();
	}

	@Test
	void validate_ConventionalScript_HasNoIssues() {
		ValidationResult result = validator.validate(VALID_SQL, SqlGenerationConfig.forPopulation("POP-1"));

		assertTrue(result.isValid(), () -> result.getErrors().toString());
		assertTrue(result.getWarnings().isEmpty(), () -> result.getWarnings().toString());
		assertEquals(100, result.getScore());
	}

	@Test
	void validate_MissingOnt_IsAnErrorAndCostsScore() {
		String sql = VALID_SQL.replace("ONT as (", "TERMS as (").replace("left join ONT", "left join TERMS");

		ValidationResult result = validator.validate(sql, null);

		assertFalse(result.isValid());
		assertTrue(result.hasIssue(SqlValidator.MISSING_REQUIRED_CTE));
		assertTrue(result.getScore() <= 90);
		assertTrue(result.getSuggestions().contains("Add the ONT CTE from the HDI template"));
	}

	@Test
	void validate_NotStartingWithWith_IsInvalidStructure() {
		ValidationResult result = validator.validate("select 1 from DEMOG;\n" + VALID_SQL, null);

		assertTrue(result.hasIssue(SqlValidator.INVALID_CTE_STRUCTURE));
	}

	@Test
	void validate_LeadingCommentsAndViewHeader_AreAccepted() {
		String sql = "-- header\n-- more\nCREATE OR ALTER VIEW [measure].[X_Populations]\nAS\n" + VALID_SQL;

		ValidationResult result = validator.validate(sql, null);

		assertFalse(result.hasIssue(SqlValidator.INVALID_CTE_STRUCTURE));
	}

	@Test
	void validate_NonConventionalCteName_WarnsWithRenameSuggestion() {
		String sql = VALID_SQL.replace("PRED_ENC_1", "VISITS");

		ValidationResult result = validator.validate(sql, null);

		assertTrue(result.isValid());
		assertTrue(result.hasIssue(SqlValidator.PREDICATE_NAMING));
		assertTrue(result.getSuggestions().contains("Rename to PRED_VISITS for consistency"));
		assertTrue(result.getSuggestions().contains("Consider adding PRED_* CTEs for clinical criteria"));
	}

	@Test
	void validate_PredicateWithoutDataModel_Warns() {
		String sql = VALID_SQL.replace("    , 'Encounter' as data_model\n", "");

		ValidationResult result = validator.validate(sql, null);

		assertEquals(1, result.getWarnings().size());
		ValidationIssue issue = result.getWarnings().get(0);
		assertEquals(SqlValidator.MISSING_PREDICATE_COLUMN, issue.getCode());
		assertEquals("Predicate PRED_ENC_1 is missing column data_model", issue.getMessage());
		assertNotNull(issue.getLine());
	}

	@Test
	void validate_PostgresDateArithmetic_IsDialectMismatch() {
		String sql = VALID_SQL.replace("where E.population_id = 'POP-1'",
			"where E.population_id = 'POP-1' and E.service_date > current_date() - interval '1 year'");

		ValidationResult result = validator.validate(sql, null);

		assertTrue(result.isValid());
		assertEquals(3, result.getWarnings().stream().filter(i -> i.getCode().equals(SqlValidator.DIALECT_MISMATCH)
			|| i.getCode().equals(SqlValidator.SYNAPSE_SYNTAX)).count());
	}

	@Test
	void validate_NoPopulationId_IsAnError() {
		String sql = "with ONT as (select 1 as x), DEMOG as (select 1 as y left join ONT o on 1 = 1)";

		ValidationResult result = validator.validate(sql, null);

		assertTrue(result.hasIssue(SqlValidator.MISSING_POPULATION_FILTER));
	}

	@Test
	void validate_OtherPopulationId_WarnsOnlyForConcreteIds() {
		assertTrue(validator.validate(VALID_SQL, SqlGenerationConfig.forPopulation("POP-2")).hasIssue(SqlValidator.POPULATION_ID_MISMATCH));
		assertFalse(validator.validate(VALID_SQL, SqlGenerationConfig.defaultConfig()).hasIssue(SqlValidator.POPULATION_ID_MISMATCH));
	}

	@Test
	void validate_DemographicsWithoutOntology_Warns() {
		String sql = VALID_SQL
			.replace("    , GENDO.concept_name as gender_concept_name\n", "")
			.replace("  left join ONT GENDO\n    on P.gender_code = GENDO.code_oid\n", "");

		ValidationResult result = validator.validate(sql, null);

		assertTrue(result.hasIssue(SqlValidator.MISSING_ONT_JOINS));
		assertTrue(result.hasIssue(SqlValidator.MISSING_CONCEPT_NAMES));
	}

	@Test
	void validate_StackedDropStatement_IsReportedOnce() {
		String sql = VALID_SQL + ";\nDROP TABLE ph_d_person;\n-- drop everything";

		ValidationResult result = validator.validate(sql, null);

		assertEquals(1, result.getErrors().stream().filter(i -> i.getCode().equals(SqlValidator.POTENTIAL_SQL_INJECTION)).count());
	}

	@Test
	void validate_UnquotedTemplateParameter_Warns() {
		String sql = VALID_SQL.replace("'POP-1'", "${POPULATION_ID}");

		ValidationResult result = validator.validate(sql, null);

		assertTrue(result.hasIssue(SqlValidator.UNQUOTED_PARAMETER));
		assertFalse(validator.validate(VALID_SQL.replace("POP-1", "${POPULATION_ID}"), null).hasIssue(SqlValidator.UNQUOTED_PARAMETER));
	}

	@Test
	void validate_UnbalancedParensAndQuotes_AreErrors() {
		ValidationResult parens = validator.validate(VALID_SQL + "\nwhere (1 = 1", null);
		ValidationResult quotes = validator.validate(VALID_SQL.replace("('HEALTHE INTENT Demographics')", "('HEALTHE INTENT Demographics)"), null);

		assertTrue(parens.hasIssue(SqlValidator.UNBALANCED_PARENS));
		assertTrue(quotes.hasIssue(SqlValidator.UNBALANCED_QUOTES));
	}

	@Test
	void validate_MoreIssues_NeverRaiseTheScore() {
		int clean = validator.validate(VALID_SQL, null).getScore();
		int oneWarning = validator.validate(VALID_SQL.replace("PRED_ENC_1", "VISITS"), null).getScore();
		int broken = validator.validate("drop", null).getScore();

		assertTrue(clean >= oneWarning);
		assertTrue(oneWarning >= broken);
		assertTrue(broken >= 0);
	}

	@Test
	void validateDetailed_ReportsCtesDependenciesAndColumns() {
		DetailedSqlValidation detailed = validator.validateDetailed(VALID_SQL, null);

		CteAnalysis ctes = detailed.getCteAnalysis();
		assertEquals(List.of("ONT", "DEMOG", "PRED_ENC_1", "INITIAL_POPULATION"), ctes.getNames());
		assertEquals(4, ctes.getTotal());
		assertEquals(List.of("PRED_ENC_1"), ctes.getPredicates());
		assertEquals(List.of("INITIAL_POPULATION"), ctes.getPopulations());
		assertEquals(List.of("ONT"), ctes.getDependencies().get("DEMOG"));
		assertEquals(List.of("PRED_ENC_1"), ctes.getDependencies().get("INITIAL_POPULATION"));

		ColumnAnalysis columns = detailed.getColumnAnalysis();
		assertEquals(List.of("population_id", "empi_id", "gender_concept_name"), columns.getSelectColumns().get("DEMOG"));
		assertEquals(List.of("population_id", "empi_id", "data_model"), columns.getSelectColumns().get("PRED_ENC_1"));
		assertTrue(columns.getJoinConditions().contains("P.gender_code = GENDO.code_oid"));
		assertTrue(columns.getFilterConditions().contains("E.population_id = 'POP-1'"));
		assertTrue(detailed.getResult().isValid());
	}

	@Test
	void selectAliases_FunctionsAndLiterals_UseAliasOrLastPart() {
		List<String> aliases = SqlValidator.selectAliases(" select max(E.encounter_id) as identifier, E.empi_id, 'a, b' as label from X");

		assertEquals(List.of("identifier", "empi_id", "label"), aliases);
	}

	@Test
	void score_IsClampedAtZero() {
		assertEquals(100, ValidationResult.score(0, 0));
		assertEquals(87, ValidationResult.score(1, 1));
		assertEquals(0, ValidationResult.score(12, 0));
	}
}
