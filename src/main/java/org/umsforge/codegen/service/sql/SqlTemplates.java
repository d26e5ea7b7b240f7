package org.umsforge.codegen.service.sql;

import org.umsforge.codegen.service.utils.CodeText;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Fixed text of the HDI Synapse script: header, terminology and demographics CTEs, predicate skeleton and views.
 */
final class SqlTemplates {
	static final String SECTION_SEPARATOR = ",\n--\n";
	private static final String RULE = "-- ============================================================================";

	private SqlTemplates() {
	}

	static String header(String populationId, String dialect, Instant generated, String title) {
		return RULE + "\n"
			+ "-- Generated SQL for HDI Platform\n"
			+ "-- Measure: " + CodeText.singleLine(title) + "\n"
			+ "-- Population ID: " + CodeText.singleLine(populationId) + "\n"
			+ "-- Dialect: " + dialect + "\n"
			+ "-- Generated: " + generated + "\n"
			+ RULE + "\n";
	}

	static String ontology(List<String> contexts, boolean excludeSnapshots) {
		String contextList = contexts.stream()
			.map(c -> "        '" + CodeText.escapeSql(c) + "'")
			.collect(Collectors.joining(",\n"));
		StringBuilder sb = new StringBuilder();
		sb.append("-- Retrieve necessary terminology contexts and concepts.\n");
		sb.append("ONT as (\n");
		sb.append("  select distinct\n");
		sb.append("    O.*\n");
		sb.append("  from ph_d_ontology O\n");
		sb.append("  where\n");
		if (excludeSnapshots) {
			sb.append("    O.population_id not like '%SNAPSHOT%'\n");
			sb.append("      and O.population_id not like '%ARCHIVE%'\n");
			sb.append("      and (\n");
		} else {
			sb.append("    (\n");
		}
		sb.append("      O.context_name in (\n");
		sb.append(contextList).append('\n');
		sb.append("      )\n");
		sb.append("    )\n");
		sb.append(")");
		return sb.toString();
	}

	/**
	 * Person demographics with ontology concept names and the age at the end of the measurement period.
	 */
	static String demographics(String populationId, String ageReferenceDate) {
		String refDate = "'" + ageReferenceDate + "'";
		return "-- Patient demographics with resolved concept names.\n"
			+ "DEMOG as (\n"
			+ "  select distinct\n"
			+ "    P.population_id\n"
			+ "    , P.empi_id\n"
			+ "    , P.gender_coding_system_id\n"
			+ "    , P.gender_code\n"
			+ "    , GENDO.concept_name as gender_concept_name\n"
			+ "    , P.birth_date\n"
			+ "    , DATEDIFF(YEAR, P.birth_date, " + refDate + ") - CASE WHEN FORMAT(CONVERT(date, " + refDate + "), 'MMdd') < FORMAT(P.birth_date, 'MMdd') THEN 1 ELSE 0 END as age_in_years\n"
			+ "    , P.deceased\n"
			+ "    , P.deceased_dt_tm\n"
			+ "    , P.postal_cd as raw_postal_cd\n"
			+ "    , STATEO.concept_name as state_concept_name\n"
			+ "    , CO.concept_name as country_concept_name\n"
			+ "    , MSO.concept_name as marital_status_concept_name\n"
			+ "    , EO.concept_name as ethnicity_concept_name\n"
			+ "    , RACEO.concept_name as race_concept_name\n"
			+ "    , RO.concept_name as religion_concept_name\n"
			+ "  from ph_d_person P\n"
			+ "  left join ONT GENDO\n"
			+ "    on P.gender_coding_system_id = GENDO.code_system_id\n"
			+ "      and P.gender_code = GENDO.code_oid\n"
			+ "      and GENDO.concept_class_name = 'Gender'\n"
			+ "  left join ONT STATEO\n"
			+ "    on P.state_coding_system_id = STATEO.code_system_id\n"
			+ "      and P.state_code = STATEO.code_oid\n"
			+ "      and STATEO.concept_class_name = 'Environment'\n"
			+ "  left join ONT CO\n"
			+ "    on P.country_coding_system_id = CO.code_system_id\n"
			+ "      and P.country_code = CO.code_oid\n"
			+ "      and CO.concept_class_name = 'Unspecified'\n"
			+ "  left join ph_d_person_demographics PD\n"
			+ "    on P.population_id = PD.population_id\n"
			+ "      and P.empi_id = PD.empi_id\n"
			+ "  left join ONT MSO\n"
			+ "    on PD.marital_status_coding_system_id = MSO.code_system_id\n"
			+ "      and PD.marital_status_code = MSO.code_oid\n"
			+ "      and MSO.concept_class_name = 'Marital Status'\n"
			+ "  left join ONT EO\n"
			+ "    on PD.ethnicity_coding_system_id = EO.code_system_id\n"
			+ "      and PD.ethnicity_code = EO.code_oid\n"
			+ "      and EO.concept_class_name in ('Race', 'Ethnicity')\n"
			+ "  left join ONT RO\n"
			+ "    on PD.religion_coding_system_id = RO.code_system_id\n"
			+ "      and PD.religion_code = RO.code_oid\n"
			+ "      and RO.concept_class_name = 'Unspecified'\n"
			+ "  left join ph_d_person_race RD\n"
			+ "    on P.population_id = RD.population_id\n"
			+ "      and P.empi_id = RD.empi_id\n"
			+ "  left join ONT RACEO\n"
			+ "    on RD.race_coding_system_id = RACEO.code_system_id\n"
			+ "      and RD.race_code = RACEO.code_oid\n"
			+ "      and RACEO.concept_class_name = 'Race'\n"
			+ "  where\n"
			+ "    -- PARAMETER: Use appropriate HDI population_id.\n"
			+ "    P.population_id = '" + CodeText.escapeSql(populationId) + "'\n"
			+ ")";
	}

	static String valueSetFilter(String oid, String alias, String codeColumn) {
		return "exists (\n"
			+ "      select 1 from valueset_codes VS\n"
			+ "      where VS.valueset_oid = '" + CodeText.escapeSql(oid) + "'\n"
			+ "        and VS.code = " + alias + "." + codeColumn + "\n"
			+ "    )";
	}

	static String createView(String viewName, String body) {
		return "CREATE OR ALTER VIEW [measure].[" + viewName + "]\nAS\n" + body + ";\nGO\n";
	}

	static String populationMembers(String library, String populationType) {
		return "select distinct empi_id\n"
			+ "from [measure].[" + library + "_Populations]\n"
			+ "where population_type = '" + populationType + "'";
	}

	static String resultsView(String library) {
		String prefix = "[measure].[" + library;
		return "select\n"
			+ "    ip.empi_id,\n"
			+ "    CASE WHEN ex.empi_id IS NOT NULL THEN 1 ELSE 0 END AS is_excluded,\n"
			+ "    CASE WHEN num.empi_id IS NOT NULL THEN 1 ELSE 0 END AS numerator_met,\n"
			+ "    CASE\n"
			+ "        WHEN ex.empi_id IS NOT NULL THEN 'Excluded'\n"
			+ "        WHEN num.empi_id IS NOT NULL THEN 'Performance Met'\n"
			+ "        ELSE 'Performance Not Met'\n"
			+ "    END AS measure_status\n"
			+ "FROM " + prefix + "_InitialPopulation] ip\n"
			+ "INNER JOIN (\n"
			+ "    " + populationMembers(library, "Denominator").replace("\n", "\n    ") + "\n"
			+ ") den\n"
			+ "    ON ip.empi_id = den.empi_id\n"
			+ "LEFT JOIN " + prefix + "_DenominatorExclusions] ex\n"
			+ "    ON ip.empi_id = ex.empi_id\n"
			+ "LEFT JOIN " + prefix + "_Numerator] num\n"
			+ "    ON ip.empi_id = num.empi_id\n"
			+ "    AND ex.empi_id IS NULL";
	}

	static String summaryView(String library) {
		return "select population_type, count(distinct empi_id) as patient_count\n"
			+ "from [measure].[" + library + "_Populations]\n"
			+ "group by population_type";
	}
}
