package org.umsforge.codegen.service.sql;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.umsforge.codegen.service.utils.CodeText;
import org.umsforge.codegen.service.utils.MeasurePreconditions;
import org.umsforge.model.Measure;
import org.umsforge.model.MeasurementPeriod;
import org.umsforge.model.Population;
import org.umsforge.model.PopulationType;
import org.umsforge.model.ValueSetReference;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Generates a CTE based T-SQL script for the HealtheIntent (HDI) Synapse data platform.
 */
public class SqlGenerator {
	private static final Logger logger = LoggerFactory.getLogger(SqlGenerator.class);

	static final String NO_CLINICAL_CRITERIA = "No clinical criteria found - generating demographics-only query";
	private static final String EMPTY_SET = "select empi_id from DEMOG where 1 = 0";

	private final Clock clock;

	public SqlGenerator() {
		this(Clock.systemUTC());
	}

	public SqlGenerator(Clock clock) {
		this.clock = clock;
	}

	/**
	 * Generates the population views of a measure.
	 *
	 * @param measure the measure to compile
	 * @param config  dialect, population id, measurement period and ontology options; {@code null} for defaults
	 * @return the generated script, or a failed result listing every violated precondition
	 */
	public SqlGenerationResult generate(Measure measure, SqlGenerationConfig config) {
		SqlGenerationConfig cfg = config == null ? SqlGenerationConfig.defaultConfig() : config;
		List<String> errors = MeasurePreconditions.check(measure);
		if (!SqlGenerationConfig.SYNAPSE.equalsIgnoreCase(StringUtils.trimToEmpty(cfg.getDialect()))) {
			errors.add(String.format("Unsupported SQL dialect: %s", cfg.getDialect()));
		}
		if (!errors.isEmpty()) {
			logger.warn("SQL generation rejected: {}", errors);
			return SqlGenerationResult.failure(errors);
		}

		String populationId = StringUtils.defaultIfBlank(cfg.getPopulationId(), SqlGenerationConfig.POPULATION_ID_PLACEHOLDER);
		MeasurementPeriod period = resolvePeriod(measure, cfg);
		logger.info("Generating Synapse SQL for measure {} and population {}", measure.getId(), populationId);

		List<String> warnings = new ArrayList<>();
		Map<String, ValueSetReference> byId = new HashMap<>();
		for (ValueSetReference vs : measure.getValueSets()) {
			if (vs.getId() != null) byId.put(vs.getId(), vs);
		}
		SqlPopulationBuilder builder = new SqlPopulationBuilder(cfg, populationId, period, byId, warnings);

		String globalPredicate = builder.globalDemographics(measure.getGlobalConstraints());
		List<String> populationCtes = new ArrayList<>();
		for (PopulationType type : PopulationType.values()) {
			Optional<Population> population = measure.findPopulation(type);
			String body = populationBody(type, population, globalPredicate, builder);
			StringBuilder cte = new StringBuilder();
			if (cfg.isIncludeComments()) cte.append("-- ").append(type.display()).append('\n');
			cte.append(type.cteName()).append(" as (\n  ").append(body).append("\n)");
			populationCtes.add(cte.toString());
		}
		if (!builder.hasClinicalPredicates()) warnings.add(NO_CLINICAL_CRITERIA);

		String library = CodeText.libraryName(measure.getId());
		List<String> sections = new ArrayList<>();
		sections.add(SqlTemplates.ontology(ontologyContexts(cfg, builder), cfg.isExcludeSnapshotsAndArchives()));
		sections.add(SqlTemplates.demographics(populationId, period.getEnd().toString()));
		sections.addAll(builder.getPredicates());
		sections.addAll(populationCtes);

		StringBuilder sql = new StringBuilder();
		sql.append(SqlTemplates.header(populationId, SqlGenerationConfig.SYNAPSE, clock.instant(), StringUtils.defaultIfBlank(measure.getTitle(), measure.getId())));
		sql.append('\n');
		sql.append("CREATE OR ALTER VIEW [measure].[").append(library).append("_Populations]\nAS\nwith\n");
		sql.append(String.join(SqlTemplates.SECTION_SEPARATOR, sections)).append('\n');
		sql.append(finalSelect()).append(";\nGO\n\n");
		sql.append(SqlTemplates.createView(library + "_InitialPopulation",
			SqlTemplates.populationMembers(library, PopulationType.INITIAL_POPULATION.display()))).append('\n');
		sql.append(SqlTemplates.createView(library + "_DenominatorExclusions",
			SqlTemplates.populationMembers(library, PopulationType.DENOMINATOR_EXCLUSION.display()))).append('\n');
		sql.append(SqlTemplates.createView(library + "_Numerator",
			SqlTemplates.populationMembers(library, PopulationType.NUMERATOR.display())
				+ "\nexcept\n"
				+ SqlTemplates.populationMembers(library, PopulationType.NUMERATOR_EXCLUSION.display()))).append('\n');
		sql.append(SqlTemplates.createView(library + "_Results", SqlTemplates.resultsView(library))).append('\n');
		sql.append(SqlTemplates.createView(library + "_Summary", SqlTemplates.summaryView(library)));

		List<String> models = builder.getModelsUsed().stream().map(SqlDataModel::label).collect(Collectors.toList());
		int predicateCount = builder.getPredicates().size();
		SqlMetadata metadata = new SqlMetadata(predicateCount, models, Complexity.estimate(predicateCount, models.size()));
		logger.info("Generated Synapse SQL for {} with {} predicate(s), complexity {}", library, predicateCount, metadata.getEstimatedComplexity().code());
		return new SqlGenerationResult(true, sql.toString(), List.of(), warnings, metadata);
	}

	private static String populationBody(PopulationType type, Optional<Population> population, String globalPredicate,
			SqlPopulationBuilder builder) {
		SqlSet tree = population.map(p -> builder.translate(p.getCriteria())).orElse(SqlSet.neutral());
		switch (type) {
			case INITIAL_POPULATION: {
				List<String> operands = new ArrayList<>();
				if (globalPredicate != null) operands.add("select distinct empi_id from " + globalPredicate);
				if (!tree.isNeutral()) operands.add(tree.asOperand(builder.nextDerivedAlias()));
				if (operands.isEmpty()) return tree.getQuery();
				return String.join("\n  intersect\n  ", operands);
			}
			case DENOMINATOR:
				if (population.isEmpty() || !population.get().hasCriteria()) return "select empi_id from INITIAL_POPULATION";
				return tree.getQuery();
			case NUMERATOR:
				return tree.getQuery();
			default:
				// exclusions and exceptions select nobody unless authored
				return tree.isNeutral() ? EMPTY_SET : tree.getQuery();
		}
	}

	private static String finalSelect() {
		List<String> selects = new ArrayList<>();
		for (PopulationType type : PopulationType.values()) {
			selects.add("select '" + type.display() + "' as population_type, empi_id from " + type.cteName());
		}
		return String.join("\nunion all\n", selects);
	}

	private MeasurementPeriod resolvePeriod(Measure measure, SqlGenerationConfig config) {
		if (config.getMeasurementPeriod() != null && config.getMeasurementPeriod().isComplete()) return config.getMeasurementPeriod();
		if (measure.getMeasurementPeriod() != null && measure.getMeasurementPeriod().isComplete()) return measure.getMeasurementPeriod();
		return MeasurementPeriod.calendarYear(LocalDate.now(clock).getYear());
	}

	/**
	 * Configured contexts, else demographics followed by the context of every data model in use.
	 */
	private static List<String> ontologyContexts(SqlGenerationConfig config, SqlPopulationBuilder builder) {
		if (!config.getOntologyContexts().isEmpty()) return config.getOntologyContexts();
		List<String> contexts = new ArrayList<>();
		contexts.add(SqlDataModel.DEMOGRAPHICS.ontologyContext());
		for (SqlDataModel model : new SqlDataModel[]{SqlDataModel.ENCOUNTER, SqlDataModel.CONDITION, SqlDataModel.PROCEDURE,
			SqlDataModel.RESULT, SqlDataModel.MEDICATION, SqlDataModel.IMMUNIZATION}) {
			if (builder.getModelsUsed().contains(model)) contexts.add(model.ontologyContext());
		}
		return contexts;
	}
}
