package org.umsforge.codegen.service.sql;

import org.umsforge.model.MeasurementPeriod;

import java.util.ArrayList;
import java.util.List;

/**
 * Options of a SQL generation run.
 */
public class SqlGenerationConfig {
	public static final String SYNAPSE = "synapse";
	public static final String POPULATION_ID_PLACEHOLDER = "${POPULATION_ID}";

	private String dialect = SYNAPSE;
	private String populationId = POPULATION_ID_PLACEHOLDER;
	private MeasurementPeriod measurementPeriod;
	private List<String> ontologyContexts = new ArrayList<>();
	private boolean excludeSnapshotsAndArchives = true;
	private boolean includeComments = true;

	private SqlGenerationConfig() {
	}

	public static SqlGenerationConfig defaultConfig() {
		return new SqlGenerationConfig();
	}

	public static SqlGenerationConfig forPopulation(String populationId) {
		return new SqlGenerationConfig().setPopulationId(populationId);
	}

	public String getDialect() {
		return dialect;
	}

	public SqlGenerationConfig setDialect(String dialect) {
		this.dialect = dialect;
		return this;
	}

	public String getPopulationId() {
		return populationId;
	}

	public SqlGenerationConfig setPopulationId(String populationId) {
		this.populationId = populationId;
		return this;
	}

	public MeasurementPeriod getMeasurementPeriod() {
		return measurementPeriod;
	}

	public SqlGenerationConfig setMeasurementPeriod(MeasurementPeriod measurementPeriod) {
		this.measurementPeriod = measurementPeriod;
		return this;
	}

	public List<String> getOntologyContexts() {
		return List.copyOf(ontologyContexts);
	}

	public SqlGenerationConfig setOntologyContexts(List<String> ontologyContexts) {
		this.ontologyContexts = ontologyContexts == null ? new ArrayList<>() : new ArrayList<>(ontologyContexts);
		return this;
	}

	public boolean isExcludeSnapshotsAndArchives() {
		return excludeSnapshotsAndArchives;
	}

	public SqlGenerationConfig setExcludeSnapshotsAndArchives(boolean excludeSnapshotsAndArchives) {
		this.excludeSnapshotsAndArchives = excludeSnapshotsAndArchives;
		return this;
	}

	public boolean isIncludeComments() {
		return includeComments;
	}

	public SqlGenerationConfig setIncludeComments(boolean includeComments) {
		this.includeComments = includeComments;
		return this;
	}

	/**
	 * Whether the population id is an unresolved template parameter.
	 */
	public static boolean isPlaceholder(String populationId) {
		return populationId == null || populationId.contains("${") || populationId.contains("POPULATION_ID");
	}
}
