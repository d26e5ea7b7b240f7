package org.umsforge.codegen.service;

import org.umsforge.codegen.service.override.EditNote;
import org.umsforge.codegen.service.override.InMemoryCodeOverrideStore;
import org.umsforge.codegen.service.sql.SqlGenerationConfig;

public class MeasureCodeOptions {
	private int minNoteLength = InMemoryCodeOverrideStore.DEFAULT_MIN_NOTE_LENGTH;
	private String defaultPopulationId = SqlGenerationConfig.POPULATION_ID_PLACEHOLDER;
	private String defaultAuthor = EditNote.DEFAULT_AUTHOR;
	private String defaultDialect = SqlGenerationConfig.SYNAPSE;

	private MeasureCodeOptions() {
	}

	public static MeasureCodeOptions defaultOptions() {
		return new MeasureCodeOptions();
	}

	public int getMinNoteLength() {
		return minNoteLength;
	}

	public void setMinNoteLength(int minNoteLength) {
		this.minNoteLength = minNoteLength;
	}

	public String getDefaultPopulationId() {
		return defaultPopulationId;
	}

	public void setDefaultPopulationId(String defaultPopulationId) {
		this.defaultPopulationId = defaultPopulationId;
	}

	public String getDefaultAuthor() {
		return defaultAuthor;
	}

	public void setDefaultAuthor(String defaultAuthor) {
		this.defaultAuthor = defaultAuthor;
	}

	public String getDefaultDialect() {
		return defaultDialect;
	}

	public void setDefaultDialect(String defaultDialect) {
		this.defaultDialect = defaultDialect;
	}

	/**
	 * SQL settings used when a caller passes none.
	 */
	public SqlGenerationConfig defaultSqlConfig() {
		return SqlGenerationConfig.forPopulation(defaultPopulationId).setDialect(defaultDialect);
	}
}
