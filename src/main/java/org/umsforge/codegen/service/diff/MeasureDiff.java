package org.umsforge.codegen.service.diff;

import java.util.List;

/**
 * Structured comparison of two versions of a measure.
 */
public class MeasureDiff {
	private final String oldMeasureId;
	private final String newMeasureId;
	private final String oldVersion;
	private final String newVersion;
	private final DiffSummary summary;
	private final List<MetadataChange> metadataChanges;
	private final List<PopulationChange> populationChanges;
	private final List<ElementChange> elementChanges;
	private final List<LineChange> codeDiff;

	public MeasureDiff(String oldMeasureId, String newMeasureId, String oldVersion, String newVersion, DiffSummary summary,
			List<MetadataChange> metadataChanges, List<PopulationChange> populationChanges, List<ElementChange> elementChanges,
			List<LineChange> codeDiff) {
		this.oldMeasureId = oldMeasureId;
		this.newMeasureId = newMeasureId;
		this.oldVersion = oldVersion;
		this.newVersion = newVersion;
		this.summary = summary;
		this.metadataChanges = List.copyOf(metadataChanges);
		this.populationChanges = List.copyOf(populationChanges);
		this.elementChanges = List.copyOf(elementChanges);
		this.codeDiff = codeDiff == null ? null : List.copyOf(codeDiff);
	}

	public String getOldMeasureId() {
		return oldMeasureId;
	}

	public String getNewMeasureId() {
		return newMeasureId;
	}

	public String getOldVersion() {
		return oldVersion;
	}

	public String getNewVersion() {
		return newVersion;
	}

	public DiffSummary getSummary() {
		return summary;
	}

	public List<MetadataChange> getMetadataChanges() {
		return metadataChanges;
	}

	public List<PopulationChange> getPopulationChanges() {
		return populationChanges;
	}

	public List<ElementChange> getElementChanges() {
		return elementChanges;
	}

	/**
	 * Line diff of the generated CQL, {@code null} unless requested.
	 */
	public List<LineChange> getCodeDiff() {
		return codeDiff;
	}
}
