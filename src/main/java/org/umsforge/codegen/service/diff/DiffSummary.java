package org.umsforge.codegen.service.diff;

public class DiffSummary {
	private final int elementsAdded;
	private final int elementsRemoved;
	private final int elementsModified;
	private final int valueSetsChanged;
	private final int populationsChanged;
	private final int metadataChanged;

	public DiffSummary(int elementsAdded, int elementsRemoved, int elementsModified, int valueSetsChanged, int populationsChanged,
			int metadataChanged) {
		this.elementsAdded = elementsAdded;
		this.elementsRemoved = elementsRemoved;
		this.elementsModified = elementsModified;
		this.valueSetsChanged = valueSetsChanged;
		this.populationsChanged = populationsChanged;
		this.metadataChanged = metadataChanged;
	}

	public int getElementsAdded() {
		return elementsAdded;
	}

	public int getElementsRemoved() {
		return elementsRemoved;
	}

	public int getElementsModified() {
		return elementsModified;
	}

	public int getValueSetsChanged() {
		return valueSetsChanged;
	}

	public int getPopulationsChanged() {
		return populationsChanged;
	}

	public int getMetadataChanged() {
		return metadataChanged;
	}

	/**
	 * Element, population and metadata changes. Value set changes are already counted with their element.
	 */
	public int getTotalChanges() {
		return elementsAdded + elementsRemoved + elementsModified + populationsChanged + metadataChanged;
	}
}
