package org.umsforge.codegen.service.diff;

import org.umsforge.model.DataElement;

import java.util.List;

public class ElementChange {
	private final String elementId;
	private final ChangeKind kind;
	private final DataElement oldElement;
	private final DataElement newElement;
	private final List<String> changes;
	private final ValueSetDiff valueSetDiff;

	public ElementChange(String elementId, ChangeKind kind, DataElement oldElement, DataElement newElement, List<String> changes,
			ValueSetDiff valueSetDiff) {
		this.elementId = elementId;
		this.kind = kind;
		this.oldElement = oldElement;
		this.newElement = newElement;
		this.changes = List.copyOf(changes);
		this.valueSetDiff = valueSetDiff;
	}

	public String getElementId() {
		return elementId;
	}

	public ChangeKind getKind() {
		return kind;
	}

	public DataElement getOldElement() {
		return oldElement;
	}

	public DataElement getNewElement() {
		return newElement;
	}

	/**
	 * One human readable line per differing field.
	 */
	public List<String> getChanges() {
		return changes;
	}

	/**
	 * Value set differences, {@code null} when the value set is unchanged.
	 */
	public ValueSetDiff getValueSetDiff() {
		return valueSetDiff;
	}

	public String label() {
		DataElement element = newElement != null ? newElement : oldElement;
		return element == null ? elementId : element.componentLabel();
	}
}
