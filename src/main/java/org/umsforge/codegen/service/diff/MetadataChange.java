package org.umsforge.codegen.service.diff;

public class MetadataChange {
	private final String field;
	private final String oldValue;
	private final String newValue;
	private final ChangeKind kind;

	public MetadataChange(String field, String oldValue, String newValue) {
		this.field = field;
		this.oldValue = oldValue;
		this.newValue = newValue;
		this.kind = ChangeKind.between(oldValue, newValue);
	}

	public String getField() {
		return field;
	}

	public String getOldValue() {
		return oldValue;
	}

	public String getNewValue() {
		return newValue;
	}

	public ChangeKind getKind() {
		return kind;
	}
}
