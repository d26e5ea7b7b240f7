package org.umsforge.codegen.service.diff;

public enum ChangeKind {
	ADDED("added"),
	REMOVED("removed"),
	MODIFIED("modified");

	private final String code;

	ChangeKind(String code) {
		this.code = code;
	}

	public String code() {
		return code;
	}

	/**
	 * Kind of a change between two optional values: a value appearing is an addition, one disappearing a removal.
	 */
	static ChangeKind between(Object oldValue, Object newValue) {
		if (oldValue == null) return ADDED;
		if (newValue == null) return REMOVED;
		return MODIFIED;
	}
}
