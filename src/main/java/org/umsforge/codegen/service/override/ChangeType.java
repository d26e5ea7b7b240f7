package org.umsforge.codegen.service.override;

/**
 * Category of a manual edit, recorded on each {@link EditNote}.
 */
public enum ChangeType {
	LOGIC("logic"),
	TIMING("timing"),
	CODES("codes"),
	SYNTAX("syntax"),
	OTHER("other");

	private final String code;

	ChangeType(String code) {
		this.code = code;
	}

	public static ChangeType fromCode(String code) {
		if (code == null || code.isBlank()) return OTHER;
		for (ChangeType type : values()) {
			if (type.code.equalsIgnoreCase(code.trim())) return type;
		}
		throw new IllegalArgumentException("Unsupported change type: " + code);
	}

	public String code() {
		return code;
	}
}
