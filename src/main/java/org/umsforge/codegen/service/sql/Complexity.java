package org.umsforge.codegen.service.sql;

public enum Complexity {
	LOW("low"),
	MEDIUM("medium"),
	HIGH("high");

	private final String code;

	Complexity(String code) {
		this.code = code;
	}

	public static Complexity estimate(int predicateCount, int dataModelCount) {
		if (predicateCount <= 3 && dataModelCount <= 2) return LOW;
		if (predicateCount <= 8 && dataModelCount <= 4) return MEDIUM;
		return HIGH;
	}

	public String code() {
		return code;
	}
}
