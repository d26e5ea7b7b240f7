package org.umsforge.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum LogicalOperator {
	AND("AND"),
	OR("OR"),
	NOT("NOT");

	private final String code;

	LogicalOperator(String code) {
		this.code = code;
	}

	@JsonCreator
	public static LogicalOperator fromCode(String code) {
		if (code == null) throw new IllegalArgumentException("The logical operator is missing");
		String c = code.trim();
		for (LogicalOperator op : values()) {
			if (op.code.equalsIgnoreCase(c)) return op;
		}
		throw new IllegalArgumentException("Unsupported logical operator: " + code);
	}

	@JsonValue
	public String code() {
		return code;
	}
}
