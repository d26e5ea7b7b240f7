package org.umsforge.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum Comparator {
	GT(">"),
	GE(">="),
	LT("<"),
	LE("<="),
	EQ("="),
	NE("!=");

	private final String symbol;

	Comparator(String symbol) {
		this.symbol = symbol;
	}

	@JsonCreator
	public static Comparator fromCode(String code) {
		if (code == null) throw new IllegalArgumentException("The comparator is missing");
		String c = code.trim();
		if ("<>".equals(c)) return NE;
		if ("==".equals(c)) return EQ;
		for (Comparator comparator : values()) {
			if (comparator.symbol.equals(c) || comparator.name().equalsIgnoreCase(c)) return comparator;
		}
		throw new IllegalArgumentException("Unsupported comparator: " + code);
	}

	@JsonValue
	public String symbol() {
		return symbol;
	}
}
