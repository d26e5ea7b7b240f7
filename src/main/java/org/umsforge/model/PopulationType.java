package org.umsforge.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Measure population kinds, in the order they are emitted by the generators.
 */
public enum PopulationType {
	INITIAL_POPULATION("initial_population", "Initial Population", "INITIAL_POPULATION"),
	DENOMINATOR("denominator", "Denominator", "DENOMINATOR"),
	DENOMINATOR_EXCLUSION("denominator_exclusion", "Denominator Exclusion", "DENOM_EXCLUSION"),
	DENOMINATOR_EXCEPTION("denominator_exception", "Denominator Exception", "DENOM_EXCEPTION"),
	NUMERATOR("numerator", "Numerator", "NUMERATOR"),
	NUMERATOR_EXCLUSION("numerator_exclusion", "Numerator Exclusion", "NUM_EXCLUSION");

	private final String code;
	private final String display;
	private final String cteName;

	PopulationType(String code, String display, String cteName) {
		this.code = code;
		this.display = display;
		this.cteName = cteName;
	}

	@JsonCreator
	public static PopulationType fromCode(String code) {
		if (code == null) throw new IllegalArgumentException("The population type is missing");
		String c = code.trim().replace('-', '_');
		for (PopulationType type : values()) {
			if (type.code.equalsIgnoreCase(c)) return type;
		}
		throw new IllegalArgumentException("Unsupported population type: " + code);
	}

	@JsonValue
	public String code() {
		return code;
	}

	/**
	 * Human readable name, also used as the CQL definition name.
	 */
	public String display() {
		return display;
	}

	/**
	 * Name of the common table expression holding this population in generated SQL.
	 */
	public String cteName() {
		return cteName;
	}
}
