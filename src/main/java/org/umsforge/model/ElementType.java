package org.umsforge.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Clinical category of a {@link DataElement}.
 */
public enum ElementType {
	DIAGNOSIS("diagnosis"),
	ENCOUNTER("encounter"),
	PROCEDURE("procedure"),
	OBSERVATION("observation"),
	MEDICATION("medication"),
	IMMUNIZATION("immunization"),
	DEMOGRAPHIC("demographic"),
	ASSESSMENT("assessment"),
	DEVICE("device"),
	COMMUNICATION("communication"),
	ALLERGY("allergy"),
	GOAL("goal");

	private final String code;

	ElementType(String code) {
		this.code = code;
	}

	@JsonCreator
	public static ElementType fromCode(String code) {
		if (code == null) throw new IllegalArgumentException("The element type is missing");
		String c = code.trim();
		for (ElementType type : values()) {
			if (type.code.equalsIgnoreCase(c)) return type;
		}
		throw new IllegalArgumentException("Unsupported element type: " + code);
	}

	@JsonValue
	public String code() {
		return code;
	}
}
