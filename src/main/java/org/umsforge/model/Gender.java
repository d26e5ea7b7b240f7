package org.umsforge.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum Gender {
	MALE("male", "FHIR Male"),
	FEMALE("female", "FHIR Female"),
	ALL("all", null);

	private final String code;
	private final String conceptName;

	Gender(String code, String conceptName) {
		this.code = code;
		this.conceptName = conceptName;
	}

	@JsonCreator
	public static Gender fromCode(String code) {
		if (code == null) throw new IllegalArgumentException("The gender is missing");
		String c = code.trim();
		for (Gender gender : values()) {
			if (gender.code.equalsIgnoreCase(c)) return gender;
		}
		throw new IllegalArgumentException("Unsupported gender: " + code);
	}

	@JsonValue
	public String code() {
		return code;
	}

	/**
	 * Ontology concept name used by the HDI person tables, {@code null} for {@link #ALL}.
	 */
	public String conceptName() {
		return conceptName;
	}

	public boolean isRestrictive() {
		return this != ALL;
	}
}
