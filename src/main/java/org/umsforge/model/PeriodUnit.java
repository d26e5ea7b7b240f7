package org.umsforge.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum PeriodUnit {
	DAYS("days", "day", "DAY"),
	WEEKS("weeks", "week", "WEEK"),
	MONTHS("months", "month", "MONTH"),
	YEARS("years", "year", "YEAR");

	private final String code;
	private final String singular;
	private final String datePart;

	PeriodUnit(String code, String singular, String datePart) {
		this.code = code;
		this.singular = singular;
		this.datePart = datePart;
	}

	@JsonCreator
	public static PeriodUnit fromCode(String code) {
		if (code == null) throw new IllegalArgumentException("The period unit is missing");
		String c = code.trim();
		for (PeriodUnit unit : values()) {
			if (unit.code.equalsIgnoreCase(c) || unit.singular.equalsIgnoreCase(c)) return unit;
		}
		throw new IllegalArgumentException("Unsupported period unit: " + code);
	}

	@JsonValue
	public String code() {
		return code;
	}

	/**
	 * Unit word for the given amount, singular when the amount is exactly one.
	 */
	public String label(int amount) {
		return amount == 1 ? singular : code;
	}

	/**
	 * T-SQL DATEADD/DATEDIFF date part.
	 */
	public String datePart() {
		return datePart;
	}
}
