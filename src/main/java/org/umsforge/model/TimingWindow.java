package org.umsforge.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum TimingWindow {
	DURING("during"),
	WITHIN("within"),
	BEFORE_END_OF("before_end_of"),
	AFTER_START_OF("after_start_of"),
	AGE_BASED("age_based");

	private final String code;

	TimingWindow(String code) {
		this.code = code;
	}

	@JsonCreator
	public static TimingWindow fromCode(String code) {
		if (code == null) throw new IllegalArgumentException("The timing window is missing");
		String c = code.trim().replace('-', '_').replace(' ', '_');
		for (TimingWindow window : values()) {
			if (window.code.equalsIgnoreCase(c)) return window;
		}
		throw new IllegalArgumentException("Unsupported timing window: " + code);
	}

	@JsonValue
	public String code() {
		return code;
	}
}
