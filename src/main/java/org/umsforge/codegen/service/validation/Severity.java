package org.umsforge.codegen.service.validation;

public enum Severity {
	ERROR("error"),
	WARNING("warning"),
	INFO("info");

	private final String code;

	Severity(String code) {
		this.code = code;
	}

	public String code() {
		return code;
	}
}
