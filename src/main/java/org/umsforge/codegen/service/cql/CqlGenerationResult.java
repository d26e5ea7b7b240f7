package org.umsforge.codegen.service.cql;

import java.util.List;

public class CqlGenerationResult {
	private final boolean success;
	private final String code;
	private final List<String> errors;
	private final List<String> warnings;
	private final CqlMetadata metadata;

	public CqlGenerationResult(boolean success, String code, List<String> errors, List<String> warnings, CqlMetadata metadata) {
		this.success = success;
		this.code = code;
		this.errors = List.copyOf(errors);
		this.warnings = List.copyOf(warnings);
		this.metadata = metadata;
	}

	public static CqlGenerationResult failure(List<String> errors) {
		return new CqlGenerationResult(false, "", errors, List.of(), CqlMetadata.empty());
	}

	public boolean isSuccess() {
		return success;
	}

	public String getCode() {
		return code;
	}

	public List<String> getErrors() {
		return errors;
	}

	public List<String> getWarnings() {
		return warnings;
	}

	public CqlMetadata getMetadata() {
		return metadata;
	}
}
