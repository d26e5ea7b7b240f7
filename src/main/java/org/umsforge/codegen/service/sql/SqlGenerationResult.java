package org.umsforge.codegen.service.sql;

import java.util.List;

public class SqlGenerationResult {
	private final boolean success;
	private final String code;
	private final List<String> errors;
	private final List<String> warnings;
	private final SqlMetadata metadata;

	public SqlGenerationResult(boolean success, String code, List<String> errors, List<String> warnings, SqlMetadata metadata) {
		this.success = success;
		this.code = code;
		this.errors = List.copyOf(errors);
		this.warnings = List.copyOf(warnings);
		this.metadata = metadata;
	}

	public static SqlGenerationResult failure(List<String> errors) {
		return new SqlGenerationResult(false, "", errors, List.of(), SqlMetadata.empty());
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

	public SqlMetadata getMetadata() {
		return metadata;
	}
}
