package org.umsforge.codegen.service;

import org.umsforge.codegen.service.cql.CqlMetadata;
import org.umsforge.codegen.service.sql.SqlMetadata;

import java.util.List;

/**
 * Generated code of one format with the overrides spliced into it.
 */
public class GenerationResult {
	private final OutputFormat format;
	private final boolean success;
	private final String code;
	private final List<String> errors;
	private final List<String> warnings;
	private final List<String> appliedOverrides;
	private final CqlMetadata cqlMetadata;
	private final SqlMetadata sqlMetadata;

	public GenerationResult(OutputFormat format, boolean success, String code, List<String> errors, List<String> warnings,
			List<String> appliedOverrides, CqlMetadata cqlMetadata, SqlMetadata sqlMetadata) {
		this.format = format;
		this.success = success;
		this.code = code;
		this.errors = List.copyOf(errors);
		this.warnings = List.copyOf(warnings);
		this.appliedOverrides = List.copyOf(appliedOverrides);
		this.cqlMetadata = cqlMetadata;
		this.sqlMetadata = sqlMetadata;
	}

	public static GenerationResult failure(OutputFormat format, List<String> errors) {
		return new GenerationResult(format, false, null, errors, List.of(), List.of(), null, null);
	}

	public OutputFormat getFormat() {
		return format;
	}

	public boolean isSuccess() {
		return success;
	}

	/**
	 * The generated code, {@code null} when generation failed.
	 */
	public String getCode() {
		return code;
	}

	public List<String> getErrors() {
		return errors;
	}

	public List<String> getWarnings() {
		return warnings;
	}

	/**
	 * Component ids whose locked override replaced generated code.
	 */
	public List<String> getAppliedOverrides() {
		return appliedOverrides;
	}

	/**
	 * Library facts for CQL output, {@code null} otherwise.
	 */
	public CqlMetadata getCqlMetadata() {
		return cqlMetadata;
	}

	/**
	 * Predicate and complexity facts for SQL output, {@code null} otherwise.
	 */
	public SqlMetadata getSqlMetadata() {
		return sqlMetadata;
	}
}
