package org.umsforge.codegen.service.validation;

import java.util.Objects;

/**
 * One finding of a structural validator. Line and column are 1-based and optional.
 */
public class ValidationIssue {
	private final Severity severity;
	private final String code;
	private final String message;
	private final Integer line;
	private final Integer column;
	private final String suggestion;

	public ValidationIssue(Severity severity, String code, String message, Integer line, Integer column, String suggestion) {
		this.severity = severity;
		this.code = code;
		this.message = message;
		this.line = line;
		this.column = column;
		this.suggestion = suggestion;
	}

	public static ValidationIssue error(String code, String message) {
		return new ValidationIssue(Severity.ERROR, code, message, null, null, null);
	}

	public static ValidationIssue warning(String code, String message) {
		return new ValidationIssue(Severity.WARNING, code, message, null, null, null);
	}

	public ValidationIssue at(Integer line, Integer column) {
		return new ValidationIssue(severity, code, message, line, column, suggestion);
	}

	public ValidationIssue withSuggestion(String suggestion) {
		return new ValidationIssue(severity, code, message, line, column, suggestion);
	}

	public Severity getSeverity() {
		return severity;
	}

	public String getCode() {
		return code;
	}

	public String getMessage() {
		return message;
	}

	public Integer getLine() {
		return line;
	}

	public Integer getColumn() {
		return column;
	}

	public String getSuggestion() {
		return suggestion;
	}

	@Override
	public String toString() {
		String location = line == null ? "" : column == null ? " (line " + line + ")" : " (line " + line + ", column " + column + ")";
		return severity.code() + " " + code + ": " + message + location;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof ValidationIssue)) return false;
		ValidationIssue that = (ValidationIssue) o;
		return severity == that.severity && Objects.equals(code, that.code) && Objects.equals(message, that.message)
			&& Objects.equals(line, that.line) && Objects.equals(column, that.column);
	}

	@Override
	public int hashCode() {
		return Objects.hash(severity, code, message, line, column);
	}
}
