package org.umsforge.codegen.service.validation;

import java.util.List;

/**
 * Outcome of a structural validation. The score starts at 100, loses 10 per error and 3 per warning, and never
 * goes below 0.
 */
public class ValidationResult {
	private final boolean valid;
	private final int score;
	private final List<ValidationIssue> errors;
	private final List<ValidationIssue> warnings;
	private final List<String> suggestions;

	public ValidationResult(List<ValidationIssue> errors, List<ValidationIssue> warnings, List<String> suggestions) {
		this.errors = List.copyOf(errors);
		this.warnings = List.copyOf(warnings);
		this.suggestions = List.copyOf(suggestions);
		this.valid = errors.isEmpty();
		this.score = score(errors.size(), warnings.size());
	}

	public static int score(int errorCount, int warningCount) {
		return Math.max(0, 100 - 10 * errorCount - 3 * warningCount);
	}

	public boolean isValid() {
		return valid;
	}

	public int getScore() {
		return score;
	}

	public List<ValidationIssue> getErrors() {
		return errors;
	}

	public List<ValidationIssue> getWarnings() {
		return warnings;
	}

	public List<String> getSuggestions() {
		return suggestions;
	}

	public boolean hasIssue(String code) {
		return errors.stream().anyMatch(i -> i.getCode().equals(code)) || warnings.stream().anyMatch(i -> i.getCode().equals(code));
	}
}
