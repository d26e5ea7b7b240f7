package org.umsforge.codegen.service.validation;

import java.util.ArrayList;
import java.util.List;

/**
 * Mutable accumulator used while one validation runs.
 */
class IssueCollector {
	private final List<ValidationIssue> errors = new ArrayList<>();
	private final List<ValidationIssue> warnings = new ArrayList<>();
	private final List<String> suggestions = new ArrayList<>();

	void add(ValidationIssue issue) {
		if (issue.getSeverity() == Severity.ERROR) errors.add(issue);
		else if (issue.getSeverity() == Severity.WARNING) warnings.add(issue);
		if (issue.getSuggestion() != null && !suggestions.contains(issue.getSuggestion())) suggestions.add(issue.getSuggestion());
	}

	void suggest(String suggestion) {
		if (!suggestions.contains(suggestion)) suggestions.add(suggestion);
	}

	ValidationResult toResult() {
		return new ValidationResult(errors, warnings, suggestions);
	}

	List<ValidationIssue> getErrors() {
		return errors;
	}

	List<ValidationIssue> getWarnings() {
		return warnings;
	}

	List<String> getSuggestions() {
		return suggestions;
	}
}
