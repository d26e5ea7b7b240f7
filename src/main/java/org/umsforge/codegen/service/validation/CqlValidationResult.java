package org.umsforge.codegen.service.validation;

import java.util.List;

public class CqlValidationResult extends ValidationResult {
	private final CqlLibraryInfo libraryInfo;

	public CqlValidationResult(List<ValidationIssue> errors, List<ValidationIssue> warnings, List<String> suggestions, CqlLibraryInfo libraryInfo) {
		super(errors, warnings, suggestions);
		this.libraryInfo = libraryInfo;
	}

	public CqlLibraryInfo getLibraryInfo() {
		return libraryInfo;
	}
}
