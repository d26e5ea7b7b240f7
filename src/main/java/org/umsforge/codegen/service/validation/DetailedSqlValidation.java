package org.umsforge.codegen.service.validation;

/**
 * Validation result plus structural introspection. The analyses never influence the score.
 */
public class DetailedSqlValidation {
	private final ValidationResult result;
	private final CteAnalysis cteAnalysis;
	private final ColumnAnalysis columnAnalysis;

	public DetailedSqlValidation(ValidationResult result, CteAnalysis cteAnalysis, ColumnAnalysis columnAnalysis) {
		this.result = result;
		this.cteAnalysis = cteAnalysis;
		this.columnAnalysis = columnAnalysis;
	}

	public ValidationResult getResult() {
		return result;
	}

	public CteAnalysis getCteAnalysis() {
		return cteAnalysis;
	}

	public ColumnAnalysis getColumnAnalysis() {
		return columnAnalysis;
	}
}
