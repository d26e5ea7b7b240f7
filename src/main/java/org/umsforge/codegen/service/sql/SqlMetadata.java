package org.umsforge.codegen.service.sql;

import java.util.List;

public class SqlMetadata {
	private final int predicateCount;
	private final List<String> dataModelsUsed;
	private final Complexity estimatedComplexity;

	public SqlMetadata(int predicateCount, List<String> dataModelsUsed, Complexity estimatedComplexity) {
		this.predicateCount = predicateCount;
		this.dataModelsUsed = List.copyOf(dataModelsUsed);
		this.estimatedComplexity = estimatedComplexity;
	}

	public static SqlMetadata empty() {
		return new SqlMetadata(0, List.of(), Complexity.LOW);
	}

	public int getPredicateCount() {
		return predicateCount;
	}

	public List<String> getDataModelsUsed() {
		return dataModelsUsed;
	}

	public Complexity getEstimatedComplexity() {
		return estimatedComplexity;
	}
}
