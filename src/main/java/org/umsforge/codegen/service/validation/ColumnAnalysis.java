package org.umsforge.codegen.service.validation;

import java.util.List;
import java.util.Map;

public class ColumnAnalysis {
	private final Map<String, List<String>> selectColumns;
	private final List<String> joinConditions;
	private final List<String> filterConditions;

	public ColumnAnalysis(Map<String, List<String>> selectColumns, List<String> joinConditions, List<String> filterConditions) {
		this.selectColumns = Map.copyOf(selectColumns);
		this.joinConditions = List.copyOf(joinConditions);
		this.filterConditions = List.copyOf(filterConditions);
	}

	/**
	 * Output column names per CTE, in select order.
	 */
	public Map<String, List<String>> getSelectColumns() {
		return selectColumns;
	}

	public List<String> getJoinConditions() {
		return joinConditions;
	}

	public List<String> getFilterConditions() {
		return filterConditions;
	}
}
