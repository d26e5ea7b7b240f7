package org.umsforge.codegen.service.validation;

import java.util.List;
import java.util.Map;

/**
 * CTE inventory of a SQL script. {@code dependencies} maps each CTE to the CTEs its body references.
 */
public class CteAnalysis {
	private final int total;
	private final List<String> names;
	private final List<String> predicates;
	private final List<String> populations;
	private final Map<String, List<String>> dependencies;

	public CteAnalysis(List<String> names, List<String> predicates, List<String> populations, Map<String, List<String>> dependencies) {
		this.total = names.size();
		this.names = List.copyOf(names);
		this.predicates = List.copyOf(predicates);
		this.populations = List.copyOf(populations);
		this.dependencies = Map.copyOf(dependencies);
	}

	public int getTotal() {
		return total;
	}

	public List<String> getNames() {
		return names;
	}

	public List<String> getPredicates() {
		return predicates;
	}

	public List<String> getPopulations() {
		return populations;
	}

	public Map<String, List<String>> getDependencies() {
		return dependencies;
	}
}
