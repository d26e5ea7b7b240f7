package org.umsforge.codegen.service.sql;

/**
 * A query returning the {@code empi_id} of every patient satisfying a criteria subtree. A neutral set stands for
 * "no restriction" and is dropped by enclosing AND/OR clauses.
 */
final class SqlSet {
	private final String query;
	private final boolean neutral;
	private final boolean compound;

	private SqlSet(String query, boolean neutral, boolean compound) {
		this.query = query;
		this.neutral = neutral;
		this.compound = compound;
	}

	static SqlSet of(String query) {
		return new SqlSet(query, false, false);
	}

	static SqlSet compound(String query) {
		return new SqlSet(query, false, true);
	}

	static SqlSet neutral() {
		return new SqlSet("select empi_id from DEMOG", true, false);
	}

	String getQuery() {
		return query;
	}

	boolean isNeutral() {
		return neutral;
	}

	/**
	 * Query usable as one operand of a set operator; compound queries become derived tables.
	 */
	String asOperand(String derivedAlias) {
		if (!compound) return query;
		return "select empi_id from (\n" + indent(query) + "\n  ) " + derivedAlias;
	}

	static String indent(String text) {
		return "    " + text.replace("\n", "\n    ");
	}
}
