package org.umsforge.codegen.service.cql;

import java.util.ArrayList;
import java.util.List;

/**
 * Translation of one criteria subtree. A neutral expression is the literal {@code true} and is dropped by enclosing
 * AND/OR clauses; its notes are warning comments that stay attached to the enclosing definition.
 */
final class CqlExpression {
	static final String TRUE = "true";

	private final String text;
	private final boolean neutral;
	private final boolean clause;
	private final List<String> notes;

	private CqlExpression(String text, boolean neutral, boolean clause, List<String> notes) {
		this.text = text;
		this.neutral = neutral;
		this.clause = clause;
		this.notes = notes;
	}

	static CqlExpression of(String text) {
		return new CqlExpression(text, false, false, new ArrayList<>());
	}

	static CqlExpression clause(String text, List<String> notes) {
		return new CqlExpression(text, false, true, notes);
	}

	static CqlExpression neutral(List<String> notes) {
		return new CqlExpression(TRUE, true, true, notes);
	}

	static CqlExpression placeholder(String warningComment) {
		List<String> notes = new ArrayList<>();
		notes.add(warningComment);
		return new CqlExpression(TRUE, true, false, notes);
	}

	String getText() {
		return text;
	}

	boolean isNeutral() {
		return neutral;
	}

	boolean isClause() {
		return clause;
	}

	List<String> getNotes() {
		return notes;
	}

	/**
	 * Definition body: each note on its own line, then the expression, all indented by two spaces.
	 */
	String toDefinitionBody() {
		StringBuilder sb = new StringBuilder();
		for (String note : notes) {
			sb.append("  ").append(note).append('\n');
		}
		sb.append("  ").append(text);
		return sb.toString();
	}
}
