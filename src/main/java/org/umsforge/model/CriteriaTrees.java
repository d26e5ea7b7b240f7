package org.umsforge.model;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * Traversal helpers over criteria trees.
 */
public final class CriteriaTrees {

	private CriteriaTrees() {
	}

	public static List<DataElement> dataElements(CriteriaNode root) {
		List<DataElement> out = new ArrayList<>();
		root.accept(new CriteriaVisitor<Void>() {
			@Override
			public Void visitClause(LogicalClause clause) {
				for (CriteriaNode child : clause.getChildren()) {
					child.accept(this);
				}
				return null;
			}

			@Override
			public Void visitElement(DataElement element) {
				out.add(element);
				return null;
			}
		});
		return out;
	}

	public static boolean anyElement(CriteriaNode root, Predicate<DataElement> predicate) {
		return dataElements(root).stream().anyMatch(predicate);
	}
}
