package org.umsforge.model;

public interface CriteriaVisitor<R> {

	R visitClause(LogicalClause clause);

	R visitElement(DataElement element);
}
