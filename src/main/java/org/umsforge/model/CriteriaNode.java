package org.umsforge.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * A node of a population criteria tree. There are exactly two variants, {@link LogicalClause} and
 * {@link DataElement}; consumers dispatch through {@link #accept(CriteriaVisitor)}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
	@JsonSubTypes.Type(value = LogicalClause.class, name = "clause"),
	@JsonSubTypes.Type(value = DataElement.class, name = "element")
})
public interface CriteriaNode {

	String getId();

	<R> R accept(CriteriaVisitor<R> visitor);
}
