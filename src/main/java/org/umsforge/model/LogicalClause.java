package org.umsforge.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

public class LogicalClause implements CriteriaNode {
	private String id;
	private LogicalOperator operator = LogicalOperator.AND;
	private String description;
	private List<CriteriaNode> children = new ArrayList<>();
	private Double confidence;
	private String reviewStatus;

	public LogicalClause() {
	}

	public LogicalClause(String id, LogicalOperator operator, CriteriaNode... children) {
		this.id = id;
		this.operator = operator;
		this.children = new ArrayList<>(Arrays.asList(children));
	}

	public static LogicalClause and(String id, CriteriaNode... children) {
		return new LogicalClause(id, LogicalOperator.AND, children);
	}

	public static LogicalClause or(String id, CriteriaNode... children) {
		return new LogicalClause(id, LogicalOperator.OR, children);
	}

	public static LogicalClause not(String id, CriteriaNode child) {
		return new LogicalClause(id, LogicalOperator.NOT, child);
	}

	@Override
	public <R> R accept(CriteriaVisitor<R> visitor) {
		return visitor.visitClause(this);
	}

	@Override
	public String getId() {
		return id;
	}

	public LogicalClause setId(String id) {
		this.id = id;
		return this;
	}

	public LogicalOperator getOperator() {
		return operator;
	}

	public LogicalClause setOperator(LogicalOperator operator) {
		this.operator = operator;
		return this;
	}

	public String getDescription() {
		return description;
	}

	public LogicalClause setDescription(String description) {
		this.description = description;
		return this;
	}

	public List<CriteriaNode> getChildren() {
		return children;
	}

	public LogicalClause setChildren(List<CriteriaNode> children) {
		this.children = children == null ? new ArrayList<>() : children;
		return this;
	}

	public LogicalClause addChild(CriteriaNode child) {
		this.children.add(child);
		return this;
	}

	public Double getConfidence() {
		return confidence;
	}

	public LogicalClause setConfidence(Double confidence) {
		this.confidence = confidence;
		return this;
	}

	public String getReviewStatus() {
		return reviewStatus;
	}

	public LogicalClause setReviewStatus(String reviewStatus) {
		this.reviewStatus = reviewStatus;
		return this;
	}

	public boolean isEmpty() {
		return children.isEmpty();
	}
}
