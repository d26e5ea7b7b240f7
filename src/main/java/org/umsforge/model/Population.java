package org.umsforge.model;

public class Population {
	private String id;
	private PopulationType type;
	private String description;
	private String narrative;
	private String reviewStatus;
	private LogicalClause criteria;

	public Population() {
	}

	public Population(String id, PopulationType type, LogicalClause criteria) {
		this.id = id;
		this.type = type;
		this.criteria = criteria;
	}

	public String getId() {
		return id;
	}

	public Population setId(String id) {
		this.id = id;
		return this;
	}

	public PopulationType getType() {
		return type;
	}

	public Population setType(PopulationType type) {
		this.type = type;
		return this;
	}

	public String getDescription() {
		return description;
	}

	public Population setDescription(String description) {
		this.description = description;
		return this;
	}

	public String getNarrative() {
		return narrative;
	}

	public Population setNarrative(String narrative) {
		this.narrative = narrative;
		return this;
	}

	public String getReviewStatus() {
		return reviewStatus;
	}

	public Population setReviewStatus(String reviewStatus) {
		this.reviewStatus = reviewStatus;
		return this;
	}

	public LogicalClause getCriteria() {
		return criteria;
	}

	public Population setCriteria(LogicalClause criteria) {
		this.criteria = criteria;
		return this;
	}

	public boolean hasCriteria() {
		return criteria != null && !criteria.isEmpty();
	}
}
