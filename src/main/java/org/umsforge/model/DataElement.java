package org.umsforge.model;

import org.apache.commons.lang3.StringUtils;

/**
 * Leaf criterion: one clinical fact about the patient.
 */
public class DataElement implements CriteriaNode {
	private String id;
	private ElementType type;
	private String description;
	private ValueSetReference valueSet;
	private TimingConstraint timing;
	private QuantityRequirement quantity;
	private ThresholdRange thresholds;
	private Gender gender;
	private boolean negation;
	private Double confidence;
	private String reviewStatus;

	public DataElement() {
	}

	public DataElement(String id, ElementType type, String description) {
		this.id = id;
		this.type = type;
		this.description = description;
	}

	@Override
	public <R> R accept(CriteriaVisitor<R> visitor) {
		return visitor.visitElement(this);
	}

	@Override
	public String getId() {
		return id;
	}

	public DataElement setId(String id) {
		this.id = id;
		return this;
	}

	public ElementType getType() {
		return type;
	}

	public DataElement setType(ElementType type) {
		this.type = type;
		return this;
	}

	public String getDescription() {
		return description;
	}

	public DataElement setDescription(String description) {
		this.description = description;
		return this;
	}

	public ValueSetReference getValueSet() {
		return valueSet;
	}

	public DataElement setValueSet(ValueSetReference valueSet) {
		this.valueSet = valueSet;
		return this;
	}

	public TimingConstraint getTiming() {
		return timing;
	}

	public DataElement setTiming(TimingConstraint timing) {
		this.timing = timing;
		return this;
	}

	public QuantityRequirement getQuantity() {
		return quantity;
	}

	public DataElement setQuantity(QuantityRequirement quantity) {
		this.quantity = quantity;
		return this;
	}

	public ThresholdRange getThresholds() {
		return thresholds;
	}

	public DataElement setThresholds(ThresholdRange thresholds) {
		this.thresholds = thresholds;
		return this;
	}

	public Gender getGender() {
		return gender;
	}

	public DataElement setGender(Gender gender) {
		this.gender = gender;
		return this;
	}

	public boolean isNegation() {
		return negation;
	}

	public DataElement setNegation(boolean negation) {
		this.negation = negation;
		return this;
	}

	public Double getConfidence() {
		return confidence;
	}

	public DataElement setConfidence(Double confidence) {
		this.confidence = confidence;
		return this;
	}

	public String getReviewStatus() {
		return reviewStatus;
	}

	public DataElement setReviewStatus(String reviewStatus) {
		this.reviewStatus = reviewStatus;
		return this;
	}

	/**
	 * Label shown next to generated code for this component: the description, else the value set name, else the id.
	 */
	public String componentLabel() {
		if (StringUtils.isNotBlank(description)) return description;
		if (valueSet != null && StringUtils.isNotBlank(valueSet.getName())) return valueSet.getName();
		return id;
	}
}
