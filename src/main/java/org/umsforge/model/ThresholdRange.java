package org.umsforge.model;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Age bounds for demographic leaves, value bounds for result leaves.
 */
public class ThresholdRange {
	private Integer ageMin;
	private Integer ageMax;
	private BigDecimal valueMin;
	private BigDecimal valueMax;
	private String unit;

	public Integer getAgeMin() {
		return ageMin;
	}

	public ThresholdRange setAgeMin(Integer ageMin) {
		this.ageMin = ageMin;
		return this;
	}

	public Integer getAgeMax() {
		return ageMax;
	}

	public ThresholdRange setAgeMax(Integer ageMax) {
		this.ageMax = ageMax;
		return this;
	}

	public BigDecimal getValueMin() {
		return valueMin;
	}

	public ThresholdRange setValueMin(BigDecimal valueMin) {
		this.valueMin = valueMin;
		return this;
	}

	public BigDecimal getValueMax() {
		return valueMax;
	}

	public ThresholdRange setValueMax(BigDecimal valueMax) {
		this.valueMax = valueMax;
		return this;
	}

	public String getUnit() {
		return unit;
	}

	public ThresholdRange setUnit(String unit) {
		this.unit = unit;
		return this;
	}

	public boolean hasAge() {
		return ageMin != null || ageMax != null;
	}

	public boolean hasValue() {
		return valueMin != null || valueMax != null;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof ThresholdRange)) return false;
		ThresholdRange that = (ThresholdRange) o;
		return Objects.equals(ageMin, that.ageMin) && Objects.equals(ageMax, that.ageMax)
			&& Objects.equals(valueMin, that.valueMin) && Objects.equals(valueMax, that.valueMax)
			&& Objects.equals(unit, that.unit);
	}

	@Override
	public int hashCode() {
		return Objects.hash(ageMin, ageMax, valueMin, valueMax, unit);
	}
}
