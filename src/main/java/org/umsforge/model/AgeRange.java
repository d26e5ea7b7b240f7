package org.umsforge.model;

public class AgeRange {
	private Integer min;
	private Integer max;

	public AgeRange() {
	}

	public AgeRange(Integer min, Integer max) {
		this.min = min;
		this.max = max;
	}

	public Integer getMin() {
		return min;
	}

	public AgeRange setMin(Integer min) {
		this.min = min;
		return this;
	}

	public Integer getMax() {
		return max;
	}

	public AgeRange setMax(Integer max) {
		this.max = max;
		return this;
	}

	public boolean isBounded() {
		return min != null || max != null;
	}
}
