package org.umsforge.model;

import java.util.Objects;

/**
 * Occurrence count requirement on a data element: either a comparator against a value or a closed range.
 */
public class QuantityRequirement {
	private Comparator comparator;
	private Integer value;
	private Integer min;
	private Integer max;

	public static QuantityRequirement atLeast(int value) {
		return new QuantityRequirement().setComparator(Comparator.GE).setValue(value);
	}

	public static QuantityRequirement between(int min, int max) {
		return new QuantityRequirement().setMin(min).setMax(max);
	}

	public Comparator getComparator() {
		return comparator;
	}

	public QuantityRequirement setComparator(Comparator comparator) {
		this.comparator = comparator;
		return this;
	}

	public Integer getValue() {
		return value;
	}

	public QuantityRequirement setValue(Integer value) {
		this.value = value;
		return this;
	}

	public Integer getMin() {
		return min;
	}

	public QuantityRequirement setMin(Integer min) {
		this.min = min;
		return this;
	}

	public Integer getMax() {
		return max;
	}

	public QuantityRequirement setMax(Integer max) {
		this.max = max;
		return this;
	}

	public boolean isRange() {
		return comparator == null && (min != null || max != null);
	}

	public boolean isComparison() {
		return comparator != null && value != null;
	}

	public String describe() {
		if (isComparison()) return comparator.symbol() + " " + value;
		if (isRange()) return String.format("between %s and %s", min == null ? "0" : min, max == null ? "*" : max);
		return "none";
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof QuantityRequirement)) return false;
		QuantityRequirement that = (QuantityRequirement) o;
		return comparator == that.comparator && Objects.equals(value, that.value)
			&& Objects.equals(min, that.min) && Objects.equals(max, that.max);
	}

	@Override
	public int hashCode() {
		return Objects.hash(comparator, value, min, max);
	}
}
