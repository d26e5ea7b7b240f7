package org.umsforge.model;

import java.util.Objects;

public class TimingConstraint {
	private TimingWindow window;
	private Integer value;
	private PeriodUnit unit;
	private String description;

	public TimingConstraint() {
	}

	public TimingConstraint(TimingWindow window, Integer value, PeriodUnit unit) {
		this.window = window;
		this.value = value;
		this.unit = unit;
	}

	public static TimingConstraint during() {
		return new TimingConstraint(TimingWindow.DURING, null, null);
	}

	public TimingWindow getWindow() {
		return window;
	}

	public TimingConstraint setWindow(TimingWindow window) {
		this.window = window;
		return this;
	}

	public Integer getValue() {
		return value;
	}

	public TimingConstraint setValue(Integer value) {
		this.value = value;
		return this;
	}

	public PeriodUnit getUnit() {
		return unit;
	}

	public TimingConstraint setUnit(PeriodUnit unit) {
		this.unit = unit;
		return this;
	}

	public String getDescription() {
		return description;
	}

	public TimingConstraint setDescription(String description) {
		this.description = description;
		return this;
	}

	/**
	 * Whether the window needs an amount and has one.
	 */
	public boolean hasAmount() {
		return value != null && unit != null;
	}

	public String describe() {
		if (window == null) return "none";
		if (!hasAmount()) return window.code();
		return String.format("%s %d %s", window.code(), value, unit.label(value));
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof TimingConstraint)) return false;
		TimingConstraint that = (TimingConstraint) o;
		return window == that.window && Objects.equals(value, that.value) && unit == that.unit;
	}

	@Override
	public int hashCode() {
		return Objects.hash(window, value, unit);
	}
}
