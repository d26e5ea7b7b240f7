package org.umsforge.model;

import java.time.LocalDate;
import java.util.Objects;

public class MeasurementPeriod {
	private LocalDate start;
	private LocalDate end;

	public MeasurementPeriod() {
	}

	public MeasurementPeriod(LocalDate start, LocalDate end) {
		this.start = start;
		this.end = end;
	}

	/**
	 * The calendar year containing the given date.
	 */
	public static MeasurementPeriod calendarYear(int year) {
		return new MeasurementPeriod(LocalDate.of(year, 1, 1), LocalDate.of(year, 12, 31));
	}

	public LocalDate getStart() {
		return start;
	}

	public MeasurementPeriod setStart(LocalDate start) {
		this.start = start;
		return this;
	}

	public LocalDate getEnd() {
		return end;
	}

	public MeasurementPeriod setEnd(LocalDate end) {
		this.end = end;
		return this;
	}

	public boolean isComplete() {
		return start != null && end != null;
	}

	@Override
	public String toString() {
		return start + " to " + end;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof MeasurementPeriod)) return false;
		MeasurementPeriod that = (MeasurementPeriod) o;
		return Objects.equals(start, that.start) && Objects.equals(end, that.end);
	}

	@Override
	public int hashCode() {
		return Objects.hash(start, end);
	}
}
