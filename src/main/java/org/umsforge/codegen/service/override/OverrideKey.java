package org.umsforge.codegen.service.override;

import org.umsforge.codegen.service.OutputFormat;

import java.util.Objects;

/**
 * Compound key of an override. A component id reused by another measure or format is a different key.
 */
public final class OverrideKey {
	private final String measureId;
	private final String componentId;
	private final OutputFormat format;

	public OverrideKey(String measureId, String componentId, OutputFormat format) {
		this.measureId = Objects.requireNonNull(measureId, "measureId must not be null");
		this.componentId = Objects.requireNonNull(componentId, "componentId must not be null");
		this.format = Objects.requireNonNull(format, "format must not be null");
	}

	public String getMeasureId() {
		return measureId;
	}

	public String getComponentId() {
		return componentId;
	}

	public OutputFormat getFormat() {
		return format;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof OverrideKey)) return false;
		OverrideKey that = (OverrideKey) o;
		return measureId.equals(that.measureId) && componentId.equals(that.componentId) && format == that.format;
	}

	@Override
	public int hashCode() {
		return Objects.hash(measureId, componentId, format);
	}

	@Override
	public String toString() {
		return measureId + "/" + componentId + "/" + format.code();
	}
}
