package org.umsforge.codegen.service.utils;

import org.apache.commons.lang3.StringUtils;
import org.umsforge.model.Measure;

import java.util.ArrayList;
import java.util.List;

public final class MeasurePreconditions {
	public static final String MISSING_ID = "Measure ID is required";
	public static final String NO_POPULATIONS = "At least one population definition is required";

	private MeasurePreconditions() {
	}

	/**
	 * Input checks shared by the generators; one message per violated precondition.
	 */
	public static List<String> check(Measure measure) {
		List<String> errors = new ArrayList<>();
		if (measure == null || StringUtils.isBlank(measure.getId())) errors.add(MISSING_ID);
		if (measure == null || measure.getPopulations().isEmpty()) errors.add(NO_POPULATIONS);
		return errors;
	}
}
