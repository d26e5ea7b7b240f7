package org.umsforge.codegen.service.config;

import org.springframework.context.annotation.Condition;
import org.springframework.context.annotation.ConditionContext;
import org.springframework.core.type.AnnotatedTypeMetadata;

public class MeasureCodeConfigCondition implements Condition {
	static final String ENABLED_PROPERTY = "hapi.fhir.measure_code.enabled";

	@Override
	public boolean matches(ConditionContext theConditionContext, AnnotatedTypeMetadata theAnnotatedTypeMetadata) {
		String property = theConditionContext.getEnvironment().getProperty(ENABLED_PROPERTY);
		return Boolean.parseBoolean(property);
	}
}
