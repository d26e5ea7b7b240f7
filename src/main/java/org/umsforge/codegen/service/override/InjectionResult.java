package org.umsforge.codegen.service.override;

import java.util.List;

public class InjectionResult {
	private final String code;
	private final List<String> appliedComponents;
	private final List<String> appendedComponents;

	public InjectionResult(String code, List<String> appliedComponents, List<String> appendedComponents) {
		this.code = code;
		this.appliedComponents = List.copyOf(appliedComponents);
		this.appendedComponents = List.copyOf(appendedComponents);
	}

	public String getCode() {
		return code;
	}

	/**
	 * Component ids whose override was injected, in application order.
	 */
	public List<String> getAppliedComponents() {
		return appliedComponents;
	}

	/**
	 * Subset of the applied components for which no anchor was found and the code was appended at the end.
	 */
	public List<String> getAppendedComponents() {
		return appendedComponents;
	}
}
