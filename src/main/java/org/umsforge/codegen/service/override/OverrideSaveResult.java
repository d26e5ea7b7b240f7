package org.umsforge.codegen.service.override;

import java.util.List;

public class OverrideSaveResult {
	private final boolean success;
	private final CodeOverride override;
	private final List<String> errors;

	private OverrideSaveResult(boolean success, CodeOverride override, List<String> errors) {
		this.success = success;
		this.override = override;
		this.errors = List.copyOf(errors);
	}

	public static OverrideSaveResult saved(CodeOverride override) {
		return new OverrideSaveResult(true, override, List.of());
	}

	public static OverrideSaveResult rejected(List<String> errors) {
		return new OverrideSaveResult(false, null, errors);
	}

	public boolean isSuccess() {
		return success;
	}

	/**
	 * The stored record, {@code null} when the save was rejected.
	 */
	public CodeOverride getOverride() {
		return override;
	}

	public List<String> getErrors() {
		return errors;
	}
}
