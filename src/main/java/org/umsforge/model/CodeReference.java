package org.umsforge.model;

import java.util.Objects;

public class CodeReference {
	private String code;
	private String system;
	private String display;

	public CodeReference() {
	}

	public CodeReference(String code, String system, String display) {
		this.code = code;
		this.system = system;
		this.display = display;
	}

	public String getCode() {
		return code;
	}

	public CodeReference setCode(String code) {
		this.code = code;
		return this;
	}

	public String getSystem() {
		return system;
	}

	public CodeReference setSystem(String system) {
		this.system = system;
		return this;
	}

	public String getDisplay() {
		return display;
	}

	public CodeReference setDisplay(String display) {
		this.display = display;
		return this;
	}

	/**
	 * Identity of the code within its system, {@code system|code}.
	 */
	public String key() {
		return system + "|" + code;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof CodeReference)) return false;
		CodeReference that = (CodeReference) o;
		return Objects.equals(code, that.code) && Objects.equals(system, that.system) && Objects.equals(display, that.display);
	}

	@Override
	public int hashCode() {
		return Objects.hash(code, system, display);
	}
}
