package org.umsforge.codegen.service.diff;

import java.util.Objects;

public class LineChange {
	public enum Type {
		ADDED, REMOVED, UNCHANGED
	}

	private final Type type;
	private final String text;

	public LineChange(Type type, String text) {
		this.type = type;
		this.text = text;
	}

	public Type getType() {
		return type;
	}

	public String getText() {
		return text;
	}

	@Override
	public String toString() {
		switch (type) {
			case ADDED:
				return "+ " + text;
			case REMOVED:
				return "- " + text;
			default:
				return "  " + text;
		}
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof LineChange)) return false;
		LineChange that = (LineChange) o;
		return type == that.type && Objects.equals(text, that.text);
	}

	@Override
	public int hashCode() {
		return Objects.hash(type, text);
	}
}
