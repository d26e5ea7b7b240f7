package org.umsforge.codegen.service.utils;

import java.util.regex.Pattern;

/**
 * Comment markers bracketing the code generated for one data element. They are valid block comments in both CQL
 * and T-SQL and are the primary anchor used when manual overrides are injected.
 */
public final class ComponentMarkers {

	private ComponentMarkers() {
	}

	public static String start(String componentId) {
		return "/* [component " + CodeText.commentSafe(componentId) + "] */";
	}

	public static String end(String componentId) {
		return "/* [/component " + CodeText.commentSafe(componentId) + "] */";
	}

	public static String wrap(String componentId, String code) {
		return start(componentId) + " " + code + " " + end(componentId);
	}

	/**
	 * Pattern matching the whole marked region of a component, markers included.
	 */
	public static Pattern region(String componentId) {
		return Pattern.compile(Pattern.quote(start(componentId)) + "(.*?)" + Pattern.quote(end(componentId)), Pattern.DOTALL);
	}
}
