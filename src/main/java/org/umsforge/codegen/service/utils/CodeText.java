package org.umsforge.codegen.service.utils;

import org.apache.commons.lang3.StringUtils;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Text helpers shared by the generators.
 */
public final class CodeText {
	private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^a-zA-Z0-9]");

	private CodeText() {
	}

	/**
	 * Cuts {@code text} to {@code max} characters followed by {@code ...} when it is longer.
	 */
	public static String truncate(String text, int max) {
		if (text == null) return null;
		return text.length() > max ? text.substring(0, max) + "..." : text;
	}

	/**
	 * Collapses every whitespace run, line breaks included, into one space.
	 */
	public static String singleLine(String text) {
		return text == null ? "" : text.trim().replaceAll("\\s+", " ");
	}

	/**
	 * Library identifier derived from a measure id: non-alphanumerics stripped, {@code _} prefixed when the result
	 * starts with a digit.
	 */
	public static String libraryName(String measureId) {
		String name = NON_ALPHANUMERIC.matcher(StringUtils.defaultString(measureId)).replaceAll("");
		if (name.isEmpty()) return "Measure";
		return Character.isDigit(name.charAt(0)) ? "_" + name : name;
	}

	public static String escapeSql(String text) {
		return text == null ? "" : text.replace("'", "''");
	}

	/**
	 * Text safe to place inside a block comment.
	 */
	public static String commentSafe(String text) {
		return singleLine(text).replace("*/", "* /").replace("/*", "/ *");
	}

	public static String escapeCqlString(String text) {
		return text == null ? "" : text.replace("\\", "\\\\").replace("'", "\\'");
	}

	public static String escapeCqlIdentifier(String text) {
		return text == null ? "" : text.replace("\\", "\\\\").replace("\"", "\\\"");
	}

	public static int countMatches(Pattern pattern, String text) {
		Matcher matcher = pattern.matcher(text);
		int count = 0;
		while (matcher.find()) count++;
		return count;
	}

	/**
	 * 1-based line number of a character offset.
	 */
	public static int lineOf(String text, int offset) {
		int line = 1;
		for (int i = 0; i < offset && i < text.length(); i++) {
			if (text.charAt(i) == '\n') line++;
		}
		return line;
	}
}
