package org.umsforge.codegen.service.utils;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Comment and string literal aware scanning of CQL and T-SQL text.
 */
public final class SourceScanner {

	private SourceScanner() {
	}

	/**
	 * Replaces every comment character by a space, keeping line breaks, so offsets and line numbers are preserved.
	 * String literals are kept intact. In SQL mode a doubled quote escapes a quote; in CQL mode a backslash escapes
	 * the next character.
	 *
	 * @param code the source text
	 * @param sql  {@code true} for T-SQL ({@code --} line comments), {@code false} for CQL ({@code //})
	 * @return the text without comments
	 */
	public static String stripComments(String code, boolean sql) {
		char lineComment = sql ? '-' : '/';
		StringBuilder out = new StringBuilder(code.length());
		int i = 0;
		int n = code.length();
		while (i < n) {
			char c = code.charAt(i);
			char next = i + 1 < n ? code.charAt(i + 1) : '\0';
			if (c == lineComment && next == lineComment) {
				while (i < n && code.charAt(i) != '\n') {
					out.append(' ');
					i++;
				}
			} else if (c == '/' && next == '*') {
				out.append("  ");
				i += 2;
				while (i < n && !(code.charAt(i) == '*' && i + 1 < n && code.charAt(i + 1) == '/')) {
					out.append(code.charAt(i) == '\n' ? '\n' : ' ');
					i++;
				}
				if (i < n) {
					out.append("  ");
					i += 2;
				}
			} else if (c == '\'' || (!sql && c == '"')) {
				int end = endOfString(code, i, sql);
				out.append(code, i, end);
				i = end;
			} else {
				out.append(c);
				i++;
			}
		}
		return out.toString();
	}

	/**
	 * Offset just past the string literal opening at {@code start}, or the text length when it is unterminated.
	 */
	public static int endOfString(String code, int start, boolean sql) {
		char quote = code.charAt(start);
		int i = start + 1;
		while (i < code.length()) {
			char c = code.charAt(i);
			if (!sql && c == '\\') {
				i += 2;
				continue;
			}
			if (c == quote) {
				if (sql && i + 1 < code.length() && code.charAt(i + 1) == quote) {
					i += 2;
					continue;
				}
				return i + 1;
			}
			i++;
		}
		return code.length();
	}

	/**
	 * Offset of the parenthesis closing the one at {@code open}, skipping SQL string literals, or -1.
	 */
	public static int matchingParen(String code, int open) {
		int depth = 0;
		int i = open;
		while (i < code.length()) {
			char c = code.charAt(i);
			if (c == '\'') {
				i = endOfString(code, i, true);
				continue;
			}
			if (c == '(') depth++;
			else if (c == ')') {
				depth--;
				if (depth == 0) return i;
			}
			i++;
		}
		return -1;
	}

	public static Pattern cteHeader(String name) {
		return Pattern.compile("\\b" + Pattern.quote(name) + "\\s+as\\s*\\(", Pattern.CASE_INSENSITIVE);
	}

	/**
	 * Text between the parentheses of the named CTE, or {@code null} when it is absent or unbalanced.
	 */
	public static String cteBody(String code, String name) {
		Matcher matcher = cteHeader(name).matcher(code);
		if (!matcher.find()) return null;
		int open = matcher.end() - 1;
		int close = matchingParen(code, open);
		return close < 0 ? null : code.substring(open + 1, close);
	}
}
