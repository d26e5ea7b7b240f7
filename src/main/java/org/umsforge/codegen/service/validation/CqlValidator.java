package org.umsforge.codegen.service.validation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.umsforge.codegen.service.utils.CodeText;
import org.umsforge.codegen.service.utils.SourceScanner;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Structural checks on CQL text: balanced delimiters, library declarations, frequent typos and placeholders.
 * It does not parse CQL.
 */
public class CqlValidator {
	private static final Logger logger = LoggerFactory.getLogger(CqlValidator.class);

	public static final String UNBALANCED_PARENS = "UNBALANCED_PARENS";
	public static final String UNBALANCED_BRACKETS = "UNBALANCED_BRACKETS";
	public static final String UNBALANCED_QUOTES = "UNBALANCED_QUOTES";
	public static final String SYNTAX_ERROR = "SYNTAX_ERROR";
	public static final String MISSING_LIBRARY = "MISSING_LIBRARY";
	public static final String MISSING_USING = "MISSING_USING";
	public static final String MISSING_CONTEXT = "MISSING_CONTEXT";
	public static final String INVALID_IDENTIFIER = "INVALID_IDENTIFIER";
	public static final String EMPTY_DEFINITION = "EMPTY_DEFINITION";
	public static final String UNUSED_VALUESET = "UNUSED_VALUESET";

	private static final Pattern LIBRARY = Pattern.compile("\\blibrary\\s+(\\w+)(\\s+version\\s+'([^']+)')?");
	private static final Pattern USING = Pattern.compile("\\busing\\s+FHIR\\s+version\\s+'[^']+'");
	private static final Pattern CONTEXT = Pattern.compile("\\bcontext\\s+(Patient|Unfiltered|Population)\\b");
	private static final Pattern DEFINE_LINE = Pattern.compile("^\\s*define\\b");
	private static final Pattern DEFINITION = Pattern.compile("^\\s*define\\s+", Pattern.MULTILINE);
	private static final Pattern EMPTY_DEFINE = Pattern.compile("define\\s+\"([^\"]+)\":\\s*\\n\\s*true\\s*$", Pattern.MULTILINE);
	private static final Pattern VALUESET = Pattern.compile("^\\s*valueset\\s+\"([^\"]+)\"", Pattern.MULTILINE);
	private static final String[][] TYPOS = {
		{"exsits", "exists"},
		{"wehre", "where"},
		{"inteval", "Interval"},
		{"patinet", "Patient"}
	};

	/**
	 * Validates CQL text.
	 *
	 * @param code the CQL library text
	 * @return errors, warnings, suggestions, the score and the library facts found
	 */
	public CqlValidationResult validate(String code) {
		String source = code == null ? "" : code;
		IssueCollector issues = new IssueCollector();
		checkDelimiters(source, issues);

		String stripped = SourceScanner.stripComments(source, false);
		Matcher library = LIBRARY.matcher(stripped);
		String libraryName = null;
		String version = null;
		if (library.find()) {
			libraryName = library.group(1);
			version = library.group(3);
		} else {
			issues.add(ValidationIssue.error(MISSING_LIBRARY, "Missing library declaration")
				.withSuggestion("Add: library <LibraryName> version '1.0.0'"));
		}
		if (!USING.matcher(stripped).find()) {
			issues.add(ValidationIssue.error(MISSING_USING, "Missing FHIR using declaration")
				.withSuggestion("Add: using FHIR version '4.0.1'"));
		}
		if (!CONTEXT.matcher(stripped).find()) {
			issues.add(ValidationIssue.warning(MISSING_CONTEXT, "Missing context declaration")
				.withSuggestion("Add: context Patient"));
		}

		checkLines(stripped, issues);
		checkPlaceholders(stripped, issues);

		Set<String> valueSets = new LinkedHashSet<>();
		Matcher vs = VALUESET.matcher(stripped);
		while (vs.find()) valueSets.add(vs.group(1));
		for (String name : valueSets) {
			int references = CodeText.countMatches(Pattern.compile(Pattern.quote("\"" + name + "\"")), stripped);
			if (references <= 1) {
				issues.add(ValidationIssue.warning(UNUSED_VALUESET, String.format("Value set \"%s\" is declared but never used", name)));
			}
		}

		CqlLibraryInfo info = new CqlLibraryInfo(libraryName, version, CodeText.countMatches(DEFINITION, stripped), valueSets.size());
		logger.debug("Validated CQL library {}: {} error(s), {} warning(s)", libraryName, issues.getErrors().size(), issues.getWarnings().size());
		return new CqlValidationResult(issues.getErrors(), issues.getWarnings(), issues.getSuggestions(), info);
	}

	private static void checkDelimiters(String code, IssueCollector issues) {
		Deque<int[]> parens = new ArrayDeque<>();
		Deque<int[]> brackets = new ArrayDeque<>();
		int line = 1;
		int column = 0;
		int i = 0;
		int n = code.length();
		while (i < n) {
			char c = code.charAt(i);
			char next = i + 1 < n ? code.charAt(i + 1) : '\0';
			column++;
			if (c == '\n') {
				line++;
				column = 0;
				i++;
				continue;
			}
			if (c == '/' && next == '/') {
				while (i < n && code.charAt(i) != '\n') i++;
				continue;
			}
			if (c == '/' && next == '*') {
				int startLine = line;
				i += 2;
				column++;
				boolean closed = false;
				while (i < n) {
					if (code.charAt(i) == '*' && i + 1 < n && code.charAt(i + 1) == '/') {
						i += 2;
						column += 2;
						closed = true;
						break;
					}
					if (code.charAt(i) == '\n') {
						line++;
						column = 0;
					} else {
						column++;
					}
					i++;
				}
				if (!closed) {
					issues.add(ValidationIssue.error(SYNTAX_ERROR, "Unclosed block comment").at(startLine, null));
				}
				continue;
			}
			if (c == '"' || c == '\'') {
				int close = closingQuote(code, i);
				if (close < 0) {
					issues.add(ValidationIssue.error(UNBALANCED_QUOTES, String.format("Unclosed string literal (started with %s)", c)).at(line, column));
					return;
				}
				for (int k = i + 1; k <= close; k++) {
					if (code.charAt(k) == '\n') {
						line++;
						column = 0;
					} else {
						column++;
					}
				}
				i = close + 1;
				continue;
			}
			if (c == '(') parens.push(new int[]{line, column});
			else if (c == '[') brackets.push(new int[]{line, column});
			else if (c == ')') {
				if (parens.isEmpty()) {
					issues.add(ValidationIssue.error(UNBALANCED_PARENS, "Unexpected closing parenthesis").at(line, column));
				} else {
					parens.pop();
				}
			} else if (c == ']') {
				if (brackets.isEmpty()) {
					issues.add(ValidationIssue.error(UNBALANCED_BRACKETS, "Unexpected closing bracket").at(line, column));
				} else {
					brackets.pop();
				}
			}
			i++;
		}
		for (int[] open : parens) {
			issues.add(ValidationIssue.error(UNBALANCED_PARENS, "Unclosed parenthesis").at(open[0], open[1]));
		}
		for (int[] open : brackets) {
			issues.add(ValidationIssue.error(UNBALANCED_BRACKETS, "Unclosed bracket").at(open[0], open[1]));
		}
	}

	/**
	 * Offset of the quote closing the literal opening at {@code start}, or -1 when it is unterminated.
	 */
	private static int closingQuote(String code, int start) {
		char quote = code.charAt(start);
		int i = start + 1;
		while (i < code.length()) {
			char c = code.charAt(i);
			if (c == '\\') {
				i += 2;
				continue;
			}
			if (c == quote) return i;
			i++;
		}
		return -1;
	}

	private static void checkLines(String stripped, IssueCollector issues) {
		String[] lines = stripped.split("\n", -1);
		for (int index = 0; index < lines.length; index++) {
			String line = lines[index];
			if (line.isBlank()) continue;
			int lineNumber = index + 1;
			if (line.contains("\"\"")) {
				issues.add(ValidationIssue.error(INVALID_IDENTIFIER, "Empty quoted identifier").at(lineNumber, line.indexOf("\"\"") + 1));
			}
			if (DEFINE_LINE.matcher(line).find() && !line.contains(":")) {
				issues.add(ValidationIssue.error(SYNTAX_ERROR, "Missing colon after define statement").at(lineNumber, null)
					.withSuggestion("Definitions use the form: define \"Name\":"));
			}
			for (String[] typo : TYPOS) {
				Matcher matcher = Pattern.compile("\\b" + typo[0] + "\\b", Pattern.CASE_INSENSITIVE).matcher(line);
				if (matcher.find()) {
					issues.add(ValidationIssue.error(SYNTAX_ERROR, String.format("Unknown keyword '%s'", matcher.group()))
						.at(lineNumber, matcher.start() + 1)
						.withSuggestion(String.format("Did you mean '%s'?", typo[1])));
				}
			}
		}
	}

	private static void checkPlaceholders(String stripped, IssueCollector issues) {
		Matcher matcher = EMPTY_DEFINE.matcher(stripped);
		while (matcher.find()) {
			issues.add(ValidationIssue.warning(EMPTY_DEFINITION,
				String.format("Definition \"%s\" always returns true - may be a placeholder", matcher.group(1)))
				.at(CodeText.lineOf(stripped, matcher.start()), null));
		}
	}
}
