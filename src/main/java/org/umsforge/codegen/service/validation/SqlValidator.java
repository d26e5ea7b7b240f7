package org.umsforge.codegen.service.validation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.umsforge.codegen.service.sql.SqlGenerationConfig;
import org.umsforge.codegen.service.utils.CodeText;
import org.umsforge.codegen.service.utils.SourceScanner;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Checks a T-SQL script against the HDI platform conventions: required CTEs, predicate naming and columns, Synapse
 * dialect, population filtering, and basic syntax balance.
 */
public class SqlValidator {
	private static final Logger logger = LoggerFactory.getLogger(SqlValidator.class);

	public static final String MISSING_REQUIRED_CTE = "MISSING_REQUIRED_CTE";
	public static final String INVALID_CTE_STRUCTURE = "INVALID_CTE_STRUCTURE";
	public static final String CTE_ORDER = "CTE_ORDER";
	public static final String PREDICATE_NAMING = "PREDICATE_NAMING";
	public static final String MISSING_PREDICATE_COLUMN = "MISSING_PREDICATE_COLUMN";
	public static final String DIALECT_MISMATCH = "DIALECT_MISMATCH";
	public static final String SYNAPSE_SYNTAX = "SYNAPSE_SYNTAX";
	public static final String MISSING_POPULATION_FILTER = "MISSING_POPULATION_FILTER";
	public static final String POPULATION_ID_MISMATCH = "POPULATION_ID_MISMATCH";
	public static final String MISSING_ONT_JOINS = "MISSING_ONT_JOINS";
	public static final String MISSING_CONCEPT_NAMES = "MISSING_CONCEPT_NAMES";
	public static final String POTENTIAL_SQL_INJECTION = "POTENTIAL_SQL_INJECTION";
	public static final String UNQUOTED_PARAMETER = "UNQUOTED_PARAMETER";
	public static final String UNBALANCED_PARENS = "UNBALANCED_PARENS";
	public static final String UNBALANCED_QUOTES = "UNBALANCED_QUOTES";

	static final List<String> REQUIRED_CTES = List.of("ONT", "DEMOG");
	static final Set<String> SYSTEM_CTES = Set.of("ONT", "DEMOG", "MEASURE_RESULT", "INITIAL_POPULATION", "DENOMINATOR",
		"DENOM_EXCLUSION", "DENOM_EXCEPTION", "NUMERATOR", "NUM_EXCLUSION");
	private static final List<String> POPULATION_CTES = List.of("INITIAL_POPULATION", "DENOMINATOR", "DENOM_EXCLUSION",
		"DENOM_EXCEPTION", "NUMERATOR", "NUM_EXCLUSION");
	private static final List<String> PREDICATE_COLUMNS = List.of("population_id", "empi_id", "data_model");

	private static final Pattern CTE = Pattern.compile("\\b([A-Z_][A-Z0-9_]*)\\s+as\\s*\\(", Pattern.CASE_INSENSITIVE);
	private static final Pattern PREDICATE_SELECT = Pattern.compile("\\b(PRED_[A-Z0-9_]+)\\s+as\\s*\\(\\s*select([\\s\\S]*?)\\bfrom\\b", Pattern.CASE_INSENSITIVE);
	private static final Pattern VIEW_HEADER = Pattern.compile("^\\s*create\\s+(or\\s+alter\\s+)?view\\b", Pattern.CASE_INSENSITIVE);
	private static final Pattern WITH = Pattern.compile("^\\s*with\\b", Pattern.CASE_INSENSITIVE);
	private static final Pattern[] DIALECT_PATTERNS = {
		Pattern.compile("\\binterval\\s*'", Pattern.CASE_INSENSITIVE),
		Pattern.compile("\\bAGE\\s*\\(", Pattern.CASE_INSENSITIVE),
		Pattern.compile("\\bcurrent_date\\s*\\(\\s*\\)", Pattern.CASE_INSENSITIVE)
	};
	private static final Pattern CURRENT_DATE = Pattern.compile("\\bcurrent_date\\b", Pattern.CASE_INSENSITIVE);
	private static final Pattern[] INJECTION_PATTERNS = {
		Pattern.compile(";\\s*(drop|delete|update|insert)\\s+", Pattern.CASE_INSENSITIVE),
		Pattern.compile("--[^\\n]*\\bdrop\\b", Pattern.CASE_INSENSITIVE),
		Pattern.compile("/\\*[\\s\\S]*?\\bdrop\\b[\\s\\S]*?\\*/", Pattern.CASE_INSENSITIVE)
	};
	private static final Pattern PARAMETER = Pattern.compile("\\$\\{[^}]*\\}");
	private static final Pattern QUOTED_PARAMETER = Pattern.compile("'\\$\\{[^}]*\\}'");
	private static final Pattern ALIAS = Pattern.compile("\\bas\\s+([a-z_][a-z0-9_]*)\\s*$", Pattern.CASE_INSENSITIVE);
	private static final Pattern JOIN_CONDITION = Pattern.compile(
		"\\bon\\s+([\\s\\S]+?)(?=\\bleft\\s+join\\b|\\binner\\s+join\\b|\\bright\\s+join\\b|\\bwhere\\b|\\bgroup\\s+by\\b|\\)|$)", Pattern.CASE_INSENSITIVE);
	private static final Pattern FILTER_CONDITION = Pattern.compile(
		"\\bwhere\\s+([\\s\\S]+?)(?=\\bgroup\\s+by\\b|\\border\\s+by\\b|\\bunion\\b|\\bintersect\\b|\\bexcept\\b|\\)|;|$)", Pattern.CASE_INSENSITIVE);

	/**
	 * Validates a SQL script.
	 *
	 * @param code   the script
	 * @param config expected population id; {@code null} or a placeholder id skips the population id comparison
	 * @return errors, warnings, suggestions and the score
	 */
	public ValidationResult validate(String code, SqlGenerationConfig config) {
		String source = code == null ? "" : code;
		String stripped = SourceScanner.stripComments(source, true);
		IssueCollector issues = new IssueCollector();

		checkStructure(stripped, issues);
		checkPredicates(stripped, issues);
		checkDialect(stripped, issues);
		checkPopulation(stripped, config == null ? null : config.getPopulationId(), issues);
		checkDemographics(stripped, issues);
		checkSecurity(source, issues);
		checkSyntax(stripped, issues);

		ValidationResult result = issues.toResult();
		logger.debug("Validated SQL script: score {}, {} error(s), {} warning(s)", result.getScore(), result.getErrors().size(), result.getWarnings().size());
		return result;
	}

	/**
	 * Validates a SQL script and reports its CTE and column structure.
	 *
	 * @param code   the script
	 * @param config expected population id, may be {@code null}
	 * @return the validation result with the CTE and column analyses
	 */
	public DetailedSqlValidation validateDetailed(String code, SqlGenerationConfig config) {
		String source = code == null ? "" : code;
		String stripped = SourceScanner.stripComments(source, true);
		return new DetailedSqlValidation(validate(source, config), analyzeCtes(stripped), analyzeColumns(stripped));
	}

	private static void checkStructure(String sql, IssueCollector issues) {
		for (String required : REQUIRED_CTES) {
			if (!SourceScanner.cteHeader(required).matcher(sql).find()) {
				issues.add(ValidationIssue.error(MISSING_REQUIRED_CTE, "Missing required CTE: " + required)
					.withSuggestion(String.format("Add the %s CTE from the HDI template", required)));
			}
		}

		String firstCodeLine = null;
		for (String line : sql.split("\n")) {
			if (!line.isBlank()) {
				firstCodeLine = line;
				break;
			}
		}
		if (firstCodeLine != null && !WITH.matcher(firstCodeLine).find() && !VIEW_HEADER.matcher(firstCodeLine).find()) {
			issues.add(ValidationIssue.error(INVALID_CTE_STRUCTURE, "SQL should start with a WITH clause")
				.withSuggestion("Start the query with: with ONT as ("));
		}

		Matcher ont = SourceScanner.cteHeader("ONT").matcher(sql);
		Matcher demog = SourceScanner.cteHeader("DEMOG").matcher(sql);
		if (ont.find() && demog.find() && demog.start() < ont.start()) {
			issues.add(ValidationIssue.warning(CTE_ORDER, "DEMOG should be defined after ONT")
				.withSuggestion("Define ONT first; DEMOG joins to it"));
		}
	}

	private static void checkPredicates(String sql, IssueCollector issues) {
		boolean anyPredicate = false;
		for (String name : cteNames(sql)) {
			if (name.toUpperCase(Locale.ROOT).startsWith("PRED_")) {
				anyPredicate = true;
			} else if (!SYSTEM_CTES.contains(name.toUpperCase(Locale.ROOT))) {
				issues.add(ValidationIssue.warning(PREDICATE_NAMING, String.format("CTE \"%s\" does not follow the PRED_ naming convention", name))
					.withSuggestion(String.format("Rename to PRED_%s for consistency", name.toUpperCase(Locale.ROOT))));
			}
		}
		if (!anyPredicate) issues.suggest("Consider adding PRED_* CTEs for clinical criteria");

		Matcher matcher = PREDICATE_SELECT.matcher(sql);
		while (matcher.find()) {
			String selectList = matcher.group(2).toLowerCase(Locale.ROOT);
			for (String column : PREDICATE_COLUMNS) {
				if (!selectList.contains(column)) {
					issues.add(ValidationIssue.warning(MISSING_PREDICATE_COLUMN, String.format("Predicate %s is missing column %s", matcher.group(1), column))
						.at(CodeText.lineOf(sql, matcher.start()), null));
				}
			}
		}
	}

	private static void checkDialect(String sql, IssueCollector issues) {
		for (Pattern pattern : DIALECT_PATTERNS) {
			Matcher matcher = pattern.matcher(sql);
			if (matcher.find()) {
				issues.add(ValidationIssue.warning(DIALECT_MISMATCH, String.format("Non Synapse syntax detected: %s", matcher.group().trim()))
					.at(CodeText.lineOf(sql, matcher.start()), null)
					.withSuggestion("Use DATEADD/DATEDIFF and GETDATE() for date arithmetic"));
			}
		}
		if (CURRENT_DATE.matcher(sql).find() && !sql.contains("GETDATE()")) {
			issues.add(ValidationIssue.warning(SYNAPSE_SYNTAX, "Use GETDATE() instead of current_date in Synapse"));
		}
	}

	private static void checkPopulation(String sql, String populationId, IssueCollector issues) {
		if (!sql.toLowerCase(Locale.ROOT).contains("population_id")) {
			issues.add(ValidationIssue.error(MISSING_POPULATION_FILTER, "Missing population_id filter")
				.withSuggestion("Filter every source table on population_id"));
			return;
		}
		if (SqlGenerationConfig.isPlaceholder(populationId)) return;
		if (!sql.contains("'" + CodeText.escapeSql(populationId) + "'")) {
			issues.add(ValidationIssue.warning(POPULATION_ID_MISMATCH, String.format("Population id '%s' is not referenced", populationId)));
		}
	}

	private static void checkDemographics(String sql, IssueCollector issues) {
		String body = SourceScanner.cteBody(sql, "DEMOG");
		if (body == null) return;
		String lower = body.toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
		if (!lower.contains("left join ont")) {
			issues.add(ValidationIssue.warning(MISSING_ONT_JOINS, "DEMOG does not join ONT for concept resolution")
				.withSuggestion("Left join ONT to resolve gender, race and ethnicity concepts"));
		}
		if (!lower.contains("concept_name")) {
			issues.add(ValidationIssue.warning(MISSING_CONCEPT_NAMES, "DEMOG does not select concept names"));
		}
	}

	private static void checkSecurity(String raw, IssueCollector issues) {
		for (Pattern pattern : INJECTION_PATTERNS) {
			Matcher matcher = pattern.matcher(raw);
			if (matcher.find()) {
				issues.add(ValidationIssue.error(POTENTIAL_SQL_INJECTION, "Potentially dangerous SQL pattern detected")
					.at(CodeText.lineOf(raw, matcher.start()), null));
				break;
			}
		}
		if (PARAMETER.matcher(raw).find() && !QUOTED_PARAMETER.matcher(raw).find()) {
			issues.add(ValidationIssue.warning(UNQUOTED_PARAMETER, "Template parameter is not quoted")
				.withSuggestion("Quote template parameters, for example '${POPULATION_ID}'"));
		}
	}

	private static void checkSyntax(String sql, IssueCollector issues) {
		int depth = 0;
		int quotes = 0;
		int line = 1;
		for (int i = 0; i < sql.length(); i++) {
			char c = sql.charAt(i);
			if (c == '\n') line++;
			else if (c == '\'') quotes++;
			else if (quotes % 2 == 0) {
				if (c == '(') depth++;
				else if (c == ')') {
					depth--;
					if (depth < 0) {
						issues.add(ValidationIssue.error(UNBALANCED_PARENS, "Unexpected closing parenthesis").at(line, null));
						depth = 0;
					}
				}
			}
		}
		if (depth > 0) {
			issues.add(ValidationIssue.error(UNBALANCED_PARENS, String.format("%d unclosed parenthesis(es)", depth)));
		}
		if (quotes % 2 != 0) {
			issues.add(ValidationIssue.error(UNBALANCED_QUOTES, "Unbalanced single quotes"));
		}
	}

	static List<String> cteNames(String sql) {
		List<String> names = new ArrayList<>();
		Matcher matcher = CTE.matcher(sql);
		while (matcher.find()) {
			if (!names.contains(matcher.group(1))) names.add(matcher.group(1));
		}
		return names;
	}

	private static CteAnalysis analyzeCtes(String sql) {
		List<String> names = cteNames(sql);
		List<String> predicates = new ArrayList<>();
		List<String> populations = new ArrayList<>();
		Map<String, List<String>> dependencies = new LinkedHashMap<>();
		for (String name : names) {
			String upper = name.toUpperCase(Locale.ROOT);
			if (upper.startsWith("PRED_")) predicates.add(name);
			if (POPULATION_CTES.contains(upper)) populations.add(name);
			String body = SourceScanner.cteBody(sql, name);
			List<String> references = new ArrayList<>();
			if (body != null) {
				for (String other : names) {
					if (!other.equals(name) && Pattern.compile("\\b" + Pattern.quote(other) + "\\b").matcher(body).find()) references.add(other);
				}
			}
			dependencies.put(name, references);
		}
		return new CteAnalysis(names, predicates, populations, dependencies);
	}

	private static ColumnAnalysis analyzeColumns(String sql) {
		Map<String, List<String>> selectColumns = new LinkedHashMap<>();
		for (String name : cteNames(sql)) {
			String body = SourceScanner.cteBody(sql, name);
			if (body != null) selectColumns.put(name, selectAliases(body));
		}
		return new ColumnAnalysis(selectColumns, collect(JOIN_CONDITION, sql), collect(FILTER_CONDITION, sql));
	}

	/**
	 * Output names of the first select list of a CTE body.
	 */
	static List<String> selectAliases(String body) {
		List<String> aliases = new ArrayList<>();
		Matcher select = Pattern.compile("^\\s*select\\s+(distinct\\s+)?", Pattern.CASE_INSENSITIVE).matcher(body);
		if (!select.find()) return aliases;
		int depth = 0;
		int start = select.end();
		int i = start;
		List<String> columns = new ArrayList<>();
		while (i < body.length()) {
			char c = body.charAt(i);
			if (c == '\'') {
				i = SourceScanner.endOfString(body, i, true);
				continue;
			}
			if (c == '(') depth++;
			else if (c == ')') depth--;
			else if (depth == 0 && c == ',') {
				columns.add(body.substring(start, i));
				start = i + 1;
			} else if (depth == 0 && body.regionMatches(true, i, "from", 0, 4) && isBoundary(body, i - 1) && isBoundary(body, i + 4)) {
				break;
			}
			i++;
		}
		columns.add(body.substring(start, Math.min(i, body.length())));
		for (String column : columns) {
			String text = column.trim();
			if (text.isEmpty()) continue;
			Matcher alias = ALIAS.matcher(text);
			if (alias.find()) {
				aliases.add(alias.group(1));
			} else {
				int dot = text.lastIndexOf('.');
				aliases.add(dot >= 0 ? text.substring(dot + 1) : text);
			}
		}
		return aliases;
	}

	private static boolean isBoundary(String text, int index) {
		return index < 0 || index >= text.length() || !Character.isLetterOrDigit(text.charAt(index)) && text.charAt(index) != '_';
	}

	private static List<String> collect(Pattern pattern, String sql) {
		List<String> out = new ArrayList<>();
		Matcher matcher = pattern.matcher(sql);
		while (matcher.find()) {
			String condition = CodeText.singleLine(matcher.group(1));
			if (!condition.isEmpty()) out.add(condition);
		}
		return out;
	}
}
