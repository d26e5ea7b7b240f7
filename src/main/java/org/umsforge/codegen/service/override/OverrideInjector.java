package org.umsforge.codegen.service.override;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.umsforge.codegen.service.OutputFormat;
import org.umsforge.codegen.service.utils.CodeText;
import org.umsforge.codegen.service.utils.ComponentMarkers;
import org.umsforge.codegen.service.utils.SourceScanner;
import org.umsforge.model.DataElement;
import org.umsforge.model.Measure;

import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splices locked overrides into freshly generated code.
 * <p>
 * Each override is anchored on its component markers first, then on the component description (a {@code define}
 * in CQL, a commented CTE in SQL). When neither is found the override is appended at the end of the document, so an
 * override is never lost.
 */
public class OverrideInjector {
	private static final Logger logger = LoggerFactory.getLogger(OverrideInjector.class);

	static final String OVERRIDDEN = "[OVERRIDDEN]";
	private static final String RULE = "============================================================";
	private static final Pattern CTE_START = Pattern.compile("\\b[A-Za-z_][A-Za-z0-9_]*\\s+as\\s*\\(", Pattern.CASE_INSENSITIVE);
	private static final Pattern NEXT_DEFINE = Pattern.compile("^(define\\s|//\\s*=+|/\\*)", Pattern.MULTILINE);

	/**
	 * Applies the locked overrides of one measure and format.
	 *
	 * @param document  generated code
	 * @param measure   measure the code was generated from, used for component descriptions
	 * @param format    language of the document
	 * @param overrides overrides to apply; unlocked ones and those of other measures or formats are ignored
	 * @return the document with overrides and the banner, unchanged when nothing applied
	 */
	public InjectionResult apply(String document, Measure measure, OutputFormat format, List<CodeOverride> overrides) {
		String code = document == null ? "" : document;
		List<String> applied = new ArrayList<>();
		List<String> appended = new ArrayList<>();
		List<CodeOverride> active = new ArrayList<>();
		for (CodeOverride override : overrides) {
			OverrideKey key = override.getKey();
			if (!override.isLocked() || key.getFormat() != format || measure == null || !key.getMeasureId().equals(measure.getId())) continue;
			active.add(override);
		}
		if (active.isEmpty()) return new InjectionResult(code, applied, appended);

		for (CodeOverride override : active) {
			String componentId = override.getKey().getComponentId();
			String description = describe(measure, componentId);
			String replacement = replacement(override, format);

			String injected = replaceMarked(code, componentId, replacement);
			if (injected == null) {
				injected = format == OutputFormat.CQL
					? replaceDefinition(code, description, replacement)
					: replaceCommentedCte(code, description, replacement);
			}
			if (injected == null) {
				logger.warn("No anchor found for override {} ({}); appending it", override.getKey(), description);
				injected = append(code, description, replacement, format);
				appended.add(componentId);
			}
			code = injected;
			applied.add(componentId);
		}

		logger.info("Applied {} override(s) to measure {} ({})", applied.size(), measure.getId(), format.code());
		return new InjectionResult(banner(active, measure, format) + code, applied, appended);
	}

	static String describe(Measure measure, String componentId) {
		return measure.findDataElement(componentId).map(DataElement::componentLabel).orElse(componentId);
	}

	private static String replacement(CodeOverride override, OutputFormat format) {
		String prefix = format.commentPrefix();
		StringBuilder text = new StringBuilder();
		for (EditNote note : override.getNotes()) {
			text.append(noteLine(prefix, note)).append('\n');
		}
		text.append(prefix).append(' ').append(OVERRIDDEN).append('\n');
		text.append(override.getCode() == null ? "" : override.getCode().strip());
		return text.toString();
	}

	private static String noteLine(String prefix, EditNote note) {
		return String.format("%s EDIT NOTE [%s] (%s): %s", prefix, note.getChangeType().code(),
			DateTimeFormatter.ISO_INSTANT.format(note.getTimestamp()), CodeText.singleLine(note.getContent()));
	}

	/**
	 * Replaces the code between the component markers, keeping the markers.
	 */
	private static String replaceMarked(String code, String componentId, String replacement) {
		Matcher matcher = ComponentMarkers.region(componentId).matcher(code);
		if (!matcher.find()) return null;
		return code.substring(0, matcher.start())
			+ ComponentMarkers.start(componentId) + "\n" + replacement + "\n" + ComponentMarkers.end(componentId)
			+ code.substring(matcher.end());
	}

	/**
	 * Replaces the body of {@code define "<description>":} up to the next top level statement.
	 */
	private static String replaceDefinition(String code, String description, String replacement) {
		Pattern header = Pattern.compile("^define\\s+\"" + Pattern.quote(CodeText.escapeCqlIdentifier(description)) + "\"\\s*:[ \\t]*\\n?", Pattern.MULTILINE);
		Matcher matcher = header.matcher(code);
		if (!matcher.find()) return null;
		int bodyStart = matcher.end();
		Matcher next = NEXT_DEFINE.matcher(code);
		int bodyEnd = next.find(bodyStart) ? next.start() : code.length();
		return code.substring(0, bodyStart) + indent(replacement) + "\n\n" + code.substring(bodyEnd);
	}

	/**
	 * Replaces the CTE that follows a {@code -- <description>} comment line.
	 */
	private static String replaceCommentedCte(String code, String description, String replacement) {
		Pattern comment = Pattern.compile("^--\\s*" + Pattern.quote(CodeText.singleLine(description)) + "\\s*$", Pattern.MULTILINE);
		Matcher matcher = comment.matcher(code);
		if (!matcher.find()) return null;
		Matcher cte = CTE_START.matcher(code);
		if (!cte.find(matcher.end())) return null;
		int close = SourceScanner.matchingParen(code, cte.end() - 1);
		if (close < 0) return null;
		return code.substring(0, cte.start()) + replacement + code.substring(close + 1);
	}

	private static String append(String code, String description, String replacement, OutputFormat format) {
		String prefix = format.commentPrefix();
		String label = CodeText.singleLine(description);
		return code.stripTrailing() + "\n\n"
			+ prefix + " " + RULE + "\n"
			+ prefix + " OVERRIDE for: " + label + "\n"
			+ prefix + " " + RULE + "\n"
			+ replacement + "\n"
			+ prefix + " " + RULE + "\n"
			+ prefix + " END OVERRIDE for: " + label + "\n";
	}

	private static String banner(List<CodeOverride> applied, Measure measure, OutputFormat format) {
		String prefix = format.commentPrefix();
		StringBuilder banner = new StringBuilder();
		banner.append(prefix).append(' ').append(RULE).append('\n');
		banner.append(prefix).append(" MANUAL OVERRIDES APPLIED: ").append(applied.size()).append(" component(s)\n");
		for (CodeOverride override : applied) {
			banner.append(prefix).append(" [OVERRIDE] ").append(CodeText.singleLine(describe(measure, override.getKey().getComponentId()))).append('\n');
			for (EditNote note : override.getNotes()) {
				banner.append(prefix).append("   ").append(noteLine("", note).trim()).append('\n');
			}
		}
		banner.append(prefix).append(' ').append(RULE).append("\n\n");
		return banner.toString();
	}

	private static String indent(String text) {
		StringBuilder out = new StringBuilder();
		for (String line : text.split("\n", -1)) {
			if (out.length() > 0) out.append('\n');
			out.append("  ").append(line);
		}
		return out.toString();
	}
}
