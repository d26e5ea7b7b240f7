package org.umsforge.codegen.service.cql;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.umsforge.codegen.service.utils.CodeText;
import org.umsforge.codegen.service.utils.MeasurePreconditions;
import org.umsforge.model.DataElement;
import org.umsforge.model.ElementType;
import org.umsforge.model.GlobalConstraints;
import org.umsforge.model.Measure;
import org.umsforge.model.MeasurementPeriod;
import org.umsforge.model.Population;
import org.umsforge.model.PopulationType;
import org.umsforge.model.ValueSetReference;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Generates a CQL library (FHIR 4.0.1, QI-Core) from a {@link Measure}.
 */
public class CqlGenerator {
	private static final Logger logger = LoggerFactory.getLogger(CqlGenerator.class);

	public static final String GENERATOR_NAME = "UMS Measure Code Compiler v1.0";
	public static final String DEFAULT_VERSION = "1.0.0";
	private static final Pattern DEFINE = Pattern.compile("^define\\s+\"", Pattern.MULTILINE);
	private static final int DESCRIPTION_LIMIT = 200;

	private static final String[][] CODE_SYSTEMS = {
		{"LOINC", "http://loinc.org"},
		{"SNOMEDCT", "http://snomed.info/sct"},
		{"ICD10CM", "http://hl7.org/fhir/sid/icd-10-cm"},
		{"CPT", "http://www.ama-assn.org/go/cpt"},
		{"HCPCS", "https://www.cms.gov/Medicare/Coding/HCPCSReleaseCodeSets"},
		{"RxNorm", "http://www.nlm.nih.gov/research/umls/rxnorm"},
		{"CVX", "http://hl7.org/fhir/sid/cvx"}
	};

	private static final String[] QUALIFYING_ENCOUNTERS = {
		"Office Visit",
		"Annual Wellness Visit",
		"Preventive Care Services Established Office Visit, 18 and Up",
		"Home Healthcare Services",
		"Online Assessments",
		"Telephone Visits"
	};

	private final Clock clock;
	private final CqlBoilerplateRegistry registry;

	public CqlGenerator() {
		this(Clock.systemUTC(), CqlBoilerplateRegistry.defaultRegistry());
	}

	public CqlGenerator(Clock clock, CqlBoilerplateRegistry registry) {
		this.clock = clock;
		this.registry = registry;
	}

	/**
	 * Generates the CQL library of a measure.
	 *
	 * @param measure the measure to compile
	 * @return the generated library, or a failed result listing every violated precondition
	 */
	public CqlGenerationResult generate(Measure measure) {
		List<String> errors = MeasurePreconditions.check(measure);
		if (!errors.isEmpty()) {
			logger.warn("CQL generation rejected: {}", errors);
			return CqlGenerationResult.failure(errors);
		}

		logger.info("Generating CQL library for measure {} with {} population(s)", measure.getId(), measure.getPopulations().size());
		List<String> warnings = new ArrayList<>();
		String libraryName = CodeText.libraryName(measure.getId());
		String version = StringUtils.defaultIfBlank(measure.getVersion(), DEFAULT_VERSION);
		List<ValueSetReference> declared = declaredValueSets(measure);
		List<BoilerplateBundle> bundles = registry.matching(measure);
		GlobalConstraints constraints = measure.getGlobalConstraints();
		boolean ageHelper = constraints != null && constraints.hasAgeRange();

		Map<String, ValueSetReference> byId = new LinkedHashMap<>();
		for (ValueSetReference vs : measure.getValueSets()) {
			if (vs.getId() != null) byId.put(vs.getId(), vs);
		}
		CqlExpressionBuilder builder = new CqlExpressionBuilder(byId, ageHelper, warnings);

		StringBuilder sb = new StringBuilder();
		appendHeader(sb, measure, libraryName, version);
		appendLibraryDeclarations(sb, libraryName, version);
		appendValueSets(sb, declared, warnings);
		appendParameters(sb, measure);
		sb.append("context Patient\n\n");
		appendHelpers(sb, measure, constraints, bundles);
		appendPopulations(sb, measure, bundles, builder, warnings);
		appendSupplementalData(sb);

		String code = sb.toString();
		CqlMetadata metadata = new CqlMetadata(libraryName, version, measure.getPopulations().size(), declared.size(),
			CodeText.countMatches(DEFINE, code));
		logger.info("Generated CQL library {} with {} definition(s) and {} warning(s)", libraryName, metadata.getDefinitionCount(), warnings.size());
		return new CqlGenerationResult(true, code, List.of(), warnings, metadata);
	}

	private void appendHeader(StringBuilder sb, Measure measure, String libraryName, String version) {
		sb.append("/*\n");
		sb.append(" * Library: ").append(libraryName).append('\n');
		sb.append(" * Title: ").append(CodeText.commentSafe(StringUtils.defaultIfBlank(measure.getTitle(), "Untitled"))).append('\n');
		sb.append(" * Measure ID: ").append(CodeText.commentSafe(measure.getId())).append('\n');
		sb.append(" * Version: ").append(version).append('\n');
		sb.append(" * Steward: ").append(CodeText.commentSafe(StringUtils.defaultIfBlank(measure.getSteward(), "Not specified"))).append('\n');
		sb.append(" * Type: ").append(CodeText.commentSafe(StringUtils.defaultIfBlank(measure.getMeasureType(), "process"))).append('\n');
		sb.append(" * Scoring: proportion\n");
		sb.append(" *\n");
		String description = StringUtils.isBlank(measure.getDescription())
			? "No description provided"
			: CodeText.truncate(CodeText.commentSafe(measure.getDescription()), DESCRIPTION_LIMIT);
		sb.append(" * Description: ").append(description).append('\n');
		sb.append(" *\n");
		sb.append(" * Generated: ").append(clock.instant()).append('\n');
		sb.append(" * Generator: ").append(GENERATOR_NAME).append('\n');
		sb.append(" */\n\n");
	}

	private static void appendLibraryDeclarations(StringBuilder sb, String libraryName, String version) {
		sb.append("library ").append(libraryName).append(" version '").append(version).append("'\n\n");
		sb.append("using FHIR version '4.0.1'\n\n");
		sb.append("include FHIRHelpers version '4.0.1' called FHIRHelpers\n");
		sb.append("include QICoreCommon version '2.0.0' called QICoreCommon\n");
		sb.append("include MATGlobalCommonFunctions version '7.0.000' called Global\n");
		sb.append("include SupplementalDataElements version '3.4.000' called SDE\n");
		sb.append("include Hospice version '6.9.000' called Hospice\n\n");
		sb.append("// Code Systems\n");
		for (String[] system : CODE_SYSTEMS) {
			sb.append("codesystem \"").append(system[0]).append("\": '").append(system[1]).append("'\n");
		}
		sb.append('\n');
	}

	private static void appendValueSets(StringBuilder sb, List<ValueSetReference> valueSets, List<String> warnings) {
		sb.append("// Value Sets\n");
		if (valueSets.isEmpty()) {
			sb.append("// No value sets defined\n\n");
			return;
		}
		for (ValueSetReference vs : valueSets) {
			String name = CodeText.escapeCqlIdentifier(vs.displayName());
			String url = vs.resolveUrl();
			if (url == null) {
				sb.append("// valueset \"").append(name).append("\": 'OID_NOT_SPECIFIED'\n");
				warnings.add(String.format("Value set \"%s\" has no OID or URL specified", vs.displayName()));
				continue;
			}
			sb.append("valueset \"").append(name).append("\": '").append(CodeText.escapeCqlString(url)).append("'\n");
			if (vs.getCodes().isEmpty()) {
				sb.append("  /* WARNING: Value set \"").append(CodeText.commentSafe(vs.displayName())).append("\" has no codes defined - may need expansion */\n");
				warnings.add(String.format("Value set \"%s\" has no codes defined", vs.displayName()));
			}
		}
		sb.append('\n');
	}

	private void appendParameters(StringBuilder sb, Measure measure) {
		MeasurementPeriod period = measure.getMeasurementPeriod();
		if (period == null || !period.isComplete()) {
			period = MeasurementPeriod.calendarYear(LocalDate.now(clock).getYear());
		}
		sb.append("// Parameters\n");
		sb.append("parameter \"Measurement Period\" Interval<DateTime>\n");
		sb.append(String.format("  default Interval[@%sT00:00:00.0, @%sT23:59:59.999]\n\n", period.getStart(), period.getEnd()));
	}

	private static void appendHelpers(StringBuilder sb, Measure measure, GlobalConstraints constraints, List<BoilerplateBundle> bundles) {
		sb.append("// Helper Definitions\n");
		if (constraints != null && constraints.hasAgeRange()) {
			Integer min = constraints.getAgeRange().getMin();
			Integer max = constraints.getAgeRange().getMax();
			sb.append("\ndefine \"Age at End of Measurement Period\":\n");
			sb.append("  AgeInYearsAt(date from end of \"Measurement Period\")\n");
			sb.append("\ndefine \"Patient Age Valid\":\n");
			sb.append(String.format("  \"Age at End of Measurement Period\" in Interval[%d, %d]\n", min == null ? 0 : min, max == null ? 999 : max));
		}
		if (constraints != null && constraints.hasRestrictiveGender()) {
			sb.append("\ndefine \"Patient Gender Valid\":\n");
			sb.append("  Patient.gender = '").append(constraints.getGender().code()).append("'\n");
		}
		if (measure.dataElements().stream().anyMatch(e -> e.getType() == ElementType.ENCOUNTER)) {
			sb.append("\ndefine \"Qualifying Encounter During Measurement Period\":\n");
			sb.append("  (\n");
			for (int i = 0; i < QUALIFYING_ENCOUNTERS.length; i++) {
				sb.append(i == 0 ? "    " : "      union ").append("[Encounter: \"").append(QUALIFYING_ENCOUNTERS[i]).append("\"]\n");
			}
			sb.append("  ) Encounter\n");
			sb.append("    where Encounter.status = 'finished'\n");
			sb.append("      and Encounter.period during \"Measurement Period\"\n");
		}
		sb.append("\ndefine \"Has Hospice Services\":\n");
		sb.append("  Hospice.\"Has Hospice Services\"\n");
		for (BoilerplateBundle bundle : bundles) {
			sb.append('\n').append(bundle.getHelperDefinitions()).append('\n');
		}
		sb.append('\n');
	}

	private static void appendPopulations(StringBuilder sb, Measure measure, List<BoilerplateBundle> bundles,
			CqlExpressionBuilder builder, List<String> warnings) {
		sb.append("// Population Definitions\n");

		Optional<Population> initial = measure.findPopulation(PopulationType.INITIAL_POPULATION);
		appendDefinition(sb, PopulationType.INITIAL_POPULATION, narrative(initial, null), initialPopulationBody(measure, initial, builder));

		Optional<Population> denominator = measure.findPopulation(PopulationType.DENOMINATOR);
		if (denominator.isPresent() && denominator.get().hasCriteria()) {
			appendDefinition(sb, PopulationType.DENOMINATOR, narrative(denominator, null), builder.translate(denominator.get().getCriteria()).toDefinitionBody());
		} else {
			appendDefinition(sb, PopulationType.DENOMINATOR, "Equals Initial Population", "  \"Initial Population\"");
		}

		Optional<Population> exclusion = measure.findPopulation(PopulationType.DENOMINATOR_EXCLUSION);
		List<String> exclusionParts = new ArrayList<>();
		exclusionParts.add("\"Has Hospice Services\"");
		for (BoilerplateBundle bundle : bundles) exclusionParts.addAll(bundle.getExclusions());
		List<String> exclusionNotes = new ArrayList<>();
		if (exclusion.isPresent() && exclusion.get().hasCriteria()) {
			CqlExpression authored = builder.translate(exclusion.get().getCriteria());
			exclusionNotes.addAll(authored.getNotes());
			if (!authored.isNeutral()) exclusionParts.add(wrapCustom(authored.getText()));
		}
		appendDefinition(sb, PopulationType.DENOMINATOR_EXCLUSION, narrative(exclusion, "Patients meeting exclusion criteria"),
			notes(exclusionNotes) + "  " + String.join("\n    or ", exclusionParts));

		Optional<Population> exception = measure.findPopulation(PopulationType.DENOMINATOR_EXCEPTION);
		if (exception.isPresent()) {
			appendDefinition(sb, PopulationType.DENOMINATOR_EXCEPTION, narrative(exception, null), optionalBody(exception.get(), builder));
		}

		Optional<Population> numerator = measure.findPopulation(PopulationType.NUMERATOR);
		Optional<BoilerplateBundle> fixedNumerator = bundles.stream().filter(b -> b.getNumerator() != null).findFirst();
		String numeratorBody;
		if (fixedNumerator.isPresent()) {
			numeratorBody = "  " + fixedNumerator.get().getNumerator();
		} else {
			CqlExpression translated = numerator.map(p -> builder.translate(p.getCriteria())).orElse(null);
			if (translated == null || (translated.isNeutral() && translated.getNotes().isEmpty())) {
				warnings.add("No numerator criteria defined in measure specification");
				numeratorBody = "  /* WARNING: No numerator criteria defined in measure specification */\n  true";
			} else {
				numeratorBody = translated.toDefinitionBody();
			}
		}
		appendDefinition(sb, PopulationType.NUMERATOR, narrative(numerator, "Patients meeting numerator criteria"), numeratorBody);

		Optional<Population> numeratorExclusion = measure.findPopulation(PopulationType.NUMERATOR_EXCLUSION);
		if (numeratorExclusion.isPresent()) {
			appendDefinition(sb, PopulationType.NUMERATOR_EXCLUSION, narrative(numeratorExclusion, null), optionalBody(numeratorExclusion.get(), builder));
		}
		sb.append('\n');
	}

	private static String initialPopulationBody(Measure measure, Optional<Population> initial, CqlExpressionBuilder builder) {
		GlobalConstraints constraints = measure.getGlobalConstraints();
		List<String> parts = new ArrayList<>();
		if (constraints != null && constraints.hasAgeRange()) parts.add("\"Patient Age Valid\"");
		if (constraints != null && constraints.hasRestrictiveGender()) parts.add("\"Patient Gender Valid\"");
		List<String> notes = new ArrayList<>();
		if (initial.isPresent()) {
			CqlExpression tree = builder.translate(initial.get().getCriteria());
			notes.addAll(tree.getNotes());
			if (!tree.isNeutral()) parts.add(parts.isEmpty() ? tree.getText() : "(" + tree.getText() + ")");
		}
		String expression = parts.isEmpty() ? CqlExpression.TRUE : String.join("\n    and ", parts);
		return notes(notes) + "  " + expression;
	}

	/**
	 * Body of a population emitted only when present; an empty tree selects nobody.
	 */
	private static String optionalBody(Population population, CqlExpressionBuilder builder) {
		CqlExpression expression = builder.translate(population.getCriteria());
		if (expression.isNeutral()) return notes(expression.getNotes()) + "  false";
		return expression.toDefinitionBody();
	}

	private static String wrapCustom(String expression) {
		if ("true".equals(expression) || "false".equals(expression)) return expression;
		return "(" + expression + ")";
	}

	private static String notes(List<String> notes) {
		StringBuilder sb = new StringBuilder();
		for (String note : notes) sb.append("  ").append(note).append('\n');
		return sb.toString();
	}

	private static String narrative(Optional<Population> population, String fallback) {
		return population
			.map(p -> StringUtils.firstNonBlank(p.getNarrative(), p.getDescription(), fallback))
			.orElse(fallback);
	}

	private static void appendDefinition(StringBuilder sb, PopulationType type, String narrative, String body) {
		sb.append("\n/*\n * ").append(type.display()).append('\n');
		if (StringUtils.isNotBlank(narrative)) {
			sb.append(" * ").append(CodeText.truncate(CodeText.commentSafe(narrative), DESCRIPTION_LIMIT)).append('\n');
		}
		sb.append(" */\n");
		sb.append("define \"").append(type.display()).append("\":\n");
		sb.append(body).append('\n');
	}

	private static void appendSupplementalData(StringBuilder sb) {
		sb.append("// Supplemental Data Elements\n");
		for (String element : new String[]{"Ethnicity", "Payer", "Race", "Sex"}) {
			sb.append("\ndefine \"SDE ").append(element).append("\":\n");
			sb.append("  SDE.\"SDE ").append(element).append("\"\n");
		}
	}

	/**
	 * Measure value sets followed by value sets referenced only from data elements, deduplicated by name.
	 */
	static List<ValueSetReference> declaredValueSets(Measure measure) {
		Map<String, ValueSetReference> declared = new LinkedHashMap<>();
		for (ValueSetReference vs : measure.getValueSets()) {
			declared.putIfAbsent(StringUtils.defaultString(vs.displayName()), vs);
		}
		for (DataElement element : measure.dataElements()) {
			ValueSetReference vs = element.getValueSet();
			if (vs == null || StringUtils.isBlank(vs.getName())) continue;
			declared.putIfAbsent(vs.displayName(), vs);
		}
		return new ArrayList<>(declared.values());
	}
}
