package org.umsforge.codegen.service.diff;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.umsforge.codegen.service.cql.CqlGenerationResult;
import org.umsforge.codegen.service.cql.CqlGenerator;
import org.umsforge.codegen.service.utils.CodeText;
import org.umsforge.model.CodeReference;
import org.umsforge.model.CriteriaTrees;
import org.umsforge.model.DataElement;
import org.umsforge.model.Measure;
import org.umsforge.model.Population;
import org.umsforge.model.PopulationType;
import org.umsforge.model.ValueSetReference;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Compares two versions of a measure, typically consecutive program years.
 */
public class MeasureDiffService {
	private static final Logger logger = LoggerFactory.getLogger(MeasureDiffService.class);

	private static final String ARROW = " → ";

	private final CqlGenerator cqlGenerator;

	public MeasureDiffService() {
		this(new CqlGenerator());
	}

	public MeasureDiffService(CqlGenerator cqlGenerator) {
		this.cqlGenerator = Objects.requireNonNull(cqlGenerator, "cqlGenerator must not be null");
	}

	public MeasureDiff compare(Measure oldMeasure, Measure newMeasure) {
		return compare(oldMeasure, newMeasure, false);
	}

	/**
	 * Compares two measures.
	 *
	 * @param oldMeasure  the earlier version
	 * @param newMeasure  the later version
	 * @param includeCode also generate both CQL libraries and diff them line by line
	 * @return the structured diff
	 */
	public MeasureDiff compare(Measure oldMeasure, Measure newMeasure, boolean includeCode) {
		Objects.requireNonNull(oldMeasure, "oldMeasure must not be null");
		Objects.requireNonNull(newMeasure, "newMeasure must not be null");

		List<ElementChange> elementChanges = compareElements(oldMeasure, newMeasure);
		List<MetadataChange> metadataChanges = compareMetadata(oldMeasure, newMeasure);
		List<PopulationChange> populationChanges = comparePopulations(oldMeasure, newMeasure);

		int added = 0;
		int removed = 0;
		int modified = 0;
		int valueSets = 0;
		for (ElementChange change : elementChanges) {
			switch (change.getKind()) {
				case ADDED -> added++;
				case REMOVED -> removed++;
				default -> modified++;
			}
			if (change.getValueSetDiff() != null) valueSets++;
		}
		DiffSummary summary = new DiffSummary(added, removed, modified, valueSets, populationChanges.size(), metadataChanges.size());

		List<LineChange> codeDiff = null;
		if (includeCode) {
			CqlGenerationResult oldCql = cqlGenerator.generate(oldMeasure);
			CqlGenerationResult newCql = cqlGenerator.generate(newMeasure);
			codeDiff = LineDiff.diff(StringUtils.defaultString(oldCql.getCode()), StringUtils.defaultString(newCql.getCode()));
		}

		logger.info("Compared measure {} with {}: {} change(s)", oldMeasure.getId(), newMeasure.getId(), summary.getTotalChanges());
		return new MeasureDiff(oldMeasure.getId(), newMeasure.getId(), versionOf(oldMeasure), versionOf(newMeasure), summary,
			metadataChanges, populationChanges, elementChanges, codeDiff);
	}

	/**
	 * Renders a diff as a plain text report.
	 */
	public String summarize(MeasureDiff diff) {
		List<String> lines = new ArrayList<>();
		DiffSummary summary = diff.getSummary();
		lines.add(String.format("Measure Comparison: %s (%s)%s%s (%s)", diff.getOldMeasureId(), diff.getOldVersion(), ARROW,
			diff.getNewMeasureId(), diff.getNewVersion()));
		lines.add("");
		lines.add("Summary:");
		lines.add("  Total Changes: " + summary.getTotalChanges());
		lines.add("  Elements Added: " + summary.getElementsAdded());
		lines.add("  Elements Removed: " + summary.getElementsRemoved());
		lines.add("  Elements Modified: " + summary.getElementsModified());
		lines.add("  Value Sets Changed: " + summary.getValueSetsChanged());
		lines.add("  Populations Changed: " + summary.getPopulationsChanged());
		lines.add("  Metadata Changed: " + summary.getMetadataChanged());

		if (!diff.getMetadataChanges().isEmpty()) {
			lines.add("");
			lines.add("Metadata Changes:");
			for (MetadataChange change : diff.getMetadataChanges()) {
				lines.add(String.format("  %s: \"%s\"%s\"%s\"", change.getField(), StringUtils.defaultString(change.getOldValue(), "(none)"),
					ARROW, StringUtils.defaultString(change.getNewValue(), "(none)")));
			}
		}
		if (!diff.getPopulationChanges().isEmpty()) {
			lines.add("");
			lines.add("Population Changes:");
			for (PopulationChange change : diff.getPopulationChanges()) {
				lines.add(String.format("  [%s] %s", change.getKind().name(), change.getType().display()));
				change.getChanges().forEach(detail -> lines.add("    - " + detail));
			}
		}
		if (!diff.getElementChanges().isEmpty()) {
			lines.add("");
			lines.add("Element Changes:");
			for (ElementChange change : diff.getElementChanges()) {
				lines.add(String.format("  [%s] %s", change.getKind().name(), CodeText.truncate(CodeText.singleLine(change.label()), 50)));
				change.getChanges().forEach(detail -> lines.add("    - " + detail));
			}
		}
		return String.join("\n", lines);
	}

	private static List<ElementChange> compareElements(Measure oldMeasure, Measure newMeasure) {
		Map<String, DataElement> oldElements = elementsById(oldMeasure);
		Map<String, DataElement> newElements = elementsById(newMeasure);
		Set<String> ids = new LinkedHashSet<>(oldElements.keySet());
		ids.addAll(newElements.keySet());

		List<ElementChange> changes = new ArrayList<>();
		for (String id : ids) {
			DataElement before = oldElements.get(id);
			DataElement after = newElements.get(id);
			if (before == null) {
				changes.add(new ElementChange(id, ChangeKind.ADDED, null, after, List.of("Element added"), valueSetDiff(null, after.getValueSet())));
			} else if (after == null) {
				changes.add(new ElementChange(id, ChangeKind.REMOVED, before, null, List.of("Element removed"), valueSetDiff(before.getValueSet(), null)));
			} else {
				ValueSetDiff vsDiff = valueSetDiff(before.getValueSet(), after.getValueSet());
				List<String> details = elementDetails(before, after, vsDiff);
				if (!details.isEmpty()) changes.add(new ElementChange(id, ChangeKind.MODIFIED, before, after, details, vsDiff));
			}
		}
		return changes;
	}

	private static List<String> elementDetails(DataElement before, DataElement after, ValueSetDiff vsDiff) {
		List<String> details = new ArrayList<>();
		if (before.getType() != after.getType()) {
			details.add("Type changed: " + code(before.getType() == null ? null : before.getType().code()) + ARROW
				+ code(after.getType() == null ? null : after.getType().code()));
		}
		if (!Objects.equals(before.getDescription(), after.getDescription())) details.add("Description changed");
		if (before.isNegation() != after.isNegation()) {
			details.add("Negation changed: " + before.isNegation() + ARROW + after.isNegation());
		}
		if (vsDiff != null) {
			if (vsDiff.isNameChanged()) details.add("Value set changed: " + code(vsDiff.getOldName()) + ARROW + code(vsDiff.getNewName()));
			if (vsDiff.isOidChanged()) details.add("Value set OID changed: " + code(vsDiff.getOldOid()) + ARROW + code(vsDiff.getNewOid()));
			if (vsDiff.getCodesAdded() > 0) details.add(vsDiff.getCodesAdded() + " codes added");
			if (vsDiff.getCodesRemoved() > 0) details.add(vsDiff.getCodesRemoved() + " codes removed");
		}
		if (!Objects.equals(before.getTiming(), after.getTiming())) {
			details.add("Timing changed: " + describe(before.getTiming(), t -> t.describe()) + ARROW + describe(after.getTiming(), t -> t.describe()));
		}
		if (!Objects.equals(before.getQuantity(), after.getQuantity())) {
			details.add("Quantity changed: " + describe(before.getQuantity(), q -> q.describe()) + ARROW + describe(after.getQuantity(), q -> q.describe()));
		}
		if (!Objects.equals(before.getThresholds(), after.getThresholds())) details.add("Thresholds changed");
		return details;
	}

	static ValueSetDiff valueSetDiff(ValueSetReference before, ValueSetReference after) {
		if (before == null && after == null) return null;
		if (before == null) {
			return new ValueSetDiff(ChangeKind.ADDED, null, after.getName(), null, after.getOid(), codeKeys(after).size(), 0);
		}
		if (after == null) {
			return new ValueSetDiff(ChangeKind.REMOVED, before.getName(), null, before.getOid(), null, 0, codeKeys(before).size());
		}
		Set<String> oldCodes = codeKeys(before);
		Set<String> newCodes = codeKeys(after);
		int codesAdded = (int) newCodes.stream().filter(c -> !oldCodes.contains(c)).count();
		int codesRemoved = (int) oldCodes.stream().filter(c -> !newCodes.contains(c)).count();
		boolean nameChanged = !Objects.equals(before.getName(), after.getName());
		boolean oidChanged = !Objects.equals(before.getOid(), after.getOid());
		if (!nameChanged && !oidChanged && codesAdded == 0 && codesRemoved == 0) return null;
		return new ValueSetDiff(ChangeKind.MODIFIED, before.getName(), after.getName(), before.getOid(), after.getOid(), codesAdded, codesRemoved);
	}

	private static Set<String> codeKeys(ValueSetReference valueSet) {
		return valueSet.getCodes().stream().map(CodeReference::key).collect(Collectors.toCollection(LinkedHashSet::new));
	}

	private static List<MetadataChange> compareMetadata(Measure before, Measure after) {
		Map<String, Function<Measure, Object>> fields = new LinkedHashMap<>();
		fields.put("id", Measure::getId);
		fields.put("title", Measure::getTitle);
		fields.put("version", Measure::getVersion);
		fields.put("steward", Measure::getSteward);
		fields.put("measureType", Measure::getMeasureType);
		fields.put("status", Measure::getStatus);
		fields.put("description", Measure::getDescription);
		fields.put("measurementPeriod", Measure::getMeasurementPeriod);

		List<MetadataChange> changes = new ArrayList<>();
		for (Map.Entry<String, Function<Measure, Object>> field : fields.entrySet()) {
			String oldValue = text(field.getValue().apply(before));
			String newValue = text(field.getValue().apply(after));
			if (!Objects.equals(oldValue, newValue)) changes.add(new MetadataChange(field.getKey(), oldValue, newValue));
		}
		return changes;
	}

	private static List<PopulationChange> comparePopulations(Measure before, Measure after) {
		Map<PopulationType, Population> oldPopulations = populationsByType(before);
		Map<PopulationType, Population> newPopulations = populationsByType(after);
		List<PopulationChange> changes = new ArrayList<>();
		for (PopulationType type : PopulationType.values()) {
			Population oldPopulation = oldPopulations.get(type);
			Population newPopulation = newPopulations.get(type);
			if (oldPopulation == null && newPopulation == null) continue;
			if (oldPopulation == null) {
				changes.add(new PopulationChange(type, ChangeKind.ADDED, null, newPopulation.getDescription(), List.of("Population added")));
			} else if (newPopulation == null) {
				changes.add(new PopulationChange(type, ChangeKind.REMOVED, oldPopulation.getDescription(), null, List.of("Population removed")));
			} else {
				List<String> details = new ArrayList<>();
				if (!Objects.equals(oldPopulation.getDescription(), newPopulation.getDescription())) details.add("Description changed");
				if (!Objects.equals(oldPopulation.getNarrative(), newPopulation.getNarrative())) details.add("Narrative changed");
				if (!elementIds(oldPopulation).equals(elementIds(newPopulation))) details.add("Criteria elements changed");
				if (!details.isEmpty()) {
					changes.add(new PopulationChange(type, ChangeKind.MODIFIED, oldPopulation.getDescription(), newPopulation.getDescription(), details));
				}
			}
		}
		return changes;
	}

	private static Map<String, DataElement> elementsById(Measure measure) {
		Map<String, DataElement> elements = new LinkedHashMap<>();
		for (DataElement element : measure.dataElements()) {
			if (element.getId() != null) elements.putIfAbsent(element.getId(), element);
		}
		return elements;
	}

	private static Map<PopulationType, Population> populationsByType(Measure measure) {
		Map<PopulationType, Population> populations = new EnumMap<>(PopulationType.class);
		for (Population population : measure.getPopulations()) {
			if (population.getType() != null) populations.putIfAbsent(population.getType(), population);
		}
		return populations;
	}

	private static Set<String> elementIds(Population population) {
		if (population.getCriteria() == null) return Set.of();
		return CriteriaTrees.dataElements(population.getCriteria()).stream()
			.map(DataElement::getId)
			.filter(Objects::nonNull)
			.collect(Collectors.toSet());
	}

	private static <T> String describe(T value, Function<T, String> describer) {
		return value == null ? "none" : describer.apply(value);
	}

	private static String text(Object value) {
		if (value == null) return null;
		String text = value.toString();
		return text.isEmpty() ? null : text;
	}

	private static String code(String value) {
		return value == null ? "none" : value;
	}

	private static String versionOf(Measure measure) {
		return StringUtils.defaultIfBlank(measure.getVersion(), "unknown");
	}
}
