package org.umsforge.codegen.service.cql;

import org.apache.commons.lang3.StringUtils;
import org.umsforge.codegen.service.utils.CodeText;
import org.umsforge.codegen.service.utils.ComponentMarkers;
import org.umsforge.model.CriteriaNode;
import org.umsforge.model.CriteriaVisitor;
import org.umsforge.model.DataElement;
import org.umsforge.model.ElementType;
import org.umsforge.model.LogicalClause;
import org.umsforge.model.LogicalOperator;
import org.umsforge.model.QuantityRequirement;
import org.umsforge.model.ThresholdRange;
import org.umsforge.model.TimingConstraint;
import org.umsforge.model.TimingWindow;
import org.umsforge.model.ValueSetReference;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Recursive, order preserving translation of a criteria tree into a CQL boolean expression.
 */
class CqlExpressionBuilder implements CriteriaVisitor<CqlExpression> {
	static final String MEASUREMENT_PERIOD = "\"Measurement Period\"";
	private static final String AND_JOIN = "\n    and ";
	private static final String OR_JOIN = "\n    or ";
	private static final String CONDITION_INDENT = "\n        ";

	private final Map<String, ValueSetReference> valueSetsById;
	private final boolean ageHelperDefined;
	private final List<String> warnings;

	CqlExpressionBuilder(Map<String, ValueSetReference> valueSetsById, boolean ageHelperDefined, List<String> warnings) {
		this.valueSetsById = valueSetsById;
		this.ageHelperDefined = ageHelperDefined;
		this.warnings = warnings;
	}

	CqlExpression translate(LogicalClause root) {
		if (root == null) return CqlExpression.neutral(new ArrayList<>());
		return root.accept(this);
	}

	@Override
	public CqlExpression visitClause(LogicalClause clause) {
		List<CriteriaNode> children = clause.getChildren();
		if (children.isEmpty()) return CqlExpression.neutral(new ArrayList<>());

		if (clause.getOperator() == LogicalOperator.NOT) {
			if (children.size() > 1) {
				warnings.add(String.format("NOT clause \"%s\" has %d children; only the first one is negated",
					StringUtils.defaultIfBlank(clause.getDescription(), clause.getId()), children.size()));
			}
			CqlExpression operand = children.get(0).accept(this);
			// a neutral operand stays neutral
			if (operand.isNeutral()) return CqlExpression.neutral(operand.getNotes());
			return CqlExpression.clause("not (" + operand.getText() + ")", operand.getNotes());
		}

		List<String> notes = new ArrayList<>();
		List<String> parts = new ArrayList<>();
		for (CriteriaNode child : children) {
			CqlExpression expression = child.accept(this);
			notes.addAll(expression.getNotes());
			if (expression.isNeutral()) continue;
			parts.add(expression.isClause() ? "(" + expression.getText() + ")" : expression.getText());
		}
		if (parts.isEmpty()) return CqlExpression.neutral(notes);
		String join = clause.getOperator() == LogicalOperator.OR ? OR_JOIN : AND_JOIN;
		return CqlExpression.clause(String.join(join, parts), notes);
	}

	@Override
	public CqlExpression visitElement(DataElement element) {
		CqlExpression expression = element.getType() == ElementType.DEMOGRAPHIC
			? translateDemographic(element)
			: translateClinical(element);
		if (expression.isNeutral()) return expression;

		String text = element.isNegation() ? "not (" + expression.getText() + ")" : expression.getText();
		if (StringUtils.isNotBlank(element.getId())) {
			text = ComponentMarkers.wrap(element.getId(), text);
		}
		return CqlExpression.of(text);
	}

	private CqlExpression translateClinical(DataElement element) {
		Optional<CqlResource> resource = CqlResource.forType(element.getType());
		String label = CodeText.commentSafe(element.componentLabel());
		if (resource.isEmpty()) {
			String type = element.getType() == null ? "unknown" : element.getType().code();
			warnings.add(String.format("Unsupported criterion type \"%s\" for \"%s\"", type, label));
			return CqlExpression.placeholder(String.format("/* WARNING: Unsupported criterion type \"%s\" for \"%s\" */", type, label));
		}

		String valueSetName = resolveValueSetName(element);
		if (valueSetName == null) {
			warnings.add(String.format("No value set defined for \"%s\"", label));
			return CqlExpression.placeholder(String.format("/* WARNING: No value set defined for \"%s\" */", label));
		}

		CqlResource r = resource.get();
		StringBuilder retrieve = new StringBuilder();
		retrieve.append('[').append(r.resourceType()).append(": \"").append(CodeText.escapeCqlIdentifier(valueSetName)).append("\"] ").append(r.alias());
		retrieve.append("\n      where ").append(r.statusPredicate());
		retrieve.append(CONDITION_INDENT).append(timingClause(r, element));
		if (r == CqlResource.OBSERVATION) retrieve.append(valueThresholds(element.getThresholds()));

		QuantityRequirement quantity = element.getQuantity();
		if (quantity != null && quantity.isComparison()) {
			return CqlExpression.of(String.format("Count(%s) %s %d", retrieve, quantity.getComparator().symbol(), quantity.getValue()));
		}
		if (quantity != null && quantity.isRange()) {
			String max = quantity.getMax() == null ? "null" : String.valueOf(quantity.getMax());
			int min = quantity.getMin() == null ? 0 : quantity.getMin();
			return CqlExpression.of(String.format("Count(%s) in Interval[%d, %s]", retrieve, min, max));
		}
		return CqlExpression.of("exists (" + retrieve + ")");
	}

	private CqlExpression translateDemographic(DataElement element) {
		if (element.getGender() != null && element.getGender().isRestrictive()) {
			return CqlExpression.of("Patient.gender = '" + element.getGender().code() + "'");
		}
		ThresholdRange thresholds = element.getThresholds();
		if (thresholds != null && thresholds.hasAge()) {
			return CqlExpression.of(String.format("AgeInYearsAt(date from end of %s) in Interval[%d, %d]",
				MEASUREMENT_PERIOD,
				thresholds.getAgeMin() == null ? 0 : thresholds.getAgeMin(),
				thresholds.getAgeMax() == null ? 999 : thresholds.getAgeMax()));
		}
		if (ageHelperDefined) return CqlExpression.of("\"Patient Age Valid\"");

		String label = CodeText.commentSafe(element.componentLabel());
		warnings.add(String.format("Demographic criterion \"%s\" has no gender or age bounds", label));
		return CqlExpression.placeholder(String.format("/* WARNING: Demographic criterion \"%s\" has no gender or age bounds */", label));
	}

	private String timingClause(CqlResource resource, DataElement element) {
		TimingConstraint timing = element.getTiming();
		String during = "and " + resource.timingPath() + " during " + MEASUREMENT_PERIOD;
		if (timing == null || timing.getWindow() == null || timing.getWindow() == TimingWindow.DURING) return during;
		if (!timing.hasAmount()) {
			warnings.add(String.format("Timing window \"%s\" on \"%s\" has no amount; the measurement period is used",
				timing.getWindow().code(), CodeText.commentSafe(element.componentLabel())));
			return during;
		}
		int amount = timing.getValue();
		String unit = timing.getUnit().label(amount);
		return switch (timing.getWindow()) {
			case WITHIN, BEFORE_END_OF -> String.format("and %s ends %d %s or less before end of %s", resource.timingPath(), amount, unit, MEASUREMENT_PERIOD);
			case AFTER_START_OF -> String.format("and %s starts %d %s or less after start of %s", resource.timingPath(), amount, unit, MEASUREMENT_PERIOD);
			case AGE_BASED -> String.format("and %s starts before Patient.birthDate + %d %s", resource.timingPath(), amount, unit);
			default -> during;
		};
	}

	private static String valueThresholds(ThresholdRange thresholds) {
		if (thresholds == null || !thresholds.hasValue()) return "";
		StringBuilder sb = new StringBuilder();
		if (thresholds.getValueMin() != null) {
			sb.append(CONDITION_INDENT).append("and (O.value as Quantity).value >= ").append(thresholds.getValueMin().toPlainString());
		}
		if (thresholds.getValueMax() != null) {
			sb.append(CONDITION_INDENT).append("and (O.value as Quantity).value <= ").append(thresholds.getValueMax().toPlainString());
		}
		return sb.toString();
	}

	/**
	 * Name of the element's value set. A reference carrying only an id is resolved against the measure value sets.
	 * Returns {@code null} when the value set has no OID or URL, since its declaration is commented out.
	 */
	private String resolveValueSetName(DataElement element) {
		ValueSetReference reference = element.getValueSet();
		if (reference == null) return null;
		boolean incomplete = StringUtils.isBlank(reference.getName()) || reference.resolveUrl() == null;
		if (incomplete && reference.getId() != null && valueSetsById.containsKey(reference.getId())) {
			reference = valueSetsById.get(reference.getId());
		}
		if (reference.resolveUrl() == null) return null;
		String name = reference.displayName();
		return StringUtils.isBlank(name) ? null : name;
	}
}
