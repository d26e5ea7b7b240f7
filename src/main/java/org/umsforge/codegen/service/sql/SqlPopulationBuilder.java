package org.umsforge.codegen.service.sql;

import org.apache.commons.lang3.StringUtils;
import org.umsforge.codegen.service.utils.CodeText;
import org.umsforge.codegen.service.utils.ComponentMarkers;
import org.umsforge.model.CriteriaNode;
import org.umsforge.model.CriteriaVisitor;
import org.umsforge.model.DataElement;
import org.umsforge.model.Gender;
import org.umsforge.model.GlobalConstraints;
import org.umsforge.model.LogicalClause;
import org.umsforge.model.LogicalOperator;
import org.umsforge.model.MeasurementPeriod;
import org.umsforge.model.QuantityRequirement;
import org.umsforge.model.ThresholdRange;
import org.umsforge.model.TimingConstraint;
import org.umsforge.model.TimingWindow;
import org.umsforge.model.ValueSetReference;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Walks population trees, emitting one {@code PRED_*} CTE per translatable leaf and combining them with set
 * operators. One instance serves a single generation run.
 */
class SqlPopulationBuilder implements CriteriaVisitor<SqlSet> {
	private static final String CONDITION_JOIN = "\n    and ";

	private final SqlGenerationConfig config;
	private final String populationId;
	private final MeasurementPeriod period;
	private final Map<String, ValueSetReference> valueSetsById;
	private final List<String> warnings;
	private final List<String> predicates = new ArrayList<>();
	private final Set<SqlDataModel> modelsUsed = new LinkedHashSet<>();
	private int predicateCounter;
	private int derivedCounter;

	SqlPopulationBuilder(SqlGenerationConfig config, String populationId, MeasurementPeriod period,
								Map<String, ValueSetReference> valueSetsById, List<String> warnings) {
		this.config = config;
		this.populationId = populationId;
		this.period = period;
		this.valueSetsById = valueSetsById;
		this.warnings = warnings;
	}

	SqlSet translate(LogicalClause root) {
		if (root == null) return SqlSet.neutral();
		return root.accept(this);
	}

	/**
	 * Predicate for the measure-wide age and gender constraints, or {@code null} when there are none.
	 */
	String globalDemographics(GlobalConstraints constraints) {
		if (constraints == null || (!constraints.hasAgeRange() && !constraints.hasRestrictiveGender())) return null;
		List<String> conditions = new ArrayList<>();
		if (constraints.hasAgeRange()) {
			addAgeConditions(conditions, constraints.getAgeRange().getMin(), constraints.getAgeRange().getMax());
		}
		if (constraints.hasRestrictiveGender()) addGenderCondition(conditions, constraints.getGender());
		return demographicPredicate(null, "Global age and gender constraints", conditions);
	}

	@Override
	public SqlSet visitClause(LogicalClause clause) {
		List<CriteriaNode> children = clause.getChildren();
		if (children.isEmpty()) return SqlSet.neutral();

		if (clause.getOperator() == LogicalOperator.NOT) {
			if (children.size() > 1) {
				warnings.add(String.format("NOT clause \"%s\" has %d children; only the first one is negated",
					StringUtils.defaultIfBlank(clause.getDescription(), clause.getId()), children.size()));
			}
			SqlSet operand = children.get(0).accept(this);
			if (operand.isNeutral()) return SqlSet.neutral();
			return complement(operand);
		}

		List<String> operands = new ArrayList<>();
		SqlSet single = null;
		for (CriteriaNode child : children) {
			SqlSet set = child.accept(this);
			if (set.isNeutral()) continue;
			single = set;
			operands.add(set.asOperand(nextDerivedAlias()));
		}
		if (operands.isEmpty()) return SqlSet.neutral();
		if (operands.size() == 1) return single;
		String operator = clause.getOperator() == LogicalOperator.OR ? "\n  union\n  " : "\n  intersect\n  ";
		return SqlSet.compound(String.join(operator, operands));
	}

	@Override
	public SqlSet visitElement(DataElement element) {
		String predicate = predicateFor(element);
		if (predicate == null) return SqlSet.neutral();
		SqlSet set = SqlSet.of("select distinct empi_id from " + predicate);
		return element.isNegation() ? complement(set) : set;
	}

	List<String> getPredicates() {
		return Collections.unmodifiableList(predicates);
	}

	Set<SqlDataModel> getModelsUsed() {
		return Collections.unmodifiableSet(modelsUsed);
	}

	boolean hasClinicalPredicates() {
		return modelsUsed.stream().anyMatch(m -> m != SqlDataModel.DEMOGRAPHICS);
	}

	String nextDerivedAlias() {
		return "G" + (++derivedCounter);
	}

	private SqlSet complement(SqlSet operand) {
		return SqlSet.compound("select empi_id from DEMOG\n  except\n  " + operand.asOperand(nextDerivedAlias()));
	}

	private String predicateFor(DataElement element) {
		String label = CodeText.commentSafe(element.componentLabel());
		Optional<SqlDataModel> model = SqlDataModel.forType(element.getType());
		if (model.isEmpty()) {
			String type = element.getType() == null ? "unknown" : element.getType().code();
			warnings.add(String.format("Unsupported criterion type \"%s\" for \"%s\"; no HDI table, treated as always true", type, label));
			return null;
		}
		if (model.get() == SqlDataModel.DEMOGRAPHICS) return elementDemographics(element, label);

		String oid = resolveOid(element);
		if (oid == null) {
			warnings.add(String.format("No value set defined for \"%s\"; criterion treated as always true", label));
			return null;
		}

		SqlDataModel m = model.get();
		String a = m.alias();
		List<String> conditions = new ArrayList<>(populationConditions(a));
		conditions.add(SqlTemplates.valueSetFilter(oid, a, m.codeColumn()));
		conditions.addAll(timingConditions(m, element));
		if (m == SqlDataModel.RESULT) addValueThresholds(conditions, element.getThresholds());

		QuantityRequirement quantity = element.getQuantity();
		boolean aggregated = quantity != null && (quantity.isComparison() || quantity.isRange());
		StringBuilder body = new StringBuilder();
		body.append(aggregated ? "  select\n" : "  select distinct\n");
		body.append("    ").append(a).append(".population_id\n");
		body.append("    , ").append(a).append(".empi_id\n");
		body.append("    , '").append(m.label()).append("' as data_model\n");
		String endColumn = m.endDateColumn() == null ? null : a + "." + m.endDateColumn();
		if (aggregated) {
			body.append("    , max(").append(a).append('.').append(m.idColumn()).append(") as identifier\n");
			body.append("    , min(").append(a).append('.').append(m.dateColumn()).append(") as clinical_start_date\n");
			body.append("    , max(").append(endColumn == null ? a + "." + m.dateColumn() : endColumn).append(") as clinical_end_date\n");
		} else {
			body.append("    , ").append(a).append('.').append(m.idColumn()).append(" as identifier\n");
			body.append("    , ").append(a).append('.').append(m.dateColumn()).append(" as clinical_start_date\n");
			body.append("    , ").append(endColumn == null ? "null" : endColumn).append(" as clinical_end_date\n");
		}
		body.append("    , '").append(CodeText.escapeSql(CodeText.singleLine(element.componentLabel()))).append("' as description\n");
		body.append("  from ").append(m.table()).append(' ').append(a).append('\n');
		body.append("  where\n    ").append(String.join(CONDITION_JOIN, conditions));
		if (aggregated) {
			String count = "count(distinct " + a + "." + m.idColumn() + ")";
			body.append("\n  group by ").append(a).append(".population_id, ").append(a).append(".empi_id\n");
			body.append("  having ").append(havingClause(count, quantity));
		}
		return register(m, element.getId(), label, body.toString());
	}

	private String elementDemographics(DataElement element, String label) {
		List<String> conditions = new ArrayList<>();
		ThresholdRange thresholds = element.getThresholds();
		if (thresholds != null && thresholds.hasAge()) addAgeConditions(conditions, thresholds.getAgeMin(), thresholds.getAgeMax());
		if (element.getGender() != null && element.getGender().isRestrictive()) addGenderCondition(conditions, element.getGender());
		if (conditions.isEmpty()) {
			warnings.add(String.format("Demographic criterion \"%s\" has no gender or age bounds; treated as always true", label));
			return null;
		}
		return demographicPredicate(element.getId(), element.componentLabel(), conditions);
	}

	private String demographicPredicate(String componentId, String description, List<String> criteria) {
		SqlDataModel m = SqlDataModel.DEMOGRAPHICS;
		List<String> conditions = new ArrayList<>(populationConditions(m.alias()));
		conditions.addAll(criteria);
		String body = "  select distinct\n"
			+ "    D.population_id\n"
			+ "    , D.empi_id\n"
			+ "    , '" + m.label() + "' as data_model\n"
			+ "    , D.empi_id as identifier\n"
			+ "    , D.birth_date as clinical_start_date\n"
			+ "    , null as clinical_end_date\n"
			+ "    , '" + CodeText.escapeSql(CodeText.singleLine(description)) + "' as description\n"
			+ "  from DEMOG D\n"
			+ "  where\n    " + String.join(CONDITION_JOIN, conditions);
		return register(m, componentId, CodeText.commentSafe(description), body);
	}

	private String register(SqlDataModel model, String componentId, String label, String body) {
		String name = "PRED_" + model.predicateTag() + "_" + (++predicateCounter);
		modelsUsed.add(model);
		StringBuilder cte = new StringBuilder();
		if (config.isIncludeComments()) cte.append("-- ").append(label).append('\n');
		boolean marked = StringUtils.isNotBlank(componentId);
		if (marked) cte.append(ComponentMarkers.start(componentId)).append('\n');
		cte.append(name).append(" as (\n").append(body).append("\n)");
		if (marked) cte.append('\n').append(ComponentMarkers.end(componentId));
		predicates.add(cte.toString());
		return name;
	}

	private List<String> populationConditions(String alias) {
		List<String> conditions = new ArrayList<>();
		conditions.add(alias + ".population_id = '" + CodeText.escapeSql(populationId) + "'");
		if (config.isExcludeSnapshotsAndArchives()) {
			conditions.add(alias + ".population_id not like '%SNAPSHOT%'");
			conditions.add(alias + ".population_id not like '%ARCHIVE%'");
		}
		return conditions;
	}

	private List<String> timingConditions(SqlDataModel model, DataElement element) {
		String column = model.alias() + "." + model.dateColumn();
		String start = "'" + period.getStart() + "'";
		String end = "'" + period.getEnd() + "'";
		List<String> during = List.of(column + " >= " + start, column + " <= " + end);

		TimingConstraint timing = element.getTiming();
		if (timing == null || timing.getWindow() == null || timing.getWindow() == TimingWindow.DURING) return during;
		if (!timing.hasAmount()) {
			warnings.add(String.format("Timing window \"%s\" on \"%s\" has no amount; the measurement period is used",
				timing.getWindow().code(), CodeText.commentSafe(element.componentLabel())));
			return during;
		}
		String part = timing.getUnit().datePart();
		int amount = timing.getValue();
		return switch (timing.getWindow()) {
			case WITHIN, BEFORE_END_OF -> List.of(
				String.format("%s >= DATEADD(%s, -%d, %s)", column, part, amount, end),
				column + " <= " + end);
			case AFTER_START_OF -> List.of(
				column + " >= " + start,
				String.format("%s <= DATEADD(%s, %d, %s)", column, part, amount, start));
			case AGE_BASED -> List.of(String.format("exists (\n"
				+ "      select 1 from DEMOG DB\n"
				+ "      where DB.empi_id = %s.empi_id\n"
				+ "        and %s < DATEADD(%s, %d, DB.birth_date)\n"
				+ "    )", model.alias(), column, part, amount));
			default -> during;
		};
	}

	private static void addValueThresholds(List<String> conditions, ThresholdRange thresholds) {
		if (thresholds == null || !thresholds.hasValue()) return;
		if (thresholds.getValueMin() != null && thresholds.getValueMax() != null) {
			conditions.add(String.format("R.numeric_value between %s and %s",
				thresholds.getValueMin().toPlainString(), thresholds.getValueMax().toPlainString()));
		} else if (thresholds.getValueMin() != null) {
			conditions.add("R.numeric_value >= " + thresholds.getValueMin().toPlainString());
		} else {
			conditions.add("R.numeric_value <= " + thresholds.getValueMax().toPlainString());
		}
	}

	private static void addAgeConditions(List<String> conditions, Integer min, Integer max) {
		if (min != null) conditions.add("D.age_in_years >= " + min);
		if (max != null) conditions.add("D.age_in_years <= " + max);
	}

	private static void addGenderCondition(List<String> conditions, Gender gender) {
		conditions.add("D.gender_concept_name in ('" + gender.conceptName() + "')");
	}

	private static String havingClause(String count, QuantityRequirement quantity) {
		if (quantity.isComparison()) {
			String symbol = quantity.getComparator().symbol();
			return count + " " + ("!=".equals(symbol) ? "<>" : symbol) + " " + quantity.getValue();
		}
		int min = quantity.getMin() == null ? 0 : quantity.getMin();
		if (quantity.getMax() == null) return count + " >= " + min;
		return count + " between " + min + " and " + quantity.getMax();
	}

	private String resolveOid(DataElement element) {
		ValueSetReference reference = element.getValueSet();
		if (reference == null) return null;
		if (reference.resolveOid() == null && reference.getId() != null && valueSetsById.containsKey(reference.getId())) {
			reference = valueSetsById.get(reference.getId());
		}
		return reference.resolveOid();
	}
}
