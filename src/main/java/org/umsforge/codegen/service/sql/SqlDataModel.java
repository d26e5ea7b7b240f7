package org.umsforge.codegen.service.sql;

import org.umsforge.model.ElementType;

import java.util.Optional;

/**
 * HDI fact tables backing each clinical data model.
 */
public enum SqlDataModel {
	CONDITION("COND", "Condition", "ph_f_condition", "C", "condition_id", "condition_code", "effective_date", null, "HEALTHE INTENT Conditions"),
	PROCEDURE("PROC", "Procedure", "ph_f_procedure", "PR", "procedure_id", "procedure_code", "performed_date", null, "HEALTHE INTENT Procedures"),
	MEDICATION("MED", "Medication", "ph_f_medication", "M", "medication_id", "medication_code", "effective_date", "end_date", "HEALTHE INTENT Medications"),
	RESULT("RESULT", "Result", "ph_f_result", "R", "result_id", "result_code", "service_date", null, "HEALTHE INTENT Results"),
	IMMUNIZATION("IMMUN", "Immunization", "ph_f_immunization", "I", "immunization_id", "immunization_code", "administration_date", null, "HEALTHE INTENT Immunizations"),
	ENCOUNTER("ENC", "Encounter", "ph_f_encounter", "E", "encounter_id", "encounter_type_code", "service_date", "discharge_date", "HEALTHE INTENT Encounters"),
	DEMOGRAPHICS("DEMOG", "Demographics", "DEMOG", "D", "empi_id", null, "birth_date", null, "HEALTHE INTENT Demographics");

	private final String predicateTag;
	private final String label;
	private final String table;
	private final String alias;
	private final String idColumn;
	private final String codeColumn;
	private final String dateColumn;
	private final String endDateColumn;
	private final String ontologyContext;

	SqlDataModel(String predicateTag, String label, String table, String alias, String idColumn, String codeColumn,
					 String dateColumn, String endDateColumn, String ontologyContext) {
		this.predicateTag = predicateTag;
		this.label = label;
		this.table = table;
		this.alias = alias;
		this.idColumn = idColumn;
		this.codeColumn = codeColumn;
		this.dateColumn = dateColumn;
		this.endDateColumn = endDateColumn;
		this.ontologyContext = ontologyContext;
	}

	public static Optional<SqlDataModel> forType(ElementType type) {
		if (type == null) return Optional.empty();
		return switch (type) {
			case DIAGNOSIS -> Optional.of(CONDITION);
			case PROCEDURE -> Optional.of(PROCEDURE);
			case MEDICATION -> Optional.of(MEDICATION);
			case OBSERVATION, ASSESSMENT -> Optional.of(RESULT);
			case IMMUNIZATION -> Optional.of(IMMUNIZATION);
			case ENCOUNTER -> Optional.of(ENCOUNTER);
			case DEMOGRAPHIC -> Optional.of(DEMOGRAPHICS);
			default -> Optional.empty();
		};
	}

	public String predicateTag() {
		return predicateTag;
	}

	/**
	 * Value of the {@code data_model} column.
	 */
	public String label() {
		return label;
	}

	public String table() {
		return table;
	}

	public String alias() {
		return alias;
	}

	public String idColumn() {
		return idColumn;
	}

	public String codeColumn() {
		return codeColumn;
	}

	public String dateColumn() {
		return dateColumn;
	}

	public String endDateColumn() {
		return endDateColumn;
	}

	public String ontologyContext() {
		return ontologyContext;
	}
}
