package org.umsforge.codegen.service.cql;

import org.umsforge.model.ElementType;

import java.util.Optional;

/**
 * QI-Core resource a data element type is retrieved from, with its alias, status filter and timing attribute.
 */
enum CqlResource {
	CONDITION("Condition", "C", "C.clinicalStatus ~ QICoreCommon.\"active\"", "prevalencePeriod"),
	ENCOUNTER("Encounter", "E", "E.status = 'finished'", "period"),
	PROCEDURE("Procedure", "P", "P.status = 'completed'", "performed"),
	OBSERVATION("Observation", "O", "O.status in { 'final', 'amended', 'corrected' }\n        and O.value is not null", "effective"),
	MEDICATION_REQUEST("MedicationRequest", "M", "M.status in { 'active', 'completed' }", "authoredOn"),
	IMMUNIZATION("Immunization", "I", "I.status = 'completed'", "occurrence");

	private final String resourceType;
	private final String alias;
	private final String statusPredicate;
	private final String timingAttribute;

	CqlResource(String resourceType, String alias, String statusPredicate, String timingAttribute) {
		this.resourceType = resourceType;
		this.alias = alias;
		this.statusPredicate = statusPredicate;
		this.timingAttribute = timingAttribute;
	}

	static Optional<CqlResource> forType(ElementType type) {
		if (type == null) return Optional.empty();
		return switch (type) {
			case DIAGNOSIS -> Optional.of(CONDITION);
			case ENCOUNTER -> Optional.of(ENCOUNTER);
			case PROCEDURE -> Optional.of(PROCEDURE);
			case OBSERVATION, ASSESSMENT -> Optional.of(OBSERVATION);
			case MEDICATION -> Optional.of(MEDICATION_REQUEST);
			case IMMUNIZATION -> Optional.of(IMMUNIZATION);
			default -> Optional.empty();
		};
	}

	String resourceType() {
		return resourceType;
	}

	String alias() {
		return alias;
	}

	String statusPredicate() {
		return statusPredicate;
	}

	String timingPath() {
		return alias + "." + timingAttribute;
	}
}
