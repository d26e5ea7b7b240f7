package org.umsforge.model;

import org.junit.jupiter.api.Test;
import org.umsforge.codegen.service.OutputFormat;
import org.umsforge.codegen.service.override.ChangeType;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ModelEnumsTest {

	@Test
	void elementType_IsCaseInsensitive() {
		assertEquals(ElementType.OBSERVATION, ElementType.fromCode(" Observation "));
		assertEquals("observation", ElementType.OBSERVATION.code());
	}

	@Test
	void elementType_Unknown_Throws() {
		IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> ElementType.fromCode("lab"));
		assertEquals("Unsupported element type: lab", e.getMessage());
		assertThrows(IllegalArgumentException.class, () -> ElementType.fromCode(null));
	}

	@Test
	void gender_ExposesOntologyConcept() {
		assertEquals("FHIR Female", Gender.fromCode("FEMALE").conceptName());
		assertNull(Gender.ALL.conceptName());
		assertFalse(Gender.ALL.isRestrictive());
		assertTrue(Gender.MALE.isRestrictive());
	}

	@Test
	void populationType_AcceptsHyphenatedCodes() {
		PopulationType type = PopulationType.fromCode("denominator-exclusion");

		assertEquals(PopulationType.DENOMINATOR_EXCLUSION, type);
		assertEquals("Denominator Exclusion", type.display());
		assertEquals("DENOM_EXCLUSION", type.cteName());
	}

	@Test
	void comparator_AcceptsAlternateSpellings() {
		assertEquals(Comparator.NE, Comparator.fromCode("<>"));
		assertEquals(Comparator.EQ, Comparator.fromCode("=="));
		assertEquals(Comparator.GE, Comparator.fromCode("ge"));
		assertEquals(">=", Comparator.GE.symbol());
		assertThrows(IllegalArgumentException.class, () -> Comparator.fromCode("=>"));
	}

	@Test
	void periodUnit_AcceptsSingularAndLabelsByAmount() {
		assertEquals(PeriodUnit.MONTHS, PeriodUnit.fromCode("month"));
		assertEquals("year", PeriodUnit.YEARS.label(1));
		assertEquals("years", PeriodUnit.YEARS.label(2));
		assertEquals("WEEK", PeriodUnit.WEEKS.datePart());
	}

	@Test
	void timingWindow_NormalizesSeparators() {
		assertEquals(TimingWindow.BEFORE_END_OF, TimingWindow.fromCode("before end of"));
		assertEquals(TimingWindow.AFTER_START_OF, TimingWindow.fromCode("after-start-of"));
	}

	@Test
	void logicalOperator_IsCaseInsensitive() {
		assertEquals(LogicalOperator.NOT, LogicalOperator.fromCode("not"));
	}

	@Test
	void outputFormat_AcceptsShortSqlAliases() {
		assertEquals(OutputFormat.SYNAPSE_SQL, OutputFormat.fromCode("sql"));
		assertEquals(OutputFormat.SYNAPSE_SQL, OutputFormat.fromCode("Synapse"));
		assertEquals(OutputFormat.CQL, OutputFormat.fromCode("CQL"));
		assertEquals("--", OutputFormat.SYNAPSE_SQL.commentPrefix());
	}

	@Test
	void changeType_BlankIsOther() {
		assertEquals(ChangeType.OTHER, ChangeType.fromCode(null));
		assertEquals(ChangeType.OTHER, ChangeType.fromCode("  "));
		assertEquals(ChangeType.TIMING, ChangeType.fromCode("Timing"));
		assertThrows(IllegalArgumentException.class, () -> ChangeType.fromCode("cosmetic"));
	}
}
