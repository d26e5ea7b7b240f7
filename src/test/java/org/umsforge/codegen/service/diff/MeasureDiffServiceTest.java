package org.umsforge.codegen.service.diff;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.umsforge.codegen.service.MeasureFixtures;
import org.umsforge.codegen.service.cql.CqlBoilerplateRegistry;
import org.umsforge.codegen.service.cql.CqlGenerator;
import org.umsforge.model.CodeReference;
import org.umsforge.model.ElementType;
import org.umsforge.model.Measure;
import org.umsforge.model.PeriodUnit;
import org.umsforge.model.PopulationType;
import org.umsforge.model.TimingConstraint;
import org.umsforge.model.TimingWindow;
import org.umsforge.model.ValueSetReference;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.umsforge.codegen.service.MeasureFixtures.element;
import static org.umsforge.codegen.service.MeasureFixtures.valueSet;

class MeasureDiffServiceTest {

	private MeasureDiffService service;
	private Measure before;
	private Measure after;

	@BeforeEach
	void setUp() {
		service = new MeasureDiffService(new CqlGenerator(MeasureFixtures.FIXED_CLOCK, CqlBoilerplateRegistry.defaultRegistry()));
		before = MeasureFixtures.diabetesEyeExam();
		after = MeasureFixtures.diabetesEyeExam();
	}

	@Test
	void compare_SameContent_HasNoChanges() {
		MeasureDiff diff = service.compare(before, after);

		assertEquals(0, diff.getSummary().getTotalChanges());
		assertTrue(diff.getElementChanges().isEmpty());
		assertTrue(diff.getPopulationChanges().isEmpty());
		assertTrue(diff.getMetadataChanges().isEmpty());
		assertNull(diff.getCodeDiff());
	}

	@Test
	void compare_AddedElement_IsReportedWithItsPopulation() {
		after.findPopulation(PopulationType.NUMERATOR).orElseThrow().getCriteria()
			.addChild(element("e-dilated", ElementType.PROCEDURE, "Dilated eye exam", valueSet("vs-dilated", "Dilated Exam", "1.2.3.4")));

		MeasureDiff diff = service.compare(before, after);

		assertEquals(1, diff.getElementChanges().size());
		ElementChange change = diff.getElementChanges().get(0);
		assertEquals("e-dilated", change.getElementId());
		assertEquals(ChangeKind.ADDED, change.getKind());
		assertEquals(List.of("Element added"), change.getChanges());
		assertNull(change.getOldElement());
		assertEquals(ChangeKind.ADDED, change.getValueSetDiff().getKind());

		DiffSummary summary = diff.getSummary();
		assertEquals(1, summary.getElementsAdded());
		assertEquals(1, summary.getValueSetsChanged());
		assertEquals(1, summary.getPopulationsChanged());
		assertEquals(2, summary.getTotalChanges());
		assertEquals(List.of("Criteria elements changed"), diff.getPopulationChanges().get(0).getChanges());
	}

	@Test
	void compare_ValueSetCodes_AreCountedBothWays() {
		ValueSetReference expanded = valueSet("vs-diabetes", "Diabetes", "2.16.840.1.113883.3.464.1003.103.12.1001")
			.addCode(new CodeReference("E11.65", "http://hl7.org/fhir/sid/icd-10-cm", "Type 2 diabetes with hyperglycemia"))
			.addCode(new CodeReference("E10.9", "http://hl7.org/fhir/sid/icd-10-cm", "Type 1 diabetes"));
		after.findDataElement("e-diabetes").orElseThrow().setValueSet(expanded);

		MeasureDiff diff = service.compare(before, after);

		ElementChange change = diff.getElementChanges().get(0);
		assertEquals(ChangeKind.MODIFIED, change.getKind());
		assertEquals(List.of("2 codes added", "1 codes removed"), change.getChanges());
		assertFalse(change.getValueSetDiff().isNameChanged());
		assertFalse(change.getValueSetDiff().isOidChanged());
		assertEquals(1, diff.getSummary().getElementsModified());
		assertEquals(1, diff.getSummary().getTotalChanges());
	}

	@Test
	void compare_TimingAndNegation_AreDescribed() {
		after.findDataElement("e-retinal").orElseThrow()
			.setTiming(new TimingConstraint(TimingWindow.WITHIN, 2, PeriodUnit.YEARS))
			.setNegation(true);

		ElementChange change = service.compare(before, after).getElementChanges().get(0);

		assertEquals(List.of("Negation changed: false → true", "Timing changed: within 1 year → within 2 years"), change.getChanges());
	}

	@Test
	void compare_TypeAndOid_AreDescribed() {
		after.findDataElement("e-hba1c").orElseThrow()
			.setType(ElementType.ASSESSMENT)
			.setValueSet(valueSet("vs-hba1c", "HbA1c Laboratory Test", "9.9.9"));

		List<String> changes = service.compare(before, after).getElementChanges().get(0).getChanges();

		assertEquals("Type changed: observation → assessment", changes.get(0));
		assertEquals("Value set OID changed: 2.16.840.1.113883.3.464.1003.198.12.1013 → 9.9.9", changes.get(1));
	}

	@Test
	void compare_Metadata_ListsChangedFieldsInOrder() {
		after.setTitle("Diabetes: Eye Exam (2026)").setVersion("3.0.0").setStatus("active");

		MeasureDiff diff = service.compare(before, after);

		List<MetadataChange> changes = diff.getMetadataChanges();
		assertEquals(3, changes.size());
		assertEquals("title", changes.get(0).getField());
		assertEquals("version", changes.get(1).getField());
		assertEquals(ChangeKind.MODIFIED, changes.get(1).getKind());
		assertEquals("status", changes.get(2).getField());
		assertEquals(ChangeKind.ADDED, changes.get(2).getKind());
		assertEquals("2.1.0", diff.getOldVersion());
		assertEquals("3.0.0", diff.getNewVersion());
	}

	@Test
	void compare_RemovedPopulation_RemovesItsElements() {
		after.getPopulations().removeIf(p -> p.getType() == PopulationType.DENOMINATOR_EXCLUSION);

		MeasureDiff diff = service.compare(before, after);

		PopulationChange population = diff.getPopulationChanges().get(0);
		assertEquals(PopulationType.DENOMINATOR_EXCLUSION, population.getType());
		assertEquals(ChangeKind.REMOVED, population.getKind());
		assertEquals(List.of("Population removed"), population.getChanges());
		assertEquals(ChangeKind.REMOVED, diff.getElementChanges().get(0).getKind());
		assertEquals(2, diff.getSummary().getTotalChanges());
	}

	@Test
	void compare_IncludeCode_DiffsGeneratedLibraries() {
		after.setVersion("3.0.0");

		List<LineChange> codeDiff = service.compare(before, after, true).getCodeDiff();

		assertNotNull(codeDiff);
		assertTrue(codeDiff.contains(new LineChange(LineChange.Type.REMOVED, "library CMS131TEST version '2.1.0'")));
		assertTrue(codeDiff.contains(new LineChange(LineChange.Type.ADDED, "library CMS131TEST version '3.0.0'")));
		assertTrue(codeDiff.stream().anyMatch(c -> c.getType() == LineChange.Type.UNCHANGED));
	}

	@Test
	void summarize_RendersHeaderCountsAndDetails() {
		after.setVersion("3.0.0");
		after.findDataElement("e-retinal").orElseThrow().setTiming(new TimingConstraint(TimingWindow.WITHIN, 2, PeriodUnit.YEARS));

		String report = service.summarize(service.compare(before, after));

		assertTrue(report.startsWith("Measure Comparison: CMS131-TEST (2.1.0) → CMS131-TEST (3.0.0)\n\nSummary:\n  Total Changes: 2\n"));
		assertTrue(report.contains("Metadata Changes:\n  version: \"2.1.0\" → \"3.0.0\""));
		assertTrue(report.contains("Element Changes:\n  [MODIFIED] Retinal exam\n    - Timing changed: within 1 year → within 2 years"));
		assertFalse(report.contains("Population Changes:"));
	}

	@Test
	void valueSetDiff_IdenticalReferences_IsNull() {
		ValueSetReference vs = valueSet("vs", "Name", "1.2");

		assertNull(MeasureDiffService.valueSetDiff(vs, valueSet("vs", "Name", "1.2")));
		assertNull(MeasureDiffService.valueSetDiff(null, null));
	}

	@Test
	void compare_NullMeasure_IsRejected() {
		assertThrows(NullPointerException.class, () -> service.compare(null, after));
	}
}
