package org.umsforge.codegen.service;

import org.umsforge.model.AgeRange;
import org.umsforge.model.CodeReference;
import org.umsforge.model.DataElement;
import org.umsforge.model.ElementType;
import org.umsforge.model.GlobalConstraints;
import org.umsforge.model.LogicalClause;
import org.umsforge.model.Measure;
import org.umsforge.model.MeasurementPeriod;
import org.umsforge.model.PeriodUnit;
import org.umsforge.model.Population;
import org.umsforge.model.PopulationType;
import org.umsforge.model.ThresholdRange;
import org.umsforge.model.TimingConstraint;
import org.umsforge.model.TimingWindow;
import org.umsforge.model.ValueSetReference;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

/**
 * Measures shared by the generator, override and diff tests.
 */
public final class MeasureFixtures {
	public static final Clock FIXED_CLOCK = Clock.fixed(Instant.parse("2025-03-01T10:15:30Z"), ZoneOffset.UTC);

	private MeasureFixtures() {
	}

	public static ValueSetReference valueSet(String id, String name, String oid) {
		return new ValueSetReference().setId(id).setName(name).setOid(oid);
	}

	public static DataElement element(String id, ElementType type, String description, ValueSetReference valueSet) {
		return new DataElement(id, type, description).setValueSet(valueSet);
	}

	/**
	 * Diabetes eye exam measure: age 18 to 75, an office visit and a diabetes diagnosis in the initial population,
	 * enucleation as exclusion, and a retinal exam or a controlled HbA1c in the numerator.
	 */
	public static Measure diabetesEyeExam() {
		ValueSetReference office = valueSet("vs-office", "Office Visit", "2.16.840.1.113883.3.464.1003.101.12.1001");
		ValueSetReference diabetes = valueSet("vs-diabetes", "Diabetes", "2.16.840.1.113883.3.464.1003.103.12.1001")
			.addCode(new CodeReference("E11.9", "http://hl7.org/fhir/sid/icd-10-cm", "Type 2 diabetes"));
		ValueSetReference enucleation = valueSet("vs-enucleation", "Bilateral Enucleation", "2.16.840.1.113883.3.526.3.1481");
		ValueSetReference retinal = valueSet("vs-retinal", "Retinal or Dilated Eye Exam", "2.16.840.1.113883.3.526.3.1283");
		ValueSetReference hba1c = valueSet("vs-hba1c", "HbA1c Laboratory Test", "2.16.840.1.113883.3.464.1003.198.12.1013");

		Measure measure = new Measure()
			.setId("CMS131-TEST")
			.setTitle("Diabetes: Eye Exam")
			.setVersion("2.1.0")
			.setSteward("NCQA")
			.setMeasureType("process")
			.setDescription("Percentage of patients 18-75 years of age with diabetes who had a retinal exam")
			.setMeasurementPeriod(MeasurementPeriod.calendarYear(2025))
			.setGlobalConstraints(new GlobalConstraints().setAgeRange(new AgeRange(18, 75)));
		measure.addValueSet(office).addValueSet(diabetes).addValueSet(enucleation).addValueSet(retinal).addValueSet(hba1c);

		measure.addPopulation(new Population("ip", PopulationType.INITIAL_POPULATION, LogicalClause.and("ip-and",
			element("e-office", ElementType.ENCOUNTER, "Office visit during the measurement period", office),
			element("e-diabetes", ElementType.DIAGNOSIS, "Diabetes diagnosis", diabetes))));
		measure.addPopulation(new Population("dex", PopulationType.DENOMINATOR_EXCLUSION, LogicalClause.and("dex-and",
			element("e-enucleation", ElementType.PROCEDURE, "Bilateral enucleation", enucleation))));
		measure.addPopulation(new Population("num", PopulationType.NUMERATOR, LogicalClause.or("num-or",
			element("e-retinal", ElementType.PROCEDURE, "Retinal exam", retinal)
				.setTiming(new TimingConstraint(TimingWindow.WITHIN, 1, PeriodUnit.YEARS)),
			element("e-hba1c", ElementType.OBSERVATION, "HbA1c below 9", hba1c)
				.setThresholds(new ThresholdRange().setValueMax(new BigDecimal("9"))))));
		return measure;
	}

	/**
	 * Measure with only an initial population holding the given criteria.
	 */
	public static Measure singlePopulation(String id, LogicalClause criteria) {
		return new Measure()
			.setId(id)
			.setTitle("Test measure " + id)
			.setMeasurementPeriod(MeasurementPeriod.calendarYear(2025))
			.addPopulation(new Population("ip", PopulationType.INITIAL_POPULATION, criteria));
	}
}
