package org.umsforge.model;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CriteriaTreesTest {

	@Test
	void dataElements_WalksDepthFirstInOrder() {
		LogicalClause root = LogicalClause.and("c-root",
			new DataElement("e-1", ElementType.ENCOUNTER, "Visit"),
			LogicalClause.or("c-or",
				new DataElement("e-2", ElementType.DIAGNOSIS, "Diabetes"),
				LogicalClause.not("c-not", new DataElement("e-3", ElementType.PROCEDURE, "Enucleation"))),
			new DataElement("e-4", ElementType.OBSERVATION, "HbA1c"));

		List<String> ids = CriteriaTrees.dataElements(root).stream().map(DataElement::getId).collect(Collectors.toList());

		assertEquals(List.of("e-1", "e-2", "e-3", "e-4"), ids);
	}

	@Test
	void anyElement_MatchesNestedLeaf() {
		LogicalClause root = LogicalClause.and("c-root",
			LogicalClause.or("c-or", new DataElement("e-1", ElementType.DEMOGRAPHIC, "Age 18 to 75")));

		assertTrue(CriteriaTrees.anyElement(root, e -> e.getType() == ElementType.DEMOGRAPHIC));
		assertFalse(CriteriaTrees.anyElement(root, e -> e.getType() == ElementType.MEDICATION));
	}

	@Test
	void componentLabel_FallsBackToValueSetThenId() {
		DataElement element = new DataElement("e-9", ElementType.PROCEDURE, " ");
		assertEquals("e-9", element.componentLabel());

		element.setValueSet(new ValueSetReference().setName("Retinal or Dilated Eye Exam"));
		assertEquals("Retinal or Dilated Eye Exam", element.componentLabel());

		element.setDescription("Retinal exam");
		assertEquals("Retinal exam", element.componentLabel());
	}

	@Test
	void globalConstraints_IgnoreUnboundedAgeAndAllGender() {
		GlobalConstraints constraints = new GlobalConstraints().setAgeRange(new AgeRange()).setGender(Gender.ALL);

		assertFalse(constraints.hasAgeRange());
		assertFalse(constraints.hasRestrictiveGender());

		constraints.setAgeRange(new AgeRange(18, null)).setGender(Gender.FEMALE);
		assertTrue(constraints.hasAgeRange());
		assertTrue(constraints.hasRestrictiveGender());
	}
}
