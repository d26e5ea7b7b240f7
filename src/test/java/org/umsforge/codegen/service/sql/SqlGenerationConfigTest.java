package org.umsforge.codegen.service.sql;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SqlGenerationConfigTest {

	@Test
	void setOntologyContexts_LaterCallerChanges_AreNotSeen() {
		List<String> contexts = new ArrayList<>(List.of("PH_F_Condition"));
		SqlGenerationConfig config = SqlGenerationConfig.forPopulation("POP-2025").setOntologyContexts(contexts);

		contexts.add("PH_F_Procedure");

		assertEquals(List.of("PH_F_Condition"), config.getOntologyContexts());
	}

	@Test
	void getOntologyContexts_IsReadOnly() {
		SqlGenerationConfig config = SqlGenerationConfig.defaultConfig().setOntologyContexts(List.of("PH_F_Condition"));

		assertThrows(UnsupportedOperationException.class, () -> config.getOntologyContexts().add("PH_F_Result"));
	}

	@Test
	void setOntologyContexts_Null_IsEmpty() {
		assertTrue(SqlGenerationConfig.defaultConfig().setOntologyContexts(null).getOntologyContexts().isEmpty());
	}
}
