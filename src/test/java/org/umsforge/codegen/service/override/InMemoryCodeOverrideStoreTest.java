package org.umsforge.codegen.service.override;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.umsforge.codegen.service.OutputFormat;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryCodeOverrideStoreTest {

	private static final OverrideKey RETINAL_CQL = new OverrideKey("CMS131", "e-retinal", OutputFormat.CQL);
	private static final OverrideKey RETINAL_SQL = new OverrideKey("CMS131", "e-retinal", OutputFormat.SYNAPSE_SQL);
	private static final String NOTE = "Widened the lookback to two years";

	private TickingClock clock;
	private InMemoryCodeOverrideStore store;

	@BeforeEach
	void setUp() {
		clock = new TickingClock(Instant.parse("2025-03-01T10:00:00Z"));
		store = new InMemoryCodeOverrideStore(clock, InMemoryCodeOverrideStore.DEFAULT_MIN_NOTE_LENGTH, "analyst");
	}

	@Test
	void save_ShortNote_IsRejectedAndNothingStored() {
		OverrideSaveResult result = store.save(RETINAL_CQL, "true", "too short", ChangeType.LOGIC, "false");

		assertFalse(result.isSuccess());
		assertNull(result.getOverride());
		assertEquals(List.of("Edit note must be at least 10 characters"), result.getErrors());
		assertTrue(store.find(RETINAL_CQL).isEmpty());
	}

	@Test
	void save_NoteIsTrimmedBeforeCounting() {
		assertFalse(store.save(RETINAL_CQL, "true", "   short    ", ChangeType.LOGIC, null).isSuccess());
	}

	@Test
	void save_FirstEdit_IsLockedWithOriginalAndNote() {
		OverrideSaveResult result = store.save(RETINAL_CQL, "exists [Procedure]", NOTE, ChangeType.TIMING, "exists [Procedure: \"Retinal\"]");

		assertTrue(result.isSuccess());
		CodeOverride saved = store.find(RETINAL_CQL).orElseThrow();
		assertTrue(saved.isLocked());
		assertEquals("exists [Procedure]", saved.getCode());
		assertEquals("exists [Procedure: \"Retinal\"]", saved.getOriginalGeneratedCode());
		assertEquals(1, saved.getNotes().size());
		EditNote note = saved.getNotes().get(0);
		assertEquals(NOTE, note.getContent());
		assertEquals("analyst", note.getAuthor());
		assertEquals(ChangeType.TIMING, note.getChangeType());
		assertEquals(OutputFormat.CQL, note.getFormat());
		assertNull(note.getPreviousCode());
	}

	@Test
	void save_SecondEditWhileLocked_KeepsFirstOriginalAndRecordsPreviousCode() {
		store.save(RETINAL_CQL, "v1", NOTE, ChangeType.LOGIC, "generated-1");
		store.save(RETINAL_CQL, "v2", "Second pass on the same logic", ChangeType.LOGIC, "generated-2");

		CodeOverride saved = store.find(RETINAL_CQL).orElseThrow();
		assertEquals("v2", saved.getCode());
		assertEquals("generated-1", saved.getOriginalGeneratedCode());
		assertEquals(2, saved.getNotes().size());
		assertEquals("v1", saved.getNotes().get(1).getPreviousCode());
		assertTrue(saved.getUpdatedAt().isAfter(saved.getCreatedAt()));
	}

	@Test
	void save_AfterRevert_TakesNewOriginalAndRelocks() {
		store.save(RETINAL_CQL, "v1", NOTE, ChangeType.LOGIC, "generated-1");
		store.revert(RETINAL_CQL);
		store.save(RETINAL_CQL, "v2", "Reapplied after regeneration", ChangeType.LOGIC, "generated-2");

		CodeOverride saved = store.find(RETINAL_CQL).orElseThrow();
		assertTrue(saved.isLocked());
		assertEquals("generated-2", saved.getOriginalGeneratedCode());
	}

	@Test
	void save_FormatsAreIndependent() {
		store.save(RETINAL_CQL, "cql code", NOTE, ChangeType.LOGIC, null);

		assertTrue(store.find(RETINAL_SQL).isEmpty());
		assertTrue(store.findLocked("CMS131", OutputFormat.SYNAPSE_SQL).isEmpty());
		assertEquals(1, store.findLocked("CMS131", OutputFormat.CQL).size());
	}

	@Test
	void find_OtherMeasureSameComponent_IsIsolated() {
		store.save(RETINAL_CQL, "cql code", NOTE, ChangeType.LOGIC, null);
		store.save(new OverrideKey("CMS122", "e-retinal", OutputFormat.CQL), "other", NOTE, ChangeType.LOGIC, null);

		List<CodeOverride> locked = store.findLocked("CMS131", OutputFormat.CQL);
		assertEquals(1, locked.size());
		assertEquals("cql code", locked.get(0).getCode());
		assertEquals(1, store.getAllNotes("CMS131", "e-retinal").size());
		assertEquals(2, store.getAllNotes("e-retinal").size());
	}

	@Test
	void revert_KeepsRecordAndIsIdempotent() {
		store.save(RETINAL_CQL, "v1", NOTE, ChangeType.LOGIC, "generated");

		CodeOverride first = store.revert(RETINAL_CQL).orElseThrow();
		CodeOverride second = store.revert(RETINAL_CQL).orElseThrow();

		assertFalse(first.isLocked());
		assertFalse(second.isLocked());
		assertEquals(first.getUpdatedAt(), second.getUpdatedAt());
		assertEquals("v1", second.getCode());
		assertEquals(1, second.getNotes().size());
		assertTrue(store.findLocked("CMS131", OutputFormat.CQL).isEmpty());
		assertEquals(1, store.findByMeasure("CMS131", null).size());
	}

	@Test
	void revert_UnknownKey_IsEmpty() {
		assertTrue(store.revert(RETINAL_SQL).isEmpty());
		assertTrue(store.revert(null).isEmpty());
	}

	@Test
	void revertAll_UnlocksEveryFormatOfTheComponent() {
		store.save(RETINAL_CQL, "cql", NOTE, ChangeType.LOGIC, null);
		store.save(RETINAL_SQL, "sql", NOTE, ChangeType.LOGIC, null);

		assertEquals(2, store.revertAll("CMS131", "e-retinal"));
		assertEquals(0, store.revertAll("CMS131", "e-retinal"));
		assertEquals(2, store.findByMeasure("CMS131", null).size());
	}

	@Test
	void addNote_AppendsWithoutChangingCode() {
		store.save(RETINAL_CQL, "v1", NOTE, ChangeType.LOGIC, null);

		OverrideSaveResult result = store.addNote(RETINAL_CQL, "Reviewed with the clinical lead", null);

		assertTrue(result.isSuccess());
		CodeOverride saved = result.getOverride();
		assertEquals("v1", saved.getCode());
		assertEquals(2, saved.getNotes().size());
		assertEquals(ChangeType.OTHER, saved.getNotes().get(1).getChangeType());
	}

	@Test
	void addNote_NoOverride_IsRejected() {
		OverrideSaveResult result = store.addNote(RETINAL_SQL, "Reviewed with the clinical lead", ChangeType.OTHER);

		assertFalse(result.isSuccess());
		assertTrue(result.getErrors().get(0).startsWith("No override exists for CMS131/e-retinal"));
	}

	@Test
	void getAllNotes_NewestFirstAcrossFormats() {
		store.save(RETINAL_CQL, "cql", "First change to the CQL", ChangeType.LOGIC, null);
		store.save(RETINAL_SQL, "sql", "Then the SQL counterpart", ChangeType.LOGIC, null);
		store.addNote(RETINAL_CQL, "Final review comment", ChangeType.OTHER);

		List<String> contents = store.getAllNotes("CMS131", "e-retinal").stream().map(EditNote::getContent).collect(Collectors.toList());

		assertEquals(List.of("Final review comment", "Then the SQL counterpart", "First change to the CQL"), contents);
	}

	@Test
	void constructor_NegativeMinimum_IsRejected() {
		assertThrows(IllegalArgumentException.class, () -> new InMemoryCodeOverrideStore(Clock.systemUTC(), -1, null));
	}

	/**
	 * Clock moving one second forward on every read.
	 */
	static class TickingClock extends Clock {
		private Instant now;

		TickingClock(Instant start) {
			this.now = start;
		}

		@Override
		public ZoneId getZone() {
			return ZoneOffset.UTC;
		}

		@Override
		public Clock withZone(ZoneId zone) {
			return this;
		}

		@Override
		public synchronized Instant instant() {
			now = now.plus(Duration.ofSeconds(1));
			return now;
		}
	}
}
