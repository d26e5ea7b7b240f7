package org.umsforge.codegen.service.diff;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class LineDiffTest {

	@Test
	void diff_ChangedMiddleLine_IsRemovedThenAdded() {
		List<String> lines = LineDiff.diff("a\nb\nc", "a\nx\nc").stream().map(LineChange::toString).collect(Collectors.toList());

		assertEquals(List.of("  a", "- b", "+ x", "  c"), lines);
	}

	@Test
	void diff_EmptySides_AreAllAddedOrRemoved() {
		assertEquals(List.of(new LineChange(LineChange.Type.ADDED, "a"), new LineChange(LineChange.Type.ADDED, "b")), LineDiff.diff("", "a\nb"));
		assertEquals(List.of(new LineChange(LineChange.Type.REMOVED, "a")), LineDiff.diff("a", null));
		assertTrue(LineDiff.diff(null, "").isEmpty());
	}

	@Test
	void diff_WindowsLineEndings_MatchUnixOnes() {
		List<LineChange> changes = LineDiff.diff("a\r\nb", "a\nb");

		assertTrue(changes.stream().allMatch(c -> c.getType() == LineChange.Type.UNCHANGED));
	}

	@Test
	void diff_KeepsLongestCommonSubsequence() {
		List<LineChange> changes = LineDiff.diff("a\nb\nc\nd", "b\nc\ne");

		long unchanged = changes.stream().filter(c -> c.getType() == LineChange.Type.UNCHANGED).count();
		assertEquals(2, unchanged);
		assertEquals(new LineChange(LineChange.Type.REMOVED, "a"), changes.get(0));
	}
}
