package org.umsforge.codegen.service.utils;

import org.junit.jupiter.api.Test;

import java.util.regex.Matcher;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ComponentMarkersTest {

	@Test
	void start_PlainId_IsBlockComment() {
		assertEquals("/* [component e-office] */", ComponentMarkers.start("e-office"));
		assertEquals("/* [/component e-office] */", ComponentMarkers.end("e-office"));
	}

	@Test
	void start_IdClosingComment_IsNeutralized() {
		String start = ComponentMarkers.start("e-1*/x");
		String end = ComponentMarkers.end("e-1*/x");

		assertEquals("/* [component e-1* /x] */", start);
		assertEquals(start.length() - 2, start.indexOf("*/"));
		assertEquals(end.length() - 2, end.indexOf("*/"));
	}

	@Test
	void region_IdWithCommentDelimiters_MatchesWrappedCode() {
		String id = "e-/*odd*/";
		String document = "define \"X\":\n  " + ComponentMarkers.wrap(id, "true") + "\n";

		Matcher matcher = ComponentMarkers.region(id).matcher(document);

		assertTrue(matcher.find());
		assertEquals(" true ", matcher.group(1));
		assertFalse(document.contains("odd*/]"));
	}
}
