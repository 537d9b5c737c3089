package net.vhati.structmatch.core;

import static net.vhati.structmatch.core.TestTrees.pattern;
import static net.vhati.structmatch.core.TestTrees.xml;
import static org.junit.jupiter.api.Assertions.*;

import org.jdom2.Element;
import org.junit.jupiter.api.Test;

final class StructureMatcherTest {

	private final StructureMatcher matcher = new StructureMatcher();

	private boolean matches(String source, String target) {
		return matcher.matches(xml(source), pattern(target));
	}

	@Test
	void leafPatternChecksOnlyTagAndAttributes() {
		assertTrue(matches("<a/>", "<a/>"));
		assertTrue(matches("<a><b/><c><d/></c></a>", "<a/>"));
		assertTrue(matches("<a k=\"v\"><b/></a>", "<a k=\"v\"/>"));
		assertFalse(matches("<a k=\"w\"><b/></a>", "<a k=\"v\"/>"));
		assertFalse(matches("<b/>", "<a/>"));
	}

	@Test
	void tagComparisonIsCaseSensitive() {
		assertFalse(matches("<A/>", "<a/>"));
	}

	@Test
	void tagComparisonIncludesNamespace() {
		assertTrue(matches("<a xmlns=\"urn:one\"/>", "<p:a xmlns:p=\"urn:one\"/>"));
		assertFalse(matches("<a xmlns=\"urn:one\"/>", "<a/>"));
	}

	@Test
	void childrenAreMatchedAsOrderedSubset() {
		assertTrue(matches("<a><x/><b/><y/><c/><z/></a>", "<a><b/><c/></a>"));
		assertTrue(matches("<a><b/><c/></a>", "<a><b/><c/></a>"));
	}

	@Test
	void childOrderMatters() {
		assertFalse(matches("<a><c/><b/></a>", "<a><b/><c/></a>"));
	}

	@Test
	void friendsAreNotReused() {
		assertFalse(matches("<a><b/><x/></a>", "<a><b/><b/></a>"));
		assertTrue(matches("<a><b/><x/><b/></a>", "<a><b/><b/></a>"));
	}

	@Test
	void matchingRecursesIntoGrandchildren() {
		String source = "<a><b><c/></b><b><d/></b></a>";
		assertTrue(matches(source, "<a><b><d/></b></a>"));
		assertFalse(matches(source, "<a><b><d/></b><b><c/></b></a>"));
	}

	@Test
	void sourceLeafFailsNonLeafPattern() {
		assertFalse(matches("<a/>", "<a><b/></a>"));
	}

	@Test
	void tooFewChildrenFailsWithoutComparingChildren() {
		MatchTrace trace = new MatchTrace();
		StructureMatcher traced = new StructureMatcher(trace);

		assertFalse(traced.matches(xml("<a><b/><c/></a>"), pattern("<a><b/><c/><d/></a>")));
		assertEquals(1, trace.getMatchCalls());
		assertEquals(0, trace.getChildScans());
	}

	@Test
	void scanStopsOnceRemainingChildrenCannotFitRemainingPattern() {
		MatchTrace trace = new MatchTrace();
		StructureMatcher traced = new StructureMatcher(trace);

		// b is claimed at the last slot, leaving no room for c.
		assertFalse(traced.matches(xml("<a><x/><y/><b/></a>"), pattern("<a><b/><c/></a>")));
		assertEquals(4, trace.getMatchCalls());
		assertEquals(1, trace.getChildScans());
		assertEquals(1, trace.getMaxDepth());
	}

	@Test
	void tagMismatchSkipsChildScan() {
		MatchTrace trace = new MatchTrace();
		StructureMatcher traced = new StructureMatcher(trace);

		assertFalse(traced.matches(xml("<z><b/></z>"), pattern("<a><b/></a>")));
		assertEquals(1, trace.getMatchCalls());
		assertEquals(0, trace.getChildScans());
	}

	@Test
	void friendIndexesAreLeftmost() {
		Element source = xml("<a><x/><b/><b/><c/><c/></a>");
		assertArrayEquals(new int[] {1, 3}, matcher.friendIndexes(source, pattern("<a><b/><c/></a>")));
		assertArrayEquals(new int[0], matcher.friendIndexes(source, pattern("<a/>")));
		assertNull(matcher.friendIndexes(source, pattern("<a><c/><b/></a>")));
	}

	@Test
	void childSubsetMatchesOnLists() {
		Element source = xml("<a><b/><c/></a>");
		StructurePattern target = pattern("<a><c/></a>");
		assertTrue(matcher.childSubsetMatches(source.getChildren(), target.getChildren()));
		assertTrue(matcher.childSubsetMatches(source.getChildren(), pattern("<a/>").getChildren()));
	}

	@Test
	void textIsNotMatchedOn() {
		assertTrue(matches("<a>hello<b>world</b></a>", "<a>other<b>text</b></a>"));
	}

	@Test
	void depthLimitFailsLoudly() {
		StructureMatcher shallow = new StructureMatcher(1, MatchTrace.NONE);
		Element source = xml("<a><b><c/></b></a>");

		assertTrue(shallow.matches(source, pattern("<a><b/></a>")));
		StructureDepthException e =
				assertThrows(StructureDepthException.class, () -> shallow.matches(source, pattern("<a><b><c/></b></a>")));
		assertEquals(1, e.getLimit());
	}

	@Test
	void negativeDepthIsRejected() {
		assertThrows(IllegalArgumentException.class, () -> new StructureMatcher(-1, MatchTrace.NONE));
	}

	@Test
	void noneTraceRecordsNothing() {
		StructureMatcher untraced = new StructureMatcher(MatchTrace.NONE);
		untraced.matches(xml("<a><b/></a>"), pattern("<a><b/></a>"));
		assertEquals(0, MatchTrace.NONE.getMatchCalls());
	}
}
