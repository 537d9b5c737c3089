package net.vhati.structmatch.core;

import static net.vhati.structmatch.core.TestTrees.pattern;
import static net.vhati.structmatch.core.TestTrees.xml;
import static org.junit.jupiter.api.Assertions.*;

import org.jdom2.Element;
import org.junit.jupiter.api.Test;

final class AttributeMatcherTest {

	private static boolean satisfies(String source, String target) {
		return AttributeMatcher.attributesSatisfy(xml(source), pattern(target));
	}

	@Test
	void emptyPatternIsVacuouslySatisfied() {
		assertTrue(satisfies("<a/>", "<a/>"));
		assertTrue(satisfies("<a x=\"1\" y=\"2\"/>", "<a/>"));
	}

	@Test
	void fewerSourceAttributesFails() {
		assertFalse(satisfies("<a x=\"1\"/>", "<a x=\"1\" y=\"2\"/>"));
	}

	@Test
	void missingKeyIsPlainFailure() {
		assertFalse(satisfies("<a x=\"1\" z=\"3\"/>", "<a x=\"1\" y=\"2\"/>"));
	}

	@Test
	void literalRequiresExactEquality() {
		assertTrue(satisfies("<a id=\"gallery\"/>", "<a id=\"gallery\"/>"));
		assertFalse(satisfies("<a id=\"Gallery\"/>", "<a id=\"gallery\"/>"));
		assertFalse(satisfies("<a id=\"gallery2\"/>", "<a id=\"gallery\"/>"));
	}

	@Test
	void extraSourceAttributesAreIgnored() {
		assertTrue(satisfies("<a id=\"g\" class=\"c\" style=\"s\"/>", "<a class=\"c\"/>"));
	}

	@Test
	void regexMatchesFromStart() {
		assertTrue(satisfies("<img class=\"product-img\"/>", "<img class=\"re{product.*}\"/>"));
		assertTrue(satisfies("<img class=\"product-img\"/>", "<img class=\"re{prod}\"/>"));
		assertFalse(satisfies("<img class=\"product-img\"/>", "<img class=\"re{img}\"/>"));
		assertFalse(satisfies("<img class=\"product-img\"/>", "<img class=\"re{^banner$}\"/>"));
	}

	@Test
	void regexAgainstMissingAttributeFails() {
		assertFalse(satisfies("<img src=\"a.png\" alt=\"a\"/>", "<img class=\"re{.*}\"/>"));
	}

	@Test
	void wrapperMustCoverWholeValue() {
		AttributeConstraint literal = AttributeConstraint.parse("xre{a}", "test");
		assertInstanceOf(AttributeConstraint.Literal.class, literal);
		assertTrue(literal.accepts("xre{a}"));

		AttributeConstraint partial = AttributeConstraint.parse("re{a}x", "test");
		assertInstanceOf(AttributeConstraint.Literal.class, partial);
	}

	@Test
	void regexTextRunsFromFirstOpenToLastCloseBrace() {
		AttributeConstraint c = AttributeConstraint.parse("re{a{2}}", "test");
		AttributeConstraint.Regex regex = assertInstanceOf(AttributeConstraint.Regex.class, c);
		assertEquals("a{2}", regex.getPattern().pattern());
		assertTrue(c.accepts("aab"));
		assertFalse(c.accepts("ab"));
	}

	@Test
	void invalidRegexFailsAtCompileTime() {
		Element target = xml("<root><img class=\"re{[unclosed}\"/></root>");
		StructureRegexException e =
				assertThrows(StructureRegexException.class, () -> StructurePattern.compile(target));
		assertTrue(e.getLocalizedMessage().contains("/root/img"));
		assertTrue(e.getLocalizedMessage().contains("class attribute"));
	}

	@Test
	void namespacedAttributesAreMatchedByNamespace() {
		String source =
				"<a xmlns:x=\"urn:x\" xmlns:y=\"urn:y\" x:k=\"1\" y:k=\"2\"/>";
		assertTrue(satisfies(source, "<a xmlns:q=\"urn:y\" q:k=\"2\"/>"));
		assertFalse(satisfies(source, "<a xmlns:q=\"urn:x\" q:k=\"2\"/>"));
	}
}
