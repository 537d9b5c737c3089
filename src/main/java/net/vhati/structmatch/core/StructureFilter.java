package net.vhati.structmatch.core;

import org.jdom2.Element;
import org.jdom2.filter.AbstractFilter;


/**
 * Matches elements that structurally contain a pattern.
 */
public class StructureFilter extends AbstractFilter<Element> {

	private final transient StructureMatcher matcher;
	private final transient StructurePattern pattern;


	public StructureFilter( StructureMatcher matcher, StructurePattern pattern ) {
		this.matcher = matcher;
		this.pattern = pattern;
	}

	@Override
	public Element filter( Object content ) {
		if ( !(content instanceof Element) ) return null;
		Element node = (Element)content;

		if ( !matcher.matches( node, pattern ) ) return null;

		return node;
	}
}
