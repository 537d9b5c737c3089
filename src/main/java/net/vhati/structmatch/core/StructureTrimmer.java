package net.vhati.structmatch.core;

import java.util.ArrayList;
import java.util.List;

import com.google.common.base.Preconditions;

import org.jdom2.Content;
import org.jdom2.Element;


/**
 * Builds minimal copies of matched elements.
 *
 * A trimmed copy keeps the matched element's tag, attributes and text, and
 * only the children that served as friends, each trimmed in turn.
 */
public class StructureTrimmer {

	private final StructureMatcher matcher;


	public StructureTrimmer( StructureMatcher matcher ) {
		this.matcher = Preconditions.checkNotNull( matcher );
	}


	/**
	 * Returns a detached, trimmed copy of an element that matches the pattern.
	 * The matched element is not modified.
	 *
	 * @throws IllegalStateException if the element doesn't match the pattern
	 */
	public Element trim( Element matched, StructurePattern pattern ) {
		Preconditions.checkState( matcher.matches( matched, pattern ), "Can't trim %s, it doesn't match %s.", ElementPaths.getPathToRoot( matched ), pattern );

		Element copy = matched.clone();
		trimChildren( copy, pattern );
		return copy;
	}

	/**
	 * Detaches every element child of node that isn't a friend, then trims the friends.
	 *
	 * Content following a detached child, up to the next element, goes with it.
	 * Text before the first element child and text after a kept friend stay.
	 */
	protected void trimChildren( Element node, StructurePattern pattern ) {
		int[] friends = matcher.friendIndexes( node, pattern );
		Preconditions.checkState( friends != null, "Lost the friends of %s while trimming against %s.", ElementPaths.getPathToRoot( node ), pattern );

		List<Content> contents = new ArrayList<Content>( node.getContent() );
		List<Element> kept = new ArrayList<Element>( friends.length );

		// Friend indexes ascend, so one pass drops each run before a friend, then the tail.
		int k = 0;
		int f = 0;
		boolean dropping = false;
		for ( Content content : contents ) {
			if ( content instanceof Element ) {
				if ( f < friends.length && friends[f] == k ) {
					kept.add( (Element)content );
					f++;
					dropping = false;
				}
				else {
					dropping = true;
				}
				k++;
			}
			if ( dropping ) {
				node.removeContent( content );
			}
		}

		List<StructurePattern> patternChildren = pattern.getChildren();
		for ( int i=0; i < kept.size(); i++ ) {
			trimChildren( kept.get( i ), patternChildren.get( i ) );
		}
	}
}
