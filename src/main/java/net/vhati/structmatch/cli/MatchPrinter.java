package net.vhati.structmatch.cli;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;

import org.jdom2.Element;
import org.jdom2.output.Format;
import org.jdom2.output.LineSeparator;
import org.jdom2.output.XMLOutputter;


/**
 * Serializes matched elements for display.
 */
public class MatchPrinter {

	private final XMLOutputter outputter;
	private final int indent;


	/**
	 * @param pretty true to nest child elements on indented lines, false for the element as parsed
	 * @param indent spaces per nesting level: 2 or 4
	 */
	public MatchPrinter( boolean pretty, int indent ) {
		Preconditions.checkArgument( indent == 2 || indent == 4, "Indent must be 2 or 4, got %s.", indent );
		this.indent = indent;

		Format format;
		if ( pretty ) {
			format = Format.getPrettyFormat();
			format.setIndent( Strings.repeat( " ", indent ) );
			format.setLineSeparator( LineSeparator.UNIX );
		} else {
			format = Format.getRawFormat();
		}
		format.setEncoding( "UTF-8" );
		this.outputter = new XMLOutputter( format );
	}


	/**
	 * Returns an element and its subtree as XML.
	 */
	public String format( Element node ) {
		return outputter.outputString( node );
	}

	/**
	 * Returns an element's subtree as tag names, one per line, indented by depth.
	 */
	public String outline( Element node ) {
		StringBuilder buf = new StringBuilder();
		appendOutline( buf, node, 0 );
		return buf.toString();
	}

	private void appendOutline( StringBuilder buf, Element node, int depth ) {
		buf.append( Strings.repeat( " ", indent * depth ) );
		buf.append( node.getQualifiedName() );
		buf.append( "\n" );

		for ( Element child : node.getChildren() ) {
			appendOutline( buf, child, depth+1 );
		}
	}
}
