package net.vhati.structmatch.core;

import org.jdom2.Element;


/**
 * Describes where an element sits in its document, for error messages and logging.
 */
public final class ElementPaths {

	private ElementPaths() {
	}


	/**
	 * Returns a string describing this element's location.
	 *
	 * Example: /html/body/div(gallery)/div(browse)
	 *
	 * An element's "id" attribute is shown in parentheses, or its "name"
	 * attribute when it has no id.
	 */
	public static String getPathToRoot( Element node ) {
		if ( node == null ) return "(none)";

		StringBuilder buf = new StringBuilder();
		String chunk;
		String tmp;
		while ( node != null ) {
			chunk = "/"+ node.getQualifiedName();

			tmp = node.getAttributeValue( "id" );
			if ( tmp == null || tmp.length() == 0 ) tmp = node.getAttributeValue( "name" );
			if ( tmp != null && tmp.length() > 0 )
				chunk += "("+ tmp +")";

			buf.insert( 0, chunk );
			node = node.getParentElement();
		}
		return buf.toString();
	}
}
