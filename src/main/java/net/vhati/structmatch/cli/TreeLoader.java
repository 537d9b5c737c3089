package net.vhati.structmatch.cli;

import java.io.File;
import java.io.IOException;
import java.io.StringReader;

import org.jdom2.Document;
import org.jdom2.Element;
import org.jdom2.JDOMException;
import org.jdom2.input.SAXBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


/**
 * Turns a command-line argument into a parsed element.
 *
 * An argument containing a '.' is treated as a file path, anything else as inline XML.
 */
public class TreeLoader {

	private static final Logger LOG = LoggerFactory.getLogger( TreeLoader.class );

	/** Keeps a DOCTYPE's external DTD from being fetched. */
	public static final String LOAD_EXTERNAL_DTD_FEATURE = "http://apache.org/xml/features/nonvalidating/load-external-dtd";


	public static boolean isFilePath( String arg ) {
		return arg.indexOf( '.' ) != -1;
	}


	/**
	 * Returns the root element parsed from a file path or inline XML.
	 *
	 * @throws TreeLoadException if the file can't be read or the XML is malformed
	 */
	public Element load( String arg ) throws TreeLoadException {
		if ( isFilePath( arg ) ) {
			return loadFile( new File( arg ), arg );
		}
		return loadText( arg );
	}

	public Element loadFile( File f, String arg ) throws TreeLoadException {
		LOG.debug( "Parsing XML file: {}", f.getPath() );
		try {
			Document doc = createBuilder().build( f );
			return doc.getRootElement();
		}
		catch ( JDOMException e ) {
			throw new TreeLoadException( arg, String.format( "Malformed XML in file \"%s\": %s", f.getPath(), e.getMessage() ), e );
		}
		catch ( IOException e ) {
			throw new TreeLoadException( arg, String.format( "Could not read file \"%s\": %s", f.getPath(), e.getMessage() ), e );
		}
	}

	public Element loadText( String xml ) throws TreeLoadException {
		LOG.debug( "Parsing inline XML ({} chars)", xml.length() );
		try {
			Document doc = createBuilder().build( new StringReader( xml ) );
			return doc.getRootElement();
		}
		catch ( JDOMException e ) {
			throw new TreeLoadException( xml, String.format( "Malformed inline XML: %s", e.getMessage() ), e );
		}
		catch ( IOException e ) {
			throw new TreeLoadException( xml, String.format( "Could not read inline XML: %s", e.getMessage() ), e );
		}
	}

	protected SAXBuilder createBuilder() {
		SAXBuilder builder = new SAXBuilder();
		builder.setExpandEntities( false );
		builder.setFeature( LOAD_EXTERNAL_DTD_FEATURE, false );
		return builder;
	}
}
