package net.vhati.structmatch.cli;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.vhati.structmatch.core.SearchStrategy;
import net.vhati.structmatch.core.StructureMatcher;


/**
 * Defaults for the command line, read from structmatch.properties on the classpath.
 *
 * Missing keys fall back to built-in values.
 */
public class MatchSettings {

	private static final Logger LOG = LoggerFactory.getLogger( MatchSettings.class );

	public static final String RESOURCE_NAME = "structmatch.properties";

	public static final String STRATEGY_KEY = "structmatch.strategy";
	public static final String INDENT_KEY = "structmatch.indent";
	public static final String MAX_DEPTH_KEY = "structmatch.maxDepth";

	private final SearchStrategy strategy;
	private final int indent;
	private final int maxDepth;


	public MatchSettings( SearchStrategy strategy, int indent, int maxDepth ) {
		this.strategy = strategy;
		this.indent = indent;
		this.maxDepth = maxDepth;
	}


	/**
	 * Reads settings from the classpath resource, or returns the built-in defaults if it's absent.
	 *
	 * @throws IllegalArgumentException if a value present in the resource is invalid
	 */
	public static MatchSettings load() {
		Properties props = new Properties();
		try ( InputStream is = MatchSettings.class.getClassLoader().getResourceAsStream( RESOURCE_NAME ) ) {
			if ( is != null ) {
				props.load( is );
			} else {
				LOG.debug( "No {} on the classpath, using defaults", RESOURCE_NAME );
			}
		}
		catch ( IOException e ) {
			throw new IllegalStateException( String.format( "Could not read %s.", RESOURCE_NAME ), e );
		}
		return fromProperties( props );
	}

	public static MatchSettings fromProperties( Properties props ) {
		SearchStrategy strategy = SearchStrategy.fromString( props.getProperty( STRATEGY_KEY, "dfs" ).trim() );
		int indent = getIntProperty( props, INDENT_KEY, 2 );
		int maxDepth = getIntProperty( props, MAX_DEPTH_KEY, StructureMatcher.DEFAULT_MAX_DEPTH );
		return new MatchSettings( strategy, indent, maxDepth );
	}

	/**
	 * Returns the int value of a property, or a default when the property is absent.
	 */
	protected static int getIntProperty( Properties props, String key, int defaultValue ) {
		String tmp = props.getProperty( key );
		if ( tmp == null ) return defaultValue;
		try {
			return Integer.parseInt( tmp.trim() );
		}
		catch ( NumberFormatException e ) {
			throw new IllegalArgumentException( String.format( "Invalid int property \"%s\": %s", key, tmp ), e );
		}
	}

	public SearchStrategy getStrategy() {
		return strategy;
	}

	public int getIndent() {
		return indent;
	}

	public int getMaxDepth() {
		return maxDepth;
	}
}
