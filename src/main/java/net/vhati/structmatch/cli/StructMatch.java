package net.vhati.structmatch.cli;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;

import org.jdom2.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.vhati.structmatch.core.MatchTrace;
import net.vhati.structmatch.core.SearchStrategy;
import net.vhati.structmatch.core.StructureDepthException;
import net.vhati.structmatch.core.StructureFinder;
import net.vhati.structmatch.core.StructureMatcher;
import net.vhati.structmatch.core.StructurePattern;
import net.vhati.structmatch.core.StructureRegexException;


/**
 * Command-line entry point: prints the structures in a source XML that match a target structure.
 *
 * Each argument is a file path if it contains a '.', otherwise inline XML.
 */
public class StructMatch {

	private static final Logger LOG = LoggerFactory.getLogger( StructMatch.class );

	public static final int EXIT_OK = 0;
	public static final int EXIT_USAGE = 1;
	public static final int EXIT_BAD_INPUT = 2;

	@Parameter( description = "<source_XML> <target_structure>" )
	private List<String> arguments = new ArrayList<String>();

	@Parameter( names = {"-s", "--strategy"}, description = "Traversal order: dfs or bfs (default from structmatch.properties)" )
	private String strategy = null;

	@Parameter( names = {"-m", "--mode"}, description = "Query mode: all, first, exists or count" )
	private String mode = "all";

	@Parameter( names = "--strict", description = "Trim each match down to the elements the target needed" )
	private boolean strict = false;

	@Parameter( names = "--pretty", description = "Pretty-print matches" )
	private boolean pretty = false;

	@Parameter( names = "--indent", description = "Pretty-print indent width: 2 or 4" )
	private Integer indent = null;

	@Parameter( names = "--outline", description = "Print matches as indented tag outlines" )
	private boolean outline = false;

	@Parameter( names = "--max-depth", description = "How deep a single structural match may recurse" )
	private Integer maxDepth = null;

	@Parameter( names = "--trace", description = "Log match call statistics" )
	private boolean trace = false;

	@Parameter( names = {"-h", "--help"}, help = true, description = "Displays help" )
	private boolean help = false;


	/**
	 * The modes a query can run in.
	 */
	public enum QueryMode {
		ALL, FIRST, EXISTS, COUNT;

		public static QueryMode fromString( String s ) {
			try {
				return valueOf( s.toUpperCase( Locale.ROOT ) );
			}
			catch ( IllegalArgumentException e ) {
				throw new ParameterException( String.format( "Invalid mode \"%s\". Must be 'all', 'first', 'exists' or 'count'.", s ) );
			}
		}
	}


	public static void main( String... args ) {
		int status = new StructMatch().run( args, System.out, System.err );
		System.exit( status );
	}


	/**
	 * Parses arguments, runs the query and prints results.
	 *
	 * @return an exit status: EXIT_OK (even when nothing matched), EXIT_USAGE or EXIT_BAD_INPUT
	 */
	public int run( String[] args, PrintStream out, PrintStream err ) {
		JCommander jCommander = JCommander.newBuilder()
			.addObject( this )
			.programName( "structmatch" )
			.build();

		QueryMode queryMode;
		SearchStrategy searchStrategy;
		try {
			jCommander.parse( args );
			if ( help ) {
				err.println( usage( jCommander ) );
				return EXIT_OK;
			}
			if ( arguments.size() != 2 ) {
				throw new ParameterException( String.format( "Expected 2 arguments (source, target), got %d.", arguments.size() ) );
			}

			MatchSettings settings = loadSettings();
			queryMode = QueryMode.fromString( mode );
			searchStrategy = ( strategy != null ? parseStrategy( strategy ) : settings.getStrategy() );
			if ( indent == null ) indent = settings.getIndent();
			if ( maxDepth == null ) maxDepth = settings.getMaxDepth();

			if ( indent != 2 && indent != 4 )
				throw new ParameterException( String.format( "Invalid indent %d. Must be 2 or 4.", indent ) );
			if ( maxDepth < 0 )
				throw new ParameterException( String.format( "Invalid max depth %d. Must be >= 0.", maxDepth ) );
		}
		catch ( ParameterException e ) {
			err.println( e.getMessage() );
			err.println( usage( jCommander ) );
			return EXIT_USAGE;
		}
		catch ( IllegalArgumentException e ) {
			LOG.error( "Bad settings in {}", MatchSettings.RESOURCE_NAME, e );
			err.println( e.getMessage() );
			return EXIT_USAGE;
		}

		TreeLoader loader = new TreeLoader();
		Element sourceRoot;
		StructurePattern pattern;
		try {
			sourceRoot = loader.load( arguments.get( 0 ) );
			pattern = StructurePattern.compile( loader.load( arguments.get( 1 ) ) );
		}
		catch ( TreeLoadException e ) {
			LOG.error( e.getMessage() );
			err.println( e.getMessage() );
			return EXIT_BAD_INPUT;
		}
		catch ( StructureRegexException e ) {
			LOG.error( "Bad target regex", e );
			err.println( e.getLocalizedMessage() );
			return EXIT_BAD_INPUT;
		}

		MatchTrace matchTrace = ( trace ? new MatchTrace() : MatchTrace.NONE );
		StructureFinder finder = new StructureFinder( new StructureMatcher( maxDepth, matchTrace ), searchStrategy );
		MatchPrinter printer = new MatchPrinter( pretty, indent );

		try {
			runQuery( finder, queryMode, sourceRoot, pattern, printer, out );
		}
		catch ( StructureDepthException e ) {
			LOG.error( e.getMessage() );
			err.println( e.getMessage() );
			return EXIT_BAD_INPUT;
		}

		if ( trace ) {
			LOG.info( "{} {} query: {}", searchStrategy.getShortName(), queryMode.name().toLowerCase( Locale.ROOT ), matchTrace );
		}
		return EXIT_OK;
	}

	/**
	 * Returns defaults for options not given on the command line.
	 *
	 * @throws IllegalArgumentException if a configured value is invalid
	 */
	protected MatchSettings loadSettings() {
		return MatchSettings.load();
	}

	protected void runQuery( StructureFinder finder, QueryMode queryMode, Element sourceRoot, StructurePattern pattern, MatchPrinter printer, PrintStream out ) {
		if ( queryMode == QueryMode.EXISTS ) {
			out.println( finder.exists( sourceRoot, pattern ) );
		}
		else if ( queryMode == QueryMode.COUNT ) {
			out.println( finder.count( sourceRoot, pattern ) );
		}
		else {
			List<Element> results = new ArrayList<Element>();
			if ( queryMode == QueryMode.FIRST ) {
				Element first = ( strict ? finder.findFirstTrimmed( sourceRoot, pattern ) : finder.findFirst( sourceRoot, pattern ) );
				if ( first != null ) results.add( first );
			}
			else {
				results = ( strict ? finder.findAllTrimmed( sourceRoot, pattern ) : finder.findAll( sourceRoot, pattern ) );
			}

			for ( Element result : results ) {
				if ( outline ) {
					out.print( printer.outline( result ) );
				} else {
					out.println( printer.format( result ) );
				}
			}
		}
	}

	private static SearchStrategy parseStrategy( String s ) {
		try {
			return SearchStrategy.fromString( s );
		}
		catch ( IllegalArgumentException e ) {
			throw new ParameterException( e.getMessage() );
		}
	}

	private static String usage( JCommander jCommander ) {
		StringBuilder buf = new StringBuilder();
		jCommander.getUsageFormatter().usage( buf );
		return buf.toString();
	}
}
