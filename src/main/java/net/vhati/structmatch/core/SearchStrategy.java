package net.vhati.structmatch.core;


/**
 * The order in which a {@link StructureFinder} visits source elements.
 */
public enum SearchStrategy {
	/** Pre-order: an element, then each child's subtree, left to right. */
	DEPTH_FIRST( "dfs" ),

	/** Level order, starting with the root. */
	BREADTH_FIRST( "bfs" );

	private final String shortName;

	SearchStrategy( String shortName ) {
		this.shortName = shortName;
	}

	public String getShortName() {
		return shortName;
	}

	/**
	 * Returns the strategy named by "dfs", "bfs", or a constant name (case-insensitive).
	 */
	public static SearchStrategy fromString( String s ) {
		for ( SearchStrategy strategy : values() ) {
			if ( strategy.shortName.equalsIgnoreCase( s ) || strategy.name().equalsIgnoreCase( s ) ) {
				return strategy;
			}
		}
		throw new IllegalArgumentException( String.format( "Invalid search strategy \"%s\". Must be 'dfs' or 'bfs'.", s ) );
	}
}
