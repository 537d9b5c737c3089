package net.vhati.structmatch.core;


/**
 * Thrown when structural matching recurses past the matcher's depth limit.
 */
public class StructureDepthException extends IllegalStateException {

	private final int limit;

	public StructureDepthException( int limit, String path ) {
		super( String.format( "Structural match exceeded max depth %d (%s).", limit, path ) );
		this.limit = limit;
	}

	public int getLimit() {
		return limit;
	}
}
