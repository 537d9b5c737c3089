package net.vhati.structmatch.cli;


/**
 * Thrown when a source or target argument can't be read or parsed as XML.
 */
public class TreeLoadException extends Exception {

	private final String argument;

	public TreeLoadException( String argument, String message, Throwable cause ) {
		super( message, cause );
		this.argument = argument;
	}

	/** Returns the command-line argument that failed to load. */
	public String getArgument() {
		return argument;
	}
}
