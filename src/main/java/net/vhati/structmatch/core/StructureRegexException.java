package net.vhati.structmatch.core;


/**
 * Indicates a pattern attribute had a re{...} value with bad regular expression syntax. <br>
 * Messages part of the stack trace can be retrieved by {@link StructureRegexException#getLocalizedMessage()}.
 */
public class StructureRegexException extends IllegalArgumentException {

	private final String representation;

	/**
	 * Constructs an exception with the specified message and cause, also saving
	 * the cause's message so {@link #getLocalizedMessage()} can report both.
	 */
	public StructureRegexException( String message, Throwable cause ) {
		super( message, cause );
		representation = message + cause.getLocalizedMessage();
	}

	@Override
	public String getLocalizedMessage() {
		return representation;
	}
}
