package net.vhati.structmatch.core;

import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;


/**
 * A single pattern attribute value, either a literal or a regular expression.
 *
 * Pattern values of the form re{...} are compiled once, when the pattern
 * is compiled. Everything else is compared literally.
 */
public abstract class AttributeConstraint {

	private static final Pattern REGEX_WRAPPER = Pattern.compile( "re\\{.*\\}", Pattern.DOTALL );


	/**
	 * Returns true if the given source attribute value satisfies this constraint.
	 */
	public abstract boolean accepts( String sourceValue );

	/**
	 * Returns the pattern value this constraint was parsed from.
	 */
	public abstract String getRawValue();


	/**
	 * Parses a pattern attribute value.
	 *
	 * @param location describes where the value came from, for error messages
	 * @throws StructureRegexException <br>
	 * if the value is wrapped as re{...} but its contents have invalid syntax as defined by {@link java.util.regex.Pattern}
	 */
	public static AttributeConstraint parse( String rawValue, String location ) {
		if ( isRegexWrapped( rawValue ) ) {
			String regex = rawValue.substring( rawValue.indexOf( '{' ) + 1, rawValue.lastIndexOf( '}' ) );
			return new Regex( rawValue, compile( location, regex ) );
		}
		return new Literal( rawValue );
	}

	/**
	 * Returns true if the whole value has the form re{...}.
	 */
	public static boolean isRegexWrapped( String rawValue ) {
		return REGEX_WRAPPER.matcher( rawValue ).matches();
	}

	protected static Pattern compile( String location, String regex ) {
		try {
			return Pattern.compile( regex );
		}
		catch ( PatternSyntaxException pse ) {
			String locationDescription = String.format( "Regular expression syntax error...\nCheck %s.\n", location );
			throw new StructureRegexException( locationDescription, pse );
		}
	}


	/**
	 * Requires exact, case-sensitive equality.
	 */
	public static class Literal extends AttributeConstraint {
		private final String value;

		public Literal( String value ) {
			this.value = value;
		}

		@Override
		public boolean accepts( String sourceValue ) {
			return value.equals( sourceValue );
		}

		@Override
		public String getRawValue() {
			return value;
		}

		@Override
		public String toString() {
			return "Literal(" + value + ")";
		}
	}


	/**
	 * Requires the regex to match at the start of the source value.
	 * The match need not consume the whole value.
	 */
	public static class Regex extends AttributeConstraint {
		private final String rawValue;
		private final Pattern pattern;

		public Regex( String rawValue, Pattern pattern ) {
			this.rawValue = rawValue;
			this.pattern = pattern;
		}

		@Override
		public boolean accepts( String sourceValue ) {
			if ( sourceValue == null ) return false;

			Matcher m = pattern.matcher( sourceValue );
			return m.lookingAt();
		}

		@Override
		public String getRawValue() {
			return rawValue;
		}

		public Pattern getPattern() {
			return pattern;
		}

		@Override
		public String toString() {
			return "Regex(" + pattern.pattern() + ")";
		}
	}
}
