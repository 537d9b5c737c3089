package net.vhati.structmatch.core;

import java.util.List;

import org.jdom2.Element;

import net.vhati.structmatch.core.StructurePattern.AttributeRule;


/**
 * Decides whether a source element's attributes satisfy a pattern node's attribute rules.
 *
 * Subset semantics: every rule must be satisfied, extra source attributes are ignored.
 */
public final class AttributeMatcher {

	private AttributeMatcher() {
	}


	public static boolean attributesSatisfy( Element source, StructurePattern pattern ) {
		return attributesSatisfy( source, pattern.getAttributeRules() );
	}

	/**
	 * Returns true if every rule is satisfied by the source element.
	 *
	 * A rule naming an attribute the source lacks is a failed match, not an error.
	 */
	public static boolean attributesSatisfy( Element source, List<AttributeRule> rules ) {
		if ( rules.isEmpty() ) return true;

		// Necessary, not sufficient.
		if ( source.getAttributes().size() < rules.size() ) return false;

		String sourceValue;
		for ( AttributeRule rule : rules ) {
			sourceValue = source.getAttributeValue( rule.getName(), rule.getNamespace() );
			if ( sourceValue == null ) return false;

			if ( !rule.getConstraint().accepts( sourceValue ) ) return false;
		}
		return true;
	}
}
