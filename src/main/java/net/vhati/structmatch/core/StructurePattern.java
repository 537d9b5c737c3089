package net.vhati.structmatch.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.google.common.base.Preconditions;

import org.jdom2.Attribute;
import org.jdom2.Element;
import org.jdom2.Namespace;


/**
 * An immutable, compiled view of a pattern element.
 *
 * Attribute values are parsed into {@link AttributeConstraint}s once here,
 * so matching never re-examines the re{...} wrapper syntax.
 * The pattern element itself is not modified.
 */
public final class StructurePattern {

	private final Element element;
	private final String name;
	private final String namespaceURI;
	private final List<AttributeRule> attributeRules;
	private final List<StructurePattern> children;


	private StructurePattern( Element element, List<AttributeRule> attributeRules, List<StructurePattern> children ) {
		this.element = element;
		this.name = element.getName();
		this.namespaceURI = element.getNamespaceURI();
		this.attributeRules = Collections.unmodifiableList( attributeRules );
		this.children = Collections.unmodifiableList( children );
	}


	/**
	 * Compiles a pattern element and all its descendants.
	 *
	 * @throws StructureRegexException <br>
	 * if any attribute value is wrapped as re{...} with invalid regex syntax
	 */
	public static StructurePattern compile( Element patternRoot ) {
		Preconditions.checkNotNull( patternRoot, "Pattern root must not be null." );

		List<AttributeRule> rules = new ArrayList<AttributeRule>();
		for ( Attribute attr : patternRoot.getAttributes() ) {
			String location = String.format( "%s attribute at %s", attr.getQualifiedName(), ElementPaths.getPathToRoot( patternRoot ) );
			AttributeConstraint constraint = AttributeConstraint.parse( attr.getValue(), location );
			rules.add( new AttributeRule( attr.getName(), attr.getNamespace(), constraint ) );
		}

		List<StructurePattern> childPatterns = new ArrayList<StructurePattern>();
		for ( Element child : patternRoot.getChildren() ) {
			childPatterns.add( compile( child ) );
		}

		return new StructurePattern( patternRoot, rules, childPatterns );
	}


	/**
	 * Returns true if the given element has this pattern's tag (local name and namespace).
	 */
	public boolean hasTagOf( Element node ) {
		return name.equals( node.getName() ) && namespaceURI.equals( node.getNamespaceURI() );
	}

	/** Returns the pattern element this was compiled from. */
	public Element getElement() {
		return element;
	}

	public String getName() {
		return name;
	}

	public List<AttributeRule> getAttributeRules() {
		return attributeRules;
	}

	public List<StructurePattern> getChildren() {
		return children;
	}

	public int getChildCount() {
		return children.size();
	}

	@Override
	public String toString() {
		return "StructurePattern(" + ElementPaths.getPathToRoot( element ) + ")";
	}


	/**
	 * One attribute constraint of a pattern node.
	 */
	public static final class AttributeRule {
		private final String name;
		private final Namespace namespace;
		private final AttributeConstraint constraint;

		public AttributeRule( String name, Namespace namespace, AttributeConstraint constraint ) {
			this.name = name;
			this.namespace = namespace;
			this.constraint = constraint;
		}

		public String getName() {
			return name;
		}

		public Namespace getNamespace() {
			return namespace;
		}

		public AttributeConstraint getConstraint() {
			return constraint;
		}
	}
}
