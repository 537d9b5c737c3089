package net.vhati.structmatch.core;

import java.util.List;

import com.google.common.base.Preconditions;

import org.jdom2.Element;


/**
 * Tests whether a source element structurally contains a pattern.
 *
 * A source element matches a pattern node when the tags are equal, the
 * attributes satisfy the pattern's rules, and each pattern child can be
 * given a "friend": a distinct source child that matches it recursively,
 * with friends appearing in the same relative order as the pattern children.
 *
 * Friends are assigned greedily, leftmost first, and earlier choices are
 * never reconsidered. Some inputs that a different assignment would
 * satisfy are therefore reported as non-matches.
 */
public class StructureMatcher {

	public static final int DEFAULT_MAX_DEPTH = 512;

	private final int maxDepth;
	private final MatchTrace trace;


	public StructureMatcher() {
		this( DEFAULT_MAX_DEPTH, MatchTrace.NONE );
	}

	public StructureMatcher( MatchTrace trace ) {
		this( DEFAULT_MAX_DEPTH, trace );
	}

	/**
	 * @param maxDepth how many levels below a candidate the match may recurse
	 * @param trace receives call counts, or MatchTrace.NONE
	 */
	public StructureMatcher( int maxDepth, MatchTrace trace ) {
		Preconditions.checkArgument( maxDepth >= 0, "maxDepth is not >= 0: %s", maxDepth );
		this.maxDepth = maxDepth;
		this.trace = Preconditions.checkNotNull( trace );
	}


	public int getMaxDepth() {
		return maxDepth;
	}

	public MatchTrace getTrace() {
		return trace;
	}


	/**
	 * Returns true if the source element matches the pattern.
	 *
	 * @throws StructureDepthException if recursion goes deeper than the max depth
	 */
	public boolean matches( Element source, StructurePattern pattern ) {
		return matches( source, pattern, 0 );
	}

	/**
	 * Returns true if each pattern child finds a friend among the source children.
	 */
	public boolean childSubsetMatches( List<Element> sourceChildren, List<StructurePattern> patternChildren ) {
		return findFriends( sourceChildren, patternChildren, 0 ) != null;
	}

	/**
	 * Returns the index, among the source element's children, of the friend
	 * chosen for each pattern child, or null if the children don't match.
	 *
	 * Only the children are checked; the caller is responsible for the
	 * source element's own tag and attributes.
	 */
	public int[] friendIndexes( Element source, StructurePattern pattern ) {
		return findFriends( source.getChildren(), pattern.getChildren(), 0 );
	}


	protected boolean matches( Element source, StructurePattern pattern, int depth ) {
		if ( depth > maxDepth )
			throw new StructureDepthException( maxDepth, ElementPaths.getPathToRoot( source ) );

		trace.recordMatchCall( depth );

		if ( !pattern.hasTagOf( source ) ) return false;
		if ( !AttributeMatcher.attributesSatisfy( source, pattern ) ) return false;

		return findFriends( source.getChildren(), pattern.getChildren(), depth ) != null;
	}

	/**
	 * Scans source children left to right, claiming the first match for each pattern child.
	 *
	 * @return friend indexes, one per pattern child (empty for a leaf pattern), or null on failure
	 */
	protected int[] findFriends( List<Element> sourceChildren, List<StructurePattern> patternChildren, int depth ) {
		int sourceSize = sourceChildren.size();
		int targetSize = patternChildren.size();

		if ( targetSize == 0 ) return new int[0];

		// Need at least as many potential friends as pattern children.
		if ( sourceSize < targetSize ) return null;

		trace.recordChildScan();

		int[] friends = new int[targetSize];
		int j = 0;

		for ( int i=0; i < targetSize; i++ ) {
			StructurePattern patternChild = patternChildren.get( i );
			boolean friendFound = false;

			while ( j < sourceSize ) {
				if ( matches( sourceChildren.get( j ), patternChild, depth+1 ) ) {
					friendFound = true;
					friends[i] = j;
					j++;
					break;
				}
				j++;
			}

			// Too few unclaimed source children left for the remaining pattern children.
			if ( !friendFound || sourceSize - j < targetSize - (i+1) ) return null;
		}

		return friends;
	}
}
