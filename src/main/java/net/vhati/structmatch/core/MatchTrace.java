package net.vhati.structmatch.core;


/**
 * Counts the work a {@link StructureMatcher} does.
 *
 * A trace belongs to the caller that supplies it; matchers never share one
 * unless the caller hands the same trace to both. Use {@link #NONE} to skip counting.
 */
public class MatchTrace {

	/** A trace that records nothing. */
	public static final MatchTrace NONE = new MatchTrace() {
		@Override
		public void recordMatchCall( int depth ) {
		}

		@Override
		public void recordChildScan() {
		}

		@Override
		public void reset() {
		}

		@Override
		public String toString() {
			return "MatchTrace.NONE";
		}
	};

	private long matchCalls = 0;
	private long childScans = 0;
	private int maxDepth = 0;


	public void recordMatchCall( int depth ) {
		matchCalls++;
		if ( depth > maxDepth ) maxDepth = depth;
	}

	public void recordChildScan() {
		childScans++;
	}

	public void reset() {
		matchCalls = 0;
		childScans = 0;
		maxDepth = 0;
	}

	/** Returns the number of node-level match tests. */
	public long getMatchCalls() {
		return matchCalls;
	}

	/** Returns the number of child-subset scans that got past the size checks. */
	public long getChildScans() {
		return childScans;
	}

	/** Returns the deepest recursion level seen, 0 being a traversal candidate. */
	public int getMaxDepth() {
		return maxDepth;
	}

	@Override
	public String toString() {
		return String.format( "MatchTrace(matchCalls=%d, childScans=%d, maxDepth=%d)", matchCalls, childScans, maxDepth );
	}
}
