package net.vhati.structmatch.core;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import com.google.common.base.Preconditions;

import org.jdom2.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


/**
 * Seeks a pattern's structure anywhere within a source tree, root included.
 *
 * Results are the source tree's own elements, in the strategy's visitation
 * order. A matching element and a matching descendant are both reported.
 * Nothing in the source tree is modified; the *Trimmed methods return
 * detached copies.
 */
public class StructureFinder {

	private static final Logger LOG = LoggerFactory.getLogger( StructureFinder.class );

	private final StructureMatcher matcher;
	private final StructureTrimmer trimmer;
	private final SearchStrategy strategy;


	public StructureFinder( SearchStrategy strategy ) {
		this( new StructureMatcher(), strategy );
	}

	public StructureFinder( StructureMatcher matcher, SearchStrategy strategy ) {
		this.matcher = Preconditions.checkNotNull( matcher );
		this.strategy = Preconditions.checkNotNull( strategy );
		// Trimming re-runs matches; keep that work out of the caller's trace.
		this.trimmer = new StructureTrimmer( new StructureMatcher( matcher.getMaxDepth(), MatchTrace.NONE ) );
	}


	public SearchStrategy getStrategy() {
		return strategy;
	}

	public StructureMatcher getMatcher() {
		return matcher;
	}


	/**
	 * Returns true if any element in the tree matches the pattern.
	 */
	public boolean exists( Element sourceRoot, StructurePattern pattern ) {
		return findFirst( sourceRoot, pattern ) != null;
	}

	/**
	 * Returns the first matching element in visitation order, or null if there are none.
	 */
	public Element findFirst( Element sourceRoot, StructurePattern pattern ) {
		Iterator<Element> it = candidates( sourceRoot, pattern );
		Element result = ( it.hasNext() ? it.next() : null );

		LOG.debug( "{} first match for {}: {}", strategy, pattern, ( result != null ? ElementPaths.getPathToRoot( result ) : "none" ) );
		return result;
	}

	/**
	 * Returns all matching elements in visitation order.
	 *
	 * An empty list will be returned if there were no matches.
	 */
	public List<Element> findAll( Element sourceRoot, StructurePattern pattern ) {
		List<Element> matchedNodes = new ArrayList<Element>();
		Iterator<Element> it = candidates( sourceRoot, pattern );
		while ( it.hasNext() ) {
			matchedNodes.add( it.next() );
		}

		LOG.debug( "{} found {} match(es) for {}", strategy, matchedNodes.size(), pattern );
		return matchedNodes;
	}

	public int count( Element sourceRoot, StructurePattern pattern ) {
		return findAll( sourceRoot, pattern ).size();
	}

	/**
	 * Returns a trimmed copy of the first match, or null if there are none.
	 */
	public Element findFirstTrimmed( Element sourceRoot, StructurePattern pattern ) {
		Element match = findFirst( sourceRoot, pattern );
		if ( match == null ) return null;

		return trimmer.trim( match, pattern );
	}

	/**
	 * Returns trimmed copies of all matches, in visitation order.
	 */
	public List<Element> findAllTrimmed( Element sourceRoot, StructurePattern pattern ) {
		List<Element> results = new ArrayList<Element>();
		for ( Element match : findAll( sourceRoot, pattern ) ) {
			results.add( trimmer.trim( match, pattern ) );
		}
		return results;
	}


	/**
	 * Returns a lazy iterator over matching elements, so callers wanting
	 * only the first stop testing once it's found.
	 */
	protected Iterator<Element> candidates( Element sourceRoot, StructurePattern pattern ) {
		Preconditions.checkNotNull( sourceRoot, "Source root must not be null." );
		Preconditions.checkNotNull( pattern, "Pattern must not be null." );

		if ( strategy == SearchStrategy.BREADTH_FIRST ) {
			return new BreadthFirstIterator( sourceRoot, new StructureFilter( matcher, pattern ) );
		}
		return new DepthFirstIterator( sourceRoot, new StructureFilter( matcher, pattern ) );
	}


	/**
	 * Pre-order: the root itself, then JDOM's document-order descendants.
	 */
	private static class DepthFirstIterator implements Iterator<Element> {
		private final StructureFilter filter;
		private final Element sourceRoot;
		private boolean rootTested = false;
		private Iterator<Element> descendants = null;
		private Element pending = null;

		public DepthFirstIterator( Element sourceRoot, StructureFilter filter ) {
			this.filter = filter;
			this.sourceRoot = sourceRoot;
		}

		@Override
		public boolean hasNext() {
			if ( pending != null ) return true;

			if ( !rootTested ) {
				rootTested = true;
				if ( filter.matches( sourceRoot ) ) {
					pending = sourceRoot;
					return true;
				}
			}

			if ( descendants == null ) {
				descendants = sourceRoot.getDescendants( filter ).iterator();
			}
			if ( descendants.hasNext() ) {
				pending = descendants.next();
			}
			return ( pending != null );
		}

		@Override
		public Element next() {
			if ( !hasNext() ) throw new NoSuchElementException();

			Element result = pending;
			pending = null;
			return result;
		}
	}


	/**
	 * Level order over a queue of elements, testing each as it's dequeued.
	 */
	private static class BreadthFirstIterator implements Iterator<Element> {
		private final StructureFilter filter;
		private final Deque<Element> queue = new ArrayDeque<Element>();
		private Element pending = null;

		public BreadthFirstIterator( Element sourceRoot, StructureFilter filter ) {
			this.filter = filter;
			queue.add( sourceRoot );
		}

		@Override
		public boolean hasNext() {
			while ( pending == null && !queue.isEmpty() ) {
				Element node = queue.poll();
				queue.addAll( node.getChildren() );

				if ( filter.matches( node ) ) pending = node;
			}
			return ( pending != null );
		}

		@Override
		public Element next() {
			if ( !hasNext() ) throw new NoSuchElementException();

			Element result = pending;
			pending = null;
			return result;
		}
	}
}
