package se.kth.codetree.clause;

import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import se.kth.codetree.util.DepthFirstIterator;

/**
 * A fully linked clause graph. Iterating over the graph follows the successor links from the first clause, which
 * visits the clauses in the same order as {@link #preOrder()}.
 */
public class ClauseGraph implements Iterable<ClauseNode> {
    private final List<ClauseNode> topLevel;
    private final ClauseNode first;
    private final ClauseNode last;
    private final int size;

    ClauseGraph(List<ClauseNode> topLevel, ClauseNode last, int size) {
        this.topLevel = Collections.unmodifiableList(topLevel);
        this.first = topLevel.isEmpty() ? null : topLevel.get(0);
        this.last = last;
        this.size = size;
    }

    /**
     * @return The clauses without a parent. A module produces at most one, but a conditional or a try statement
     *      built on its own produces one per branch.
     */
    public List<ClauseNode> getTopLevel() {
        return topLevel;
    }

    /**
     * @return The first clause of the linear order, or null if the graph is empty. For a module this is its body
     *      clause, the parent of every other clause.
     */
    public ClauseNode getFirst() {
        return first;
    }

    /**
     * @return The last clause of the linear order, or null if the graph is empty.
     */
    public ClauseNode getLast() {
        return last;
    }

    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    /**
     * @return A pre-order iterator over the clause tree that uses the parent/child links only.
     */
    public Iterator<ClauseNode> preOrder() {
        return DepthFirstIterator.ofForest(topLevel, ClauseNode::getChildren);
    }

    /**
     * @return An iterator that follows the successor links, starting from the first clause.
     */
    @Override
    public Iterator<ClauseNode> iterator() {
        return new Iterator<ClauseNode>() {
            private ClauseNode next = first;

            @Override
            public boolean hasNext() {
                return next != null;
            }

            @Override
            public ClauseNode next() {
                if (next == null) {
                    throw new NoSuchElementException();
                }
                ClauseNode current = next;
                next = current.getSuccessor();
                return current;
            }
        };
    }
}
