package se.kth.codetree.clause;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import se.kth.codetree.exception.InvariantViolationException;
import se.kth.codetree.syntax.SourcePosition;
import se.kth.codetree.syntax.SyntaxKind;
import se.kth.codetree.syntax.SyntaxNode;
import se.kth.codetree.util.DepthFirstIterator;

/**
 * A clause of the clause graph. A clause wraps a syntax node together with the part of the node it represents: a
 * compound construct is represented by one clause per non-empty branch, while a simple statement is represented by
 * a single clause tagged {@link ClauseTag#NONE}.
 *
 * Clauses are linked in three ways. The parent/child links form the clause tree, the sibling links order the
 * children of one parent, and the predecessor/successor links form a single linear order over the whole graph that
 * is equal to a pre-order traversal of the clause tree. All links are set by {@link ClauseBuilder} and never change
 * afterwards.
 */
public class ClauseNode {
    private final SyntaxNode syntax;
    private final ClauseTag tag;
    private final SourcePosition position;
    private final ClauseNode parent;
    private final List<ClauseNode> children = new ArrayList<>();

    private ClauseNode prevSibling;
    private ClauseNode nextSibling;
    private ClauseNode predecessor;
    private ClauseNode successor;
    private int index = -1;

    ClauseNode(SyntaxNode syntax, ClauseTag tag, SourcePosition position, ClauseNode parent) {
        this.syntax = syntax;
        this.tag = tag;
        this.position = position;
        this.parent = parent;
    }

    /**
     * @return The syntax node this clause was created from. For handler clauses this is the handler, and for
     *      promoted clauses this is the cascaded conditional.
     */
    public SyntaxNode getSyntax() {
        return syntax;
    }

    public SyntaxKind getSyntaxKind() {
        return syntax.getKind();
    }

    public ClauseTag getTag() {
        return tag;
    }

    /**
     * @return The position of the clause's first token.
     */
    public SourcePosition getPosition() {
        return position;
    }

    public int getLine() {
        return position.getLine();
    }

    /**
     * @return The parent clause, or null for top-level clauses.
     */
    public ClauseNode getParent() {
        return parent;
    }

    public List<ClauseNode> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public ClauseNode getPrevSibling() {
        return prevSibling;
    }

    public ClauseNode getNextSibling() {
        return nextSibling;
    }

    /**
     * @return The clause before this one in the linear order, or null for the first clause.
     */
    public ClauseNode getPredecessor() {
        return predecessor;
    }

    /**
     * @return The clause after this one in the linear order, or null for the last clause.
     */
    public ClauseNode getSuccessor() {
        return successor;
    }

    /**
     * @return The 0-based index of this clause in the linear order.
     */
    public int getIndex() {
        return index;
    }

    /**
     * @return true iff this clause wraps a simple statement.
     */
    public boolean isSimple() {
        return tag == ClauseTag.NONE;
    }

    /**
     * @return true iff this clause is the body of a class or function-like definition.
     */
    public boolean isNamedDefinition() {
        return syntax.getKind() == SyntaxKind.NAMED_DEFINITION && tag == ClauseTag.BODY;
    }

    /**
     * @return A pre-order iterator over this clause and all of its descendants.
     */
    public Iterator<ClauseNode> walk() {
        return DepthFirstIterator.of(this, ClauseNode::getChildren);
    }

    /**
     * Link this clause and the argument as direct neighbours in the linear order.
     *
     * @param next The clause that succeeds this one.
     * @throws InvariantViolationException if this clause already has a successor, or the argument already has a
     *      predecessor.
     */
    void linkSuccessor(ClauseNode next) {
        if (successor != null) {
            throw new InvariantViolationException(
                    "Attempted to assign successor " + next + " to " + this + ", which already has successor "
                            + successor);
        }
        if (next.predecessor != null) {
            throw new InvariantViolationException(
                    "Attempted to assign predecessor " + this + " to " + next + ", which already has predecessor "
                            + next.predecessor);
        }
        successor = next;
        next.predecessor = this;
    }

    void setIndex(int index) {
        this.index = index;
    }

    boolean isLinked() {
        return index >= 0;
    }

    /**
     * Append a clause to the end of a sibling list, linking it to the previous last sibling.
     */
    static void appendSibling(List<ClauseNode> siblings, ClauseNode clause) {
        if (!siblings.isEmpty()) {
            ClauseNode last = siblings.get(siblings.size() - 1);
            last.nextSibling = clause;
            clause.prevSibling = last;
        }
        siblings.add(clause);
    }

    List<ClauseNode> mutableChildren() {
        return children;
    }

    @Override
    public String toString() {
        return "Clause(" + syntax.getKind() + "," + tag + ")@" + position;
    }
}
