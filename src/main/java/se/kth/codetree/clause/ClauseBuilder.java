package se.kth.codetree.clause;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import se.kth.codetree.exception.InvariantViolationException;
import se.kth.codetree.syntax.Branch;
import se.kth.codetree.syntax.Dialect;
import se.kth.codetree.syntax.SourceLines;
import se.kth.codetree.syntax.SourcePosition;
import se.kth.codetree.syntax.SyntaxKind;
import se.kth.codetree.syntax.SyntaxNode;
import se.kth.codetree.util.LazyLogger;

/**
 * Builds a clause graph from a syntax tree in a single pass. Each compound construct is split into one clause per
 * non-empty branch, and every clause is linked into the linear order as soon as it is known to be part of the graph.
 *
 * Branch clauses are created as pending placeholders and committed only when their first descendant is committed.
 * A branch that ends up without any clause (because all of its statements were empty constructs) is therefore
 * dropped without ever having been linked. Cascaded conditionals (elif, else if) are never wrapped in a branch
 * clause at all: they are promoted to the level of the conditional they continue and tagged
 * {@link ClauseTag#ALTERNATE_BRANCH}, which places them in the linear order directly after the primary branch's
 * subtree.
 */
public class ClauseBuilder {
    private static final LazyLogger LOGGER = new LazyLogger(ClauseBuilder.class);

    private final SourceLines lines;
    private final Dialect dialect;
    private final List<ClauseNode> topLevel = new ArrayList<>();
    private final Deque<ClauseNode> pending = new ArrayDeque<>();
    private ClauseNode tail = null;
    private int size = 0;

    private ClauseBuilder(SourceLines lines, Dialect dialect) {
        this.lines = lines;
        this.dialect = dialect;
    }

    /**
     * Build the clause graph of a syntax tree.
     *
     * @param root The root of the syntax tree, typically a {@link SyntaxKind#MODULE} node.
     * @param lines The source lines the tree was parsed from.
     * @param dialect The dialect used to detect cascaded conditionals.
     * @return A fully linked clause graph.
     * @throws se.kth.codetree.exception.InvariantViolationException if the tree contains constructs that cannot be
     *      decomposed.
     * @throws se.kth.codetree.exception.MalformedSourceException if a node's position is outside of the source.
     */
    public static ClauseGraph build(SyntaxNode root, SourceLines lines, Dialect dialect) {
        ClauseBuilder builder = new ClauseBuilder(lines, dialect);
        builder.visit(root, null);
        if (!builder.pending.isEmpty()) {
            throw new InvariantViolationException("Unresolved branch clauses after build: " + builder.pending);
        }
        LOGGER.debug(() -> "Built clause graph with " + builder.size + " clauses from " + root);
        return new ClauseGraph(builder.topLevel, builder.tail, builder.size);
    }

    private void visit(SyntaxNode node, ClauseNode parent) {
        switch (node.getKind()) {
            case MODULE:
            case NAMED_DEFINITION:
            case SCOPE:
                visitBranch(node, ClauseTag.BODY, node.getPosition(), node.getBody(), parent);
                break;
            case ITERATION:
                visitBranch(node, ClauseTag.BODY, node.getPosition(), node.getBody(), parent);
                visitBranch(node, ClauseTag.ELSE_BRANCH, node.getBranchPosition(Branch.ALTERNATE),
                        node.getAlternate(), parent);
                break;
            case CONDITIONAL:
                visitConditional(node, ClauseTag.BODY, parent);
                break;
            case PROTECTED_REGION:
                visitProtectedRegion(node, parent);
                break;
            case STATEMENT:
                if (node.hasBranches()) {
                    throw new InvariantViolationException(
                            "Unrecognized compound construct " + node + ": statements must not have branches");
                }
                commitPending();
                commit(createClause(node, ClauseTag.NONE, node.getPosition(), parent));
                break;
            default:
                throw new InvariantViolationException(
                        "Unrecognized construct " + node + " in the body of " + describe(parent));
        }
    }

    /**
     * Visit a conditional. The head tag is {@link ClauseTag#BODY} for a conditional in its own right, and
     * {@link ClauseTag#ALTERNATE_BRANCH} for one that was promoted from the alternate branch of an outer
     * conditional. Either way, all clauses of the conditional are placed under the given parent.
     */
    private void visitConditional(SyntaxNode node, ClauseTag headTag, ClauseNode parent) {
        visitBranch(node, headTag, node.getPosition(), node.getBody(), parent);

        List<SyntaxNode> alternate = node.getAlternate();
        if (isCascaded(alternate)) {
            SyntaxNode cascaded = alternate.get(0);
            LOGGER.trace(() -> "Promoting cascaded conditional " + cascaded + " to the level of " + node);
            visitConditional(cascaded, ClauseTag.ALTERNATE_BRANCH, parent);
        } else {
            visitBranch(node, ClauseTag.ELSE_BRANCH, node.getBranchPosition(Branch.ALTERNATE), alternate, parent);
        }
    }

    private void visitProtectedRegion(SyntaxNode node, ClauseNode parent) {
        visitBranch(node, ClauseTag.BODY, node.getPosition(), node.getBody(), parent);
        for (SyntaxNode handler : node.getHandlers()) {
            if (handler.getKind() != SyntaxKind.HANDLER) {
                throw new InvariantViolationException("Expected a handler in " + node + ", got " + handler);
            }
            visitBranch(handler, ClauseTag.HANDLER_BRANCH, handler.getPosition(), handler.getBody(), parent);
        }
        visitBranch(node, ClauseTag.ELSE_BRANCH, node.getBranchPosition(Branch.ALTERNATE),
                node.getAlternate(), parent);
        visitBranch(node, ClauseTag.CLEANUP_BRANCH, node.getBranchPosition(Branch.CLEANUP),
                node.getCleanup(), parent);
    }

    private void visitBranch(
            SyntaxNode node, ClauseTag tag, SourcePosition position, List<SyntaxNode> statements, ClauseNode parent) {
        if (statements.isEmpty()) {
            return;
        }

        ClauseNode branch = createClause(node, tag, position, parent);
        pending.addLast(branch);
        for (SyntaxNode statement : statements) {
            visit(statement, branch);
        }

        if (!branch.isLinked()) {
            if (pending.peekLast() != branch) {
                throw new InvariantViolationException(
                        "Pending branch clauses resolved out of order: expected " + branch + ", got "
                                + pending.peekLast());
            }
            pending.removeLast();
            LOGGER.trace(() -> "Dropped " + branch + " as none of its statements produced a clause");
        }
    }

    private boolean isCascaded(List<SyntaxNode> alternate) {
        return alternate.size() == 1
                && alternate.get(0).getKind() == SyntaxKind.CONDITIONAL
                && dialect.isCascadedConditional(alternate.get(0), lines);
    }

    private ClauseNode createClause(SyntaxNode node, ClauseTag tag, SourcePosition position, ClauseNode parent) {
        lines.validate(position);
        return new ClauseNode(node, tag, position, parent);
    }

    /**
     * Commit all pending branch clauses, outermost first. This is done right before a clause is committed, as any
     * pending branch is an ancestor of that clause.
     */
    private void commitPending() {
        while (!pending.isEmpty()) {
            commit(pending.removeFirst());
        }
    }

    private void commit(ClauseNode clause) {
        ClauseNode parent = clause.getParent();
        ClauseNode.appendSibling(parent == null ? topLevel : parent.mutableChildren(), clause);
        if (tail != null) {
            tail.linkSuccessor(clause);
        }
        clause.setIndex(size++);
        tail = clause;
        LOGGER.trace(() -> "Linked " + clause + " at index " + clause.getIndex());
    }

    private static String describe(ClauseNode parent) {
        return parent == null ? "the root" : parent.toString();
    }
}
