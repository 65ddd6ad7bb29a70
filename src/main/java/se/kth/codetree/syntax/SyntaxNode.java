package se.kth.codetree.syntax;

import java.util.List;

/**
 * A node of a syntax tree produced by an external parser. The clause builder only needs the kind of a node, its
 * position and the statement sequences of its branches; everything else about the node is opaque.
 *
 * Branches that a kind does not have must be returned as empty lists, never null.
 */
public interface SyntaxNode {

    SyntaxKind getKind();

    /**
     * @return The name of a named definition, or null for any other kind of node.
     */
    String getName();

    /**
     * @return The position of the node's first token.
     */
    SourcePosition getPosition();

    /**
     * @return The statements of the body (or primary branch).
     */
    List<SyntaxNode> getBody();

    /**
     * @return The statements of the alternate branch of a conditional, the exhaustion branch of a loop or the
     *      completion branch of a protected region.
     */
    List<SyntaxNode> getAlternate();

    /**
     * @return The handlers of a protected region, each of kind {@link SyntaxKind#HANDLER}.
     */
    List<SyntaxNode> getHandlers();

    /**
     * @return The statements of the cleanup branch of a protected region.
     */
    List<SyntaxNode> getCleanup();

    /**
     * Parsers that know where the keyword opening a branch is located should override this. The default is the
     * position of the node itself, which is on the same indentation level as the keyword in well-formed input.
     *
     * @param branch A keyword-opened branch.
     * @return The position of the keyword opening the branch.
     */
    default SourcePosition getBranchPosition(Branch branch) {
        return getPosition();
    }

    /**
     * @return true iff any of the branches of this node has statements.
     */
    default boolean hasBranches() {
        return !getBody().isEmpty() || !getAlternate().isEmpty()
                || !getHandlers().isEmpty() || !getCleanup().isEmpty();
    }
}
