package se.kth.codetree.block;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import se.kth.codetree.clause.ClauseNode;
import se.kth.codetree.exception.InvariantViolationException;
import se.kth.codetree.syntax.SourceLines;
import se.kth.codetree.util.DepthFirstIterator;

/**
 * A node of the block tree. A block groups a contiguous run of clauses that share a nesting level, and owns the
 * blocks nested inside of it.
 *
 * Like clauses, blocks have sibling links and predecessor/successor links. The latter form a linear order over the
 * whole block tree that is equal to its pre-order traversal. Blocks are built by {@link BlockGrouper} and are sealed
 * once the grouper is done with them.
 */
public class BlockNode {
    private final BlockKind kind;
    private final String name;
    private final String indentation;
    private final SourceLines sourceLines;
    private final List<ClauseNode> clauses = new ArrayList<>();
    private final List<BlockNode> children = new ArrayList<>();

    private BlockNode parent;
    private BlockNode prevSibling;
    private BlockNode nextSibling;
    private BlockNode predecessor;
    private BlockNode successor;
    private boolean sealed = false;

    private BlockNode(BlockKind kind, String name, String indentation, SourceLines sourceLines) {
        this.kind = kind;
        this.name = name;
        this.indentation = indentation;
        this.sourceLines = sourceLines;
    }

    static BlockNode newPackage(String name) {
        return new BlockNode(BlockKind.PACKAGE, name, null, null);
    }

    static BlockNode newModule(String name, SourceLines sourceLines) {
        return new BlockNode(BlockKind.MODULE, name, null, sourceLines);
    }

    /**
     * Create a nested block and append it to the children of its parent.
     */
    static BlockNode newNested(BlockKind kind, String name, String indentation, BlockNode parent) {
        BlockNode block = new BlockNode(kind, name, indentation, null);
        parent.adopt(block);
        return block;
    }

    public BlockKind getKind() {
        return kind;
    }

    /**
     * @return The name of a package, module or named definition, or null for any other block.
     */
    public String getName() {
        return name;
    }

    /**
     * @return The leading whitespace of the block's first line, or null for packages and modules.
     */
    public String getIndentation() {
        return indentation;
    }

    /**
     * @return The clauses that belong directly to this block, in linear order.
     */
    public List<ClauseNode> getClauses() {
        return Collections.unmodifiableList(clauses);
    }

    public List<BlockNode> getChildren() {
        return Collections.unmodifiableList(children);
    }

    /**
     * @return The parent block, or null for the root.
     */
    public BlockNode getParent() {
        return parent;
    }

    public BlockNode getPrevSibling() {
        return prevSibling;
    }

    public BlockNode getNextSibling() {
        return nextSibling;
    }

    /**
     * @return The block before this one in pre-order, or null for the root.
     */
    public BlockNode getPredecessor() {
        return predecessor;
    }

    /**
     * @return The block after this one in pre-order, or null for the last block.
     */
    public BlockNode getSuccessor() {
        return successor;
    }

    public boolean isSealed() {
        return sealed;
    }

    /**
     * @return true iff the block is followed by an increase in indentation.
     */
    public boolean startsBlock() {
        return kind.startsBlock();
    }

    /**
     * @return The ancestors of this block from the root down to and including this block.
     */
    public List<BlockNode> getLineage() {
        List<BlockNode> lineage = new ArrayList<>();
        for (BlockNode block = this; block != null; block = block.parent) {
            lineage.add(block);
        }
        Collections.reverse(lineage);
        return lineage;
    }

    /**
     * @return The closest ancestor that is a named definition, a module or a package, or null if there is none.
     */
    public BlockNode getContext() {
        for (BlockNode block = parent; block != null; block = block.parent) {
            if (block.kind != BlockKind.BLOCK && block.kind != BlockKind.RUN) {
                return block;
            }
        }
        return null;
    }

    /**
     * @return The module this block belongs to (itself for modules), or null for packages.
     */
    public BlockNode getModule() {
        for (BlockNode block = this; block != null; block = block.parent) {
            if (block.kind == BlockKind.MODULE) {
                return block;
            }
        }
        return null;
    }

    public BlockNode getRoot() {
        BlockNode block = this;
        while (block.parent != null) {
            block = block.parent;
        }
        return block;
    }

    /**
     * @return The raw source lines of the module this block belongs to.
     */
    public SourceLines getSourceLines() {
        return requireModule().sourceLines;
    }

    /**
     * @return The 1-based first line of the block. Modules start at line 1.
     */
    public int getStartLine() {
        if (kind == BlockKind.MODULE) {
            return 1;
        }
        requireModule();
        return clauses.get(0).getLine();
    }

    /**
     * @return The 1-based line after the last line of the block, which is the start line of the successor if it is in
     *      the same module, or one past the end of the source otherwise.
     */
    public int getEndLine() {
        BlockNode module = requireModule();
        if (successor != null && successor.getModule() == module) {
            return successor.getStartLine();
        }
        return module.sourceLines.size() + 1;
    }

    /**
     * @return The raw source lines in the range [start line, end line). Lines of nested blocks are not included, as
     *      the first nested block is the successor of its parent.
     */
    public List<String> getLines() {
        return getSourceLines().slice(getStartLine(), getEndLine());
    }

    /**
     * @return A pre-order iterator over this block and all of its descendants.
     */
    public Iterator<BlockNode> walk() {
        return DepthFirstIterator.of(this, BlockNode::getChildren);
    }

    /**
     * @return The last block of this block's subtree in pre-order.
     */
    BlockNode lastDescendant() {
        BlockNode block = this;
        while (!block.children.isEmpty()) {
            block = block.children.get(block.children.size() - 1);
        }
        return block;
    }

    ClauseNode lastClause() {
        return clauses.isEmpty() ? null : clauses.get(clauses.size() - 1);
    }

    void addClause(ClauseNode clause) {
        checkNotSealed();
        ClauseNode last = lastClause();
        if (last != null && clause.getPredecessor() != last) {
            throw new InvariantViolationException(
                    "Clauses of " + this + " are not contiguous: " + clause + " does not follow " + last);
        }
        clauses.add(clause);
    }

    void adopt(BlockNode child) {
        checkNotSealed();
        if (child.parent != null) {
            throw new InvariantViolationException(child + " already has parent " + child.parent);
        }
        if (!children.isEmpty()) {
            BlockNode last = children.get(children.size() - 1);
            last.nextSibling = child;
            child.prevSibling = last;
        }
        children.add(child);
        child.parent = this;
    }

    void linkSuccessor(BlockNode next) {
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

    void seal() {
        sealed = true;
    }

    private void checkNotSealed() {
        if (sealed) {
            throw new InvariantViolationException("Attempted to modify sealed block " + this);
        }
    }

    private BlockNode requireModule() {
        BlockNode module = getModule();
        if (module == null) {
            throw new UnsupportedOperationException("A package has no source lines");
        }
        return module;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Block(").append(kind);
        if (name != null) {
            sb.append(",").append(name);
        }
        if (!clauses.isEmpty()) {
            sb.append(")@").append(clauses.get(0).getPosition());
        } else {
            sb.append(")");
        }
        return sb.toString();
    }
}
