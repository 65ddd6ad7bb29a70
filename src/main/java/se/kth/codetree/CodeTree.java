package se.kth.codetree;

import java.util.Iterator;
import se.kth.codetree.block.BlockGrouper;
import se.kth.codetree.block.BlockNode;
import se.kth.codetree.clause.ClauseBuilder;
import se.kth.codetree.clause.ClauseGraph;
import se.kth.codetree.syntax.Dialect;
import se.kth.codetree.syntax.SourceLines;
import se.kth.codetree.syntax.SyntaxNode;
import se.kth.codetree.util.LazyLogger;

/**
 * The structural model of a single source file: its clause graph and the block tree grouped from it.
 *
 * A code tree is never updated in place. To pick up changes to the source, parse it again and build a new tree.
 */
public class CodeTree {
    private static final LazyLogger LOGGER = new LazyLogger(CodeTree.class);

    private final ClauseGraph clauses;
    private final BlockNode root;

    private CodeTree(ClauseGraph clauses, BlockNode root) {
        this.clauses = clauses;
        this.root = root;
    }

    /**
     * Build the code tree of a module.
     *
     * @param moduleName The name of the module.
     * @param syntaxTree The syntax tree of the module, as produced by a parser.
     * @param lines The source lines the syntax tree was parsed from.
     * @param dialect The dialect of the source.
     * @return The code tree of the module.
     * @throws se.kth.codetree.exception.CodeTreeException if the tree cannot be built. No partial tree is returned.
     */
    public static CodeTree build(String moduleName, SyntaxNode syntaxTree, SourceLines lines, Dialect dialect) {
        LOGGER.debug(() -> "Building code tree for module " + moduleName);
        ClauseGraph clauses = ClauseBuilder.build(syntaxTree, lines, dialect);
        BlockNode root = BlockGrouper.group(moduleName, clauses, lines);
        return new CodeTree(clauses, root);
    }

    public ClauseGraph getClauses() {
        return clauses;
    }

    /**
     * @return The module block.
     */
    public BlockNode getRoot() {
        return root;
    }

    /**
     * @return A pre-order iterator over all blocks, starting with the module block.
     */
    public Iterator<BlockNode> walk() {
        return root.walk();
    }
}
