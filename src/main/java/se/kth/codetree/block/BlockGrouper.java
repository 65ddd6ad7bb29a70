package se.kth.codetree.block;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import se.kth.codetree.clause.ClauseGraph;
import se.kth.codetree.clause.ClauseNode;
import se.kth.codetree.exception.InvariantViolationException;
import se.kth.codetree.syntax.SourceLines;
import se.kth.codetree.syntax.SyntaxKind;
import se.kth.codetree.util.LazyLogger;

/**
 * Groups the linear order of a clause graph into a tree of blocks, using the indentation of each clause's first line
 * to decide where blocks open and close.
 *
 * The grouper is a state machine that consumes the clauses one at a time. The block currently collecting clauses is
 * kept in {@code current}, and its ancestors on an explicit stack. A clause that closes the current block is not
 * consumed, but sent through the machine again against the parent block.
 *
 * <ul>
 *     <li>{@link State#NEW_BLOCK}: open a child of the current block with the clause.</li>
 *     <li>{@link State#BUILD}: compare the clause's indentation to that of the current block, and either append the
 *     clause, open a nested block for it or close the current block.</li>
 *     <li>{@link State#END_BLOCK}: seal the current block and return to its parent.</li>
 *     <li>{@link State#DONE}: all clauses are consumed and all blocks are sealed.</li>
 * </ul>
 *
 * A named definition or a compound construct collects the simple statements directly below it until a nested block
 * is opened. From then on, statements at that level are collected in runs, so that the clauses of any block are
 * contiguous in the linear order.
 */
public class BlockGrouper {
    private static final LazyLogger LOGGER = new LazyLogger(BlockGrouper.class);

    enum State {
        NEW_BLOCK, BUILD, END_BLOCK, DONE
    }

    private enum Relation {
        DEEPER, EQUAL, DEDENT
    }

    private final SourceLines lines;
    private final Deque<BlockNode> stack = new ArrayDeque<>();
    private final Map<ClauseNode, BlockNode> owners = new IdentityHashMap<>();
    private BlockNode current;
    private boolean consumed;

    private BlockGrouper(SourceLines lines) {
        this.lines = lines;
    }

    /**
     * Group a clause graph into a block tree rooted in a module block.
     *
     * @param moduleName The name of the module.
     * @param graph A clause graph built from the module.
     * @param lines The source lines of the module.
     * @return The module block.
     * @throws InvariantViolationException if the indentation of the clauses is inconsistent.
     */
    public static BlockNode group(String moduleName, ClauseGraph graph, SourceLines lines) {
        BlockGrouper grouper = new BlockGrouper(lines);
        BlockNode module = grouper.run(BlockNode.newModule(moduleName, lines), graph.iterator());
        linkBlocks(module, grouper.owners);
        LOGGER.debug(() -> "Grouped " + graph.size() + " clauses of module " + moduleName + " into "
                + grouper.owners.values().stream().distinct().count() + " blocks");
        return module;
    }

    /**
     * Wrap already grouped modules in a package block, and link the modules together in the block linear order.
     *
     * @param name The name of the package.
     * @param modules Module blocks, in the order they should appear in the package.
     * @return The package block.
     */
    public static BlockNode assemblePackage(String name, List<BlockNode> modules) {
        BlockNode pkg = BlockNode.newPackage(name);
        BlockNode previous = pkg;
        for (BlockNode module : modules) {
            if (module.getKind() != BlockKind.MODULE && module.getKind() != BlockKind.PACKAGE) {
                throw new IllegalArgumentException("Only modules and packages can be put in a package, got " + module);
            }
            pkg.adopt(module);
            previous.linkSuccessor(module);
            previous = module.lastDescendant();
        }
        pkg.seal();
        return pkg;
    }

    private BlockNode run(BlockNode module, Iterator<ClauseNode> clauses) {
        current = module;
        ClauseNode clause = clauses.hasNext() ? clauses.next() : null;
        if (clause != null && clause.getSyntaxKind() == SyntaxKind.MODULE) {
            add(module, clause);
        } else {
            consumed = false;
        }

        State state = State.BUILD;
        while (state != State.DONE) {
            if (consumed) {
                clause = clauses.hasNext() ? clauses.next() : null;
            }
            consumed = false;

            State next;
            switch (state) {
                case NEW_BLOCK:
                    next = newBlock(clause);
                    break;
                case BUILD:
                    next = build(clause);
                    break;
                case END_BLOCK:
                    next = endBlock(clause);
                    break;
                default:
                    throw new IllegalStateException("Invalid state: " + state);
            }
            traceTransition(state, next, clause);
            state = next;
        }
        return current;
    }

    private State newBlock(ClauseNode clause) {
        BlockKind kind;
        if (clause.isNamedDefinition()) {
            kind = BlockKind.NAMED_DEF;
        } else if (clause.isSimple()) {
            kind = BlockKind.RUN;
        } else {
            kind = BlockKind.BLOCK;
        }
        String name = kind == BlockKind.NAMED_DEF ? clause.getSyntax().getName() : null;

        BlockNode block = BlockNode.newNested(kind, name, indentationOf(clause), current);
        stack.push(current);
        current = block;
        add(block, clause);
        return State.BUILD;
    }

    private State build(ClauseNode clause) {
        if (clause == null) {
            return State.END_BLOCK;
        }

        Relation relation = relate(clause, current.getIndentation());
        BlockKind kind = current.getKind();
        boolean collecting = kind.startsBlock() && current.getChildren().isEmpty();
        switch (relation) {
            case DEEPER:
                if ((kind == BlockKind.RUN || collecting) && clause.isSimple()) {
                    add(current, clause);
                    return State.BUILD;
                }
                // runs are flat, anything else nested below a statement belongs to the enclosing block
                return kind == BlockKind.RUN ? State.END_BLOCK : State.NEW_BLOCK;
            case EQUAL:
                if ((kind == BlockKind.RUN && clause.isSimple())
                        || (collecting && clause.getTag().isContinuation())) {
                    add(current, clause);
                    return State.BUILD;
                }
                return State.END_BLOCK;
            case DEDENT:
                return State.END_BLOCK;
            default:
                throw new IllegalStateException("Invalid relation: " + relation);
        }
    }

    private State endBlock(ClauseNode clause) {
        current.seal();
        if (stack.isEmpty()) {
            if (clause != null) {
                throw new InvariantViolationException(
                        "Indentation of " + clause + " decreases past the root block " + current);
            }
            return State.DONE;
        }
        current = stack.pop();
        return clause == null ? State.END_BLOCK : State.BUILD;
    }

    private void add(BlockNode block, ClauseNode clause) {
        block.addClause(clause);
        owners.put(clause, block);
        consumed = true;
    }

    private String indentationOf(ClauseNode clause) {
        return lines.indentation(clause.getLine());
    }

    /**
     * Relate the indentation of a clause to the indentation of a block. A dedent is a strictly shorter indentation
     * that is a prefix of the block's. Indentations that are not prefixes of each other cannot be related.
     */
    private Relation relate(ClauseNode clause, String blockIndentation) {
        String indentation = indentationOf(clause);
        if (blockIndentation == null) {
            return Relation.DEEPER;
        } else if (indentation.equals(blockIndentation)) {
            return Relation.EQUAL;
        } else if (indentation.startsWith(blockIndentation)) {
            return Relation.DEEPER;
        } else if (blockIndentation.startsWith(indentation)) {
            return Relation.DEDENT;
        }
        throw new InvariantViolationException(
                "Inconsistent indentation of " + clause + ": " + quote(indentation)
                        + " is unrelated to the indentation " + quote(blockIndentation) + " of " + current);
    }

    /**
     * Derive the block linear order from the clause linear order. Clauses of a block are contiguous, so the
     * successor of a block is the owner of the clause after its last clause.
     */
    private static void linkBlocks(BlockNode root, Map<ClauseNode, BlockNode> owners) {
        for (Iterator<BlockNode> it = root.walk(); it.hasNext(); ) {
            BlockNode block = it.next();
            BlockNode successor;
            if (block.lastClause() == null) {
                successor = block.getChildren().isEmpty() ? null : block.getChildren().get(0);
            } else {
                ClauseNode next = block.lastClause().getSuccessor();
                successor = next == null ? null : owners.get(next);
            }
            if (successor != null) {
                block.linkSuccessor(successor);
            }
        }
    }

    private void traceTransition(State from, State to, ClauseNode clause) {
        LOGGER.trace(() -> from + " -> " + to + " on " + clause + " in " + current
                + (consumed ? "" : " (not consumed)"));
    }

    private static String quote(String indentation) {
        return "\"" + indentation.replace("\t", "\\t") + "\"";
    }
}
