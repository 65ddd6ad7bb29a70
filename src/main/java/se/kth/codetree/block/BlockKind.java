package se.kth.codetree.block;

/**
 * The kinds of block nodes.
 */
public enum BlockKind {
    /** A directory of modules. Has a name but no clauses. */
    PACKAGE,
    /** A single source file. Has a name and at most the body clause of the file. */
    MODULE,
    /** A class or function-like definition. */
    NAMED_DEF,
    /** An anonymous nested scope, such as the branches of a conditional or a loop. */
    BLOCK,
    /** A flat sequence of simple statements. */
    RUN;

    /**
     * @return true iff blocks of this kind are followed by an increase in indentation.
     */
    public boolean startsBlock() {
        return this == NAMED_DEF || this == BLOCK;
    }
}
