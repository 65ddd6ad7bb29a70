package se.kth.codetree.clause;

/**
 * Tags a clause with the part of a compound construct that it represents.
 */
public enum ClauseTag {
    /** The body of a construct, or the primary branch of a conditional. */
    BODY,
    /** A cascaded conditional that was promoted to the level of the conditional it continues. */
    ALTERNATE_BRANCH,
    /** The alternate branch of a conditional, the exhaustion branch of a loop or the completion branch of a try. */
    ELSE_BRANCH,
    /** One handler of a protected region. */
    HANDLER_BRANCH,
    /** The cleanup branch of a protected region. */
    CLEANUP_BRANCH,
    /** Not a clause of a compound construct, but a simple statement. */
    NONE;

    /**
     * @return true iff a clause with this tag continues the construct of an earlier clause at the same level.
     */
    public boolean isContinuation() {
        return this == ELSE_BRANCH || this == HANDLER_BRANCH || this == CLEANUP_BRANCH;
    }
}
