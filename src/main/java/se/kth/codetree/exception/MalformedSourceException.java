package se.kth.codetree.exception;

import se.kth.codetree.syntax.SourcePosition;

/**
 * Thrown when the syntax tree is inconsistent with the source lines it was parsed from, for example when a node
 * claims a position outside of the source.
 */
public class MalformedSourceException extends CodeTreeException {
    private final SourcePosition position;

    public MalformedSourceException(String s, SourcePosition position) {
        super(s + " at " + position);
        this.position = position;
    }

    public MalformedSourceException(String s, SourcePosition position, Throwable throwable) {
        super(s + " at " + position, throwable);
        this.position = position;
    }

    /**
     * @return The position of the offending node.
     */
    public SourcePosition getPosition() {
        return position;
    }
}
