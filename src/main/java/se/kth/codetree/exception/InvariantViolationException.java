package se.kth.codetree.exception;

/**
 * Thrown when construction of the clause graph or the block tree breaks one of its structural invariants. This
 * always indicates a bug in the decomposition or grouping tables (or input that they cannot represent), and aborts
 * construction for the whole input.
 */
public class InvariantViolationException extends CodeTreeException {
    public InvariantViolationException(String s) {
        super(s);
    }

    public InvariantViolationException(String s, Throwable throwable) {
        super(s, throwable);
    }
}
