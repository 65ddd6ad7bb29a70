package se.kth.codetree.exception;

/**
 * Base exception for code tree construction failures.
 */
public abstract class CodeTreeException extends RuntimeException {
    public CodeTreeException(String s) {
        super(s);
    }

    public CodeTreeException(String s, Throwable throwable) {
        super(s, throwable);
    }
}
