package se.kth.codetree.syntax;

/**
 * Branches of a compound construct that are opened by their own keyword.
 */
public enum Branch {
    ALTERNATE,
    CLEANUP
}
