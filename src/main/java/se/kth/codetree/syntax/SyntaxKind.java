package se.kth.codetree.syntax;

/**
 * The kinds of syntax tree nodes that the clause builder distinguishes between.
 */
public enum SyntaxKind {
    /** The root of a source file. Only has a body. */
    MODULE,
    /** A class or function-like definition. Only has a body, and carries a name. */
    NAMED_DEFINITION,
    /** A block-scoping construct, such as a resource block or a nested block. Only has a body. */
    SCOPE,
    /** A conditional with a primary branch (the body) and an optional alternate branch. */
    CONDITIONAL,
    /** A loop with a body and an optional exhaustion branch (the alternate). */
    ITERATION,
    /** A protected region with a body, handlers, a completion branch (the alternate) and a cleanup branch. */
    PROTECTED_REGION,
    /** A single handler of a protected region. Only has a body. */
    HANDLER,
    /** Any non-compound statement. */
    STATEMENT
}
