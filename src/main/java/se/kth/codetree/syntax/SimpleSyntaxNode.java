package se.kth.codetree.syntax;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * An immutable, general-purpose {@link SyntaxNode} for parsers that have no node type of their own.
 */
public final class SimpleSyntaxNode implements SyntaxNode {
    private final SyntaxKind kind;
    private final String name;
    private final SourcePosition position;
    private final List<SyntaxNode> body;
    private final List<SyntaxNode> alternate;
    private final List<SyntaxNode> handlers;
    private final List<SyntaxNode> cleanup;
    private final Map<Branch, SourcePosition> branchPositions;

    private SimpleSyntaxNode(Builder builder) {
        kind = builder.kind;
        name = builder.name;
        position = builder.position;
        body = Collections.unmodifiableList(new ArrayList<>(builder.body));
        alternate = Collections.unmodifiableList(new ArrayList<>(builder.alternate));
        handlers = Collections.unmodifiableList(new ArrayList<>(builder.handlers));
        cleanup = Collections.unmodifiableList(new ArrayList<>(builder.cleanup));
        branchPositions = new EnumMap<>(builder.branchPositions);
    }

    public static Builder builder(SyntaxKind kind, SourcePosition position) {
        return new Builder(kind, position);
    }

    /**
     * @return A non-compound statement node.
     */
    public static SimpleSyntaxNode statement(int line, int column) {
        return builder(SyntaxKind.STATEMENT, SourcePosition.of(line, column)).build();
    }

    @Override
    public SyntaxKind getKind() {
        return kind;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public SourcePosition getPosition() {
        return position;
    }

    @Override
    public List<SyntaxNode> getBody() {
        return body;
    }

    @Override
    public List<SyntaxNode> getAlternate() {
        return alternate;
    }

    @Override
    public List<SyntaxNode> getHandlers() {
        return handlers;
    }

    @Override
    public List<SyntaxNode> getCleanup() {
        return cleanup;
    }

    @Override
    public SourcePosition getBranchPosition(Branch branch) {
        return branchPositions.getOrDefault(branch, position);
    }

    @Override
    public String toString() {
        return kind + (name != null ? "(" + name + ")" : "") + "@" + position;
    }

    public static final class Builder {
        private final SyntaxKind kind;
        private final SourcePosition position;
        private String name;
        private final List<SyntaxNode> body = new ArrayList<>();
        private final List<SyntaxNode> alternate = new ArrayList<>();
        private final List<SyntaxNode> handlers = new ArrayList<>();
        private final List<SyntaxNode> cleanup = new ArrayList<>();
        private final Map<Branch, SourcePosition> branchPositions = new EnumMap<>(Branch.class);

        private Builder(SyntaxKind kind, SourcePosition position) {
            this.kind = Objects.requireNonNull(kind);
            this.position = Objects.requireNonNull(position);
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder body(List<? extends SyntaxNode> statements) {
            body.addAll(statements);
            return this;
        }

        public Builder alternate(List<? extends SyntaxNode> statements) {
            alternate.addAll(statements);
            return this;
        }

        public Builder alternate(SourcePosition keyword, List<? extends SyntaxNode> statements) {
            branchPositions.put(Branch.ALTERNATE, keyword);
            return alternate(statements);
        }

        public Builder handler(SyntaxNode handler) {
            handlers.add(handler);
            return this;
        }

        public Builder cleanup(SourcePosition keyword, List<? extends SyntaxNode> statements) {
            branchPositions.put(Branch.CLEANUP, keyword);
            cleanup.addAll(statements);
            return this;
        }

        public SimpleSyntaxNode build() {
            if (kind == SyntaxKind.HANDLER && !(alternate.isEmpty() && handlers.isEmpty() && cleanup.isEmpty())) {
                throw new IllegalStateException("A handler only has a body");
            }
            return new SimpleSyntaxNode(this);
        }
    }
}
