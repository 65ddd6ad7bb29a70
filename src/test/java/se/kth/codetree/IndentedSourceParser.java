package se.kth.codetree;

import java.util.ArrayList;
import java.util.List;
import se.kth.codetree.syntax.SimpleSyntaxNode;
import se.kth.codetree.syntax.SourceLines;
import se.kth.codetree.syntax.SourcePosition;
import se.kth.codetree.syntax.SyntaxKind;
import se.kth.codetree.syntax.SyntaxNode;

/**
 * A parser for a small, Python-like language where compound statements end their header line with a colon and
 * their body is indented. It understands def, class, if/elif/else, for/while with else, try/except/else/finally and
 * with. Any other line is a simple statement.
 */
public class IndentedSourceParser {
    private final SourceLines lines;
    private int line = 1;

    private IndentedSourceParser(SourceLines lines) {
        this.lines = lines;
    }

    /**
     * Parse source text into a module node positioned at 1:1.
     */
    public static SimpleSyntaxNode parse(String source) {
        IndentedSourceParser parser = new IndentedSourceParser(SourceLines.of(source));
        List<SyntaxNode> body = parser.statements("");
        if (parser.skipBlank()) {
            throw new IllegalArgumentException("Unexpected indentation at line " + parser.line);
        }
        return SimpleSyntaxNode.builder(SyntaxKind.MODULE, SourcePosition.of(1, 1)).body(body).build();
    }

    private List<SyntaxNode> statements(String indent) {
        List<SyntaxNode> statements = new ArrayList<>();
        while (skipBlank() && lines.indentation(line).equals(indent) && !isContinuation(keyword())) {
            statements.add(statement(indent));
        }
        if (skipBlank() && lines.indentation(line).length() > indent.length()) {
            throw new IllegalArgumentException("Unexpected indent at line " + line);
        }
        return statements;
    }

    private SyntaxNode statement(String indent) {
        SourcePosition position = here(indent);
        String keyword = keyword();
        switch (keyword) {
            case "def":
            case "class":
                String header = lines.get(line).trim().substring(keyword.length()).trim();
                String name = header.split("[(:]")[0].trim();
                line++;
                return SimpleSyntaxNode.builder(SyntaxKind.NAMED_DEFINITION, position)
                        .name(name)
                        .body(suite(indent))
                        .build();
            case "if":
                return conditional(indent, position);
            case "for":
            case "while": {
                line++;
                SimpleSyntaxNode.Builder builder =
                        SimpleSyntaxNode.builder(SyntaxKind.ITERATION, position).body(suite(indent));
                if (atKeyword(indent, "else")) {
                    SourcePosition elsePosition = here(indent);
                    line++;
                    builder.alternate(elsePosition, suite(indent));
                }
                return builder.build();
            }
            case "try": {
                line++;
                SimpleSyntaxNode.Builder builder =
                        SimpleSyntaxNode.builder(SyntaxKind.PROTECTED_REGION, position).body(suite(indent));
                while (atKeyword(indent, "except")) {
                    SourcePosition handlerPosition = here(indent);
                    line++;
                    builder.handler(SimpleSyntaxNode.builder(SyntaxKind.HANDLER, handlerPosition)
                            .body(suite(indent))
                            .build());
                }
                if (atKeyword(indent, "else")) {
                    SourcePosition elsePosition = here(indent);
                    line++;
                    builder.alternate(elsePosition, suite(indent));
                }
                if (atKeyword(indent, "finally")) {
                    SourcePosition finallyPosition = here(indent);
                    line++;
                    builder.cleanup(finallyPosition, suite(indent));
                }
                return builder.build();
            }
            case "with":
                line++;
                return SimpleSyntaxNode.builder(SyntaxKind.SCOPE, position).body(suite(indent)).build();
            default:
                line++;
                return SimpleSyntaxNode.builder(SyntaxKind.STATEMENT, position).build();
        }
    }

    /**
     * Parse an if or elif line with its body, and any elif or else that follows. An elif becomes a conditional that
     * is the only statement of the alternate branch, positioned on the elif keyword.
     */
    private SyntaxNode conditional(String indent, SourcePosition position) {
        line++;
        SimpleSyntaxNode.Builder builder =
                SimpleSyntaxNode.builder(SyntaxKind.CONDITIONAL, position).body(suite(indent));
        if (atKeyword(indent, "elif")) {
            SourcePosition elifPosition = here(indent);
            List<SyntaxNode> cascaded = new ArrayList<>();
            cascaded.add(conditional(indent, elifPosition));
            builder.alternate(elifPosition, cascaded);
        } else if (atKeyword(indent, "else")) {
            SourcePosition elsePosition = here(indent);
            line++;
            builder.alternate(elsePosition, suite(indent));
        }
        return builder.build();
    }

    private List<SyntaxNode> suite(String parentIndent) {
        if (!skipBlank() || lines.indentation(line).length() <= parentIndent.length()) {
            throw new IllegalArgumentException("Expected an indented block at line " + line);
        }
        return statements(lines.indentation(line));
    }

    private boolean atKeyword(String indent, String keyword) {
        return skipBlank() && lines.indentation(line).equals(indent) && keyword().equals(keyword);
    }

    private boolean skipBlank() {
        while (line <= lines.size() && lines.get(line).trim().isEmpty()) {
            line++;
        }
        return line <= lines.size();
    }

    private String keyword() {
        String text = lines.get(line).trim();
        int end = 0;
        while (end < text.length() && Character.isJavaIdentifierPart(text.charAt(end))) {
            end++;
        }
        return text.substring(0, end);
    }

    private SourcePosition here(String indent) {
        return SourcePosition.of(line, indent.length() + 1);
    }

    private static boolean isContinuation(String keyword) {
        return keyword.equals("elif") || keyword.equals("else")
                || keyword.equals("except") || keyword.equals("finally");
    }
}
