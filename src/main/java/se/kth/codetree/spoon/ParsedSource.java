package se.kth.codetree.spoon;

import se.kth.codetree.CodeTree;
import se.kth.codetree.syntax.Dialect;
import se.kth.codetree.syntax.SourceLines;

/**
 * A parsed Java source file: its module name, syntax tree and raw lines.
 */
public class ParsedSource {
    private final String moduleName;
    private final SpoonSyntaxNode syntaxTree;
    private final SourceLines lines;

    public ParsedSource(String moduleName, SpoonSyntaxNode syntaxTree, SourceLines lines) {
        this.moduleName = moduleName;
        this.syntaxTree = syntaxTree;
        this.lines = lines;
    }

    public String getModuleName() {
        return moduleName;
    }

    public SpoonSyntaxNode getSyntaxTree() {
        return syntaxTree;
    }

    public SourceLines getLines() {
        return lines;
    }

    /**
     * @return A freshly built code tree of this source.
     */
    public CodeTree toCodeTree() {
        return CodeTree.build(moduleName, syntaxTree, lines, Dialect.JAVA);
    }
}
