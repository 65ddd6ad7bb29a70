package se.kth.codetree.syntax;

/**
 * Language-specific text heuristics. The only one needed is the detection of cascaded alternate branches, that is
 * a conditional that forms the entire alternate branch of another conditional and is written with the alternate
 * keyword directly in front of it (elif, else if) instead of in a nested block.
 *
 * The detection works on the raw text because parsers generally represent both spellings with the same tree.
 */
public enum Dialect {
    /** Cascaded conditionals start their line with the elif keyword. */
    PYTHON {
        @Override
        public boolean isCascadedConditional(SyntaxNode conditional, SourceLines lines) {
            String line = lines.get(conditional.getPosition().getLine()).trim();
            return startsWithKeyword(line, "elif");
        }
    },

    /** Cascaded conditionals are directly preceded by the else keyword on the same line. */
    JAVA {
        @Override
        public boolean isCascadedConditional(SyntaxNode conditional, SourceLines lines) {
            String before = lines.textBefore(conditional.getPosition()).trim();
            return endsWithKeyword(before, "else");
        }
    };

    /**
     * @param conditional A conditional that is the only statement of another conditional's alternate branch.
     * @param lines The source lines the conditional was parsed from.
     * @return true iff the conditional is written as a cascaded alternate branch.
     */
    public abstract boolean isCascadedConditional(SyntaxNode conditional, SourceLines lines);

    private static boolean startsWithKeyword(String text, String keyword) {
        return text.startsWith(keyword)
                && (text.length() == keyword.length()
                        || !Character.isJavaIdentifierPart(text.charAt(keyword.length())));
    }

    private static boolean endsWithKeyword(String text, String keyword) {
        int start = text.length() - keyword.length();
        return text.endsWith(keyword)
                && (start == 0 || !Character.isJavaIdentifierPart(text.charAt(start - 1)));
    }
}
