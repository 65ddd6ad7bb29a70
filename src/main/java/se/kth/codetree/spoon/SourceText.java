package se.kth.codetree.spoon;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import se.kth.codetree.syntax.SourcePosition;

/**
 * The text Spoon parsed a compilation unit from, indexed so that character offsets reported by Spoon can be
 * translated into positions. Line terminators are the same as those recognized by
 * {@link se.kth.codetree.syntax.SourceLines}, and columns count characters, so tabs are one column wide.
 */
final class SourceText {
    private final String source;
    private final int[] lineStarts;

    SourceText(String source) {
        this.source = source;
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int i = 0; i < source.length(); i++) {
            char c = source.charAt(i);
            if (c == '\n' || (c == '\r' && (i + 1 == source.length() || source.charAt(i + 1) != '\n'))) {
                starts.add(i + 1);
            }
        }
        lineStarts = starts.stream().mapToInt(Integer::intValue).toArray();
    }

    /**
     * @param offset A 0-based character offset.
     * @return The line and column of the offset.
     */
    SourcePosition positionOf(int offset) {
        if (offset < 0 || offset > source.length()) {
            throw new IllegalArgumentException("Offset " + offset + " outside of text of length " + source.length());
        }
        int index = Arrays.binarySearch(lineStarts, offset);
        int line = index >= 0 ? index : -index - 2;
        return SourcePosition.of(line + 1, offset - lineStarts[line] + 1);
    }

    /**
     * @return The first offset at or after the given one that is not whitespace, a comment or a semicolon.
     */
    int skipTrivia(int offset) {
        int i = offset;
        while (i < source.length()) {
            char c = source.charAt(i);
            if (Character.isWhitespace(c) || c == ';') {
                i++;
            } else if (source.startsWith("//", i)) {
                while (i < source.length() && source.charAt(i) != '\n' && source.charAt(i) != '\r') {
                    i++;
                }
            } else if (source.startsWith("/*", i)) {
                int end = source.indexOf("*/", i + 2);
                i = end < 0 ? source.length() : end + 2;
            } else {
                break;
            }
        }
        return i;
    }

    boolean startsWithKeyword(int offset, String keyword) {
        int end = offset + keyword.length();
        return source.startsWith(keyword, offset)
                && (end >= source.length() || !Character.isJavaIdentifierPart(source.charAt(end)));
    }
}
