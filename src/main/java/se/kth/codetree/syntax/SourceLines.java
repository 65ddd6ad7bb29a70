package se.kth.codetree.syntax;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import se.kth.codetree.exception.MalformedSourceException;

/**
 * The raw text of a source file as an ordered list of lines, without line terminators. Lines are addressed with
 * 1-based indices, matching {@link SourcePosition}.
 */
public final class SourceLines {
    private final List<String> lines;

    private SourceLines(List<String> lines) {
        this.lines = Collections.unmodifiableList(lines);
    }

    /**
     * Split source text into lines. Any of \n, \r\n and \r terminate a line, and a terminator at the very end of the
     * text does not start a new line.
     *
     * @param source The full text of a source file.
     * @return The lines of the source.
     */
    public static SourceLines of(String source) {
        if (source.isEmpty()) {
            return new SourceLines(new ArrayList<>());
        }
        List<String> lines = new ArrayList<>(Arrays.asList(source.split("\\r\\n|\\r|\\n", -1)));
        if (lines.get(lines.size() - 1).isEmpty()) {
            lines.remove(lines.size() - 1);
        }
        return new SourceLines(lines);
    }

    public static SourceLines of(List<String> lines) {
        return new SourceLines(new ArrayList<>(lines));
    }

    /**
     * @return The amount of lines in the source.
     */
    public int size() {
        return lines.size();
    }

    /**
     * @param line A 1-based line number.
     * @return The text of the line.
     * @throws MalformedSourceException if the line is outside of the source.
     */
    public String get(int line) {
        if (line < 1 || line > lines.size()) {
            throw new MalformedSourceException(
                    "Line outside of source with " + lines.size() + " lines", SourcePosition.of(line, 1));
        }
        return lines.get(line - 1);
    }

    /**
     * Check that a position points into the source. A column directly after the last character of a line is
     * allowed.
     *
     * @param position A position reported by a parser.
     * @throws MalformedSourceException if the position is outside of the source.
     */
    public void validate(SourcePosition position) {
        if (position.getLine() < 1 || position.getLine() > lines.size()) {
            throw new MalformedSourceException(
                    "Position outside of source with " + lines.size() + " lines", position);
        }
        int length = lines.get(position.getLine() - 1).length();
        if (position.getColumn() < 1 || position.getColumn() > length + 1) {
            throw new MalformedSourceException("Column outside of line of length " + length, position);
        }
    }

    /**
     * @param line A 1-based line number.
     * @return The leading whitespace of the line.
     */
    public String indentation(int line) {
        String text = get(line);
        int end = 0;
        while (end < text.length() && isIndentation(text.charAt(end))) {
            ++end;
        }
        return text.substring(0, end);
    }

    /**
     * @param position A position in the source.
     * @return The text on the position's line that precedes the position.
     */
    public String textBefore(SourcePosition position) {
        validate(position);
        return get(position.getLine()).substring(0, position.getColumn() - 1);
    }

    /**
     * @param start First line, inclusive.
     * @param end Last line, exclusive.
     * @return The lines in the range.
     */
    public List<String> slice(int start, int end) {
        if (start > end) {
            throw new IllegalArgumentException("Invalid line range [" + start + ", " + end + ")");
        }
        if (start == end) {
            return Collections.emptyList();
        }
        get(start);
        get(end - 1);
        return lines.subList(start - 1, end - 1);
    }

    private static boolean isIndentation(char c) {
        return c == ' ' || c == '\t' || c == '\f';
    }
}
