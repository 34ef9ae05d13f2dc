package org.pywalrus.transpiler;

import org.pywalrus.parser.ast.Node;

/**
 * Text helpers for splicing generated code between existing source lines.
 */
public final class Whitespace {

    /**
     * A node's code split around its significant text.
     *
     * @param leading  whitespace and comments in front of the first token
     * @param code     the significant text
     * @param trailing whitespace after the last token, only non-empty for nodes ending a line
     */
    public record Span(String leading, String code, String trailing) {
    }

    /**
     * Text before an insertion point split into the comment block that stays above
     * the inserted code and the code that follows it.
     */
    public record CommentSplit(String comments, String code) {
    }

    private Whitespace() {
    }

    public static Span extract(Node node) {
        String leading = node.getFirstLeaf().getPrefix();
        String rest = node.getCode().substring(leading.length());
        int end = rest.length();
        while (end > 0 && Character.isWhitespace(rest.charAt(end - 1))) {
            end--;
        }
        return new Span(leading, rest.substring(0, end), rest.substring(end));
    }

    /**
     * Splits off the leading lines of {@code text} that are blank or hold only a comment.
     */
    public static CommentSplit splitComments(String text) {
        int lineStart = 0;
        while (lineStart < text.length()) {
            int lineEnd = lineEnd(text, lineStart);
            if (lineEnd == text.length()) {
                // the last line has no terminator and therefore carries the code
                break;
            }
            String line = text.substring(lineStart, lineEnd).strip();
            if (!line.isEmpty() && !line.startsWith("#")) {
                break;
            }
            lineStart = skipLineBreak(text, lineEnd);
        }
        return new CommentSplit(text.substring(0, lineStart), text.substring(lineStart));
    }

    /**
     * How many blank lines must be added between {@code before} and {@code after} so
     * that at least {@code expected} blank lines separate their text.
     */
    public static int missingNewlines(String before, String after, int expected) {
        int present = trailingBlankLines(before) + leadingBlankLines(after);
        return Math.max(0, expected - present);
    }

    /**
     * Whether {@code text} has a line that is neither blank nor a comment.
     */
    public static boolean hasCode(CharSequence text) {
        for (String line : text.toString().split("\r\n|\r|\n")) {
            String stripped = line.strip();
            if (!stripped.isEmpty() && !stripped.startsWith("#")) {
                return true;
            }
        }
        return false;
    }

    public static boolean endsWithLineBreak(CharSequence text) {
        if (text.length() == 0) {
            return false;
        }
        char last = text.charAt(text.length() - 1);
        return last == '\n' || last == '\r';
    }

    /**
     * The indentation of a statement that starts a line: the whitespace after the last
     * line break in its prefix.
     */
    public static String indentationOf(Node statement) {
        String prefix = statement.getFirstLeaf().getPrefix();
        int start = Math.max(prefix.lastIndexOf('\n'), prefix.lastIndexOf('\r')) + 1;
        return prefix.substring(start);
    }

    static int trailingBlankLines(String text) {
        int breaks = 0;
        int i = text.length() - 1;
        while (i >= 0 && Character.isWhitespace(text.charAt(i))) {
            char c = text.charAt(i);
            if (c == '\n' || c == '\r' && (i + 1 >= text.length() || text.charAt(i + 1) != '\n')) {
                breaks++;
            }
            i--;
        }
        if (i < 0) {
            // nothing but whitespace, every line break ends a blank line
            return breaks;
        }
        return Math.max(0, breaks - 1);
    }

    static int leadingBlankLines(String text) {
        int breaks = 0;
        int lastBreakEnd = 0;
        int i = 0;
        while (i < text.length() && Character.isWhitespace(text.charAt(i))) {
            char c = text.charAt(i);
            if (c == '\n' || c == '\r' && (i + 1 >= text.length() || text.charAt(i + 1) != '\n')) {
                breaks++;
                lastBreakEnd = i + 1;
            }
            i++;
        }
        return lastBreakEnd == 0 ? 0 : breaks;
    }

    private static int lineEnd(String text, int from) {
        int i = from;
        while (i < text.length() && text.charAt(i) != '\n' && text.charAt(i) != '\r') {
            i++;
        }
        return i;
    }

    private static int skipLineBreak(String text, int lineEnd) {
        if (text.startsWith("\r\n", lineEnd)) {
            return lineEnd + 2;
        }
        return lineEnd + 1;
    }
}
