package org.pywalrus.parser.fstring;

import java.util.ArrayList;
import java.util.List;

import org.pywalrus.WalrusSyntaxException;

/**
 * Splits the body of an f-string into literal text and replacement fields, with the
 * rules of Python 3.8: no backslashes or comments inside expressions, quotes inside
 * expressions must differ from the enclosing ones, {@code :} and {@code !} end the
 * expression only outside brackets, {@code =} before the end makes the field
 * self-documenting.
 */
public final class FStringScanner {

    private static final String CONVERSIONS = "sra";

    private final String body;
    private final boolean raw;
    private final String sourceName;
    private final int line;
    private final int column;
    private int pos;

    private FStringScanner(StringLiteral literal, String sourceName, int line, int column) {
        this.body = literal.body();
        this.raw = literal.isRaw();
        this.sourceName = sourceName;
        this.line = line;
        this.column = column;
    }

    public static List<FStringPiece> scan(StringLiteral literal, String sourceName, int line, int column) {
        if (!literal.isFormatted()) {
            throw new IllegalArgumentException("Not an f-string: " + literal.toSource());
        }
        FStringScanner scanner = new FStringScanner(literal, sourceName, line, column);
        return scanner.scanPieces(false);
    }

    /**
     * All replacement fields of {@code pieces}, each followed by the fields of its format spec.
     */
    public static List<FStringPiece.Field> fields(List<FStringPiece> pieces) {
        return FStringPiece.fields(pieces);
    }

    private List<FStringPiece> scanPieces(boolean inSpec) {
        List<FStringPiece> pieces = new ArrayList<>();
        StringBuilder text = new StringBuilder();
        while (pos < body.length()) {
            char c = body.charAt(pos);
            if (c == '\\') {
                if (!raw && body.startsWith("\\N{", pos)) {
                    int close = body.indexOf('}', pos);
                    if (close < 0) {
                        throw error("malformed \\N character escape");
                    }
                    text.append(body, pos, close + 1);
                    pos = close + 1;
                    continue;
                }
                text.append(c);
                pos++;
                if (!raw && pos < body.length() && !isBrace(body.charAt(pos))) {
                    text.append(body.charAt(pos));
                    pos++;
                }
                continue;
            }
            if (c == '{') {
                if (!inSpec && next() == '{') {
                    text.append("{{");
                    pos += 2;
                    continue;
                }
                flush(text, pieces);
                pos++;
                pieces.add(scanField());
                continue;
            }
            if (c == '}') {
                if (inSpec) {
                    flush(text, pieces);
                    return pieces;
                }
                if (next() == '}') {
                    text.append("}}");
                    pos += 2;
                    continue;
                }
                throw error("single '}' is not allowed");
            }
            text.append(c);
            pos++;
        }
        if (inSpec) {
            throw error("expecting '}'");
        }
        flush(text, pieces);
        return pieces;
    }

    private FStringPiece.Field scanField() {
        int start = pos;
        int depth = 0;
        int expressionEnd = -1;
        String debugText = null;
        while (expressionEnd < 0) {
            if (pos >= body.length()) {
                throw error("expecting '}'");
            }
            char c = body.charAt(pos);
            switch (c) {
                case '\\':
                    throw error("expression part cannot include a backslash");
                case '#':
                    throw error("expression part cannot include '#'");
                case '\'':
                case '"':
                    skipString(c);
                    continue;
                case '(':
                case '[':
                case '{':
                    depth++;
                    break;
                case ')':
                case ']':
                    if (--depth < 0) {
                        throw error("unmatched '" + c + "'");
                    }
                    break;
                case '}':
                    if (depth == 0) {
                        expressionEnd = pos;
                        continue;
                    }
                    depth--;
                    break;
                case '!':
                    if (depth == 0 && next() != '=') {
                        expressionEnd = pos;
                        continue;
                    }
                    break;
                case ':':
                    if (depth == 0) {
                        expressionEnd = pos;
                        continue;
                    }
                    break;
                case '=':
                    if (depth == 0 && next() != '=' && !isComparisonStart(previous())) {
                        expressionEnd = pos;
                        pos++;
                        while (pos < body.length() && Character.isWhitespace(body.charAt(pos))) {
                            pos++;
                        }
                        debugText = body.substring(start, pos);
                        continue;
                    }
                    break;
                default:
                    break;
            }
            pos++;
        }

        String expression = body.substring(start, expressionEnd);
        if (expression.isBlank()) {
            throw error("empty expression not allowed");
        }

        Character conversion = null;
        if (pos < body.length() && body.charAt(pos) == '!') {
            pos++;
            if (pos >= body.length() || CONVERSIONS.indexOf(body.charAt(pos)) < 0) {
                throw error("invalid conversion character: expected 's', 'r', or 'a'");
            }
            conversion = body.charAt(pos);
            pos++;
        }

        List<FStringPiece> formatSpec = null;
        if (pos < body.length() && body.charAt(pos) == ':') {
            pos++;
            formatSpec = scanPieces(true);
        }

        if (pos >= body.length() || body.charAt(pos) != '}') {
            throw error("expecting '}'");
        }
        pos++;
        return new FStringPiece.Field(expression, debugText, conversion, formatSpec);
    }

    private void skipString(char quote) {
        String delimiter = body.startsWith(String.valueOf(quote).repeat(3), pos)
                ? String.valueOf(quote).repeat(3)
                : String.valueOf(quote);
        int close = body.indexOf(delimiter, pos + delimiter.length());
        if (close < 0) {
            throw error("unterminated string in expression part");
        }
        pos = close + delimiter.length();
    }

    private char next() {
        return pos + 1 < body.length() ? body.charAt(pos + 1) : '\0';
    }

    private char previous() {
        return pos > 0 ? body.charAt(pos - 1) : '\0';
    }

    private static boolean isComparisonStart(char c) {
        return c == '=' || c == '!' || c == '<' || c == '>';
    }

    private static boolean isBrace(char c) {
        return c == '{' || c == '}';
    }

    private static void flush(StringBuilder text, List<FStringPiece> pieces) {
        if (text.length() > 0) {
            pieces.add(new FStringPiece.Literal(text.toString()));
            text.setLength(0);
        }
    }

    private WalrusSyntaxException error(String message) {
        return new WalrusSyntaxException("f-string: " + message, sourceName, line, column);
    }
}
