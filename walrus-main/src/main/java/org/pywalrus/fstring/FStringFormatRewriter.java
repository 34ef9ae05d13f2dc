package org.pywalrus.fstring;

import java.util.ArrayList;
import java.util.List;

import org.pywalrus.PythonVersion;
import org.pywalrus.parser.SourceParser;
import org.pywalrus.parser.ast.Leaf;
import org.pywalrus.parser.ast.Node;
import org.pywalrus.parser.fstring.FStringPiece;
import org.pywalrus.parser.fstring.FStringScanner;
import org.pywalrus.parser.fstring.StringLiteral;
import org.pywalrus.parser.util.AstUtils;

/**
 * Rewrites f-strings as {@code str.format} calls:
 * <pre>
 * f'{a!r:>{width}} and {b=}'   becomes   '{!r:>{}} and b={!r}'.format((a), (width), (b))
 * </pre>
 * Every part of an implicit concatenation becomes part of the format template, so
 * braces in the parts that were not f-strings are doubled.
 */
public final class FStringFormatRewriter implements FormattedLiteralRewriter {

    private static final String SOURCE_NAME = "<fstring>";

    @Override
    public String rewrite(String literal, PythonVersion version) {
        Node node = SourceParser.parseExpression(literal, version);
        if (!AstUtils.isStringAtom(node)) {
            throw new IllegalArgumentException("Not a string literal: " + literal);
        }
        List<Leaf> parts = new ArrayList<>();
        if (node instanceof Leaf leaf) {
            parts.add(leaf);
        } else {
            for (Node child : node.getChildren()) {
                parts.add((Leaf) child);
            }
        }
        if (parts.stream().noneMatch(part -> StringLiteral.of(part.getValue()).isFormatted())) {
            return literal;
        }

        StringBuilder text = new StringBuilder();
        List<String> arguments = new ArrayList<>();
        for (Leaf part : parts) {
            text.append(part.getPrefix());
            StringLiteral string = StringLiteral.of(part.getValue());
            if (string.isFormatted()) {
                List<FStringPiece> pieces = FStringScanner.scan(string, SOURCE_NAME, part.getLine(), part.getColumn());
                StringBuilder body = new StringBuilder();
                render(pieces, body, arguments);
                text.append(string.withPrefix(withoutFormatFlag(string.prefix())).withBody(body.toString()).toSource());
            } else {
                text.append(string.withBody(escapeBraces(string.body(), string.isRaw())).toSource());
            }
        }
        return text.append(".format(").append(String.join(", ", arguments)).append(')').toString();
    }

    private static void render(List<FStringPiece> pieces, StringBuilder body, List<String> arguments) {
        for (FStringPiece piece : pieces) {
            if (piece instanceof FStringPiece.Literal literal) {
                body.append(literal.text());
                continue;
            }
            FStringPiece.Field field = (FStringPiece.Field) piece;
            arguments.add("(" + field.expression() + ")");
            if (field.isSelfDocumenting()) {
                body.append(escapeBraces(field.debugText(), true));
            }
            body.append('{');
            if (field.conversion() != null) {
                body.append('!').append(field.conversion());
            } else if (field.isSelfDocumenting() && field.formatSpec() == null) {
                body.append("!r");
            }
            if (field.formatSpec() != null) {
                body.append(':');
                render(field.formatSpec(), body, arguments);
            }
            body.append('}');
        }
    }

    /**
     * Doubles braces so that {@code str.format} reproduces them, leaving named unicode
     * escapes of non-raw strings intact.
     */
    static String escapeBraces(String text, boolean raw) {
        StringBuilder result = new StringBuilder(text.length());
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (!raw && c == '\\') {
                if (text.startsWith("\\N{", i)) {
                    int close = text.indexOf('}', i);
                    int end = close < 0 ? text.length() : close + 1;
                    result.append(text, i, end);
                    i = end;
                    continue;
                }
                result.append(c);
                i++;
                if (i < text.length()) {
                    char escaped = text.charAt(i);
                    if (escaped == '{' || escaped == '}') {
                        result.append(escaped);
                    }
                    result.append(escaped);
                    i++;
                }
                continue;
            }
            if (c == '{' || c == '}') {
                result.append(c);
            }
            result.append(c);
            i++;
        }
        return result.toString();
    }

    private static String withoutFormatFlag(String prefix) {
        return prefix.replace("f", "").replace("F", "");
    }
}
