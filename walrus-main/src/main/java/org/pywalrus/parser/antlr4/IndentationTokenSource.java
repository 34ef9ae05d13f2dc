package org.pywalrus.parser.antlr4;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import org.antlr.v4.runtime.CommonToken;
import org.antlr.v4.runtime.ListTokenSource;
import org.antlr.v4.runtime.Token;
import org.pywalrus.WalrusSyntaxException;

/**
 * Turns the raw lexer output into the token stream of a Python logical-line grammar.
 * <p>
 * Newlines inside brackets and newlines ending blank or comment-only lines move to the
 * hidden channel. Zero-width {@code INDENT} and {@code DEDENT} tokens are inserted in
 * front of the first token of a logical line whose indentation differs from the
 * enclosing block, tabs advancing to the next multiple of eight columns. At end of input
 * a zero-width {@code NEWLINE} closes an unterminated last line and all open blocks are
 * dedented.
 */
public final class IndentationTokenSource extends ListTokenSource {

    private static final int TAB_SIZE = 8;

    public IndentationTokenSource(Python3Lexer lexer, String sourceName) {
        super(process(lexer, sourceName), sourceName);
    }

    private static List<Token> process(Python3Lexer lexer, String sourceName) {
        List<Token> result = new ArrayList<>();
        Deque<Integer> indents = new ArrayDeque<>();
        indents.push(0);

        int depth = 0;
        boolean lineEmpty = true;
        boolean physicalLineStart = true;
        String leadingWhitespace = "";

        for (Token raw = lexer.nextToken(); ; raw = lexer.nextToken()) {
            int type = raw.getType();
            switch (type) {
                case Python3Lexer.WS:
                    if (physicalLineStart && leadingWhitespace.isEmpty()) {
                        leadingWhitespace = raw.getText();
                    }
                    result.add(raw);
                    continue;
                case Python3Lexer.COMMENT:
                    physicalLineStart = false;
                    result.add(raw);
                    continue;
                case Python3Lexer.LINE_JOINING:
                    physicalLineStart = false;
                    result.add(raw);
                    continue;
                case Python3Lexer.NEWLINE:
                    physicalLineStart = true;
                    leadingWhitespace = "";
                    if (depth > 0 || lineEmpty) {
                        result.add(hidden(raw));
                    } else {
                        result.add(raw);
                        lineEmpty = true;
                    }
                    continue;
                case Token.EOF:
                    if (!lineEmpty) {
                        result.add(synthetic(raw, Python3Lexer.NEWLINE));
                    }
                    while (indents.peek() > 0) {
                        indents.pop();
                        result.add(synthetic(raw, Python3Parser.DEDENT));
                    }
                    result.add(raw);
                    return result;
                default:
                    break;
            }

            if (lineEmpty) {
                if (depth == 0) {
                    int column = physicalLineStart ? measure(leadingWhitespace) : 0;
                    if (column > indents.peek()) {
                        indents.push(column);
                        result.add(synthetic(raw, Python3Parser.INDENT));
                    } else {
                        while (column < indents.peek()) {
                            indents.pop();
                            result.add(synthetic(raw, Python3Parser.DEDENT));
                        }
                        if (column != indents.peek()) {
                            throw new WalrusSyntaxException("unindent does not match any outer indentation level",
                                    sourceName, raw.getLine(), raw.getCharPositionInLine());
                        }
                    }
                }
                lineEmpty = false;
            }
            physicalLineStart = false;

            switch (type) {
                case Python3Lexer.OPEN_PAREN:
                case Python3Lexer.OPEN_BRACK:
                case Python3Lexer.OPEN_BRACE:
                    depth++;
                    break;
                case Python3Lexer.CLOSE_PAREN:
                case Python3Lexer.CLOSE_BRACK:
                case Python3Lexer.CLOSE_BRACE:
                    depth = Math.max(0, depth - 1);
                    break;
                default:
                    break;
            }
            result.add(raw);
        }
    }

    static int measure(String whitespace) {
        int column = 0;
        for (int i = 0; i < whitespace.length(); i++) {
            char c = whitespace.charAt(i);
            if (c == '\t') {
                column = (column / TAB_SIZE + 1) * TAB_SIZE;
            } else if (c == '\f') {
                column = 0;
            } else {
                column++;
            }
        }
        return column;
    }

    private static Token hidden(Token raw) {
        CommonToken token = new CommonToken(raw);
        token.setChannel(Token.HIDDEN_CHANNEL);
        return token;
    }

    private static Token synthetic(Token anchor, int type) {
        CommonToken token = new CommonToken(anchor);
        token.setType(type);
        token.setText("");
        token.setChannel(Token.DEFAULT_CHANNEL);
        token.setStopIndex(anchor.getStartIndex() - 1);
        return token;
    }
}
