package org.pywalrus.parser.antlr4;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

import org.antlr.v4.runtime.BufferedTokenStream;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.Vocabulary;
import org.antlr.v4.runtime.tree.ParseTree;
import org.antlr.v4.runtime.tree.TerminalNode;
import org.pywalrus.WalrusSyntaxException;
import org.pywalrus.parser.ast.Branch;
import org.pywalrus.parser.ast.Leaf;
import org.pywalrus.parser.ast.Node;
import org.pywalrus.parser.ast.NodeKind;
import org.pywalrus.parser.fstring.FStringPiece;
import org.pywalrus.parser.fstring.FStringScanner;
import org.pywalrus.parser.fstring.StringLiteral;

/**
 * Converts an Antlr parse tree into the immutable {@link Node} tree.
 * <p>
 * Hidden-channel text in front of each token becomes the prefix of its leaf, so the
 * leaves of the result concatenate back to the source. Rule nodes with a single child
 * are replaced by that child, {@code INDENT} and {@code DEDENT} disappear and the end
 * of input becomes an {@link NodeKind#ENDMARKER} leaf holding the trailing text.
 */
public final class ParseTreeConverter {

    private final String[] ruleNames;
    private final String[] prefixes;
    private final String sourceName;
    private final Function<String, Node> expressionParser;

    /**
     * @param tokens           the filled token stream the tree was parsed from
     * @param expressionParser parses the text of an f-string replacement field
     */
    public ParseTreeConverter(BufferedTokenStream tokens, String[] ruleNames, String sourceName,
                              Function<String, Node> expressionParser) {
        this.ruleNames = ruleNames;
        this.sourceName = sourceName;
        this.expressionParser = expressionParser;
        this.prefixes = computePrefixes(tokens.getTokens());
    }

    public Node convert(ParseTree tree) {
        Node node = convertTree(tree);
        if (node == null) {
            throw new IllegalStateException("Parse tree without tokens");
        }
        return node;
    }

    private Node convertTree(ParseTree tree) {
        if (tree instanceof TerminalNode terminal) {
            return convertToken(terminal.getSymbol());
        }
        ParserRuleContext context = (ParserRuleContext) tree;
        NodeKind kind = NodeKind.forRule(ruleNames[context.getRuleIndex()]);
        List<Node> children = new ArrayList<>(context.getChildCount());
        for (int i = 0; i < context.getChildCount(); i++) {
            Node child = convertTree(context.getChild(i));
            if (child != null) {
                children.add(child);
            }
        }
        if (children.isEmpty()) {
            return null;
        }
        if (children.size() == 1 && !kind.keepsSingleChild()) {
            return children.get(0);
        }
        return new Branch(kind, children);
    }

    private Node convertToken(Token token) {
        int type = token.getType();
        if (type == Python3Parser.INDENT || type == Python3Parser.DEDENT) {
            return null;
        }
        String prefix = prefixes[token.getTokenIndex()];
        int line = token.getLine();
        int column = token.getCharPositionInLine();
        switch (type) {
            case Token.EOF:
                return new Leaf(NodeKind.ENDMARKER, "", prefix, line, column);
            case Python3Lexer.NEWLINE:
                return new Leaf(NodeKind.NEWLINE, token.getText(), prefix, line, column);
            case Python3Lexer.NAME:
                return new Leaf(NodeKind.NAME, token.getText(), prefix, line, column);
            case Python3Lexer.NUMBER:
                return new Leaf(NodeKind.NUMBER, token.getText(), prefix, line, column);
            case Python3Lexer.STRING:
                return new Leaf(NodeKind.STRING, token.getText(), prefix, line, column,
                        embeddedExpressions(token.getText(), line, column));
            default:
                return new Leaf(literalKind(type), token.getText(), prefix, line, column);
        }
    }

    private List<Node> embeddedExpressions(String text, int line, int column) {
        StringLiteral literal = StringLiteral.of(text);
        if (!literal.isFormatted()) {
            return List.of();
        }
        List<Node> embedded = new ArrayList<>();
        for (FStringPiece.Field field : FStringScanner.fields(FStringScanner.scan(literal, sourceName, line, column))) {
            try {
                embedded.add(expressionParser.apply(field.expression()));
            } catch (WalrusSyntaxException e) {
                throw new WalrusSyntaxException("f-string: invalid expression '" + field.expression().strip() + "'",
                        sourceName, line, column, e);
            }
        }
        return embedded;
    }

    private static NodeKind literalKind(int type) {
        Vocabulary vocabulary = Python3Lexer.VOCABULARY;
        String literal = vocabulary.getLiteralName(type);
        if (literal != null && literal.length() > 2 && Character.isLetter(literal.charAt(1))) {
            return NodeKind.KEYWORD;
        }
        return NodeKind.OPERATOR;
    }

    /**
     * Hidden text is carried over the zero-width INDENT and DEDENT tokens to the next real token.
     */
    private static String[] computePrefixes(List<Token> tokens) {
        String[] result = new String[tokens.size()];
        StringBuilder pending = new StringBuilder();
        for (Token token : tokens) {
            if (token.getChannel() != Token.DEFAULT_CHANNEL) {
                pending.append(token.getText());
                continue;
            }
            int type = token.getType();
            if (type == Python3Parser.INDENT || type == Python3Parser.DEDENT) {
                result[token.getTokenIndex()] = "";
                continue;
            }
            result[token.getTokenIndex()] = pending.toString();
            pending.setLength(0);
        }
        return result;
    }
}
