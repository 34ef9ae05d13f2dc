package org.pywalrus.parser;

import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.tree.ParseTree;
import org.pywalrus.PythonVersion;
import org.pywalrus.WalrusSyntaxException;
import org.pywalrus.parser.antlr4.Antlr4ParseStart;
import org.pywalrus.parser.antlr4.IndentationTokenSource;
import org.pywalrus.parser.antlr4.ParseTreeConverter;
import org.pywalrus.parser.antlr4.Python3Lexer;
import org.pywalrus.parser.antlr4.Python3Parser;
import org.pywalrus.parser.antlr4.ThrowingErrorListener;
import org.pywalrus.parser.ast.Node;
import org.pywalrus.parser.ast.NodeKind;
import org.pywalrus.parser.validation.SyntaxValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the Python front end: source text to validated syntax tree.
 */
public final class SourceParser {

    private static final Logger LOG = LoggerFactory.getLogger(SourceParser.class);

    public static final String DEFAULT_SOURCE_NAME = "<unknown>";

    private static final String FRAGMENT_SOURCE_NAME = "<fstring>";

    private SourceParser() {
    }

    public static Node parse(String source, PythonVersion version) {
        return parse(source, DEFAULT_SOURCE_NAME, version);
    }

    /**
     * Parses a module.
     *
     * @return a {@link NodeKind#FILE_INPUT} node whose code is exactly {@code source}
     * @throws WalrusSyntaxException if the source is not valid for {@code version}
     */
    public static Node parse(String source, String sourceName, PythonVersion version) {
        LOG.debug("Parsing {} as Python {}", sourceName, version.getText());
        Node module = parseTree(source, sourceName, version, Antlr4ParseStart.FILE_INPUT);
        new SyntaxValidator(version, sourceName).validate(module);
        return module;
    }

    /**
     * Parses an expression as if it were enclosed in parentheses, so it may span lines.
     *
     * @return the expression node, its code is exactly {@code expression} without
     *         trailing whitespace
     */
    public static Node parseExpression(String expression, PythonVersion version) {
        Node node = parseFragment(expression, FRAGMENT_SOURCE_NAME, version);
        new SyntaxValidator(version, FRAGMENT_SOURCE_NAME).validate(node);
        return node;
    }

    private static Node parseFragment(String expression, String sourceName, PythonVersion version) {
        Node input = parseTree("(" + expression + "\n)", sourceName, version, Antlr4ParseStart.EVAL_INPUT);
        Node atom = input.getChild(0);
        if (!atom.is(NodeKind.ATOM) || atom.getChildren().size() != 3) {
            throw new WalrusSyntaxException("expected an expression", sourceName, input.getLine(), input.getColumn());
        }
        return atom.getChild(1);
    }

    private static Node parseTree(String source, String sourceName, PythonVersion version, Antlr4ParseStart start) {
        ThrowingErrorListener errorListener = new ThrowingErrorListener(sourceName);

        Python3Lexer lexer = new Python3Lexer(CharStreams.fromString(source, sourceName));
        lexer.removeErrorListeners();
        lexer.addErrorListener(errorListener);

        CommonTokenStream tokens = new CommonTokenStream(new IndentationTokenSource(lexer, sourceName));
        tokens.fill();

        Python3Parser parser = new Python3Parser(tokens);
        parser.removeErrorListeners();
        parser.addErrorListener(errorListener);

        ParseTree tree = start.parse(parser);
        ParseTreeConverter converter = new ParseTreeConverter(tokens, parser.getRuleNames(), sourceName,
                fragment -> parseFragment(fragment, sourceName, version));
        return converter.convert(tree);
    }
}
