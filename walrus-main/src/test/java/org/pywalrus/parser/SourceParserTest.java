package org.pywalrus.parser;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.pywalrus.PythonVersion;
import org.pywalrus.WalrusSyntaxException;
import org.pywalrus.parser.ast.Leaf;
import org.pywalrus.parser.ast.Node;
import org.pywalrus.parser.ast.NodeKind;
import org.pywalrus.parser.util.AstUtils;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SourceParserTest {

    // ── round trip ───────────────────────────────────────────────────────

    @ParameterizedTest
    @ValueSource(strings = {
            "",
            "x = 1",
            "x = 1\n",
            "\n\n# only a comment\n",
            "if a:\n    b\n\n\n# tail\n",
            "def f(a, *args, b=1, **kw) -> int:\n\treturn (a +\n\t\tb)\n",
            "class A(B, metaclass=M):\r\n    '''doc'''\r\n    x = [i for i in y]\r\n",
            "value = 1 + \\\n    2\n",
            "while (chunk := read()):\n    pass\nelse:\n    done()\n",
            "try:\n  pass\nexcept E as e:\n  raise\nfinally:\n  pass\n",
            "@decorator\nasync def f():\n    async with a as b:\n        await b\n",
            "s = f'{a!r:>{w}}' 'x' r'y'\n",
            "x = 1\f\ny = 2\n",
            "if a:\n    if b:\n        c\n    d\ne\n",
    })
    void parse_reproducesSourceExactly(String source) {
        Node module = SourceParser.parse(source, PythonVersion.PY39);

        assertThat(module.getKind()).isEqualTo(NodeKind.FILE_INPUT);
        assertThat(module.getCode()).isEqualTo(source);
        assertThat(module.getLastLeaf().getKind()).isEqualTo(NodeKind.ENDMARKER);
    }

    @Test
    void parse_dropsIndentTokensAndKeepsSuiteShape() {
        Node module = SourceParser.parse("if a:\n    b = 1\n    c = 2\n", PythonVersion.PY39);

        Node ifStmt = module.getChild(0);
        assertThat(ifStmt.getKind()).isEqualTo(NodeKind.IF_STMT);
        Node suite = ifStmt.getChild(3);
        assertThat(suite.getKind()).isEqualTo(NodeKind.SUITE);
        assertThat(suite.getChildren()).hasSize(3);
        assertThat(suite.getChild(0).getKind()).isEqualTo(NodeKind.NEWLINE);
        assertThat(AstUtils.firstStatement(suite).getCode()).isEqualTo("    b = 1\n");
    }

    @Test
    void parse_oneLineSuite_isSimpleStatement() {
        Node module = SourceParser.parse("if a: b; c\n", PythonVersion.PY39);

        Node suite = module.getChild(0).getChild(3);
        assertThat(suite.getKind()).isEqualTo(NodeKind.SIMPLE_STMT);
        assertThat(AstUtils.isSuite(suite)).isTrue();
    }

    @Test
    void parse_classifiesLeaves() {
        Node module = SourceParser.parse("if not x: print(y := 1)\n", PythonVersion.PY39);

        List<Node> names = AstUtils.findAll(module, NodeKind.NAME);
        assertThat(names).extracting(node -> ((Leaf) node).getValue()).containsExactly("x", "print", "y");
        assertThat(AstUtils.findAll(module, NodeKind.KEYWORD)).extracting(node -> ((Leaf) node).getValue())
                .containsExactly("if", "not");
        assertThat(AstUtils.findAll(module, NodeKind.ARGUMENT)).hasSize(1);
        assertThat(AstUtils.isNamedExpr(AstUtils.findAll(module, NodeKind.ARGUMENT).get(0))).isTrue();
    }

    @Test
    void parse_keepsPositions() {
        Node module = SourceParser.parse("a = 1\n\nif b:\n    cc = 2\n", PythonVersion.PY39);

        Node name = AstUtils.findAll(module, NodeKind.NAME).get(2);
        assertThat(((Leaf) name).getValue()).isEqualTo("cc");
        assertThat(name.getLine()).isEqualTo(4);
        assertThat(name.getColumn()).isEqualTo(4);
        assertThat(((Leaf) name).getPrefix()).isEqualTo("    ");
    }

    // ── f-strings ────────────────────────────────────────────────────────

    @Test
    void parse_attachesFormattedFieldExpressions() {
        Node module = SourceParser.parse("s = f'{a + b}{c!r:{d}}'\n", PythonVersion.PY39);

        Leaf literal = (Leaf) AstUtils.findAll(module, NodeKind.STRING).get(0);
        assertThat(literal.getEmbedded()).extracting(Node::getCode).containsExactly("a + b", "c", "d");
        assertThat(literal.getEmbedded().get(0).getKind()).isEqualTo(NodeKind.ARITH_EXPR);
    }

    @Test
    void parse_findsAssignmentInsideFormattedField() {
        Node module = SourceParser.parse("print(f'{(n := 10)}')\n", PythonVersion.PY39);

        assertThat(AstUtils.containsNamedExpr(module)).isTrue();
        assertThat(AstUtils.countNamedExprs(module)).isEqualTo(1);
    }

    @Test
    void parse_invalidFieldExpression_isSyntaxError() {
        assertThatThrownBy(() -> SourceParser.parse("s = f'{a +}'\n", PythonVersion.PY39))
                .isInstanceOf(WalrusSyntaxException.class)
                .hasMessageContaining("f-string: invalid expression 'a +'");
    }

    // ── expressions ──────────────────────────────────────────────────────

    @Test
    void parseExpression_returnsExpressionNode() {
        Node expression = SourceParser.parseExpression("a +\n b", PythonVersion.PY39);

        assertThat(expression.getKind()).isEqualTo(NodeKind.ARITH_EXPR);
        assertThat(expression.getCode()).isEqualTo("a +\n b");
    }

    @Test
    void parseExpression_implicitConcatenation() {
        Node expression = SourceParser.parseExpression("'a' \"b\"", PythonVersion.PY39);

        assertThat(expression.getKind()).isEqualTo(NodeKind.STRINGS);
        assertThat(expression.getChildren()).hasSize(2);
        assertThat(AstUtils.isStringAtom(expression)).isTrue();
    }

    @Test
    void parseExpression_rejectsStatements() {
        assertThatThrownBy(() -> SourceParser.parseExpression("x = 1", PythonVersion.PY39))
                .isInstanceOf(WalrusSyntaxException.class);
    }

    // ── errors ───────────────────────────────────────────────────────────

    @Test
    void parse_inconsistentDedent_isSyntaxError() {
        assertThatThrownBy(() -> SourceParser.parse("if x:\n        a\n    b\n", "indent.py", PythonVersion.PY39))
                .isInstanceOf(WalrusSyntaxException.class)
                .hasMessageContaining("unindent does not match any outer indentation level")
                .satisfies(e -> assertThat(((WalrusSyntaxException) e).getLine()).isEqualTo(3));
    }

    @Test
    void parse_unexpectedIndent_isSyntaxError() {
        assertThatThrownBy(() -> SourceParser.parse("a = 1\n    b = 2\n", PythonVersion.PY39))
                .isInstanceOf(WalrusSyntaxException.class);
    }

    @Test
    void parse_relaxedDecorator_dependsOnVersion() {
        String source = "@buttons[0].clicked.connect\ndef f():\n    pass\n";

        assertThat(SourceParser.parse(source, PythonVersion.PY39).getCode()).isEqualTo(source);
        assertThatThrownBy(() -> SourceParser.parse(source, PythonVersion.PY38))
                .isInstanceOf(WalrusSyntaxException.class)
                .hasMessageContaining("decorators must be dotted names");
    }

    @Test
    void parse_dottedDecoratorWithCall_isValidFor38() {
        String source = "@app.route('/', methods=['GET'])\ndef index():\n    pass\n";

        assertThat(SourceParser.parse(source, PythonVersion.PY38).getCode()).isEqualTo(source);
    }
}
