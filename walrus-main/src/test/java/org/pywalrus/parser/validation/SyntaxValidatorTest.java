package org.pywalrus.parser.validation;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;
import org.pywalrus.PythonVersion;
import org.pywalrus.WalrusSyntaxException;
import org.pywalrus.parser.SourceParser;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SyntaxValidatorTest {

    private static void parse(String source) {
        SourceParser.parse(source, "test.py", PythonVersion.PY39);
    }

    // ── targets ──────────────────────────────────────────────────────────

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "(a.b := 1)              | attribute",
            "(a[0] := 1)             | subscript",
            "(f() := 1)              | function call",
            "((a, b) := 1)           | tuple",
            "([a] := 1)              | list",
            "(lambda: x := 1)        | lambda",
            "(True := 1)             | True",
            "(1 := 1)                | literal",
            "(a + b := 1)            | operator",
    })
    void nonNameTarget_isRejected(String expression, String description) {
        assertThatThrownBy(() -> parse("x = " + expression + "\n"))
                .isInstanceOf(WalrusSyntaxException.class)
                .hasMessageContaining("cannot use assignment expressions with " + description);
    }

    @Test
    void awaitTarget_isRejected() {
        assertThatThrownBy(() -> parse("async def f():\n    (await x := 1)\n"))
                .isInstanceOf(WalrusSyntaxException.class)
                .hasMessageContaining("await expression");
    }

    // ── comprehensions ───────────────────────────────────────────────────

    @ParameterizedTest
    @ValueSource(strings = {
            "[x for x in (y := [1, 2])]\n",
            "[x for x in range(3) for z in (y := [x])]\n",
            "{x: 1 for x in (y := data)}\n",
            "[x for x in (lambda: (y := 1))()]\n",
    })
    void assignmentInIterable_isRejected(String source) {
        assertThatThrownBy(() -> parse(source))
                .isInstanceOf(WalrusSyntaxException.class)
                .hasMessageContaining("comprehension iterable expression");
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "[i := 0 for i in range(3)]                        | i",
            "[(j := 0) for i, j in pairs]                      | j",
            "[[(j := 0) for i in range(3)] for j in range(3)]  | j",
            "{k: (k := 1) for k in keys}                       | k",
            "f((n := 1) for n in data)                         | n",
    })
    void rebindingIterationVariable_isRejected(String source, String name) {
        assertThatThrownBy(() -> parse(source + "\n"))
                .isInstanceOf(WalrusSyntaxException.class)
                .hasMessageContaining("cannot rebind comprehension iteration variable '" + name + "'");
    }

    @Test
    void comprehensionInClassBody_isRejected() {
        assertThatThrownBy(() -> parse("class A:\n    data = [(y := x) for x in range(3)]\n"))
                .isInstanceOf(WalrusSyntaxException.class)
                .hasMessageContaining("cannot be used in a class body");
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "[y := f(x) for x in data]\n",
            "total = [(acc := acc + x) for x in data]\n",
            "def f():\n    return [(y := x) for x in range(3)]\n",
            "class A:\n    def m(self):\n        return [(y := x) for x in z]\n",
            "class A:\n    f = lambda: [(y := x) for x in z]\n",
            "class A:\n    print(y := 1)\n",
            "[lambda: (x := 1) for x in data]\n",
            "if (n := len(a)) > 10:\n    pass\n",
            "print(f'{(x := 1)}')\n",
    })
    void legalPositions_areAccepted(String source) {
        assertThatCode(() -> parse(source)).doesNotThrowAnyException();
    }

    // ── decorators ───────────────────────────────────────────────────────

    @ParameterizedTest
    @ValueSource(strings = {"@a\n", "@a.b.c\n", "@a.b(1, x=2)\n"})
    void dottedDecorators_areValidFor38(String decorator) {
        assertThatCode(() -> SourceParser.parse(decorator + "def f():\n    pass\n", PythonVersion.PY38))
                .doesNotThrowAnyException();
    }

    @ParameterizedTest
    @ValueSource(strings = {"@a[0]\n", "@a()()\n", "@a().b\n", "@(yield)\n", "@x if y else z\n"})
    void otherDecorators_areRejectedFor38(String decorator) {
        String source = decorator + "def f():\n    pass\n";

        assertThatThrownBy(() -> SourceParser.parse(source, PythonVersion.PY38))
                .isInstanceOf(WalrusSyntaxException.class);
        assertThatCode(() -> SourceParser.parse(source, PythonVersion.PY39)).doesNotThrowAnyException();
    }
}
