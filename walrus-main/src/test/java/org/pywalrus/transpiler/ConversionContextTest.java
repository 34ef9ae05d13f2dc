package org.pywalrus.transpiler;

import org.junit.jupiter.api.Test;
import org.pywalrus.ConversionConfig;
import org.pywalrus.PythonVersion;
import org.pywalrus.parser.SourceParser;

import static org.assertj.core.api.Assertions.assertThat;

class ConversionContextTest {

    private static final ConversionConfig CONFIG = ConversionConfig.builder()
            .uniqueNames(UniqueNameGenerator::sequential)
            .build();

    private static ConversionContext convert(String source) {
        return ConversionContext.forModule(SourceParser.parse(source, PythonVersion.PY39), CONFIG,
                CONFIG.newNameGenerator());
    }

    // ── module context ───────────────────────────────────────────────────

    @Test
    void module_startsAtTopLevel() {
        ConversionContext context = convert("x = 1\n");

        assertThat(context.getKind()).isEqualTo(ContextKind.PLAIN);
        assertThat(context.getIndentLevel()).isZero();
        assertThat(context.getIndentation()).isEmpty();
        assertThat(context.getScopeKeyword()).isEqualTo(ScopeKeyword.GLOBAL);
        assertThat(context.isRaw()).isFalse();
        assertThat(context.getClassMembers()).isNull();
        assertThat(context.getOutput()).isEqualTo("x = 1\n");
    }

    // ── pending declarations ─────────────────────────────────────────────

    @Test
    void functions_pendInDiscoveryOrderAndEmitSorted() {
        ConversionContext context = convert("print(b := 1, a := 2)\n");

        assertThat(context.getPendingFunctions())
                .extracting(WrapperFunction::name)
                .containsExactly("b", "a");
        assertThat(context.getPendingBindings()).containsExactly("b", "a");

        String output = context.getOutput();
        assertThat(output.indexOf("def _walrus_wrapper_a_2(expr):"))
                .isLessThan(output.indexOf("def _walrus_wrapper_b_1(expr):"));
        assertThat(output).endsWith("print(_walrus_wrapper_b_1(1), _walrus_wrapper_a_2(2))\n");
    }

    @Test
    void nestedValues_areCollectedByTheStatementContext() {
        ConversionContext context = convert("print((a := (b := 1)))\n");

        assertThat(context.getPendingFunctions())
                .extracting(WrapperFunction::name)
                .containsExactly("b", "a");
        assertThat(context.getOutput())
                .endsWith("print((_walrus_wrapper_a_1((_walrus_wrapper_b_2(1)))))\n");
    }

    @Test
    void lambda_defaultsBelongToEnclosingScope() {
        ConversionContext context = convert("f = lambda a=(d := 1): (e := a)\n");

        assertThat(context.getPendingFunctions())
                .extracting(WrapperFunction::name)
                .containsExactly("d");
        assertThat(context.getPendingBindings()).containsExactly("d");
        assertThat(context.getPendingLambdas()).hasSize(1);

        LambdaFunction lambda = context.getPendingLambdas().get(0);
        assertThat(lambda.uid()).isEqualTo("1");
        assertThat(lambda.parameters()).isEqualTo("a=(_walrus_wrapper_d_2(1))");
        assertThat(lambda.body())
                .contains("nonlocal e")
                .contains("e = NotImplemented")
                .endsWith("    return (_walrus_wrapper_e_3(a))\n");
        assertThat(context.getOutput()).endsWith("f = _walrus_wrapper_lambda_1\n");
    }

    @Test
    void globalDeclaration_suppressesHiddenBinding() {
        ConversionContext context = convert("global g\nprint(g := 1)\n");

        assertThat(context.getSeenGlobals()).containsExactly("g");
        assertThat(context.getPendingBindings()).isEmpty();
        assertThat(context.getPendingFunctions())
                .extracting(WrapperFunction::keyword)
                .containsExactly(ScopeKeyword.GLOBAL);
        assertThat(context.getOutput()).doesNotContain("NotImplemented");
    }

    // ── class bodies ─────────────────────────────────────────────────────

    @Test
    void classBody_storesMembersInNamespace() {
        ConversionContext context = convert("class A:\n    x = (y := 1)\n");

        assertThat(context.getPendingFunctions()).isEmpty();
        assertThat(context.getOutput()).isEqualTo(
                "class A:\n    x = ((__import__('builtins').locals().__setitem__('y', 1), y)[1])\n");
    }
}
