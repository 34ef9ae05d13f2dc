package org.pywalrus.transpiler;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class NameManglerTest {

    @ParameterizedTest
    @CsvSource({
            "A, __x, _A__x",
            "_A, __x, _A__x",
            "__Ham, __spam, _Ham__spam",
            "__, __x, __x",
            "A, __init__, __init__",
            "A, ___, ___",
            "A, _x, _x",
            "A, x, x"
    })
    void mangle(String className, String name, String expected) {
        assertThat(NameMangler.mangle(className, name)).isEqualTo(expected);
    }
}
