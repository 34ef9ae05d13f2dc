package org.pywalrus;

import java.util.Properties;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;
import org.pywalrus.fstring.FStringFormatRewriter;
import org.pywalrus.transpiler.UniqueNameGenerator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConversionConfigTest {

    @Test
    void defaults() {
        ConversionConfig config = ConversionConfig.defaults();

        assertThat(config.getLinesep()).isEqualTo(Linesep.LF);
        assertThat(config.getLinesepText()).isEqualTo("\n");
        assertThat(config.getIndentation()).isEqualTo("    ");
        assertThat(config.getSourceVersion()).isEqualTo(PythonVersion.PY39);
        assertThat(config.isPep8()).isTrue();
        assertThat(config.getLiteralRewriter()).isInstanceOf(FStringFormatRewriter.class);
    }

    // ── textual values ───────────────────────────────────────────────────

    @ParameterizedTest
    @CsvSource({
            "t, '\t'",
            "TAB, '\t'",
            "tabs, '\t'",
            "2, '  '",
            "8, '        '",
            "'\t', '\t'",
            "'   ', '   '",
    })
    void indentation_acceptedValues(String value, String expected) {
        assertThat(ConversionConfig.builder().indentation(value).build().getIndentation()).isEqualTo(expected);
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "0", "-2", "abc", " x ", "99999999999"})
    void indentation_rejectedValues(String value) {
        assertThatThrownBy(() -> ConversionConfig.builder().indentation(value))
                .isInstanceOf(WalrusConfigurationException.class)
                .satisfies(e -> assertThat(((WalrusConfigurationException) e).getSetting()).isEqualTo("indentation"));
    }

    @Test
    void linesep_acceptsTerminatorsAndNames() {
        assertThat(ConversionConfig.builder().linesep("\r\n").build().getLinesep()).isEqualTo(Linesep.CRLF);
        assertThat(ConversionConfig.builder().linesep("crlf").build().getLinesep()).isEqualTo(Linesep.CRLF);
        assertThat(ConversionConfig.builder().linesep("\r").build().getLinesep()).isEqualTo(Linesep.CR);
        assertThat(ConversionConfig.builder().linesep("LF").build().getLinesep()).isEqualTo(Linesep.LF);
        assertThatThrownBy(() -> ConversionConfig.builder().linesep("nl"))
                .isInstanceOf(WalrusConfigurationException.class);
    }

    @ParameterizedTest
    @CsvSource({"1, true", "yes, true", "TRUE, true", "on, true", "0, false", "no, false", "False, false", "off, false"})
    void pep8_acceptsBooleanWords(String value, boolean expected) {
        assertThat(ConversionConfig.builder().pep8(value).build().isPep8()).isEqualTo(expected);
    }

    @Test
    void pep8_rejectsOtherWords() {
        assertThatThrownBy(() -> ConversionConfig.builder().pep8("maybe"))
                .isInstanceOf(WalrusConfigurationException.class)
                .hasMessage("Invalid value for linting: 'maybe'");
    }

    @Test
    void sourceVersion_parsesVersionText() {
        assertThat(ConversionConfig.builder().sourceVersion("3.8").build().getSourceVersion())
                .isEqualTo(PythonVersion.PY38);
        assertThat(ConversionConfig.builder().sourceVersion("py39").build().getSourceVersion())
                .isEqualTo(PythonVersion.PY39);
        assertThatThrownBy(() -> ConversionConfig.builder().sourceVersion("2.7"))
                .isInstanceOf(WalrusConfigurationException.class);
    }

    // ── properties ───────────────────────────────────────────────────────

    @Test
    void fromProperties_readsWalrusKeys() {
        Properties properties = new Properties();
        properties.setProperty(ConversionConfig.LINESEP_PROPERTY, "CRLF");
        properties.setProperty(ConversionConfig.INDENTATION_PROPERTY, "tab");
        properties.setProperty(ConversionConfig.SOURCE_VERSION_PROPERTY, "3.8");
        properties.setProperty(ConversionConfig.LINTING_PROPERTY, "off");
        properties.setProperty("unrelated", "value");

        ConversionConfig config = ConversionConfig.fromProperties(properties);

        assertThat(config.getLinesep()).isEqualTo(Linesep.CRLF);
        assertThat(config.getIndentation()).isEqualTo("\t");
        assertThat(config.getSourceVersion()).isEqualTo(PythonVersion.PY38);
        assertThat(config.isPep8()).isFalse();
    }

    @Test
    void fromProperties_withoutKeys_usesDefaults() {
        ConversionConfig config = ConversionConfig.fromProperties(new Properties());

        assertThat(config.getLinesep()).isEqualTo(Linesep.LF);
        assertThat(config.getIndentation()).isEqualTo("    ");
    }

    @Test
    void fromProperties_badValue_failsBeforeConversion() {
        Properties properties = new Properties();
        properties.setProperty(ConversionConfig.INDENTATION_PROPERTY, "wide");

        assertThatThrownBy(() -> ConversionConfig.fromProperties(properties))
                .isInstanceOf(WalrusConfigurationException.class)
                .hasMessageContaining("wide");
    }

    // ── detection ────────────────────────────────────────────────────────

    @Test
    void detectFrom_takesLineEndingAndFirstBlockIndentation() {
        ConversionConfig config = ConversionConfig.builder()
                .detectFrom("import os\r\n\r\ndef f():\r\n\tif x:\r\n\t\tpass\r\n")
                .build();

        assertThat(config.getLinesep()).isEqualTo(Linesep.CRLF);
        assertThat(config.getIndentation()).isEqualTo("\t");
    }

    @Test
    void detectFrom_withoutBlocks_keepsIndentation() {
        ConversionConfig config = ConversionConfig.builder()
                .indentation("2")
                .detectFrom("x = 1\ry = 2\r")
                .build();

        assertThat(config.getLinesep()).isEqualTo(Linesep.CR);
        assertThat(config.getIndentation()).isEqualTo("  ");
    }

    @Test
    void detectFrom_unparsableSource_keepsIndentation() {
        ConversionConfig config = ConversionConfig.builder()
                .detectFrom("def (\n   x")
                .build();

        assertThat(config.getLinesep()).isEqualTo(Linesep.LF);
        assertThat(config.getIndentation()).isEqualTo("    ");
    }

    // ── name generators ──────────────────────────────────────────────────

    @Test
    void newNameGenerator_isFreshForEveryRun() {
        ConversionConfig config = ConversionConfig.builder().uniqueNames(UniqueNameGenerator::sequential).build();

        assertThat(config.newNameGenerator().next()).isEqualTo("1");
        assertThat(config.newNameGenerator().next()).isEqualTo("1");
    }

    @Test
    void toBuilder_keepsSettings() {
        ConversionConfig original = ConversionConfig.builder().linesep(Linesep.CR).indentation("3").pep8(false).build();

        ConversionConfig copy = original.toBuilder().sourceVersion(PythonVersion.PY38).build();

        assertThat(copy.getLinesep()).isEqualTo(Linesep.CR);
        assertThat(copy.getIndentation()).isEqualTo("   ");
        assertThat(copy.isPep8()).isFalse();
        assertThat(copy.getSourceVersion()).isEqualTo(PythonVersion.PY38);
        assertThat(original.getSourceVersion()).isEqualTo(PythonVersion.PY39);
    }
}
