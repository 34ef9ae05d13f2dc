package org.pywalrus;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Properties;
import java.util.function.Supplier;

import org.pywalrus.fstring.FStringFormatRewriter;
import org.pywalrus.fstring.FormattedLiteralRewriter;
import org.pywalrus.parser.SourceParser;
import org.pywalrus.parser.ast.Node;
import org.pywalrus.parser.ast.NodeKind;
import org.pywalrus.parser.util.AstUtils;
import org.pywalrus.transpiler.UniqueNameGenerator;
import org.pywalrus.transpiler.Whitespace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Settings of a conversion run. Instances are immutable; values are resolved and
 * checked when the {@link Builder} builds, before any source is touched.
 */
public final class ConversionConfig {

    private static final Logger LOG = LoggerFactory.getLogger(ConversionConfig.class);

    public static final String LINESEP_PROPERTY = "walrus.linesep";
    public static final String INDENTATION_PROPERTY = "walrus.indentation";
    public static final String SOURCE_VERSION_PROPERTY = "walrus.source-version";
    public static final String LINTING_PROPERTY = "walrus.linting";

    private static final List<String> TRUE_VALUES = List.of("1", "yes", "true", "on");
    private static final List<String> FALSE_VALUES = List.of("0", "no", "false", "off");
    private static final List<String> TAB_VALUES = List.of("t", "tab", "tabs");

    private static final ConversionConfig DEFAULTS = builder().build();

    private final Linesep linesep;
    private final String indentation;
    private final PythonVersion sourceVersion;
    private final boolean pep8;
    private final Supplier<UniqueNameGenerator> uniqueNames;
    private final FormattedLiteralRewriter literalRewriter;

    private ConversionConfig(Builder builder) {
        this.linesep = builder.linesep;
        this.indentation = builder.indentation;
        this.sourceVersion = builder.sourceVersion;
        this.pep8 = builder.pep8;
        this.uniqueNames = builder.uniqueNames;
        this.literalRewriter = builder.literalRewriter;
    }

    public static ConversionConfig defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Defaults overridden by the {@code walrus.*} system properties that are set.
     *
     * @throws WalrusConfigurationException if a property has an unrecognized value
     */
    public static ConversionConfig fromSystemProperties() {
        return fromProperties(System.getProperties());
    }

    public static ConversionConfig fromProperties(Properties properties) {
        return builder().properties(properties).build();
    }

    public Linesep getLinesep() {
        return linesep;
    }

    public String getLinesepText() {
        return linesep.getText();
    }

    /**
     * The indentation unit added for each nesting level of inserted code.
     */
    public String getIndentation() {
        return indentation;
    }

    public PythonVersion getSourceVersion() {
        return sourceVersion;
    }

    /**
     * Whether inserted code is surrounded by the blank lines PEP 8 asks for.
     */
    public boolean isPep8() {
        return pep8;
    }

    /**
     * A fresh generator for one conversion run.
     */
    public UniqueNameGenerator newNameGenerator() {
        return uniqueNames.get();
    }

    public FormattedLiteralRewriter getLiteralRewriter() {
        return literalRewriter;
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.linesep = linesep;
        builder.indentation = indentation;
        builder.sourceVersion = sourceVersion;
        builder.pep8 = pep8;
        builder.uniqueNames = uniqueNames;
        builder.literalRewriter = literalRewriter;
        return builder;
    }

    @Override
    public String toString() {
        return "ConversionConfig{linesep=" + linesep
                + ", indentation='" + indentation.replace("\t", "\\t") + "'"
                + ", sourceVersion=" + sourceVersion.getText()
                + ", pep8=" + pep8 + "}";
    }

    static String parseIndentation(String value) {
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if (TAB_VALUES.contains(normalized)) {
            return "\t";
        }
        if (!normalized.isEmpty() && normalized.chars().allMatch(Character::isDigit)) {
            int width;
            try {
                width = Integer.parseInt(normalized);
            } catch (NumberFormatException e) {
                throw new WalrusConfigurationException("indentation", value);
            }
            if (width > 0) {
                return " ".repeat(width);
            }
        } else if (!value.isEmpty() && value.chars().allMatch(c -> c == ' ' || c == '\t')) {
            return value;
        }
        throw new WalrusConfigurationException("indentation", value);
    }

    static boolean parseBoolean(String setting, String value) {
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if (TRUE_VALUES.contains(normalized)) {
            return true;
        }
        if (FALSE_VALUES.contains(normalized)) {
            return false;
        }
        throw new WalrusConfigurationException(setting, value);
    }

    public static final class Builder {

        private Linesep linesep = Linesep.LF;
        private String indentation = "    ";
        private PythonVersion sourceVersion = PythonVersion.latest();
        private boolean pep8 = true;
        private Supplier<UniqueNameGenerator> uniqueNames = UniqueNameGenerator::random;
        private FormattedLiteralRewriter literalRewriter = new FStringFormatRewriter();

        private Builder() {
        }

        public Builder linesep(Linesep linesep) {
            this.linesep = Objects.requireNonNull(linesep, "linesep");
            return this;
        }

        /**
         * @param linesep {@code \n}, {@code \r\n}, {@code \r} or one of their names
         */
        public Builder linesep(String linesep) {
            this.linesep = Linesep.parse(linesep);
            return this;
        }

        /**
         * @param indentation {@code t}, {@code tab} or {@code tabs}, a number of spaces, or
         *                    the indentation unit itself
         */
        public Builder indentation(String indentation) {
            this.indentation = parseIndentation(indentation);
            return this;
        }

        public Builder sourceVersion(PythonVersion sourceVersion) {
            this.sourceVersion = Objects.requireNonNull(sourceVersion, "sourceVersion");
            return this;
        }

        public Builder sourceVersion(String sourceVersion) {
            this.sourceVersion = PythonVersion.parse(sourceVersion);
            return this;
        }

        public Builder pep8(boolean pep8) {
            this.pep8 = pep8;
            return this;
        }

        public Builder pep8(String pep8) {
            this.pep8 = parseBoolean("linting", pep8);
            return this;
        }

        public Builder uniqueNames(Supplier<UniqueNameGenerator> uniqueNames) {
            this.uniqueNames = Objects.requireNonNull(uniqueNames, "uniqueNames");
            return this;
        }

        public Builder literalRewriter(FormattedLiteralRewriter literalRewriter) {
            this.literalRewriter = Objects.requireNonNull(literalRewriter, "literalRewriter");
            return this;
        }

        /**
         * Applies the {@code walrus.*} keys present in {@code properties}.
         */
        public Builder properties(Properties properties) {
            String value = properties.getProperty(LINESEP_PROPERTY);
            if (value != null) {
                linesep(value);
            }
            value = properties.getProperty(INDENTATION_PROPERTY);
            if (value != null) {
                indentation(value);
            }
            value = properties.getProperty(SOURCE_VERSION_PROPERTY);
            if (value != null) {
                sourceVersion(value);
            }
            value = properties.getProperty(LINTING_PROPERTY);
            if (value != null) {
                pep8(value);
            }
            return this;
        }

        /**
         * Takes the line terminator and the indentation unit from {@code source}: its most
         * frequent line terminator and the indentation of its first indented block. Settings
         * that cannot be detected keep their current value.
         */
        public Builder detectFrom(String source) {
            this.linesep = Linesep.detect(source);
            try {
                Node module = SourceParser.parse(source, sourceVersion);
                List<Node> suites = AstUtils.findAll(module, NodeKind.SUITE);
                if (!suites.isEmpty()) {
                    String detected = Whitespace.indentationOf(AstUtils.firstStatement(suites.get(0)));
                    if (!detected.isEmpty()) {
                        this.indentation = detected;
                    }
                }
            } catch (WalrusSyntaxException e) {
                LOG.debug("Keeping indentation '{}', source does not parse: {}", indentation, e.getMessage());
            }
            return this;
        }

        public ConversionConfig build() {
            return new ConversionConfig(this);
        }
    }
}
