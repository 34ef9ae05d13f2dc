package org.pywalrus.fstring;

import org.pywalrus.PythonVersion;

/**
 * Lowers a string literal, or an implicit concatenation of literals, that contains
 * f-strings into an expression without f-strings.
 */
@FunctionalInterface
public interface FormattedLiteralRewriter {

    /**
     * @param literal the literal's source text, without surrounding whitespace
     * @return an equivalent expression; the literal itself when it holds no f-string
     */
    String rewrite(String literal, PythonVersion version);
}
