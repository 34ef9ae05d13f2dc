package org.pywalrus.transpiler;

public enum ContextKind {

    /** module, function body or compound statement suite */
    PLAIN,

    /** class body, or a suite nested in one without a new scope */
    CLASS,

    /** the body of an extracted lambda */
    LAMBDA,

    /** a string literal lowered to a format call */
    STRING
}
