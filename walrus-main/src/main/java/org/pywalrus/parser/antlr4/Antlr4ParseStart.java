package org.pywalrus.parser.antlr4;

import org.antlr.v4.runtime.tree.ParseTree;

/**
 * The start production for Antlr.
 * Tells Antlr what piece of Python code it can expect.
 */
@FunctionalInterface
public interface Antlr4ParseStart {

    ParseTree parse(Python3Parser parser);

    Antlr4ParseStart FILE_INPUT = Python3Parser::file_input;
    Antlr4ParseStart EVAL_INPUT = Python3Parser::eval_input;
}
