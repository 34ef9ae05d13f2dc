package org.pywalrus.parser.antlr4;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.pywalrus.WalrusSyntaxException;

/**
 * Aborts lexing or parsing on the first reported error.
 */
public final class ThrowingErrorListener extends BaseErrorListener {

    private final String sourceName;

    public ThrowingErrorListener(String sourceName) {
        this.sourceName = sourceName;
    }

    @Override
    public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line, int charPositionInLine,
                            String msg, RecognitionException e) {
        throw new WalrusSyntaxException("invalid syntax (" + msg + ")", sourceName, line, charPositionInLine, e);
    }
}
