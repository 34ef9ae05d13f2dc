package org.pywalrus;

/**
 * The source text is not valid Python for the configured grammar version, or uses an
 * assignment expression in a position the language forbids.
 */
public class WalrusSyntaxException extends WalrusException {

    private final String sourceName;
    private final int line;
    private final int column;

    public WalrusSyntaxException(String message, String sourceName, int line, int column) {
        super(format(message, sourceName, line, column));
        this.sourceName = sourceName;
        this.line = line;
        this.column = column;
    }

    public WalrusSyntaxException(String message, String sourceName, int line, int column, Throwable cause) {
        super(format(message, sourceName, line, column), cause);
        this.sourceName = sourceName;
        this.line = line;
        this.column = column;
    }

    public String getSourceName() {
        return sourceName;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    private static String format(String message, String sourceName, int line, int column) {
        return sourceName + ":" + line + ":" + column + ": " + message;
    }
}
