package org.pywalrus;

import java.util.Locale;

public enum Linesep {

    LF("\n"),
    CRLF("\r\n"),
    CR("\r");

    private final String text;

    Linesep(String text) {
        this.text = text;
    }

    public String getText() {
        return text;
    }

    /**
     * Accepts either the line terminator itself or its name, case-insensitively.
     */
    public static Linesep parse(String value) {
        for (Linesep linesep : values()) {
            if (linesep.text.equals(value) || linesep.name().equals(value.trim().toUpperCase(Locale.ROOT))) {
                return linesep;
            }
        }
        throw new WalrusConfigurationException("linesep", value);
    }

    /**
     * The most frequent line terminator of {@code source}, {@link #LF} when there is none.
     * Ties go to the terminator that comes first in declaration order.
     */
    public static Linesep detect(String source) {
        int lf = 0;
        int crlf = 0;
        int cr = 0;
        for (int i = 0; i < source.length(); i++) {
            char c = source.charAt(i);
            if (c == '\r') {
                if (i + 1 < source.length() && source.charAt(i + 1) == '\n') {
                    crlf++;
                    i++;
                } else {
                    cr++;
                }
            } else if (c == '\n') {
                lf++;
            }
        }
        if (crlf > lf && crlf >= cr) {
            return CRLF;
        }
        if (cr > lf && cr > crlf) {
            return CR;
        }
        return LF;
    }
}
