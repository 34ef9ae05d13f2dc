package org.pywalrus.parser.fstring;

import java.util.Locale;

/**
 * A string token split into its prefix letters, its quote and its body.
 */
public record StringLiteral(String prefix, String quote, String body) {

    public static StringLiteral of(String token) {
        int start = 0;
        while (start < token.length() && token.charAt(start) != '\'' && token.charAt(start) != '"') {
            start++;
        }
        if (start == token.length()) {
            throw new IllegalArgumentException("Not a string literal: " + token);
        }
        String prefix = token.substring(0, start);
        char q = token.charAt(start);
        String triple = String.valueOf(q).repeat(3);
        String quote = token.startsWith(triple, start) && token.length() - start >= 6 ? triple : String.valueOf(q);
        String body = token.substring(start + quote.length(), token.length() - quote.length());
        return new StringLiteral(prefix, quote, body);
    }

    public boolean isFormatted() {
        return prefix.toLowerCase(Locale.ROOT).contains("f");
    }

    public boolean isRaw() {
        return prefix.toLowerCase(Locale.ROOT).contains("r");
    }

    public boolean isBytes() {
        return prefix.toLowerCase(Locale.ROOT).contains("b");
    }

    public String toSource() {
        return prefix + quote + body + quote;
    }

    public StringLiteral withPrefix(String newPrefix) {
        return new StringLiteral(newPrefix, quote, body);
    }

    public StringLiteral withBody(String newBody) {
        return new StringLiteral(prefix, quote, newBody);
    }
}
