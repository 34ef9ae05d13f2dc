package org.pywalrus.parser.fstring;

import java.util.ArrayList;
import java.util.List;

/**
 * A piece of an f-string body: literal text or a replacement field.
 */
public sealed interface FStringPiece permits FStringPiece.Literal, FStringPiece.Field {

    /**
     * Literal text exactly as written in the source, doubled braces included.
     */
    record Literal(String text) implements FStringPiece {
    }

    /**
     * A replacement field.
     *
     * @param expression the expression text between the brace and the conversion, spec or closing brace
     * @param debugText  for a self-documenting field, the text up to and including {@code =} and the
     *                   whitespace after it, otherwise {@code null}
     * @param conversion the conversion character, or {@code null}
     * @param formatSpec the pieces of the format spec, or {@code null} when the field has none
     */
    record Field(String expression, String debugText, Character conversion, List<FStringPiece> formatSpec)
            implements FStringPiece {

        public Field {
            formatSpec = formatSpec == null ? null : List.copyOf(formatSpec);
        }

        public boolean isSelfDocumenting() {
            return debugText != null;
        }
    }

    /**
     * Fields in the order {@code str.format} numbers them: each field before the
     * fields nested in its format spec.
     */
    static List<Field> fields(List<FStringPiece> pieces) {
        List<Field> result = new ArrayList<>();
        collect(pieces, result);
        return result;
    }

    private static void collect(List<FStringPiece> pieces, List<Field> result) {
        for (FStringPiece piece : pieces) {
            if (piece instanceof Field field) {
                result.add(field);
                if (field.formatSpec() != null) {
                    collect(field.formatSpec(), result);
                }
            }
        }
    }
}
