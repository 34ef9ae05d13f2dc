package org.pywalrus;

import java.util.Locale;

/**
 * Grammar versions accepted as conversion input.
 */
public enum PythonVersion {

    PY38("3.8"),
    PY39("3.9");

    private final String text;

    PythonVersion(String text) {
        this.text = text;
    }

    public String getText() {
        return text;
    }

    /**
     * Decorators may be arbitrary expressions from 3.9 on.
     */
    public boolean allowsRelaxedDecorators() {
        return this.compareTo(PY39) >= 0;
    }

    public static PythonVersion latest() {
        return PY39;
    }

    public static PythonVersion parse(String value) {
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (PythonVersion version : values()) {
            if (version.text.equals(normalized) || version.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return version;
            }
        }
        throw new WalrusConfigurationException("source version", value);
    }
}
