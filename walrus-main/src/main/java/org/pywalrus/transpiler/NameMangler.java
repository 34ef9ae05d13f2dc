package org.pywalrus.transpiler;

/**
 * Private name mangling of class bodies: {@code __spam} in class {@code _Ham} is stored as
 * {@code _Ham__spam}.
 */
public final class NameMangler {

    private NameMangler() {
    }

    public static String mangle(String className, String name) {
        if (!name.startsWith("__") || name.endsWith("__") || isUnderscores(name)) {
            return name;
        }
        String stripped = stripLeadingUnderscores(className);
        if (stripped.isEmpty()) {
            return name;
        }
        return "_" + stripped + name;
    }

    private static boolean isUnderscores(String text) {
        return stripLeadingUnderscores(text).isEmpty();
    }

    private static String stripLeadingUnderscores(String text) {
        int start = 0;
        while (start < text.length() && text.charAt(start) == '_') {
            start++;
        }
        return text.substring(start);
    }
}
