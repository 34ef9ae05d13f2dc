package org.pywalrus.transpiler;

import org.pywalrus.parser.util.ScopeResolver.ScopeKind;

/**
 * The declaration a wrapper function uses to bind a name in the scope around it.
 */
public enum ScopeKeyword {

    GLOBAL("global"),
    NONLOCAL("nonlocal");

    private final String keyword;

    ScopeKeyword(String keyword) {
        this.keyword = keyword;
    }

    public String getKeyword() {
        return keyword;
    }

    /**
     * The keyword for code in the body of a scope of the given kind. Class bodies keep
     * the keyword of the scope around the class.
     */
    public static ScopeKeyword forBody(ScopeKind kind, ScopeKeyword enclosing) {
        if (kind == null) {
            return enclosing;
        }
        switch (kind) {
            case MODULE:
                return GLOBAL;
            case FUNCTION:
                return NONLOCAL;
            default:
                return enclosing;
        }
    }
}
