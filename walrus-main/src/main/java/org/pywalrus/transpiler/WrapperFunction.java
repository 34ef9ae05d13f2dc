package org.pywalrus.transpiler;

/**
 * A pending wrapper that binds {@code name} in the scope selected by {@code keyword}.
 */
public record WrapperFunction(String name, String uid, ScopeKeyword keyword) {

    public String functionName() {
        return WrapperTemplates.functionName(name, uid);
    }
}
