package org.pywalrus.transpiler;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Registry of the members bound by assignment expressions in one class body, keyed by
 * mangled name. Each member keeps the uid of the binding that introduced it; the value
 * itself lives in the class namespace under the mangled name.
 * <p>
 * One table exists per class body and every context converting part of that body
 * shares it, so later bindings of a member find the uid of the first one. Names the
 * body declares {@code global} or {@code nonlocal} are tracked as external and bound
 * through ordinary wrapper functions instead.
 */
public final class ClassMemberTable {

    private final String className;
    private final Map<String, String> members = new LinkedHashMap<>();
    private final Map<String, ScopeKeyword> externals = new LinkedHashMap<>();

    public ClassMemberTable(String className) {
        this.className = className;
    }

    public String getClassName() {
        return className;
    }

    public String mangle(String name) {
        return NameMangler.mangle(className, name);
    }

    /**
     * Registers a binding of a member.
     *
     * @param uid unique name drawn for this binding
     * @return the uid of the member's first binding
     */
    public String register(String mangledName, String uid) {
        return members.computeIfAbsent(mangledName, key -> uid);
    }

    /**
     * @throws IllegalArgumentException if the member is not in the table
     */
    public String uid(String mangledName) {
        String uid = members.get(mangledName);
        if (uid == null) {
            throw new IllegalArgumentException("Unknown class member: " + mangledName);
        }
        return uid;
    }

    public boolean contains(String mangledName) {
        return members.containsKey(mangledName);
    }

    public Map<String, String> getMembers() {
        return Collections.unmodifiableMap(members);
    }

    public void declareExternal(String name, ScopeKeyword keyword) {
        externals.put(name, keyword);
    }

    /**
     * @return the declared keyword, or {@code null} when the name is a class member
     */
    public ScopeKeyword externalKeyword(String name) {
        return externals.get(name);
    }
}
