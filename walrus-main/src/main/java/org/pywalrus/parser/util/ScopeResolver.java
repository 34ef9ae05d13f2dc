package org.pywalrus.parser.util;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.pywalrus.parser.ast.Leaf;
import org.pywalrus.parser.ast.Node;
import org.pywalrus.parser.ast.NodeKind;

/**
 * Finds the scope a node belongs to. Only the body of a function, lambda or class is
 * inside the scope it opens: decorators, default values, annotations and base classes
 * are evaluated in the enclosing scope.
 */
public final class ScopeResolver {

    public enum ScopeKind {
        MODULE,
        FUNCTION,
        CLASS
    }

    private ScopeResolver() {
    }

    /**
     * The kind of scope whose body is {@code owner}'s last child, or {@code null} when
     * {@code owner} does not open a scope.
     */
    public static ScopeKind scopeOpenedBy(Node owner) {
        switch (owner.getKind()) {
            case FUNCDEF:
            case LAMBDEF:
            case LAMBDEF_NOCOND:
                return ScopeKind.FUNCTION;
            case CLASSDEF:
                return ScopeKind.CLASS;
            default:
                return null;
        }
    }

    public static boolean opensScope(Node owner) {
        return scopeOpenedBy(owner) != null;
    }

    /**
     * Whether {@code child} is the body of the scope opened by {@code owner}.
     */
    public static boolean isScopeBody(Node owner, Node child) {
        List<Node> children = owner.getChildren();
        return opensScope(owner) && children.get(children.size() - 1) == child;
    }

    /**
     * The innermost scope enclosing the last node of {@code path}.
     *
     * @param path nodes from the module root down to the node, both included
     */
    public static ScopeKind enclosingScope(List<Node> path) {
        for (int i = path.size() - 2; i >= 0; i--) {
            Node ancestor = path.get(i);
            if (isScopeBody(ancestor, path.get(i + 1))) {
                return scopeOpenedBy(ancestor);
            }
        }
        return ScopeKind.MODULE;
    }

    /**
     * Index of the innermost scope boundary on {@code path}, -1 at module level.
     */
    public static int innermostScopeIndex(List<Node> path) {
        for (int i = path.size() - 2; i >= 0; i--) {
            if (isScopeBody(path.get(i), path.get(i + 1))) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Names declared by the {@code global} or {@code nonlocal} statements of one scope body,
     * wherever they appear in it. Nested function, lambda and class bodies are not searched.
     *
     * @param declaration {@link NodeKind#GLOBAL_STMT} or {@link NodeKind#NONLOCAL_STMT}
     */
    public static Set<String> declaredNames(Node body, NodeKind declaration) {
        Set<String> names = new LinkedHashSet<>();
        collectDeclared(body, declaration, names);
        return names;
    }

    private static void collectDeclared(Node node, NodeKind declaration, Set<String> names) {
        if (node.is(declaration)) {
            for (Node child : node.getChildren()) {
                if (child.is(NodeKind.NAME)) {
                    names.add(((Leaf) child).getValue());
                }
            }
            return;
        }
        if (opensScope(node)) {
            return;
        }
        for (Node child : node.getChildren()) {
            collectDeclared(child, declaration, names);
        }
    }
}
