package org.pywalrus.parser.ast;

import java.util.List;

/**
 * Immutable syntax tree node. The code of a node is the exact source text it spans,
 * including the whitespace and comments preceding its first token.
 */
public abstract sealed class Node permits Leaf, Branch {

    private final NodeKind kind;

    protected Node(NodeKind kind) {
        this.kind = kind;
    }

    public NodeKind getKind() {
        return kind;
    }

    public boolean is(NodeKind kind) {
        return this.kind == kind;
    }

    public abstract String getCode();

    public abstract List<Node> getChildren();

    public abstract Leaf getFirstLeaf();

    public abstract Leaf getLastLeaf();

    public Node getChild(int index) {
        return getChildren().get(index);
    }

    public int getLine() {
        return getFirstLeaf().getLine();
    }

    public int getColumn() {
        return getFirstLeaf().getColumn();
    }

    /**
     * The code of this node without the prefix of its first token.
     */
    public String getCodeWithoutPrefix() {
        return getCode().substring(getFirstLeaf().getPrefix().length());
    }

    /**
     * Short description used in error messages.
     */
    public String describe() {
        String code = getCodeWithoutPrefix().strip();
        if (code.length() > 40) {
            code = code.substring(0, 37) + "...";
        }
        return kind.name().toLowerCase(java.util.Locale.ROOT) + " '" + code + "' at " + getLine() + ":" + getColumn();
    }

    @Override
    public String toString() {
        return describe();
    }
}
