package org.pywalrus.parser.ast;

import java.util.List;

public final class Branch extends Node {

    private final List<Node> children;
    private String code;

    public Branch(NodeKind kind, List<Node> children) {
        super(kind);
        if (kind.isLeaf()) {
            throw new IllegalArgumentException(kind + " is a leaf kind");
        }
        if (children.isEmpty()) {
            throw new IllegalArgumentException(kind + " needs at least one child");
        }
        this.children = List.copyOf(children);
    }

    @Override
    public String getCode() {
        // computed once, the tree never changes
        String result = code;
        if (result == null) {
            StringBuilder builder = new StringBuilder();
            for (Node child : children) {
                builder.append(child.getCode());
            }
            result = builder.toString();
            code = result;
        }
        return result;
    }

    @Override
    public List<Node> getChildren() {
        return children;
    }

    @Override
    public Leaf getFirstLeaf() {
        return children.get(0).getFirstLeaf();
    }

    @Override
    public Leaf getLastLeaf() {
        return children.get(children.size() - 1).getLastLeaf();
    }
}
