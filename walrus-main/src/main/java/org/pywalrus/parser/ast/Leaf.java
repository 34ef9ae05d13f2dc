package org.pywalrus.parser.ast;

import java.util.List;

/**
 * A token together with everything the tokenizer skipped in front of it.
 */
public final class Leaf extends Node {

    private final String value;
    private final String prefix;
    private final int line;
    private final int column;
    private final List<Node> embedded;

    public Leaf(NodeKind kind, String value, String prefix, int line, int column) {
        this(kind, value, prefix, line, column, List.of());
    }

    /**
     * @param embedded the parsed replacement-field expressions of an f-string token
     */
    public Leaf(NodeKind kind, String value, String prefix, int line, int column, List<Node> embedded) {
        super(kind);
        if (!kind.isLeaf()) {
            throw new IllegalArgumentException(kind + " is not a leaf kind");
        }
        this.value = value;
        this.prefix = prefix;
        this.line = line;
        this.column = column;
        this.embedded = List.copyOf(embedded);
    }

    public String getValue() {
        return value;
    }

    public String getPrefix() {
        return prefix;
    }

    public List<Node> getEmbedded() {
        return embedded;
    }

    public boolean isOperator(String operator) {
        return getKind() == NodeKind.OPERATOR && value.equals(operator);
    }

    public boolean isKeyword(String keyword) {
        return getKind() == NodeKind.KEYWORD && value.equals(keyword);
    }

    @Override
    public String getCode() {
        return prefix + value;
    }

    @Override
    public List<Node> getChildren() {
        return List.of();
    }

    @Override
    public Leaf getFirstLeaf() {
        return this;
    }

    @Override
    public Leaf getLastLeaf() {
        return this;
    }

    @Override
    public int getLine() {
        return line;
    }

    @Override
    public int getColumn() {
        return column;
    }
}
