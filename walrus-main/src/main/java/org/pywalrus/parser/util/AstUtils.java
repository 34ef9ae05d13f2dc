package org.pywalrus.parser.util;

import java.util.ArrayList;
import java.util.List;

import org.pywalrus.parser.ast.Leaf;
import org.pywalrus.parser.ast.Node;
import org.pywalrus.parser.ast.NodeKind;

public class AstUtils {

    private AstUtils() {
    }

    /**
     * Whether {@code node} is an assignment expression: a {@code namedexpr_test} with a
     * target, or a call argument of the form {@code NAME := test}.
     */
    public static boolean isNamedExpr(Node node) {
        if (node.is(NodeKind.NAMEDEXPR_TEST)) {
            return true;
        }
        return node.is(NodeKind.ARGUMENT)
                && node.getChildren().size() == 3
                && isOperator(node.getChild(1), ":=");
    }

    /**
     * Whether the subtree of {@code node} contains an assignment expression, looking
     * into the replacement fields of f-strings.
     */
    public static boolean containsNamedExpr(Node node) {
        if (isNamedExpr(node)) {
            return true;
        }
        if (node instanceof Leaf leaf) {
            for (Node embedded : leaf.getEmbedded()) {
                if (containsNamedExpr(embedded)) {
                    return true;
                }
            }
            return false;
        }
        for (Node child : node.getChildren()) {
            if (containsNamedExpr(child)) {
                return true;
            }
        }
        return false;
    }

    /**
     * The number of assignment expressions in the subtree of {@code node}, f-strings included.
     */
    public static int countNamedExprs(Node node) {
        int count = isNamedExpr(node) ? 1 : 0;
        if (node instanceof Leaf leaf) {
            for (Node embedded : leaf.getEmbedded()) {
                count += countNamedExprs(embedded);
            }
        }
        for (Node child : node.getChildren()) {
            count += countNamedExprs(child);
        }
        return count;
    }

    public static boolean isOperator(Node node, String operator) {
        return node instanceof Leaf leaf && leaf.isOperator(operator);
    }

    public static boolean isKeyword(Node node, String keyword) {
        return node instanceof Leaf leaf && leaf.isKeyword(keyword);
    }

    /**
     * A single string literal or an implicit concatenation of literals.
     */
    public static boolean isStringAtom(Node node) {
        return node.is(NodeKind.STRING) || node.is(NodeKind.STRINGS);
    }

    /**
     * A block suite or the simple statement of a one-line suite.
     */
    public static boolean isSuite(Node node) {
        return node.is(NodeKind.SUITE) || node.is(NodeKind.SIMPLE_STMT);
    }

    /**
     * A function or class definition statement, decorated or not.
     */
    public static boolean isDefinition(Node node) {
        switch (node.getKind()) {
            case FUNCDEF:
            case CLASSDEF:
            case DECORATED:
            case ASYNC_FUNCDEF:
                return true;
            case ASYNC_STMT:
                return node.getChild(1).is(NodeKind.FUNCDEF);
            default:
                return false;
        }
    }

    /**
     * The first statement of a block suite, after its leading newline.
     */
    public static Node firstStatement(Node suite) {
        if (suite.is(NodeKind.SIMPLE_STMT)) {
            return suite;
        }
        return suite.getChild(1);
    }

    /**
     * All nodes of the given kind in document order, not looking into f-strings.
     */
    public static List<Node> findAll(Node root, NodeKind kind) {
        List<Node> result = new ArrayList<>();
        collect(root, kind, result);
        return result;
    }

    private static void collect(Node node, NodeKind kind, List<Node> result) {
        if (node.is(kind)) {
            result.add(node);
        }
        for (Node child : node.getChildren()) {
            collect(child, kind, result);
        }
    }

    /**
     * The chain of nodes from {@code root} down to {@code target}, both included.
     *
     * @throws IllegalArgumentException if {@code target} is not part of the tree
     */
    public static List<Node> pathTo(Node root, Node target) {
        List<Node> path = new ArrayList<>();
        if (!findPath(root, target, path)) {
            throw new IllegalArgumentException(target.describe() + " is not part of " + root.describe());
        }
        return path;
    }

    private static boolean findPath(Node node, Node target, List<Node> path) {
        path.add(node);
        if (node == target) {
            return true;
        }
        for (Node child : node.getChildren()) {
            if (findPath(child, target, path)) {
                return true;
            }
        }
        path.remove(path.size() - 1);
        return false;
    }
}
