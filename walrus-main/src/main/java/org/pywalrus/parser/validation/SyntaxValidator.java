package org.pywalrus.parser.validation;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.pywalrus.PythonVersion;
import org.pywalrus.WalrusSyntaxException;
import org.pywalrus.parser.ast.Leaf;
import org.pywalrus.parser.ast.Node;
import org.pywalrus.parser.ast.NodeKind;
import org.pywalrus.parser.util.AstUtils;
import org.pywalrus.parser.util.ScopeResolver;

/**
 * Rejects the programs the grammar accepts but the compiler does not: assignment
 * expressions with a target other than a plain name or in forbidden comprehension
 * positions, and for 3.8 decorators that are not a dotted name with an optional call.
 */
public final class SyntaxValidator {

    private final PythonVersion version;
    private final String sourceName;

    public SyntaxValidator(PythonVersion version, String sourceName) {
        this.version = version;
        this.sourceName = sourceName;
    }

    public void validate(Node root) {
        visit(root, new ArrayList<>());
    }

    private void visit(Node node, List<Node> ancestors) {
        if (AstUtils.isNamedExpr(node) && node.getChildren().size() == 3) {
            checkNamedExpr(node, ancestors);
        } else if (node.is(NodeKind.DECORATOR) && !version.allowsRelaxedDecorators()) {
            checkDecorator(node);
        }

        ancestors.add(node);
        if (node instanceof Leaf leaf) {
            for (Node embedded : leaf.getEmbedded()) {
                visit(embedded, ancestors);
            }
        }
        for (Node child : node.getChildren()) {
            visit(child, ancestors);
        }
        ancestors.remove(ancestors.size() - 1);
    }

    private void checkNamedExpr(Node namedExpr, List<Node> ancestors) {
        Node target = namedExpr.getChild(0);
        if (!target.is(NodeKind.NAME)) {
            throw error("cannot use assignment expressions with " + describeTarget(target), target);
        }
        String name = ((Leaf) target).getValue();

        List<Node> path = new ArrayList<>(ancestors);
        path.add(namedExpr);

        for (int i = 0; i < ancestors.size(); i++) {
            Node ancestor = ancestors.get(i);
            if (ancestor.is(NodeKind.SYNC_COMP_FOR) && ancestor.getChild(3) == path.get(i + 1)) {
                throw error("assignment expression cannot be used in a comprehension iterable expression", namedExpr);
            }
        }

        boolean inComprehension = false;
        int scopeIndex = ScopeResolver.innermostScopeIndex(path);
        for (int i = ancestors.size() - 1; i > scopeIndex; i--) {
            Node clause = comprehensionClause(ancestors.get(i));
            if (clause == null) {
                continue;
            }
            inComprehension = true;
            if (iterationVariables(clause).contains(name)) {
                throw error("assignment expression cannot rebind comprehension iteration variable '" + name + "'",
                        namedExpr);
            }
        }

        if (inComprehension && ScopeResolver.enclosingScope(path) == ScopeResolver.ScopeKind.CLASS) {
            throw error("assignment expression within a comprehension cannot be used in a class body", namedExpr);
        }
    }

    /**
     * The first {@code for} clause when {@code node} is a comprehension, otherwise {@code null}.
     */
    private static Node comprehensionClause(Node node) {
        if (!node.is(NodeKind.TESTLIST_COMP) && !node.is(NodeKind.DICTORSETMAKER) && !node.is(NodeKind.ARGUMENT)) {
            return null;
        }
        for (Node child : node.getChildren()) {
            if (child.is(NodeKind.COMP_FOR) || child.is(NodeKind.SYNC_COMP_FOR)) {
                return child;
            }
        }
        return null;
    }

    private static Set<String> iterationVariables(Node clause) {
        Set<String> names = new LinkedHashSet<>();
        Node current = clause;
        while (current != null) {
            Node next = null;
            if (current.is(NodeKind.COMP_FOR)) {
                next = current.getChild(1);
            } else if (current.is(NodeKind.SYNC_COMP_FOR)) {
                collectTargetNames(current.getChild(1), names);
                next = current.getChildren().size() > 4 ? current.getChild(4) : null;
            } else if (current.is(NodeKind.COMP_IF)) {
                next = current.getChildren().size() > 2 ? current.getChild(2) : null;
            }
            current = next;
        }
        return names;
    }

    private static void collectTargetNames(Node target, Set<String> names) {
        switch (target.getKind()) {
            case NAME:
                names.add(((Leaf) target).getValue());
                break;
            case EXPRLIST:
            case TESTLIST_COMP:
            case ATOM:
                for (Node child : target.getChildren()) {
                    collectTargetNames(child, names);
                }
                break;
            case STAR_EXPR:
                collectTargetNames(target.getChild(1), names);
                break;
            default:
                break;
        }
    }

    private void checkDecorator(Node decorator) {
        Node expression = decorator.getChild(1);
        if (expression.is(NodeKind.NAME)) {
            return;
        }
        if (expression.is(NodeKind.ATOM_EXPR) && expression.getChild(0).is(NodeKind.NAME)) {
            List<Node> trailers = expression.getChildren().subList(1, expression.getChildren().size());
            boolean valid = true;
            for (int i = 0; i < trailers.size() && valid; i++) {
                Node trailer = trailers.get(i);
                boolean last = i == trailers.size() - 1;
                valid = trailer.is(NodeKind.TRAILER)
                        && (AstUtils.isOperator(trailer.getChild(0), ".") || last && AstUtils.isOperator(trailer.getChild(0), "("));
            }
            if (valid) {
                return;
            }
        }
        throw error("invalid syntax: decorators must be dotted names before Python 3.9", expression);
    }

    private static String describeTarget(Node target) {
        switch (target.getKind()) {
            case LAMBDEF:
            case LAMBDEF_NOCOND:
                return "lambda";
            case ATOM_EXPR:
            case POWER:
                return describeAtomExpr(target);
            case ATOM:
                Node open = target.getChild(0);
                if (AstUtils.isOperator(open, "(")) {
                    return "tuple";
                }
                return AstUtils.isOperator(open, "[") ? "list" : "dict display";
            case STRING:
            case STRINGS:
            case NUMBER:
                return "literal";
            case KEYWORD:
                return ((Leaf) target).getValue();
            case STAR_EXPR:
                return "starred";
            case COMPARISON:
                return "comparison";
            case TEST:
                return "conditional expression";
            default:
                return "operator";
        }
    }

    private static String describeAtomExpr(Node target) {
        if (target.is(NodeKind.POWER)) {
            return "operator";
        }
        if (AstUtils.isKeyword(target.getChild(0), "await")) {
            return "await expression";
        }
        Node lastTrailer = target.getChild(target.getChildren().size() - 1);
        Node opener = lastTrailer.getChild(0);
        if (AstUtils.isOperator(opener, "(")) {
            return "function call";
        }
        if (AstUtils.isOperator(opener, "[")) {
            return "subscript";
        }
        return "attribute";
    }

    private WalrusSyntaxException error(String message, Node node) {
        return new WalrusSyntaxException(message, sourceName, node.getLine(), node.getColumn());
    }
}
