package org.pywalrus.parser.ast;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Kinds of syntax tree nodes. Interior kinds carry the name of the grammar rule that
 * produced them, leaf kinds classify tokens.
 */
public enum NodeKind {

    // leaves
    NAME,
    NUMBER,
    STRING,
    KEYWORD,
    OPERATOR,
    NEWLINE,
    ENDMARKER,

    // grammar rules
    FILE_INPUT,
    EVAL_INPUT,
    DECORATOR,
    DECORATORS,
    DECORATED,
    ASYNC_FUNCDEF,
    FUNCDEF,
    PARAMETERS,
    TYPEDARGSLIST,
    TYPEDARG,
    TFPDEF,
    VARARGSLIST,
    VARARG,
    VFPDEF,
    STMT,
    SIMPLE_STMT,
    SMALL_STMT,
    EXPR_STMT,
    ANNASSIGN,
    TESTLIST_STAR_EXPR,
    AUGASSIGN,
    DEL_STMT,
    PASS_STMT,
    FLOW_STMT,
    BREAK_STMT,
    CONTINUE_STMT,
    RETURN_STMT,
    YIELD_STMT,
    RAISE_STMT,
    IMPORT_STMT,
    IMPORT_NAME,
    IMPORT_FROM,
    IMPORT_AS_NAME,
    DOTTED_AS_NAME,
    IMPORT_AS_NAMES,
    DOTTED_AS_NAMES,
    DOTTED_NAME,
    GLOBAL_STMT,
    NONLOCAL_STMT,
    ASSERT_STMT,
    COMPOUND_STMT,
    ASYNC_STMT,
    IF_STMT,
    WHILE_STMT,
    FOR_STMT,
    TRY_STMT,
    WITH_STMT,
    WITH_ITEM,
    EXCEPT_CLAUSE,
    SUITE,
    NAMEDEXPR_TEST,
    TEST,
    TEST_NOCOND,
    LAMBDEF,
    LAMBDEF_NOCOND,
    OR_TEST,
    AND_TEST,
    NOT_TEST,
    COMPARISON,
    COMP_OP,
    STAR_EXPR,
    EXPR,
    XOR_EXPR,
    AND_EXPR,
    SHIFT_EXPR,
    ARITH_EXPR,
    TERM,
    FACTOR,
    POWER,
    ATOM_EXPR,
    ATOM,
    STRINGS,
    TESTLIST_COMP,
    TRAILER,
    SUBSCRIPTLIST,
    SUBSCRIPT,
    SLICEOP,
    EXPRLIST,
    TESTLIST,
    DICTORSETMAKER,
    CLASSDEF,
    ARGLIST,
    ARGUMENT,
    COMP_ITER,
    SYNC_COMP_FOR,
    COMP_FOR,
    COMP_IF,
    YIELD_EXPR,
    YIELD_ARG;

    private static final Map<String, NodeKind> BY_RULE_NAME = new HashMap<>();

    static {
        for (NodeKind kind : values()) {
            if (!kind.isLeaf()) {
                BY_RULE_NAME.put(kind.name().toLowerCase(Locale.ROOT), kind);
            }
        }
    }

    public boolean isLeaf() {
        return ordinal() <= ENDMARKER.ordinal();
    }

    /**
     * Start rules are kept in the tree even when they wrap a single child.
     */
    public boolean keepsSingleChild() {
        return this == FILE_INPUT || this == EVAL_INPUT;
    }

    public static NodeKind forRule(String ruleName) {
        NodeKind kind = BY_RULE_NAME.get(ruleName);
        if (kind == null) {
            throw new IllegalArgumentException("Unknown grammar rule: " + ruleName);
        }
        return kind;
    }
}
