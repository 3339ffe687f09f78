package com.chih.JQWeb.core.expr;

/**
 * 语法树节点种类，沙箱按种类白名单校验
 *
 * @author lizhiyuan
 * @since 2026/10/02
 */
public enum ExprKind {
    LITERAL,
    NAME,
    ATTRIBUTE,
    SUBSCRIPT,
    SLICE,
    CALL,
    STARRED,
    BINARY_OP,
    UNARY_OP,
    BOOL_OP,
    COMPARE,
    CONDITIONAL,
    LAMBDA,
    COMPREHENSION,
    LIST,
    TUPLE,
    SET,
    DICT,
    ASSIGNMENT,
    NAMED_EXPRESSION
}
