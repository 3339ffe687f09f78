package com.chih.JQWeb.core.expr;

import com.chih.JQWeb.core.exception.ExpressionSyntaxException;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumSet;
import java.util.Set;

/**
 * 表达式沙箱：对语法树做静态白名单检查
 * <p>
 * 只允许 {@link #ALLOWED} 中列出的节点种类；属性名、关键字参数名、局部变量名均不得包含 {@code __}。
 * 检查在编译期完成，未通过检查的表达式永远不会被求值。
 *
 * @author lizhiyuan
 * @since 2026/10/02
 */
public final class ExpressionSandbox {

    public static final Set<ExprKind> ALLOWED = EnumSet.of(
            ExprKind.LITERAL,
            ExprKind.NAME,
            ExprKind.ATTRIBUTE,
            ExprKind.SUBSCRIPT,
            ExprKind.SLICE,
            ExprKind.CALL,
            ExprKind.STARRED,
            ExprKind.BINARY_OP,
            ExprKind.UNARY_OP,
            ExprKind.BOOL_OP,
            ExprKind.COMPARE,
            ExprKind.CONDITIONAL,
            ExprKind.LAMBDA,
            ExprKind.COMPREHENSION,
            ExprKind.LIST,
            ExprKind.TUPLE,
            ExprKind.SET,
            ExprKind.DICT);

    private ExpressionSandbox() {
    }

    public static void validate(Expr root, String source) {
        Deque<Expr> pending = new ArrayDeque<>();
        pending.push(root);
        while (!pending.isEmpty()) {
            Expr expr = pending.pop();
            if (!ALLOWED.contains(expr.kind())) {
                throw new ExpressionSyntaxException(describe(expr.kind()) + " is not allowed", source);
            }
            checkNames(expr, source);
            for (Expr child : expr.children()) {
                pending.push(child);
            }
        }
    }

    private static void checkNames(Expr expr, String source) {
        if (expr instanceof Expr.Attribute) {
            checkName(((Expr.Attribute) expr).name(), source);
        } else if (expr instanceof Expr.Name) {
            checkName(((Expr.Name) expr).name(), source);
        } else if (expr instanceof Expr.Call) {
            for (Expr.Keyword keyword : ((Expr.Call) expr).keywords()) {
                if (keyword.name() != null) {
                    checkName(keyword.name(), source);
                }
            }
        } else if (expr instanceof Expr.Lambda) {
            for (String parameter : ((Expr.Lambda) expr).parameters()) {
                checkName(parameter, source);
            }
        }
    }

    private static void checkName(String name, String source) {
        if (name.contains("__")) {
            throw new ExpressionSyntaxException("access to '" + name + "' is forbidden", source);
        }
    }

    private static String describe(ExprKind kind) {
        switch (kind) {
            case ASSIGNMENT:
                return "assignment";
            case NAMED_EXPRESSION:
                return "assignment expression";
            default:
                return kind.name().toLowerCase().replace('_', ' ');
        }
    }
}
