package com.chih.JQWeb.core.expr;

import java.util.Map;

/**
 * 编译后的表达式：源文本加上已通过沙箱检查的语法树
 *
 * @author lizhiyuan
 * @since 2026/10/02
 */
public final class CompiledExpression {

    private final String source;
    private final Expr tree;

    CompiledExpression(String source, Expr tree) {
        this.source = source;
        this.tree = tree;
    }

    public Object evaluate(Map<String, Object> values) {
        return tree.evaluate(Scope.of(values));
    }

    public String getSource() {
        return source;
    }

    public Expr getTree() {
        return tree;
    }

    @Override
    public String toString() {
        return source;
    }
}
