package com.chih.JQWeb.core.expr;

import com.chih.JQWeb.core.exception.ExpressionEvaluationException;
import com.chih.JQWeb.core.exception.MissingValueException;

import java.util.HashMap;
import java.util.Map;

/**
 * 表达式求值作用域
 * <p>
 * {@code values} 为模板绑定（只读访问）；lambda 参数与推导式目标保存在局部链上，互不泄漏。
 *
 * @author lizhiyuan
 * @since 2026/10/02
 */
public final class Scope {

    private final Map<String, Object> values;
    private final Scope parent;
    private final Map<String, Object> locals;

    private Scope(Map<String, Object> values, Scope parent, Map<String, Object> locals) {
        this.values = values;
        this.parent = parent;
        this.locals = locals;
    }

    public static Scope of(Map<String, Object> values) {
        return new Scope(values, null, Map.of());
    }

    public Scope child() {
        return new Scope(values, this, new HashMap<>());
    }

    public Map<String, Object> values() {
        return values;
    }

    public void define(String name, Object value) {
        locals.put(name, value);
    }

    public Object local(String name) {
        for (Scope scope = this; scope != null; scope = scope.parent) {
            if (scope.locals.containsKey(name)) {
                return scope.locals.get(name);
            }
        }
        throw new ExpressionEvaluationException("NameError: name '" + name + "' is not defined");
    }

    public Object required(String name) {
        if (!values.containsKey(name)) {
            throw new MissingValueException(name);
        }
        return values.get(name);
    }

    public Object optional(String name) {
        return values.get(name);
    }
}
