package com.chih.JQWeb.core.expr;

import com.chih.JQWeb.core.exception.ExpressionEvaluationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 表达式语法树
 * <p>
 * 节点直接对 {@link Scope} 求值，运算语义委托给 {@link PyOps}。
 *
 * @author lizhiyuan
 * @since 2026/10/02
 */
public interface Expr {

    ExprKind kind();

    List<Expr> children();

    Object evaluate(Scope scope);

    record Literal(Object value) implements Expr {
        public ExprKind kind() {
            return ExprKind.LITERAL;
        }

        public List<Expr> children() {
            return List.of();
        }

        public Object evaluate(Scope scope) {
            return value;
        }
    }

    record Name(String name, NameKind resolution) implements Expr {
        public ExprKind kind() {
            return ExprKind.NAME;
        }

        public List<Expr> children() {
            return List.of();
        }

        public Object evaluate(Scope scope) {
            switch (resolution) {
                case LOCAL:
                    return scope.local(name);
                case BUILTIN:
                    return Builtins.get(name);
                case REQUIRED:
                    return scope.required(name);
                default:
                    return scope.optional(name);
            }
        }
    }

    record Attribute(Expr target, String name) implements Expr {
        public ExprKind kind() {
            return ExprKind.ATTRIBUTE;
        }

        public List<Expr> children() {
            return List.of(target);
        }

        public Object evaluate(Scope scope) {
            return PyOps.getAttribute(target.evaluate(scope), name);
        }
    }

    record Subscript(Expr target, Expr index) implements Expr {
        public ExprKind kind() {
            return ExprKind.SUBSCRIPT;
        }

        public List<Expr> children() {
            return List.of(target, index);
        }

        public Object evaluate(Scope scope) {
            return PyOps.getItem(target.evaluate(scope), index.evaluate(scope));
        }
    }

    record Slice(Expr lower, Expr upper, Expr step) implements Expr {
        public ExprKind kind() {
            return ExprKind.SLICE;
        }

        public List<Expr> children() {
            List<Expr> children = new ArrayList<>();
            if (lower != null) {
                children.add(lower);
            }
            if (upper != null) {
                children.add(upper);
            }
            if (step != null) {
                children.add(step);
            }
            return children;
        }

        public Object evaluate(Scope scope) {
            return new PyOps.SliceValue(
                    lower == null ? null : lower.evaluate(scope),
                    upper == null ? null : upper.evaluate(scope),
                    step == null ? null : step.evaluate(scope));
        }
    }

    /**
     * 关键字参数；{@code name} 为 null 表示 {@code **mapping} 展开
     */
    record Keyword(String name, Expr value) {
    }

    record Call(Expr function, List<Expr> args, List<Keyword> keywords) implements Expr {
        public ExprKind kind() {
            return ExprKind.CALL;
        }

        public List<Expr> children() {
            List<Expr> children = new ArrayList<>();
            children.add(function);
            children.addAll(args);
            for (Keyword keyword : keywords) {
                children.add(keyword.value());
            }
            return children;
        }

        public Object evaluate(Scope scope) {
            Object callee = function.evaluate(scope);
            List<Object> positional = new ArrayList<>();
            for (Expr arg : args) {
                if (arg instanceof Starred) {
                    for (Object item : PyOps.iterate(((Starred) arg).value().evaluate(scope))) {
                        positional.add(item);
                    }
                } else {
                    positional.add(arg.evaluate(scope));
                }
            }
            Map<String, Object> named = new LinkedHashMap<>();
            for (Keyword keyword : keywords) {
                Object value = keyword.value().evaluate(scope);
                if (keyword.name() != null) {
                    named.put(keyword.name(), value);
                } else if (value instanceof Map) {
                    for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
                        named.put(String.valueOf(entry.getKey()), entry.getValue());
                    }
                } else {
                    throw new ExpressionEvaluationException("TypeError: argument after ** must be a mapping");
                }
            }
            return PyOps.call(callee, positional, named);
        }
    }

    record Starred(Expr value) implements Expr {
        public ExprKind kind() {
            return ExprKind.STARRED;
        }

        public List<Expr> children() {
            return List.of(value);
        }

        public Object evaluate(Scope scope) {
            throw new ExpressionEvaluationException("SyntaxError: can't use starred expression here");
        }
    }

    record BinaryOp(String operator, Expr left, Expr right) implements Expr {
        public ExprKind kind() {
            return ExprKind.BINARY_OP;
        }

        public List<Expr> children() {
            return List.of(left, right);
        }

        public Object evaluate(Scope scope) {
            return PyOps.binary(operator, left.evaluate(scope), right.evaluate(scope));
        }
    }

    record UnaryOp(String operator, Expr operand) implements Expr {
        public ExprKind kind() {
            return ExprKind.UNARY_OP;
        }

        public List<Expr> children() {
            return List.of(operand);
        }

        public Object evaluate(Scope scope) {
            return PyOps.unary(operator, operand.evaluate(scope));
        }
    }

    /**
     * {@code and} / {@code or}，短路并返回决定结果的操作数本身
     */
    record BoolOp(boolean conjunction, List<Expr> values) implements Expr {
        public ExprKind kind() {
            return ExprKind.BOOL_OP;
        }

        public List<Expr> children() {
            return values;
        }

        public Object evaluate(Scope scope) {
            Object result = null;
            for (Expr value : values) {
                result = value.evaluate(scope);
                if (PyOps.truthy(result) != conjunction) {
                    return result;
                }
            }
            return result;
        }
    }

    /**
     * 链式比较 {@code a < b <= c}
     */
    record Compare(Expr left, List<String> operators, List<Expr> comparators) implements Expr {
        public ExprKind kind() {
            return ExprKind.COMPARE;
        }

        public List<Expr> children() {
            List<Expr> children = new ArrayList<>();
            children.add(left);
            children.addAll(comparators);
            return children;
        }

        public Object evaluate(Scope scope) {
            Object current = left.evaluate(scope);
            for (int i = 0; i < operators.size(); i++) {
                Object next = comparators.get(i).evaluate(scope);
                if (!PyOps.compare(operators.get(i), current, next)) {
                    return Boolean.FALSE;
                }
                current = next;
            }
            return Boolean.TRUE;
        }
    }

    record Conditional(Expr test, Expr body, Expr orElse) implements Expr {
        public ExprKind kind() {
            return ExprKind.CONDITIONAL;
        }

        public List<Expr> children() {
            return List.of(test, body, orElse);
        }

        public Object evaluate(Scope scope) {
            return PyOps.truthy(test.evaluate(scope)) ? body.evaluate(scope) : orElse.evaluate(scope);
        }
    }

    record Lambda(List<String> parameters, Expr body) implements Expr {
        public ExprKind kind() {
            return ExprKind.LAMBDA;
        }

        public List<Expr> children() {
            return List.of(body);
        }

        public Object evaluate(Scope scope) {
            return (PyCallable) (args, kwargs) -> {
                if (args.size() + kwargs.size() != parameters.size()) {
                    throw new ExpressionEvaluationException("TypeError: <lambda>() takes " + parameters.size()
                            + " arguments but " + (args.size() + kwargs.size()) + " were given");
                }
                Scope local = scope.child();
                for (int i = 0; i < parameters.size(); i++) {
                    String parameter = parameters.get(i);
                    if (i < args.size()) {
                        local.define(parameter, args.get(i));
                    } else if (kwargs.containsKey(parameter)) {
                        local.define(parameter, kwargs.get(parameter));
                    } else {
                        throw new ExpressionEvaluationException("TypeError: <lambda>() missing argument '" + parameter + "'");
                    }
                }
                return body.evaluate(local);
            };
        }
    }

    /**
     * 推导式赋值目标：单个名称，或（可嵌套的）名称元组
     */
    record Target(String name, List<Target> elements) {

        public static Target name(String name) {
            return new Target(name, null);
        }

        void bind(Scope scope, Object value) {
            if (name != null) {
                scope.define(name, value);
                return;
            }
            List<Object> items = new ArrayList<>();
            for (Object item : PyOps.iterate(value)) {
                items.add(item);
            }
            if (items.size() != elements.size()) {
                throw new ExpressionEvaluationException("ValueError: expected " + elements.size()
                        + " values to unpack, got " + items.size());
            }
            for (int i = 0; i < elements.size(); i++) {
                elements.get(i).bind(scope, items.get(i));
            }
        }
    }

    record ForClause(Target target, Expr iterable, List<Expr> conditions) {
    }

    enum ComprehensionType { LIST, SET, DICT, GENERATOR }

    /**
     * 推导式；字典推导式时 {@code element} 为键、{@code value} 为值
     */
    record Comprehension(ComprehensionType type, Expr element, Expr value, List<ForClause> clauses) implements Expr {
        public ExprKind kind() {
            return ExprKind.COMPREHENSION;
        }

        public List<Expr> children() {
            List<Expr> children = new ArrayList<>();
            children.add(element);
            if (value != null) {
                children.add(value);
            }
            for (ForClause clause : clauses) {
                children.add(clause.iterable());
                children.addAll(clause.conditions());
            }
            return children;
        }

        public Object evaluate(Scope scope) {
            List<Object> keys = new ArrayList<>();
            List<Object> values = new ArrayList<>();
            expand(0, scope.child(), keys, values);
            switch (type) {
                case SET:
                    return new LinkedHashSet<>(keys);
                case DICT:
                    Map<Object, Object> map = new LinkedHashMap<>();
                    for (int i = 0; i < keys.size(); i++) {
                        map.put(keys.get(i), values.get(i));
                    }
                    return map;
                default:
                    return keys;
            }
        }

        private void expand(int depth, Scope local, List<Object> keys, List<Object> values) {
            if (depth == clauses.size()) {
                keys.add(element.evaluate(local));
                if (value != null) {
                    values.add(value.evaluate(local));
                }
                return;
            }
            ForClause clause = clauses.get(depth);
            Iterator<Object> iterator = PyOps.iterate(clause.iterable().evaluate(local)).iterator();
            while (iterator.hasNext()) {
                clause.target().bind(local, iterator.next());
                boolean accepted = true;
                for (Expr condition : clause.conditions()) {
                    if (!PyOps.truthy(condition.evaluate(local))) {
                        accepted = false;
                        break;
                    }
                }
                if (accepted) {
                    expand(depth + 1, local, keys, values);
                }
            }
        }
    }

    record ListDisplay(List<Expr> elements) implements Expr {
        public ExprKind kind() {
            return ExprKind.LIST;
        }

        public List<Expr> children() {
            return elements;
        }

        public Object evaluate(Scope scope) {
            return collect(elements, scope);
        }
    }

    /**
     * 元组以不可变列表表示
     */
    record TupleDisplay(List<Expr> elements) implements Expr {
        public ExprKind kind() {
            return ExprKind.TUPLE;
        }

        public List<Expr> children() {
            return elements;
        }

        public Object evaluate(Scope scope) {
            return Collections.unmodifiableList(collect(elements, scope));
        }
    }

    record SetDisplay(List<Expr> elements) implements Expr {
        public ExprKind kind() {
            return ExprKind.SET;
        }

        public List<Expr> children() {
            return elements;
        }

        public Object evaluate(Scope scope) {
            return new LinkedHashSet<>(collect(elements, scope));
        }
    }

    /**
     * 字典字面量；键为 null 的项表示 {@code **mapping} 展开
     */
    record DictDisplay(List<Expr> keys, List<Expr> values) implements Expr {
        public ExprKind kind() {
            return ExprKind.DICT;
        }

        public List<Expr> children() {
            List<Expr> children = new ArrayList<>();
            for (Expr key : keys) {
                if (key != null) {
                    children.add(key);
                }
            }
            children.addAll(values);
            return children;
        }

        public Object evaluate(Scope scope) {
            Map<Object, Object> map = new LinkedHashMap<>();
            for (int i = 0; i < keys.size(); i++) {
                Object value = values.get(i).evaluate(scope);
                if (keys.get(i) == null) {
                    if (!(value instanceof Map)) {
                        throw new ExpressionEvaluationException("TypeError: '" + PyOps.typeName(value) + "' object is not a mapping");
                    }
                    map.putAll((Map<?, ?>) value);
                } else {
                    map.put(keys.get(i).evaluate(scope), value);
                }
            }
            return map;
        }
    }

    /**
     * 赋值；只为让沙箱给出明确的拒绝原因而存在
     */
    record Assignment(Expr target, Expr value) implements Expr {
        public ExprKind kind() {
            return ExprKind.ASSIGNMENT;
        }

        public List<Expr> children() {
            return List.of(target, value);
        }

        public Object evaluate(Scope scope) {
            throw new ExpressionEvaluationException("assignment is not allowed in expressions");
        }
    }

    record NamedExpression(String name, Expr value) implements Expr {
        public ExprKind kind() {
            return ExprKind.NAMED_EXPRESSION;
        }

        public List<Expr> children() {
            return List.of(value);
        }

        public Object evaluate(Scope scope) {
            throw new ExpressionEvaluationException("assignment is not allowed in expressions");
        }
    }

    private static List<Object> collect(List<Expr> elements, Scope scope) {
        List<Object> result = new ArrayList<>();
        for (Expr element : elements) {
            if (element instanceof Starred) {
                for (Object item : PyOps.iterate(((Starred) element).value().evaluate(scope))) {
                    result.add(item);
                }
            } else {
                result.add(element.evaluate(scope));
            }
        }
        return result;
    }
}
