package com.chih.JQWeb.core.expr;

import com.chih.JQWeb.core.exception.ExpressionEvaluationException;
import com.chih.JQWeb.core.exception.MissingValueException;
import com.chih.JQWeb.core.render.HtmlSafe;
import com.chih.JQWeb.core.render.Markup;

import java.lang.reflect.Array;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.AbstractList;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * 表达式值模型的运算语义（Python 风格）
 * <p>
 * 值模型：null、Boolean、Long/Double（其余数字类型按需归一）、String、{@link Markup}、
 * List（元组为不可变 List）、Map、Set、{@link PyCallable}、Java Bean / record（只读）。
 *
 * @author lizhiyuan
 * @since 2026/10/02
 */
public final class PyOps {

    private static final Set<String> FORBIDDEN_GETTERS = Set.of("getClass", "class", "getClassLoader", "hashCode", "wait", "notify", "notifyAll");

    private PyOps() {
    }

    /**
     * 切片值 {@code a[lower:upper:step]}
     */
    public record SliceValue(Object lower, Object upper, Object step) {
    }

    // === 类型与转换 ===

    public static Object normalize(Object value) {
        if (value instanceof HtmlSafe && !(value instanceof Markup)) {
            return Markup.of(((HtmlSafe) value).toHtml());
        }
        return value;
    }

    public static String typeName(Object value) {
        if (value == null) {
            return "NoneType";
        }
        if (value instanceof Boolean) {
            return "bool";
        }
        if (isIntegral(value)) {
            return "int";
        }
        if (value instanceof Number) {
            return "float";
        }
        if (value instanceof Markup) {
            return "Markup";
        }
        if (value instanceof CharSequence) {
            return "str";
        }
        if (value instanceof List) {
            return "list";
        }
        if (value instanceof Map) {
            return "dict";
        }
        if (value instanceof Set) {
            return "set";
        }
        if (value instanceof PyCallable) {
            return "function";
        }
        return value.getClass().getSimpleName();
    }

    public static boolean isIntegral(Object value) {
        return value instanceof Long || value instanceof Integer || value instanceof Short
                || value instanceof Byte || value instanceof BigInteger;
    }

    public static boolean isNumeric(Object value) {
        return value instanceof Number || value instanceof Boolean;
    }

    private static boolean isIntegralLike(Object value) {
        return isIntegral(value) || value instanceof Boolean;
    }

    public static long toLong(Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value ? 1L : 0L;
        }
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        throw typeError("an integer is required (got type " + typeName(value) + ")");
    }

    public static double toDouble(Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value ? 1.0 : 0.0;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        throw typeError("must be real number, not " + typeName(value));
    }

    private static Object number(double value) {
        return value;
    }

    public static boolean truthy(Object value) {
        value = normalize(value);
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (isIntegral(value)) {
            return toLong(value) != 0;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue() != 0.0;
        }
        if (value instanceof CharSequence) {
            return ((CharSequence) value).length() > 0;
        }
        if (value instanceof Collection) {
            return !((Collection<?>) value).isEmpty();
        }
        if (value instanceof Map) {
            return !((Map<?, ?>) value).isEmpty();
        }
        if (value.getClass().isArray()) {
            return Array.getLength(value) > 0;
        }
        return true;
    }

    /**
     * Python {@code str()}
     */
    public static String str(Object value) {
        if (value == null) {
            return "None";
        }
        if (value instanceof Boolean) {
            return (Boolean) value ? "True" : "False";
        }
        if (value instanceof String) {
            return (String) value;
        }
        if (value instanceof HtmlSafe) {
            return ((HtmlSafe) value).toHtml();
        }
        if (value instanceof CharSequence) {
            return value.toString();
        }
        if (value instanceof Double || value instanceof Float) {
            return floatRepr(((Number) value).doubleValue());
        }
        if (value instanceof BigDecimal) {
            return ((BigDecimal) value).toPlainString();
        }
        if (value instanceof Number) {
            return value.toString();
        }
        if (value instanceof List) {
            return ((List<?>) value).stream().map(PyOps::repr).collect(Collectors.joining(", ", "[", "]"));
        }
        if (value instanceof Set) {
            Set<?> set = (Set<?>) value;
            return set.isEmpty() ? "set()" : set.stream().map(PyOps::repr).collect(Collectors.joining(", ", "{", "}"));
        }
        if (value instanceof Map) {
            return ((Map<?, ?>) value).entrySet().stream()
                    .map(e -> repr(e.getKey()) + ": " + repr(e.getValue()))
                    .collect(Collectors.joining(", ", "{", "}"));
        }
        if (value instanceof PyCallable) {
            return "<function>";
        }
        return value.toString();
    }

    /**
     * Python {@code repr()}
     */
    public static String repr(Object value) {
        if (value instanceof Markup) {
            return "Markup(" + quote(value.toString()) + ")";
        }
        if (value instanceof CharSequence && !(value instanceof HtmlSafe)) {
            return quote(value.toString());
        }
        return str(value);
    }

    private static String quote(String text) {
        char quote = text.indexOf('\'') >= 0 && text.indexOf('"') < 0 ? '"' : '\'';
        StringBuilder out = new StringBuilder().append(quote);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\\' || c == quote) {
                out.append('\\').append(c);
            } else if (c == '\n') {
                out.append("\\n");
            } else if (c == '\t') {
                out.append("\\t");
            } else if (c == '\r') {
                out.append("\\r");
            } else {
                out.append(c);
            }
        }
        return out.append(quote).toString();
    }

    /**
     * 浮点数的最短十进制表示，规则同 Python（指数小于 -4 或不小于 16 时用科学计数法）
     */
    public static String floatRepr(double d) {
        if (Double.isNaN(d)) {
            return "nan";
        }
        if (Double.isInfinite(d)) {
            return d > 0 ? "inf" : "-inf";
        }
        if (d == 0.0) {
            return 1.0 / d < 0 ? "-0.0" : "0.0";
        }
        BigDecimal decimal = new BigDecimal(Double.toString(d)).stripTrailingZeros();
        double abs = Math.abs(d);
        if (abs >= 1e-4 && abs < 1e16) {
            String plain = decimal.toPlainString();
            return plain.contains(".") ? plain : plain + ".0";
        }
        String digits = decimal.unscaledValue().abs().toString();
        int exponent = digits.length() - 1 - decimal.scale();
        String mantissa = digits.length() == 1 ? digits : digits.charAt(0) + "." + digits.substring(1);
        int absExponent = Math.abs(exponent);
        return (d < 0 ? "-" : "") + mantissa + "e" + (exponent < 0 ? "-" : "+") + (absExponent < 10 ? "0" : "") + absExponent;
    }

    /**
     * 模板输出用的文本：null 与 false 为空串，安全值取其标记文本
     */
    public static String toText(Object value) {
        if (value == null || Boolean.FALSE.equals(value)) {
            return "";
        }
        return str(value);
    }

    // === 运算符 ===

    public static Object unary(String operator, Object operand) {
        switch (operator) {
            case "not":
                return !truthy(operand);
            case "-":
                if (isIntegralLike(operand)) {
                    return Math.negateExact(toLong(operand));
                }
                return number(-toDouble(operand));
            case "+":
                if (isIntegralLike(operand)) {
                    return toLong(operand);
                }
                return number(toDouble(operand));
            case "~":
                return ~toLong(operand);
            default:
                throw typeError("unsupported unary operator " + operator);
        }
    }

    public static Object binary(String operator, Object left, Object right) {
        Object a = normalize(left);
        Object b = normalize(right);
        switch (operator) {
            case "+":
                return add(a, b);
            case "-":
                if (a instanceof Set && b instanceof Set) {
                    Set<Object> result = new LinkedHashSet<>((Set<?>) a);
                    result.removeAll((Set<?>) b);
                    return result;
                }
                return arithmetic(operator, a, b);
            case "*":
                return multiply(a, b);
            case "/":
                requireNumbers(operator, a, b);
                if (toDouble(b) == 0.0) {
                    throw new ExpressionEvaluationException("ZeroDivisionError: division by zero");
                }
                return number(toDouble(a) / toDouble(b));
            case "//":
                requireNumbers(operator, a, b);
                if (toDouble(b) == 0.0) {
                    throw new ExpressionEvaluationException("ZeroDivisionError: integer division or modulo by zero");
                }
                if (isIntegralLike(a) && isIntegralLike(b)) {
                    return Math.floorDiv(toLong(a), toLong(b));
                }
                return number(Math.floor(toDouble(a) / toDouble(b)));
            case "%":
                return modulo(a, b);
            case "**":
                return power(a, b);
            case "&":
            case "|":
            case "^":
                return bitwise(operator, a, b);
            case "<<":
                return toLong(a) << toLong(b);
            case ">>":
                return toLong(a) >> toLong(b);
            default:
                throw unsupported(operator, a, b);
        }
    }

    private static Object add(Object a, Object b) {
        if (isNumeric(a) && isNumeric(b)) {
            return arithmetic("+", a, b);
        }
        if (a instanceof Markup && b instanceof CharSequence) {
            return ((Markup) a).concat(b);
        }
        if (b instanceof Markup && a instanceof CharSequence) {
            return Markup.escape(a).concat(b);
        }
        if (a instanceof CharSequence && b instanceof CharSequence) {
            return a.toString() + b;
        }
        if (a instanceof List && b instanceof List) {
            List<Object> result = new ArrayList<>((List<?>) a);
            result.addAll((List<?>) b);
            return result;
        }
        throw unsupported("+", a, b);
    }

    private static Object multiply(Object a, Object b) {
        if (isNumeric(a) && isNumeric(b)) {
            return arithmetic("*", a, b);
        }
        if (isIntegralLike(a) && (b instanceof CharSequence || b instanceof List)) {
            return multiply(b, a);
        }
        if (a instanceof CharSequence && isIntegralLike(b)) {
            String repeated = a.toString().repeat((int) Math.max(0, toLong(b)));
            return a instanceof Markup ? Markup.of(repeated) : repeated;
        }
        if (a instanceof List && isIntegralLike(b)) {
            List<Object> result = new ArrayList<>();
            for (long i = 0; i < toLong(b); i++) {
                result.addAll((List<?>) a);
            }
            return result;
        }
        throw unsupported("*", a, b);
    }

    private static Object modulo(Object a, Object b) {
        if (a instanceof Markup) {
            return Markup.of(PyFormat.percent(a.toString(), escapeArguments(b)));
        }
        if (a instanceof CharSequence) {
            return PyFormat.percent(a.toString(), b);
        }
        requireNumbers("%", a, b);
        if (toDouble(b) == 0.0) {
            throw new ExpressionEvaluationException("ZeroDivisionError: integer division or modulo by zero");
        }
        if (isIntegralLike(a) && isIntegralLike(b)) {
            return Math.floorMod(toLong(a), toLong(b));
        }
        double x = toDouble(a);
        double y = toDouble(b);
        return number(x - y * Math.floor(x / y));
    }

    private static Object escapeArguments(Object args) {
        if (args instanceof List) {
            List<Object> escaped = new ArrayList<>();
            for (Object item : (List<?>) args) {
                escaped.add(item instanceof CharSequence ? Markup.escape(item) : item);
            }
            return Collections.unmodifiableList(escaped);
        }
        if (args instanceof Map) {
            return args;
        }
        return args instanceof CharSequence ? Markup.escape(args) : args;
    }

    private static Object power(Object a, Object b) {
        requireNumbers("**", a, b);
        if (isIntegralLike(a) && isIntegralLike(b) && toLong(b) >= 0) {
            long base = toLong(a);
            long exponent = toLong(b);
            long result = 1;
            try {
                for (long i = 0; i < exponent; i++) {
                    result = Math.multiplyExact(result, base);
                }
                return result;
            } catch (ArithmeticException e) {
                return number(Math.pow(base, exponent));
            }
        }
        return number(Math.pow(toDouble(a), toDouble(b)));
    }

    private static Object bitwise(String operator, Object a, Object b) {
        if (a instanceof Boolean && b instanceof Boolean) {
            boolean x = (Boolean) a;
            boolean y = (Boolean) b;
            return operator.equals("&") ? x & y : operator.equals("|") ? x | y : x ^ y;
        }
        if (a instanceof Set && b instanceof Set) {
            Set<Object> result = new LinkedHashSet<>((Set<?>) a);
            if (operator.equals("&")) {
                result.retainAll((Set<?>) b);
            } else if (operator.equals("|")) {
                result.addAll((Set<?>) b);
            } else {
                result.addAll((Set<?>) b);
                Set<Object> common = new LinkedHashSet<>((Set<?>) a);
                common.retainAll((Set<?>) b);
                result.removeAll(common);
            }
            return result;
        }
        if (isIntegralLike(a) && isIntegralLike(b)) {
            long x = toLong(a);
            long y = toLong(b);
            return operator.equals("&") ? x & y : operator.equals("|") ? x | y : x ^ y;
        }
        throw unsupported(operator, a, b);
    }

    private static Object arithmetic(String operator, Object a, Object b) {
        requireNumbers(operator, a, b);
        if (isIntegralLike(a) && isIntegralLike(b)) {
            long x = toLong(a);
            long y = toLong(b);
            try {
                switch (operator) {
                    case "+":
                        return Math.addExact(x, y);
                    case "-":
                        return Math.subtractExact(x, y);
                    default:
                        return Math.multiplyExact(x, y);
                }
            } catch (ArithmeticException overflow) {
                // 超出 long 范围时退化为浮点
                return arithmetic(operator, (double) x, (double) y);
            }
        }
        double x = toDouble(a);
        double y = toDouble(b);
        switch (operator) {
            case "+":
                return number(x + y);
            case "-":
                return number(x - y);
            default:
                return number(x * y);
        }
    }

    private static void requireNumbers(String operator, Object a, Object b) {
        if (!isNumeric(a) || !isNumeric(b)) {
            throw unsupported(operator, a, b);
        }
    }

    // === 比较 ===

    public static boolean compare(String operator, Object left, Object right) {
        Object a = normalize(left);
        Object b = normalize(right);
        switch (operator) {
            case "==":
                return pyEquals(a, b);
            case "!=":
                return !pyEquals(a, b);
            case "<":
                return compareValues(a, b, operator) < 0;
            case "<=":
                return compareValues(a, b, operator) <= 0;
            case ">":
                return compareValues(a, b, operator) > 0;
            case ">=":
                return compareValues(a, b, operator) >= 0;
            case "in":
                return contains(b, a);
            case "not in":
                return !contains(b, a);
            case "is":
                return identical(left, right);
            case "is not":
                return !identical(left, right);
            default:
                throw typeError("unsupported comparison " + operator);
        }
    }

    private static boolean identical(Object a, Object b) {
        if (a == b) {
            return true;
        }
        return a instanceof Boolean && a.equals(b);
    }

    public static boolean pyEquals(Object left, Object right) {
        Object a = normalize(left);
        Object b = normalize(right);
        if (a == b) {
            return true;
        }
        if (a == null || b == null) {
            return false;
        }
        if (isNumeric(a) && isNumeric(b)) {
            if (isIntegralLike(a) && isIntegralLike(b)) {
                return toLong(a) == toLong(b);
            }
            return toDouble(a) == toDouble(b);
        }
        if (a instanceof CharSequence && b instanceof CharSequence) {
            return a.toString().equals(b.toString());
        }
        if (a instanceof List && b instanceof List) {
            List<?> x = (List<?>) a;
            List<?> y = (List<?>) b;
            if (x.size() != y.size()) {
                return false;
            }
            for (int i = 0; i < x.size(); i++) {
                if (!pyEquals(x.get(i), y.get(i))) {
                    return false;
                }
            }
            return true;
        }
        if (a instanceof Map && b instanceof Map) {
            Map<?, ?> x = (Map<?, ?>) a;
            Map<?, ?> y = (Map<?, ?>) b;
            if (x.size() != y.size()) {
                return false;
            }
            for (Map.Entry<?, ?> entry : x.entrySet()) {
                Object other = mapGet(y, entry.getKey());
                if (other == PyObject.MISSING || !pyEquals(entry.getValue(), other)) {
                    return false;
                }
            }
            return true;
        }
        return a.equals(b);
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    public static int compareValues(Object left, Object right, String operator) {
        Object a = normalize(left);
        Object b = normalize(right);
        if (isNumeric(a) && isNumeric(b)) {
            if (isIntegralLike(a) && isIntegralLike(b)) {
                return Long.compare(toLong(a), toLong(b));
            }
            return Double.compare(toDouble(a), toDouble(b));
        }
        if (a instanceof CharSequence && b instanceof CharSequence) {
            return a.toString().compareTo(b.toString());
        }
        if (a instanceof List && b instanceof List) {
            List<?> x = (List<?>) a;
            List<?> y = (List<?>) b;
            for (int i = 0; i < Math.min(x.size(), y.size()); i++) {
                if (!pyEquals(x.get(i), y.get(i))) {
                    return compareValues(x.get(i), y.get(i), operator);
                }
            }
            return Integer.compare(x.size(), y.size());
        }
        if (a != null && b != null && a.getClass() == b.getClass() && a instanceof Comparable) {
            return ((Comparable) a).compareTo(b);
        }
        throw typeError("'" + operator + "' not supported between instances of '" + typeName(a) + "' and '" + typeName(b) + "'");
    }

    public static boolean contains(Object container, Object item) {
        container = normalize(container);
        if (container == null) {
            throw typeError("argument of type 'NoneType' is not iterable");
        }
        if (container instanceof CharSequence) {
            Object needle = normalize(item);
            if (!(needle instanceof CharSequence)) {
                throw typeError("'in <string>' requires string as left operand, not " + typeName(needle));
            }
            return container.toString().contains(needle.toString());
        }
        if (container instanceof Map) {
            return mapGet((Map<?, ?>) container, item) != PyObject.MISSING;
        }
        for (Object element : iterate(container)) {
            if (pyEquals(element, item)) {
                return true;
            }
        }
        return false;
    }

    // === 迭代、长度、下标 ===

    @SuppressWarnings("unchecked")
    public static Iterable<Object> iterate(Object value) {
        value = normalize(value);
        if (value == null) {
            throw typeError("'NoneType' object is not iterable");
        }
        if (value instanceof Map) {
            return (Iterable<Object>) (Iterable<?>) ((Map<?, ?>) value).keySet();
        }
        if (value instanceof Iterable) {
            return (Iterable<Object>) value;
        }
        if (value instanceof CharSequence) {
            String text = value.toString();
            List<Object> chars = new ArrayList<>(text.length());
            for (int i = 0; i < text.length(); i++) {
                chars.add(String.valueOf(text.charAt(i)));
            }
            return chars;
        }
        if (value.getClass().isArray()) {
            int length = Array.getLength(value);
            List<Object> items = new ArrayList<>(length);
            for (int i = 0; i < length; i++) {
                items.add(Array.get(value, i));
            }
            return items;
        }
        if (value instanceof Iterator) {
            Iterator<Object> iterator = (Iterator<Object>) value;
            return () -> iterator;
        }
        throw typeError("'" + typeName(value) + "' object is not iterable");
    }

    public static List<Object> toList(Object value) {
        List<Object> items = new ArrayList<>();
        for (Object item : iterate(value)) {
            items.add(item);
        }
        return items;
    }

    /**
     * @return 长度；不支持长度的值返回 -1
     */
    public static int sizeOf(Object value) {
        value = normalize(value);
        if (value instanceof CharSequence) {
            return ((CharSequence) value).length();
        }
        if (value instanceof Collection) {
            return ((Collection<?>) value).size();
        }
        if (value instanceof Map) {
            return ((Map<?, ?>) value).size();
        }
        if (value != null && value.getClass().isArray()) {
            return Array.getLength(value);
        }
        return -1;
    }

    public static int length(Object value) {
        int size = sizeOf(value);
        if (size < 0) {
            throw typeError("object of type '" + typeName(value) + "' has no len()");
        }
        return size;
    }

    /**
     * 字典取值，兼容 Integer/Long 键与 Markup/String 键
     *
     * @return 值；键不存在时返回 {@link PyObject#MISSING}
     */
    public static Object mapGet(Map<?, ?> map, Object key) {
        if (map.containsKey(key)) {
            return map.get(key);
        }
        Object alternative = null;
        if (key instanceof Long && (Long) key >= Integer.MIN_VALUE && (Long) key <= Integer.MAX_VALUE) {
            alternative = ((Long) key).intValue();
        } else if (key instanceof Integer) {
            alternative = ((Integer) key).longValue();
        } else if (key instanceof CharSequence && !(key instanceof String)) {
            alternative = key.toString();
        }
        if (alternative != null && map.containsKey(alternative)) {
            return map.get(alternative);
        }
        return PyObject.MISSING;
    }

    public static Object getItem(Object target, Object key) {
        Object value = normalize(target);
        if (value == null) {
            throw typeError("'NoneType' object is not subscriptable");
        }
        if (key instanceof SliceValue) {
            return slice(value, (SliceValue) key);
        }
        if (value instanceof Map) {
            Object found = mapGet((Map<?, ?>) value, normalize(key));
            if (found == PyObject.MISSING) {
                throw new MissingValueException(key);
            }
            return found;
        }
        if (value instanceof List) {
            List<?> list = (List<?>) value;
            return list.get(index(key, list.size()));
        }
        if (value instanceof CharSequence) {
            CharSequence text = (CharSequence) value;
            return String.valueOf(text.charAt(index(key, text.length())));
        }
        if (value.getClass().isArray()) {
            return Array.get(value, index(key, Array.getLength(value)));
        }
        throw typeError("'" + typeName(value) + "' object is not subscriptable");
    }

    private static int index(Object key, int size) {
        if (!isIntegralLike(key)) {
            throw typeError("indices must be integers, not " + typeName(key));
        }
        long index = toLong(key);
        if (index < 0) {
            index += size;
        }
        if (index < 0 || index >= size) {
            throw new ExpressionEvaluationException("IndexError: index out of range");
        }
        return (int) index;
    }

    private static Object slice(Object value, SliceValue slice) {
        List<Object> items;
        boolean text = value instanceof CharSequence;
        if (text || value instanceof List) {
            items = toList(value);
        } else {
            throw typeError("'" + typeName(value) + "' object is not subscriptable");
        }
        int size = items.size();
        long step = slice.step() == null ? 1 : toLong(slice.step());
        if (step == 0) {
            throw new ExpressionEvaluationException("ValueError: slice step cannot be zero");
        }
        long start;
        long stop;
        if (step > 0) {
            start = bound(slice.lower(), size, 0, 0, size);
            stop = bound(slice.upper(), size, size, 0, size);
        } else {
            start = bound(slice.lower(), size, size - 1, -1, size - 1);
            stop = bound(slice.upper(), size, -1, -1, size - 1);
        }
        List<Object> result = new ArrayList<>();
        for (long i = start; step > 0 ? i < stop : i > stop; i += step) {
            result.add(items.get((int) i));
        }
        if (text) {
            StringBuilder out = new StringBuilder();
            result.forEach(out::append);
            return value instanceof Markup ? Markup.of(out.toString()) : out.toString();
        }
        return result;
    }

    private static long bound(Object raw, int size, long fallback, long min, long max) {
        if (raw == null) {
            return fallback;
        }
        long index = toLong(raw);
        if (index < 0) {
            index += size;
        }
        return Math.max(min, Math.min(max, index));
    }

    // === 属性与调用 ===

    public static Object getAttribute(Object target, String name) {
        Object value = normalize(target);
        if (value == null) {
            throw new ExpressionEvaluationException("AttributeError: 'NoneType' object has no attribute '" + name + "'");
        }
        if (name.startsWith("_") || FORBIDDEN_GETTERS.contains(name)) {
            throw new ExpressionEvaluationException("AttributeError: access to '" + name + "' is forbidden");
        }
        if (value instanceof PyObject) {
            Object attribute = ((PyObject) value).getAttribute(name);
            if (attribute != PyObject.MISSING) {
                return attribute;
            }
        }
        Object method = PyMethods.lookup(value, name);
        if (method != null) {
            return method;
        }
        if (value instanceof Map) {
            Object found = mapGet((Map<?, ?>) value, name);
            if (found != PyObject.MISSING) {
                return found;
            }
        } else if (!(value instanceof CharSequence) && !(value instanceof Collection) && !isNumeric(value)) {
            Method getter = findGetter(value.getClass(), name);
            if (getter != null) {
                return invokeGetter(getter, value, name);
            }
        }
        throw new ExpressionEvaluationException("AttributeError: '" + typeName(value) + "' object has no attribute '" + name + "'");
    }

    private static Method findGetter(Class<?> type, String name) {
        String suffix = Character.toUpperCase(name.charAt(0)) + name.substring(1);
        String[] candidates = type.isRecord() ? new String[]{name} : new String[]{"get" + suffix, "is" + suffix};
        for (String candidate : candidates) {
            if (FORBIDDEN_GETTERS.contains(candidate)) {
                continue;
            }
            try {
                Method method = type.getMethod(candidate);
                if (!Modifier.isStatic(method.getModifiers()) && method.getReturnType() != void.class) {
                    return method;
                }
            } catch (NoSuchMethodException e) {
                // 尝试下一个候选名
            }
        }
        return null;
    }

    private static Object invokeGetter(Method getter, Object target, String name) {
        try {
            if (!Modifier.isPublic(getter.getDeclaringClass().getModifiers())) {
                getter.trySetAccessible();
            }
            return getter.invoke(target);
        } catch (IllegalAccessException e) {
            throw new ExpressionEvaluationException("AttributeError: attribute '" + name + "' is not accessible", e);
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new ExpressionEvaluationException("error reading attribute '" + name + "'", cause);
        }
    }

    @SuppressWarnings("unchecked")
    public static Object call(Object callee, List<Object> args, Map<String, Object> kwargs) {
        if (callee instanceof PyCallable) {
            return ((PyCallable) callee).call(args, kwargs);
        }
        if (kwargs.isEmpty()) {
            if (callee instanceof Function && args.size() == 1) {
                return ((Function<Object, Object>) callee).apply(args.get(0));
            }
            if (callee instanceof BiFunction && args.size() == 2) {
                return ((BiFunction<Object, Object, Object>) callee).apply(args.get(0), args.get(1));
            }
            if (callee instanceof Supplier && args.isEmpty()) {
                return ((Supplier<Object>) callee).get();
            }
        }
        throw typeError("'" + typeName(callee) + "' object is not callable");
    }

    /**
     * 惰性整数序列，供 {@code range()} 与 t-foreach 计数循环使用
     */
    public static final class Range extends AbstractList<Object> {

        private final long start;
        private final long step;
        private final int size;

        public Range(long start, long stop, long step) {
            if (step == 0) {
                throw new ExpressionEvaluationException("ValueError: range() arg 3 must not be zero");
            }
            this.start = start;
            this.step = step;
            long count = step > 0 ? (stop - start + step - 1) / step : (start - stop - step - 1) / -step;
            this.size = (int) Math.max(0, Math.min(Integer.MAX_VALUE, count));
        }

        @Override
        public Object get(int index) {
            if (index < 0 || index >= size) {
                throw new IndexOutOfBoundsException(index);
            }
            return start + step * index;
        }

        @Override
        public int size() {
            return size;
        }
    }

    // === 错误 ===

    static ExpressionEvaluationException typeError(String message) {
        return new ExpressionEvaluationException("TypeError: " + message);
    }

    private static ExpressionEvaluationException unsupported(String operator, Object a, Object b) {
        return typeError("unsupported operand type(s) for " + operator + ": '" + typeName(a) + "' and '" + typeName(b) + "'");
    }
}
