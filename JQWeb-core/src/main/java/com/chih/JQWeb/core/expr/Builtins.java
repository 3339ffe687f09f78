package com.chih.JQWeb.core.expr;

import com.chih.JQWeb.core.exception.ExpressionEvaluationException;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

/**
 * 表达式中可直接使用的内置函数与类型
 *
 * @author lizhiyuan
 * @since 2026/10/02
 */
public final class Builtins {

    private static final Map<String, Object> BUILTINS = new HashMap<>();

    /**
     * 内置类型：可调用（构造/转换），也可作为 {@code isinstance} 的第二个参数
     */
    public static final class TypeBuiltin implements PyCallable {

        private final String name;
        private final Predicate<Object> instanceCheck;
        private final PyCallable constructor;

        TypeBuiltin(String name, Predicate<Object> instanceCheck, PyCallable constructor) {
            this.name = name;
            this.instanceCheck = instanceCheck;
            this.constructor = constructor;
        }

        public boolean isInstance(Object value) {
            return instanceCheck.test(PyOps.normalize(value));
        }

        @Override
        public Object call(List<Object> args, Map<String, Object> kwargs) {
            return constructor.call(args, kwargs);
        }

        @Override
        public String toString() {
            return "<class '" + name + "'>";
        }
    }

    static {
        type("str", v -> v instanceof CharSequence, (args, kwargs) -> args.isEmpty() ? "" : PyOps.str(args.get(0)));
        type("unicode", v -> v instanceof CharSequence, (args, kwargs) -> args.isEmpty() ? "" : PyOps.str(args.get(0)));
        type("bytes", v -> v instanceof byte[], (args, kwargs) -> {
            throw new ExpressionEvaluationException("TypeError: bytes are not supported in templates");
        });
        type("bool", v -> v instanceof Boolean, (args, kwargs) -> !args.isEmpty() && PyOps.truthy(args.get(0)));
        type("int", v -> v instanceof Boolean || PyOps.isIntegral(v), Builtins::toInt);
        type("float", v -> v instanceof Double || v instanceof Float, Builtins::toFloat);
        type("list", v -> v instanceof List, (args, kwargs) -> args.isEmpty() ? new ArrayList<>() : PyOps.toList(args.get(0)));
        type("tuple", v -> v instanceof List, (args, kwargs) ->
                Collections.unmodifiableList(args.isEmpty() ? new ArrayList<>() : PyOps.toList(args.get(0))));
        type("set", v -> v instanceof Set, (args, kwargs) ->
                args.isEmpty() ? new LinkedHashSet<>() : new LinkedHashSet<>(PyOps.toList(args.get(0))));
        type("dict", v -> v instanceof Map, (args, kwargs) -> {
            Map<Object, Object> result = args.isEmpty() ? new LinkedHashMap<>() : toDict(args.get(0));
            result.putAll(kwargs);
            return result;
        });
        type("Exception", v -> v instanceof Throwable, (args, kwargs) ->
                new ExpressionEvaluationException(args.isEmpty() ? "" : PyOps.str(args.get(0))));

        function("len", (args, kwargs) -> (long) PyOps.length(one(args, "len")));
        function("abs", (args, kwargs) -> {
            Object value = one(args, "abs");
            return PyOps.isIntegral(value) || value instanceof Boolean ? (Object) Math.abs(PyOps.toLong(value)) : (Object) Math.abs(PyOps.toDouble(value));
        });
        function("repr", (args, kwargs) -> PyOps.repr(one(args, "repr")));
        function("ord", (args, kwargs) -> {
            String text = PyOps.str(one(args, "ord"));
            if (text.codePointCount(0, text.length()) != 1) {
                throw new ExpressionEvaluationException("TypeError: ord() expected a character");
            }
            return (long) text.codePointAt(0);
        });
        function("chr", (args, kwargs) -> new String(Character.toChars((int) PyOps.toLong(one(args, "chr")))));
        function("min", (args, kwargs) -> extreme(args, kwargs, -1));
        function("max", (args, kwargs) -> extreme(args, kwargs, 1));
        function("sum", (args, kwargs) -> {
            Object total = args.size() > 1 ? args.get(1) : kwargs.getOrDefault("start", 0L);
            for (Object item : PyOps.iterate(PyMethods.arg(args, 0, null))) {
                total = PyOps.binary("+", total, item);
            }
            return total;
        });
        function("round", Builtins::round);
        function("divmod", (args, kwargs) -> pair(
                PyOps.binary("//", args.get(0), args.get(1)),
                PyOps.binary("%", args.get(0), args.get(1))));
        function("sorted", Builtins::sorted);
        function("enumerate", (args, kwargs) -> {
            long index = PyOps.toLong(args.size() > 1 ? args.get(1) : kwargs.getOrDefault("start", 0L));
            List<Object> result = new ArrayList<>();
            for (Object item : PyOps.iterate(PyMethods.arg(args, 0, null))) {
                result.add(pair(index++, item));
            }
            return result;
        });
        function("range", (args, kwargs) -> {
            if (args.isEmpty() || args.size() > 3) {
                throw new ExpressionEvaluationException("TypeError: range expected 1 to 3 arguments");
            }
            if (args.size() == 1) {
                return new PyOps.Range(0, PyOps.toLong(args.get(0)), 1);
            }
            return new PyOps.Range(PyOps.toLong(args.get(0)), PyOps.toLong(args.get(1)),
                    args.size() == 3 ? PyOps.toLong(args.get(2)) : 1);
        });
        BUILTINS.put("xrange", BUILTINS.get("range"));
        function("zip", (args, kwargs) -> {
            List<List<Object>> lists = new ArrayList<>();
            int size = Integer.MAX_VALUE;
            for (Object arg : args) {
                List<Object> items = PyOps.toList(arg);
                lists.add(items);
                size = Math.min(size, items.size());
            }
            List<Object> result = new ArrayList<>();
            for (int i = 0; !lists.isEmpty() && i < size; i++) {
                List<Object> row = new ArrayList<>();
                for (List<Object> items : lists) {
                    row.add(items.get(i));
                }
                result.add(Collections.unmodifiableList(row));
            }
            return result;
        });
        function("map", (args, kwargs) -> {
            Object function = args.get(0);
            List<Object> result = new ArrayList<>();
            for (Object item : PyOps.iterate(args.get(1))) {
                result.add(PyOps.call(function, new ArrayList<>(Collections.singletonList(item)), Map.of()));
            }
            return result;
        });
        function("filter", (args, kwargs) -> {
            Object function = args.get(0);
            List<Object> result = new ArrayList<>();
            for (Object item : PyOps.iterate(args.get(1))) {
                Object verdict = function == null ? item : PyOps.call(function, new ArrayList<>(Collections.singletonList(item)), Map.of());
                if (PyOps.truthy(verdict)) {
                    result.add(item);
                }
            }
            return result;
        });
        function("reduce", (args, kwargs) -> {
            Object function = args.get(0);
            List<Object> items = PyOps.toList(args.get(1));
            int start = 0;
            Object accumulator;
            if (args.size() > 2) {
                accumulator = args.get(2);
            } else if (items.isEmpty()) {
                throw new ExpressionEvaluationException("TypeError: reduce() of empty iterable with no initial value");
            } else {
                accumulator = items.get(0);
                start = 1;
            }
            for (int i = start; i < items.size(); i++) {
                accumulator = PyOps.call(function, pair(accumulator, items.get(i)), Map.of());
            }
            return accumulator;
        });
        function("any", (args, kwargs) -> {
            for (Object item : PyOps.iterate(one(args, "any"))) {
                if (PyOps.truthy(item)) {
                    return true;
                }
            }
            return false;
        });
        function("all", (args, kwargs) -> {
            for (Object item : PyOps.iterate(one(args, "all"))) {
                if (!PyOps.truthy(item)) {
                    return false;
                }
            }
            return true;
        });
        function("isinstance", (args, kwargs) -> {
            Object types = args.get(1);
            if (types instanceof List) {
                for (Object type : (List<?>) types) {
                    if (type instanceof TypeBuiltin && ((TypeBuiltin) type).isInstance(args.get(0))) {
                        return true;
                    }
                }
                return false;
            }
            if (!(types instanceof TypeBuiltin)) {
                throw new ExpressionEvaluationException("TypeError: isinstance() arg 2 must be a type or tuple of types");
            }
            return ((TypeBuiltin) types).isInstance(args.get(0));
        });
    }

    private Builtins() {
    }

    public static boolean isBuiltin(String name) {
        return BUILTINS.containsKey(name);
    }

    public static Object get(String name) {
        if (!BUILTINS.containsKey(name)) {
            throw new ExpressionEvaluationException("NameError: name '" + name + "' is not defined");
        }
        return BUILTINS.get(name);
    }

    public static Set<String> names() {
        return Collections.unmodifiableSet(BUILTINS.keySet());
    }

    /**
     * 字典、键值对列表或单个键值对转为有序字典
     */
    public static Map<Object, Object> toDict(Object value) {
        Object source = PyOps.normalize(value);
        Map<Object, Object> result = new LinkedHashMap<>();
        if (source instanceof Map) {
            result.putAll((Map<?, ?>) source);
            return result;
        }
        for (Object item : PyOps.iterate(source)) {
            List<Object> pair = PyOps.toList(item);
            if (pair.size() != 2) {
                throw new ExpressionEvaluationException("ValueError: dictionary update sequence element has length "
                        + pair.size() + "; 2 is required");
            }
            result.put(pair.get(0), pair.get(1));
        }
        return result;
    }

    private static void type(String name, Predicate<Object> instanceCheck, PyCallable constructor) {
        BUILTINS.put(name, new TypeBuiltin(name, instanceCheck, constructor));
    }

    private static void function(String name, PyCallable function) {
        BUILTINS.put(name, function);
    }

    private static Object one(List<Object> args, String name) {
        if (args.size() != 1) {
            throw new ExpressionEvaluationException("TypeError: " + name + "() takes exactly one argument (" + args.size() + " given)");
        }
        return args.get(0);
    }

    private static List<Object> pair(Object first, Object second) {
        List<Object> pair = new ArrayList<>(2);
        pair.add(first);
        pair.add(second);
        return Collections.unmodifiableList(pair);
    }

    private static Object toInt(List<Object> args, Map<String, Object> kwargs) {
        if (args.isEmpty()) {
            return 0L;
        }
        Object value = PyOps.normalize(args.get(0));
        if (value instanceof CharSequence) {
            int base = (int) PyOps.toLong(args.size() > 1 ? args.get(1) : kwargs.getOrDefault("base", 10L));
            String text = value.toString().strip().replace("_", "");
            try {
                return Long.parseLong(text, base);
            } catch (NumberFormatException e) {
                throw new ExpressionEvaluationException("ValueError: invalid literal for int() with base " + base + ": "
                        + PyOps.repr(value));
            }
        }
        if (value instanceof Double || value instanceof Float || value instanceof BigDecimal) {
            return (long) PyOps.toDouble(value);
        }
        return PyOps.toLong(value);
    }

    private static Object toFloat(List<Object> args, Map<String, Object> kwargs) {
        if (args.isEmpty()) {
            return 0.0;
        }
        Object value = PyOps.normalize(args.get(0));
        if (value instanceof CharSequence) {
            String text = value.toString().strip().toLowerCase();
            switch (text) {
                case "inf":
                case "+inf":
                case "infinity":
                    return Double.POSITIVE_INFINITY;
                case "-inf":
                case "-infinity":
                    return Double.NEGATIVE_INFINITY;
                case "nan":
                    return Double.NaN;
                default:
                    try {
                        return Double.parseDouble(text);
                    } catch (NumberFormatException e) {
                        throw new ExpressionEvaluationException("ValueError: could not convert string to float: " + PyOps.repr(value));
                    }
            }
        }
        return PyOps.toDouble(value);
    }

    private static Object round(List<Object> args, Map<String, Object> kwargs) {
        Object value = PyOps.normalize(PyMethods.arg(args, 0, null));
        Object digits = args.size() > 1 ? args.get(1) : kwargs.get("ndigits");
        if (PyOps.isIntegral(value) || value instanceof Boolean) {
            return digits == null ? PyOps.toLong(value) : value;
        }
        double number = PyOps.toDouble(value);
        if (digits == null) {
            return (long) Math.rint(number);
        }
        if (Double.isNaN(number) || Double.isInfinite(number)) {
            return number;
        }
        return new BigDecimal(number).setScale((int) PyOps.toLong(digits), RoundingMode.HALF_EVEN).doubleValue();
    }

    private static Object extreme(List<Object> args, Map<String, Object> kwargs, int direction) {
        List<Object> items = args.size() == 1 ? PyOps.toList(args.get(0)) : args;
        if (items.isEmpty()) {
            if (kwargs.containsKey("default")) {
                return kwargs.get("default");
            }
            throw new ExpressionEvaluationException("ValueError: " + (direction < 0 ? "min" : "max") + "() arg is an empty sequence");
        }
        Object key = kwargs.get("key");
        Object best = items.get(0);
        Object bestKey = key == null ? best : PyOps.call(key, new ArrayList<>(Collections.singletonList(best)), Map.of());
        for (int i = 1; i < items.size(); i++) {
            Object candidate = items.get(i);
            Object candidateKey = key == null ? candidate : PyOps.call(key, new ArrayList<>(Collections.singletonList(candidate)), Map.of());
            if (PyOps.compareValues(candidateKey, bestKey, direction < 0 ? "<" : ">") * direction > 0) {
                best = candidate;
                bestKey = candidateKey;
            }
        }
        return best;
    }

    private static Object sorted(List<Object> args, Map<String, Object> kwargs) {
        List<Object> items = PyOps.toList(PyMethods.arg(args, 0, null));
        Object key = kwargs.get("key");
        Comparator<Object> comparator = (a, b) -> {
            Object left = key == null ? a : PyOps.call(key, new ArrayList<>(Collections.singletonList(a)), Map.of());
            Object right = key == null ? b : PyOps.call(key, new ArrayList<>(Collections.singletonList(b)), Map.of());
            return PyOps.compareValues(left, right, "<");
        };
        if (PyOps.truthy(kwargs.get("reverse"))) {
            comparator = comparator.reversed();
        }
        items.sort(comparator);
        return items;
    }
}
