package com.chih.JQWeb.core.expr;

import com.chih.JQWeb.core.exception.ExpressionEvaluationException;
import com.chih.JQWeb.core.render.Markup;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * 字符串、列表、字典、集合上可调用的方法
 * <p>
 * 只开放只读方法与少量列表追加方法；返回的绑定方法为 {@link PyCallable}。
 */
final class PyMethods {

    private PyMethods() {
    }

    static PyCallable lookup(Object target, String name) {
        if (target instanceof Markup) {
            return stringMethod(target.toString(), name, true);
        }
        if (target instanceof CharSequence) {
            return stringMethod(target.toString(), name, false);
        }
        if (target instanceof Map) {
            return dictMethod((Map<?, ?>) target, name);
        }
        if (target instanceof List) {
            return listMethod((List<?>) target, name);
        }
        if (target instanceof Set) {
            return setMethod((Set<?>) target, name);
        }
        return null;
    }

    // === str ===

    private static PyCallable stringMethod(String text, String name, boolean markup) {
        switch (name) {
            case "upper":
                return wrap(markup, (args, kwargs) -> text.toUpperCase(Locale.ROOT));
            case "lower":
                return wrap(markup, (args, kwargs) -> text.toLowerCase(Locale.ROOT));
            case "strip":
                return wrap(markup, (args, kwargs) -> strip(text, arg(args, 0, null), true, true));
            case "lstrip":
                return wrap(markup, (args, kwargs) -> strip(text, arg(args, 0, null), true, false));
            case "rstrip":
                return wrap(markup, (args, kwargs) -> strip(text, arg(args, 0, null), false, true));
            case "title":
                return wrap(markup, (args, kwargs) -> title(text));
            case "capitalize":
                return wrap(markup, (args, kwargs) -> text.isEmpty() ? text
                        : text.substring(0, 1).toUpperCase(Locale.ROOT) + text.substring(1).toLowerCase(Locale.ROOT));
            case "replace":
                return wrap(markup, (args, kwargs) -> replace(text, args, markup));
            case "zfill":
                return wrap(markup, (args, kwargs) -> zfill(text, (int) PyOps.toLong(arg(args, 0, 0L))));
            case "center":
            case "ljust":
            case "rjust":
                return wrap(markup, (args, kwargs) -> {
                    int width = (int) PyOps.toLong(arg(args, 0, 0L));
                    String fill = PyOps.str(arg(args, 1, " "));
                    char align = name.equals("center") ? '^' : name.equals("ljust") ? '<' : '>';
                    return PyFormat.formatValue(text, fill + align + width);
                });
            case "format":
                return (args, kwargs) -> {
                    if (!markup) {
                        return PyFormat.format(text, args, kwargs);
                    }
                    List<Object> escaped = new ArrayList<>();
                    for (Object arg : args) {
                        escaped.add(Markup.escape(arg));
                    }
                    Map<String, Object> escapedKwargs = new LinkedHashMap<>();
                    kwargs.forEach((k, v) -> escapedKwargs.put(k, Markup.escape(v)));
                    return Markup.of(PyFormat.format(text, escaped, escapedKwargs));
                };
            case "join":
                return (args, kwargs) -> {
                    StringBuilder out = new StringBuilder();
                    boolean first = true;
                    for (Object item : PyOps.iterate(arg(args, 0, null))) {
                        if (!first) {
                            out.append(text);
                        }
                        first = false;
                        Object element = PyOps.normalize(item);
                        if (!(element instanceof CharSequence)) {
                            throw PyOps.typeError("sequence item: expected str instance, " + PyOps.typeName(element) + " found");
                        }
                        out.append(markup ? Markup.escape(element).toHtml() : element.toString());
                    }
                    return markup ? Markup.of(out.toString()) : out.toString();
                };
            case "split":
                return (args, kwargs) -> split(text, arg(args, 0, kwargs.get("sep")),
                        (int) PyOps.toLong(arg(args, 1, kwargs.getOrDefault("maxsplit", -1L))));
            case "splitlines":
                return (args, kwargs) -> {
                    List<Object> lines = new ArrayList<>();
                    if (!text.isEmpty()) {
                        Collections.addAll(lines, (Object[]) text.split("\\r?\\n|\\r", -1));
                        if (text.endsWith("\n") || text.endsWith("\r")) {
                            lines.remove(lines.size() - 1);
                        }
                    }
                    return lines;
                };
            case "startswith":
                return (args, kwargs) -> affix(text, arg(args, 0, null), true);
            case "endswith":
                return (args, kwargs) -> affix(text, arg(args, 0, null), false);
            case "find":
                return (args, kwargs) -> (long) text.indexOf(PyOps.str(arg(args, 0, null)));
            case "rfind":
                return (args, kwargs) -> (long) text.lastIndexOf(PyOps.str(arg(args, 0, null)));
            case "index":
                return (args, kwargs) -> {
                    int index = text.indexOf(PyOps.str(arg(args, 0, null)));
                    if (index < 0) {
                        throw new ExpressionEvaluationException("ValueError: substring not found");
                    }
                    return (long) index;
                };
            case "count":
                return (args, kwargs) -> {
                    String needle = PyOps.str(arg(args, 0, null));
                    if (needle.isEmpty()) {
                        return (long) text.length() + 1;
                    }
                    long count = 0;
                    for (int i = text.indexOf(needle); i >= 0; i = text.indexOf(needle, i + needle.length())) {
                        count++;
                    }
                    return count;
                };
            case "isdigit":
                return (args, kwargs) -> !text.isEmpty() && text.chars().allMatch(Character::isDigit);
            case "isalpha":
                return (args, kwargs) -> !text.isEmpty() && text.chars().allMatch(Character::isLetter);
            case "isalnum":
                return (args, kwargs) -> !text.isEmpty() && text.chars().allMatch(Character::isLetterOrDigit);
            case "isspace":
                return (args, kwargs) -> !text.isEmpty() && text.chars().allMatch(Character::isWhitespace);
            case "isupper":
                return (args, kwargs) -> !text.equals(text.toLowerCase(Locale.ROOT)) && text.equals(text.toUpperCase(Locale.ROOT));
            case "islower":
                return (args, kwargs) -> !text.equals(text.toUpperCase(Locale.ROOT)) && text.equals(text.toLowerCase(Locale.ROOT));
            default:
                return null;
        }
    }

    private static PyCallable wrap(boolean markup, PyCallable method) {
        if (!markup) {
            return method;
        }
        return (args, kwargs) -> {
            Object result = method.call(args, kwargs);
            return result instanceof String ? Markup.of((String) result) : result;
        };
    }

    private static String strip(String text, Object chars, boolean left, boolean right) {
        String set = chars == null ? null : PyOps.str(chars);
        int start = 0;
        int end = text.length();
        while (left && start < end && matches(text.charAt(start), set)) {
            start++;
        }
        while (right && end > start && matches(text.charAt(end - 1), set)) {
            end--;
        }
        return text.substring(start, end);
    }

    private static boolean matches(char c, String set) {
        return set == null ? Character.isWhitespace(c) : set.indexOf(c) >= 0;
    }

    private static String title(String text) {
        StringBuilder out = new StringBuilder(text.length());
        boolean previousLetter = false;
        for (char c : text.toCharArray()) {
            out.append(previousLetter ? Character.toLowerCase(c) : Character.toUpperCase(c));
            previousLetter = Character.isLetter(c);
        }
        return out.toString();
    }

    private static String replace(String text, List<Object> args, boolean markup) {
        String old = PyOps.str(arg(args, 0, null));
        Object replacement = arg(args, 1, null);
        String with = markup ? Markup.escape(replacement).toHtml() : PyOps.str(replacement);
        long count = PyOps.toLong(arg(args, 2, -1L));
        if (count < 0) {
            return text.replace(old, with);
        }
        StringBuilder out = new StringBuilder();
        int from = 0;
        for (long n = 0; n < count; n++) {
            int index = text.indexOf(old, from);
            if (index < 0) {
                break;
            }
            out.append(text, from, index).append(with);
            from = index + old.length();
        }
        return out.append(text.substring(from)).toString();
    }

    private static String zfill(String text, int width) {
        if (text.length() >= width) {
            return text;
        }
        String zeros = "0".repeat(width - text.length());
        if (!text.isEmpty() && (text.charAt(0) == '-' || text.charAt(0) == '+')) {
            return text.charAt(0) + zeros + text.substring(1);
        }
        return zeros + text;
    }

    private static List<Object> split(String text, Object separator, int maxSplit) {
        List<Object> parts = new ArrayList<>();
        if (separator == null) {
            String remaining = text.strip();
            if (remaining.isEmpty()) {
                return parts;
            }
            String[] pieces = maxSplit < 0 ? remaining.split("\\s+") : remaining.split("\\s+", maxSplit + 1);
            Collections.addAll(parts, (Object[]) pieces);
            return parts;
        }
        String sep = PyOps.str(separator);
        if (sep.isEmpty()) {
            throw new ExpressionEvaluationException("ValueError: empty separator");
        }
        int from = 0;
        int splits = 0;
        while (maxSplit < 0 || splits < maxSplit) {
            int index = text.indexOf(sep, from);
            if (index < 0) {
                break;
            }
            parts.add(text.substring(from, index));
            from = index + sep.length();
            splits++;
        }
        parts.add(text.substring(from));
        return parts;
    }

    private static boolean affix(String text, Object candidates, boolean prefix) {
        if (candidates instanceof List) {
            for (Object candidate : (List<?>) candidates) {
                if (affix(text, candidate, prefix)) {
                    return true;
                }
            }
            return false;
        }
        String affix = PyOps.str(candidates);
        return prefix ? text.startsWith(affix) : text.endsWith(affix);
    }

    // === dict ===

    @SuppressWarnings("unchecked")
    private static PyCallable dictMethod(Map<?, ?> map, String name) {
        switch (name) {
            case "get":
                return (args, kwargs) -> {
                    Object found = PyOps.mapGet(map, arg(args, 0, null));
                    return found == PyObject.MISSING ? arg(args, 1, null) : found;
                };
            case "keys":
                return (args, kwargs) -> new ArrayList<Object>(map.keySet());
            case "values":
                return (args, kwargs) -> new ArrayList<Object>(map.values());
            case "items":
                return (args, kwargs) -> {
                    List<Object> items = new ArrayList<>();
                    for (Map.Entry<?, ?> entry : map.entrySet()) {
                        items.add(Collections.unmodifiableList(new ArrayList<>(Arrays.asList(entry.getKey(), entry.getValue()))));
                    }
                    return items;
                };
            case "copy":
                return (args, kwargs) -> new LinkedHashMap<Object, Object>(map);
            case "update":
                return (args, kwargs) -> {
                    Map<Object, Object> target = (Map<Object, Object>) map;
                    if (!args.isEmpty()) {
                        target.putAll(Builtins.toDict(args.get(0)));
                    }
                    target.putAll(kwargs);
                    return null;
                };
            default:
                return null;
        }
    }

    // === list ===

    @SuppressWarnings("unchecked")
    private static PyCallable listMethod(List<?> list, String name) {
        switch (name) {
            case "index":
                return (args, kwargs) -> {
                    for (int i = 0; i < list.size(); i++) {
                        if (PyOps.pyEquals(list.get(i), arg(args, 0, null))) {
                            return (long) i;
                        }
                    }
                    throw new ExpressionEvaluationException("ValueError: " + PyOps.repr(arg(args, 0, null)) + " is not in list");
                };
            case "count":
                return (args, kwargs) -> list.stream().filter(item -> PyOps.pyEquals(item, arg(args, 0, null))).count();
            case "copy":
                return (args, kwargs) -> new ArrayList<Object>(list);
            case "append":
                return (args, kwargs) -> {
                    ((List<Object>) list).add(arg(args, 0, null));
                    return null;
                };
            case "extend":
                return (args, kwargs) -> {
                    ((List<Object>) list).addAll(PyOps.toList(arg(args, 0, null)));
                    return null;
                };
            default:
                return null;
        }
    }

    // === set ===

    private static PyCallable setMethod(Set<?> set, String name) {
        switch (name) {
            case "union":
                return (args, kwargs) -> {
                    Set<Object> result = new LinkedHashSet<>(set);
                    for (Object other : args) {
                        result.addAll(PyOps.toList(other));
                    }
                    return result;
                };
            case "intersection":
                return (args, kwargs) -> {
                    Set<Object> result = new LinkedHashSet<>(set);
                    for (Object other : args) {
                        result.retainAll(PyOps.toList(other));
                    }
                    return result;
                };
            case "difference":
                return (args, kwargs) -> {
                    Set<Object> result = new LinkedHashSet<>(set);
                    for (Object other : args) {
                        result.removeAll(PyOps.toList(other));
                    }
                    return result;
                };
            case "copy":
                return (args, kwargs) -> new LinkedHashSet<Object>(set);
            default:
                return null;
        }
    }

    static Object arg(List<Object> args, int index, Object fallback) {
        return index < args.size() ? args.get(index) : fallback;
    }
}
