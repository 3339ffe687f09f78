package com.chih.JQWeb.core.expr;

import com.chih.JQWeb.core.exception.ExpressionEvaluationException;
import com.chih.JQWeb.core.exception.MissingValueException;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 字符串格式化：{@code "%s" % args} 与 {@code "{}".format(...)}
 */
final class PyFormat {

    private PyFormat() {
    }

    // === printf 风格 ===

    static String percent(String format, Object args) {
        List<?> positional = args instanceof List ? (List<?>) args : null;
        Map<?, ?> mapping = args instanceof Map ? (Map<?, ?>) args : null;
        int next = 0;
        StringBuilder out = new StringBuilder();
        int i = 0;
        while (i < format.length()) {
            char c = format.charAt(i++);
            if (c != '%') {
                out.append(c);
                continue;
            }
            if (i >= format.length()) {
                throw new ExpressionEvaluationException("ValueError: incomplete format");
            }
            if (format.charAt(i) == '%') {
                out.append('%');
                i++;
                continue;
            }
            String key = null;
            if (format.charAt(i) == '(') {
                int close = format.indexOf(')', i);
                if (close < 0) {
                    throw new ExpressionEvaluationException("ValueError: incomplete format key");
                }
                key = format.substring(i + 1, close);
                i = close + 1;
            }
            StringBuilder flags = new StringBuilder();
            while (i < format.length() && "-+ 0#".indexOf(format.charAt(i)) >= 0) {
                flags.append(format.charAt(i++));
            }
            int start = i;
            while (i < format.length() && Character.isDigit(format.charAt(i))) {
                i++;
            }
            String width = format.substring(start, i);
            String precision = null;
            if (i < format.length() && format.charAt(i) == '.') {
                start = ++i;
                while (i < format.length() && Character.isDigit(format.charAt(i))) {
                    i++;
                }
                precision = format.substring(start, i);
            }
            if (i >= format.length()) {
                throw new ExpressionEvaluationException("ValueError: incomplete format");
            }
            char conversion = format.charAt(i++);

            Object value;
            if (key != null) {
                if (mapping == null) {
                    throw PyOps.typeError("format requires a mapping");
                }
                value = PyOps.mapGet(mapping, key);
                if (value == PyObject.MISSING) {
                    throw new MissingValueException(key);
                }
            } else if (positional != null) {
                if (next >= positional.size()) {
                    throw PyOps.typeError("not enough arguments for format string");
                }
                value = positional.get(next++);
            } else {
                if (next++ > 0) {
                    throw PyOps.typeError("not enough arguments for format string");
                }
                value = args;
            }
            out.append(convert(conversion, flags.toString(), width, precision, value));
        }
        if (positional != null && next < positional.size()) {
            throw PyOps.typeError("not all arguments converted during string formatting");
        }
        return out.toString();
    }

    private static String convert(char conversion, String flags, String width, String precision, Object value) {
        String javaFlags = flags.replace("#", "");
        if (javaFlags.contains("-")) {
            javaFlags = javaFlags.replace("0", "");
        }
        String prefix = "%" + javaFlags + width;
        String textPrefix = "%" + (flags.contains("-") ? "-" : "") + width;
        switch (conversion) {
            case 's':
                return String.format(Locale.ROOT, textPrefix + (precision == null ? "" : "." + precision) + "s", PyOps.str(value));
            case 'r':
            case 'a':
                return String.format(Locale.ROOT, textPrefix + "s", PyOps.repr(value));
            case 'd':
            case 'i':
            case 'u':
                return String.format(Locale.ROOT, prefix + "d", PyOps.toLong(value));
            case 'f':
            case 'F':
            case 'e':
            case 'E':
                return String.format(Locale.ROOT, prefix + "." + (precision == null || precision.isEmpty() ? "6" : precision) + (conversion == 'F' ? 'f' : conversion),
                        PyOps.toDouble(value));
            case 'g':
            case 'G':
                String general = general(PyOps.toDouble(value), precision == null || precision.isEmpty() ? 6 : Integer.parseInt(precision));
                return pad(conversion == 'G' ? general.toUpperCase() : general, width, flags.contains("-") ? '<' : '>', ' ');
            case 'x':
            case 'X':
            case 'o':
                return String.format(Locale.ROOT, prefix.replace("+", "").replace(" ", "") + conversion, PyOps.toLong(value));
            case 'c':
                return value instanceof CharSequence ? value.toString() : String.valueOf((char) PyOps.toLong(value));
            default:
                throw new ExpressionEvaluationException("ValueError: unsupported format character '" + conversion + "'");
        }
    }

    /**
     * {@code %g}：有效数字截断，去掉末尾的零
     */
    static String general(double value, int precision) {
        if (value == 0.0 || Double.isNaN(value) || Double.isInfinite(value)) {
            return PyOps.floatRepr(value).replace(".0", "");
        }
        int digits = Math.max(precision, 1);
        BigDecimal rounded = new BigDecimal(value).round(new MathContext(digits));
        int exponent = rounded.precision() - rounded.scale() - 1;
        if (exponent < -4 || exponent >= digits) {
            String text = String.format(Locale.ROOT, "%." + (digits - 1) + "e", value);
            int e = text.indexOf('e');
            String mantissa = text.substring(0, e);
            if (mantissa.contains(".")) {
                mantissa = mantissa.replaceAll("0+$", "").replaceAll("\\.$", "");
            }
            return mantissa + text.substring(e);
        }
        return rounded.stripTrailingZeros().toPlainString();
    }

    // === str.format ===

    static String format(String template, List<Object> args, Map<String, Object> kwargs) {
        StringBuilder out = new StringBuilder();
        int auto = 0;
        int i = 0;
        while (i < template.length()) {
            char c = template.charAt(i);
            if (c == '{') {
                if (i + 1 < template.length() && template.charAt(i + 1) == '{') {
                    out.append('{');
                    i += 2;
                    continue;
                }
                int close = template.indexOf('}', i);
                if (close < 0) {
                    throw new ExpressionEvaluationException("ValueError: Single '{' encountered in format string");
                }
                String field = template.substring(i + 1, close);
                String spec = "";
                int colon = field.indexOf(':');
                if (colon >= 0) {
                    spec = field.substring(colon + 1);
                    field = field.substring(0, colon);
                }
                char conversion = 0;
                int bang = field.indexOf('!');
                if (bang >= 0) {
                    conversion = field.charAt(bang + 1);
                    field = field.substring(0, bang);
                }
                Object value;
                if (field.isEmpty()) {
                    value = argument(args, auto++);
                } else {
                    value = resolveField(field, args, kwargs);
                }
                if (conversion == 'r') {
                    value = PyOps.repr(value);
                } else if (conversion == 's') {
                    value = PyOps.str(value);
                }
                out.append(formatValue(value, spec));
                i = close + 1;
            } else if (c == '}') {
                if (i + 1 < template.length() && template.charAt(i + 1) == '}') {
                    i++;
                }
                out.append('}');
                i++;
            } else {
                out.append(c);
                i++;
            }
        }
        return out.toString();
    }

    private static Object argument(List<Object> args, int index) {
        if (index >= args.size()) {
            throw new ExpressionEvaluationException("IndexError: Replacement index " + index + " out of range");
        }
        return args.get(index);
    }

    private static Object resolveField(String field, List<Object> args, Map<String, Object> kwargs) {
        int end = 0;
        while (end < field.length() && field.charAt(end) != '.' && field.charAt(end) != '[') {
            end++;
        }
        String head = field.substring(0, end);
        Object value;
        if (!head.isEmpty() && head.chars().allMatch(Character::isDigit)) {
            value = argument(args, Integer.parseInt(head));
        } else if (kwargs.containsKey(head)) {
            value = kwargs.get(head);
        } else {
            throw new MissingValueException(head);
        }
        while (end < field.length()) {
            if (field.charAt(end) == '.') {
                int next = end + 1;
                while (next < field.length() && field.charAt(next) != '.' && field.charAt(next) != '[') {
                    next++;
                }
                value = PyOps.getAttribute(value, field.substring(end + 1, next));
                end = next;
            } else {
                int close = field.indexOf(']', end);
                String key = field.substring(end + 1, close);
                Object index = key.chars().allMatch(Character::isDigit) && !key.isEmpty() ? (Object) Long.parseLong(key) : key;
                value = PyOps.getItem(value, index);
                end = close + 1;
            }
        }
        return value;
    }

    /**
     * 格式规格 {@code [[fill]align][sign][#][0][width][,][.precision][type]}
     */
    static String formatValue(Object value, String spec) {
        if (spec.isEmpty()) {
            return PyOps.str(value);
        }
        int i = 0;
        char fill = ' ';
        char align = 0;
        if (spec.length() >= 2 && "<>^=".indexOf(spec.charAt(1)) >= 0) {
            fill = spec.charAt(0);
            align = spec.charAt(1);
            i = 2;
        } else if ("<>^=".indexOf(spec.charAt(0)) >= 0) {
            align = spec.charAt(0);
            i = 1;
        }
        char sign = '-';
        if (i < spec.length() && "+- ".indexOf(spec.charAt(i)) >= 0) {
            sign = spec.charAt(i++);
        }
        if (i < spec.length() && spec.charAt(i) == '#') {
            i++;
        }
        if (i < spec.length() && spec.charAt(i) == '0') {
            if (align == 0) {
                fill = '0';
                align = '=';
            }
            i++;
        }
        int start = i;
        while (i < spec.length() && Character.isDigit(spec.charAt(i))) {
            i++;
        }
        String width = spec.substring(start, i);
        boolean grouping = false;
        if (i < spec.length() && (spec.charAt(i) == ',' || spec.charAt(i) == '_')) {
            grouping = true;
            i++;
        }
        Integer precision = null;
        if (i < spec.length() && spec.charAt(i) == '.') {
            start = ++i;
            while (i < spec.length() && Character.isDigit(spec.charAt(i))) {
                i++;
            }
            precision = Integer.parseInt(spec.substring(start, i));
        }
        char type = i < spec.length() ? spec.charAt(i) : 0;

        String body;
        boolean numeric = PyOps.isNumeric(value) && type != 's';
        if (!numeric) {
            body = PyOps.str(value);
            if (precision != null && precision < body.length()) {
                body = body.substring(0, precision);
            }
            return pad(body, width, align == 0 ? '<' : align, fill);
        }
        double number = PyOps.toDouble(value);
        boolean negative = number < 0;
        switch (type) {
            case 'f':
            case 'F':
                body = String.format(Locale.ROOT, (grouping ? "%,." : "%.") + (precision == null ? 6 : precision) + "f", Math.abs(number));
                break;
            case '%':
                body = String.format(Locale.ROOT, "%." + (precision == null ? 6 : precision) + "f", Math.abs(number) * 100) + "%";
                break;
            case 'e':
            case 'E':
                body = String.format(Locale.ROOT, "%." + (precision == null ? 6 : precision) + type, Math.abs(number));
                break;
            case 'g':
            case 'G':
                body = general(Math.abs(number), precision == null ? 6 : precision);
                break;
            case 'x':
            case 'X':
                body = Long.toHexString(Math.abs(PyOps.toLong(value)));
                body = type == 'X' ? body.toUpperCase() : body;
                break;
            case 'o':
                body = Long.toOctalString(Math.abs(PyOps.toLong(value)));
                break;
            case 'b':
                body = Long.toBinaryString(Math.abs(PyOps.toLong(value)));
                break;
            case 'd':
            case 'n':
                body = grouping ? String.format(Locale.ROOT, "%,d", Math.abs(PyOps.toLong(value))) : String.valueOf(Math.abs(PyOps.toLong(value)));
                break;
            default:
                if (value instanceof Double || value instanceof Float) {
                    body = precision == null ? PyOps.floatRepr(Math.abs(number)) : general(Math.abs(number), precision);
                } else {
                    long abs = Math.abs(PyOps.toLong(value));
                    body = grouping ? String.format(Locale.ROOT, "%,d", abs) : String.valueOf(abs);
                }
        }
        String signText = negative ? "-" : sign == '+' ? "+" : sign == ' ' ? " " : "";
        if (align == '=') {
            int target = width.isEmpty() ? 0 : Integer.parseInt(width);
            StringBuilder padded = new StringBuilder(signText);
            for (int n = signText.length() + body.length(); n < target; n++) {
                padded.append(fill);
            }
            return padded.append(body).toString();
        }
        return pad(signText + body, width, align == 0 ? '>' : align, fill);
    }

    private static String pad(String text, String width, char align, char fill) {
        if (width == null || width.isEmpty()) {
            return text;
        }
        int target = Integer.parseInt(width);
        int missing = target - text.length();
        if (missing <= 0) {
            return text;
        }
        String left;
        String right;
        if (align == '<') {
            left = "";
            right = String.valueOf(fill).repeat(missing);
        } else if (align == '^') {
            left = String.valueOf(fill).repeat(missing / 2);
            right = String.valueOf(fill).repeat(missing - missing / 2);
        } else {
            left = String.valueOf(fill).repeat(missing);
            right = "";
        }
        return left + text + right;
    }
}
