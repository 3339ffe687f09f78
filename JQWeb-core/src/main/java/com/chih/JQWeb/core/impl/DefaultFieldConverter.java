package com.chih.JQWeb.core.impl;

import com.chih.JQWeb.core.expr.PyOps;
import com.chih.JQWeb.core.render.Markup;
import com.chih.JQWeb.core.spi.FieldConverter;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 默认的字段 / 部件转换器
 * <p>
 * 支持的部件：{@code text}（换行转 {@code <br/>}）、{@code html}（原样输出）、
 * {@code float}（按 {@code precision} 保留小数，默认 2 位）、{@code integer}，
 * 其余类型按字符串转义输出。{@code inherit_branding} 打开时附加 {@code data-oe-*} 属性。
 *
 * @author lizhiyuan
 * @since 2026/10/14
 */
public class DefaultFieldConverter implements FieldConverter {

    @Override
    public FieldRendering recordToHtml(Object record, String field, Map<String, Object> options, Map<String, Object> values) {
        Object value = PyOps.getAttribute(record, field);
        if (!options.containsKey("type") || options.get("type") == null) {
            options.put("type", inferType(value));
        }
        boolean branding = PyOps.truthy(options.get("inherit_branding"));
        Map<String, Object> attributes = new LinkedHashMap<>();
        if (branding) {
            attributes.put("data-oe-model", record == null ? null : record.getClass().getSimpleName());
            attributes.put("data-oe-field", field);
            attributes.put("data-oe-type", options.get("type"));
            attributes.put("data-oe-expression", options.get("expression"));
        }
        return new FieldRendering(attributes, convert(value, options), branding);
    }

    @Override
    public FieldRendering valueToHtml(Object value, Map<String, Object> options, Map<String, Object> values) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("data-oe-type", options.get("type"));
        attributes.put("data-oe-expression", options.get("expression"));
        return new FieldRendering(attributes, convert(value, options),
                PyOps.truthy(options.get("inherit_branding")));
    }

    /**
     * @return null 或 false 表示没有内容
     */
    protected Object convert(Object value, Map<String, Object> options) {
        if (value == null || Boolean.FALSE.equals(value)) {
            return null;
        }
        String type = options.get("type") == null ? "char" : String.valueOf(options.get("type"));
        switch (type) {
            case "html":
                return Markup.of(PyOps.str(value));
            case "text":
                return Markup.of(Markup.escapeText(PyOps.str(value)).replace("\n", "<br/>\n"));
            case "float":
            case "monetary":
                return Markup.of(formatFloat(value, options.get("precision")));
            case "integer":
                return Markup.of(String.valueOf(PyOps.toLong(value)));
            default:
                return Markup.escape(value);
        }
    }

    private static String formatFloat(Object value, Object precision) {
        int digits = precision == null ? 2 : (int) PyOps.toLong(precision);
        BigDecimal decimal = value instanceof BigDecimal
                ? (BigDecimal) value
                : BigDecimal.valueOf(PyOps.toDouble(value));
        return decimal.setScale(digits, RoundingMode.HALF_EVEN).toPlainString();
    }

    private static String inferType(Object value) {
        if (PyOps.isIntegral(value)) {
            return "integer";
        }
        if (value instanceof Number) {
            return "float";
        }
        if (value instanceof Markup) {
            return "html";
        }
        return "char";
    }
}
