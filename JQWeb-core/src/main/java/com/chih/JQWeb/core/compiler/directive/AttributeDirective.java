package com.chih.JQWeb.core.compiler.directive;

import com.chih.JQWeb.core.compiler.CompileContext;
import com.chih.JQWeb.core.compiler.DirectiveCursor;
import com.chih.JQWeb.core.compiler.QWebSyntax;
import com.chih.JQWeb.core.compiler.instruction.AttributesInstruction;
import com.chih.JQWeb.core.compiler.instruction.AttributesInstruction.AttributeSource;
import com.chih.JQWeb.core.compiler.instruction.Instruction;
import com.chih.JQWeb.core.expr.CompiledExpression;
import com.chih.JQWeb.core.expr.FormatString;
import com.chih.JQWeb.core.expr.PyOps;
import com.chih.JQWeb.core.xml.XmlElement;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 元素属性：静态属性在前，t-attf-* / t-att-* / t-att 按书写顺序在后
 *
 * @author lizhiyuan
 * @since 2026/10/06
 */
public final class AttributeDirective {

    private AttributeDirective() {
    }

    public static List<Instruction> compile(XmlElement element, DirectiveCursor cursor, CompileContext context) {
        List<AttributeSource> sources = new ArrayList<>();

        for (String key : element.attributeNames()) {
            if (!key.startsWith("t-")) {
                String value = element.removeAttribute(key);
                String name = QWebSyntax.stripTranslate(key);
                sources.add((attributes, execution, values) -> attributes.put(name, value));
            }
        }

        for (String key : element.attributeNames()) {
            if (key.startsWith("t-attf-")) {
                FormatString format = context.format(element.removeAttribute(key));
                String name = QWebSyntax.stripTranslate(key.substring("t-attf-".length()));
                sources.add((attributes, execution, values) -> attributes.put(name, format.evaluate(values)));
            } else if (key.startsWith("t-att-")) {
                CompiledExpression expression = context.expression(element.removeAttribute(key));
                String name = key.substring("t-att-".length());
                sources.add((attributes, execution, values) -> attributes.put(name, expression.evaluate(values)));
            } else if ("t-att".equals(key)) {
                CompiledExpression expression = context.expression(element.removeAttribute(key));
                sources.add((attributes, execution, values) -> merge(attributes, expression.evaluate(values)));
            }
        }

        // <t> 不输出标签，没有属性时不必占用 __qweb_attrs__
        if (sources.isEmpty() && "t".equals(element.getTag())) {
            return new ArrayList<>();
        }
        List<Instruction> code = context.text().flush();
        code.add(new AttributesInstruction(sources));
        return code;
    }

    /**
     * t-att 的值：字典、单个键值对或键值对列表
     */
    static void merge(Map<String, Object> attributes, Object value) {
        Object normalized = PyOps.normalize(value);
        if (normalized instanceof Map) {
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) normalized).entrySet()) {
                attributes.put(PyOps.str(entry.getKey()), entry.getValue());
            }
            return;
        }
        if (normalized == null || !PyOps.truthy(normalized)) {
            return;
        }
        List<Object> items = PyOps.toList(normalized);
        if (!(PyOps.normalize(items.get(0)) instanceof List)) {
            attributes.put(PyOps.str(items.get(0)), items.size() > 1 ? items.get(1) : null);
            return;
        }
        for (Object item : items) {
            List<Object> pair = PyOps.toList(item);
            attributes.put(PyOps.str(pair.get(0)), pair.get(1));
        }
    }
}
