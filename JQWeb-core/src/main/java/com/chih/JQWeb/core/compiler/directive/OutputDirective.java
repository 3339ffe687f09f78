package com.chih.JQWeb.core.compiler.directive;

import com.chih.JQWeb.core.compiler.CompileContext;
import com.chih.JQWeb.core.compiler.DirectiveCursor;
import com.chih.JQWeb.core.compiler.QWebSyntax;
import com.chih.JQWeb.core.compiler.instruction.Evaluation;
import com.chih.JQWeb.core.compiler.instruction.Instruction;
import com.chih.JQWeb.core.compiler.instruction.OutputInstruction;
import com.chih.JQWeb.core.compiler.instruction.SlotInstruction;
import com.chih.JQWeb.core.exception.TemplateCompileException;
import com.chih.JQWeb.core.expr.CompiledExpression;
import com.chih.JQWeb.core.expr.PyOps;
import com.chih.JQWeb.core.render.BlockExecution;
import com.chih.JQWeb.core.render.HtmlSafe;
import com.chih.JQWeb.core.render.Markup;
import com.chih.JQWeb.core.spi.FieldConverter.FieldRendering;
import com.chih.JQWeb.core.xml.XmlElement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 输出类指令：t-out，以及 t-field 和已废弃的 t-esc / t-raw
 * <p>
 * 带 t-options（部件）或 t-field 时交给 {@code FieldConverter} 转换，
 * 其返回的属性合并到元素属性中。
 * </p>
 *
 * @author lizhiyuan
 * @since 2026/10/06
 */
public final class OutputDirective {

    private static final Logger log = LoggerFactory.getLogger(OutputDirective.class);

    private static final Set<String> FIELD_FORBIDDEN_TAGS = Set.of(
            "table", "tbody", "thead", "tfoot", "tr", "td", "li", "ul", "ol", "dl", "dt", "dd");

    private OutputDirective() {
    }

    public static List<Instruction> compileEsc(XmlElement element, DirectiveCursor cursor, CompileContext context) {
        if (context.isDevMode("qweb")) {
            log.warn("Found deprecated directive @t-esc='{}' in template '{}'. Replace by @t-out",
                    element.getAttribute("t-esc"), context.getName());
        }
        return compile(element, cursor, context);
    }

    public static List<Instruction> compileRaw(XmlElement element, DirectiveCursor cursor, CompileContext context) {
        log.warn("Found deprecated directive @t-raw='{}' in template '{}'. Replace by @t-out, and explicitely wrap "
                + "content in `Markup` if necessary", element.getAttribute("t-raw"), context.getName());
        return compile(element, cursor, context);
    }

    public static List<Instruction> compileField(XmlElement element, DirectiveCursor cursor, CompileContext context) {
        String tag = element.getTag();
        if (FIELD_FORBIDDEN_TAGS.contains(tag)) {
            throw new TemplateCompileException("QWeb widgets do not work correctly on '" + tag + "' elements");
        }
        if ("t".equals(tag)) {
            throw new TemplateCompileException("t-field can not be used on a t element, provide an actual HTML node");
        }
        String expression = element.getAttribute("t-field");
        if (expression == null || !expression.contains(".")) {
            throw new TemplateCompileException("t-field must have at least a dot like 'record.field_name'");
        }
        return compile(element, cursor, context);
    }

    public static List<Instruction> compile(XmlElement element, DirectiveCursor cursor, CompileContext context) {
        String type;
        String expression;
        if (element.hasAttribute("t-out")) {
            type = "t-out";
            expression = element.removeAttribute("t-out");
        } else if (element.hasAttribute("t-field")) {
            type = "t-field";
            expression = element.removeAttribute("t-field");
        } else if (element.hasAttribute("t-esc")) {
            type = "t-esc";
            expression = element.removeAttribute("t-esc");
        } else {
            type = "t-raw";
            expression = element.removeAttribute("t-raw");
        }

        List<Instruction> code = context.text().flush();
        boolean hasOptions = element.removeAttribute("t-consumed-options") != null;

        List<Instruction> tagOpen = new ArrayList<>(context.compileDirective(element, cursor, "tag-open"));
        tagOpen.addAll(context.text().flush());
        List<Instruction> tagClose = new ArrayList<>(context.compileDirective(element, cursor, "tag-close"));
        tagClose.addAll(context.text().flush());
        List<Instruction> defaultBody = new ArrayList<>(context.compileDirective(element, cursor, "inner-content"));
        defaultBody.addAll(context.text().flush());

        String tag = element.getTag();
        if (QWebSyntax.SLOT_KEY.equals(expression) && !hasOptions) {
            code.add(new SlotInstruction(tagOpen, tagClose));
            return code;
        }

        Evaluation content;
        boolean forceDisplayDependent;
        if ("t-field".equals(type)) {
            int dot = expression.lastIndexOf('.');
            CompiledExpression record = context.expression(expression.substring(0, dot), true);
            String field = expression.substring(dot + 1);
            content = (execution, values) -> {
                Map<String, Object> options = takeOptions(execution, values, tag, expression);
                FieldRendering rendering = execution.getSession().getFieldConverter()
                        .recordToHtml(record.evaluate(values), field, options, values);
                Object value = rendering.content();
                if (value != null && !Boolean.FALSE.equals(value)) {
                    value = toStr(value);
                }
                return new FieldRendering(rendering.attributes(), value, rendering.forceDisplay());
            };
            forceDisplayDependent = true;
        } else {
            CompiledExpression compiled = QWebSyntax.SLOT_KEY.equals(expression) ? null : context.expression(expression);
            Evaluation value = compiled == null
                    ? (execution, values) -> values.getOrDefault(QWebSyntax.SLOT_KEY, "")
                    : (execution, values) -> compiled.evaluate(values);
            if (hasOptions) {
                content = (execution, values) -> {
                    Object raw = value.evaluate(execution, values);
                    Map<String, Object> options = takeOptions(execution, values, tag, expression);
                    FieldRendering rendering = execution.getSession().getFieldConverter()
                            .valueToHtml(raw, options, values);
                    return new FieldRendering(rendering.attributes(), toStr(rendering.content()),
                            rendering.forceDisplay());
                };
                forceDisplayDependent = true;
            } else {
                content = value;
                forceDisplayDependent = false;
            }
            if ("t-raw".equals(type)) {
                Evaluation escaped = content;
                content = (execution, values) -> {
                    Object result = escaped.evaluate(execution, values);
                    if (result == null || Boolean.FALSE.equals(result) || result instanceof FieldRendering) {
                        return result;
                    }
                    return Markup.of(PyOps.str(result));
                };
            }
        }

        code.add(new OutputInstruction(content, tagOpen, tagClose, defaultBody, forceDisplayDependent));
        return code;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> takeOptions(BlockExecution execution, Map<String, Object> values,
                                                   String tag, String expression) {
        Object consumed = values.remove(QWebSyntax.OPTIONS_KEY);
        Map<String, Object> options = consumed instanceof Map
                ? new LinkedHashMap<>((Map<String, Object>) consumed)
                : new LinkedHashMap<>();
        options.put("tagName", tag);
        options.put("expression", expression);
        if (!options.containsKey("type")) {
            options.put("type", options.get("widget"));
        }
        options.put("inherit_branding", execution.getTemplate().getOptions().inheritBranding());
        return options;
    }

    /**
     * None / False 为空串，安全标记保持原样，其余转为字符串
     */
    private static Object toStr(Object value) {
        if (value == null || Boolean.FALSE.equals(value)) {
            return "";
        }
        if (value instanceof CharSequence || value instanceof HtmlSafe) {
            return value;
        }
        return PyOps.str(value);
    }
}
