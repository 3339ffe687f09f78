package com.chih.JQWeb.core.compiler.directive;

import com.chih.JQWeb.core.compiler.CompileContext;
import com.chih.JQWeb.core.compiler.DirectiveCursor;
import com.chih.JQWeb.core.compiler.QWebSyntax;
import com.chih.JQWeb.core.compiler.instruction.CallInstruction;
import com.chih.JQWeb.core.compiler.instruction.CallInstruction.ArgumentSource;
import com.chih.JQWeb.core.compiler.instruction.Evaluation;
import com.chih.JQWeb.core.compiler.instruction.Instruction;
import com.chih.JQWeb.core.exception.SourceLocation;
import com.chih.JQWeb.core.exception.TemplateCompileException;
import com.chih.JQWeb.core.expr.CompiledExpression;
import com.chih.JQWeb.core.expr.FormatString;
import com.chih.JQWeb.core.xml.XmlElement;

import java.util.ArrayList;
import java.util.List;

/**
 * t-call 与其别名 t-lang
 *
 * @author lizhiyuan
 * @since 2026/10/06
 */
public final class CallDirective {

    private CallDirective() {
    }

    public static List<Instruction> compile(XmlElement element, DirectiveCursor cursor, CompileContext context) {
        String target = element.removeAttribute("t-call");
        if (!"t".equals(element.getTag())) {
            throw new TemplateCompileException("t-call must be on a <t> element (actually on <"
                    + element.getTag() + ">).");
        }
        List<Instruction> code = context.text().flush(true);
        SourceLocation location = context.getLocation();
        element.removeAttribute("t-consumed-options");

        String contentBlock = null;
        boolean legacy = false;
        if (element.hasContent()) {
            legacy = isLegacyForm(element);
            contentBlock = context.nextBlockName("t_call");
            List<Instruction> content = new ArrayList<>(context.compileDirective(element, cursor, "inner-content"));
            content.addAll(context.text().flush(true));
            context.addBlock(contentBlock, content);
        }

        List<ArgumentSource> arguments = new ArrayList<>();
        for (String key : element.attributeNames()) {
            if (key.endsWith(".f") || key.endsWith(".translate")) {
                String name = key.endsWith(".f")
                        ? key.substring(0, key.length() - 2)
                        : QWebSyntax.stripTranslate(key);
                FormatString format = context.format(element.removeAttribute(key));
                arguments.add((callValues, execution, values) -> callValues.put(name, format.evaluate(values)));
            } else if (!key.startsWith("t-")) {
                CompiledExpression expression = context.expression(element.removeAttribute(key));
                arguments.add((callValues, execution, values) -> callValues.put(key, expression.evaluate(values)));
            } else if ("t-args".equals(key)) {
                CompiledExpression expression = context.expression(element.removeAttribute(key));
                arguments.add((callValues, execution, values) ->
                        AttributeDirective.merge(callValues, expression.evaluate(values)));
            }
        }

        code.add(new CallInstruction(compileTarget(target, context), contentBlock, legacy, arguments, location));
        return code;
    }

    /**
     * t-lang 是 t-options-lang 的别名，改写后重新编译该节点
     */
    public static List<Instruction> compileLang(XmlElement element, DirectiveCursor cursor, CompileContext context) {
        if (!element.hasAttribute("t-call")) {
            throw new TemplateCompileException(
                    "t-lang is an alias of t-options-lang but only available on the same node of t-call");
        }
        element.setAttribute("t-options-lang", element.removeAttribute("t-lang"));
        return context.compileNode(element);
    }

    /**
     * 数字为模板 id；否则按格式化字符串求值，结果为数字时同样视为 id
     */
    private static Evaluation compileTarget(String target, CompileContext context) {
        if (QWebSyntax.isDigits(target)) {
            Integer id = Integer.valueOf(target);
            return (execution, values) -> id;
        }
        FormatString format = context.format(target);
        if (format.isConstant()) {
            String name = format.evaluate(null);
            return (execution, values) -> name;
        }
        return (execution, values) -> {
            String name = format.evaluate(values);
            return QWebSyntax.isDigits(name) ? (Object) Integer.valueOf(name) : name;
        };
    }

    /**
     * 旧写法：t-call 上没有普通属性，内容里用 t-set 传参
     */
    private static boolean isLegacyForm(XmlElement element) {
        for (String key : element.attributeNames()) {
            if (!key.startsWith("t-")) {
                return false;
            }
        }
        for (XmlElement child : element.getChildElements()) {
            String set = child.getAttribute("t-set");
            if (set != null && !set.isEmpty()) {
                return true;
            }
        }
        return false;
    }
}
