package com.chih.JQWeb.core.compiler.directive;

import com.chih.JQWeb.core.compiler.CompileContext;
import com.chih.JQWeb.core.compiler.DirectiveCursor;
import com.chih.JQWeb.core.compiler.instruction.Evaluation;
import com.chih.JQWeb.core.compiler.instruction.Instruction;
import com.chih.JQWeb.core.compiler.instruction.OptionsInstruction;
import com.chih.JQWeb.core.exception.TemplateCompileException;
import com.chih.JQWeb.core.expr.CompiledExpression;
import com.chih.JQWeb.core.xml.XmlElement;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * t-options、t-options-*，以及检查选项是否被消费的 t-consumed-options
 *
 * @author lizhiyuan
 * @since 2026/10/06
 */
public final class OptionsDirective {

    private static final String PREFIX = "t-options-";

    private OptionsDirective() {
    }

    public static List<Instruction> compile(XmlElement element, DirectiveCursor cursor, CompileContext context) {
        List<Instruction> code = context.text().flush();

        Evaluation dict = null;
        String source = element.removeAttribute("t-options");
        if (source != null && !source.isEmpty()) {
            CompiledExpression expression = context.expression(source);
            dict = (execution, values) -> expression.evaluate(values);
        }

        Map<String, Evaluation> named = new LinkedHashMap<>();
        for (String attribute : element.attributeNames()) {
            if (attribute.startsWith(PREFIX)) {
                CompiledExpression expression = context.expression(element.removeAttribute(attribute));
                named.put(attribute.substring(PREFIX.length()), (execution, values) -> expression.evaluate(values));
            }
        }

        code.add(new OptionsInstruction(dict, named));
        element.setAttribute("t-consumed-options", "True");
        return code;
    }

    /**
     * 走到无序阶段仍残留说明没有指令取用 t-options
     */
    public static List<Instruction> compileConsumed(XmlElement element, DirectiveCursor cursor, CompileContext context) {
        throw new TemplateCompileException("the t-options must be on the same tag as a directive that consumes it "
                + "(for example: t-out, t-field, t-call)");
    }
}
