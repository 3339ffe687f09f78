package com.chih.JQWeb.core.compiler.directive;

import com.chih.JQWeb.core.compiler.CompileContext;
import com.chih.JQWeb.core.compiler.DirectiveCursor;
import com.chih.JQWeb.core.compiler.QWebSyntax;
import com.chih.JQWeb.core.compiler.instruction.Evaluation;
import com.chih.JQWeb.core.compiler.instruction.ForeachInstruction;
import com.chih.JQWeb.core.compiler.instruction.Instruction;
import com.chih.JQWeb.core.exception.TemplateCompileException;
import com.chih.JQWeb.core.expr.CompiledExpression;
import com.chih.JQWeb.core.xml.XmlElement;

import java.util.ArrayList;
import java.util.List;

/**
 * t-foreach / t-as
 *
 * @author lizhiyuan
 * @since 2026/10/06
 */
public final class ForeachDirective {

    private ForeachDirective() {
    }

    public static List<Instruction> compile(XmlElement element, DirectiveCursor cursor, CompileContext context) {
        String source = element.removeAttribute("t-foreach");
        String name = element.removeAttribute("t-as");
        if (name == null || name.isEmpty()) {
            throw new TemplateCompileException("KeyError: 't-as'");
        }
        if (!QWebSyntax.VARNAME.matcher(name).matches()) {
            throw new TemplateCompileException("The varname '" + name
                    + "' can only contain alphanumeric characters and underscores.");
        }

        if ("t".equals(element.getTag())) {
            context.text().rstrip();
        }
        List<Instruction> code = context.text().flush();
        List<Instruction> body = new ArrayList<>(context.compileDirectives(element, cursor));
        body.addAll(context.text().flush(true));

        Evaluation collection;
        String trimmed = source == null ? "" : source.trim();
        if (QWebSyntax.isDigits(trimmed)) {
            Long count = Long.valueOf(trimmed);
            collection = (execution, values) -> count;
        } else {
            CompiledExpression expression = context.expression(source);
            collection = (execution, values) -> expression.evaluate(values);
        }
        code.add(new ForeachInstruction(collection, name, body));
        return code;
    }

    public static List<Instruction> compileAs(XmlElement element, DirectiveCursor cursor, CompileContext context) {
        if (!element.hasAttribute("t-foreach")) {
            throw new TemplateCompileException("t-as must be on the same node of t-foreach");
        }
        return new ArrayList<>();
    }
}
