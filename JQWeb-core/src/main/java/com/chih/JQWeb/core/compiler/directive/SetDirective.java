package com.chih.JQWeb.core.compiler.directive;

import com.chih.JQWeb.core.compiler.CompileContext;
import com.chih.JQWeb.core.compiler.DirectiveCursor;
import com.chih.JQWeb.core.compiler.QWebSyntax;
import com.chih.JQWeb.core.compiler.instruction.AssignInstruction;
import com.chih.JQWeb.core.compiler.instruction.Instruction;
import com.chih.JQWeb.core.compiler.instruction.UpdateValuesInstruction;
import com.chih.JQWeb.core.exception.SourceLocation;
import com.chih.JQWeb.core.exception.TemplateCompileException;
import com.chih.JQWeb.core.expr.CompiledExpression;
import com.chih.JQWeb.core.expr.FormatString;
import com.chih.JQWeb.core.render.CallParameters;
import com.chih.JQWeb.core.render.ContentValue;
import com.chih.JQWeb.core.render.ScopeMode;
import com.chih.JQWeb.core.xml.XmlElement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * t-set 及其取值属性 t-value / t-valuef
 * <p>
 * 取值方式：t-value 表达式；t-valuef 格式化字符串；{@code t-set="{...}"} 合并字典；
 * 以上都没有时以元素内容为值，编译成独立块，使用时才渲染。
 * </p>
 *
 * @author lizhiyuan
 * @since 2026/10/06
 */
public final class SetDirective {

    private static final String VALUEF_TRANSLATE = "t-valuef.translate";

    private SetDirective() {
    }

    public static List<Instruction> compile(XmlElement element, DirectiveCursor cursor, CompileContext context) {
        List<Instruction> code = context.text().flush("t".equals(element.getTag()));

        String name = element.removeAttribute("t-set");
        if (name == null || name.isEmpty()) {
            throw new TemplateCompileException("KeyError: 't-set'");
        }
        boolean slot = QWebSyntax.SLOT_KEY.equals(name);
        boolean dict = name.charAt(0) == '{';
        if (!slot && !dict && !QWebSyntax.VARNAME.matcher(name).matches()) {
            throw new TemplateCompileException("The varname can only contain alphanumeric characters and underscores.");
        }
        if (name.contains("__")) {
            throw new TemplateCompileException("Using variable names with '__' is not allowed: '" + name + "'");
        }

        boolean fromValue = element.hasAttribute("t-value") || element.hasAttribute("t-valuef")
                || element.hasAttribute(VALUEF_TRANSLATE);
        if (fromValue || dict) {
            // 内容视为空
            element.removeAttribute("t-inner-content");
            if (slot) {
                throw new TemplateCompileException("t-set=\"0\" should not be set from t-value or t-valuef");
            }
        }

        if (element.hasAttribute("t-value")) {
            String source = element.removeAttribute("t-value");
            CompiledExpression expression = context.expression(source.isEmpty() ? "None" : source);
            code.add(new AssignInstruction(name, (execution, values) -> expression.evaluate(values)));
        } else if (element.hasAttribute("t-valuef") || element.hasAttribute(VALUEF_TRANSLATE)) {
            String source = element.hasAttribute("t-valuef")
                    ? element.removeAttribute("t-valuef")
                    : element.removeAttribute(VALUEF_TRANSLATE);
            FormatString format = context.format(source);
            code.add(new AssignInstruction(name, (execution, values) -> format.evaluate(values)));
        } else if (dict) {
            CompiledExpression expression = context.expression(name);
            code.add(new UpdateValuesInstruction((execution, values) -> expression.evaluate(values)));
        } else {
            SourceLocation location = context.getLocation();
            List<Instruction> content = new ArrayList<>(context.compileDirective(element, cursor, "inner-content"));
            content.addAll(context.text().flush());
            if (content.isEmpty()) {
                code.add(new AssignInstruction(name, (execution, values) -> ""));
            } else {
                String blockName = context.nextBlockName("t_set");
                context.addBlock(blockName, content);
                code.add(new AssignInstruction(name, (execution, values) -> new ContentValue(execution.getSession(),
                        new CallParameters(Collections.emptyMap(), execution.getTemplate(), blockName,
                                new LinkedHashMap<>(values), ScopeMode.ROOT, "t-set", location))));
            }
        }
        return code;
    }

    public static List<Instruction> compileValue(XmlElement element, DirectiveCursor cursor, CompileContext context) {
        throw new TemplateCompileException("t-value must be on the same node of t-set");
    }

    public static List<Instruction> compileValuef(XmlElement element, DirectiveCursor cursor, CompileContext context) {
        throw new TemplateCompileException("t-valuef must be on the same node of t-set");
    }
}
