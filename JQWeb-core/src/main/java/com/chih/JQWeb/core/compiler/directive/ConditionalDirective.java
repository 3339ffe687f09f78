package com.chih.JQWeb.core.compiler.directive;

import com.chih.JQWeb.core.compiler.CompileContext;
import com.chih.JQWeb.core.compiler.DirectiveCursor;
import com.chih.JQWeb.core.compiler.QWebSyntax;
import com.chih.JQWeb.core.compiler.instruction.ConditionalInstruction;
import com.chih.JQWeb.core.compiler.instruction.Instruction;
import com.chih.JQWeb.core.exception.TemplateCompileException;
import com.chih.JQWeb.core.expr.CompiledExpression;
import com.chih.JQWeb.core.xml.XmlComment;
import com.chih.JQWeb.core.xml.XmlElement;
import com.chih.JQWeb.core.xml.XmlNode;
import com.chih.JQWeb.core.xml.XmlProcessingInstruction;
import com.chih.JQWeb.core.xml.XmlText;

import java.util.ArrayList;
import java.util.List;

/**
 * 条件类指令：t-if、t-elif、t-else、t-groups
 * <p>
 * t-if 编译时顺带编译紧随其后的 t-elif / t-else 兄弟节点作为 else 分支，
 * 并给该节点打上 {@code t-qweb-skip}，避免再次编译。
 * </p>
 *
 * @author lizhiyuan
 * @since 2026/10/06
 */
public final class ConditionalDirective {

    private ConditionalDirective() {
    }

    public static List<Instruction> compileIf(XmlElement element, DirectiveCursor cursor, CompileContext context) {
        String source = element.hasAttribute("t-if")
                ? element.removeAttribute("t-if")
                : element.removeAttribute("t-elif");
        if (source == null || source.trim().isEmpty()) {
            throw new TemplateCompileException("t-if or t-elif expression should not be empty.");
        }
        CompiledExpression condition = context.expression(source);

        String strip = context.text().rstrip();
        if ("t".equals(element.getTag()) && firstTextMatches(element)) {
            strip = "";
        }

        List<Instruction> code = context.text().flush();
        if (!strip.isEmpty()) {
            context.text().append(strip);
        }
        List<Instruction> then = new ArrayList<>(context.compileDirectives(element, cursor));
        then.addAll(context.text().flush(true));

        List<Instruction> otherwise = new ArrayList<>();
        List<XmlNode> between = new ArrayList<>();
        XmlNode next = element.getNextSibling();
        while (next instanceof XmlText || next instanceof XmlComment || next instanceof XmlProcessingInstruction) {
            between.add(next);
            next = next.getNextSibling();
        }
        if (next instanceof XmlElement
                && (((XmlElement) next).hasAttribute("t-else") || ((XmlElement) next).hasAttribute("t-elif"))) {
            XmlElement branch = (XmlElement) next;
            for (XmlNode node : between) {
                if (node instanceof XmlText && !((XmlText) node).isWhitespace()) {
                    throw new TemplateCompileException(
                            "Unexpected non-whitespace characters between t-if and t-else directives");
                }
            }
            for (XmlNode node : between) {
                node.detach();
            }
            branch.setAttribute("t-else-valid", "True");
            if (!strip.isEmpty()) {
                context.text().append(strip);
            }
            otherwise.addAll(context.compileNode(branch));
            otherwise.addAll(context.text().flush(true));
            branch.setAttribute("t-qweb-skip", "True");
        }

        code.add(new ConditionalInstruction((execution, values) -> condition.evaluate(values), then, otherwise));
        return code;
    }

    public static List<Instruction> compileElif(XmlElement element, DirectiveCursor cursor, CompileContext context) {
        if (element.removeAttribute("t-else-valid") == null) {
            throw new TemplateCompileException("t-elif directive must be preceded by t-if or t-elif directive");
        }
        return compileIf(element, cursor, context);
    }

    public static List<Instruction> compileElse(XmlElement element, DirectiveCursor cursor, CompileContext context) {
        if (element.removeAttribute("t-else-valid") == null) {
            throw new TemplateCompileException("t-else directive must be preceded by t-if or t-elif directive");
        }
        element.removeAttribute("t-else");
        return new ArrayList<>();
    }

    /**
     * t-groups / groups：由 {@code AccessChecker} 判断当前用户是否属于这些组
     */
    public static List<Instruction> compileGroups(XmlElement element, DirectiveCursor cursor, CompileContext context) {
        String groups = element.hasAttribute("t-groups")
                ? element.removeAttribute("t-groups")
                : element.removeAttribute("groups");

        String strip = context.text().rstrip();
        List<Instruction> code = context.text().flush();
        if (!"t".equals(element.getTag()) && !strip.isEmpty()) {
            context.text().append(strip);
        }
        List<Instruction> body = new ArrayList<>(context.compileDirectives(element, cursor));
        body.addAll(context.text().flush(true));

        code.add(new ConditionalInstruction(
                (execution, values) -> execution.getSession().getAccessChecker().hasGroups(groups, values),
                body, new ArrayList<>()));
        return code;
    }

    private static boolean firstTextMatches(XmlElement element) {
        XmlNode first = element.getFirstChild();
        return first instanceof XmlText && QWebSyntax.LSTRIP.matcher(((XmlText) first).getText()).find();
    }
}
