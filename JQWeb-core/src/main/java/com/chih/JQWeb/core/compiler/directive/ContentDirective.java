package com.chih.JQWeb.core.compiler.directive;

import com.chih.JQWeb.core.compiler.CompileContext;
import com.chih.JQWeb.core.compiler.DirectiveCursor;
import com.chih.JQWeb.core.compiler.instruction.Instruction;
import com.chih.JQWeb.core.render.Markup;
import com.chih.JQWeb.core.xml.XmlComment;
import com.chih.JQWeb.core.xml.XmlElement;
import com.chih.JQWeb.core.xml.XmlNode;
import com.chih.JQWeb.core.xml.XmlProcessingInstruction;
import com.chih.JQWeb.core.xml.XmlText;

import java.util.ArrayList;
import java.util.List;

/**
 * 技术指令 t-inner-content：依次编译子节点
 *
 * @author lizhiyuan
 * @since 2026/10/06
 */
public final class ContentDirective {

    private ContentDirective() {
    }

    public static List<Instruction> compile(XmlElement element, DirectiveCursor cursor, CompileContext context) {
        element.removeAttribute("t-inner-content");
        List<Instruction> code = new ArrayList<>();
        // 编译 t-if 时会移除后面的注释与空白，遍历快照并跳过已脱离的节点
        for (XmlNode child : new ArrayList<>(element.getChildren())) {
            if (child.getParent() != element) {
                continue;
            }
            if (child instanceof XmlText) {
                context.text().append(Markup.escapeContent(((XmlText) child).getText()));
            } else if (child instanceof XmlElement) {
                code.addAll(context.compileNode((XmlElement) child));
            } else if (child instanceof XmlComment) {
                if (context.isPreserveComments()) {
                    context.text().append("<!--" + ((XmlComment) child).getText() + "-->");
                }
            } else if (child instanceof XmlProcessingInstruction) {
                if (context.isPreserveComments()) {
                    XmlProcessingInstruction pi = (XmlProcessingInstruction) child;
                    context.text().append("<?" + pi.getTarget() + " " + pi.getData() + "?>");
                }
            }
        }
        return code;
    }
}
