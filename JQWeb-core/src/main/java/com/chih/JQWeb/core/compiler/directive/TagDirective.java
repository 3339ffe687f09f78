package com.chih.JQWeb.core.compiler.directive;

import com.chih.JQWeb.core.compiler.CompileContext;
import com.chih.JQWeb.core.compiler.DirectiveCursor;
import com.chih.JQWeb.core.compiler.instruction.DynamicAttributesInstruction;
import com.chih.JQWeb.core.compiler.instruction.Instruction;
import com.chih.JQWeb.core.xml.XmlElement;

import java.util.ArrayList;
import java.util.List;

/**
 * 技术指令 t-tag-open / t-tag-close，由节点编译时自动添加
 *
 * @author lizhiyuan
 * @since 2026/10/06
 */
public final class TagDirective {

    private static final DynamicAttributesInstruction ATTRIBUTES = new DynamicAttributesInstruction();

    private TagDirective() {
    }

    public static List<Instruction> compileOpen(XmlElement element, DirectiveCursor cursor, CompileContext context) {
        String tag = element.removeAttribute("t-tag-open");
        if (tag == null || tag.isEmpty()) {
            return new ArrayList<>();
        }
        context.text().append("<" + tag);
        List<Instruction> code = context.text().flush();
        code.add(ATTRIBUTES);
        context.text().append(element.hasAttribute("t-tag-close") ? ">" : "/>");
        return code;
    }

    public static List<Instruction> compileClose(XmlElement element, DirectiveCursor cursor, CompileContext context) {
        String tag = element.removeAttribute("t-tag-close");
        if (tag != null && !tag.isEmpty()) {
            context.text().append("</" + tag + ">");
        }
        return new ArrayList<>();
    }
}
