package com.chih.JQWeb.core.compiler;

import com.chih.JQWeb.core.compiler.instruction.Instruction;
import com.chih.JQWeb.core.compiler.instruction.LocationInstruction;
import com.chih.JQWeb.core.compiler.instruction.TraceInstruction;
import com.chih.JQWeb.core.exception.SourceLocation;
import com.chih.JQWeb.core.exception.TemplateCompileException;
import com.chih.JQWeb.core.expr.PyOps;
import com.chih.JQWeb.core.render.Markup;
import com.chih.JQWeb.core.xml.XmlElement;
import com.chih.JQWeb.core.xml.XmlNode;
import com.chih.JQWeb.core.xml.XmlText;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 指令编译器
 * <p>
 * 遍历模板树，按 {@link DirectiveTable} 的固定顺序调用各指令的编译器，
 * 生成中间指令序列。没有 t-* 属性的元素走静态快速路径，直接输出字面标记。
 * </p>
 *
 * @author lizhiyuan
 * @since 2026/10/05
 */
public class DirectiveCompiler {

    private static final Logger log = LoggerFactory.getLogger(DirectiveCompiler.class);

    /** profile 模式下不单独计时的技术指令 */
    private static final Set<String> UNTRACED = Set.of("inner-content", "tag-open", "tag-close");

    private final DirectiveTable table;

    public DirectiveCompiler() {
        this(DirectiveTable.standard());
    }

    public DirectiveCompiler(DirectiveTable table) {
        this.table = table;
    }

    /**
     * 编译模板根元素，结果即模板的内容块
     */
    public List<Instruction> compileRoot(XmlElement root, CompileContext context) {
        XmlNode first = root.getFirstChild();
        if (first instanceof XmlText) {
            XmlText text = (XmlText) first;
            text.setText(QWebSyntax.FIRST_RSTRIP.matcher(text.getText()).replaceFirst("$2"));
        }
        List<Instruction> code = new ArrayList<>(compileNode(root, context));
        code.addAll(context.text().flush(true));
        return code;
    }

    public List<Instruction> compileNode(XmlElement element, CompileContext context) {
        // 已由前一个 t-if 编译的 t-else / t-elif
        if (element.hasAttribute("t-qweb-skip")) {
            return new ArrayList<>();
        }
        if (isStaticNode(element)) {
            return compileStaticNode(element, context);
        }

        SourceLocation location = new SourceLocation(context.getReference(), element.getPath(), element.toStartTag());
        context.setLocation(location);
        List<Instruction> body = new ArrayList<>();
        body.add(new LocationInstruction(location));

        // 旧名称 t-call-options
        if (element.hasAttribute("t-call-options") && !element.hasAttribute("t-options")) {
            element.setAttribute("t-options", element.removeAttribute("t-call-options"));
        }
        String tag = element.getTag();
        if (!"t".equals(tag)) {
            element.setAttribute("t-tag-open", tag);
            if (!QWebSyntax.VOID_ELEMENTS.contains(tag)) {
                element.setAttribute("t-tag-close", tag);
            }
        }
        if (!element.hasAttribute("t-out") && !element.hasAttribute("t-esc")
                && !element.hasAttribute("t-raw") && !element.hasAttribute("t-field")) {
            element.setAttribute("t-inner-content", "True");
        }

        try {
            body.addAll(compileDirectives(element, table.cursor(), context));
        } catch (TemplateCompileException e) {
            if (e.getLocation() != null) {
                throw e;
            }
            throw new TemplateCompileException(e.getRawMessage(), location, e);
        } catch (RuntimeException e) {
            throw new TemplateCompileException(e.getClass().getSimpleName() + ": " + e.getMessage(), location, e);
        }
        return body;
    }

    public List<Instruction> compileDirectives(XmlElement element, DirectiveCursor cursor, CompileContext context) {
        if (isStaticNode(element)) {
            element.removeAttribute("t-tag-open");
            element.removeAttribute("t-inner-content");
            element.removeAttribute("t-tag-close");
            return compileStaticNode(element, context);
        }

        List<Instruction> code = new ArrayList<>();
        while (cursor.hasNext()) {
            String directive = cursor.next();
            if (element.hasAttribute("t-" + directive)) {
                code.addAll(compileDirective(element, cursor, context, directive));
            } else if ("groups".equals(directive)) {
                if (element.hasAttribute("groups")) {
                    code.addAll(compileDirective(element, cursor, context, directive));
                }
            } else if ("att".equals(directive)) {
                code.addAll(compileDirective(element, cursor, context, directive));
            } else if ("options".equals(directive)) {
                if (hasAttributeWithPrefix(element, "t-options-")) {
                    code.addAll(compileDirective(element, cursor, context, directive));
                }
            }
        }

        // 顺序表之外的指令（t-value 脱离 t-set 等）在这里报错
        for (String name : element.attributeNames()) {
            if (!element.hasAttribute(name) || !name.startsWith("t-") || QWebSyntax.SPECIAL_DIRECTIVES.contains(name)) {
                continue;
            }
            String directive = name.substring(2);
            if (table.has(directive)) {
                code.addAll(compileDirective(element, cursor, context, directive));
            }
        }

        Set<String> remaining = new LinkedHashSet<>(element.attributeNames());
        remaining.removeAll(QWebSyntax.SPECIAL_DIRECTIVES);
        if (!remaining.isEmpty()) {
            log.warn("Unknown directives or unused attributes: {} in {}", remaining, context.getName());
        }
        return code;
    }

    public List<Instruction> compileDirective(XmlElement element, DirectiveCursor cursor, CompileContext context,
                                              String directive) {
        List<Instruction> code = table.get(directive).compile(element, cursor, context);
        if (context.isProfile() && !UNTRACED.contains(directive) && !code.isEmpty()) {
            String path = context.getLocation() == null ? null : context.getLocation().path();
            return new ArrayList<>(Collections.singletonList(new TraceInstruction("t-" + directive, path, code)));
        }
        return code;
    }

    /**
     * 没有 t-* 指令（技术指令 t-tag-open、t-inner-content 除外）且不是 {@code <t>} 的元素
     */
    public static boolean isStaticNode(XmlElement element) {
        if ("t".equals(element.getTag()) || element.hasAttribute("groups")) {
            return false;
        }
        for (String name : element.attributeNames()) {
            if (name.startsWith("t-") && !"t-tag-open".equals(name) && !"t-inner-content".equals(name)) {
                return false;
            }
        }
        return true;
    }

    private List<Instruction> compileStaticNode(XmlElement element, CompileContext context) {
        String tag = element.getTag();
        boolean isVoid = QWebSyntax.VOID_ELEMENTS.contains(tag);

        Map<String, Object> attributes = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : element.getAttributes().entrySet()) {
            attributes.put(QWebSyntax.stripTranslate(entry.getKey()), entry.getValue());
        }
        QWebSyntax.sanitizeAttributes(attributes);

        StringBuilder open = new StringBuilder("<").append(tag);
        for (Map.Entry<String, Object> entry : attributes.entrySet()) {
            Object value = entry.getValue();
            if (PyOps.truthy(value) || value instanceof CharSequence) {
                open.append(' ').append(entry.getKey()).append("=\"")
                        .append(Markup.escapeText(PyOps.str(value))).append('"');
            }
        }
        open.append(isVoid ? "/>" : ">");
        context.text().append(open.toString());
        element.clearAttributes();

        List<Instruction> body = compileDirective(element, null, context, "inner-content");
        if (!isVoid) {
            context.text().append("</" + tag + ">");
        }
        return body;
    }

    private static boolean hasAttributeWithPrefix(XmlElement element, String prefix) {
        for (String name : element.attributeNames()) {
            if (name.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }
}
