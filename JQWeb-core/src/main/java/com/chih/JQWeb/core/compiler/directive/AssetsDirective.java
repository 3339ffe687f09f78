package com.chih.JQWeb.core.compiler.directive;

import com.chih.JQWeb.core.compiler.CompileContext;
import com.chih.JQWeb.core.compiler.DirectiveCursor;
import com.chih.JQWeb.core.compiler.instruction.AssetsInstruction;
import com.chih.JQWeb.core.compiler.instruction.Instruction;
import com.chih.JQWeb.core.exception.TemplateCompileException;
import com.chih.JQWeb.core.xml.XmlElement;

import java.util.List;

/**
 * t-call-assets：引用资源包，各开关在编译期确定
 *
 * @author lizhiyuan
 * @since 2026/10/06
 */
public final class AssetsDirective {

    private AssetsDirective() {
    }

    public static List<Instruction> compile(XmlElement element, DirectiveCursor cursor, CompileContext context) {
        if (!element.getChildElements().isEmpty()) {
            throw new TemplateCompileException("t-call-assets cannot contain children nodes");
        }
        List<Instruction> code = context.text().flush();

        String bundle = element.removeAttribute("t-call-assets");
        boolean css = compileBool(element.removeAttribute("t-css"), true);
        boolean js = compileBool(element.removeAttribute("t-js"), true);
        boolean deferLoad = compileBool(element.removeAttribute("defer_load"), false);
        boolean lazyLoad = compileBool(element.removeAttribute("lazy_load"), false);
        String media = element.removeAttribute("media");
        // 链接由 AssetLinkProvider 生成，是否加前缀也由它决定
        element.removeAttribute("t-autoprefix");

        code.add(new AssetsInstruction(bundle, css, js, deferLoad, lazyLoad, media));
        return code;
    }

    /**
     * {@code true / 1} 与 {@code false / 0}，其余取默认值
     */
    static boolean compileBool(String value, boolean defaultValue) {
        if (value == null || value.isEmpty()) {
            return defaultValue;
        }
        String lower = value.toLowerCase();
        if ("false".equals(lower) || "0".equals(lower)) {
            return false;
        }
        if ("true".equals(lower) || "1".equals(lower)) {
            return true;
        }
        return defaultValue;
    }
}
