package com.chih.JQWeb.core.compiler.directive;

import com.chih.JQWeb.core.compiler.CompileContext;
import com.chih.JQWeb.core.compiler.DirectiveCursor;
import com.chih.JQWeb.core.compiler.instruction.DebugInstruction;
import com.chih.JQWeb.core.compiler.instruction.Instruction;
import com.chih.JQWeb.core.xml.XmlElement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * t-debug：仅在 qweb 开发模式下生效
 *
 * @author lizhiyuan
 * @since 2026/10/06
 */
public final class DebugDirective {

    private static final Logger log = LoggerFactory.getLogger(DebugDirective.class);

    private DebugDirective() {
    }

    public static List<Instruction> compile(XmlElement element, DirectiveCursor cursor, CompileContext context) {
        element.removeAttribute("t-debug");
        if (!context.isDevMode("qweb")) {
            log.warn("@t-debug in template is only available in qweb dev mode");
            return new ArrayList<>();
        }
        List<Instruction> code = context.text().flush();
        String path = context.getLocation() == null ? element.getPath() : context.getLocation().path();
        code.add(new DebugInstruction(path));
        return code;
    }
}
