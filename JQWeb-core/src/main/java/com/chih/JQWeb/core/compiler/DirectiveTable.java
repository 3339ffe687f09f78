package com.chih.JQWeb.core.compiler;

import com.chih.JQWeb.core.compiler.directive.AssetsDirective;
import com.chih.JQWeb.core.compiler.directive.AttributeDirective;
import com.chih.JQWeb.core.compiler.directive.CallDirective;
import com.chih.JQWeb.core.compiler.directive.ConditionalDirective;
import com.chih.JQWeb.core.compiler.directive.ContentDirective;
import com.chih.JQWeb.core.compiler.directive.DebugDirective;
import com.chih.JQWeb.core.compiler.directive.ForeachDirective;
import com.chih.JQWeb.core.compiler.directive.OptionsDirective;
import com.chih.JQWeb.core.compiler.directive.OutputDirective;
import com.chih.JQWeb.core.compiler.directive.SetDirective;
import com.chih.JQWeb.core.compiler.directive.TagDirective;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 指令名到编译器的固定映射，外加同一元素上的求值顺序
 *
 * @author lizhiyuan
 * @since 2026/10/05
 */
public final class DirectiveTable {

    private final List<String> order;

    private final Map<String, DirectiveHandler> handlers;

    private DirectiveTable(List<String> order, Map<String, DirectiveHandler> handlers) {
        this.order = Collections.unmodifiableList(new ArrayList<>(order));
        this.handlers = Collections.unmodifiableMap(new HashMap<>(handlers));
    }

    /**
     * 标准指令集
     * <p>
     * 顺序：elif / else 最先（由前一个 t-if 编译），接着 debug、groups、as、foreach、if、
     * call-assets、lang、options、call、att、field / esc / raw / out、tag-open、set、
     * inner-content、tag-close。value、valuef、consumed-options 不在顺序表里，
     * 残留时在无序阶段报错。
     */
    public static DirectiveTable standard() {
        Map<String, DirectiveHandler> handlers = new HashMap<>();
        handlers.put("elif", ConditionalDirective::compileElif);
        handlers.put("else", ConditionalDirective::compileElse);
        handlers.put("debug", DebugDirective::compile);
        handlers.put("groups", ConditionalDirective::compileGroups);
        handlers.put("as", ForeachDirective::compileAs);
        handlers.put("foreach", ForeachDirective::compile);
        handlers.put("if", ConditionalDirective::compileIf);
        handlers.put("call-assets", AssetsDirective::compile);
        handlers.put("lang", CallDirective::compileLang);
        handlers.put("options", OptionsDirective::compile);
        handlers.put("call", CallDirective::compile);
        handlers.put("att", AttributeDirective::compile);
        handlers.put("field", OutputDirective::compileField);
        handlers.put("esc", OutputDirective::compileEsc);
        handlers.put("raw", OutputDirective::compileRaw);
        handlers.put("out", OutputDirective::compile);
        handlers.put("tag-open", TagDirective::compileOpen);
        handlers.put("set", SetDirective::compile);
        handlers.put("inner-content", ContentDirective::compile);
        handlers.put("tag-close", TagDirective::compileClose);
        handlers.put("value", SetDirective::compileValue);
        handlers.put("valuef", SetDirective::compileValuef);
        handlers.put("consumed-options", OptionsDirective::compileConsumed);

        List<String> order = List.of(
                "elif", "else", "debug", "groups", "as", "foreach", "if", "call-assets", "lang",
                "options", "call", "att", "field", "esc", "raw", "out", "tag-open", "set",
                "inner-content", "tag-close");
        return new DirectiveTable(order, handlers);
    }

    public List<String> getOrder() {
        return order;
    }

    public DirectiveHandler get(String directive) {
        DirectiveHandler handler = handlers.get(directive);
        if (handler == null) {
            throw new IllegalArgumentException("No handler for directive t-" + directive);
        }
        return handler;
    }

    public boolean has(String directive) {
        return handlers.containsKey(directive);
    }

    public DirectiveCursor cursor() {
        return new DirectiveCursor(order);
    }
}
