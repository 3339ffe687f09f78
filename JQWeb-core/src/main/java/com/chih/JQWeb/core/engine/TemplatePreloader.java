package com.chih.JQWeb.core.engine;

import com.chih.JQWeb.core.compiler.QWebSyntax;
import com.chih.JQWeb.core.domain.TemplateDefinition;
import com.chih.JQWeb.core.spi.TemplateSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

/**
 * 编译前的批量预加载
 * <p>
 * 从入口模板出发，按层收集静态 t-call 目标，每层通过一次
 * {@link TemplateSource#resolveAll} 取回定义。动态目标（格式化字符串）以及带
 * t-options / t-lang（改变编译选项）的调用不预加载，渲染时再按需解析。
 * </p>
 *
 * @author lizhiyuan
 * @since 2026/10/11
 */
public class TemplatePreloader {

    private static final Logger log = LoggerFactory.getLogger(TemplatePreloader.class);

    private final TemplateSource source;

    public TemplatePreloader(TemplateSource source) {
        this.source = source;
    }

    /**
     * @param reference 入口引用
     * @param skip      已有编译产物、无需再加载的引用
     * @return 引用到定义的映射，入口总在第一个；找不到的引用映射为 null
     */
    public Map<Object, TemplateDefinition> collect(Object reference, Predicate<Object> skip) {
        Map<Object, TemplateDefinition> result = new LinkedHashMap<>();
        Set<Object> seen = new HashSet<>();
        seen.add(reference);
        List<Object> batch = new ArrayList<>();
        batch.add(reference);

        int rounds = 0;
        while (!batch.isEmpty()) {
            rounds++;
            Map<Object, TemplateDefinition> found = source.resolveAll(batch);
            List<Object> next = new ArrayList<>();
            for (Object ref : batch) {
                TemplateDefinition definition = found.get(ref);
                result.put(ref, definition);
                if (definition == null) {
                    continue;
                }
                for (Object target : staticCallTargets(definition)) {
                    if (seen.add(target) && !skip.test(target)) {
                        next.add(target);
                    }
                }
            }
            batch = next;
        }
        log.debug("Preloaded {} templates for {} in {} rounds", result.size(), reference, rounds);
        return result;
    }

    /**
     * 定义中可在编译前确定的 t-call 目标
     */
    static Set<Object> staticCallTargets(TemplateDefinition definition) {
        Set<Object> targets = new LinkedHashSet<>();
        definition.getElement().forEachElement(element -> {
            String target = element.getAttribute("t-call");
            if (target == null || target.isEmpty()) {
                return;
            }
            if (element.hasAttribute("t-options") || element.hasAttribute("t-call-options")
                    || element.hasAttribute("t-lang")) {
                return;
            }
            for (String name : element.attributeNames()) {
                if (name.startsWith("t-options-")) {
                    return;
                }
            }
            if (target.contains("{") || target.contains("<") || target.contains("/")) {
                return;
            }
            targets.add(QWebSyntax.isDigits(target) ? (Object) Integer.valueOf(target) : target);
        });
        return targets;
    }
}
