package com.chih.JQWeb.core.impl;

import com.chih.JQWeb.core.domain.TemplateDefinition;
import com.chih.JQWeb.core.spi.TemplateChangeEvent;
import com.chih.JQWeb.core.spi.TemplateSource;
import com.chih.JQWeb.core.support.TemplateParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * 内存模板源
 * <p>
 * 模板按注册顺序分配从 1 开始的数字 id，既可以按名称也可以按 id 引用。
 * 可选的 loader 函数用于"无存储"渲染：本地找不到时交给调用方按引用提供 XML。
 * </p>
 * <pre>{@code
 * InMemoryTemplateSource source = new InMemoryTemplateSource()
 *         .add("A", "<t t-name=\"A\"><t t-call=\"B\"><p>slot</p></t></t>")
 *         .add("B", "<t t-name=\"B\">before-<t t-out=\"0\"/>-after</t>");
 * }</pre>
 *
 * @author lizhiyuan
 * @since 2026/10/14
 */
public class InMemoryTemplateSource implements TemplateSource {

    private static final Logger log = LoggerFactory.getLogger(InMemoryTemplateSource.class);

    private final Map<String, TemplateDefinition> templates = Collections.synchronizedMap(new LinkedHashMap<>());

    private final AtomicInteger sequence = new AtomicInteger();

    private final Function<Object, String> loader;

    private volatile Consumer<TemplateChangeEvent> changeListener;

    public InMemoryTemplateSource() {
        this(null);
    }

    /**
     * @param loader 按引用返回模板 XML，找不到时返回 null
     */
    public InMemoryTemplateSource(Function<Object, String> loader) {
        this.loader = loader;
    }

    /**
     * 注册或替换模板
     *
     * @param name 模板名称；XML 根元素没有 t-name 时以此为准
     * @param xml  单个元素的模板源码
     */
    public InMemoryTemplateSource add(String name, String xml) {
        TemplateDefinition definition = new TemplateDefinition(name, TemplateParser.parseElement(xml));
        TemplateDefinition previous = templates.get(name);
        Integer id = previous != null ? previous.getId() : sequence.incrementAndGet();
        definition = definition.withId(id);
        templates.put(name, definition);
        log.debug("Registered in-memory template '{}' (id={})", name, id);
        fire(new TemplateChangeEvent(Collections.singletonMap(name, definition), null));
        return this;
    }

    /**
     * 一次注册文档中的全部模板（{@code <templates>} 包裹的多个 {@code t-name}）
     */
    public InMemoryTemplateSource addDocument(String xml) {
        Map<String, TemplateDefinition> parsed = TemplateParser.parse(xml, "memory");
        Map<String, TemplateDefinition> updated = new LinkedHashMap<>();
        for (TemplateDefinition definition : parsed.values()) {
            TemplateDefinition previous = templates.get(definition.getName());
            Integer id = previous != null ? previous.getId() : sequence.incrementAndGet();
            TemplateDefinition withId = definition.withId(id);
            templates.put(definition.getName(), withId);
            updated.put(definition.getName(), withId);
        }
        fire(new TemplateChangeEvent(updated, null));
        return this;
    }

    public boolean remove(String name) {
        if (templates.remove(name) == null) {
            return false;
        }
        fire(new TemplateChangeEvent(null, Collections.singleton(name)));
        return true;
    }

    /**
     * @return 模板 id，未注册时返回 null
     */
    public Integer idOf(String name) {
        TemplateDefinition definition = templates.get(name);
        return definition == null ? null : definition.getId();
    }

    @Override
    public Map<String, TemplateDefinition> loadAll() {
        synchronized (templates) {
            return new LinkedHashMap<>(templates);
        }
    }

    @Override
    public TemplateDefinition load(Object reference) {
        TemplateDefinition definition = TemplateSource.super.load(reference);
        if (definition != null || loader == null) {
            return definition;
        }
        String xml = loader.apply(reference);
        if (xml == null) {
            return null;
        }
        String name = String.valueOf(reference);
        return new TemplateDefinition(reference instanceof Integer ? (Integer) reference : null,
                name, TemplateParser.parseElement(xml), null, null, "loader");
    }

    @Override
    public void onChange(Consumer<TemplateChangeEvent> listener) {
        this.changeListener = listener;
    }

    private void fire(TemplateChangeEvent event) {
        Consumer<TemplateChangeEvent> listener = changeListener;
        if (listener != null && !event.isEmpty()) {
            listener.accept(event);
        }
    }
}
