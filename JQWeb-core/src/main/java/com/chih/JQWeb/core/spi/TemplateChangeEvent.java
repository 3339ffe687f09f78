package com.chih.JQWeb.core.spi;

import com.chih.JQWeb.core.domain.TemplateDefinition;

import java.util.Collections;
import java.util.Map;
import java.util.Set;

/**
 * 模板变更事件
 * <p>
 * 引擎收到事件后整体清空编译缓存，不做按 key 的局部失效。
 *
 * @author lizhiyuan
 * @since 2026/10/13
 */
public class TemplateChangeEvent {
    // 新增或修改的模板
    private final Map<String, TemplateDefinition> updated;
    // 被删除的模板名称
    private final Set<String> removed;

    public TemplateChangeEvent(Map<String, TemplateDefinition> updated, Set<String> removed) {
        this.updated = (updated != null) ? updated : Collections.emptyMap();
        this.removed = (removed != null) ? removed : Collections.emptySet();
    }

    public Map<String, TemplateDefinition> getUpdated() {
        return updated;
    }

    public Set<String> getRemoved() {
        return removed;
    }

    public boolean isEmpty() {
        return updated.isEmpty() && removed.isEmpty();
    }
}
