package com.chih.JQWeb.core.spi;

import com.chih.JQWeb.core.engine.CompiledTemplate;
import com.chih.JQWeb.core.engine.TemplateCacheKey;

/**
 * 编译产物缓存 (SPI)
 * <p>
 * 条目写入后不可变；失效只能整体清空，避免新旧版本产物混用。
 *
 * @author lizhiyuan
 * @since 2026/10/13
 */
public interface TemplateCache {

    /**
     * @return 未命中时返回 null
     */
    CompiledTemplate get(TemplateCacheKey key);

    void put(TemplateCacheKey key, CompiledTemplate template);

    void clear();

    default long size() {
        return -1;
    }
}
