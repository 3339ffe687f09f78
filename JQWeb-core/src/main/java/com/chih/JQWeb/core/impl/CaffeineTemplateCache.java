package com.chih.JQWeb.core.impl;

import com.chih.JQWeb.core.engine.CompiledTemplate;
import com.chih.JQWeb.core.engine.TemplateCacheKey;
import com.chih.JQWeb.core.spi.TemplateCache;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

/**
 * 基于 Caffeine 的编译产物缓存
 *
 * @author lizhiyuan
 * @since 2026/10/14
 */
public class CaffeineTemplateCache implements TemplateCache {

    public static final long DEFAULT_MAXIMUM_SIZE = 10_000;

    private final Cache<TemplateCacheKey, CompiledTemplate> cache;

    public CaffeineTemplateCache() {
        this(DEFAULT_MAXIMUM_SIZE);
    }

    public CaffeineTemplateCache(long maximumSize) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .recordStats()
                .build();
    }

    @Override
    public CompiledTemplate get(TemplateCacheKey key) {
        return cache.getIfPresent(key);
    }

    @Override
    public void put(TemplateCacheKey key, CompiledTemplate template) {
        // 同一 key 并发编译时保留先写入者
        cache.asMap().putIfAbsent(key, template);
    }

    @Override
    public void clear() {
        cache.invalidateAll();
    }

    @Override
    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    public double hitRate() {
        return cache.stats().hitRate();
    }
}
