package com.chih.JQWeb.core.engine;

/**
 * 编译缓存键：模板引用 + 选项快照
 *
 * @param reference 模板名称（String）或数字 id（Integer）
 *
 * @author lizhiyuan
 * @since 2026/10/11
 */
public record TemplateCacheKey(Object reference, TemplateOptions options) {
}
