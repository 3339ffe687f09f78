package com.chih.JQWeb.core.render;

import com.chih.JQWeb.core.engine.CompiledTemplate;
import com.chih.JQWeb.core.engine.TemplateOptions;

/**
 * 按引用与选项取得编译产物（缓存或现场编译），由引擎提供
 *
 * @author lizhiyuan
 * @since 2026/10/09
 */
@FunctionalInterface
public interface TemplateResolver {

    /**
     * @return 永不为 null；不存在或编译失败时返回延迟报错的哨兵产物
     */
    CompiledTemplate resolve(Object reference, TemplateOptions options);
}
