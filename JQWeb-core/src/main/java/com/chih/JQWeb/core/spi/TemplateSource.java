package com.chih.JQWeb.core.spi;

import com.chih.JQWeb.core.domain.TemplateDefinition;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Consumer;

/**
 * 模板来源接口 (SPI)
 * <p>
 * 负责存储与继承合并，向引擎提供已解析的 XML 元素。实现类可以是文件、classpath、数据库等。
 * </p>
 *
 * @author lizhiyuan
 * @since 2026/10/13
 */
public interface TemplateSource extends AutoCloseable {

    /**
     * 加载所有模板定义
     *
     * @return key 为模板名称
     */
    Map<String, TemplateDefinition> loadAll();

    /**
     * 注册变更监听；源数据变化时实现类需要主动回调
     */
    void onChange(Consumer<TemplateChangeEvent> listener);

    /**
     * 按引用加载单个模板
     *
     * @param reference 模板名称或数字 id
     * @return 不存在时返回 null
     */
    default TemplateDefinition load(Object reference) {
        if (reference instanceof Integer) {
            for (TemplateDefinition definition : loadAll().values()) {
                if (reference.equals(definition.getId())) {
                    return definition;
                }
            }
            return null;
        }
        return loadAll().get(String.valueOf(reference));
    }

    /**
     * 批量加载，供编译前的预加载使用
     *
     * @return 只包含找到的引用
     */
    default Map<Object, TemplateDefinition> resolveAll(Collection<?> references) {
        Map<Object, TemplateDefinition> found = new LinkedHashMap<>();
        for (Object reference : references) {
            TemplateDefinition definition = load(reference);
            if (definition != null) {
                found.put(reference, definition);
            }
        }
        return found;
    }

    /**
     * 关闭资源（如线程池、WatchService）
     */
    @Override
    default void close() throws Exception {
        // Default no-op
    }
}
