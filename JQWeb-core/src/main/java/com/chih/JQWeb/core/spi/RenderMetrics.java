package com.chih.JQWeb.core.spi;

/**
 * 监控指标 SPI 接口
 *
 * @author lizhiyuan
 * @since 2026/10/13
 */
public interface RenderMetrics {

    /**
     * 记录一次顶层渲染
     *
     * @param template   模板引用
     * @param durationNs 耗时 (纳秒)
     * @param success    是否成功
     */
    void recordRender(String template, long durationNs, boolean success);

    /**
     * 记录一次模板编译（缓存未命中）
     */
    default void recordCompile(String template, long durationNs, boolean success) {
    }

    /**
     * profile 模式下单个指令的执行耗时
     *
     * @param directive 指令名，如 {@code t-foreach}
     * @param path      节点路径
     */
    default void recordDirective(String template, String directive, String path, long durationNs) {
    }
}
