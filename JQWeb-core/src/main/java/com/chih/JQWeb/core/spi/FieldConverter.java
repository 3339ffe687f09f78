package com.chih.JQWeb.core.spi;

import java.util.Map;

/**
 * 字段 / 部件值到标记的转换 (SPI)，供 {@code t-field} 与带选项的 {@code t-out} 使用
 *
 * @author lizhiyuan
 * @since 2026/10/13
 */
public interface FieldConverter {

    /**
     * 渲染记录上的字段
     *
     * @param record  记录对象
     * @param field   字段名
     * @param options 合并后的选项（含 tagName、expression、type 等）
     * @param values  当前绑定
     */
    FieldRendering recordToHtml(Object record, String field, Map<String, Object> options, Map<String, Object> values);

    /**
     * 按部件（widget）渲染任意值
     */
    FieldRendering valueToHtml(Object value, Map<String, Object> options, Map<String, Object> values);

    /**
     * 转换结果
     *
     * @param attributes   要合并到元素上的属性
     * @param content      内容；null 或 false 时输出元素的默认内容
     * @param forceDisplay 内容为空时仍输出元素标签
     */
    record FieldRendering(Map<String, Object> attributes, Object content, boolean forceDisplay) {
    }
}
