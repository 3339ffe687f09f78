package com.chih.JQWeb.core.spi;

import java.util.List;
import java.util.Map;

/**
 * 资源包链接生成 (SPI)，供 {@code t-call-assets} 使用
 *
 * @author lizhiyuan
 * @since 2026/10/13
 */
public interface AssetLinkProvider {

    /**
     * @param bundle 资源包名
     * @param css    是否包含样式
     * @param js     是否包含脚本
     * @param values 当前绑定
     * @return 资源 URL 列表，按 .js / .css / .xml 扩展名生成对应节点
     */
    List<String> getLinks(String bundle, boolean css, boolean js, Map<String, Object> values);

    static AssetLinkProvider none() {
        return (bundle, css, js, values) -> List.of();
    }
}
