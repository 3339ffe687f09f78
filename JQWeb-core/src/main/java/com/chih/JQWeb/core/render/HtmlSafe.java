package com.chih.JQWeb.core.render;

/**
 * 已是安全标记文本、输出时不再转义的值
 *
 * @author lizhiyuan
 * @since 2026/10/09
 */
public interface HtmlSafe {

    String toHtml();
}
