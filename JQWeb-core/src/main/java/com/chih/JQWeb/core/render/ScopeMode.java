package com.chih.JQWeb.core.render;

/**
 * 进入新栈帧时绑定的作用域方式
 *
 * @author lizhiyuan
 * @since 2026/10/09
 */
public enum ScopeMode {
    /** 直接共享调用方的绑定 */
    NONE,
    /** 调用方绑定的副本 */
    COPY,
    /** 渲染入口绑定的副本 */
    ROOT
}
