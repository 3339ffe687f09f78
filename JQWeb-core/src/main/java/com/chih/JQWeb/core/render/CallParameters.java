package com.chih.JQWeb.core.render;

import com.chih.JQWeb.core.exception.SourceLocation;

import java.util.Map;

/**
 * 压入新栈帧的请求，由 t-call、t-set 内容块与 t-call 的内容槽产生
 *
 * @param options   t-call 上的 t-options，覆盖调用方的模板选项
 * @param template  目标模板引用（名称 / id），或同一编译产物 {@code CompiledTemplate}
 * @param block     要执行的块名，null 表示模板入口块
 * @param values    合并到新作用域的绑定
 * @param scope     作用域方式
 * @param directive 产生该调用的指令，如 {@code t-call}、{@code t-set}
 * @param location  调用位置，用于错误报告的调用链
 *
 * @author lizhiyuan
 * @since 2026/10/09
 */
public record CallParameters(Map<String, Object> options, Object template, String block,
                             Map<String, Object> values, ScopeMode scope, String directive,
                             SourceLocation location) {

    @Override
    public String toString() {
        return "CallParameters{template=" + template + ", block=" + block + ", scope=" + scope
                + ", directive=" + directive + ", location=" + location + "}";
    }
}
