package com.chih.JQWeb.core.render;

import com.chih.JQWeb.core.engine.CompiledTemplate;
import com.chih.JQWeb.core.engine.TemplateOptions;

import java.util.Iterator;
import java.util.Map;

/**
 * 渲染栈中的一帧
 *
 * @param params   进入本帧的调用参数
 * @param iterator 本帧的输出项（文本、{@link CallParameters}、{@link ContentValue}）
 * @param values   本帧的绑定
 * @param options  本帧模板的编译选项
 * @param template 本帧的编译产物，引导帧为 null
 *
 * @author lizhiyuan
 * @since 2026/10/09
 */
public record StackFrame(CallParameters params, Iterator<Object> iterator, Map<String, Object> values,
                         TemplateOptions options, CompiledTemplate template) {

    @Override
    public String toString() {
        return "StackFrame{" + params + "}";
    }
}
