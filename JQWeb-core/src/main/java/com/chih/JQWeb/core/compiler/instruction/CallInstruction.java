package com.chih.JQWeb.core.compiler.instruction;

import com.chih.JQWeb.core.compiler.QWebSyntax;
import com.chih.JQWeb.core.exception.SourceLocation;
import com.chih.JQWeb.core.render.BlockExecution;
import com.chih.JQWeb.core.render.CallParameters;
import com.chih.JQWeb.core.render.ContentValue;
import com.chih.JQWeb.core.render.ScopeMode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * t-call：组装调用参数并交给栈机压栈
 * <p>
 * 元素内容编译为独立的块，以 {@link ContentValue} 形式放进被调模板的 "0"。
 * 旧写法（内容里只有 t-set）会先渲染内容，把其中新设置的变量作为调用参数。
 * </p>
 *
 * @author lizhiyuan
 * @since 2026/10/06
 */
public final class CallInstruction implements Instruction {

    private final Evaluation target;

    private final String contentBlock;

    private final boolean legacy;

    private final List<ArgumentSource> arguments;

    private final SourceLocation location;

    /**
     * @param target       目标模板引用
     * @param contentBlock 元素内容块名，没有内容时为 null
     * @param legacy       是否旧写法
     * @param arguments    参数来源，按顺序合并
     */
    public CallInstruction(Evaluation target, String contentBlock, boolean legacy,
                           List<ArgumentSource> arguments, SourceLocation location) {
        this.target = target;
        this.contentBlock = contentBlock;
        this.legacy = legacy;
        this.arguments = arguments;
        this.location = location;
    }

    @Override
    @SuppressWarnings("unchecked")
    public void execute(BlockExecution execution, Map<String, Object> values) {
        Object rawOptions = values.remove(QWebSyntax.OPTIONS_KEY);
        Map<String, Object> options = rawOptions instanceof Map
                ? (Map<String, Object>) rawOptions
                : Collections.emptyMap();

        Map<String, Object> callValues = new LinkedHashMap<>();
        if (contentBlock != null) {
            Map<String, Object> contentValues = new LinkedHashMap<>(values);
            ContentValue content = new ContentValue(execution.getSession(), new CallParameters(
                    Collections.emptyMap(), execution.getTemplate(), contentBlock, contentValues,
                    ScopeMode.ROOT, "inner-content", location));
            callValues.put(QWebSyntax.SLOT_KEY, content);
            if (legacy) {
                content.toString();
                for (Map.Entry<String, Object> entry : contentValues.entrySet()) {
                    String key = entry.getKey();
                    if (QWebSyntax.SLOT_KEY.equals(key) || QWebSyntax.ATTRIBUTES_KEY.equals(key)) {
                        continue;
                    }
                    if (entry.getValue() != values.get(key)) {
                        callValues.put(key, entry.getValue());
                    }
                }
            }
        } else {
            callValues.put(QWebSyntax.SLOT_KEY, "");
        }

        for (ArgumentSource argument : arguments) {
            argument.contribute(callValues, execution, values);
        }

        Object reference = target.evaluate(execution, values);
        execution.emit(new CallParameters(options, reference, null, callValues, ScopeMode.COPY, "t-call", location),
                values);
    }

    /**
     * 一个调用参数来源：t-call 元素上的普通属性、{@code .f} 格式属性或 t-args
     */
    @FunctionalInterface
    public interface ArgumentSource {

        void contribute(Map<String, Object> callValues, BlockExecution execution, Map<String, Object> values);
    }
}
