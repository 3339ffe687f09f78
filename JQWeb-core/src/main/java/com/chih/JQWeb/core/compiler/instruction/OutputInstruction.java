package com.chih.JQWeb.core.compiler.instruction;

import com.chih.JQWeb.core.compiler.QWebSyntax;
import com.chih.JQWeb.core.render.BlockExecution;
import com.chih.JQWeb.core.render.ContentValue;
import com.chih.JQWeb.core.render.Markup;
import com.chih.JQWeb.core.spi.FieldConverter.FieldRendering;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * t-out / t-esc / t-raw / t-field 的输出
 * <p>
 * 内容非 None 且非 False 时输出开始标签、内容、结束标签；否则输出元素的默认内容；
 * 没有默认内容时，字段类输出按 forceDisplay 决定是否保留空标签。
 * </p>
 *
 * @author lizhiyuan
 * @since 2026/10/06
 */
public final class OutputInstruction implements Instruction {

    private final Evaluation content;

    private final List<Instruction> tagOpen;

    private final List<Instruction> tagClose;

    private final List<Instruction> defaultBody;

    private final boolean forceDisplayDependent;

    /**
     * @param content               内容求值；字段 / 部件类返回 {@link FieldRendering}
     * @param forceDisplayDependent 内容为空时是否参考 forceDisplay
     */
    public OutputInstruction(Evaluation content, List<Instruction> tagOpen, List<Instruction> tagClose,
                             List<Instruction> defaultBody, boolean forceDisplayDependent) {
        this.content = content;
        this.tagOpen = tagOpen;
        this.tagClose = tagClose;
        this.defaultBody = defaultBody;
        this.forceDisplayDependent = forceDisplayDependent;
    }

    @Override
    @SuppressWarnings("unchecked")
    public void execute(BlockExecution execution, Map<String, Object> values) {
        Object result = content.evaluate(execution, values);
        boolean forceDisplay = false;
        if (result instanceof FieldRendering) {
            FieldRendering rendering = (FieldRendering) result;
            if (rendering.attributes() != null && !rendering.attributes().isEmpty()) {
                Object existing = values.get(QWebSyntax.ATTRIBUTES_KEY);
                if (existing instanceof Map) {
                    ((Map<String, Object>) existing).putAll(rendering.attributes());
                } else {
                    values.put(QWebSyntax.ATTRIBUTES_KEY, new LinkedHashMap<>(rendering.attributes()));
                }
            }
            result = rendering.content();
            forceDisplay = rendering.forceDisplay();
        }

        if (result != null && !Boolean.FALSE.equals(result)) {
            Object html = result instanceof ContentValue ? result : Markup.escape(result).toHtml();
            List<Instruction> code = new ArrayList<>(tagOpen);
            code.add((exec, scope) -> exec.emit(html, scope));
            code.addAll(tagClose);
            execution.run(code, values);
        } else if (!defaultBody.isEmpty()) {
            List<Instruction> code = new ArrayList<>(tagOpen);
            code.addAll(defaultBody);
            code.addAll(tagClose);
            execution.run(code, values);
        } else if (forceDisplayDependent) {
            if (forceDisplay) {
                List<Instruction> code = new ArrayList<>(tagOpen);
                code.addAll(tagClose);
                execution.run(code, values);
            } else {
                values.remove(QWebSyntax.ATTRIBUTES_KEY);
            }
        }
    }
}
