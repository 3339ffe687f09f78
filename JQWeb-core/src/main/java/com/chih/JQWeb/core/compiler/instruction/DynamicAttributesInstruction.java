package com.chih.JQWeb.core.compiler.instruction;

import com.chih.JQWeb.core.compiler.QWebSyntax;
import com.chih.JQWeb.core.expr.PyOps;
import com.chih.JQWeb.core.render.BlockExecution;
import com.chih.JQWeb.core.render.Markup;

import java.util.Map;

/**
 * 开始标签中的属性部分：取出 {@link QWebSyntax#ATTRIBUTES_KEY} 并输出
 * <p>
 * 值为假且不是字符串的属性被省略，空字符串保留为 {@code name=""}。
 *
 * @author lizhiyuan
 * @since 2026/10/06
 */
public final class DynamicAttributesInstruction implements Instruction {

    @Override
    @SuppressWarnings("unchecked")
    public void execute(BlockExecution execution, Map<String, Object> values) {
        Object collected = values.remove(QWebSyntax.ATTRIBUTES_KEY);
        if (!(collected instanceof Map)) {
            return;
        }
        Map<String, Object> attributes = QWebSyntax.sanitizeAttributes((Map<String, Object>) collected);
        StringBuilder out = new StringBuilder();
        for (Map.Entry<String, Object> entry : attributes.entrySet()) {
            Object value = entry.getValue();
            if (PyOps.truthy(value) || value instanceof CharSequence) {
                out.append(' ')
                        .append(Markup.escape(entry.getKey()).toHtml())
                        .append("=\"")
                        .append(Markup.escape(value instanceof CharSequence ? value : PyOps.str(value)).toHtml())
                        .append('"');
            }
        }
        execution.emitText(out.toString());
    }
}
