package com.chih.JQWeb.core.compiler.instruction;

import com.chih.JQWeb.core.render.BlockExecution;

import java.util.Map;

/**
 * 输出一段已转义的静态文本
 *
 * @author lizhiyuan
 * @since 2026/10/06
 */
public final class TextInstruction implements Instruction {

    private final String text;

    public TextInstruction(String text) {
        this.text = text;
    }

    public String getText() {
        return text;
    }

    @Override
    public void execute(BlockExecution execution, Map<String, Object> values) {
        execution.emitText(text);
    }

    @Override
    public String toString() {
        return "Text[" + text + "]";
    }
}
