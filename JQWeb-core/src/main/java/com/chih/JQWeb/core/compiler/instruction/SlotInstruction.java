package com.chih.JQWeb.core.compiler.instruction;

import com.chih.JQWeb.core.compiler.QWebSyntax;
import com.chih.JQWeb.core.render.BlockExecution;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * {@code t-out="0"}：原样输出 t-call 传入的内容槽
 *
 * @author lizhiyuan
 * @since 2026/10/06
 */
public final class SlotInstruction implements Instruction {

    private final List<Instruction> tagOpen;

    private final List<Instruction> tagClose;

    public SlotInstruction(List<Instruction> tagOpen, List<Instruction> tagClose) {
        this.tagOpen = tagOpen;
        this.tagClose = tagClose;
    }

    @Override
    public void execute(BlockExecution execution, Map<String, Object> values) {
        Object slot = values.getOrDefault(QWebSyntax.SLOT_KEY, "");
        List<Instruction> code = new ArrayList<>(tagOpen);
        code.add((exec, scope) -> exec.emit(slot == null ? "" : slot, scope));
        code.addAll(tagClose);
        execution.run(code, values);
    }
}
