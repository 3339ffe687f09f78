package com.chih.JQWeb.core.render;

import com.chih.JQWeb.core.compiler.instruction.Instruction;

import java.util.List;
import java.util.Map;

/**
 * 按顺序执行一组指令
 *
 * @author lizhiyuan
 * @since 2026/10/09
 */
public final class SequenceTask implements Task {

    private final List<Instruction> instructions;

    private final Map<String, Object> values;

    private int index;

    public SequenceTask(List<Instruction> instructions, Map<String, Object> values) {
        this.instructions = instructions;
        this.values = values;
    }

    @Override
    public boolean step(BlockExecution execution) {
        if (index >= instructions.size()) {
            return false;
        }
        instructions.get(index++).execute(execution, values);
        return true;
    }
}
