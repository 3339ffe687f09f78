package com.chih.JQWeb.core.compiler.instruction;

import com.chih.JQWeb.core.render.BlockExecution;

import java.util.Map;

/**
 * t-set：把求值结果绑定到变量
 *
 * @author lizhiyuan
 * @since 2026/10/06
 */
public final class AssignInstruction implements Instruction {

    private final String name;

    private final Evaluation value;

    public AssignInstruction(String name, Evaluation value) {
        this.name = name;
        this.value = value;
    }

    @Override
    public void execute(BlockExecution execution, Map<String, Object> values) {
        values.put(name, value.evaluate(execution, values));
    }
}
