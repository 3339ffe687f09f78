package com.chih.JQWeb.core.compiler.instruction;

import com.chih.JQWeb.core.expr.PyOps;
import com.chih.JQWeb.core.render.BlockExecution;

import java.util.List;
import java.util.Map;

/**
 * t-if / t-elif / t-else 与 t-groups：条件为真执行 then 分支，否则执行 otherwise 分支
 *
 * @author lizhiyuan
 * @since 2026/10/06
 */
public final class ConditionalInstruction implements Instruction {

    private final Evaluation condition;

    private final List<Instruction> then;

    private final List<Instruction> otherwise;

    public ConditionalInstruction(Evaluation condition, List<Instruction> then, List<Instruction> otherwise) {
        this.condition = condition;
        this.then = then;
        this.otherwise = otherwise;
    }

    @Override
    public void execute(BlockExecution execution, Map<String, Object> values) {
        if (PyOps.truthy(condition.evaluate(execution, values))) {
            execution.run(then, values);
        } else {
            execution.run(otherwise, values);
        }
    }
}
