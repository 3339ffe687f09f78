package com.chih.JQWeb.core.render;

import com.chih.JQWeb.core.compiler.instruction.Instruction;

import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * 循环：每次迭代用迭代器给出的绑定执行一遍循环体
 * <p>
 * 下一次迭代的绑定在上一次循环体执行完后才计算。
 *
 * @author lizhiyuan
 * @since 2026/10/09
 */
public final class LoopTask implements Task {

    private final Iterator<Map<String, Object>> iterations;

    private final List<Instruction> body;

    public LoopTask(Iterator<Map<String, Object>> iterations, List<Instruction> body) {
        this.iterations = iterations;
        this.body = body;
    }

    @Override
    public boolean step(BlockExecution execution) {
        if (!iterations.hasNext()) {
            return false;
        }
        Map<String, Object> values = iterations.next();
        execution.run(body, values);
        return true;
    }
}
