package com.chih.JQWeb.core.compiler.instruction;

import com.chih.JQWeb.core.render.BlockExecution;

import java.util.List;
import java.util.Map;

/**
 * profile 模式下包裹一条指令的编译结果，执行完毕后上报耗时
 *
 * @author lizhiyuan
 * @since 2026/10/06
 */
public final class TraceInstruction implements Instruction {

    private final String directive;

    private final String path;

    private final List<Instruction> code;

    public TraceInstruction(String directive, String path, List<Instruction> code) {
        this.directive = directive;
        this.path = path;
        this.code = code;
    }

    @Override
    public void execute(BlockExecution execution, Map<String, Object> values) {
        long start = System.nanoTime();
        // 先压入离开任务，子序列执行完后才轮到它
        execution.push(exec -> {
            exec.getSession().getMetrics().recordDirective(String.valueOf(exec.getTemplate().getName()),
                    directive, path, System.nanoTime() - start);
            return false;
        });
        execution.run(code, values);
    }
}
