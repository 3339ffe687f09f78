package com.chih.JQWeb.core.compiler.instruction;

import com.chih.JQWeb.core.render.BlockExecution;

import java.util.Map;

/**
 * 编译后的一条中间指令
 * <p>
 * 指令只通过 {@link BlockExecution} 输出文本、压入子任务，不直接递归执行其他代码块。
 *
 * @author lizhiyuan
 * @since 2026/10/06
 */
@FunctionalInterface
public interface Instruction {

    /**
     * @param execution 当前代码块的执行状态
     * @param values    当前绑定（foreach 的每次迭代各有一份）
     */
    void execute(BlockExecution execution, Map<String, Object> values);
}
