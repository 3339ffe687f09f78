package com.chih.JQWeb.core.render;

/**
 * {@link BlockExecution} 任务栈中的一个单元
 *
 * @author lizhiyuan
 * @since 2026/10/09
 */
public interface Task {

    /**
     * 推进一步；可以输出内容或压入新任务
     *
     * @return 已无事可做时返回 false，此时不得压入任何任务
     */
    boolean step(BlockExecution execution);
}
