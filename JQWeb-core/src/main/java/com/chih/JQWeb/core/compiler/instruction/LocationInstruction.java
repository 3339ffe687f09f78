package com.chih.JQWeb.core.compiler.instruction;

import com.chih.JQWeb.core.exception.SourceLocation;
import com.chih.JQWeb.core.render.BlockExecution;

import java.util.Map;

/**
 * 记录当前执行到的节点，出错时报告路径与片段
 *
 * @author lizhiyuan
 * @since 2026/10/06
 */
public final class LocationInstruction implements Instruction {

    private final SourceLocation location;

    public LocationInstruction(SourceLocation location) {
        this.location = location;
    }

    @Override
    public void execute(BlockExecution execution, Map<String, Object> values) {
        execution.setLocation(location);
    }
}
