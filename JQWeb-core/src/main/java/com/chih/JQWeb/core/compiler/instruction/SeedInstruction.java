package com.chih.JQWeb.core.compiler.instruction;

import com.chih.JQWeb.core.render.BlockExecution;

import java.util.Map;

/**
 * 模板入口：补充 xmlid / viewid 后执行模板主体块
 *
 * @author lizhiyuan
 * @since 2026/10/06
 */
public final class SeedInstruction implements Instruction {

    private final String name;

    private final Object reference;

    private final String contentBlock;

    public SeedInstruction(String name, Object reference, String contentBlock) {
        this.name = name;
        this.reference = reference;
        this.contentBlock = contentBlock;
    }

    @Override
    public void execute(BlockExecution execution, Map<String, Object> values) {
        if (!values.containsKey("xmlid")) {
            values.put("xmlid", name);
            values.put("viewid", reference);
        }
        execution.run(execution.getTemplate().getBlock(contentBlock).getInstructions(), values);
    }
}
