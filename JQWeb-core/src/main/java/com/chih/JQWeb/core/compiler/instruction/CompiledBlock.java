package com.chih.JQWeb.core.compiler.instruction;

import java.util.Collections;
import java.util.List;

/**
 * 一个内容块的指令序列：模板主体、入口块，以及 t-set / t-call 内容各自生成的块
 *
 * @author lizhiyuan
 * @since 2026/10/06
 */
public final class CompiledBlock {

    private final String name;

    private final List<Instruction> instructions;

    public CompiledBlock(String name, List<Instruction> instructions) {
        this.name = name;
        this.instructions = Collections.unmodifiableList(instructions);
    }

    public String getName() {
        return name;
    }

    public List<Instruction> getInstructions() {
        return instructions;
    }

    @Override
    public String toString() {
        return "CompiledBlock{" + name + ", " + instructions.size() + " instructions}";
    }
}
