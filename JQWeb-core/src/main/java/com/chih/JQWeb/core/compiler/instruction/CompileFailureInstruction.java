package com.chih.JQWeb.core.compiler.instruction;

import com.chih.JQWeb.core.exception.TemplateCompileException;
import com.chih.JQWeb.core.render.BlockExecution;

import java.util.Map;

/**
 * 编译失败的哨兵块，每次渲染抛出一个新的异常实例（缓存中的原异常不被修改）
 *
 * @author lizhiyuan
 * @since 2026/10/06
 */
public final class CompileFailureInstruction implements Instruction {

    private final TemplateCompileException failure;

    public CompileFailureInstruction(TemplateCompileException failure) {
        this.failure = failure;
    }

    @Override
    public void execute(BlockExecution execution, Map<String, Object> values) {
        throw new TemplateCompileException(failure.getRawMessage(), failure.getLocation(), failure);
    }
}
