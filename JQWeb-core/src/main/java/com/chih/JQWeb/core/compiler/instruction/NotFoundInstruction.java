package com.chih.JQWeb.core.compiler.instruction;

import com.chih.JQWeb.core.exception.TemplateNotFoundException;
import com.chih.JQWeb.core.render.BlockExecution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * 模板不存在的哨兵块：按渲染选项抛出异常或输出空内容
 *
 * @author lizhiyuan
 * @since 2026/10/06
 */
public final class NotFoundInstruction implements Instruction {

    private static final Logger log = LoggerFactory.getLogger(NotFoundInstruction.class);

    private final Object reference;

    public NotFoundInstruction(Object reference) {
        this.reference = reference;
    }

    @Override
    public void execute(BlockExecution execution, Map<String, Object> values) {
        if (execution.getSession().getRenderOptions().isRaiseIfNotFound()) {
            throw new TemplateNotFoundException(reference);
        }
        log.warn("Template not found, rendered as empty: {}", reference);
    }
}
