package com.chih.JQWeb.core.compiler.instruction;

import com.chih.JQWeb.core.render.BlockExecution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.TreeSet;

/**
 * t-debug：在 qweb 开发模式下记录当前绑定
 *
 * @author lizhiyuan
 * @since 2026/10/06
 */
public final class DebugInstruction implements Instruction {

    private static final Logger log = LoggerFactory.getLogger(DebugInstruction.class);

    private final String path;

    public DebugInstruction(String path) {
        this.path = path;
    }

    @Override
    public void execute(BlockExecution execution, Map<String, Object> values) {
        log.info("t-debug in '{}' at {}: variables {}", execution.getTemplate().getName(), path,
                new TreeSet<>(values.keySet()));
        if (log.isDebugEnabled()) {
            log.debug("t-debug values: {}", values);
        }
    }
}
