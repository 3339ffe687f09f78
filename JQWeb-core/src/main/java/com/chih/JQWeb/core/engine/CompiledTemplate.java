package com.chih.JQWeb.core.engine;

import com.chih.JQWeb.core.compiler.instruction.CompiledBlock;
import com.chih.JQWeb.core.compiler.instruction.CompileFailureInstruction;
import com.chih.JQWeb.core.compiler.instruction.NotFoundInstruction;
import com.chih.JQWeb.core.exception.TemplateCompileException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 一个模板的编译产物：块名到指令序列的映射、入口块名与选项快照
 * <p>
 * 创建后不可变。模板不存在或编译失败时同样生成产物（哨兵），错误推迟到真正渲染时抛出，
 * 失败结果也进入缓存，重复渲染会以相同方式失败。
 * </p>
 *
 * @author lizhiyuan
 * @since 2026/10/11
 */
public final class CompiledTemplate {

    private final Object reference;

    private final String name;

    private final TemplateOptions options;

    private final Map<String, CompiledBlock> blocks;

    private final String entryBlock;

    private final boolean available;

    public CompiledTemplate(Object reference, String name, TemplateOptions options,
                            Map<String, CompiledBlock> blocks, String entryBlock) {
        this(reference, name, options, blocks, entryBlock, true);
    }

    private CompiledTemplate(Object reference, String name, TemplateOptions options,
                             Map<String, CompiledBlock> blocks, String entryBlock, boolean available) {
        this.reference = reference;
        this.name = name;
        this.options = options;
        this.blocks = Collections.unmodifiableMap(new LinkedHashMap<>(blocks));
        this.entryBlock = entryBlock;
        this.available = available;
        if (!this.blocks.containsKey(entryBlock)) {
            throw new IllegalArgumentException("Entry block '" + entryBlock + "' is missing");
        }
    }

    /**
     * 渲染时抛出 {@link com.chih.JQWeb.core.exception.TemplateNotFoundException}
     * （或在 raiseIfNotFound=false 时输出空内容）的哨兵
     */
    public static CompiledTemplate notFound(Object reference, TemplateOptions options) {
        String entry = "not_found";
        CompiledBlock block = new CompiledBlock(entry, Collections.singletonList(new NotFoundInstruction(reference)));
        return new CompiledTemplate(reference, null, options, Collections.singletonMap(entry, block), entry, false);
    }

    /**
     * 渲染时重新抛出编译异常的哨兵
     */
    public static CompiledTemplate failed(Object reference, String name, TemplateOptions options,
                                          TemplateCompileException failure) {
        String entry = "compile_failure";
        CompiledBlock block = new CompiledBlock(entry, Collections.singletonList(new CompileFailureInstruction(failure)));
        return new CompiledTemplate(reference, name, options, Collections.singletonMap(entry, block), entry, false);
    }

    /** 数字 id 或模板名称 */
    public Object getReference() {
        return reference;
    }

    /** 模板名称（t-name），不可用时可能为 null */
    public String getName() {
        return name;
    }

    public TemplateOptions getOptions() {
        return options;
    }

    public Map<String, CompiledBlock> getBlocks() {
        return blocks;
    }

    public String getEntryBlockName() {
        return entryBlock;
    }

    public CompiledBlock getEntryBlock() {
        return blocks.get(entryBlock);
    }

    public CompiledBlock getBlock(String blockName) {
        CompiledBlock block = blocks.get(blockName);
        if (block == null) {
            throw new IllegalStateException("Block '" + blockName + "' not found in template " + reference);
        }
        return block;
    }

    /**
     * @return 编译成功时为 true；哨兵为 false
     */
    public boolean isAvailable() {
        return available;
    }

    @Override
    public String toString() {
        return "CompiledTemplate{reference=" + reference + ", name=" + name + ", blocks=" + blocks.keySet()
                + (available ? "" : ", unavailable") + "}";
    }
}
