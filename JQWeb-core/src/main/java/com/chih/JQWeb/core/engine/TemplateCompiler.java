package com.chih.JQWeb.core.engine;

import com.chih.JQWeb.core.compiler.CompileContext;
import com.chih.JQWeb.core.compiler.DirectiveCompiler;
import com.chih.JQWeb.core.compiler.instruction.Instruction;
import com.chih.JQWeb.core.compiler.instruction.SeedInstruction;
import com.chih.JQWeb.core.domain.TemplateDefinition;
import com.chih.JQWeb.core.exception.TemplateCompileException;
import com.chih.JQWeb.core.xml.XmlElement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;

/**
 * 把模板定义编译为 {@link CompiledTemplate}
 * <p>
 * 编译在定义元素的深拷贝上进行。不存在的模板与编译失败都返回哨兵产物，
 * 由渲染时的入口块抛出异常。
 * </p>
 *
 * @author lizhiyuan
 * @since 2026/10/11
 */
public class TemplateCompiler {

    private static final Logger log = LoggerFactory.getLogger(TemplateCompiler.class);

    private final DirectiveCompiler directiveCompiler;

    private final QWebSettings settings;

    public TemplateCompiler(QWebSettings settings) {
        this(new DirectiveCompiler(), settings);
    }

    public TemplateCompiler(DirectiveCompiler directiveCompiler, QWebSettings settings) {
        this.directiveCompiler = directiveCompiler;
        this.settings = settings;
    }

    /**
     * @param reference  请求的引用（名称或 id），作为产物与错误报告中的引用
     * @param definition 模板定义，null 表示不存在
     */
    public CompiledTemplate compile(Object reference, TemplateDefinition definition, TemplateOptions options) {
        if (definition == null) {
            log.debug("Template not found, caching sentinel: {}", reference);
            return CompiledTemplate.notFound(reference, options);
        }

        String name = definition.getName();
        XmlElement root = definition.getElement().copy();
        root.removeAttribute("t-name");
        root.removeAttribute("t-inherit");
        root.removeAttribute("t-inherit-mode");

        CompileContext context = new CompileContext(directiveCompiler, reference, name, options, settings);
        try {
            List<Instruction> content = directiveCompiler.compileRoot(root, context);
            String entry = context.getBaseName();
            String contentBlock = entry + "_content";
            context.addBlock(contentBlock, content);
            context.addBlock(entry, Collections.singletonList(new SeedInstruction(name, reference, contentBlock)));
            CompiledTemplate compiled = new CompiledTemplate(reference, name, options, context.getBlocks(), entry);
            log.debug("Template compiled: {} ({} blocks)", name, compiled.getBlocks().size());
            return compiled;
        } catch (TemplateCompileException e) {
            log.error("Failed to compile template: {}", name, e);
            return CompiledTemplate.failed(reference, name, options, e);
        } catch (RuntimeException e) {
            log.error("Failed to compile template: {}", name, e);
            return CompiledTemplate.failed(reference, name, options,
                    new TemplateCompileException(e.getClass().getSimpleName() + ": " + e.getMessage(), e));
        }
    }
}
