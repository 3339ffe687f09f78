package com.chih.JQWeb.core.compiler;

import com.chih.JQWeb.core.compiler.instruction.CompiledBlock;
import com.chih.JQWeb.core.compiler.instruction.Instruction;
import com.chih.JQWeb.core.engine.QWebSettings;
import com.chih.JQWeb.core.engine.TemplateOptions;
import com.chih.JQWeb.core.exception.SourceLocation;
import com.chih.JQWeb.core.expr.CompiledExpression;
import com.chih.JQWeb.core.expr.ExpressionCompiler;
import com.chih.JQWeb.core.expr.FormatString;
import com.chih.JQWeb.core.xml.XmlElement;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 单个模板一次编译的状态：模板身份、选项、文本缓冲、已生成的内容块与当前节点位置
 *
 * @author lizhiyuan
 * @since 2026/10/05
 */
public final class CompileContext {

    private final DirectiveCompiler compiler;

    private final Object reference;

    private final String name;

    private final TemplateOptions options;

    private final QWebSettings settings;

    private final TextAccumulator text = new TextAccumulator();

    private final Map<String, CompiledBlock> blocks = new LinkedHashMap<>();

    private final String baseName;

    private int blockCounter;

    private SourceLocation location;

    public CompileContext(DirectiveCompiler compiler, Object reference, String name,
                          TemplateOptions options, QWebSettings settings) {
        this.compiler = compiler;
        this.reference = reference;
        this.name = name;
        this.options = options;
        this.settings = settings;
        String refName = name == null || name.contains("<") ? "" : name;
        this.baseName = QWebSyntax.TO_VARNAME.matcher("template_" + refName + "_" + reference).replaceAll("_");
    }

    // === 递归编译入口 ===

    public List<Instruction> compileNode(XmlElement element) {
        return compiler.compileNode(element, this);
    }

    public List<Instruction> compileDirectives(XmlElement element, DirectiveCursor cursor) {
        return compiler.compileDirectives(element, cursor, this);
    }

    public List<Instruction> compileDirective(XmlElement element, DirectiveCursor cursor, String directive) {
        return compiler.compileDirective(element, cursor, this, directive);
    }

    // === 表达式 ===

    public CompiledExpression expression(String source) {
        return ExpressionCompiler.compile(source);
    }

    public CompiledExpression expression(String source, boolean raiseOnMissing) {
        return ExpressionCompiler.compile(source, raiseOnMissing);
    }

    public FormatString format(String source) {
        return ExpressionCompiler.compileFormat(source);
    }

    // === 内容块 ===

    /**
     * 为 t-set / t-call 的内容生成块名，如 {@code template_web_layout_7_t_set_0}
     */
    public String nextBlockName(String prefix) {
        return baseName + "_" + prefix + "_" + blockCounter++;
    }

    public void addBlock(String blockName, List<Instruction> instructions) {
        blocks.put(blockName, new CompiledBlock(blockName, instructions));
    }

    public Map<String, CompiledBlock> getBlocks() {
        return blocks;
    }

    public String getBaseName() {
        return baseName;
    }

    // === 状态 ===

    public TextAccumulator text() {
        return text;
    }

    public SourceLocation getLocation() {
        return location;
    }

    void setLocation(SourceLocation location) {
        this.location = location;
    }

    public Object getReference() {
        return reference;
    }

    public String getName() {
        return name;
    }

    public TemplateOptions getOptions() {
        return options;
    }

    public boolean isDevMode(String flag) {
        return settings.isDevMode(flag);
    }

    public boolean isPreserveComments() {
        return settings.isPreserveComments();
    }

    public boolean isProfile() {
        return options.profile();
    }
}
