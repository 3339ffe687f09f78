package com.chih.JQWeb.core.expr;

import com.chih.JQWeb.core.exception.ExpressionSyntaxException;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 表达式编译入口：词法分析、名称分类、解析、沙箱校验
 * <p>
 * 编译是纯函数，不会对表达式求值。
 *
 * @author lizhiyuan
 * @since 2026/10/02
 */
public final class ExpressionCompiler {

    /** {@code #{expr}} 或 {@code {{expr}}} 占位符 */
    private static final Pattern FORMAT_PLACEHOLDER = Pattern.compile("(?:#\\{(.+?)\\})|(?:\\{\\{(.+?)\\}\\})");

    private ExpressionCompiler() {
    }

    public static CompiledExpression compile(String source) {
        return compile(source, false);
    }

    /**
     * @param raiseOnMissing 为 true 时所有自由名称都必须存在于绑定中
     */
    public static CompiledExpression compile(String source, boolean raiseOnMissing) {
        if (source == null) {
            throw new ExpressionSyntaxException("missing expression", null);
        }
        String trimmed = source.strip();
        try {
            Expr tree = ExpressionParser.parse(trimmed, raiseOnMissing);
            ExpressionSandbox.validate(tree, trimmed);
            return new CompiledExpression(trimmed, tree);
        } catch (ExpressionSyntaxException e) {
            if (e.getExpression() == null) {
                throw new ExpressionSyntaxException(e.getMessage(), trimmed);
            }
            throw e;
        }
    }

    public static FormatString compileFormat(String source) {
        List<Object> parts = new ArrayList<>();
        Matcher matcher = FORMAT_PLACEHOLDER.matcher(source);
        int last = 0;
        while (matcher.find()) {
            if (matcher.start() > last) {
                parts.add(source.substring(last, matcher.start()));
            }
            String expression = matcher.group(1) != null ? matcher.group(1) : matcher.group(2);
            parts.add(compile(expression));
            last = matcher.end();
        }
        if (last < source.length()) {
            parts.add(source.substring(last));
        }
        return new FormatString(source, parts);
    }
}
