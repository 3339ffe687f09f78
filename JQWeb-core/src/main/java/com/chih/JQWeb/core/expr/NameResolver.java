package com.chih.JQWeb.core.expr;

import com.chih.JQWeb.core.exception.ExpressionSyntaxException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 为表达式中的每个标识符决定查找策略
 * <p>
 * 按括号层级处理：先收集本层 {@code lambda} 参数与推导式 {@code for} 目标，
 * 再递归进入每个括号组（组在本层被视为一个整体），最后对本层剩余的标识符分类：
 * 后面紧跟 {@code .}、{@code (}、{@code [} 或括号组的名称必须存在，其余名称缺失时取 null。
 *
 * @author lizhiyuan
 * @since 2026/10/02
 */
public final class NameResolver {

    /** 允许原样出现的关键字 */
    public static final Set<String> ALLOWED_KEYWORDS = Collections.unmodifiableSet(new LinkedHashSet<>(Arrays.asList(
            "False", "None", "True", "and", "as", "elif", "else", "for", "if", "in", "is", "not", "or", "lambda")));

    /** 不允许出现的语句关键字 */
    public static final Set<String> FORBIDDEN_KEYWORDS = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
            "import", "from", "def", "class", "return", "yield", "del", "global", "nonlocal", "pass",
            "raise", "try", "except", "finally", "while", "with", "assert", "break", "continue",
            "async", "await", "exec", "print")));

    private final List<Token> tokens;
    private final NameKind[] kinds;
    private final boolean raiseOnMissing;

    private NameResolver(List<Token> tokens, boolean raiseOnMissing) {
        this.tokens = tokens;
        this.kinds = new NameKind[tokens.size()];
        Arrays.fill(kinds, NameKind.NONE);
        this.raiseOnMissing = raiseOnMissing;
    }

    /**
     * @param tokens         词法单元（以 END 结尾）
     * @param raiseOnMissing 为 true 时所有自由名称都必须存在
     * @return 与 tokens 等长的分类结果
     */
    public static NameKind[] resolve(List<Token> tokens, boolean raiseOnMissing) {
        NameResolver resolver = new NameResolver(tokens, raiseOnMissing);
        int end = tokens.size();
        if (end > 0 && tokens.get(end - 1).type() == TokenType.END) {
            end--;
        }
        resolver.resolveLevel(0, end, new HashSet<>());
        return resolver.kinds;
    }

    private void resolveLevel(int from, int to, Set<String> inherited) {
        Set<String> arguments = new HashSet<>(inherited);
        collectArguments(from, to, arguments);

        // 本层视图：括号组折叠为其左括号下标
        List<Integer> level = new ArrayList<>();
        int depth = 0;
        int open = -1;
        for (int i = from; i < to; i++) {
            TokenType type = tokens.get(i).type();
            if (type.isOpening()) {
                if (depth == 0) {
                    open = i;
                }
                depth++;
            } else if (type.isClosing()) {
                depth--;
                if (depth < 0) {
                    throw new ExpressionSyntaxException("unmatched '" + tokens.get(i).text() + "'", null);
                }
                if (depth == 0) {
                    resolveLevel(open + 1, i, arguments);
                    level.add(open);
                }
            } else if (depth == 0) {
                level.add(i);
            }
        }
        if (depth != 0) {
            throw new ExpressionSyntaxException("unclosed '" + tokens.get(open).text() + "'", null);
        }

        for (int p = 0; p < level.size(); p++) {
            int index = level.get(p);
            Token token = tokens.get(index);
            if (token.type() != TokenType.NAME) {
                continue;
            }
            String name = token.text();
            if (name.contains("__")) {
                throw new ExpressionSyntaxException("Using variable names with '__' is not allowed: '" + name + "'", null);
            }
            if (FORBIDDEN_KEYWORDS.contains(name)) {
                throw new ExpressionSyntaxException("Forbidden keyword '" + name + "'", null);
            }
            if (name.equals("lambda")) {
                p = markLambdaParameters(level, p, arguments);
                continue;
            }
            Token previous = p > 0 ? tokens.get(level.get(p - 1)) : null;
            Token next = p + 1 < level.size() ? tokens.get(level.get(p + 1)) : null;
            if (arguments.contains(name)) {
                kinds[index] = NameKind.LOCAL;
            } else if (ALLOWED_KEYWORDS.contains(name) || Builtins.isBuiltin(name)) {
                kinds[index] = NameKind.BUILTIN;
            } else if (next != null && next.type() == TokenType.EQUAL) {
                kinds[index] = NameKind.KEYWORD_ARGUMENT;
            } else if (previous != null && previous.type() == TokenType.DOT) {
                kinds[index] = NameKind.ATTRIBUTE;
            } else if (raiseOnMissing || (next != null && (next.type() == TokenType.DOT || next.type().isOpening()))) {
                kinds[index] = NameKind.REQUIRED;
            } else {
                kinds[index] = NameKind.OPTIONAL;
            }
        }
    }

    private int markLambdaParameters(List<Integer> level, int p, Set<String> arguments) {
        int q = p + 1;
        for (; q < level.size(); q++) {
            Token token = tokens.get(level.get(q));
            if (token.type() == TokenType.NAME && arguments.contains(token.text())) {
                kinds[level.get(q)] = NameKind.LOCAL;
            } else if (token.type() == TokenType.COLON) {
                break;
            }
        }
        return q;
    }

    private void collectArguments(int from, int to, Set<String> arguments) {
        int depth = 0;
        for (int i = from; i < to; i++) {
            Token token = tokens.get(i);
            if (token.type().isOpening()) {
                depth++;
            } else if (token.type().isClosing()) {
                depth--;
            } else if (depth == 0 && token.isName("lambda")) {
                collectLambdaParameters(i + 1, to, arguments);
            } else if (depth == 0 && token.isName("for")) {
                collectLoopTargets(i + 1, to, arguments);
            }
        }
    }

    private void collectLambdaParameters(int from, int to, Set<String> arguments) {
        for (int i = from; i < to; i++) {
            Token token = tokens.get(i);
            if (token.type() == TokenType.NAME) {
                arguments.add(token.text());
            } else if (token.type() == TokenType.COLON) {
                return;
            } else if (token.type() == TokenType.EQUAL) {
                throw new ExpressionSyntaxException("Lambda default values are not supported", null);
            } else if (token.type() != TokenType.COMMA) {
                throw new ExpressionSyntaxException("This lambda code style is not implemented", null);
            }
        }
    }

    private void collectLoopTargets(int from, int to, Set<String> arguments) {
        for (int i = from; i < to; i++) {
            Token token = tokens.get(i);
            if (token.type() == TokenType.NAME) {
                if (token.text().equals("in")) {
                    return;
                }
                arguments.add(token.text());
            } else if (token.type() != TokenType.COMMA && token.type() != TokenType.LPAR && token.type() != TokenType.RPAR) {
                throw new ExpressionSyntaxException("This loop code style is not implemented", null);
            }
        }
    }
}
