package com.chih.JQWeb.core.expr;

import java.util.List;
import java.util.Map;

/**
 * 格式字符串，如 {@code "item-{{ record.id }}"} 或 {@code "#{name}.png"}
 * <p>
 * 由字面片段与表达式交替组成；求值结果为普通字符串，null 与 false 输出为空。
 *
 * @author lizhiyuan
 * @since 2026/10/02
 */
public final class FormatString {

    private final String source;
    private final List<Object> parts;

    FormatString(String source, List<Object> parts) {
        this.source = source;
        this.parts = parts;
    }

    public String evaluate(Map<String, Object> values) {
        StringBuilder out = new StringBuilder();
        for (Object part : parts) {
            if (part instanceof CompiledExpression) {
                out.append(PyOps.toText(((CompiledExpression) part).evaluate(values)));
            } else {
                out.append((String) part);
            }
        }
        return out.toString();
    }

    /**
     * @return 不含任何占位符时为 true
     */
    public boolean isConstant() {
        for (Object part : parts) {
            if (part instanceof CompiledExpression) {
                return false;
            }
        }
        return true;
    }

    public String getSource() {
        return source;
    }

    @Override
    public String toString() {
        return source;
    }
}
