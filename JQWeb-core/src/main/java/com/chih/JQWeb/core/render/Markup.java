package com.chih.JQWeb.core.render;

import com.chih.JQWeb.core.expr.PyOps;

/**
 * 安全的标记文本
 * <p>
 * 与普通字符串拼接或格式化时，另一侧的普通文本会先被转义。
 *
 * @author lizhiyuan
 * @since 2026/10/09
 */
public final class Markup implements HtmlSafe, CharSequence, Comparable<Markup> {

    public static final Markup EMPTY = new Markup("");

    private final String html;

    private Markup(String html) {
        this.html = html;
    }

    /**
     * 把已知安全的文本标记为安全，不做转义
     */
    public static Markup of(String html) {
        return html == null || html.isEmpty() ? EMPTY : new Markup(html);
    }

    /**
     * 转义任意值：安全值保持原样，其余转为文本后转义；null 为空串
     */
    public static Markup escape(Object value) {
        if (value instanceof Markup) {
            return (Markup) value;
        }
        if (value instanceof HtmlSafe) {
            return of(((HtmlSafe) value).toHtml());
        }
        if (value == null) {
            return EMPTY;
        }
        return of(escapeText(PyOps.str(value)));
    }

    public static String escapeText(String text) {
        StringBuilder out = null;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            String replacement;
            switch (c) {
                case '&':
                    replacement = "&amp;";
                    break;
                case '<':
                    replacement = "&lt;";
                    break;
                case '>':
                    replacement = "&gt;";
                    break;
                case '"':
                    replacement = "&#34;";
                    break;
                case '\'':
                    replacement = "&#39;";
                    break;
                default:
                    replacement = null;
            }
            if (replacement == null) {
                if (out != null) {
                    out.append(c);
                }
                continue;
            }
            if (out == null) {
                out = new StringBuilder(text.length() + 16);
                out.append(text, 0, i);
            }
            out.append(replacement);
        }
        return out == null ? text : out.toString();
    }

    /**
     * 文本节点内容的转义，只处理 {@code & < >}，引号保持原样
     */
    public static String escapeContent(String text) {
        if (text.indexOf('&') < 0 && text.indexOf('<') < 0 && text.indexOf('>') < 0) {
            return text;
        }
        return text.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;");
    }

    public Markup concat(Object other) {
        return of(html + escape(other).html);
    }

    @Override
    public String toHtml() {
        return html;
    }

    @Override
    public int length() {
        return html.length();
    }

    @Override
    public char charAt(int index) {
        return html.charAt(index);
    }

    @Override
    public CharSequence subSequence(int start, int end) {
        return html.subSequence(start, end);
    }

    @Override
    public int compareTo(Markup other) {
        return html.compareTo(other.html);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        return obj instanceof Markup && html.equals(((Markup) obj).html);
    }

    @Override
    public int hashCode() {
        return html.hashCode();
    }

    @Override
    public String toString() {
        return html;
    }
}
