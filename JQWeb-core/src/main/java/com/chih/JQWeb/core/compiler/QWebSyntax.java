package com.chih.JQWeb.core.compiler;

import com.chih.JQWeb.core.expr.PyOps;

import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * 模板语法常量
 *
 * @author lizhiyuan
 * @since 2026/10/05
 */
public final class QWebSyntax {

    /** t-att / t-field 组装的属性表在绑定中的键，tag-open 时取出 */
    public static final String ATTRIBUTES_KEY = "__qweb_attrs__";

    /** t-options 合并结果在绑定中的键，由 t-out / t-field / t-call 取出 */
    public static final String OPTIONS_KEY = "__qweb_options__";

    /** t-call 内容槽 */
    public static final String SLOT_KEY = "0";

    public static final Set<String> VOID_ELEMENTS = Set.of(
            "area", "base", "br", "col", "embed", "hr", "img", "input", "keygen",
            "link", "menuitem", "meta", "param", "source", "track", "wbr");

    /** 保留属性，不参与编译也不报告为未知指令 */
    public static final Set<String> SPECIAL_DIRECTIVES = Set.of("t-translation", "t-ignore", "t-title");

    public static final Pattern RSTRIP = Pattern.compile("\\n[ \\t]*$");

    public static final Pattern LSTRIP = Pattern.compile("^[ \\t]*\\n");

    public static final Pattern FIRST_RSTRIP = Pattern.compile("^(\\n[ \\t]*)+(\\n[ \\t])");

    public static final Pattern VARNAME = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*$");

    public static final Pattern TO_VARNAME = Pattern.compile("[^A-Za-z0-9_]+");

    /** javascript: 链接，{@code javascript:history.back()} 除外 */
    public static final Pattern MALICIOUS_SCHEMES = Pattern.compile(
            "javascript:(?!( ?)((window\\.)?)history\\.back\\(\\)$)", Pattern.CASE_INSENSITIVE);

    private QWebSyntax() {
    }

    public static boolean isMaliciousUrl(String url) {
        return MALICIOUS_SCHEMES.matcher(url).find();
    }

    /**
     * 清除 href 中的 javascript: 链接，静态节点与动态属性共用
     */
    public static Map<String, Object> sanitizeAttributes(Map<String, Object> attributes) {
        Object href = attributes.get("href");
        if (PyOps.truthy(href) && isMaliciousUrl(PyOps.str(href))) {
            attributes.put("href", "");
        }
        return attributes;
    }

    /**
     * 去掉可翻译属性名的 {@code .translate} 后缀
     */
    public static String stripTranslate(String name) {
        return name.endsWith(".translate") ? name.substring(0, name.length() - ".translate".length()) : name;
    }

    public static boolean isDigits(String text) {
        if (text.isEmpty()) {
            return false;
        }
        for (int i = 0; i < text.length(); i++) {
            if (!Character.isDigit(text.charAt(i))) {
                return false;
            }
        }
        return true;
    }
}
