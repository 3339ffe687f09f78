package com.chih.JQWeb.core.compiler.instruction;

import com.chih.JQWeb.core.compiler.QWebSyntax;
import com.chih.JQWeb.core.expr.PyOps;
import com.chih.JQWeb.core.render.BlockExecution;
import com.chih.JQWeb.core.render.Markup;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * t-call-assets：向 {@code AssetLinkProvider} 取资源包链接，按扩展名输出 script / link 节点
 *
 * @author lizhiyuan
 * @since 2026/10/06
 */
public final class AssetsInstruction implements Instruction {

    private static final String SEPARATOR = "\n        ";

    private final String bundle;

    private final boolean css;

    private final boolean js;

    private final boolean deferLoad;

    private final boolean lazyLoad;

    private final String media;

    public AssetsInstruction(String bundle, boolean css, boolean js, boolean deferLoad, boolean lazyLoad,
                             String media) {
        this.bundle = bundle;
        this.css = css;
        this.js = js;
        this.deferLoad = deferLoad;
        this.lazyLoad = lazyLoad;
        this.media = css ? media : null;
    }

    @Override
    public void execute(BlockExecution execution, Map<String, Object> values) {
        List<String> links = execution.getSession().getAssetLinkProvider().getLinks(bundle, css, js, values);
        List<String> nodes = new ArrayList<>();
        for (String url : links) {
            String node = toNode(url, deferLoad, lazyLoad, media);
            if (node != null) {
                nodes.add(node);
            }
        }
        execution.emit(Markup.of(String.join(SEPARATOR, nodes)), values);
    }

    private static String toNode(String url, boolean defer, boolean lazy, String media) {
        String path = url;
        int query = path.indexOf('?');
        if (query >= 0) {
            path = path.substring(0, query);
        }
        String extension = path.substring(path.lastIndexOf('.') + 1);

        String tag;
        Map<String, Object> attributes = new LinkedHashMap<>();
        switch (extension) {
            case "js":
                tag = "script";
                attributes.put("type", "text/javascript");
                if (defer) {
                    attributes.put("defer", "defer");
                }
                attributes.put(lazy ? "data-src" : "src", url);
                break;
            case "css":
            case "scss":
            case "sass":
            case "less":
                tag = "link";
                attributes.put("type", "text/" + extension);
                attributes.put("rel", "stylesheet");
                attributes.put("href", url);
                attributes.put("media", media);
                break;
            case "xml":
                tag = "script";
                attributes.put("type", "text/xml");
                attributes.put("async", "async");
                attributes.put("rel", "prefetch");
                attributes.put("data-src", url);
                break;
            default:
                return null;
        }
        QWebSyntax.sanitizeAttributes(attributes);

        StringBuilder out = new StringBuilder("<").append(tag);
        for (Map.Entry<String, Object> entry : attributes.entrySet()) {
            Object value = entry.getValue();
            if (PyOps.truthy(value) || value instanceof CharSequence) {
                out.append(' ').append(entry.getKey()).append("=\"")
                        .append(Markup.escapeText(PyOps.str(value))).append('"');
            }
        }
        if (QWebSyntax.VOID_ELEMENTS.contains(tag)) {
            out.append("/>");
        } else {
            out.append("></").append(tag).append('>');
        }
        return out.toString();
    }
}
