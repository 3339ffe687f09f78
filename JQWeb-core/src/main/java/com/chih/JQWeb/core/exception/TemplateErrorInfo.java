package com.chih.JQWeb.core.exception;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 渲染错误的结构化描述
 * <p>
 * 对应 {message, template_reference, xml_path, offending_snippet, caller_chain}。
 * {@code source} 记录从最外层到出错处的每一次 t-call / 内容块调用位置。
 */
public class TemplateErrorInfo {

    private final String message;
    private final String template;
    private Object reference;
    private final String path;
    private final String element;
    private final List<SourceLocation> source;

    public TemplateErrorInfo(String message, String template, Object reference,
                             String path, String element, List<SourceLocation> source) {
        this.message = message;
        this.template = template;
        this.reference = reference;
        this.path = path;
        this.element = element;
        this.source = source == null ? new ArrayList<>() : new ArrayList<>(source);
    }

    public String getMessage() {
        return message;
    }

    public String getTemplate() {
        return template;
    }

    public Object getReference() {
        return reference;
    }

    public void setReference(Object reference) {
        this.reference = reference;
    }

    public String getPath() {
        return path;
    }

    public String getElement() {
        return element;
    }

    public List<SourceLocation> getSource() {
        return Collections.unmodifiableList(source);
    }

    /**
     * 外层调用链补到已有调用链之前（内层内容块先于外层报告错误时）
     */
    public void prependSource(List<SourceLocation> outer) {
        source.addAll(0, outer);
    }

    @Override
    public String toString() {
        List<String> info = new ArrayList<>();
        info.add(message);
        if (template != null) {
            info.add("Template: " + template);
        }
        if (reference != null) {
            info.add("Reference: " + reference);
        }
        if (path != null) {
            info.add("Path: " + path);
        }
        if (element != null) {
            info.add("Element: " + element);
        }
        if (!source.isEmpty()) {
            info.add("From: " + source.stream().map(String::valueOf).collect(Collectors.joining("\n          ")));
        }
        return String.join("\n    ", info);
    }
}
