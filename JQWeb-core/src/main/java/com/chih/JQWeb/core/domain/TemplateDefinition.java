package com.chih.JQWeb.core.domain;

import com.chih.JQWeb.core.xml.XmlElement;

import java.util.Objects;

/**
 * 模板定义：存储层给出的、已完成继承合并的 XML 元素
 * <p>
 * 编译器只读取元素的深拷贝，定义本身在交给引擎后不再修改。
 *
 * @author lizhiyuan
 * @since 2026/10/13
 */
public class TemplateDefinition {

    /** 数字 id，来源未分配 id 时为 null */
    private final Integer id;

    /** t-name，如 {@code web.layout} */
    private final String name;

    private final XmlElement element;

    /** t-inherit 的父模板名，仅记录 */
    private final String inheritFrom;

    /** t-inherit-mode：primary 或 extension */
    private final String inheritMode;

    /** 定义所在的资源（文件路径、classpath 路径或 "memory"） */
    private final String origin;

    public TemplateDefinition(Integer id, String name, XmlElement element, String inheritFrom, String inheritMode, String origin) {
        this.id = id;
        this.name = name;
        this.element = Objects.requireNonNull(element, "element");
        this.inheritFrom = inheritFrom;
        this.inheritMode = inheritMode;
        this.origin = origin;
    }

    public TemplateDefinition(String name, XmlElement element) {
        this(null, name, element, null, null, "memory");
    }

    /**
     * 返回分配了新 id 的副本
     */
    public TemplateDefinition withId(Integer newId) {
        return new TemplateDefinition(newId, name, element, inheritFrom, inheritMode, origin);
    }

    public Integer getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public XmlElement getElement() {
        return element;
    }

    public String getInheritFrom() {
        return inheritFrom;
    }

    public String getInheritMode() {
        return inheritMode;
    }

    public String getOrigin() {
        return origin;
    }

    /**
     * 缓存与错误报告使用的引用：优先 id，其次名称
     */
    public Object getReference() {
        return id != null ? id : name;
    }

    @Override
    public String toString() {
        return "TemplateDefinition{name='" + name + "', id=" + id + ", origin='" + origin + "'}";
    }
}
