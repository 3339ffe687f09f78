package com.chih.JQWeb.core.exception;

/**
 * 模板中某个节点的位置：所属模板引用、XPath 路径与节点起始标签片段
 *
 * @param template 模板引用（名称或数字 id），内联模板时为 null
 * @param path     节点路径，如 {@code /t/div[2]/span}
 * @param element  节点片段，如 {@code <span t-out="name"/>}
 */
public record SourceLocation(Object template, String path, String element) {

    @Override
    public String toString() {
        return "(" + template + ", '" + path + "', '" + element + "')";
    }
}
