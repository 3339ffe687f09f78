package com.chih.JQWeb.core.xml;

/**
 * 模板树节点
 * <p>
 * 与 W3C DOM 不同，元素属性保持源文件中的顺序，静态节点可以按原样输出。
 *
 * @author lizhiyuan
 * @since 2026/10/03
 */
public abstract class XmlNode {

    XmlElement parent;

    public XmlElement getParent() {
        return parent;
    }

    public XmlNode getNextSibling() {
        if (parent == null) {
            return null;
        }
        int index = parent.indexOf(this);
        return index + 1 < parent.getChildCount() ? parent.getChild(index + 1) : null;
    }

    public XmlNode getPreviousSibling() {
        if (parent == null) {
            return null;
        }
        int index = parent.indexOf(this);
        return index > 0 ? parent.getChild(index - 1) : null;
    }

    /**
     * 从父节点上摘除
     */
    public void detach() {
        if (parent != null) {
            parent.removeChild(this);
        }
    }

    /**
     * 深拷贝，拷贝结果没有父节点
     */
    public abstract XmlNode copy();
}
