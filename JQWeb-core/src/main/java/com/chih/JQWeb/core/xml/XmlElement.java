package com.chih.JQWeb.core.xml;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * 元素节点：标签名（含前缀，如 {@code svg:path}）、有序属性与子节点
 *
 * @author lizhiyuan
 * @since 2026/10/03
 */
public final class XmlElement extends XmlNode {

    private String tag;

    private final Map<String, String> attributes = new LinkedHashMap<>();

    private final List<XmlNode> children = new ArrayList<>();

    public XmlElement(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }

    public void setTag(String tag) {
        this.tag = tag;
    }

    // === 属性 ===

    public String getAttribute(String name) {
        return attributes.get(name);
    }

    public boolean hasAttribute(String name) {
        return attributes.containsKey(name);
    }

    public void setAttribute(String name, String value) {
        attributes.put(name, value);
    }

    /**
     * @return 被移除的值，不存在时为 null
     */
    public String removeAttribute(String name) {
        return attributes.remove(name);
    }

    /**
     * 属性名快照，遍历时可以安全地增删属性
     */
    public List<String> attributeNames() {
        return new ArrayList<>(attributes.keySet());
    }

    public Map<String, String> getAttributes() {
        return Collections.unmodifiableMap(attributes);
    }

    public void clearAttributes() {
        attributes.clear();
    }

    // === 子节点 ===

    public List<XmlNode> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public int getChildCount() {
        return children.size();
    }

    public XmlNode getChild(int index) {
        return children.get(index);
    }

    public XmlNode getFirstChild() {
        return children.isEmpty() ? null : children.get(0);
    }

    public List<XmlElement> getChildElements() {
        List<XmlElement> elements = new ArrayList<>();
        for (XmlNode child : children) {
            if (child instanceof XmlElement) {
                elements.add((XmlElement) child);
            }
        }
        return elements;
    }

    public boolean hasContent() {
        return !children.isEmpty();
    }

    public void appendChild(XmlNode child) {
        child.detach();
        child.parent = this;
        children.add(child);
    }

    public void removeChild(XmlNode child) {
        // 按引用查找，文本节点可能内容相同
        int index = indexOf(child);
        if (index >= 0) {
            children.remove(index);
            child.parent = null;
        }
    }

    int indexOf(XmlNode child) {
        for (int i = 0; i < children.size(); i++) {
            if (children.get(i) == child) {
                return i;
            }
        }
        return -1;
    }

    /**
     * 先序遍历自身及所有后代元素
     */
    public void forEachElement(Consumer<XmlElement> action) {
        action.accept(this);
        for (XmlNode child : children) {
            if (child instanceof XmlElement) {
                ((XmlElement) child).forEachElement(action);
            }
        }
    }

    /**
     * 节点在所属树中的路径，如 {@code /t/div[2]/span}；同名兄弟多于一个时才带序号
     */
    public String getPath() {
        List<String> steps = new ArrayList<>();
        XmlElement current = this;
        while (current != null) {
            String step = current.tag;
            XmlElement up = current.parent;
            if (up != null) {
                int position = 0;
                int count = 0;
                for (XmlNode sibling : up.children) {
                    if (sibling instanceof XmlElement && ((XmlElement) sibling).tag.equals(current.tag)) {
                        count++;
                        if (sibling == current) {
                            position = count;
                        }
                    }
                }
                if (count > 1) {
                    step = step + "[" + position + "]";
                }
            }
            steps.add(step);
            current = up;
        }
        Collections.reverse(steps);
        return "/" + String.join("/", steps);
    }

    /**
     * 不含子节点的起始标签，用于错误信息，如 {@code <span t-out="name"/>}
     */
    public String toStartTag() {
        StringBuilder out = new StringBuilder("<").append(tag);
        attributes.forEach((name, value) -> out.append(' ').append(name).append("=\"").append(escapeAttribute(value)).append('"'));
        return out.append("/>").toString();
    }

    private static String escapeAttribute(String value) {
        return value.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;").replace("\"", "&quot;");
    }

    @Override
    public XmlElement copy() {
        XmlElement clone = new XmlElement(tag);
        clone.attributes.putAll(attributes);
        for (XmlNode child : children) {
            XmlNode childCopy = child.copy();
            childCopy.parent = clone;
            clone.children.add(childCopy);
        }
        return clone;
    }

    @Override
    public String toString() {
        return toStartTag();
    }
}
