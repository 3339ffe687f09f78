package com.chih.JQWeb.core.xml;

/**
 * 文本节点（已解码实体，CDATA 也合并为文本）
 *
 * @author lizhiyuan
 * @since 2026/10/03
 */
public final class XmlText extends XmlNode {

    private String text;

    public XmlText(String text) {
        this.text = text;
    }

    public String getText() {
        return text;
    }

    public void setText(String text) {
        this.text = text;
    }

    public boolean isWhitespace() {
        return text.isBlank();
    }

    @Override
    public XmlText copy() {
        return new XmlText(text);
    }

    @Override
    public String toString() {
        return text;
    }
}
