package com.chih.JQWeb.core.xml;

public final class XmlComment extends XmlNode {

    private final String text;

    public XmlComment(String text) {
        this.text = text;
    }

    public String getText() {
        return text;
    }

    @Override
    public XmlComment copy() {
        return new XmlComment(text);
    }

    @Override
    public String toString() {
        return "<!--" + text + "-->";
    }
}
