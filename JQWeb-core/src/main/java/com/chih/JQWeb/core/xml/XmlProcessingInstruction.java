package com.chih.JQWeb.core.xml;

public final class XmlProcessingInstruction extends XmlNode {

    private final String target;
    private final String data;

    public XmlProcessingInstruction(String target, String data) {
        this.target = target;
        this.data = data;
    }

    public String getTarget() {
        return target;
    }

    public String getData() {
        return data;
    }

    @Override
    public XmlProcessingInstruction copy() {
        return new XmlProcessingInstruction(target, data);
    }

    @Override
    public String toString() {
        return "<?" + target + " " + data + "?>";
    }
}
