package com.chih.JQWeb.core.xml;

import org.xml.sax.Attributes;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.ext.DefaultHandler2;

import javax.xml.XMLConstants;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.parsers.SAXParser;
import javax.xml.parsers.SAXParserFactory;
import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * 基于 SAX 构建 {@link XmlElement} 树
 * <p>
 * 关闭 DOCTYPE 与外部实体（防 XXE），不做命名空间处理：{@code xmlns:*} 按普通属性保留，
 * 带前缀的标签名原样输出。
 *
 * @author lizhiyuan
 * @since 2026/10/03
 */
public final class XmlTreeBuilder extends DefaultHandler2 {

    private final Deque<XmlElement> open = new ArrayDeque<>();

    private XmlElement root;

    private XmlTreeBuilder() {
    }

    public static XmlElement parse(InputStream input) throws IOException {
        return parse(new InputSource(input));
    }

    public static XmlElement parse(String xml) {
        try {
            return parse(new InputSource(new StringReader(xml)));
        } catch (IOException e) {
            // StringReader 不会抛出 IO 异常，这里只剩解析错误
            throw new IllegalArgumentException(e.getMessage(), e);
        }
    }

    private static XmlElement parse(InputSource source) throws IOException {
        XmlTreeBuilder builder = new XmlTreeBuilder();
        try {
            SAXParser parser = newFactory().newSAXParser();
            parser.setProperty("http://xml.org/sax/properties/lexical-handler", builder);
            parser.parse(source, builder);
        } catch (SAXException e) {
            throw new IOException("Malformed XML: " + e.getMessage(), e);
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("SAX parser is not available", e);
        }
        if (builder.root == null) {
            throw new IOException("Malformed XML: no root element");
        }
        return builder.root;
    }

    private static SAXParserFactory newFactory() throws ParserConfigurationException, SAXException {
        SAXParserFactory factory = SAXParserFactory.newInstance();
        factory.setNamespaceAware(false);
        factory.setValidating(false);
        factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
        factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
        factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
        factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
        return factory;
    }

    @Override
    public void startElement(String uri, String localName, String qName, Attributes attributes) {
        XmlElement element = new XmlElement(qName);
        for (int i = 0; i < attributes.getLength(); i++) {
            element.setAttribute(attributes.getQName(i), attributes.getValue(i));
        }
        if (open.isEmpty()) {
            root = element;
        } else {
            open.peek().appendChild(element);
        }
        open.push(element);
    }

    @Override
    public void endElement(String uri, String localName, String qName) {
        open.pop();
    }

    @Override
    public void characters(char[] ch, int start, int length) {
        if (open.isEmpty()) {
            return;
        }
        XmlElement current = open.peek();
        XmlNode last = current.getChildCount() == 0 ? null : current.getChild(current.getChildCount() - 1);
        String text = new String(ch, start, length);
        if (last instanceof XmlText) {
            XmlText previous = (XmlText) last;
            previous.setText(previous.getText() + text);
        } else {
            current.appendChild(new XmlText(text));
        }
    }

    @Override
    public void comment(char[] ch, int start, int length) {
        if (!open.isEmpty()) {
            open.peek().appendChild(new XmlComment(new String(ch, start, length)));
        }
    }

    @Override
    public void processingInstruction(String target, String data) {
        if (!open.isEmpty()) {
            open.peek().appendChild(new XmlProcessingInstruction(target, data));
        }
    }
}
