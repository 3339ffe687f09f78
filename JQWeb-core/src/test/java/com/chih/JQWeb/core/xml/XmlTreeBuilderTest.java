package com.chih.JQWeb.core.xml;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("XmlTreeBuilder 测试")
class XmlTreeBuilderTest {

    @Test
    @DisplayName("保留属性顺序")
    void testAttributeOrder() {
        XmlElement root = XmlTreeBuilder.parse("<div z=\"1\" a=\"2\" t-if=\"x\" m=\"3\"/>");

        assertThat(root.attributeNames()).containsExactly("z", "a", "t-if", "m");
    }

    @Test
    @DisplayName("文本、注释与处理指令")
    void testMixedContent() {
        XmlElement root = XmlTreeBuilder.parse("<t>a &amp; b<!-- note --><?php echo 1?><br/>tail</t>");

        assertThat(root.getChildren()).hasSize(5);
        assertThat(((XmlText) root.getChild(0)).getText()).isEqualTo("a & b");
        assertThat(((XmlComment) root.getChild(1)).getText()).isEqualTo(" note ");
        XmlProcessingInstruction pi = (XmlProcessingInstruction) root.getChild(2);
        assertThat(pi.getTarget()).isEqualTo("php");
        assertThat(pi.getData()).isEqualTo("echo 1");
        assertThat(((XmlElement) root.getChild(3)).getTag()).isEqualTo("br");
        assertThat(root.getChild(3).getParent()).isSameAs(root);
    }

    @Test
    @DisplayName("命名空间前缀原样保留")
    void testNamespacePrefix() {
        XmlElement root = XmlTreeBuilder.parse("<svg xmlns:xlink=\"http://www.w3.org/1999/xlink\"><use xlink:href=\"#a\"/></svg>");

        assertThat(root.getAttribute("xmlns:xlink")).isEqualTo("http://www.w3.org/1999/xlink");
        assertThat(root.getChildElements().get(0).getAttribute("xlink:href")).isEqualTo("#a");
    }

    @Test
    @DisplayName("格式错误")
    void testMalformed() {
        assertThatThrownBy(() -> XmlTreeBuilder.parse("<div><p></div>"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Malformed XML");

        ByteArrayInputStream input = new ByteArrayInputStream("<div>".getBytes(StandardCharsets.UTF_8));
        assertThatThrownBy(() -> XmlTreeBuilder.parse(input))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("Malformed XML");
    }

    @Test
    @DisplayName("禁止 DOCTYPE 与外部实体")
    void testDoctypeRejected() {
        String xxe = "<?xml version=\"1.0\"?><!DOCTYPE t [<!ENTITY x SYSTEM \"file:///etc/passwd\">]><t>&x;</t>";

        assertThatThrownBy(() -> XmlTreeBuilder.parse(xxe)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("路径与起始标签")
    void testPathAndStartTag() {
        XmlElement root = XmlTreeBuilder.parse("<t><div/><div><span title=\"a&quot;b\"/></div></t>");
        XmlElement span = root.getChildElements().get(1).getChildElements().get(0);

        assertThat(span.getPath()).isEqualTo("/t/div[2]/span");
        assertThat(span.toStartTag()).isEqualTo("<span title=\"a&quot;b\"/>");
    }

    @Test
    @DisplayName("复制后与原树互不影响")
    void testCopy() {
        XmlElement root = XmlTreeBuilder.parse("<t a=\"1\"><b>x</b></t>");
        XmlElement copy = root.copy();

        copy.setAttribute("a", "2");
        copy.getChildElements().get(0).setAttribute("c", "3");

        assertThat(root.getAttribute("a")).isEqualTo("1");
        assertThat(root.getChildElements().get(0).hasAttribute("c")).isFalse();
        assertThat(copy.getChildElements().get(0).getParent()).isSameAs(copy);
    }
}
