package com.chih.JQWeb.core.support;

import com.chih.JQWeb.core.domain.TemplateDefinition;
import com.chih.JQWeb.core.xml.XmlElement;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * TemplateParser 单元测试
 */
@DisplayName("TemplateParser 测试")
class TemplateParserTest {

    @ParameterizedTest
    @CsvSource({"a.xml, true", "A.XML, true", "a.yaml, false", "a.xml.bak, false", "xml, false"})
    @DisplayName("支持的文件类型")
    void testSupportedFiles(String filename, boolean supported) {
        assertThat(TemplateParser.isSupportedFile(filename)).isEqualTo(supported);
        assertThat(TemplateParser.isSupportedFile(null)).isFalse();
    }

    @Test
    @DisplayName("文档中的多个模板保持顺序")
    void testDocument() {
        Map<String, TemplateDefinition> templates = TemplateParser.parse("""
                <templates>
                    <t t-name="b"><p>b</p></t>
                    <div>ignored</div>
                    <t t-name="a"><p>a</p></t>
                </templates>
                """, "doc.xml");

        assertThat(templates.keySet()).containsExactly("b", "a");
        TemplateDefinition b = templates.get("b");
        assertThat(b.getOrigin()).isEqualTo("doc.xml");
        assertThat(b.getElement().getParent()).isNull();
    }

    @Test
    @DisplayName("根元素本身就是模板")
    void testRootTemplate() {
        Map<String, TemplateDefinition> templates = TemplateParser.parse("<t t-name=\"solo\">x</t>", "solo.xml");

        assertThat(templates).containsOnlyKeys("solo");
    }

    @Test
    @DisplayName("<template id> 转为 <t t-name>，只保留 t-* 属性")
    void testTemplateTag() {
        Map<String, TemplateDefinition> templates = TemplateParser.parse(
                "<odoo><template id=\"web.x\" name=\"Label\" priority=\"5\" t-inherit=\"web.base\"><p/></template></odoo>",
                "views.xml");

        TemplateDefinition definition = templates.get("web.x");
        XmlElement element = definition.getElement();
        assertThat(element.getTag()).isEqualTo("t");
        assertThat(element.getAttribute("t-name")).isEqualTo("web.x");
        assertThat(element.hasAttribute("name")).isFalse();
        assertThat(element.hasAttribute("priority")).isFalse();
        assertThat(element.getChildElements()).extracting(XmlElement::getTag).containsExactly("p");
        assertThat(definition.getInheritFrom()).isEqualTo("web.base");
        assertThat(definition.getInheritMode()).isEqualTo("primary");
    }

    @Test
    @DisplayName("非法的继承模式")
    void testInvalidInheritMode() {
        assertThatThrownBy(() -> TemplateParser.parse(
                "<t t-name=\"x\" t-inherit=\"y\" t-inherit-mode=\"replace\"/>", "bad.xml"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Invalid t-inherit-mode 'replace'");
    }

    @Test
    @DisplayName("同名模板后者覆盖前者")
    void testDuplicateNames() {
        Map<String, TemplateDefinition> templates = TemplateParser.parse(
                "<templates><t t-name=\"x\">1</t><t t-name=\"x\">2</t></templates>", "dup.xml");

        assertThat(templates).hasSize(1);
        assertThat(templates.get("x").getElement().getFirstChild().toString()).contains("2");
    }

    @Test
    @DisplayName("输入流：BOM 与 CRLF")
    void testStreamWithBomAndCrlf() throws IOException {
        byte[] body = "<t t-name=\"crlf\">a\r\nb</t>".getBytes(StandardCharsets.UTF_8);
        byte[] content = new byte[body.length + 3];
        content[0] = (byte) 0xEF;
        content[1] = (byte) 0xBB;
        content[2] = (byte) 0xBF;
        System.arraycopy(body, 0, content, 3, body.length);

        Map<String, TemplateDefinition> templates = TemplateParser.parse(new ByteArrayInputStream(content), "bom.xml");

        assertThat(templates.get("crlf").getElement().getFirstChild().toString()).doesNotContain("\r");
    }

    @Test
    @DisplayName("输入流：格式错误包装为 IOException")
    void testStreamMalformed() {
        InputStream input = new ByteArrayInputStream("<t t-name=\"x\">".getBytes(StandardCharsets.UTF_8));

        assertThatThrownBy(() -> TemplateParser.parse(input, "broken.xml"))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("broken.xml");
    }

    @Test
    @DisplayName("输入流：超过大小上限")
    void testStreamTooLarge() {
        byte[] large = new byte[10 * 1024 * 1024 + 1];
        Arrays.fill(large, (byte) ' ');

        assertThatThrownBy(() -> TemplateParser.parse(new ByteArrayInputStream(large), "huge.xml"))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("too large");
    }

    @Test
    void testNullStream() {
        assertThatThrownBy(() -> TemplateParser.parse((InputStream) null, "x"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
