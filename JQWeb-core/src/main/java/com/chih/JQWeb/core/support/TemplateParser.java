package com.chih.JQWeb.core.support;

import com.chih.JQWeb.core.domain.TemplateDefinition;
import com.chih.JQWeb.core.xml.XmlElement;
import com.chih.JQWeb.core.xml.XmlNode;
import com.chih.JQWeb.core.xml.XmlTreeBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * 模板文件解析器
 * <p>
 * 一个 .xml 文件可以包含多个模板：
 * <pre>{@code
 * <templates>
 *     <t t-name="web.layout">...</t>
 *     <template id="web.footer">...</template>   <!-- 转换为 <t t-name="web.footer"> -->
 * </templates>
 * }</pre>
 * 根元素自身带 {@code t-name} 时整个文件就是一个模板。
 * {@code t-inherit} / {@code t-inherit-mode} 只记录到定义上，继承合并不在这里处理。
 *
 * @author lizhiyuan
 * @since 2026/10/14
 */
public final class TemplateParser {

    private static final Logger log = LoggerFactory.getLogger(TemplateParser.class);

    /**
     * 单个模板文件大小上限（10MB），防止误选大文件导致 OOM
     */
    private static final int MAX_FILE_SIZE = 10 * 1024 * 1024;

    private TemplateParser() {
    }

    public static boolean isSupportedFile(String filename) {
        return filename != null && filename.toLowerCase(Locale.ROOT).endsWith(".xml");
    }

    /**
     * 解析输入流
     *
     * @param is     调用方负责关闭
     * @param origin 资源标识，写入定义并用于日志
     * @return key 为模板名称，保持文件中的顺序
     * @throws IOException 读取失败、文件过大或 XML 格式错误
     */
    public static Map<String, TemplateDefinition> parse(InputStream is, String origin) throws IOException {
        if (is == null) {
            throw new IllegalArgumentException("InputStream cannot be null");
        }
        byte[] content = readLimited(is, origin);
        try {
            XmlElement root = XmlTreeBuilder.parse(new ByteArrayInputStream(stripBom(content)));
            return collect(root, origin);
        } catch (IOException | IllegalArgumentException e) {
            log.error("Failed to parse template file: {}. Error: {}", origin, e.getMessage());
            throw new IOException("Failed to parse template file: " + origin, e);
        }
    }

    /**
     * 解析字符串形式的模板文档
     */
    public static Map<String, TemplateDefinition> parse(String xml, String origin) {
        return collect(XmlTreeBuilder.parse(normalizeContent(xml)), origin);
    }

    /**
     * 解析单个元素（内联模板），不做 {@code <template>} 转换
     */
    public static XmlElement parseElement(String xml) {
        return XmlTreeBuilder.parse(normalizeContent(xml));
    }

    private static Map<String, TemplateDefinition> collect(XmlElement root, String origin) {
        Map<String, TemplateDefinition> templates = new LinkedHashMap<>();
        if (root.hasAttribute("t-name") || isTemplateTag(root)) {
            addTemplate(templates, root, origin);
            return templates;
        }
        for (XmlElement child : root.getChildElements()) {
            if (child.hasAttribute("t-name") || isTemplateTag(child)) {
                addTemplate(templates, child, origin);
            } else {
                log.debug("Skipping element <{}> without t-name in {}", child.getTag(), origin);
            }
        }
        return templates;
    }

    private static boolean isTemplateTag(XmlElement element) {
        return "template".equals(element.getTag()) && element.hasAttribute("id");
    }

    private static void addTemplate(Map<String, TemplateDefinition> templates, XmlElement element, String origin) {
        XmlElement template = isTemplateTag(element) ? toTElement(element) : element;
        template.detach();
        String name = template.getAttribute("t-name");
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Template without name in " + origin);
        }
        String inheritFrom = template.removeAttribute("t-inherit");
        String inheritMode = template.removeAttribute("t-inherit-mode");
        if (inheritMode != null && !"primary".equals(inheritMode) && !"extension".equals(inheritMode)) {
            throw new IllegalArgumentException("Invalid t-inherit-mode '" + inheritMode + "' for template " + name);
        }
        if (templates.put(name, new TemplateDefinition(null, name, template, inheritFrom,
                inheritFrom == null ? null : (inheritMode == null ? "primary" : inheritMode), origin)) != null) {
            log.warn("Duplicate template name '{}' in {}, the last definition wins", name, origin);
        }
    }

    /**
     * {@code <template id="x" ...>} 转成 {@code <t t-name="x" ...>}，只保留 t-* 属性
     */
    private static XmlElement toTElement(XmlElement template) {
        XmlElement converted = new XmlElement("t");
        converted.setAttribute("t-name", template.getAttribute("id"));
        for (String name : template.attributeNames()) {
            if (name.startsWith("t-") && !"t-name".equals(name)) {
                converted.setAttribute(name, template.getAttribute(name));
            }
        }
        for (XmlNode child : new ArrayList<>(template.getChildren())) {
            converted.appendChild(child);
        }
        return converted;
    }

    private static byte[] readLimited(InputStream is, String origin) throws IOException {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        byte[] data = new byte[8192];
        int nRead;
        int totalBytes = 0;
        while ((nRead = is.read(data, 0, data.length)) != -1) {
            totalBytes += nRead;
            if (totalBytes > MAX_FILE_SIZE) {
                throw new IOException(String.format(
                        "File '%s' is too large (%d bytes). Maximum allowed size: %d bytes.",
                        origin, totalBytes, MAX_FILE_SIZE));
            }
            buffer.write(data, 0, nRead);
        }
        return buffer.toByteArray();
    }

    private static byte[] stripBom(byte[] content) {
        if (content.length >= 3 && (content[0] & 0xFF) == 0xEF && (content[1] & 0xFF) == 0xBB && (content[2] & 0xFF) == 0xBF) {
            return normalizeContent(new String(content, 3, content.length - 3, StandardCharsets.UTF_8))
                    .getBytes(StandardCharsets.UTF_8);
        }
        return content;
    }

    /**
     * 去掉 UTF-8 BOM，统一换行符为 \n
     */
    public static String normalizeContent(String content) {
        if (content == null) {
            return "";
        }
        if (content.startsWith("\uFEFF")) {
            content = content.substring(1);
        }
        return content.replace("\r\n", "\n");
    }
}
