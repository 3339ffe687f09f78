package com.chih.JQWeb.core.impl;

import com.chih.JQWeb.core.domain.TemplateDefinition;
import com.chih.JQWeb.core.engine.QWebEngine;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

/**
 * FileTemplateSource 单元测试
 *
 * 覆盖目录扫描、classpath 加载、错误隔离与热更新。
 */
@DisplayName("FileTemplateSource 测试")
class FileTemplateSourceTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("加载单个文件中的多个模板")
    void testSingleFile() throws Exception {
        Path file = tempDir.resolve("layout.xml");
        Files.writeString(file, """
                <templates>
                    <t t-name="web.layout"><html><t t-out="0"/></html></t>
                    <template id="web.footer" t-inherit="web.layout" t-inherit-mode="extension"><footer/></template>
                </templates>
                """);

        FileTemplateSource source = new FileTemplateSource(file.toString());
        try {
            Map<String, TemplateDefinition> templates = source.loadAll();
            assertThat(templates).containsOnlyKeys("web.layout", "web.footer");

            TemplateDefinition footer = source.load("web.footer");
            assertThat(footer.getElement().getTag()).isEqualTo("t");
            assertThat(footer.getInheritFrom()).isEqualTo("web.layout");
            assertThat(footer.getInheritMode()).isEqualTo("extension");

            assertThat(source.load("nonexistent")).isNull();
        } finally {
            source.close();
        }
    }

    @Test
    @DisplayName("递归扫描目录，忽略非 xml 文件")
    void testDirectoryScan() throws Exception {
        Path nested = Files.createDirectories(tempDir.resolve("mail"));
        Files.writeString(tempDir.resolve("a.xml"), "<t t-name=\"a\">A</t>");
        Files.writeString(nested.resolve("b.xml"), "<t t-name=\"mail.b\">B</t>");
        Files.writeString(tempDir.resolve("readme.txt"), "<t t-name=\"c\">C</t>");

        FileTemplateSource source = new FileTemplateSource(tempDir.toString());
        try {
            assertThat(source.getTemplateNames()).containsExactlyInAnyOrder("a", "mail.b");
        } finally {
            source.close();
        }
    }

    @Test
    @DisplayName("从 classpath 加载")
    void testClasspath() throws Exception {
        FileTemplateSource source = new FileTemplateSource("classpath:templates/");
        try {
            assertThat(source.getTemplateNames()).contains("shop.product_card", "shop.product_list");
        } finally {
            source.close();
        }
    }

    @Test
    @DisplayName("不存在的路径不报错")
    void testMissingPath() throws Exception {
        FileTemplateSource source = new FileTemplateSource(tempDir.resolve("nowhere").toString());
        try {
            assertThat(source.loadAll()).isEmpty();
        } finally {
            source.close();
        }
    }

    @Test
    @DisplayName("单个文件解析失败不影响其他文件")
    void testMalformedFileIsolated() throws Exception {
        Files.writeString(tempDir.resolve("bad.xml"), "<t t-name=\"bad\"><div></t>");
        Files.writeString(tempDir.resolve("good.xml"), "<t t-name=\"good\">ok</t>");

        FileTemplateSource source = new FileTemplateSource(tempDir.toString());
        try {
            assertThat(source.getTemplateNames()).containsExactly("good");
            assertThat(source.getLoadErrors()).hasSize(1);
            assertThat(source.getLoadErrors().keySet().iterator().next()).endsWith("bad.xml");
        } finally {
            source.close();
        }
    }

    @Test
    @DisplayName("文件修改后引擎渲染新内容")
    void testHotReloadThroughEngine() throws Exception {
        Path file = tempDir.resolve("banner.xml");
        Files.writeString(file, "<t t-name=\"banner\"><b>old</b></t>");

        FileTemplateSource source = new FileTemplateSource(List.of(file.toString()), 100, null, null);
        try {
            QWebEngine engine = QWebEngine.builder(source).build();
            assertThat(engine.render("banner", Map.of())).isEqualTo("<b>old</b>");

            Files.writeString(file, "<t t-name=\"banner\"><b>new</b></t>");

            // 等待防抖结束后的缓存失效
            long deadline = System.currentTimeMillis() + 10_000;
            String html = engine.render("banner", Map.of());
            while (!"<b>new</b>".equals(html) && System.currentTimeMillis() < deadline) {
                Thread.sleep(100);
                html = engine.render("banner", Map.of());
            }
            assertThat(html).isEqualTo("<b>new</b>");
        } finally {
            source.close();
        }
    }

    @Test
    @DisplayName("目录中新增文件被发现")
    void testNewFileInWatchedDirectory() throws Exception {
        Files.writeString(tempDir.resolve("first.xml"), "<t t-name=\"first\">1</t>");

        FileTemplateSource source = new FileTemplateSource(List.of(tempDir.toString()), 100, null, null);
        try {
            CountDownLatch latch = new CountDownLatch(1);
            source.onChange(event -> {
                if (event.getUpdated().containsKey("second")) {
                    latch.countDown();
                }
            });

            Files.writeString(tempDir.resolve("second.xml"), "<t t-name=\"second\">2</t>");

            assertThat(latch.await(10, TimeUnit.SECONDS)).isTrue();
            assertThat(source.getTemplateNames()).contains("first", "second");
        } finally {
            source.close();
        }
    }
}
