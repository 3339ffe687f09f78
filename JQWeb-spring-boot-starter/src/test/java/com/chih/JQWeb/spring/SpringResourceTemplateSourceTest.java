package com.chih.JQWeb.spring;

import com.chih.JQWeb.core.domain.TemplateDefinition;
import com.chih.JQWeb.core.spi.TemplateChangeEvent;
import com.chih.JQWeb.core.xml.XmlText;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("SpringResourceTemplateSource 测试")
class SpringResourceTemplateSourceTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("加载单个文件系统资源")
    void testSingleFileSystemResource() throws Exception {
        Path file = tempDir.resolve("pages.xml");
        Files.writeString(file, """
                <templates>
                    <t t-name="page.header"><h1 t-out="title"/></t>
                    <template id="page.footer"><footer>bye</footer></template>
                </templates>
                """);

        SpringResourceTemplateSource source = new SpringResourceTemplateSource(
                List.of("file:" + file), 100, null, null);
        try {
            Map<String, TemplateDefinition> templates = source.loadAll();
            assertThat(templates).containsOnlyKeys("page.header", "page.footer");
            assertThat(source.load("page.header").getOrigin()).isNotNull();
            assertThat(source.load("missing")).isNull();
            assertThat(source.getLoadErrors()).isEmpty();
        } finally {
            source.close();
        }
    }

    @Test
    @DisplayName("通配符只加载 xml 文件")
    void testWildcardPattern() throws Exception {
        Files.writeString(tempDir.resolve("a.xml"), "<t t-name=\"a\">A</t>");
        Files.writeString(tempDir.resolve("b.xml"), "<t t-name=\"b\">B</t>");
        Files.writeString(tempDir.resolve("notes.txt"), "<t t-name=\"c\">C</t>");

        SpringResourceTemplateSource source = new SpringResourceTemplateSource(
                List.of("file:" + tempDir + "/*"), 100, null, null);
        try {
            assertThat(source.getTemplateNames()).containsExactlyInAnyOrder("a", "b");
        } finally {
            source.close();
        }
    }

    @Test
    @DisplayName("classpath 资源")
    void testClasspathResources() throws Exception {
        SpringResourceTemplateSource source = new SpringResourceTemplateSource(
                List.of("classpath*:templates/*.xml"), 100, null, null);
        try {
            assertThat(source.loadAll()).containsKey("greeting");
        } finally {
            source.close();
        }
    }

    @Test
    @DisplayName("格式错误的文件记录到加载错误中")
    void testMalformedFile() throws Exception {
        Files.writeString(tempDir.resolve("broken.xml"), "<t t-name=\"broken\"><p></t>");
        Files.writeString(tempDir.resolve("ok.xml"), "<t t-name=\"ok\">ok</t>");

        SpringResourceTemplateSource source = new SpringResourceTemplateSource(
                List.of("file:" + tempDir + "/*.xml"), 100, null, null);
        try {
            assertThat(source.getTemplateNames()).containsExactly("ok");
            assertThat(source.getLoadErrors()).hasSize(1);
        } finally {
            source.close();
        }
    }

    @Test
    @DisplayName("文件修改触发变更事件")
    void testHotReload() throws Exception {
        Path file = tempDir.resolve("live.xml");
        Files.writeString(file, "<t t-name=\"live\">v1</t>");

        SpringResourceTemplateSource source = new SpringResourceTemplateSource(
                List.of("file:" + file), 100, null, null);
        try {
            CountDownLatch latch = new CountDownLatch(1);
            AtomicReference<TemplateChangeEvent> received = new AtomicReference<>();
            source.onChange(event -> {
                if (event.getUpdated().containsKey("live")) {
                    received.set(event);
                    latch.countDown();
                }
            });

            Files.writeString(file, "<t t-name=\"live\">v2</t>");

            assertThat(latch.await(10, TimeUnit.SECONDS)).isTrue();
            XmlText text = (XmlText) received.get().getUpdated().get("live").getElement().getFirstChild();
            assertThat(text.getText()).isEqualTo("v2");
        } finally {
            source.close();
        }
    }

    @Test
    @DisplayName("destroy 关闭监听线程")
    void testDestroy() {
        SpringResourceTemplateSource source = new SpringResourceTemplateSource(
                List.of("classpath:/nonexistent/*.xml"), 100, null, null);
        assertThat(source.loadAll()).isEmpty();
        source.destroy();
    }
}
