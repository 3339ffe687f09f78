package com.chih.JQWeb.core.engine;

import com.chih.JQWeb.core.exception.TemplateCompileException;
import com.chih.JQWeb.core.impl.InMemoryTemplateSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("QWebEngine 编译缓存")
class QWebEngineCacheTest {

    private InMemoryTemplateSource source;
    private QWebEngine engine;

    @BeforeEach
    void setUp() {
        source = new InMemoryTemplateSource();
        source.add("card", "<t t-name=\"card\"><h1 t-out=\"title\"/></t>");
        source.add("page", "<t t-name=\"page\"><main><t t-call=\"card\"/></main></t>");
        engine = QWebEngine.builder(source).build();
    }

    @Test
    @DisplayName("重复渲染不重新编译，被调模板随调用方一起预编译")
    void testCompileOnce() {
        assertThat(engine.render("page", Map.of("title", "A"))).isEqualTo("<main><h1>A</h1></main>");
        assertThat(engine.render("page", Map.of("title", "B"))).isEqualTo("<main><h1>B</h1></main>");
        assertThat(engine.render("card", Map.of("title", "C"))).isEqualTo("<h1>C</h1>");

        assertThat(engine.getCompileCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("模板更新后缓存失效")
    void testInvalidationOnUpdate() {
        engine.render("page", Map.of("title", "A"));
        source.add("card", "<t t-name=\"card\"><h2 t-out=\"title\"/></t>");

        assertThat(engine.render("page", Map.of("title", "A"))).isEqualTo("<main><h2>A</h2></main>");
        assertThat(engine.getCompileCount()).isEqualTo(4);
    }

    @Test
    @DisplayName("模板删除后渲染报告未找到")
    void testInvalidationOnRemove() {
        engine.render("page", Map.of());
        source.remove("card");

        String html = engine.render("page", Map.of(), RenderOptions.builder().raiseIfNotFound(false).build());

        assertThat(html).isEqualTo("<main></main>");
    }

    @Test
    @DisplayName("不同渲染选项各自编译")
    void testOptionsAreCacheKeys() {
        engine.render("card", Map.of("title", "x"));
        engine.render("card", Map.of("title", "x"), RenderOptions.builder().lang("fr_FR").build());
        engine.render("card", Map.of("title", "x"), RenderOptions.builder().lang("fr_FR").build());

        assertThat(engine.getCompileCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("t-lang 以新的语言编译被调模板")
    void testLangOverride() {
        source.add("localized", "<t t-name=\"localized\"><t t-call=\"card\" t-lang=\"'fr_FR'\"/></t>");

        assertThat(engine.render("localized", Map.of("title", "Bonjour"))).isEqualTo("<h1>Bonjour</h1>");
        assertThat(engine.getCompileCount()).isEqualTo(2);

        engine.render("card", Map.of("title", "Hello"));
        assertThat(engine.getCompileCount()).isEqualTo(3);
    }

    @Test
    @DisplayName("xml 开发模式每次渲染都重新编译")
    void testDevModeRecompiles() {
        engine = QWebEngine.builder(source).settings(QWebSettings.builder().devMode("xml").build()).build();

        engine.render("card", Map.of());
        engine.render("card", Map.of());

        assertThat(engine.getCompileCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("未找到的模板不计入编译次数")
    void testNotFoundIsNotCounted() {
        engine.render("nothing", Map.of(), RenderOptions.builder().raiseIfNotFound(false).build());

        assertThat(engine.getCompileCount()).isZero();
    }

    @Test
    @DisplayName("编译失败的结果同样被缓存")
    void testFailureIsCached() {
        source.add("broken", "<t t-name=\"broken\"><p t-call=\"card\"/></t>");
        for (int i = 0; i < 3; i++) {
            assertThatThrownBy(() -> engine.render("broken", Map.of()))
                    .isInstanceOf(TemplateCompileException.class)
                    .hasMessageContaining("t-call must be on a <t> element");
        }
        assertThat(engine.getCompileCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("并发渲染同一模板只编译一次")
    void testConcurrentRenders() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<String>> results = new ArrayList<>();
            for (int i = 0; i < 32; i++) {
                int n = i;
                results.add(pool.submit(() -> engine.render("card", Map.of("title", n))));
            }
            for (int i = 0; i < results.size(); i++) {
                assertThat(results.get(i).get()).isEqualTo("<h1>" + i + "</h1>");
            }
        } finally {
            pool.shutdownNow();
        }
        assertThat(engine.getCompileCount()).isEqualTo(1);
    }

    @Test
    void testClearCache() {
        engine.render("card", Map.of());
        engine.clearCache();
        engine.render("card", Map.of());

        assertThat(engine.getCompileCount()).isEqualTo(2);
    }
}
