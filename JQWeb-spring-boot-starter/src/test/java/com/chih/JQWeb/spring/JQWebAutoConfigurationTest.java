package com.chih.JQWeb.spring;

import com.chih.JQWeb.core.engine.QWebEngine;
import com.chih.JQWeb.core.impl.CaffeineTemplateCache;
import com.chih.JQWeb.core.impl.InMemoryTemplateSource;
import com.chih.JQWeb.core.impl.NoOpRenderMetrics;
import com.chih.JQWeb.core.spi.RenderMetrics;
import com.chih.JQWeb.core.spi.TemplateCache;
import com.chih.JQWeb.core.spi.TemplateSource;
import com.chih.JQWeb.spring.health.JQWebHealthIndicator;
import com.chih.JQWeb.spring.metrics.MicrometerRenderMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Status;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("JQWebAutoConfiguration 测试")
class JQWebAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(JQWebAutoConfiguration.class))
            .withPropertyValues("j-qweb.locations=classpath*:templates/*.xml");

    @Test
    @DisplayName("默认配置创建全部组件")
    void testDefaultBeans() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(QWebEngine.class);
            assertThat(context).hasSingleBean(TemplateSource.class);
            assertThat(context.getBean(TemplateSource.class)).isInstanceOf(SpringResourceTemplateSource.class);
            assertThat(context.getBean(TemplateCache.class)).isInstanceOf(CaffeineTemplateCache.class);
            // 没有 MeterRegistry 时使用空实现
            assertThat(context.getBean(RenderMetrics.class)).isInstanceOf(NoOpRenderMetrics.class);
            assertThat(context).hasBean("jQWebWatcherExecutor");
            assertThat(context).hasBean("jQWebDebounceExecutor");
        });
    }

    @Test
    @DisplayName("从 classpath 加载模板并渲染")
    void testRenderFromClasspath() {
        contextRunner.run(context -> {
            QWebEngine engine = context.getBean(QWebEngine.class);
            assertThat(engine.render("greeting", Map.of("name", "<World>")))
                    .isEqualTo("<p>Hello &lt;World&gt;</p>");
        });
    }

    @Test
    @DisplayName("配置属性绑定到引擎设置")
    void testPropertiesBinding() {
        contextRunner.withPropertyValues("j-qweb.dev-mode=xml,qweb", "j-qweb.preserve-comments=true",
                        "j-qweb.debounce-millis=1000")
                .run(context -> {
                    JQWebProperties properties = context.getBean(JQWebProperties.class);
                    assertThat(properties.getDebounceMillis()).isEqualTo(1000);

                    QWebEngine engine = context.getBean(QWebEngine.class);
                    assertThat(engine.getSettings().isDevMode("xml")).isTrue();
                    assertThat(engine.getSettings().isDevMode("qweb")).isTrue();
                    assertThat(engine.getSettings().isPreserveComments()).isTrue();
                });
    }

    @Test
    @DisplayName("存在 MeterRegistry 时启用 Micrometer 监控")
    void testMicrometerMetrics() {
        contextRunner.withBean(MeterRegistry.class, SimpleMeterRegistry::new)
                .run(context -> {
                    assertThat(context.getBean(RenderMetrics.class)).isInstanceOf(MicrometerRenderMetrics.class);

                    context.getBean(QWebEngine.class).render("greeting", Map.of("name", "x"));
                    MeterRegistry registry = context.getBean(MeterRegistry.class);
                    assertThat(registry.find("jqweb.render.count").tag("template", "greeting").counter())
                            .isNotNull();
                    assertThat(registry.find("jqweb.compile.timer").timer()).isNotNull();
                });
    }

    @Test
    @DisplayName("用户自定义 TemplateSource 优先")
    void testCustomTemplateSource() {
        contextRunner.withBean(TemplateSource.class,
                        () -> new InMemoryTemplateSource().add("custom", "<t t-name=\"custom\"><b>custom</b></t>"))
                .run(context -> {
                    assertThat(context.getBean(TemplateSource.class)).isInstanceOf(InMemoryTemplateSource.class);
                    assertThat(context.getBean(QWebEngine.class).render("custom", Map.of()))
                            .isEqualTo("<b>custom</b>");
                    // 非 SpringResourceTemplateSource 不注册健康检查
                    assertThat(context).doesNotHaveBean(JQWebHealthIndicator.class);
                });
    }

    @Test
    @DisplayName("健康检查在模板全部加载成功时为 UP")
    void testHealthIndicator() {
        contextRunner.run(context -> {
            JQWebHealthIndicator indicator = context.getBean(JQWebHealthIndicator.class);
            assertThat(indicator.health().getStatus()).isEqualTo(Status.UP);
            assertThat(indicator.health().getDetails()).containsEntry("templateCount", 1);
        });
    }

    @Test
    @DisplayName("JQWebProperties 默认值")
    void testPropertiesDefaults() {
        JQWebProperties properties = new JQWebProperties();

        assertThat(properties.getLocations()).containsExactly("classpath*:templates/**/*.xml", "file:./templates/*.xml");
        assertThat(properties.getDebounceMillis()).isEqualTo(500);
        assertThat(properties.getCacheMaximumSize()).isEqualTo(10_000);
        assertThat(properties.getDevMode()).isEmpty();
        assertThat(properties.isPreserveComments()).isFalse();
        assertThat(JQWebProperties.class.getAnnotation(ConfigurationProperties.class).prefix()).isEqualTo("j-qweb");
    }
}
