package com.chih.JQWeb.spring;

import com.chih.JQWeb.core.engine.QWebEngine;
import com.chih.JQWeb.core.engine.QWebSettings;
import com.chih.JQWeb.core.impl.CaffeineTemplateCache;
import com.chih.JQWeb.core.impl.DefaultFieldConverter;
import com.chih.JQWeb.core.impl.NoOpRenderMetrics;
import com.chih.JQWeb.core.spi.AccessChecker;
import com.chih.JQWeb.core.spi.AssetLinkProvider;
import com.chih.JQWeb.core.spi.FieldConverter;
import com.chih.JQWeb.core.spi.RenderMetrics;
import com.chih.JQWeb.core.spi.TemplateCache;
import com.chih.JQWeb.core.spi.TemplateSource;
import com.chih.JQWeb.spring.health.JQWebHealthIndicator;
import com.chih.JQWeb.spring.metrics.MicrometerRenderMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;

/**
 * JQWeb Spring Boot 自动配置
 * <p>
 * 所有组件都带 {@code @ConditionalOnMissingBean}，应用可以声明自己的实现覆盖默认值。
 * </p>
 *
 * <pre>{@code
 * j-qweb:
 *   locations:
 *     - classpath*:templates/*.xml
 *     - file:./custom-templates/*.xml
 *   debounce-millis: 1000
 *   dev-mode: qweb
 * }</pre>
 *
 * @see JQWebProperties
 * @see SpringResourceTemplateSource
 * @see QWebEngine
 *
 * @author lizhiyuan
 * @since 2026/10/16
 */
@AutoConfiguration
@EnableConfigurationProperties(JQWebProperties.class)
public class JQWebAutoConfiguration {

    /**
     * 文件监听线程，单线程守护
     */
    @Bean("jQWebWatcherExecutor")
    public ExecutorService jQWebWatcherExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setThreadNamePrefix("jqweb-watcher-");
        executor.setDaemon(true);
        executor.initialize();
        return executor.getThreadPoolExecutor();
    }

    /**
     * 防抖定时器，单线程保证事件顺序
     */
    @Bean("jQWebDebounceExecutor")
    public ScheduledExecutorService jQWebDebounceExecutor() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("jqweb-debouncer-");
        scheduler.setDaemon(true);
        scheduler.initialize();
        return scheduler.getScheduledExecutor();
    }

    @Bean
    @ConditionalOnMissingBean(TemplateSource.class)
    public TemplateSource templateSource(JQWebProperties properties,
            @Qualifier("jQWebWatcherExecutor") ExecutorService watcherExecutor,
            @Qualifier("jQWebDebounceExecutor") ScheduledExecutorService debounceExecutor) {
        return new SpringResourceTemplateSource(properties.getLocations(), properties.getDebounceMillis(),
                watcherExecutor, debounceExecutor);
    }

    @Bean
    @ConditionalOnMissingBean(TemplateCache.class)
    public TemplateCache templateCache(JQWebProperties properties) {
        return new CaffeineTemplateCache(properties.getCacheMaximumSize());
    }

    @Bean
    @ConditionalOnMissingBean(FieldConverter.class)
    public FieldConverter fieldConverter() {
        return new DefaultFieldConverter();
    }

    @Bean
    @ConditionalOnMissingBean(AssetLinkProvider.class)
    public AssetLinkProvider assetLinkProvider() {
        return AssetLinkProvider.none();
    }

    @Bean
    @ConditionalOnMissingBean(AccessChecker.class)
    public AccessChecker accessChecker() {
        return AccessChecker.allowAll();
    }

    /**
     * 类路径中有 Micrometer 且存在 MeterRegistry 时使用 Micrometer 实现
     */
    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(MeterRegistry.class)
    static class MetricsConfiguration {

        @Bean
        @ConditionalOnBean(MeterRegistry.class)
        @ConditionalOnMissingBean(RenderMetrics.class)
        public RenderMetrics renderMetrics(MeterRegistry registry) {
            return new MicrometerRenderMetrics(registry);
        }
    }

    // 保底：没有监控环境时注入空实现
    @Bean
    @ConditionalOnMissingBean(RenderMetrics.class)
    public RenderMetrics defaultRenderMetrics() {
        return new NoOpRenderMetrics();
    }

    @Bean
    @ConditionalOnMissingBean(QWebEngine.class)
    public QWebEngine qWebEngine(JQWebProperties properties,
            TemplateSource source,
            TemplateCache cache,
            FieldConverter fieldConverter,
            AssetLinkProvider assetLinkProvider,
            AccessChecker accessChecker,
            RenderMetrics metrics) {
        QWebSettings settings = QWebSettings.builder()
                .devMode(properties.getDevMode())
                .preserveComments(properties.isPreserveComments())
                .build();
        return QWebEngine.builder(source)
                .cache(cache)
                .settings(settings)
                .fieldConverter(fieldConverter)
                .assetLinkProvider(assetLinkProvider)
                .accessChecker(accessChecker)
                .metrics(metrics)
                .build();
    }

    /**
     * 健康检查，仅在引入 Actuator 时生效
     */
    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(HealthIndicator.class)
    static class HealthCheckConfiguration {

        @Bean
        @ConditionalOnMissingBean(name = "jQWebHealthIndicator")
        public JQWebHealthIndicator jQWebHealthIndicator(TemplateSource source) {
            // 自定义 TemplateSource 没有加载错误信息，不注册
            if (source instanceof SpringResourceTemplateSource) {
                return new JQWebHealthIndicator((SpringResourceTemplateSource) source);
            }
            return null;
        }
    }
}
