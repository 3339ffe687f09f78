package com.chih.JQWeb.spring.metrics;

import com.chih.JQWeb.core.spi.RenderMetrics;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.concurrent.TimeUnit;

/**
 * 基于 Micrometer 的监控实现
 * <p>
 * 监控指标说明：
 * <ul>
 *   <li>jqweb.render.timer: 顶层渲染耗时，tags: template, result={success|failure}</li>
 *   <li>jqweb.render.count: 顶层渲染次数</li>
 *   <li>jqweb.compile.timer: 缓存未命中时的编译耗时</li>
 *   <li>jqweb.directive.timer: profile 模式下单个指令的耗时，tags: template, directive</li>
 * </ul>
 * </p>
 * <p>
 * <strong>注意</strong>：模板引用会成为 tag，动态生成大量模板名时需要留意基数。
 * 指令计时不带节点路径 tag。
 * </p>
 */
public class MicrometerRenderMetrics implements RenderMetrics {

    private final MeterRegistry registry;

    public MicrometerRenderMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void recordRender(String template, long durationNs, boolean success) {
        String result = success ? "success" : "failure";
        Timer.builder("jqweb.render.timer")
                .description("Timer for template rendering")
                .tag("template", template)
                .tag("result", result)
                .register(registry)
                .record(durationNs, TimeUnit.NANOSECONDS);

        Counter.builder("jqweb.render.count")
                .description("Counter for template rendering")
                .tag("template", template)
                .tag("result", result)
                .register(registry)
                .increment();
    }

    @Override
    public void recordCompile(String template, long durationNs, boolean success) {
        Timer.builder("jqweb.compile.timer")
                .description("Timer for template compilation")
                .tag("template", template)
                .tag("result", success ? "success" : "failure")
                .register(registry)
                .record(durationNs, TimeUnit.NANOSECONDS);
    }

    @Override
    public void recordDirective(String template, String directive, String path, long durationNs) {
        Timer.builder("jqweb.directive.timer")
                .description("Timer for profiled directives")
                .tag("template", template)
                .tag("directive", directive)
                .register(registry)
                .record(durationNs, TimeUnit.NANOSECONDS);
    }
}
