package com.chih.JQWeb.spring.health;

import com.chih.JQWeb.spring.SpringResourceTemplateSource;
import org.springframework.boot.actuate.health.AbstractHealthIndicator;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.util.Map;
import java.util.stream.Collectors;

/**
 * 模板源健康检查
 * 存在解析失败的模板文件时状态为 DOWN
 *
 * @author lizhiyuan
 * @since 2026/10/17
 */
public class JQWebHealthIndicator extends AbstractHealthIndicator {

    private final SpringResourceTemplateSource templateSource;

    public JQWebHealthIndicator(SpringResourceTemplateSource templateSource) {
        this.templateSource = templateSource;
    }

    @Override
    protected void doHealthCheck(Health.Builder builder) throws Exception {
        Map<String, Throwable> errors = templateSource.getLoadErrors();

        if (errors.isEmpty()) {
            builder.up()
                    .withDetail("message", "All templates loaded successfully.")
                    .withDetail("templateCount", templateSource.getTemplateNames().size());
        } else {
            builder.status(Status.DOWN).withDetail("message", "Some template files failed to load.")
                    .withDetail("errorCount", errors.size())
                    .withDetail("errors", errors.entrySet().stream()
                            .collect(Collectors.toMap(Map.Entry::getKey, e -> String.valueOf(e.getValue().getMessage()))));
        }
    }
}
