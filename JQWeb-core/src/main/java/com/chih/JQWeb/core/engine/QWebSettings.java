package com.chih.JQWeb.core.engine;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 引擎级设置：影响编译产物但不进入缓存键
 *
 * @author lizhiyuan
 * @since 2026/10/11
 */
public final class QWebSettings {

    public static final QWebSettings DEFAULT = builder().build();

    /** 开发模式标志，如 {@code xml}（不缓存编译产物）、{@code qweb}（启用 t-debug 与弃用警告） */
    private final Set<String> devMode;

    /** 保留注释与处理指令 */
    private final boolean preserveComments;

    private QWebSettings(Builder builder) {
        this.devMode = Collections.unmodifiableSet(new LinkedHashSet<>(builder.devMode));
        this.preserveComments = builder.preserveComments;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Set<String> getDevMode() {
        return devMode;
    }

    public boolean isDevMode(String flag) {
        return devMode.contains(flag) || devMode.contains("all");
    }

    public boolean isPreserveComments() {
        return preserveComments;
    }

    public static final class Builder {
        private final Set<String> devMode = new LinkedHashSet<>();
        private boolean preserveComments;

        private Builder() {
        }

        /**
         * 逗号分隔的开发模式，如 {@code "xml,qweb"}
         */
        public Builder devMode(String flags) {
            if (flags != null) {
                for (String flag : flags.split(",")) {
                    if (!flag.isBlank()) {
                        devMode.add(flag.trim());
                    }
                }
            }
            return this;
        }

        public Builder preserveComments(boolean preserveComments) {
            this.preserveComments = preserveComments;
            return this;
        }

        public QWebSettings build() {
            return new QWebSettings(this);
        }
    }
}
