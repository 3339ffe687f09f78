package com.chih.JQWeb.core.render;

import com.chih.JQWeb.core.engine.CompiledTemplate;
import com.chih.JQWeb.core.engine.QWebSettings;
import com.chih.JQWeb.core.engine.RenderOptions;
import com.chih.JQWeb.core.engine.TemplateCacheKey;
import com.chih.JQWeb.core.engine.TemplateOptions;
import com.chih.JQWeb.core.impl.DefaultFieldConverter;
import com.chih.JQWeb.core.impl.NoOpRenderMetrics;
import com.chih.JQWeb.core.spi.AccessChecker;
import com.chih.JQWeb.core.spi.AssetLinkProvider;
import com.chih.JQWeb.core.spi.FieldConverter;
import com.chih.JQWeb.core.spi.RenderMetrics;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 单次渲染的共享状态：入口绑定、选项、协作者与本次已解析的编译产物
 * <p>
 * 每次 render 新建一个，只在单个线程中使用。
 *
 * @author lizhiyuan
 * @since 2026/10/09
 */
public final class RenderSession {

    private final TemplateResolver resolver;

    private final Map<String, Object> rootValues;

    private final RenderOptions renderOptions;

    private final QWebSettings settings;

    private final FieldConverter fieldConverter;

    private final AssetLinkProvider assetLinkProvider;

    private final AccessChecker accessChecker;

    private final RenderMetrics metrics;

    private final Map<TemplateCacheKey, CompiledTemplate> loaded = new HashMap<>();

    /** 正在推进的栈机，内容块在其内部强制渲染时以它的深度为起点 */
    private RenderStackMachine active;

    private RenderSession(Builder builder) {
        this.resolver = Objects.requireNonNull(builder.resolver, "resolver");
        this.rootValues = Collections.unmodifiableMap(builder.rootValues);
        this.renderOptions = builder.renderOptions;
        this.settings = builder.settings;
        this.fieldConverter = builder.fieldConverter;
        this.assetLinkProvider = builder.assetLinkProvider;
        this.accessChecker = builder.accessChecker;
        this.metrics = builder.metrics;
    }

    public static Builder builder(TemplateResolver resolver) {
        return new Builder(resolver);
    }

    /**
     * 本次渲染内同一 (引用, 选项) 只解析一次
     */
    public CompiledTemplate resolve(Object reference, TemplateOptions options) {
        TemplateCacheKey key = new TemplateCacheKey(reference, options);
        CompiledTemplate template = loaded.get(key);
        if (template == null) {
            template = resolver.resolve(reference, options);
            loaded.put(key, template);
        }
        return template;
    }

    /**
     * 标记栈机开始推进
     *
     * @return 之前的活跃栈机，推进结束后交给 {@link #deactivate}
     */
    RenderStackMachine activate(RenderStackMachine machine) {
        RenderStackMachine previous = active;
        active = machine;
        return previous;
    }

    void deactivate(RenderStackMachine previous) {
        active = previous;
    }

    /**
     * 当前活跃栈机的总深度（含外层栈机），没有活跃栈机时为 0
     */
    public int currentDepth() {
        return active == null ? 0 : active.depth();
    }

    /**
     * 入口绑定的只读视图，ROOT 作用域从这里复制
     */
    public Map<String, Object> getRootValues() {
        return rootValues;
    }

    public TemplateOptions getRootOptions() {
        return renderOptions.getTemplateOptions();
    }

    public RenderOptions getRenderOptions() {
        return renderOptions;
    }

    public QWebSettings getSettings() {
        return settings;
    }

    public FieldConverter getFieldConverter() {
        return fieldConverter;
    }

    public AssetLinkProvider getAssetLinkProvider() {
        return assetLinkProvider;
    }

    public AccessChecker getAccessChecker() {
        return accessChecker;
    }

    public RenderMetrics getMetrics() {
        return metrics;
    }

    public static final class Builder {
        private final TemplateResolver resolver;
        private Map<String, Object> rootValues = Collections.emptyMap();
        private RenderOptions renderOptions = RenderOptions.DEFAULT;
        private QWebSettings settings = QWebSettings.DEFAULT;
        private FieldConverter fieldConverter = new DefaultFieldConverter();
        private AssetLinkProvider assetLinkProvider = AssetLinkProvider.none();
        private AccessChecker accessChecker = AccessChecker.allowAll();
        private RenderMetrics metrics = new NoOpRenderMetrics();

        private Builder(TemplateResolver resolver) {
            this.resolver = resolver;
        }

        public Builder rootValues(Map<String, Object> rootValues) {
            this.rootValues = rootValues;
            return this;
        }

        public Builder renderOptions(RenderOptions renderOptions) {
            this.renderOptions = renderOptions;
            return this;
        }

        public Builder settings(QWebSettings settings) {
            this.settings = settings;
            return this;
        }

        public Builder fieldConverter(FieldConverter fieldConverter) {
            this.fieldConverter = fieldConverter;
            return this;
        }

        public Builder assetLinkProvider(AssetLinkProvider assetLinkProvider) {
            this.assetLinkProvider = assetLinkProvider;
            return this;
        }

        public Builder accessChecker(AccessChecker accessChecker) {
            this.accessChecker = accessChecker;
            return this;
        }

        public Builder metrics(RenderMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public RenderSession build() {
            return new RenderSession(this);
        }
    }
}
