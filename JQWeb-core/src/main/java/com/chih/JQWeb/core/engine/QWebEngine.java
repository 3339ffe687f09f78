package com.chih.JQWeb.core.engine;

import com.chih.JQWeb.core.domain.TemplateDefinition;
import com.chih.JQWeb.core.exception.ExpressionEvaluationException;
import com.chih.JQWeb.core.expr.PyCallable;
import com.chih.JQWeb.core.expr.PyOps;
import com.chih.JQWeb.core.impl.CaffeineTemplateCache;
import com.chih.JQWeb.core.impl.DefaultFieldConverter;
import com.chih.JQWeb.core.impl.NoOpRenderMetrics;
import com.chih.JQWeb.core.render.RenderSession;
import com.chih.JQWeb.core.render.RenderStackMachine;
import com.chih.JQWeb.core.render.TemplateResolver;
import com.chih.JQWeb.core.spi.AccessChecker;
import com.chih.JQWeb.core.spi.AssetLinkProvider;
import com.chih.JQWeb.core.spi.FieldConverter;
import com.chih.JQWeb.core.spi.RenderMetrics;
import com.chih.JQWeb.core.spi.TemplateCache;
import com.chih.JQWeb.core.spi.TemplateChangeEvent;
import com.chih.JQWeb.core.spi.TemplateSource;
import com.chih.JQWeb.core.support.ScriptSafeJson;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 模板引擎入口：协调 Source、编译缓存与渲染栈机
 * <p>
 * 锁的使用：
 * <ul>
 *     <li>读锁保护缓存查询，渲染之间互不阻塞</li>
 *     <li>写锁用于提交编译结果和清空缓存</li>
 *     <li>按缓存键的编译锁防止同一模板被并发重复编译</li>
 * </ul>
 * 缓存失效只做整体清空：任何模板变化都可能影响调用它的模板。
 * 清空后仍在进行的编译通过代数比对丢弃，不会写回旧产物。
 * </p>
 *
 * @author lizhiyuan
 * @since 2026/10/11
 */
public class QWebEngine implements TemplateResolver {

    private static final Logger log = LoggerFactory.getLogger(QWebEngine.class);

    private static final PyCallable FLOOR = (args, kwargs) -> (long) Math.floor(PyOps.toDouble(single(args, "floor")));

    private static final PyCallable CEIL = (args, kwargs) -> (long) Math.ceil(PyOps.toDouble(single(args, "ceil")));

    private final TemplateSource source;
    private final TemplateCache cache;
    private final TemplateCompiler compiler;
    private final TemplatePreloader preloader;
    private final QWebSettings settings;
    private final FieldConverter fieldConverter;
    private final AssetLinkProvider assetLinkProvider;
    private final AccessChecker accessChecker;
    private final RenderMetrics metrics;
    private final ScriptSafeJson json;

    private final ReentrantReadWriteLock rwLock = new ReentrantReadWriteLock();
    private final ReentrantReadWriteLock.ReadLock readLock = rwLock.readLock();
    private final ReentrantReadWriteLock.WriteLock writeLock = rwLock.writeLock();

    // 编译锁按缓存键分配，长时间不用自动淘汰
    private final Cache<TemplateCacheKey, ReentrantLock> compileLocks = Caffeine.newBuilder()
            .maximumSize(10_000)
            .expireAfterAccess(30, TimeUnit.MINUTES)
            .build();

    /** 每次清空缓存加一 */
    private final AtomicLong generation = new AtomicLong();

    private final AtomicLong compileCount = new AtomicLong();

    private QWebEngine(Builder builder) {
        this.source = builder.source;
        this.cache = builder.cache != null ? builder.cache : new CaffeineTemplateCache();
        this.settings = builder.settings;
        this.compiler = new TemplateCompiler(settings);
        this.preloader = new TemplatePreloader(source);
        this.fieldConverter = builder.fieldConverter;
        this.assetLinkProvider = builder.assetLinkProvider;
        this.accessChecker = builder.accessChecker;
        this.metrics = builder.metrics != null ? builder.metrics : new NoOpRenderMetrics();
        this.json = new ScriptSafeJson();

        // 注册变更监听
        this.source.onChange(this::handleSourceChange);
        log.info("QWeb engine initialized (dev mode: {})", settings.getDevMode());
    }

    public static Builder builder(TemplateSource source) {
        return new Builder(source);
    }

    // === 渲染 ===

    public String render(Object template, Map<String, Object> values) {
        return render(template, values, RenderOptions.DEFAULT);
    }

    /**
     * 渲染模板并拼接全部输出
     *
     * @param template 模板名称或数字 id
     * @param values   初始绑定，不会被修改
     */
    public String render(Object template, Map<String, Object> values, RenderOptions options) {
        long startTime = System.nanoTime();
        boolean success = false;
        try {
            StringBuilder out = new StringBuilder();
            Iterator<String> chunks = stream(template, values, options);
            while (chunks.hasNext()) {
                out.append(chunks.next());
            }
            success = true;
            return out.toString();
        } finally {
            metrics.recordRender(String.valueOf(template), System.nanoTime() - startTime, success);
        }
    }

    /**
     * 惰性渲染：每次 {@code next()} 只推进到下一段输出
     */
    public Iterator<String> stream(Object template, Map<String, Object> values, RenderOptions options) {
        RenderOptions renderOptions = options != null ? options : RenderOptions.DEFAULT;
        Map<String, Object> rootValues = prepareValues(values, renderOptions);
        RenderSession session = RenderSession.builder(this)
                .rootValues(rootValues)
                .renderOptions(renderOptions)
                .settings(settings)
                .fieldConverter(fieldConverter)
                .assetLinkProvider(assetLinkProvider)
                .accessChecker(accessChecker)
                .metrics(metrics)
                .build();
        return new RenderStackMachine(session, template, null, new LinkedHashMap<>(rootValues), "render");
    }

    private Map<String, Object> prepareValues(Map<String, Object> values, RenderOptions options) {
        Map<String, Object> rootValues = new LinkedHashMap<>();
        if (!options.isMinimalContext()) {
            rootValues.put("true", Boolean.TRUE);
            rootValues.put("false", Boolean.FALSE);
            rootValues.put("json", json);
            rootValues.put("floor", FLOOR);
            rootValues.put("ceil", CEIL);
            rootValues.put("lang", options.getTemplateOptions().lang());
            rootValues.put("debug", String.join(",", settings.getDevMode()));
        }
        if (values != null) {
            rootValues.putAll(values);
            if (values.containsKey("0")) {
                log.warn("A value named \"0\" is reserved for t-call content and was ignored");
                rootValues.remove("0");
            }
        }
        return rootValues;
    }

    // === 编译与缓存 ===

    @Override
    public CompiledTemplate resolve(Object reference, TemplateOptions options) {
        if (settings.isDevMode("xml")) {
            // 开发模式下每次都重新编译
            return compileWithMetrics(reference, source.load(reference), options);
        }

        TemplateCacheKey key = new TemplateCacheKey(reference, options);
        readLock.lock();
        try {
            CompiledTemplate cached = cache.get(key);
            if (cached != null) {
                return cached;
            }
        } finally {
            readLock.unlock();
        }

        ReentrantLock keyLock = compileLocks.get(key, k -> new ReentrantLock());
        keyLock.lock();
        try {
            // Double-check
            CompiledTemplate cached = cache.get(key);
            if (cached != null) {
                return cached;
            }
            long startGeneration = generation.get();

            Map<Object, TemplateDefinition> definitions = preloader.collect(reference,
                    ref -> cache.get(new TemplateCacheKey(ref, options)) != null);
            Map<TemplateCacheKey, CompiledTemplate> compiled = new LinkedHashMap<>();
            for (Map.Entry<Object, TemplateDefinition> entry : definitions.entrySet()) {
                compiled.put(new TemplateCacheKey(entry.getKey(), options),
                        compileWithMetrics(entry.getKey(), entry.getValue(), options));
            }

            applyUpdates(compiled, startGeneration);
            CompiledTemplate result = cache.get(key);
            return result != null ? result : compiled.get(key);
        } finally {
            keyLock.unlock();
        }
    }

    private CompiledTemplate compileWithMetrics(Object reference, TemplateDefinition definition, TemplateOptions options) {
        long startTime = System.nanoTime();
        CompiledTemplate compiled = compiler.compile(reference, definition, options);
        if (definition != null) {
            compileCount.incrementAndGet();
            metrics.recordCompile(String.valueOf(reference), System.nanoTime() - startTime, compiled.isAvailable());
        }
        return compiled;
    }

    private void applyUpdates(Map<TemplateCacheKey, CompiledTemplate> compiled, long startGeneration) {
        writeLock.lock();
        try {
            if (generation.get() != startGeneration) {
                log.debug("Templates changed during compilation, {} artifacts discarded", compiled.size());
                return;
            }
            compiled.forEach(cache::put);
        } finally {
            writeLock.unlock();
        }
    }

    private void handleSourceChange(TemplateChangeEvent event) {
        if (event.isEmpty()) {
            return;
        }
        clearCache();
        log.info("Hot update completed: {} templates updated, {} removed",
                event.getUpdated().size(), event.getRemoved().size());
    }

    /**
     * 清空全部编译产物
     */
    public void clearCache() {
        writeLock.lock();
        try {
            generation.incrementAndGet();
            cache.clear();
        } finally {
            writeLock.unlock();
        }
        log.info("Compiled template cache cleared");
    }

    /**
     * @return 实际执行过的编译次数（不含不存在模板的哨兵）
     */
    public long getCompileCount() {
        return compileCount.get();
    }

    public TemplateSource getSource() {
        return source;
    }

    public TemplateCache getCache() {
        return cache;
    }

    public QWebSettings getSettings() {
        return settings;
    }

    private static Object single(List<Object> args, String name) {
        if (args.size() != 1) {
            throw new ExpressionEvaluationException("TypeError: " + name + "() takes exactly one argument ("
                    + args.size() + " given)");
        }
        return args.get(0);
    }

    public static final class Builder {
        private final TemplateSource source;
        private TemplateCache cache;
        private QWebSettings settings = QWebSettings.DEFAULT;
        private FieldConverter fieldConverter = new DefaultFieldConverter();
        private AssetLinkProvider assetLinkProvider = AssetLinkProvider.none();
        private AccessChecker accessChecker = AccessChecker.allowAll();
        private RenderMetrics metrics;

        private Builder(TemplateSource source) {
            if (source == null) {
                throw new IllegalArgumentException("TemplateSource must not be null");
            }
            this.source = source;
        }

        public Builder cache(TemplateCache cache) {
            this.cache = cache;
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

        public QWebEngine build() {
            return new QWebEngine(this);
        }
    }
}
