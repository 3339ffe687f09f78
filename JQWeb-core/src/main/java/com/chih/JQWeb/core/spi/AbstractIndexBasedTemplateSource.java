package com.chih.JQWeb.core.spi;

import com.chih.JQWeb.core.domain.TemplateDefinition;
import com.chih.JQWeb.core.support.TemplateDirectoryWatcher;
import com.chih.JQWeb.core.support.TemplateParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import java.util.function.Consumer;

/**
 * 基于索引的 TemplateSource 泛型基类
 * <p>
 * 只在内存中保存"模板名 -> 资源"的索引，不保存解析后的 XML 树；
 * 引擎编译缓存未命中时才回源读取并解析对应文件。
 * 文件变更经防抖后合并为一个 {@link TemplateChangeEvent}。
 * </p>
 *
 * @param <T> 资源类型（FileResource 或 Spring Resource）
 *
 * @author lizhiyuan
 * @since 2026/10/13
 */
public abstract class AbstractIndexBasedTemplateSource<T> implements TemplateSource {

    private static final Logger log = LoggerFactory.getLogger(AbstractIndexBasedTemplateSource.class);

    /** 正向索引：模板名 -> 资源 */
    protected final Map<String, T> keyToIndex = new ConcurrentHashMap<>();

    /** 反向索引：资源 ID -> 该资源定义的模板名，用于计算删除 */
    protected final Map<String, Set<String>> sourceToKeys = new ConcurrentHashMap<>();

    protected final Map<String, T> resourceCache = new ConcurrentHashMap<>();

    // 防抖窗口内累积的变更
    protected final Map<String, TemplateDefinition> pendingUpdates = new ConcurrentHashMap<>();

    protected final Set<String> pendingRemoves = ConcurrentHashMap.newKeySet();

    /** 加载失败的资源：资源 ID -> 异常，供健康检查使用 */
    protected final Map<String, Throwable> loadErrors = new ConcurrentHashMap<>();

    protected final TemplateDirectoryWatcher fileWatcher;

    protected volatile Consumer<TemplateChangeEvent> changeListener;

    /**
     * 监听器注册前产生的事件先暂存，注册时重放
     */
    private final Queue<TemplateChangeEvent> pendingEvents = new ConcurrentLinkedQueue<>();

    protected AbstractIndexBasedTemplateSource() {
        this(500L, null, null);
    }

    /**
     * @param debounceDelayMs  防抖延迟（毫秒）
     * @param watcherExecutor  文件监听线程池，null 时内部创建
     * @param debounceExecutor 防抖定时器线程池，null 时内部创建
     */
    protected AbstractIndexBasedTemplateSource(long debounceDelayMs,
                                               ExecutorService watcherExecutor,
                                               ScheduledExecutorService debounceExecutor) {
        this.fileWatcher = new TemplateDirectoryWatcher(
                path -> TemplateParser.isSupportedFile(path.getFileName().toString()),
                this::applyFileChanges,
                debounceDelayMs,
                watcherExecutor,
                debounceExecutor
        );
    }

    // === 子类实现的资源差异 ===

    /**
     * @return 输入流，调用者负责关闭
     */
    protected abstract InputStream openStream(T resource) throws Exception;

    /**
     * 资源唯一标识，用作索引键，需保证稳定
     */
    protected abstract String getResourceId(T resource);

    protected abstract boolean exists(T resource);

    /**
     * 文件监听回调时把 File 转回资源对象
     *
     * @return 不支持时返回 null
     */
    protected abstract T resolveResourceFromFile(File file);

    protected abstract String getResourceDescription(T resource);

    // === 索引维护 ===

    /**
     * 刷新单个资源的索引
     *
     * @param isIncremental 热更新时为 true，此时同时记录待通知的变更
     */
    protected void refreshIndex(T resource, boolean isIncremental) {
        String resourceId = getResourceId(resource);
        try {
            if (!exists(resource)) {
                handleResourceRemoval(resourceId, isIncremental);
                return;
            }
            Map<String, TemplateDefinition> templates = parseResource(resource);
            updateIndex(resourceId, templates, resource, isIncremental);
        } catch (Exception e) {
            log.error("Failed to refresh template resource: {}", resourceId, e);
            loadErrors.put(resourceId, e);
        }
    }

    private void handleResourceRemoval(String resourceId, boolean isIncremental) {
        Set<String> removedKeys = sourceToKeys.remove(resourceId);
        resourceCache.remove(resourceId);
        if (removedKeys != null) {
            removedKeys.forEach(keyToIndex::remove);
            if (isIncremental) {
                synchronized (this) {
                    pendingRemoves.addAll(removedKeys);
                    removedKeys.forEach(pendingUpdates::remove);
                }
            }
        }
        loadErrors.remove(resourceId);
        log.info("Template resource removed: {} (affected {} templates)", resourceId,
                removedKeys != null ? removedKeys.size() : 0);
    }

    /**
     * 更新双向索引，增量模式下计算新增、修改与消失的模板
     */
    private void updateIndex(String resourceId, Map<String, TemplateDefinition> templates,
                             T resource, boolean isIncremental) {
        Set<String> oldKeys = sourceToKeys.getOrDefault(resourceId, Collections.emptySet());
        Set<String> currentKeys = new HashSet<>(templates.keySet());

        resourceCache.put(resourceId, resource);
        sourceToKeys.put(resourceId, currentKeys);

        for (Map.Entry<String, TemplateDefinition> entry : templates.entrySet()) {
            T previous = keyToIndex.put(entry.getKey(), resource);
            if (previous != null && !getResourceId(previous).equals(resourceId)) {
                log.warn("Template '{}' from {} overrides the definition in {}",
                        entry.getKey(), resourceId, getResourceId(previous));
            }
            if (isIncremental) {
                // 与 notifyManager 使用同一把锁，避免快照时丢失更新
                synchronized (this) {
                    pendingUpdates.put(entry.getKey(), entry.getValue());
                    pendingRemoves.remove(entry.getKey());
                }
            }
        }

        for (String oldKey : oldKeys) {
            if (!currentKeys.contains(oldKey)) {
                keyToIndex.remove(oldKey);
                if (isIncremental) {
                    synchronized (this) {
                        pendingRemoves.add(oldKey);
                        pendingUpdates.remove(oldKey);
                    }
                }
            }
        }

        loadErrors.remove(resourceId);
    }

    protected Map<String, TemplateDefinition> parseResource(T resource) throws Exception {
        try (InputStream is = openStream(resource)) {
            return TemplateParser.parse(is, getResourceDescription(resource));
        }
    }

    /**
     * 初始加载：失败只记录，不影响其他资源
     */
    protected final void safeLoadResource(T resource) {
        try {
            refreshIndex(resource, false);
            log.debug("Loaded template resource: {}", getResourceId(resource));
        } catch (Exception e) {
            log.error("Failed to load template resource: {}", getResourceDescription(resource), e);
        }
    }

    /**
     * 一轮静默期内变化的文件：逐个刷新索引后推送一次合并事件
     */
    private void applyFileChanges(Set<Path> changedFiles) {
        for (Path path : changedFiles) {
            T resource = resolveResourceFromFile(path.toFile());
            if (resource != null) {
                refreshIndex(resource, true);
            }
        }
        notifyManager();
    }

    /**
     * 防抖结束后推送合并的变更事件
     */
    protected void notifyManager() {
        Map<String, TemplateDefinition> updatesSnapshot;
        Set<String> removesSnapshot;

        synchronized (this) {
            if (pendingUpdates.isEmpty() && pendingRemoves.isEmpty()) {
                return;
            }
            updatesSnapshot = new HashMap<>(pendingUpdates);
            removesSnapshot = new HashSet<>(pendingRemoves);
            pendingUpdates.clear();
            pendingRemoves.clear();
        }

        TemplateChangeEvent event = new TemplateChangeEvent(updatesSnapshot, removesSnapshot);
        Consumer<TemplateChangeEvent> listener = changeListener;
        if (listener != null) {
            log.info("Debounce finished. Pushing template changes: {} updated, {} removed.",
                    updatesSnapshot.size(), removesSnapshot.size());
            listener.accept(event);
        } else {
            pendingEvents.offer(event);
            log.debug("Change listener not registered, caching event: {} updated, {} removed",
                    updatesSnapshot.size(), removesSnapshot.size());
        }
    }

    // === TemplateSource ===

    @Override
    public Map<String, TemplateDefinition> loadAll() {
        Map<String, TemplateDefinition> all = new LinkedHashMap<>();
        for (T resource : new LinkedHashSet<>(keyToIndex.values())) {
            try {
                all.putAll(parseResource(resource));
            } catch (Exception e) {
                log.warn("Failed to parse template resource during loadAll: {}", getResourceId(resource), e);
            }
        }
        return all;
    }

    @Override
    public TemplateDefinition load(Object reference) {
        if (!(reference instanceof String)) {
            return TemplateSource.super.load(reference);
        }
        // 缓存未命中时回源：查索引 -> 读文件 -> 解析
        T resource = keyToIndex.get(reference);
        if (resource == null) {
            return null;
        }
        try {
            return parseResource(resource).get(reference);
        } catch (Exception e) {
            log.error("Failed to load template: {}", reference, e);
            loadErrors.put(getResourceId(resource), e);
            return null;
        }
    }

    @Override
    public void onChange(Consumer<TemplateChangeEvent> listener) {
        this.changeListener = listener;
        replayPendingEvents();
    }

    private void replayPendingEvents() {
        if (pendingEvents.isEmpty()) {
            return;
        }
        log.info("Replaying {} cached template change events", pendingEvents.size());
        TemplateChangeEvent event;
        while ((event = pendingEvents.poll()) != null) {
            try {
                changeListener.accept(event);
            } catch (Exception e) {
                log.error("Failed to replay cached change event", e);
            }
        }
    }

    @Override
    public void close() throws Exception {
        fileWatcher.close();
    }

    public Set<String> getTemplateNames() {
        return Collections.unmodifiableSet(keyToIndex.keySet());
    }

    public Map<String, Throwable> getLoadErrors() {
        return Collections.unmodifiableMap(loadErrors);
    }

    protected void startWatcher() {
        fileWatcher.start();
    }
}
