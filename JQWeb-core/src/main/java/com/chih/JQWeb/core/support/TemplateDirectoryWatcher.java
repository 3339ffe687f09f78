package com.chih.JQWeb.core.support;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.function.Predicate;

import static java.nio.file.StandardWatchEventKinds.ENTRY_CREATE;
import static java.nio.file.StandardWatchEventKinds.ENTRY_DELETE;
import static java.nio.file.StandardWatchEventKinds.ENTRY_MODIFY;
import static java.nio.file.StandardWatchEventKinds.OVERFLOW;

/**
 * 模板目录监听器
 * <p>
 * 监听线程只收集发生变化的模板文件；变化停止 {@code quietPeriodMs} 后，
 * 把期间去重的文件按首次变化的顺序一次交给回调。编辑器连续写入同一文件只算一次，
 * 删除也会交给回调，由调用方根据文件是否存在区分。
 * 已监听目录下新建的子目录会自动加入监听。
 * </p>
 *
 * @author lizhiyuan
 * @since 2026/10/19
 */
public class TemplateDirectoryWatcher implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TemplateDirectoryWatcher.class);

    private final WatchService watchService;

    private final Map<WatchKey, Path> directories = new ConcurrentHashMap<>();

    private final Predicate<Path> templateFilter;

    private final Consumer<Set<Path>> onSettled;

    private final long quietPeriodMs;

    private final ExecutorService pollExecutor;

    private final ScheduledExecutorService flushExecutor;

    private final boolean ownsPollExecutor;

    private final boolean ownsFlushExecutor;

    /** 本轮静默期内变化的文件，受 this 保护 */
    private final Set<Path> changed = new LinkedHashSet<>();

    private ScheduledFuture<?> flushTask;

    private volatile boolean running;

    /**
     * @param templateFilter 判断文件是否为模板，隐藏文件与编辑器备份文件总是忽略
     * @param onSettled      静默期结束后收到本轮变化的文件
     * @param pollExecutor   监听线程池，null 时内部创建
     * @param flushExecutor  静默期定时器，null 时内部创建
     */
    public TemplateDirectoryWatcher(Predicate<Path> templateFilter, Consumer<Set<Path>> onSettled,
                                    long quietPeriodMs, ExecutorService pollExecutor,
                                    ScheduledExecutorService flushExecutor) {
        this.templateFilter = templateFilter;
        this.onSettled = onSettled;
        this.quietPeriodMs = quietPeriodMs;
        try {
            this.watchService = FileSystems.getDefault().newWatchService();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to initialize WatchService", e);
        }
        this.ownsPollExecutor = pollExecutor == null;
        this.pollExecutor = ownsPollExecutor
                ? Executors.newSingleThreadExecutor(r -> daemon(r, "JQWeb-TemplateWatcher"))
                : pollExecutor;
        this.ownsFlushExecutor = flushExecutor == null;
        this.flushExecutor = ownsFlushExecutor
                ? Executors.newSingleThreadScheduledExecutor(r -> daemon(r, "JQWeb-TemplateFlush"))
                : flushExecutor;
    }

    private static Thread daemon(Runnable r, String name) {
        Thread t = new Thread(r, name);
        t.setDaemon(true);
        return t;
    }

    /**
     * @return 新加入监听时为 true；不是目录、已在监听或注册失败时为 false
     */
    public boolean watch(Path directory) {
        Path dir = directory.toAbsolutePath().normalize();
        if (!Files.isDirectory(dir) || directories.containsValue(dir)) {
            return false;
        }
        try {
            WatchKey key = dir.register(watchService, ENTRY_CREATE, ENTRY_MODIFY, ENTRY_DELETE);
            directories.put(key, dir);
            log.debug("Registered template directory: {}", dir);
            return true;
        } catch (IOException e) {
            log.warn("Failed to watch template directory: {}", dir, e);
            return false;
        }
    }

    public Set<Path> getDirectories() {
        return Set.copyOf(directories.values());
    }

    public synchronized void start() {
        if (!running) {
            running = true;
            pollExecutor.submit(this::pollLoop);
        }
    }

    public boolean isRunning() {
        return running;
    }

    private void pollLoop() {
        while (running) {
            WatchKey key;
            try {
                key = watchService.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (ClosedWatchServiceException e) {
                return;
            }
            Path dir = directories.get(key);
            if (dir != null) {
                for (WatchEvent<?> event : key.pollEvents()) {
                    collect(dir, event);
                }
            }
            if (!key.reset()) {
                directories.remove(key);
            }
        }
    }

    private void collect(Path dir, WatchEvent<?> event) {
        if (event.kind() == OVERFLOW) {
            log.warn("Watch events overflowed in {}, some template changes may be missed", dir);
            return;
        }
        Path path = dir.resolve((Path) event.context());
        if (event.kind() == ENTRY_CREATE && Files.isDirectory(path)) {
            if (watch(path)) {
                log.info("Watching new template directory: {}", path);
            }
            return;
        }
        if (!isTemplateFile(path)) {
            return;
        }
        synchronized (this) {
            changed.add(path);
            if (flushTask != null) {
                flushTask.cancel(false);
            }
            flushTask = flushExecutor.schedule(this::flush, quietPeriodMs, TimeUnit.MILLISECONDS);
        }
    }

    private boolean isTemplateFile(Path path) {
        String name = path.getFileName().toString();
        return !name.startsWith(".") && !name.endsWith("~") && templateFilter.test(path);
    }

    private void flush() {
        Set<Path> batch;
        synchronized (this) {
            if (changed.isEmpty()) {
                return;
            }
            batch = new LinkedHashSet<>(changed);
            changed.clear();
            flushTask = null;
        }
        log.debug("Template files settled: {}", batch);
        try {
            onSettled.accept(Collections.unmodifiableSet(batch));
        } catch (RuntimeException e) {
            log.error("Failed to apply changes of {} template files", batch.size(), e);
        }
    }

    @Override
    public void close() {
        running = false;
        try {
            watchService.close();
        } catch (IOException e) {
            log.debug("Failed to close WatchService", e);
        }
        if (ownsPollExecutor) {
            pollExecutor.shutdownNow();
        }
        if (ownsFlushExecutor) {
            flushExecutor.shutdownNow();
        }
        log.info("Template directory watcher stopped ({} directories).", directories.size());
        directories.clear();
    }
}
