package com.chih.JQWeb.core.impl;

import com.chih.JQWeb.core.spi.AbstractIndexBasedTemplateSource;
import com.chih.JQWeb.core.support.FileResource;
import com.chih.JQWeb.core.support.TemplateParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.net.JarURLConnection;
import java.net.URL;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Enumeration;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import java.util.jar.JarEntry;
import java.util.jar.JarFile;

/**
 * 基于文件的模板源
 * <p>
 * 路径可以是文件、目录或 classpath 位置；文件系统上的目录会被递归监听，
 * 修改 .xml 文件后经防抖推送变更事件。classpath 中 JAR 内的资源只读。
 * </p>
 * <pre>{@code
 * FileTemplateSource source = new FileTemplateSource("templates/");
 * QWebEngine engine = QWebEngine.builder(source).build();
 * }</pre>
 *
 * @author lizhiyuan
 * @since 2026/10/14
 */
public class FileTemplateSource extends AbstractIndexBasedTemplateSource<FileResource> {

    private static final Logger log = LoggerFactory.getLogger(FileTemplateSource.class);

    private final List<String> configPaths;

    public FileTemplateSource(String... paths) {
        this(Arrays.asList(paths));
    }

    public FileTemplateSource(List<String> paths) {
        this(paths, 500L, null, null);
    }

    /**
     * @param paths            文件系统路径或 classpath 路径
     * @param debounceDelayMs  防抖延迟（毫秒）
     * @param watcherExecutor  文件监听线程池，可为 null
     * @param debounceExecutor 防抖定时器线程池，可为 null
     */
    public FileTemplateSource(List<String> paths, long debounceDelayMs,
                              ExecutorService watcherExecutor, ScheduledExecutorService debounceExecutor) {
        super(debounceDelayMs, watcherExecutor, debounceExecutor);
        this.configPaths = new ArrayList<>(paths);
        initialLoadAndWatch();
        startWatcher();
    }

    private void initialLoadAndWatch() {
        Set<File> watchedDirectories = new HashSet<>();
        for (String pathStr : configPaths) {
            File file = new File(pathStr);
            if (file.exists()) {
                if (file.isDirectory()) {
                    loadDirectory(file, watchedDirectories);
                } else {
                    loadSingleFile(file);
                    watch(file.getParentFile(), watchedDirectories);
                }
            } else {
                scanClasspath(pathStr, watchedDirectories);
            }
        }
    }

    private void loadDirectory(File directory, Set<File> watchedDirectories) {
        watch(directory, watchedDirectories);
        File[] files = directory.listFiles();
        if (files == null) {
            return;
        }
        // 按文件名排序，保证同名模板的覆盖顺序稳定
        Arrays.sort(files);
        for (File file : files) {
            if (file.isDirectory()) {
                loadDirectory(file, watchedDirectories);
            } else if (TemplateParser.isSupportedFile(file.getName())) {
                loadSingleFile(file);
            }
        }
    }

    private void watch(File directory, Set<File> watchedDirectories) {
        if (directory != null && watchedDirectories.add(directory) && fileWatcher.watch(directory.toPath())) {
            log.info("Watching template directory: {}", directory.getAbsolutePath());
        }
    }

    private void loadSingleFile(File file) {
        if (!TemplateParser.isSupportedFile(file.getName())) {
            return;
        }
        safeLoadResource(FileResource.fromFile(file.toPath()));
    }

    private void scanClasspath(String path, Set<File> watchedDirectories) {
        String cleanPath = path.startsWith("/") ? path.substring(1) : path;
        if (cleanPath.startsWith("classpath:")) {
            cleanPath = cleanPath.substring("classpath:".length());
        }
        if (cleanPath.isEmpty()) {
            log.warn("Empty classpath location ignored, specify a directory such as 'templates/'");
            return;
        }

        try {
            Enumeration<URL> resources = getClass().getClassLoader().getResources(cleanPath);
            boolean found = false;
            while (resources.hasMoreElements()) {
                found = true;
                URL url = resources.nextElement();
                if ("file".equals(url.getProtocol())) {
                    File file = new File(url.toURI());
                    if (file.isDirectory()) {
                        loadDirectory(file, watchedDirectories);
                    } else {
                        loadSingleFile(file);
                    }
                } else if ("jar".equals(url.getProtocol())) {
                    scanJar(url, cleanPath);
                }
            }
            if (!found) {
                log.warn("Template path not found (checked file system and classpath): {}", path);
            }
        } catch (Exception e) {
            log.error("Failed to scan template location: {}", path, e);
        }
    }

    private void scanJar(URL url, String rootPath) throws IOException {
        JarURLConnection jarConn = (JarURLConnection) url.openConnection();
        jarConn.setUseCaches(false);
        URL jarBaseUrl = jarConn.getJarFileURL();

        try (JarFile jarFile = jarConn.getJarFile()) {
            Enumeration<JarEntry> entries = jarFile.entries();
            while (entries.hasMoreElements()) {
                JarEntry entry = entries.nextElement();
                String name = entry.getName();
                if (name.startsWith(rootPath) && !entry.isDirectory() && TemplateParser.isSupportedFile(name)) {
                    URL entryUrl = new URL("jar:" + jarBaseUrl + "!/" + name);
                    safeLoadResource(FileResource.fromClasspath(entryUrl, "classpath:" + name));
                }
            }
        }
    }

    @Override
    protected InputStream openStream(FileResource resource) throws Exception {
        return resource.getInputStream();
    }

    @Override
    protected String getResourceId(FileResource resource) {
        return resource.getId();
    }

    @Override
    protected boolean exists(FileResource resource) {
        return resource.exists();
    }

    @Override
    protected FileResource resolveResourceFromFile(File file) {
        return FileResource.fromFile(file.toPath());
    }

    @Override
    protected String getResourceDescription(FileResource resource) {
        return resource.getId();
    }
}
