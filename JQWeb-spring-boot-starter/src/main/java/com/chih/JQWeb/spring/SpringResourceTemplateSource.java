package com.chih.JQWeb.spring;

import com.chih.JQWeb.core.spi.AbstractIndexBasedTemplateSource;
import com.chih.JQWeb.core.support.TemplateParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.core.io.support.ResourcePatternResolver;
import org.springframework.util.StringUtils;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;

/**
 * 基于 Spring Resource 的模板源
 * <p>
 * 支持 {@code classpath*:} 通配符与 ant-style 路径，文件系统中的模板所在目录会被监听以支持热更新。
 * </p>
 *
 * @see AbstractIndexBasedTemplateSource
 *
 * @author lizhiyuan
 * @since 2026/10/16
 */
public class SpringResourceTemplateSource extends AbstractIndexBasedTemplateSource<Resource>
        implements DisposableBean {

    private static final Logger log = LoggerFactory.getLogger(SpringResourceTemplateSource.class);

    private final ResourcePatternResolver resolver = new PathMatchingResourcePatternResolver();

    /** 构造时确定，运行时不可变 */
    private final List<String> locations;

    /**
     * @param locations        资源位置列表，支持 Spring Resource 路径模式
     * @param debounceDelayMs  防抖延迟（毫秒）
     * @param watcherExecutor  文件监听线程池，可为 null
     * @param debounceExecutor 防抖定时器线程池，可为 null
     */
    public SpringResourceTemplateSource(List<String> locations, long debounceDelayMs,
                                        ExecutorService watcherExecutor, ScheduledExecutorService debounceExecutor) {
        super(debounceDelayMs, watcherExecutor, debounceExecutor);
        this.locations = new ArrayList<>(locations);
        initialLoad();
        startWatcher();
    }

    private void initialLoad() {
        Set<File> watchedDirectories = new HashSet<>();

        for (String location : locations) {
            if (!StringUtils.hasText(location)) {
                continue;
            }
            try {
                Resource[] resources = resolver.getResources(location);
                for (Resource resource : resources) {
                    if (!isTemplateResource(resource)) {
                        continue;
                    }
                    safeLoadResource(resource);

                    // 只对文件系统资源注册监听
                    try {
                        if (isFileResource(resource)) {
                            File parentFile = resource.getFile().getParentFile();
                            if (parentFile != null && watchedDirectories.add(parentFile)
                                    && fileWatcher.watch(parentFile.toPath())) {
                                log.info("Watching template directory: {}", parentFile.getAbsolutePath());
                            }
                        }
                    } catch (IOException e) {
                        log.warn("Failed to register watcher for {}", resource.getDescription(), e);
                    }
                }
            } catch (IOException e) {
                log.warn("Failed to scan template location: {}", location, e);
            }
        }
    }

    private boolean isTemplateResource(Resource resource) {
        if (resource == null) {
            return false;
        }
        String filename = resource.getFilename();
        return filename != null && TemplateParser.isSupportedFile(filename);
    }

    @Override
    protected InputStream openStream(Resource resource) throws Exception {
        return resource.getInputStream();
    }

    @Override
    protected String getResourceId(Resource resource) {
        try {
            if (isFileResource(resource)) {
                return resource.getFile().getAbsolutePath();
            }
            return resource.getURI().toString();
        } catch (IOException e) {
            return resource.getDescription();
        }
    }

    @Override
    protected boolean exists(Resource resource) {
        return resource.exists();
    }

    @Override
    protected Resource resolveResourceFromFile(File file) {
        return new FileSystemResource(file);
    }

    @Override
    protected String getResourceDescription(Resource resource) {
        return resource.getDescription();
    }

    private boolean isFileResource(Resource resource) {
        try {
            return resource.isFile() || "file".equals(resource.getURL().getProtocol());
        } catch (IOException e) {
            return false;
        }
    }

    @Override
    public void destroy() {
        try {
            close();
        } catch (Exception e) {
            log.error("Failed to destroy SpringResourceTemplateSource", e);
        }
    }
}
