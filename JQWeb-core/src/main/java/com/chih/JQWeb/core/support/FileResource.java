package com.chih.JQWeb.core.support;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * 模板文件资源
 * <p>
 * 统一文件系统与 Classpath（目录或 JAR）两种来源，作为 {@link com.chih.JQWeb.core.impl.FileTemplateSource}
 * 的索引值。只保存定位信息，不缓存文件内容。
 * </p>
 *
 * @author lizhiyuan
 * @since 2026/10/14
 */
public final class FileResource {

    private final Path filePath;

    private final URL classpathUrl;

    /** 日志与索引使用的路径标识，classpath 资源带 {@code classpath:} 前缀 */
    private final String resourcePath;

    private FileResource(Path filePath, URL classpathUrl, String resourcePath) {
        this.filePath = filePath;
        this.classpathUrl = classpathUrl;
        this.resourcePath = resourcePath;
    }

    public static FileResource fromFile(Path filePath) {
        if (filePath == null) {
            throw new IllegalArgumentException("File path cannot be null");
        }
        return new FileResource(filePath, null, filePath.toAbsolutePath().toString());
    }

    public static FileResource fromClasspath(URL classpathUrl, String resourcePath) {
        if (classpathUrl == null) {
            throw new IllegalArgumentException("Classpath URL cannot be null");
        }
        if (resourcePath == null || resourcePath.isBlank()) {
            throw new IllegalArgumentException("Resource path cannot be null or empty");
        }
        return new FileResource(null, classpathUrl, resourcePath);
    }

    public InputStream getInputStream() throws IOException {
        if (filePath != null) {
            return Files.newInputStream(filePath);
        }
        return classpathUrl.openStream();
    }

    public boolean exists() {
        if (filePath != null) {
            return Files.isRegularFile(filePath);
        }
        // classpath URL 没有 exists()，只能尝试打开
        try (InputStream ignored = classpathUrl.openStream()) {
            return true;
        } catch (IOException e) {
            return false;
        }
    }

    /**
     * 资源唯一标识：文件取绝对路径，classpath 取传入的路径
     */
    public String getId() {
        return resourcePath;
    }

    public boolean isFileSystemResource() {
        return filePath != null;
    }

    public Path getFilePath() {
        return filePath;
    }

    public String getFilename() {
        String path = filePath != null ? filePath.getFileName().toString() : classpathUrl.getPath();
        int lastSlash = Math.max(path.lastIndexOf('/'), path.lastIndexOf('\\'));
        return lastSlash >= 0 ? path.substring(lastSlash + 1) : path;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        return Objects.equals(resourcePath, ((FileResource) obj).resourcePath);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(resourcePath);
    }

    @Override
    public String toString() {
        return "FileResource{path='" + resourcePath + "'}";
    }
}
