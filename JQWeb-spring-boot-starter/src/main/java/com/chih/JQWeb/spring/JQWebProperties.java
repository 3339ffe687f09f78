package com.chih.JQWeb.spring;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * 模板路径与引擎配置
 *
 * @author lizhiyuan
 * @since 2026/10/16
 */
@ConfigurationProperties(prefix = "j-qweb")
public class JQWebProperties {

    /**
     * 扫描路径列表
     * 支持 classpath: (只读) 和 file: (支持热更新)
     */
    private List<String> locations = new ArrayList<>();

    /**
     * 热更新防抖延迟 (毫秒)
     */
    private long debounceMillis = 500;

    /**
     * 编译产物缓存上限
     */
    private long cacheMaximumSize = 10_000;

    /**
     * 逗号分隔的开发模式，如 {@code xml,qweb}
     */
    private String devMode = "";

    /**
     * 保留模板中的注释与处理指令
     */
    private boolean preserveComments;

    public JQWebProperties() {
        // 默认约定：classpath 下 templates 目录的所有 xml，以及项目根目录下的 templates/*.xml
        locations.add("classpath*:templates/**/*.xml");
        locations.add("file:./templates/*.xml");
    }

    public List<String> getLocations() {
        return locations;
    }

    public void setLocations(List<String> locations) {
        this.locations = locations;
    }

    public long getDebounceMillis() {
        return debounceMillis;
    }

    public void setDebounceMillis(long debounceMillis) {
        this.debounceMillis = debounceMillis;
    }

    public long getCacheMaximumSize() {
        return cacheMaximumSize;
    }

    public void setCacheMaximumSize(long cacheMaximumSize) {
        this.cacheMaximumSize = cacheMaximumSize;
    }

    public String getDevMode() {
        return devMode;
    }

    public void setDevMode(String devMode) {
        this.devMode = devMode;
    }

    public boolean isPreserveComments() {
        return preserveComments;
    }

    public void setPreserveComments(boolean preserveComments) {
        this.preserveComments = preserveComments;
    }
}
