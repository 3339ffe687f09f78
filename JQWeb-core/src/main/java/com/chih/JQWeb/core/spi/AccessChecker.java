package com.chih.JQWeb.core.spi;

import java.util.Map;

/**
 * 访问控制 (SPI)，供 {@code t-groups} / {@code groups} 使用
 *
 * @author lizhiyuan
 * @since 2026/10/13
 */
@FunctionalInterface
public interface AccessChecker {

    /**
     * @param groups 逗号分隔的组名，{@code !} 前缀表示排除
     */
    boolean hasGroups(String groups, Map<String, Object> values);

    static AccessChecker allowAll() {
        return (groups, values) -> true;
    }
}
