package com.chih.JQWeb.core.compiler;

import java.util.Iterator;
import java.util.List;

/**
 * 单个元素上按优先级遍历指令名的游标
 * <p>
 * t-if、t-foreach 等包裹型指令用同一个游标继续编译剩余指令，
 * 因此同一元素上的每个指令只会被处理一次。
 *
 * @author lizhiyuan
 * @since 2026/10/05
 */
public final class DirectiveCursor implements Iterator<String> {

    private final Iterator<String> names;

    DirectiveCursor(List<String> order) {
        this.names = order.iterator();
    }

    @Override
    public boolean hasNext() {
        return names.hasNext();
    }

    @Override
    public String next() {
        return names.next();
    }
}
