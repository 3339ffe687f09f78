package com.chih.JQWeb.core.compiler.instruction;

import com.chih.JQWeb.core.expr.PyOps;
import com.chih.JQWeb.core.render.BlockExecution;
import com.chih.JQWeb.core.render.LoopTask;

import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.stream.LongStream;

/**
 * t-foreach 循环
 * <p>
 * 每次迭代在当前绑定的新副本上设置循环变量，循环体内的 t-set 不会泄漏到循环外，
 * 也不会影响下一次迭代。
 * </p>
 *
 * @author lizhiyuan
 * @since 2026/10/06
 */
public final class ForeachInstruction implements Instruction {

    private final Evaluation source;

    private final String name;

    private final List<Instruction> body;

    public ForeachInstruction(Evaluation source, String name, List<Instruction> body) {
        this.source = source;
        this.name = name;
        this.body = body;
    }

    @Override
    public void execute(BlockExecution execution, Map<String, Object> values) {
        Object collection = source.evaluate(execution, values);
        if (!PyOps.truthy(collection)) {
            collection = Collections.emptyList();
        }
        collection = PyOps.normalize(collection);

        long size;
        Iterator<?> items;
        boolean mapping = collection instanceof Map;
        if (PyOps.isIntegral(collection)) {
            // 整数 n 等价于 range(n)，长度可超过 int
            size = Math.max(PyOps.toLong(collection), 0);
            items = LongStream.range(0, size).iterator();
        } else if (mapping) {
            size = PyOps.sizeOf(collection);
            items = ((Map<?, ?>) collection).entrySet().iterator();
        } else {
            size = PyOps.sizeOf(collection);
            items = PyOps.iterate(collection).iterator();
        }
        execution.push(new LoopTask(new Iterations(values, items, size, mapping), body));
    }

    /**
     * 惰性生成每次迭代的绑定
     */
    private final class Iterations implements Iterator<Map<String, Object>> {

        private final Map<String, Object> values;

        private final Iterator<?> items;

        /** 未知长度为 -1 */
        private final long size;

        private final boolean mapping;

        private long index;

        Iterations(Map<String, Object> values, Iterator<?> items, long size, boolean mapping) {
            this.values = values;
            this.items = items;
            this.size = size;
            this.mapping = mapping;
        }

        @Override
        public boolean hasNext() {
            return items.hasNext();
        }

        @Override
        public Map<String, Object> next() {
            if (!items.hasNext()) {
                throw new NoSuchElementException();
            }
            Object item = items.next();
            Object key;
            Object value;
            if (mapping) {
                Map.Entry<?, ?> entry = (Map.Entry<?, ?>) item;
                key = entry.getKey();
                value = entry.getValue();
            } else {
                key = item;
                value = item;
            }

            Map<String, Object> scope = new LinkedHashMap<>(values);
            scope.put(name, key);
            scope.put(name + "_value", value);
            scope.put(name + "_index", index);
            scope.put(name + "_first", index == 0);
            if (size >= 0) {
                scope.put(name + "_size", size);
                scope.put(name + "_last", index + 1 == size);
            }
            scope.put(name + "_odd", index % 2);
            scope.put(name + "_even", index % 2 == 0);
            scope.put(name + "_parity", index % 2 == 0 ? "even" : "odd");
            index++;
            return scope;
        }
    }
}
