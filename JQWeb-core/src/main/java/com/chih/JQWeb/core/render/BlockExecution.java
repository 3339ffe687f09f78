package com.chih.JQWeb.core.render;

import com.chih.JQWeb.core.compiler.instruction.CompiledBlock;
import com.chih.JQWeb.core.compiler.instruction.Instruction;
import com.chih.JQWeb.core.engine.CompiledTemplate;
import com.chih.JQWeb.core.exception.SourceLocation;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * 一个代码块的惰性执行
 * <p>
 * 用显式任务栈代替嵌套调用：指令把子序列、循环压栈，输出项先进入队列，
 * 只有在调用方拉取下一项时才继续执行。栈帧的迭代器就是这个对象。
 *
 * @author lizhiyuan
 * @since 2026/10/09
 */
public final class BlockExecution implements Iterator<Object> {

    private final RenderSession session;

    private final CompiledTemplate template;

    private final Deque<Task> tasks = new ArrayDeque<>();

    private final Deque<Emission> output = new ArrayDeque<>();

    /** 最近一次执行的节点位置，出错时报告 */
    private SourceLocation location;

    /** 最近一次取出的输出项所在的绑定，t-call 以此为副本来源 */
    private Map<String, Object> lastValues;

    public BlockExecution(RenderSession session, CompiledTemplate template, CompiledBlock block,
                          Map<String, Object> values) {
        this.session = session;
        this.template = template;
        this.lastValues = values;
        run(block.getInstructions(), values);
    }

    @Override
    public boolean hasNext() {
        while (output.isEmpty()) {
            Task task = tasks.peek();
            if (task == null) {
                return false;
            }
            if (!task.step(this)) {
                tasks.pop();
            }
        }
        return true;
    }

    @Override
    public Object next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        Emission emission = output.poll();
        lastValues = emission.values();
        return emission.item();
    }

    // === 指令使用的操作 ===

    public void emit(Object item, Map<String, Object> values) {
        output.add(new Emission(item, values));
    }

    public void emitText(String text) {
        if (!text.isEmpty()) {
            output.add(new Emission(text, lastValues));
        }
    }

    /**
     * 压入一组指令，下一步开始执行
     */
    public void run(List<Instruction> instructions, Map<String, Object> values) {
        if (!instructions.isEmpty()) {
            tasks.push(new SequenceTask(instructions, values));
        }
    }

    public void push(Task task) {
        tasks.push(task);
    }

    public RenderSession getSession() {
        return session;
    }

    public CompiledTemplate getTemplate() {
        return template;
    }

    public SourceLocation getLocation() {
        return location;
    }

    public void setLocation(SourceLocation location) {
        this.location = location;
    }

    public Map<String, Object> lastValues() {
        return lastValues;
    }

    private record Emission(Object item, Map<String, Object> values) {
    }
}
