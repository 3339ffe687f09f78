package com.chih.JQWeb.core.render;

import com.chih.JQWeb.core.compiler.instruction.CompiledBlock;
import com.chih.JQWeb.core.engine.CompiledTemplate;
import com.chih.JQWeb.core.engine.TemplateOptions;
import com.chih.JQWeb.core.exception.JQWebException;
import com.chih.JQWeb.core.exception.SourceLocation;
import com.chih.JQWeb.core.exception.TemplateErrorInfo;
import com.chih.JQWeb.core.exception.TemplateRecursionException;
import com.chih.JQWeb.core.exception.TemplateRenderException;
import com.chih.JQWeb.core.exception.TransientTemplateException;
import com.chih.JQWeb.core.expr.PyOps;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * 非递归渲染栈机
 * <p>
 * 状态：栈顶帧活跃时从其迭代器取下一项；文本直接产出；{@link CallParameters} 或未渲染的
 * {@link ContentValue} 解析目标块后压入新帧；帧耗尽则弹出，栈空即渲染结束。
 * 栈深超过 {@value #MAX_DEPTH} 视为无限递归。内容块在字符串运算中强制渲染时会新建栈机，
 * 新栈机从外层栈机的深度起算，因此嵌套渲染同样受这个上限约束。
 * </p>
 * <p>
 * 出错时只在这里补充一次结构化上下文（模板、路径、节点片段、调用链）；
 * 存储层的瞬时异常原样抛出，便于上层重试。
 * </p>
 *
 * @author lizhiyuan
 * @since 2026/10/09
 */
public final class RenderStackMachine implements Iterator<String> {

    public static final int MAX_DEPTH = 50;

    private final RenderSession session;

    private final Deque<StackFrame> stack = new ArrayDeque<>();

    /** 外层栈机的深度，独立渲染时为 0 */
    private final int baseDepth;

    /** 入口模板引用，错误信息缺少引用时使用 */
    private final Object reference;

    private String pending;

    /**
     * @param template  模板引用或编译产物
     * @param block     块名，null 为入口块
     * @param values    入口绑定，直接共享不复制
     * @param directive 本次渲染的来源，如 {@code render}
     */
    public RenderStackMachine(RenderSession session, Object template, String block,
                              Map<String, Object> values, String directive) {
        this.session = session;
        this.baseDepth = session.currentDepth();
        this.reference = template instanceof CompiledTemplate ? ((CompiledTemplate) template).getReference() : template;
        CallParameters bootstrap = new CallParameters(Collections.emptyMap(), template, block, null,
                ScopeMode.NONE, directive, null);
        stack.push(new StackFrame(bootstrap, Collections.<Object>singletonList(bootstrap).iterator(),
                values, session.getRootOptions(), null));
    }

    /**
     * @return 包含外层栈机在内的总深度
     */
    public int depth() {
        return baseDepth + stack.size();
    }

    @Override
    public boolean hasNext() {
        if (pending == null) {
            pending = advance();
        }
        return pending != null;
    }

    @Override
    public String next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        String chunk = pending;
        pending = null;
        return chunk;
    }

    private String advance() {
        RenderStackMachine previous = session.activate(this);
        try {
            return step();
        } catch (TransientTemplateException e) {
            throw e;
        } catch (RuntimeException e) {
            throw annotate(e);
        } finally {
            session.deactivate(previous);
        }
    }

    private String step() {
        while (!stack.isEmpty()) {
            if (depth() > MAX_DEPTH) {
                throw new TemplateRecursionException(MAX_DEPTH);
            }
            StackFrame frame = stack.peek();
            Iterator<Object> iterator = frame.iterator();
            if (!iterator.hasNext()) {
                stack.pop();
                continue;
            }
            Object item = iterator.next();
            if (item instanceof String) {
                return (String) item;
            }
            CallParameters params;
            if (item instanceof ContentValue) {
                ContentValue content = (ContentValue) item;
                if (content.isRendered()) {
                    return content.getHtml();
                }
                params = content.getParameters();
            } else if (item instanceof CallParameters) {
                params = (CallParameters) item;
            } else if (item instanceof HtmlSafe) {
                return ((HtmlSafe) item).toHtml();
            } else {
                return PyOps.toText(item);
            }
            enter(frame, params);
        }
        return null;
    }

    private void enter(StackFrame caller, CallParameters params) {
        CompiledTemplate template;
        TemplateOptions options;
        if (params.template() instanceof CompiledTemplate) {
            template = (CompiledTemplate) params.template();
            options = template.getOptions();
        } else {
            options = caller.options().withOverrides(params.options());
            template = session.resolve(params.template(), options);
        }

        Map<String, Object> callerValues = caller.iterator() instanceof BlockExecution
                ? ((BlockExecution) caller.iterator()).lastValues()
                : caller.values();
        Map<String, Object> values;
        switch (params.scope()) {
            case ROOT:
                values = new LinkedHashMap<>(session.getRootValues());
                break;
            case COPY:
                values = new LinkedHashMap<>(callerValues);
                break;
            default:
                values = callerValues;
                break;
        }
        if (params.values() != null) {
            values.putAll(params.values());
        }

        CompiledBlock block = params.block() != null ? template.getBlock(params.block()) : template.getEntryBlock();
        stack.push(new StackFrame(params, new BlockExecution(session, template, block, values), values, options, template));
    }

    // === 错误上下文 ===

    private RuntimeException annotate(RuntimeException error) {
        StackFrame frame = stack.peek();
        if (frame == null) {
            return error;
        }
        TemplateErrorInfo info = buildErrorInfo(error, frame);
        if (error instanceof JQWebException) {
            JQWebException qwebError = (JQWebException) error;
            if (qwebError.hasErrorInfo()) {
                // 内层内容块已报告过，只补外层调用链
                TemplateErrorInfo existing = qwebError.getErrorInfo();
                if (!info.getSource().isEmpty()) {
                    existing.prependSource(info.getSource());
                }
                if (existing.getReference() == null) {
                    existing.setReference(referenceOf(frame.params().template()));
                }
                return qwebError;
            }
            qwebError.attachErrorInfo(info);
            return qwebError;
        }
        return new TemplateRenderException(info, error);
    }

    private TemplateErrorInfo buildErrorInfo(RuntimeException error, StackFrame frame) {
        String raw = error instanceof JQWebException ? ((JQWebException) error).getRawMessage() : error.getMessage();
        String message = error.getClass().getSimpleName() + ": " + raw;

        String name = null;
        Object ref;
        SourceLocation location = null;
        boolean ownFrame = (frame.template() != null && frame.template().isAvailable()
                && !(error instanceof TemplateRecursionException)) || stack.size() <= 1;
        if (ownFrame) {
            CompiledTemplate template = frame.template();
            name = template == null ? null : template.getName();
            ref = template == null ? referenceOf(frame.params().template()) : template.getReference();
            if (frame.iterator() instanceof BlockExecution) {
                location = ((BlockExecution) frame.iterator()).getLocation();
            }
        } else {
            // 目标模板不可用（未找到 / 编译失败 / 递归过深）时报告调用方的节点
            Iterator<StackFrame> frames = stack.iterator();
            frames.next();
            CompiledTemplate callerTemplate = frames.next().template();
            ref = callerTemplate == null ? null : callerTemplate.getReference();
            name = callerTemplate == null ? null : callerTemplate.getName();
            location = frame.params().location();
        }
        if (name == null && ref == null) {
            ref = reference;
        }

        List<SourceLocation> source = new ArrayList<>();
        Iterator<StackFrame> bottomUp = stack.descendingIterator();
        while (bottomUp.hasNext()) {
            SourceLocation callSite = bottomUp.next().params().location();
            if (callSite != null) {
                source.add(callSite);
            }
        }
        return new TemplateErrorInfo(message, name, ref,
                location == null ? null : location.path(),
                location == null ? null : location.element(),
                source);
    }

    private static Object referenceOf(Object template) {
        return template instanceof CompiledTemplate ? ((CompiledTemplate) template).getReference() : template;
    }
}
