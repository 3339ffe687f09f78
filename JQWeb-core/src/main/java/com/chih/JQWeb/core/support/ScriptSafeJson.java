package com.chih.JQWeb.core.support;

import com.chih.JQWeb.core.exception.ExpressionEvaluationException;
import com.chih.JQWeb.core.expr.PyCallable;
import com.chih.JQWeb.core.expr.PyObject;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.List;
import java.util.Map;

/**
 * 渲染上下文中的 {@code json} 值
 * <p>
 * {@code json.dumps(value)} 输出可以直接嵌入 {@code <script>} 的 JSON：
 * {@code <}、{@code >}、{@code &} 被转成 unicode 转义。
 * </p>
 *
 * @author lizhiyuan
 * @since 2026/10/14
 */
public class ScriptSafeJson implements PyObject {

    private final ObjectMapper mapper;

    private final PyCallable dumps = this::dumps;

    private final PyCallable loads = this::loads;

    public ScriptSafeJson(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public ScriptSafeJson() {
        this(QWebObjectMapperFactory.createJsonMapper());
    }

    @Override
    public Object getAttribute(String name) {
        switch (name) {
            case "dumps":
                return dumps;
            case "loads":
                return loads;
            default:
                return MISSING;
        }
    }

    /**
     * 序列化并转义 HTML 敏感字符
     */
    public String toJson(Object value) {
        try {
            String json = mapper.writeValueAsString(value);
            return json.replace("<", "\\u003c").replace(">", "\\u003e").replace("&", "\\u0026");
        } catch (JsonProcessingException e) {
            throw new ExpressionEvaluationException("TypeError: Object is not JSON serializable: " + e.getOriginalMessage(), e);
        }
    }

    private Object dumps(List<Object> args, Map<String, Object> kwargs) {
        if (args.size() != 1) {
            throw new ExpressionEvaluationException("TypeError: dumps() takes exactly one argument (" + args.size() + " given)");
        }
        return toJson(args.get(0));
    }

    private Object loads(List<Object> args, Map<String, Object> kwargs) {
        if (args.size() != 1) {
            throw new ExpressionEvaluationException("TypeError: loads() takes exactly one argument (" + args.size() + " given)");
        }
        try {
            return mapper.readValue(String.valueOf(args.get(0)), Object.class);
        } catch (JsonProcessingException e) {
            throw new ExpressionEvaluationException("ValueError: " + e.getOriginalMessage(), e);
        }
    }

    @Override
    public String toString() {
        return "<module 'json'>";
    }
}
