package com.chih.JQWeb.core.compiler.instruction;

import com.chih.JQWeb.core.compiler.QWebSyntax;
import com.chih.JQWeb.core.expr.Builtins;
import com.chih.JQWeb.core.expr.PyOps;
import com.chih.JQWeb.core.render.BlockExecution;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * t-options / t-options-*：组装选项字典，交给同一元素上的 t-out、t-field 或 t-call 取用
 *
 * @author lizhiyuan
 * @since 2026/10/06
 */
public final class OptionsInstruction implements Instruction {

    private final Evaluation dict;

    private final Map<String, Evaluation> named;

    /**
     * @param dict  t-options 表达式，可为 null
     * @param named t-options-* 各项，后于 dict 合并
     */
    public OptionsInstruction(Evaluation dict, Map<String, Evaluation> named) {
        this.dict = dict;
        this.named = named;
    }

    @Override
    public void execute(BlockExecution execution, Map<String, Object> values) {
        Map<String, Object> options = new LinkedHashMap<>();
        if (dict != null) {
            for (Map.Entry<Object, Object> entry : Builtins.toDict(dict.evaluate(execution, values)).entrySet()) {
                options.put(PyOps.str(entry.getKey()), entry.getValue());
            }
        }
        for (Map.Entry<String, Evaluation> entry : named.entrySet()) {
            options.put(entry.getKey(), entry.getValue().evaluate(execution, values));
        }
        values.put(QWebSyntax.OPTIONS_KEY, options);
    }
}
