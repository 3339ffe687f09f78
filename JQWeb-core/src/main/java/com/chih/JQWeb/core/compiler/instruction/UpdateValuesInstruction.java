package com.chih.JQWeb.core.compiler.instruction;

import com.chih.JQWeb.core.expr.Builtins;
import com.chih.JQWeb.core.expr.PyOps;
import com.chih.JQWeb.core.render.BlockExecution;

import java.util.Map;

/**
 * {@code t-set="{'a': 1, 'b': 2}"}：把字典合并进当前绑定
 *
 * @author lizhiyuan
 * @since 2026/10/06
 */
public final class UpdateValuesInstruction implements Instruction {

    private final Evaluation dict;

    public UpdateValuesInstruction(Evaluation dict) {
        this.dict = dict;
    }

    @Override
    public void execute(BlockExecution execution, Map<String, Object> values) {
        for (Map.Entry<Object, Object> entry : Builtins.toDict(dict.evaluate(execution, values)).entrySet()) {
            values.put(PyOps.str(entry.getKey()), entry.getValue());
        }
    }
}
