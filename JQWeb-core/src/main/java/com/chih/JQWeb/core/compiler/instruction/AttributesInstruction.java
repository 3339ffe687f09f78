package com.chih.JQWeb.core.compiler.instruction;

import com.chih.JQWeb.core.compiler.QWebSyntax;
import com.chih.JQWeb.core.render.BlockExecution;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 按书写顺序收集元素属性（静态属性、t-attf-*、t-att-*、t-att），存入 {@link QWebSyntax#ATTRIBUTES_KEY}
 *
 * @author lizhiyuan
 * @since 2026/10/06
 */
public final class AttributesInstruction implements Instruction {

    private final List<AttributeSource> sources;

    public AttributesInstruction(List<AttributeSource> sources) {
        this.sources = sources;
    }

    @Override
    public void execute(BlockExecution execution, Map<String, Object> values) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        for (AttributeSource source : sources) {
            source.contribute(attributes, execution, values);
        }
        values.put(QWebSyntax.ATTRIBUTES_KEY, attributes);
    }

    /**
     * 一个属性来源，按顺序写入属性表，后写覆盖先写
     */
    @FunctionalInterface
    public interface AttributeSource {

        void contribute(Map<String, Object> attributes, BlockExecution execution, Map<String, Object> values);
    }
}
