package com.chih.JQWeb.core.compiler.instruction;

import com.chih.JQWeb.core.render.BlockExecution;

import java.util.Map;

/**
 * 运行期求值：编译后的表达式、格式化字符串或协作者调用
 *
 * @author lizhiyuan
 * @since 2026/10/06
 */
@FunctionalInterface
public interface Evaluation {

    Object evaluate(BlockExecution execution, Map<String, Object> values);
}
