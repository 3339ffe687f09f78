package com.chih.JQWeb.core.expr;

import java.util.List;
import java.util.Map;

/**
 * 表达式中可调用的值：内置函数、lambda、绑定方法
 *
 * @author lizhiyuan
 * @since 2026/10/02
 */
@FunctionalInterface
public interface PyCallable {

    Object call(List<Object> args, Map<String, Object> kwargs);
}
