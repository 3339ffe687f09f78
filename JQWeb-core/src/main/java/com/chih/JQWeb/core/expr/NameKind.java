package com.chih.JQWeb.core.expr;

/**
 * 标识符在表达式中的解析方式
 *
 * @author lizhiyuan
 * @since 2026/10/02
 */
public enum NameKind {
    /** 非标识符词法单元 */
    NONE,
    /** lambda 参数或推导式目标，在局部作用域中查找 */
    LOCAL,
    /** 允许的关键字或内置函数，原样保留 */
    BUILTIN,
    /** 调用中的关键字参数名 */
    KEYWORD_ARGUMENT,
    /** 紧跟在 {@code .} 之后的属性名 */
    ATTRIBUTE,
    /** 必须存在的绑定，缺失时抛出 KeyError */
    REQUIRED,
    /** 可缺省的绑定，缺失时为 null */
    OPTIONAL
}
