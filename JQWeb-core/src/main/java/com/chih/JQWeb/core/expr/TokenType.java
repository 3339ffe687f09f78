package com.chih.JQWeb.core.expr;

/**
 * 表达式词法单元类型
 *
 * @author lizhiyuan
 * @since 2026/10/02
 */
public enum TokenType {
    /** 标识符或关键字 */
    NAME,
    /** 整数或浮点数字面量 */
    NUMBER,
    /** 字符串字面量（已解码） */
    STRING,
    /** 运算符，如 {@code + == // **} */
    OPERATOR,
    LPAR,
    RPAR,
    LSQB,
    RSQB,
    LBRACE,
    RBRACE,
    COMMA,
    COLON,
    DOT,
    /** 单个 {@code =}，只出现在关键字参数（或被沙箱拒绝的赋值）中 */
    EQUAL,
    /** 输入结束 */
    END;

    public boolean isOpening() {
        return this == LPAR || this == LSQB || this == LBRACE;
    }

    public boolean isClosing() {
        return this == RPAR || this == RSQB || this == RBRACE;
    }
}
