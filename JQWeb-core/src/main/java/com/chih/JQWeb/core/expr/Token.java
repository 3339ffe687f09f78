package com.chih.JQWeb.core.expr;

/**
 * 表达式词法单元
 *
 * @param type     类型
 * @param text     源文本
 * @param value    字面量的值（字符串、Long 或 Double），其余为 null
 * @param position 在表达式中的起始偏移
 *
 * @author lizhiyuan
 * @since 2026/10/02
 */
public record Token(TokenType type, String text, Object value, int position) {

    public boolean is(TokenType type, String text) {
        return this.type == type && this.text.equals(text);
    }

    public boolean isName(String name) {
        return type == TokenType.NAME && text.equals(name);
    }

    public boolean isOperator(String op) {
        return type == TokenType.OPERATOR && text.equals(op);
    }

    @Override
    public String toString() {
        return type + "('" + text + "')@" + position;
    }
}
