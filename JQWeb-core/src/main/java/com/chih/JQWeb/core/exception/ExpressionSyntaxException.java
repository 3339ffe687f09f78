package com.chih.JQWeb.core.exception;

/**
 * 表达式无法解析，或包含沙箱不允许的操作
 */
public class ExpressionSyntaxException extends TemplateCompileException {

    private final String expression;

    public ExpressionSyntaxException(String message, String expression) {
        super(message + (expression == null ? "" : " in expression: " + expression));
        this.expression = expression;
    }

    public String getExpression() {
        return expression;
    }
}
