package com.chih.JQWeb.core.exception;

/**
 * 表达式求值期间的类型、下标、属性等错误
 */
public class ExpressionEvaluationException extends JQWebException {
    public ExpressionEvaluationException(String message) {
        super(message);
    }

    public ExpressionEvaluationException(String message, Throwable cause) {
        super(message, cause);
    }
}
