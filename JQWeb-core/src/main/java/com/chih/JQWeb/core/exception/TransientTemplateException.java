package com.chih.JQWeb.core.exception;

/**
 * 模板存储层的瞬时冲突（如事务冲突），渲染栈不做任何标注，原样抛给上游重试
 */
public class TransientTemplateException extends JQWebException {
    public TransientTemplateException(String message, Throwable cause) {
        super(message, cause);
    }
}
