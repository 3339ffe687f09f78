package com.chih.JQWeb.core.exception;

/**
 * 编译后代码块执行期间的任意失败，附带栈机收集的结构化上下文
 */
public class TemplateRenderException extends JQWebException {

    public TemplateRenderException(String message) {
        super(message);
    }

    public TemplateRenderException(TemplateErrorInfo info, Throwable cause) {
        super(RENDER_ERROR, cause);
        attachErrorInfo(info);
    }
}
