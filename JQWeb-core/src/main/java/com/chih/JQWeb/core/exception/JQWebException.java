package com.chih.JQWeb.core.exception;

/**
 * JQWeb 框架根异常
 * <p>
 * 可选携带 {@link TemplateErrorInfo}，渲染栈展开时由栈机补充模板、路径与调用链信息。
 */
public class JQWebException extends RuntimeException {

    static final String RENDER_ERROR = "Error while rendering the template";

    private TemplateErrorInfo errorInfo;

    public JQWebException(String message) {
        super(message);
    }

    public JQWebException(String message, Throwable cause) {
        super(message, cause);
    }

    public TemplateErrorInfo getErrorInfo() {
        return errorInfo;
    }

    public boolean hasErrorInfo() {
        return errorInfo != null;
    }

    public void attachErrorInfo(TemplateErrorInfo errorInfo) {
        this.errorInfo = errorInfo;
    }

    /**
     * 未附加错误信息时的原始消息
     */
    public String getRawMessage() {
        return super.getMessage();
    }

    @Override
    public String getMessage() {
        if (errorInfo == null) {
            return super.getMessage();
        }
        return RENDER_ERROR + ":\n    " + errorInfo;
    }
}
