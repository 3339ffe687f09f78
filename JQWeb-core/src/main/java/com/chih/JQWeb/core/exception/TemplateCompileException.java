package com.chih.JQWeb.core.exception;

/**
 * 模板编译失败（非法表达式、非法指令组合等），不会重试，失败结果同样被缓存
 */
public class TemplateCompileException extends JQWebException {

    /** 出错节点，无法定位时为 null */
    private final SourceLocation location;

    public TemplateCompileException(String message) {
        this(message, null, null);
    }

    public TemplateCompileException(String message, Throwable cause) {
        this(message, null, cause);
    }

    public TemplateCompileException(String message, SourceLocation location, Throwable cause) {
        super(message, cause);
        this.location = location;
    }

    public SourceLocation getLocation() {
        return location;
    }

    @Override
    public String getMessage() {
        if (hasErrorInfo() || location == null) {
            return super.getMessage();
        }
        return getRawMessage() + "\n    Template: " + location.template()
                + "\n    Path: " + location.path()
                + "\n    Element: " + location.element();
    }
}
