package com.chih.JQWeb.core.exception;

/**
 * 表达式要求存在的绑定（或字典键）缺失
 */
public class MissingValueException extends JQWebException {

    private final Object key;

    public MissingValueException(Object key) {
        super("KeyError: '" + key + "'");
        this.key = key;
    }

    public Object getKey() {
        return key;
    }
}
