package com.chih.JQWeb.core.expr;

/**
 * 向表达式暴露属性的对象（如 {@code json} 辅助对象），优先于 getter 反射
 *
 * @author lizhiyuan
 * @since 2026/10/02
 */
public interface PyObject {

    /**
     * @return 属性值；不存在时返回 {@link #MISSING}
     */
    Object getAttribute(String name);

    Object MISSING = new Object() {
        @Override
        public String toString() {
            return "<missing>";
        }
    };
}
