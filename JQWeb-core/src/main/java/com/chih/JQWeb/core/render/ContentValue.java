package com.chih.JQWeb.core.render;

/**
 * 延迟渲染的内容块（t-set 的内容、t-call 的内容槽 "0"）
 * <p>
 * 直接输出时作为 {@link CallParameters} 交给栈机压栈；
 * 参与字符串运算时（{@link #toString()}）才在独立的栈机里渲染，结果只计算一次。
 *
 * @author lizhiyuan
 * @since 2026/10/09
 */
public final class ContentValue implements HtmlSafe {

    private final RenderSession session;

    private final CallParameters parameters;

    private String html;

    public ContentValue(RenderSession session, CallParameters parameters) {
        this.session = session;
        this.parameters = parameters;
    }

    public CallParameters getParameters() {
        return parameters;
    }

    public boolean isRendered() {
        return html != null;
    }

    /**
     * @return 已渲染的标记；尚未渲染时为 null
     */
    public String getHtml() {
        return html;
    }

    @Override
    public String toHtml() {
        return toString();
    }

    @Override
    public String toString() {
        if (html == null) {
            StringBuilder out = new StringBuilder();
            RenderStackMachine machine = new RenderStackMachine(session, parameters.template(),
                    parameters.block(), parameters.values(), parameters.directive());
            while (machine.hasNext()) {
                out.append(machine.next());
            }
            html = out.toString();
        }
        return html;
    }
}
