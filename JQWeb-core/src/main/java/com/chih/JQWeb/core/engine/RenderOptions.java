package com.chih.JQWeb.core.engine;

/**
 * 单次渲染的选项
 * <p>
 * {@link TemplateOptions} 部分参与缓存键，其余开关只影响本次渲染。
 *
 * @author lizhiyuan
 * @since 2026/10/11
 */
public final class RenderOptions {

    public static final RenderOptions DEFAULT = builder().build();

    private final TemplateOptions templateOptions;

    /** 模板不存在时抛异常；false 时记录警告并输出空内容 */
    private final boolean raiseIfNotFound;

    /** 不注入 json、floor、ceil 等默认值 */
    private final boolean minimalContext;

    private RenderOptions(Builder builder) {
        this.templateOptions = new TemplateOptions(builder.lang, builder.inheritBranding,
                builder.inheritBrandingAuto, builder.editTranslations, builder.profile);
        this.raiseIfNotFound = builder.raiseIfNotFound;
        this.minimalContext = builder.minimalContext;
    }

    public static Builder builder() {
        return new Builder();
    }

    public TemplateOptions getTemplateOptions() {
        return templateOptions;
    }

    public boolean isRaiseIfNotFound() {
        return raiseIfNotFound;
    }

    public boolean isMinimalContext() {
        return minimalContext;
    }

    public static final class Builder {
        private String lang;
        private boolean inheritBranding;
        private boolean inheritBrandingAuto;
        private boolean editTranslations;
        private boolean profile;
        private boolean raiseIfNotFound = true;
        private boolean minimalContext;

        private Builder() {
        }

        public Builder lang(String lang) {
            this.lang = lang;
            return this;
        }

        public Builder inheritBranding(boolean inheritBranding) {
            this.inheritBranding = inheritBranding;
            return this;
        }

        public Builder inheritBrandingAuto(boolean inheritBrandingAuto) {
            this.inheritBrandingAuto = inheritBrandingAuto;
            return this;
        }

        public Builder editTranslations(boolean editTranslations) {
            this.editTranslations = editTranslations;
            return this;
        }

        public Builder profile(boolean profile) {
            this.profile = profile;
            return this;
        }

        public Builder raiseIfNotFound(boolean raiseIfNotFound) {
            this.raiseIfNotFound = raiseIfNotFound;
            return this;
        }

        public Builder minimalContext(boolean minimalContext) {
            this.minimalContext = minimalContext;
            return this;
        }

        public RenderOptions build() {
            return new RenderOptions(this);
        }
    }
}
