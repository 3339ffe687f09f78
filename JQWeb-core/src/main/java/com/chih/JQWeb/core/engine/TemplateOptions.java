package com.chih.JQWeb.core.engine;

import com.chih.JQWeb.core.expr.PyOps;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 影响编译产物的选项快照，同时是编译缓存键的一部分
 *
 * @param lang                语言
 * @param inheritBranding     输出 data-oe-* 编辑标记
 * @param inheritBrandingAuto 按记录权限自动决定是否输出编辑标记
 * @param editTranslations    翻译编辑模式
 * @param profile             记录指令级耗时
 *
 * @author lizhiyuan
 * @since 2026/10/11
 */
public record TemplateOptions(String lang, boolean inheritBranding, boolean inheritBrandingAuto,
                              boolean editTranslations, boolean profile) {

    public static final TemplateOptions DEFAULT = new TemplateOptions(null, false, false, false, false);

    public TemplateOptions withLang(String newLang) {
        return new TemplateOptions(newLang, inheritBranding, inheritBrandingAuto, editTranslations, profile);
    }

    /**
     * 用 t-call 上的 t-options 覆盖当前选项，未识别的键忽略
     */
    public TemplateOptions withOverrides(Map<String, Object> overrides) {
        if (overrides == null || overrides.isEmpty()) {
            return this;
        }
        String newLang = lang;
        boolean branding = inheritBranding;
        boolean brandingAuto = inheritBrandingAuto;
        boolean translations = editTranslations;
        boolean profiling = profile;
        for (Map.Entry<String, Object> entry : overrides.entrySet()) {
            Object value = entry.getValue();
            switch (entry.getKey()) {
                case "lang":
                    newLang = value == null ? null : PyOps.str(value);
                    break;
                case "inherit_branding":
                    branding = PyOps.truthy(value);
                    break;
                case "inherit_branding_auto":
                    brandingAuto = PyOps.truthy(value);
                    break;
                case "edit_translations":
                    translations = PyOps.truthy(value);
                    break;
                case "profile":
                    profiling = PyOps.truthy(value);
                    break;
                default:
                    break;
            }
        }
        TemplateOptions result = new TemplateOptions(newLang, branding, brandingAuto, translations, profiling);
        return result.equals(this) ? this : result;
    }

    /**
     * 以表达式可读的形式导出，传给字段转换器
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("lang", lang);
        map.put("inherit_branding", inheritBranding);
        map.put("inherit_branding_auto", inheritBrandingAuto);
        map.put("edit_translations", editTranslations);
        map.put("profile", profile);
        return map;
    }
}
