package com.chih.JQWeb.core.support;

import com.chih.JQWeb.core.render.HtmlSafe;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * ObjectMapper 工厂
 * <p>
 * 模板中 {@code json.dumps(...)} 使用的序列化配置集中在这里。
 * </p>
 *
 * @author lizhiyuan
 * @since 2026/10/14
 */
public final class QWebObjectMapperFactory {

    private QWebObjectMapperFactory() {
    }

    /**
     * 创建 JSON 序列化用的 ObjectMapper，线程安全可重用
     */
    public static ObjectMapper createJsonMapper() {
        ObjectMapper mapper = new ObjectMapper();

        /* 支持 LocalDate 等时间类型，输出 ISO-8601 字符串 */
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

        /* 模板里经常把任意 bean 传给 json.dumps，空对象输出 {} 而不是报错 */
        mapper.configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);

        /* 输出顺序跟随 Map 的插入顺序，保证渲染结果稳定 */
        mapper.configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, false);

        /* Markup 与内容块按标记文本输出 */
        SimpleModule markupModule = new SimpleModule("qweb-markup");
        markupModule.addSerializer(HtmlSafe.class, ToStringSerializer.instance);
        mapper.registerModule(markupModule);

        return mapper;
    }
}
