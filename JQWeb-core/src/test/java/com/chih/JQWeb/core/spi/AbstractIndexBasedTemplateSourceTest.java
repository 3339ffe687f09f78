package com.chih.JQWeb.core.spi;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static org.assertj.core.api.Assertions.*;

/**
 * AbstractIndexBasedTemplateSource 单元测试
 *
 * 使用内存资源验证双向索引、增量变更计算与事件暂存。
 */
@DisplayName("AbstractIndexBasedTemplateSource 测试")
class AbstractIndexBasedTemplateSourceTest {

    /**
     * 资源就是一个名字，内容保存在 map 中
     */
    private static class MemorySource extends AbstractIndexBasedTemplateSource<String> {

        private final Map<String, String> contents = new ConcurrentHashMap<>();

        MemorySource() {
            super(50L, null, null);
        }

        void put(String resource, String xml) {
            contents.put(resource, xml);
        }

        void delete(String resource) {
            contents.remove(resource);
        }

        @Override
        protected InputStream openStream(String resource) throws Exception {
            String xml = contents.get(resource);
            if (xml == null) {
                throw new IOException("Resource not found: " + resource);
            }
            return new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8));
        }

        @Override
        protected String getResourceId(String resource) {
            return resource;
        }

        @Override
        protected boolean exists(String resource) {
            return contents.containsKey(resource);
        }

        @Override
        protected String resolveResourceFromFile(File file) {
            return file.getName();
        }

        @Override
        protected String getResourceDescription(String resource) {
            return "memory:" + resource;
        }
    }

    private MemorySource source;

    private final List<TemplateChangeEvent> events = new ArrayList<>();

    @BeforeEach
    void setUp() {
        source = new MemorySource();
    }

    @AfterEach
    void tearDown() throws Exception {
        source.close();
    }

    @Test
    @DisplayName("初始加载建立双向索引")
    void testInitialIndex() {
        source.put("a.xml", "<templates><t t-name=\"one\">1</t><t t-name=\"two\">2</t></templates>");
        source.safeLoadResource("a.xml");

        assertThat(source.getTemplateNames()).containsExactlyInAnyOrder("one", "two");
        assertThat(source.sourceToKeys.get("a.xml")).containsExactlyInAnyOrder("one", "two");
        assertThat(source.load("one").getOrigin()).isEqualTo("memory:a.xml");
        assertThat(source.load(42)).isNull();
        assertThat(source.pendingUpdates).isEmpty();
    }

    @Test
    @DisplayName("增量刷新计算新增与删除的模板")
    void testIncrementalDiff() {
        source.put("a.xml", "<templates><t t-name=\"one\">1</t><t t-name=\"two\">2</t></templates>");
        source.safeLoadResource("a.xml");
        source.onChange(events::add);

        source.put("a.xml", "<templates><t t-name=\"one\">1b</t><t t-name=\"three\">3</t></templates>");
        source.refreshIndex("a.xml", true);
        source.notifyManager();

        assertThat(events).hasSize(1);
        TemplateChangeEvent event = events.get(0);
        assertThat(event.getUpdated()).containsOnlyKeys("one", "three");
        assertThat(event.getRemoved()).containsExactly("two");
        assertThat(source.getTemplateNames()).containsExactlyInAnyOrder("one", "three");
    }

    @Test
    @DisplayName("资源删除时移除其全部模板")
    void testResourceRemoval() {
        source.put("a.xml", "<t t-name=\"one\">1</t>");
        source.put("b.xml", "<t t-name=\"other\">x</t>");
        source.safeLoadResource("a.xml");
        source.safeLoadResource("b.xml");
        source.onChange(events::add);

        source.delete("a.xml");
        source.refreshIndex("a.xml", true);
        source.notifyManager();

        assertThat(source.getTemplateNames()).containsExactly("other");
        assertThat(events.get(0).getRemoved()).containsExactly("one");
        assertThat(events.get(0).getUpdated()).isEmpty();
    }

    @Test
    @DisplayName("后加载的资源覆盖同名模板")
    void testOverrideAcrossResources() {
        source.put("a.xml", "<t t-name=\"shared\">a</t>");
        source.put("b.xml", "<t t-name=\"shared\">b</t>");
        source.safeLoadResource("a.xml");
        source.safeLoadResource("b.xml");

        assertThat(source.load("shared").getOrigin()).isEqualTo("memory:b.xml");
    }

    @Test
    @DisplayName("解析失败记录错误，修复后清除")
    void testLoadErrors() {
        source.put("bad.xml", "<t t-name=\"x\">");
        source.safeLoadResource("bad.xml");
        assertThat(source.getLoadErrors()).containsOnlyKeys("bad.xml");

        source.put("bad.xml", "<t t-name=\"x\">fixed</t>");
        source.refreshIndex("bad.xml", true);
        assertThat(source.getLoadErrors()).isEmpty();
        assertThat(source.getTemplateNames()).containsExactly("x");
    }

    @Test
    @DisplayName("监听器注册前的事件在注册时重放")
    void testPendingEventsReplay() {
        source.put("a.xml", "<t t-name=\"early\">1</t>");
        source.refreshIndex("a.xml", true);
        source.notifyManager();

        assertThat(events).isEmpty();
        source.onChange(events::add);

        assertThat(events).hasSize(1);
        assertThat(events.get(0).getUpdated()).containsOnlyKeys("early");
    }

    @Test
    @DisplayName("没有变更时不发送事件")
    void testNoEventWithoutChanges() {
        source.onChange(events::add);
        source.notifyManager();

        assertThat(events).isEmpty();
    }
}
