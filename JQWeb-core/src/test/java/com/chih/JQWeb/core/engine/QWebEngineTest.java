package com.chih.JQWeb.core.engine;

import com.chih.JQWeb.core.domain.TemplateDefinition;
import com.chih.JQWeb.core.exception.TemplateNotFoundException;
import com.chih.JQWeb.core.spi.RenderMetrics;
import com.chih.JQWeb.core.spi.TemplateChangeEvent;
import com.chih.JQWeb.core.spi.TemplateSource;
import com.chih.JQWeb.core.support.TemplateParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * QWebEngine 与协作者的交互
 *
 * 测试覆盖：
 * - 批量预加载
 * - 变更事件触发缓存失效
 * - 渲染与编译指标
 * - profile 模式的指令计时
 */
@ExtendWith(MockitoExtension.class)
public class QWebEngineTest {

    @Mock
    private TemplateSource mockSource;

    @Mock
    private RenderMetrics mockMetrics;

    private final Map<String, TemplateDefinition> definitions = new LinkedHashMap<>();

    private QWebEngine engine;

    @BeforeEach
    void setUp() {
        define("layout", "<t t-name=\"layout\"><html><t t-out=\"0\"/></html></t>");
        define("menu", "<t t-name=\"menu\"><nav t-foreach=\"items\" t-as=\"item\" t-out=\"item\"/></t>");
        define("home", "<t t-name=\"home\"><t t-call=\"layout\"><t t-call=\"menu\"/><p>home</p></t></t>");

        engine = QWebEngine.builder(mockSource).metrics(mockMetrics).build();
    }

    private void define(String name, String xml) {
        definitions.put(name, new TemplateDefinition(name, TemplateParser.parseElement(xml)));
    }

    private void stubResolveAll() {
        when(mockSource.resolveAll(anyCollection())).thenAnswer(invocation -> {
            Collection<?> references = invocation.getArgument(0);
            Map<Object, TemplateDefinition> found = new LinkedHashMap<>();
            for (Object reference : references) {
                TemplateDefinition definition = definitions.get(String.valueOf(reference));
                if (definition != null) {
                    found.put(reference, definition);
                }
            }
            return found;
        });
    }

    @Test
    void testPreloadInOneBatchPerLevel() {
        stubResolveAll();

        String html = engine.render("home", Map.of("items", List.of("a", "b")));

        assertThat(html).isEqualTo("<html><nav>a</nav><nav>b</nav><p>home</p></html>");
        // home，然后 layout 与 menu 一起
        verify(mockSource, times(2)).resolveAll(anyCollection());
        verify(mockSource, never()).load(any());
        assertThat(engine.getCompileCount()).isEqualTo(3);
    }

    @Test
    void testCachedRenderDoesNotTouchSource() {
        stubResolveAll();

        engine.render("home", Map.of());
        engine.render("home", Map.of());
        engine.render("menu", Map.of());

        verify(mockSource, times(2)).resolveAll(anyCollection());
        assertThat(engine.getCompileCount()).isEqualTo(3);
    }

    @Test
    void testChangeEventClearsCache() {
        stubResolveAll();
        @SuppressWarnings("unchecked")
        ArgumentCaptor<Consumer<TemplateChangeEvent>> listener = ArgumentCaptor.forClass(Consumer.class);
        verify(mockSource).onChange(listener.capture());

        engine.render("menu", Map.of("items", List.of("x")));
        define("menu", "<t t-name=\"menu\"><ul><li t-foreach=\"items\" t-as=\"item\" t-out=\"item\"/></ul></t>");
        listener.getValue().accept(new TemplateChangeEvent(Map.of("menu", definitions.get("menu")), null));

        assertThat(engine.render("menu", Map.of("items", List.of("x")))).isEqualTo("<ul><li>x</li></ul>");
        assertThat(engine.getCompileCount()).isEqualTo(2);
    }

    @Test
    void testEmptyChangeEventKeepsCache() {
        stubResolveAll();
        @SuppressWarnings("unchecked")
        ArgumentCaptor<Consumer<TemplateChangeEvent>> listener = ArgumentCaptor.forClass(Consumer.class);
        verify(mockSource).onChange(listener.capture());

        engine.render("menu", Map.of());
        listener.getValue().accept(new TemplateChangeEvent(null, Set.of()));
        engine.render("menu", Map.of());

        assertThat(engine.getCompileCount()).isEqualTo(1);
    }

    @Test
    void testMetrics() {
        stubResolveAll();

        engine.render("menu", Map.of());
        assertThatThrownBy(() -> engine.render("ghost", Map.of())).isInstanceOf(TemplateNotFoundException.class);

        verify(mockMetrics).recordRender(eq("menu"), anyLong(), eq(true));
        verify(mockMetrics).recordRender(eq("ghost"), anyLong(), eq(false));
        verify(mockMetrics).recordCompile(eq("menu"), anyLong(), eq(true));
        verify(mockMetrics, never()).recordCompile(eq("ghost"), anyLong(), anyBoolean());
        verify(mockMetrics, never()).recordDirective(anyString(), anyString(), any(), anyLong());
    }

    @Test
    void testProfileRecordsDirectives() {
        stubResolveAll();
        RenderOptions profiled = RenderOptions.builder().profile(true).build();

        String html = engine.render("menu", Map.of("items", List.of(1, 2)), profiled);

        assertThat(html).isEqualTo("<nav>1</nav><nav>2</nav>");
        verify(mockMetrics, atLeastOnce()).recordDirective(eq("menu"), eq("t-foreach"), any(), anyLong());
        verify(mockMetrics, atLeastOnce()).recordDirective(eq("menu"), eq("t-out"), any(), anyLong());
        verify(mockMetrics, never()).recordDirective(anyString(), eq("t-tag-open"), any(), anyLong());
    }
}
