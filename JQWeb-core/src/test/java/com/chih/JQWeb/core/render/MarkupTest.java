package com.chih.JQWeb.core.render;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Markup 测试")
class MarkupTest {

    @Test
    void testEscape() {
        assertThat(Markup.escape("<a href=\"x\">'&'</a>").toHtml())
                .isEqualTo("&lt;a href=&#34;x&#34;&gt;&#39;&amp;&#39;&lt;/a&gt;");
        assertThat(Markup.escape(null) == Markup.EMPTY).isTrue();
        assertThat(Markup.escape(List.of("a")).toHtml()).isEqualTo("[&#39;a&#39;]");
    }

    @Test
    @DisplayName("安全值不重复转义")
    void testAlreadySafe() {
        Markup bold = Markup.of("<b>x</b>");

        assertThat(Markup.escape(bold) == bold).isTrue();
        assertThat(bold.concat("<i>").toHtml()).isEqualTo("<b>x</b>&lt;i&gt;");
        assertThat(bold.concat(Markup.of("<i/>")).toHtml()).isEqualTo("<b>x</b><i/>");
    }

    @Test
    @DisplayName("文本节点只转义 & < >")
    void testEscapeContent() {
        assertThat(Markup.escapeContent("\"a\" & 'b' <c>")).isEqualTo("\"a\" &amp; 'b' &lt;c&gt;");
        assertThat(Markup.escapeContent("plain")).isEqualTo("plain");
    }

    @Test
    void testEquality() {
        assertThat(Markup.of("x").equals(Markup.of("x"))).isTrue();
        assertThat(Markup.of("x").equals("x")).isFalse();
        assertThat(Markup.of("") == Markup.EMPTY).isTrue();
        assertThat(Markup.of("abc").subSequence(1, 2).toString()).isEqualTo("b");
    }
}
