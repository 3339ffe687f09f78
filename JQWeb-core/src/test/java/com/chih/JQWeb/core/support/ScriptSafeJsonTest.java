package com.chih.JQWeb.core.support;

import com.chih.JQWeb.core.exception.ExpressionEvaluationException;
import com.chih.JQWeb.core.expr.ExpressionCompiler;
import com.chih.JQWeb.core.render.Markup;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ScriptSafeJson 测试")
class ScriptSafeJsonTest {

    private final ScriptSafeJson json = new ScriptSafeJson();

    @Test
    @DisplayName("转义 HTML 敏感字符")
    void testEscapesHtmlCharacters() {
        assertThat(json.toJson("</script><b>&")).isEqualTo("\"\\u003c/script\\u003e\\u003cb\\u003e\\u0026\"");
    }

    @Test
    @DisplayName("保持 Map 插入顺序")
    void testMapOrder() {
        Map<String, Object> value = new LinkedHashMap<>();
        value.put("z", 1);
        value.put("a", List.of(true, "x"));
        value.put("n", null);

        assertThat(json.toJson(value)).isEqualTo("{\"z\":1,\"a\":[true,\"x\"],\"n\":null}");
    }

    @Test
    @DisplayName("日期与 Markup")
    void testDatesAndMarkup() {
        assertThat(json.toJson(LocalDate.of(2024, 1, 2))).isEqualTo("\"2024-01-02\"");
        assertThat(json.toJson(Markup.of("<i>"))).isEqualTo("\"\\u003ci\\u003e\"");
    }

    @Test
    @DisplayName("表达式中的 dumps / loads")
    void testFromExpressions() {
        Map<String, Object> values = Map.of("json", json, "data", Map.of("k", "v"));

        assertThat(ExpressionCompiler.compile("json.dumps(data)").evaluate(values)).isEqualTo("{\"k\":\"v\"}");
        assertThat(ExpressionCompiler.compile("json.loads('[1, 2, 3]')[2]").evaluate(values)).isEqualTo(3);
        assertThat(ExpressionCompiler.compile("str(json)").evaluate(values)).isEqualTo("<module 'json'>");
    }

    @Test
    @DisplayName("参数错误")
    void testErrors() {
        Map<String, Object> values = Map.of("json", json);

        assertThatThrownBy(() -> ExpressionCompiler.compile("json.dumps(1, 2)").evaluate(values))
                .isInstanceOf(ExpressionEvaluationException.class)
                .hasMessageContaining("dumps() takes exactly one argument");
        assertThatThrownBy(() -> ExpressionCompiler.compile("json.loads('{')").evaluate(values))
                .isInstanceOf(ExpressionEvaluationException.class)
                .hasMessageStartingWith("ValueError");
    }
}
