package com.chih.JQWeb.core.engine;

import com.chih.JQWeb.core.exception.ExpressionEvaluationException;
import com.chih.JQWeb.core.exception.JQWebException;
import com.chih.JQWeb.core.exception.MissingValueException;
import com.chih.JQWeb.core.exception.SourceLocation;
import com.chih.JQWeb.core.exception.TemplateCompileException;
import com.chih.JQWeb.core.exception.TemplateErrorInfo;
import com.chih.JQWeb.core.exception.TemplateNotFoundException;
import com.chih.JQWeb.core.exception.TemplateRecursionException;
import com.chih.JQWeb.core.exception.TransientTemplateException;
import com.chih.JQWeb.core.impl.InMemoryTemplateSource;
import com.chih.JQWeb.core.render.RenderStackMachine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

@DisplayName("QWebEngine 错误报告")
class QWebEngineErrorTest {

    private InMemoryTemplateSource source;
    private QWebEngine engine;

    @BeforeEach
    void setUp() {
        source = new InMemoryTemplateSource();
        engine = QWebEngine.builder(source).build();
    }

    @Test
    @DisplayName("模板不存在")
    void testNotFound() {
        assertThatThrownBy(() -> engine.render("missing", Map.of()))
                .isInstanceOf(TemplateNotFoundException.class)
                .hasMessageContaining("Template not found: missing");

        String html = engine.render("missing", Map.of(), RenderOptions.builder().raiseIfNotFound(false).build());
        assertThat(html).isEmpty();
    }

    @Test
    @DisplayName("t-call 目标不存在时报告调用方节点")
    void testCallTargetNotFound() {
        source.add("caller", "<t t-name=\"caller\"><div><t t-call=\"ghost\"/></div></t>");

        TemplateNotFoundException error = catchThrowableOfType(
                () -> engine.render("caller", Map.of()), TemplateNotFoundException.class);

        assertThat(error.getReference()).isEqualTo("ghost");
        TemplateErrorInfo info = error.getErrorInfo();
        assertThat(info.getTemplate()).isEqualTo("caller");
        assertThat(info.getPath()).isEqualTo("/t/div/t");
        assertThat(error.getMessage()).startsWith("Error while rendering the template:");
    }

    @Test
    @DisplayName("无限递归")
    void testInfiniteRecursion() {
        source.add("loop", "<t t-name=\"loop\"><b>x</b><t t-call=\"loop\"/></t>");

        assertThatThrownBy(() -> engine.render("loop", Map.of()))
                .isInstanceOf(TemplateRecursionException.class)
                .hasMessageContaining("Qweb template infinite recursion: stack depth exceeded 50 frames");
    }

    @ParameterizedTest(name = "{0}")
    @ValueSource(strings = {"str(x)", "len(x)", "x + ''"})
    @DisplayName("t-set 内容在字符串运算中递归同样受栈深限制")
    void testRecursionThroughContentCoercion(String expression) {
        source.add("rec", "<t t-name=\"rec\"><t t-set=\"x\"><t t-call=\"rec\"/></t><t t-out=\"" + expression + "\"/></t>");

        TemplateRecursionException error = catchThrowableOfType(
                () -> engine.render("rec", Map.of()), TemplateRecursionException.class);

        assertThat(error).isNotNull();
        assertThat(error.hasErrorInfo()).isTrue();
        assertThat(error.getErrorInfo().getMessage())
                .contains("stack depth exceeded " + RenderStackMachine.MAX_DEPTH + " frames");
        assertThat(error.getErrorInfo().getSource()).isNotEmpty();
    }

    @Test
    @DisplayName("经由内容槽的递归受栈深限制")
    void testRecursionThroughSlot() {
        source.add("box", "<t t-name=\"box\"><div><t t-out=\"0\"/></div></t>");
        source.add("nest", "<t t-name=\"nest\"><t t-call=\"box\"><t t-call=\"nest\"/></t></t>");

        TemplateRecursionException error = catchThrowableOfType(
                () -> engine.render("nest", Map.of()), TemplateRecursionException.class);

        assertThat(error).isNotNull();
        assertThat(error.hasErrorInfo()).isTrue();
        assertThat(error.getErrorInfo().getTemplate()).isIn("nest", "box");
        assertThat(error.getErrorInfo().getSource()).isNotEmpty();
    }

    @Test
    @DisplayName("有限深度的递归正常渲染")
    void testBoundedRecursion() {
        source.add("countdown", "<t t-name=\"countdown\"><t t-out=\"n\"/><t t-if=\"n > 0\">"
                + "<t t-call=\"countdown\" n=\"n - 1\"/></t></t>");

        assertThat(engine.render("countdown", Map.of("n", 5))).isEqualTo("543210");
    }

    @Test
    @DisplayName("运行时错误携带模板、路径与调用链")
    void testErrorContext() {
        source.add("inner", "<t t-name=\"inner\"><p t-out=\"1 // zero\"/></t>");
        source.add("outer", "<t t-name=\"outer\"><div><t t-call=\"inner\"/></div></t>");

        ExpressionEvaluationException error = catchThrowableOfType(
                () -> engine.render("outer", Map.of("zero", 0)), ExpressionEvaluationException.class);

        TemplateErrorInfo info = error.getErrorInfo();
        assertThat(info.getMessage()).startsWith("ExpressionEvaluationException: ZeroDivisionError");
        assertThat(info.getTemplate()).isEqualTo("inner");
        assertThat(info.getPath()).isEqualTo("/t/p");
        assertThat(info.getElement()).contains("<p");
        assertThat(info.getSource()).extracting(SourceLocation::path).contains("/t/div/t");
        assertThat(error.getMessage()).contains("Template: inner");
    }

    @Test
    @DisplayName("t-call 内容块中的错误包含两级调用位置")
    void testErrorInsideSlot() {
        source.add("frame", "<t t-name=\"frame\"><section><t t-out=\"0\"/></section></t>");
        source.add("page", "<t t-name=\"page\"><t t-call=\"frame\"><i t-out=\"user.name\"/></t></t>");

        MissingValueException error = catchThrowableOfType(
                () -> engine.render("page", Map.of()), MissingValueException.class);

        assertThat(error.getErrorInfo().getMessage()).contains("KeyError: 'user'");
        assertThat(error.getErrorInfo().getSource()).isNotEmpty();
    }

    @ParameterizedTest(name = "{0}")
    @CsvSource(delimiter = '|', quoteCharacter = '"', value = {
            "<t><p t-call='x'/></t>|t-call must be on a <t> element (actually on <p>).",
            "<t><p t-elif='a'>x</p></t>|t-elif directive must be preceded by t-if or t-elif directive",
            "<t><p t-else=''>x</p></t>|t-else directive must be preceded by t-if or t-elif directive",
            "<t><p t-if=''>x</p></t>|t-if or t-elif expression should not be empty.",
            "<t><t t-value='1'/></t>|t-value must be on the same node of t-set",
            "<t><t t-set='a-b' t-value='1'/></t>|The varname can only contain alphanumeric characters and underscores.",
            "<t><t t-lang='fr'/></t>|t-lang is an alias of t-options-lang but only available on the same node of t-call",
            "<t><t t-field='record.name'/></t>|t-field can not be used on a t element",
            "<t><p t-options='{}'>x</p></t>|the t-options must be on the same tag as a directive that consumes it",
            "<t><td t-field='record.name'/></t>|QWeb widgets do not work correctly on 'td' elements",
            "<t><p t-out='x.__class__'/></t>|__"
    })
    @DisplayName("编译期错误")
    void testCompileErrors(String xml, String message) {
        source.add("bad", xml);

        assertThatThrownBy(() -> engine.render("bad", Map.of()))
                .isInstanceOf(TemplateCompileException.class)
                .hasMessageContaining(message);
    }

    @Test
    @DisplayName("编译错误定位到出错节点")
    void testCompileErrorLocation() {
        source.add("bad", "<t><div><span t-call=\"x\"/></div></t>");

        TemplateCompileException error = catchThrowableOfType(
                () -> engine.render("bad", Map.of()), TemplateCompileException.class);

        assertThat(error.getLocation()).isNotNull();
        assertThat(error.getLocation().path()).isEqualTo("/t/div/span");
    }

    @Test
    @DisplayName("每次渲染抛出新的异常实例")
    void testCompileErrorIsFreshPerRender() {
        source.add("bad", "<t><p t-call=\"x\"/></t>");

        JQWebException first = catchThrowableOfType(() -> engine.render("bad", Map.of()), JQWebException.class);
        JQWebException second = catchThrowableOfType(() -> engine.render("bad", Map.of()), JQWebException.class);

        assertThat(first).isNotSameAs(second);
        assertThat(first.getErrorInfo().getSource()).isEqualTo(second.getErrorInfo().getSource());
    }

    @Test
    @DisplayName("存储层瞬时异常原样抛出")
    void testTransientErrorIsNotAnnotated() {
        InMemoryTemplateSource flaky = new InMemoryTemplateSource(reference -> {
            throw new TransientTemplateException("serialization failure", null);
        });
        flaky.add("page", "<t t-name=\"page\"><div><t t-call=\"lazy\"/></div></t>");
        engine = QWebEngine.builder(flaky).build();

        TransientTemplateException error = catchThrowableOfType(
                () -> engine.render("page", Map.of()), TransientTemplateException.class);

        assertThat(error.hasErrorInfo()).isFalse();
        assertThat(error.getMessage()).isEqualTo("serialization failure");
    }
}
