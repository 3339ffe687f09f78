package com.chih.JQWeb.core.expr;

import com.chih.JQWeb.core.exception.ExpressionEvaluationException;
import com.chih.JQWeb.core.exception.ExpressionSyntaxException;
import com.chih.JQWeb.core.exception.MissingValueException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("表达式编译与沙箱")
class ExpressionCompilerTest {

    private static Object eval(String source, Map<String, Object> values) {
        return ExpressionCompiler.compile(source).evaluate(values);
    }

    @Nested
    @DisplayName("求值")
    class Evaluation {

        @Test
        void testArithmeticAndComparison() {
            assertThat(eval("1 + 2 * 3", Map.of())).isEqualTo(7L);
            assertThat(eval("7 // 2", Map.of())).isEqualTo(3L);
            assertThat(eval("-7 // 2", Map.of())).isEqualTo(-4L);
            assertThat(eval("-7 % 3", Map.of())).isEqualTo(2L);
            assertThat(eval("1 < n <= 3", Map.of("n", 3))).isEqualTo(true);
            assertThat(eval("'a' if n else 'b'", Map.of("n", 0))).isEqualTo("b");
        }

        @Test
        void testBooleanOperatorsReturnOperand() {
            assertThat(eval("name or 'anonymous'", Map.of())).isEqualTo("anonymous");
            assertThat(eval("name and name.upper()", Map.of("name", "bob"))).isEqualTo("BOB");
            assertThat(eval("not items", Map.of("items", List.of()))).isEqualTo(true);
        }

        @Test
        void testAttributeSubscriptAndMethods() {
            Map<String, Object> values = new HashMap<>();
            values.put("user", Map.of("name", "Ada", "tags", List.of("x", "y", "z")));
            assertThat(eval("user['name']", values)).isEqualTo("Ada");
            assertThat(eval("user.get('missing', 'none')", values)).isEqualTo("none");
            assertThat(eval("', '.join(user['tags'])", values)).isEqualTo("x, y, z");
            assertThat(eval("user['tags'][-1]", values)).isEqualTo("z");
            assertThat(eval("user['tags'][1:]", values)).isEqualTo(List.of("y", "z"));
            assertThat(eval("len(user['tags'])", values)).isEqualTo(3L);
        }

        @Test
        void testLambdaAndComprehensions() {
            assertThat(eval("[x * 2 for x in range(4) if x % 2 == 0]", Map.of())).isEqualTo(List.of(0L, 4L));
            assertThat(eval("sorted(['b', 'a', 'c'])", Map.of())).isEqualTo(List.of("a", "b", "c"));
            assertThat(eval("(lambda a, b: a + b)(2, 3)", Map.of())).isEqualTo(5L);
            assertThat(eval("{k: v for k, v in [('a', 1)]}", Map.of())).isEqualTo(Map.of("a", 1L));
        }

        @Test
        void testStringFormatting() {
            assertThat(eval("'%s-%s' % (a, b)", Map.of("a", "x", "b", 2))).isEqualTo("x-2");
            assertThat(eval("'{} items'.format(n)", Map.of("n", 3))).isEqualTo("3 items");
        }

        @Test
        @DisplayName("局部变量不会泄漏到绑定中")
        void testComprehensionTargetsDoNotLeak() {
            Map<String, Object> values = new HashMap<>();
            values.put("x", "outer");
            assertThat(eval("[x for x in [1, 2]]", values)).isEqualTo(List.of(1L, 2L));
            assertThat(values).containsEntry("x", "outer");
        }
    }

    @Nested
    @DisplayName("缺失名称")
    class MissingNames {

        @Test
        @DisplayName("普通名称缺失时为 None")
        void testOptionalName() {
            assertThat(eval("missing", Map.of())).isNull();
            assertThat(eval("missing is None", Map.of())).isEqualTo(true);
        }

        @Test
        @DisplayName("被调用或取属性的名称必须存在")
        void testRequiredName() {
            assertThatThrownBy(() -> eval("missing.name", Map.of()))
                    .isInstanceOf(MissingValueException.class)
                    .hasMessageContaining("missing");
            assertThatThrownBy(() -> eval("missing()", Map.of()))
                    .isInstanceOf(MissingValueException.class);
        }

        @Test
        @DisplayName("raiseOnMissing 时所有自由名称都必须存在")
        void testRaiseOnMissing() {
            CompiledExpression expression = ExpressionCompiler.compile("record", true);
            assertThatThrownBy(() -> expression.evaluate(Map.of()))
                    .isInstanceOf(MissingValueException.class);
            assertThat(expression.evaluate(Map.of("record", "r"))).isEqualTo("r");
        }

        @Test
        void testUnknownFunction() {
            assertThatThrownBy(() -> eval("undefined_function(1)", Map.of()))
                    .isInstanceOf(MissingValueException.class);
        }
    }

    @Nested
    @DisplayName("沙箱")
    class Sandbox {

        @ParameterizedTest
        @ValueSource(strings = {
                "x.__class__",
                "__import__('os')",
                "[y.__globals__ for y in items]",
                "(lambda __x: 1)(2)"
        })
        @DisplayName("双下划线名称被拒绝")
        void testDunderRejected(String source) {
            assertThatThrownBy(() -> ExpressionCompiler.compile(source))
                    .isInstanceOf(ExpressionSyntaxException.class);
        }

        @ParameterizedTest
        @ValueSource(strings = {"a = 1", "a += 1", "(a := 1)", "import os", "x; y", ""})
        @DisplayName("语句与赋值在编译期被拒绝")
        void testStatementsRejected(String source) {
            assertThatThrownBy(() -> ExpressionCompiler.compile(source))
                    .isInstanceOf(ExpressionSyntaxException.class);
        }

        @Test
        void testSyntaxErrorKeepsExpression() {
            assertThatThrownBy(() -> ExpressionCompiler.compile("1 +"))
                    .isInstanceOfSatisfying(ExpressionSyntaxException.class,
                            e -> assertThat(e.getExpression()).isEqualTo("1 +"));
        }

        @Test
        @DisplayName("编译不会求值")
        void testCompileIsPure() {
            CompiledExpression expression = ExpressionCompiler.compile("1 // 0");
            assertThatThrownBy(() -> expression.evaluate(Map.of()))
                    .isInstanceOf(ExpressionEvaluationException.class);
        }
    }

    @Nested
    @DisplayName("格式化字符串")
    class Format {

        @Test
        void testBothPlaceholderStyles() {
            FormatString format = ExpressionCompiler.compileFormat("item-{{ id }} #{name}");
            assertThat(format.isConstant()).isFalse();
            assertThat(format.evaluate(Map.of("id", 7, "name", "box"))).isEqualTo("item-7 box");
        }

        @Test
        void testConstantFormat() {
            FormatString format = ExpressionCompiler.compileFormat("plain text");
            assertThat(format.isConstant()).isTrue();
            assertThat(format.evaluate(null)).isEqualTo("plain text");
        }

        @Test
        @DisplayName("None 与 False 占位输出为空")
        void testFalsyPlaceholders() {
            assertThat(ExpressionCompiler.compileFormat("[{{ a }}|{{ b }}]").evaluate(Map.of("b", false)))
                    .isEqualTo("[|]");
        }
    }
}
