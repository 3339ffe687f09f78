package com.chih.JQWeb.core.engine;

import com.chih.JQWeb.core.impl.InMemoryTemplateSource;
import com.chih.JQWeb.core.render.Markup;
import com.chih.JQWeb.core.spi.AccessChecker;
import com.chih.JQWeb.core.spi.AssetLinkProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
/**
 * 各指令的渲染结果
 */
@DisplayName("QWebEngine 渲染")
class QWebEngineRenderTest {

    private InMemoryTemplateSource source;
    private QWebEngine engine;

    @BeforeEach
    void setUp() {
        source = new InMemoryTemplateSource();
        engine = QWebEngine.builder(source).build();
    }

    private String render(String xml, Map<String, Object> values) {
        source.add("test", xml);
        return engine.render("test", values);
    }

    private String render(String xml) {
        return render(xml, Map.of());
    }

    @Nested
    @DisplayName("t-if / t-elif / t-else")
    class Conditionals {

        private static final String TEMPLATE = "<t><p t-if=\"n > 5\">big</p><p t-elif=\"n > 2\">mid</p>"
                + "<p t-else=\"\">small</p></t>";

        @Test
        void testBranches() {
            assertThat(render(TEMPLATE, Map.of("n", 9))).isEqualTo("<p>big</p>");
            assertThat(render(TEMPLATE, Map.of("n", 3))).isEqualTo("<p>mid</p>");
            assertThat(render(TEMPLATE, Map.of("n", 1))).isEqualTo("<p>small</p>");
        }

        @Test
        @DisplayName("t-if 与 t-else 之间允许空白与注释")
        void testWhitespaceBetweenBranches() {
            String xml = "<t><t t-if=\"flag\">yes</t>\n    <!-- note -->\n    <t t-else=\"\">no</t></t>";
            assertThat(render(xml, Map.of("flag", true)).trim()).isEqualTo("yes");
            assertThat(render(xml, Map.of("flag", false)).trim()).isEqualTo("no");
        }

        @Test
        @DisplayName("t-if 在 <t> 上只输出内容")
        void testIfOnT() {
            assertThat(render("<t><t t-if=\"items\">has <t t-out=\"len(items)\"/></t></t>",
                    Map.of("items", List.of(1, 2)))).isEqualTo("has 2");
        }
    }

    @Nested
    @DisplayName("t-foreach")
    class Foreach {

        @Test
        void testLoopMetadata() {
            String xml = "<t><t t-foreach=\"['a', 'b', 'c']\" t-as=\"c\"><t t-out=\"c_index\"/><t t-out=\"c\"/>"
                    + "<t t-if=\"not c_last\">,</t></t></t>";
            assertThat(render(xml)).isEqualTo("0a,1b,2c");
        }

        @Test
        void testParityAndFirst() {
            String xml = "<t><t t-foreach=\"range(3)\" t-as=\"i\"><t t-out=\"i_parity\"/>"
                    + "<t t-if=\"i_first\">!</t> </t></t>";
            assertThat(render(xml)).isEqualTo("even! odd even ");
        }

        @Test
        @DisplayName("整数按 range 迭代")
        void testIntegerSource() {
            assertThat(render("<t><t t-foreach=\"3\" t-as=\"i\"><t t-out=\"i\"/></t></t>")).isEqualTo("012");
        }

        @Test
        @DisplayName("超过 int 范围的整数循环保留完整长度")
        void testLongIntegerSource() {
            source.add("test", "<t><t t-foreach=\"3000000000\" t-as=\"i\">"
                    + "<t t-out=\"str(i) + '/' + str(i_size) + '/' + str(i_last)\"/></t></t>");
            Iterator<String> chunks = engine.stream("test", Map.of(), RenderOptions.DEFAULT);
            String first = "";
            while (first.isEmpty() && chunks.hasNext()) {
                first = chunks.next();
            }
            assertThat(first).isEqualTo("0/3000000000/False");
        }

        @Test
        @DisplayName("字典迭代键，_value 为值")
        void testMappingSource() {
            String xml = "<t><t t-foreach=\"{'a': 1, 'b': 2}\" t-as=\"k\"><t t-out=\"k\"/>=<t t-out=\"k_value\"/>;</t></t>";
            assertThat(render(xml)).isEqualTo("a=1;b=2;");
        }

        @Test
        @DisplayName("空集合或 None 不输出")
        void testEmptySource() {
            assertThat(render("<t><li t-foreach=\"missing\" t-as=\"x\">x</li></t>")).isEmpty();
            assertThat(render("<t><li t-foreach=\"[]\" t-as=\"x\">x</li></t>")).isEmpty();
        }

        @Test
        @DisplayName("循环内的 t-set 不影响循环外")
        void testLoopScopeIsolation() {
            String xml = "<t><t t-set=\"total\" t-value=\"0\"/><t t-foreach=\"[1, 2, 3]\" t-as=\"n\">"
                    + "<t t-set=\"total\" t-value=\"total + n\"/></t><t t-out=\"total\"/>"
                    + "<t t-out=\"n or 'gone'\"/></t>";
            assertThat(render(xml)).isEqualTo("0gone");
        }

        @Test
        @DisplayName("指令执行顺序与属性书写顺序无关")
        void testDirectiveOrderIndependentOfAttributeOrder() {
            Map<String, Object> values = Map.of("y", List.of(1, 2, 3, 4));
            String ifFirst = render("<t><div t-if=\"i % 2\" t-foreach=\"y\" t-as=\"i\" t-out=\"i\"/></t>", values);
            String foreachFirst = render("<t><div t-foreach=\"y\" t-as=\"i\" t-out=\"i\" t-if=\"i % 2\"/></t>", values);

            assertThat(ifFirst).isEqualTo("<div>1</div><div>3</div>");
            assertThat(foreachFirst).isEqualTo(ifFirst);
        }

        @Test
        void testEscInsideForeach() {
            assertThat(render("<t t-foreach=\"[1,2,3]\" t-as=\"i\"><span t-esc=\"i\"/></t>"))
                    .isEqualTo("<span>1</span><span>2</span><span>3</span>");
        }

        @Test
        void testForeachOnElement() {
            assertThat(render("<ul><li t-foreach=\"items\" t-as=\"item\" t-out=\"item\"/></ul>",
                    Map.of("items", List.of("x", "y")))).isEqualTo("<ul><li>x</li><li>y</li></ul>");
        }
    }

    @Nested
    @DisplayName("t-set")
    class Set {

        @Test
        void testValue() {
            assertThat(render("<t><t t-set=\"a\" t-value=\"2\"/><t t-out=\"a * 3\"/></t>")).isEqualTo("6");
        }

        @Test
        void testValuef() {
            assertThat(render("<t><t t-set=\"greeting\" t-valuef=\"Hello {{name}}\"/><t t-out=\"greeting\"/></t>",
                    Map.of("name", "Bob"))).isEqualTo("Hello Bob");
        }

        @Test
        @DisplayName("字典形式批量赋值")
        void testDictionary() {
            assertThat(render("<t><t t-set=\"{'x': 1, 'y': 'two'}\"/><t t-out=\"x\"/><t t-out=\"y\"/></t>"))
                    .isEqualTo("1two");
        }

        @Test
        @DisplayName("元素内容作为值，输出时不再转义")
        void testBodyValue() {
            assertThat(render("<t><t t-set=\"block\"><b t-out=\"name\"/></t><i t-out=\"block\"/></t>",
                    Map.of("name", "<Bob>"))).isEqualTo("<i><b>&lt;Bob&gt;</b></i>");
        }

        @Test
        @DisplayName("内容值使用赋值时的绑定")
        void testBodyValueSnapshot() {
            String xml = "<t><t t-set=\"name\" t-value=\"'A'\"/><t t-set=\"b\"><t t-out=\"name\"/></t>"
                    + "<t t-set=\"name\" t-value=\"'B'\"/><t t-out=\"b\"/><t t-out=\"name\"/></t>";
            assertThat(render(xml)).isEqualTo("AB");
        }

        @Test
        @DisplayName("空内容为空串")
        void testEmptyBody() {
            assertThat(render("<t><t t-set=\"e\"/><t t-out=\"e == ''\"/></t>")).isEqualTo("True");
        }
    }

    @Nested
    @DisplayName("t-out / t-esc / t-raw")
    class Output {

        @Test
        void testEscaping() {
            assertThat(render("<p t-out=\"v\"/>", Map.of("v", "<b>\"x\" & 'y'</b>")))
                    .isEqualTo("<p>&lt;b&gt;&#34;x&#34; &amp; &#39;y&#39;&lt;/b&gt;</p>");
        }

        @Test
        @DisplayName("安全标记不转义")
        void testMarkup() {
            assertThat(render("<p t-out=\"v\"/>", Map.of("v", Markup.of("<b>x</b>")))).isEqualTo("<p><b>x</b></p>");
        }

        @Test
        @DisplayName("值为空时输出默认内容")
        void testDefaultContent() {
            assertThat(render("<p t-out=\"missing\">fallback</p>")).isEqualTo("<p>fallback</p>");
            assertThat(render("<p t-out=\"False\"/>")).isEmpty();
            assertThat(render("<p t-out=\"0\"/>")).isEqualTo("<p></p>");
        }

        @Test
        void testScalars() {
            assertThat(render("<t><t t-out=\"True\"/>|<t t-out=\"1.5\"/>|<t t-out=\"[1, 'a']\"/></t>"))
                    .isEqualTo("True|1.5|[1, &#39;a&#39;]");
        }

        @Test
        void testDeprecatedDirectives() {
            Map<String, Object> values = Map.of("v", "<i>x</i>");
            assertThat(render("<t><t t-esc=\"v\"/><t t-raw=\"v\"/></t>", values))
                    .isEqualTo("&lt;i&gt;x&lt;/i&gt;<i>x</i>");
        }

        @Test
        @DisplayName("t-options 部件")
        void testWidgetOptions() {
            assertThat(render("<span t-out=\"price\" t-options-widget=\"'float'\" t-options-precision=\"3\"/>",
                    Map.of("price", 1.5)))
                    .isEqualTo("<span data-oe-type=\"float\" data-oe-expression=\"price\">1.500</span>");
            assertThat(render("<div t-out=\"text\" t-options=\"{'widget': 'text'}\"/>", Map.of("text", "a\nb")))
                    .isEqualTo("<div data-oe-type=\"text\" data-oe-expression=\"text\">a<br/>\nb</div>");
        }

        @Test
        void testField() {
            Map<String, Object> record = new HashMap<>();
            record.put("name", "Widget <1>");
            record.put("note", null);
            Map<String, Object> values = Map.of("record", record);
            assertThat(render("<span t-field=\"record.name\"/>", values)).isEqualTo("<span>Widget &lt;1&gt;</span>");
            assertThat(render("<span t-field=\"record.note\">n/a</span>", values)).isEqualTo("<span>n/a</span>");
            assertThat(render("<span t-field=\"record.note\"/>", values)).isEmpty();
        }
    }

    @Nested
    @DisplayName("属性")
    class Attributes {

        @Test
        void testAttAndAttf() {
            String xml = "<div title=\"static\" t-att-class=\"cls\" t-att-hidden=\"False\" t-attf-id=\"item-{{n}}\"/>";
            assertThat(render(xml, Map.of("cls", "big", "n", 3)))
                    .isEqualTo("<div title=\"static\" class=\"big\" id=\"item-3\"></div>");
        }

        @Test
        @DisplayName("空字符串保留，None 与 False 省略")
        void testFalsyValues() {
            assertThat(render("<span t-att-a=\"''\" t-att-b=\"None\" t-att-c=\"0\" t-att-d=\"1\"/>"))
                    .isEqualTo("<span a=\"\" d=\"1\"></span>");
        }

        @Test
        void testAttDictionaryAndPairs() {
            assertThat(render("<span t-att=\"{'data-a': 1, 'title': 'x'}\"/>"))
                    .isEqualTo("<span data-a=\"1\" title=\"x\"></span>");
            assertThat(render("<span t-att=\"['data-x', 'y']\"/>")).isEqualTo("<span data-x=\"y\"></span>");
            assertThat(render("<span t-att=\"[('a', 1), ('b', 2)]\"/>")).isEqualTo("<span a=\"1\" b=\"2\"></span>");
        }

        @Test
        @DisplayName("属性值转义")
        void testAttributeEscaping() {
            assertThat(render("<a t-att-title=\"t\">x</a>", Map.of("t", "\"<&>\"")))
                    .isEqualTo("<a title=\"&#34;&lt;&amp;&gt;&#34;\">x</a>");
        }

        @Test
        @DisplayName("javascript: 链接被清空")
        void testMaliciousHref() {
            assertThat(render("<a t-att-href=\"url\">x</a>", Map.of("url", "javascript:alert(1)")))
                    .isEqualTo("<a href=\"\">x</a>");
            assertThat(render("<a t-att-href=\"url\">x</a>", Map.of("url", "javascript:history.back()")))
                    .isEqualTo("<a href=\"javascript:history.back()\">x</a>");
        }

        @Test
        @DisplayName("空元素自闭合")
        void testVoidElement() {
            assertThat(render("<t><br/><input t-att-value=\"v\"/></t>", Map.of("v", "x")))
                    .isEqualTo("<br/><input value=\"x\"/>");
        }
    }

    @Nested
    @DisplayName("t-call")
    class Call {

        @BeforeEach
        void templates() {
            source.add("layout", "<t t-name=\"layout\"><div class=\"wrap\"><t t-out=\"0\"/></div></t>");
            source.add("card", "<t t-name=\"card\"><h1 t-out=\"title\"/></t>");
        }

        @Test
        @DisplayName("调用内容作为 0 传入")
        void testSlot() {
            assertThat(render("<t t-call=\"layout\"><p>body</p></t>")).isEqualTo("<div class=\"wrap\"><p>body</p></div>");
        }

        @Test
        @DisplayName("调用内容可以访问调用方的变量")
        void testSlotSeesCallerValues() {
            assertThat(render("<t><t t-set=\"who\" t-value=\"'me'\"/><t t-call=\"layout\"><p t-out=\"who\"/></t></t>"))
                    .isEqualTo("<div class=\"wrap\"><p>me</p></div>");
        }

        @Test
        @DisplayName("参数只在被调模板内可见")
        void testArgumentsDoNotLeak() {
            assertThat(render("<t><t t-call=\"card\" title=\"'Hi'\"/><t t-out=\"title or 'none'\"/></t>"))
                    .isEqualTo("<h1>Hi</h1>none");
        }

        @Test
        @DisplayName("被调模板内的 t-set 不影响调用方")
        void testCalleeScopeIsolation() {
            source.add("setter", "<t t-name=\"setter\"><t t-set=\"leak\" t-value=\"1\"/></t>");
            assertThat(render("<t><t t-call=\"setter\"/><t t-out=\"leak or 'no'\"/></t>")).isEqualTo("no");
        }

        @Test
        @DisplayName("旧写法：内容中的 t-set 作为参数")
        void testLegacyForm() {
            assertThat(render("<t t-call=\"card\"><t t-set=\"title\" t-value=\"'Legacy'\"/></t>"))
                    .isEqualTo("<h1>Legacy</h1>");
        }

        @Test
        void testArgsDictionaryAndFormatArguments() {
            assertThat(render("<t t-call=\"card\" t-args=\"{'title': 'From args'}\"/>")).isEqualTo("<h1>From args</h1>");
            assertThat(render("<t t-call=\"card\" title.f=\"No. {{n}}\"/>", Map.of("n", 7))).isEqualTo("<h1>No. 7</h1>");
        }

        @Test
        @DisplayName("动态目标")
        void testDynamicTarget() {
            source.add("simple_card", "<t t-name=\"simple_card\">simple</t>");
            assertThat(render("<t t-call=\"{{kind}}_card\"/>", Map.of("kind", "simple"))).isEqualTo("simple");
        }

        @Test
        @DisplayName("按数字 id 渲染与调用")
        void testNumericReference() {
            Integer id = source.idOf("card");
            assertThat(engine.render(id, Map.of("title", "X"))).isEqualTo("<h1>X</h1>");
            assertThat(render("<t t-call=\"" + id + "\" title=\"'Y'\"/>")).isEqualTo("<h1>Y</h1>");
        }

        @Test
        @DisplayName("嵌套调用时 0 指向最近一层的内容")
        void testNestedSlots() {
            source.add("outer", "<t t-name=\"outer\"><section><t t-out=\"0\"/></section></t>");
            String xml = "<t t-call=\"outer\"><t t-call=\"layout\"><b>deep</b></t></t>";
            assertThat(render(xml)).isEqualTo("<section><div class=\"wrap\"><b>deep</b></div></section>");
        }
    }

    @Nested
    @DisplayName("其他指令")
    class Misc {

        @Test
        @DisplayName("groups 由 AccessChecker 决定")
        void testGroups() {
            AccessChecker checker = (groups, values) -> "base.admin".equals(groups) && Boolean.TRUE.equals(values.get("admin"));
            engine = QWebEngine.builder(source).accessChecker(checker).build();
            String xml = "<t><p groups=\"base.admin\">secret</p><p t-groups=\"base.user\">user</p>public</t>";
            assertThat(render(xml, Map.of("admin", true))).isEqualTo("<p>secret</p>public");
            assertThat(render(xml, Map.of("admin", false))).isEqualTo("public");
        }

        @Test
        @DisplayName("t-call-assets 按扩展名生成节点")
        void testAssets() {
            AssetLinkProvider provider = (bundle, css, js, values) ->
                    List.of("/" + bundle + "/a.js", "/" + bundle + "/b.css", "/" + bundle + "/c.txt");
            engine = QWebEngine.builder(source).assetLinkProvider(provider).build();
            assertThat(render("<t t-call-assets=\"web\" defer_load=\"True\"/>"))
                    .isEqualTo("<script type=\"text/javascript\" defer=\"defer\" src=\"/web/a.js\"></script>\n"
                            + "        <link type=\"text/css\" rel=\"stylesheet\" href=\"/web/b.css\"/>");
        }

        @Test
        @DisplayName("默认绑定：json、floor、ceil")
        void testDefaultValues() {
            assertThat(render("<t><t t-out=\"floor(2.7)\"/>,<t t-out=\"ceil(2.1)\"/></t>")).isEqualTo("2,3");
            assertThat(render("<script t-out=\"json.dumps({'a': '<x>'})\"/>"))
                    .isEqualTo("<script>{&#34;a&#34;:&#34;\\u003cx\\u003e&#34;}</script>");
        }

        @Test
        @DisplayName("minimalContext 不注入默认绑定")
        void testMinimalContext() {
            source.add("test", "<t t-out=\"json is None\"/>");
            assertThat(engine.render("test", Map.of(), RenderOptions.builder().minimalContext(true).build()))
                    .isEqualTo("True");
        }

        @Test
        @DisplayName("入口块补充 xmlid 与 viewid")
        void testEntryValues() {
            assertThat(render("<t><t t-out=\"xmlid\"/>|<t t-out=\"viewid\"/></t>")).isEqualTo("test|test");
            assertThat(render("<t t-out=\"xmlid\"/>", Map.of("xmlid", "given"))).isEqualTo("given");
        }

        @Test
        @DisplayName("调用方传入的 0 被忽略")
        void testReservedSlotValue() {
            assertThat(render("<t t-out=\"0\"/>", Map.of("0", "injected"))).isEmpty();
        }

        @Test
        @DisplayName("preserveComments 保留注释")
        void testComments() {
            assertThat(render("<div><!-- c --><b>x</b></div>")).isEqualTo("<div><b>x</b></div>");
            engine = QWebEngine.builder(source)
                    .settings(QWebSettings.builder().preserveComments(true).build())
                    .build();
            assertThat(render("<div><!-- c --><b>x</b></div>")).isEqualTo("<div><!-- c --><b>x</b></div>");
        }

        @Test
        @DisplayName("t-debug 不产生输出")
        void testDebug() {
            assertThat(render("<t><t t-debug=\"\"/>x</t>")).isEqualTo("x");
            engine = QWebEngine.builder(source).settings(QWebSettings.builder().devMode("qweb").build()).build();
            assertThat(render("<t><t t-debug=\"\"/>x<t t-out=\"debug\"/></t>")).isEqualTo("xqweb");
        }

        @Test
        @DisplayName("stream 逐段输出")
        void testStream() {
            source.add("test", "<t><t t-foreach=\"range(3)\" t-as=\"i\"><b t-out=\"i\"/></t></t>");
            Iterator<String> chunks = engine.stream("test", Map.of(), RenderOptions.DEFAULT);
            StringBuilder out = new StringBuilder();
            int count = 0;
            while (chunks.hasNext()) {
                out.append(chunks.next());
                count++;
            }
            assertThat(out.toString()).isEqualTo("<b>0</b><b>1</b><b>2</b>");
            assertThat(count).isGreaterThan(1);
        }
    }
}
