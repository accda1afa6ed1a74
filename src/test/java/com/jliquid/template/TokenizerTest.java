package com.jliquid.template;

import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.regex.Pattern;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

public class TokenizerTest {

    private void assertTokens(String source, String... expected) {
        assertEquals(Lists.mutable.of(expected), new Tokenizer(source).tokenize());
    }

    @Test
    public void testBlankString() {
        assertTokens("", "");
    }

    @Test
    public void testWhitespaceOnlyString() {
        assertTokens("  ", "  ");
    }

    @Test
    public void testStringWithNoMatches() {
        assertTokens("hello world", "hello world");
    }

    @Test
    public void testSingleVariable() {
        assertTokens("{{funk}}", "{{funk}}");
    }

    @Test
    public void testSingleVariableSurroundedByWhitespace() {
        assertTokens(" {{funk}} ", " ", "{{funk}}", " ");
    }

    @Test
    public void testMultipleVariables() {
        assertTokens(" {{funk}} {{so}} {{brutha}} ",
            " ", "{{funk}}", " ", "{{so}}", " ", "{{brutha}}", " ");
    }

    @Test
    public void testAdjacentTags() {
        assertTokens("{{a}}{% b %}{{c}}", "{{a}}", "{% b %}", "{{c}}");
    }

    @Test
    public void testSingleBlock() {
        assertTokens(" {%comment%} ", " ", "{%comment%}", " ");
    }

    @Test
    public void testBlockTags() {
        assertTokens(" {% thing %} {% comment %} My comment here {% endcomment %} ",
            " ", "{% thing %}", " ", "{% comment %}", " My comment here ", "{% endcomment %}", " ");
    }

    @Test
    public void testMultilineString() {
        assertTokens("{%comment%}\nMy Comment\n{%endcomment%}\n",
            "{%comment%}", "\nMy Comment\n", "{%endcomment%}", "\n");
    }

    @Test
    public void testHtmlWithLiquid() {
        String content = "\n<html>\n  <head>\n    <title>{{ title }}</title>\n  </head>\n"
            + "  <body class=\"some-class\">\n    <p>{% comment %}Content here{% endcomment %}</p>\n"
            + "    <script type=\"text/javascript\">\n      var {{ name }} = function() {\n"
            + "        alert(\"{{ js_value }}\");\n      };\n    </script>\n  </body>\n</html>\n        ";

        assertTokens(content,
            "\n<html>\n  <head>\n    <title>",
            "{{ title }}",
            "</title>\n  </head>\n  <body class=\"some-class\">\n    <p>",
            "{% comment %}",
            "Content here",
            "{% endcomment %}",
            "</p>\n    <script type=\"text/javascript\">\n      var ",
            "{{ name }}",
            " = function() {\n        alert(\"",
            "{{ js_value }}",
            "\");\n      };\n    </script>\n  </body>\n</html>\n        ");
    }

    @Test
    public void testUnterminatedOpeners() {
        assertTokens("hello {{ world", "hello ", "{{", " world");
        assertTokens("a {% b", "a ", "{%", " b");
    }

    @Test
    public void testTagsDoNotSpanLines() {
        assertTokens("{{ a\n}}", "{{", " a\n}}");
    }

    @Test
    public void testSingleClosingBraceEndsOutputTag() {
        assertTokens("{{ a } b }}", "{{ a }", " b }}");
        assertTokens("x {{ a }", "x ", "{{ a }");
    }

    @Test
    public void testSlicesAreFlaggedAndContiguous() {
        MutableList<Slice> slices = new Tokenizer("a{{b}}c").slices();

        assertEquals(Lists.mutable.of(Slice.literal(0, 1), Slice.tag(1, 6), Slice.literal(6, 7)), slices);
    }

    @Test
    public void testCustomPattern() {
        Pattern pattern = Pattern.compile("<%.*?%>");
        assertEquals(Lists.mutable.of("a ", "<% b %>", " {{c}}"), new Tokenizer("a <% b %> {{c}}").tokenize(pattern));
    }

    @Test
    public void testTemplatePatternText() {
        assertEquals("(\\{%.*?%\\}|\\{\\{.*?\\}\\}?|\\{\\{|\\{%)", TagPattern.TEMPLATE.toString());
    }

    static Stream<String> sources() {
        return Stream.of(
            "",
            "plain text",
            "{{a}}",
            "{%",
            "}}{{",
            "{{ a }} {% if b %}x{% endif %}",
            "{{{{}}}}",
            "{%%}{%}%}",
            "ünïcödé {{ ☃ }} 😀 {% tag %}",
            "line one\n{{ broken\n}} line two {{ ok }}");
    }

    @ParameterizedTest
    @MethodSource("sources")
    public void testRoundTripIsLossless(String source) {
        MutableList<String> tokens = new Tokenizer(source).tokenize();
        assertEquals(source, String.join("", tokens));
    }

    @ParameterizedTest
    @MethodSource("sources")
    public void testSlicesCoverSourceInOrder(String source) {
        MutableList<Slice> slices = new Tokenizer(source).slices();

        assertFalse(slices.isEmpty());
        assertEquals(0, slices.getFirst().start());
        assertEquals(source.length(), slices.getLast().end());
        for (int i = 1; i < slices.size(); i++) {
            assertEquals(slices.get(i - 1).end(), slices.get(i).start());
        }
    }

    @Test
    public void testOnlyLineFeedEndsTagEarly() {
        assertTokens("{{ a\r }}", "{{ a\r }}");
        assertTokens("{{ a\u2028 }}", "{{ a\u2028 }}");
        assertTokens("{% a\u0085 %}", "{% a\u0085 %}");
    }
}
