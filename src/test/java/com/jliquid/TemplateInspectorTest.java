package com.jliquid;

import com.jliquid.error.LexicalException;
import com.jliquid.error.SyntaxException;
import com.jliquid.lexer.Token;
import com.jliquid.lexer.TokenKind;
import com.jliquid.output.SliceReport;
import com.jliquid.parser.Parser;
import org.eclipse.collections.api.list.MutableList;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

public class TemplateInspectorTest {

    private final TemplateInspector lenient = new TemplateInspector(false, Parser.DEFAULT_MAX_DEPTH);

    @Test
    public void testOutputTagExpression() {
        MutableList<SliceReport> reports = lenient.inspect("Hello {{ user.names[0] | upcase }}!");

        assertEquals(3, reports.size());
        assertFalse(reports.get(0).slice().tag());
        assertEquals("Hello ", reports.get(0).text());

        SliceReport tag = reports.get(1);
        assertTrue(tag.slice().tag());
        assertEquals("user.names[0]", tag.expression());
        assertEquals(Token.of(TokenKind.PIPE, "|"), tag.tokens().get(6));
        assertFalse(tag.hasError());

        assertEquals("!", reports.get(2).text());
    }

    @Test
    public void testBlockTagIsLexedNotParsed() {
        SliceReport tag = lenient.inspect("{% for item in (1..5) %}").get(0);

        assertNull(tag.expression());
        assertEquals(Token.of(TokenKind.IDENTIFIER, "for"), tag.tokens().get(0));
        assertEquals(8, tag.tokens().size());
    }

    @Test
    public void testLexicalErrorIsReportedAndSkipped() {
        MutableList<SliceReport> reports = lenient.inspect("{{ a % b }} after {{ ok }}");

        assertTrue(reports.get(0).hasError());
        assertTrue(reports.get(0).error().contains("'%'"));
        assertEquals("ok", reports.get(2).expression());
    }

    @Test
    public void testSyntaxErrorIsReportedAndSkipped() {
        SliceReport tag = lenient.inspect("{{ | upcase }}").get(0);

        assertTrue(tag.hasError());
        assertEquals(2, tag.tokens().size());
    }

    @Test
    public void testStrictModeThrows() {
        TemplateInspector strict = new TemplateInspector(true, Parser.DEFAULT_MAX_DEPTH);

        assertThrows(LexicalException.class, () -> strict.inspect("{{ a % b }}"));
        assertThrows(SyntaxException.class, () -> strict.inspect("{{ (1 2) }}"));
    }

    @Test
    public void testEmptyTemplate() {
        MutableList<SliceReport> reports = lenient.inspect("");
        assertEquals(1, reports.size());
        assertEquals("", reports.get(0).text());
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "{{ a }}   | ' a '",
        "{{ a }    | ' a '",
        "{% if %}  | ' if '",
        "{{        | ''",
        "{%        | ''",
        "{{}}      | ''"
    })
    public void testInterior(String tag, String expected) {
        assertEquals(expected, TemplateInspector.interior(tag));
    }
}
