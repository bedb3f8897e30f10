package com.ciro.jlive.ast;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

class LvLexerTest {

    @Test
    void splitsOutputAndStatementMarkers() {
        var toks = LvLexer.lex("<p><%= @name %></p><% end %>", "t");
        assertEquals(4, toks.size());
        var out = assertInstanceOf(Token.Expression.class, toks.get(1));
        assertEquals("=", out.marker());
        assertEquals("@name", out.code());
        var stmt = assertInstanceOf(Token.Expression.class, toks.get(3));
        assertEquals("", stmt.marker());
        assertEquals("end", stmt.code());
    }

    @Test
    void commentsAreDropped() {
        var toks = LvLexer.lex("a<%# ignored %>b", "t");
        assertEquals(2, toks.size());
        assertEquals("a", ((Token.Text) toks.get(0)).content());
        assertEquals("b", ((Token.Text) toks.get(1)).content());
    }

    @Test
    void doublePercentIsLiteral() {
        var toks = LvLexer.lex("<p>100<%% done</p>", "t");
        assertEquals("100<% done", ((Token.Text) toks.get(1)).content());
    }

    @Test
    void closingMarkerInsideStringDoesNotEndExpression() {
        var toks = LvLexer.lex("<p><%= \"a%>b\" <> 'c%>' %></p>", "t");
        assertEquals(3, toks.size());
        var out = assertInstanceOf(Token.Expression.class, toks.get(1));
        assertEquals("\"a%>b\" <> 'c%>'", out.code());
        assertInstanceOf(Token.TagClose.class, toks.get(2));
    }

    @Test
    void escapedQuoteKeepsStringOpen() {
        var toks = LvLexer.lex("<%= \"say \\\"%>\\\"\" %>", "t");
        assertEquals(1, toks.size());
        assertEquals("\"say \\\"%>\\\"\"", ((Token.Expression) toks.get(0)).code());
    }

    @Test
    void commentsCloseAtFirstMarkerEvenWithQuotes() {
        var toks = LvLexer.lex("a<%# don't %>b", "t");
        assertEquals(2, toks.size());
        assertEquals("b", ((Token.Text) toks.get(1)).content());
    }

    @Test
    void missingClosingMarker() {
        var e = assertThrows(TemplateCompileException.class, () -> LvLexer.lex("<p>\n<%= @x </p>", "t"));
        assertEquals(ErrorKind.UNTERMINATED_EXPRESSION, e.kind());
        assertEquals("missing token '%>'", e.description());
        assertEquals(2, e.span().line());
        assertEquals("t:2:1: missing token '%>'", e.getMessage());
    }

    @Test
    void expressionCannotSplitATag() {
        var e = assertThrows(TemplateCompileException.class,
                () -> LvLexer.lex("<div class=\"<%= @c %>\">", "t"));
        assertEquals(ErrorKind.UNTERMINATED_TAG, e.kind());
    }

    @Test
    void positionsContinueAfterExpressions() {
        var toks = LvLexer.lex("<%= @a %>\n<b>x</b>", "t");
        var b = toks.stream().filter(t -> t instanceof Token.TagOpen).findFirst().orElseThrow();
        assertEquals(2, b.span().line());
        assertEquals(1, b.span().column());
    }
}
