package com.ciro.jlive.ast;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HtmlTokenizerTest {

    private static List<Token> tokens(String src) {
        HtmlTokenizer.Result r = HtmlTokenizer.tokenize(src, HtmlTokenizer.State.initial(), "test.lv");
        HtmlTokenizer.finish(r.end(), "test.lv");
        return r.tokens();
    }

    @Test
    void readsTagsAttributesAndText() {
        var toks = tokens("<div class=\"box\" id='main' hidden title={@title} {@rest}>hi</div>");
        assertEquals(3, toks.size());

        var open = assertInstanceOf(Token.TagOpen.class, toks.get(0));
        assertEquals("div", open.name());
        assertEquals(TagKind.ELEMENT, open.kind());
        assertFalse(open.selfClose());
        assertEquals(5, open.attrs().size());

        assertEquals(new AttrValue.Literal("box", '"'), open.attrs().get(0).value());
        assertEquals(new AttrValue.Literal("main", '\''), open.attrs().get(1).value());
        assertEquals(AttrValue.PRESENCE, open.attrs().get(2).value());
        assertEquals("@title", open.attrs().get(3).code());
        assertTrue(open.attrs().get(4).isSpread());
        assertEquals("@rest", open.attrs().get(4).code());

        assertEquals("hi", assertInstanceOf(Token.Text.class, toks.get(1)).content());
        assertEquals("div", assertInstanceOf(Token.TagClose.class, toks.get(2)).name());
    }

    @Test
    void classifiesComponentsAndSlots() {
        var toks = tokens("<Ui.card><:footer/></Ui.card><.local/>");
        assertEquals(TagKind.REMOTE_COMPONENT, ((Token.TagOpen) toks.get(0)).kind());
        var slot = (Token.TagOpen) toks.get(1);
        assertEquals(TagKind.SLOT, slot.kind());
        assertTrue(slot.selfClose());
        assertEquals(TagKind.LOCAL_COMPONENT, ((Token.TagOpen) toks.get(3)).kind());
    }

    @Test
    void bracedValuesKeepNestedBracesAndStrings() {
        var open = (Token.TagOpen) tokens("<a href={\"/x}\" <> @id} data={%{a: 1}}>").get(0);
        assertEquals("\"/x}\" <> @id", open.attrs().get(0).code());
        assertEquals("%{a: 1}", open.attrs().get(1).code());
    }

    @Test
    void commentsAndDoctypeStayText() {
        var toks = tokens("<!DOCTYPE html><!-- <b>not a tag</b> --><p></p>");
        assertEquals("<!DOCTYPE html><!-- <b>not a tag</b> -->",
                assertInstanceOf(Token.Text.class, toks.get(0)).content());
        assertEquals("p", ((Token.TagOpen) toks.get(1)).name());
    }

    @Test
    void scriptContentIsNotTokenized() {
        var toks = tokens("<script>if (a < b) { x(\"<div>\") }</script>");
        assertEquals(3, toks.size());
        assertEquals("if (a < b) { x(\"<div>\") }", ((Token.Text) toks.get(1)).content());
        assertEquals("script", ((Token.TagClose) toks.get(2)).name());
    }

    @Test
    void scriptCloseIsFoundAfterCharsThatGrowWhenLowercased() {
        var toks = tokens("<script>var s = \"İİİİ\";</script><p>ok</p>");
        assertEquals(6, toks.size());
        assertEquals("var s = \"İİİİ\";", ((Token.Text) toks.get(1)).content());
        assertEquals("script", ((Token.TagClose) toks.get(2)).name());
        assertEquals("p", ((Token.TagOpen) toks.get(3)).name());
        assertEquals("ok", ((Token.Text) toks.get(4)).content());
    }

    @Test
    void rawTextCloseIgnoresCase() {
        var toks = tokens("<style>p { color: red }</STYLE>");
        assertEquals(3, toks.size());
        assertEquals("p { color: red }", ((Token.Text) toks.get(1)).content());
    }

    @Test
    void unterminatedTag() {
        var e = assertThrows(TemplateCompileException.class, () -> tokens("<div class=\"a\""));
        assertEquals(ErrorKind.UNTERMINATED_TAG, e.kind());
        assertEquals("expected closing `>` for tag <div>", e.description());
    }

    @Test
    void unterminatedComment() {
        var e = assertThrows(TemplateCompileException.class, () -> tokens("<p></p><!-- open"));
        assertEquals(ErrorKind.UNTERMINATED_COMMENT, e.kind());
        assertEquals(1, e.span().line());
        assertEquals(8, e.span().column());
    }

    @Test
    void invalidAttributeValue() {
        var e = assertThrows(TemplateCompileException.class, () -> tokens("<div class=box>"));
        assertEquals(ErrorKind.INVALID_ATTRIBUTE_VALUE, e.kind());
    }

    @Test
    void invalidCharacterInName() {
        var e = assertThrows(TemplateCompileException.class, () -> tokens("<div a\"b=\"1\">"));
        assertEquals(ErrorKind.INVALID_CHARACTER_IN_NAME, e.kind());
    }

    @Test
    void tracksLinesAndColumns() {
        var toks = tokens("<ul>\n  <li>x</li>\n</ul>");
        var li = (Token.TagOpen) toks.get(2);
        assertEquals(2, li.span().line());
        assertEquals(3, li.span().column());
    }

    @Test
    void voidTags() {
        assertTrue(HtmlTokenizer.isVoid("br"));
        assertTrue(HtmlTokenizer.isVoid("INPUT"));
        assertFalse(HtmlTokenizer.isVoid("div"));
    }
}
