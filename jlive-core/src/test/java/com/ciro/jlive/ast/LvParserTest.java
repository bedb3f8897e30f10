package com.ciro.jlive.ast;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LvParserTest {

    private static Document parse(String src) {
        return LvParser.parse(src, "page.lv");
    }

    private static TemplateCompileException fails(String src) {
        return assertThrows(TemplateCompileException.class, () -> parse(src));
    }

    @Test
    void buildsElementTree() {
        var doc = parse("<div><p>hi</p><br></div>");
        assertTrue(doc.root());
        var div = assertInstanceOf(LvNode.Element.class, doc.nodes().get(0));
        assertEquals(2, div.children().size());
        var br = assertInstanceOf(LvNode.Element.class, div.children().get(1));
        assertTrue(br.isVoid());
        assertTrue(br.children().isEmpty());
    }

    @Test
    void rootOnlyWithASingleTopLevelTag() {
        assertTrue(parse("\n  <main></main>\n").root());
        assertFalse(parse("<p></p><p></p>").root());
        assertFalse(parse("text <p></p>").root());
        assertFalse(parse("<%= @x %>").root());
    }

    @Test
    void mismatchedClosingTag() {
        var e = assertThrows(MismatchedClosingTagException.class, () -> parse("<div><span></div>"));
        assertEquals("span", e.expected());
        assertEquals("div", e.found());
        assertEquals(ErrorKind.MISMATCHED_CLOSING_TAG, e.kind());
        assertEquals(6, e.openSpan().column());
        assertEquals(12, e.closeSpan().column());
    }

    @Test
    void slotOutsideComponent() {
        var e = fails("<div><:footer>bye</:footer></div>");
        assertEquals(ErrorKind.SLOT_OUTSIDE_COMPONENT, e.kind());
        assertTrue(e.getMessage().contains("A slot entry must be a direct child of a component"));
    }

    @Test
    void slotInsideBlockIsNotADirectChild() {
        var e = fails("<.card><%= if @x do %><:footer/><% end %></.card>");
        assertEquals(ErrorKind.SLOT_OUTSIDE_COMPONENT, e.kind());
    }

    @Test
    void closingTagWithoutOpening() {
        assertEquals(ErrorKind.UNEXPECTED_CLOSING_TAG, fails("<p></p></div>").kind());
        assertEquals("missing opening tag for </br>", fails("<p><br></br></p>").description());
    }

    @Test
    void unclosedTag() {
        var e = fails("<section><p>x</p>");
        assertEquals(ErrorKind.UNCLOSED_TAG, e.kind());
        assertEquals("end of template reached without closing tag for <section>", e.description());
    }

    @Test
    void loopAttribute() {
        var doc = parse("<ul><li :for={item <- @items} class=\"row\"><%= item %></li></ul>");
        var ul = (LvNode.Element) doc.nodes().get(0);
        var loop = assertInstanceOf(LvNode.Loop.class, ul.children().get(0));
        assertEquals("item <- @items", loop.generator().code());
        assertEquals(1, loop.element().attrs().size());
        assertEquals("class", loop.element().attrs().get(0).name());
    }

    @Test
    void loopAttributeErrors() {
        assertEquals(ErrorKind.DUPLICATE_ATTRIBUTE, fails("<li :for={a <- @x} :for={b <- @y}></li>").kind());
        assertEquals(ErrorKind.INVALID_LOOP, fails("<li :for=\"x\"></li>").kind());
        var e = fails("<li :if={@x}></li>");
        assertEquals(ErrorKind.UNSUPPORTED_ATTRIBUTE, e.kind());
        assertEquals("unsupported attribute \":if\" in tags", e.description());
    }

    @Test
    void componentWithSlotsAndInnerBlock() {
        var doc = parse("""
                <Ui.table rows={@rows}>
                  header text
                  <:col label="Name" :let={row}><%= row.name %></:col>
                  <:col label="Age"/>
                </Ui.table>""");
        var table = assertInstanceOf(LvNode.Component.class, doc.nodes().get(0));
        assertEquals(new ComponentTarget("Ui", "table"), table.target());
        assertEquals(3, table.slots().size());
        assertEquals(LvNode.SlotEntry.INNER_BLOCK, table.slots().get(0).name());
        assertEquals("col", table.slots().get(1).name());
        assertEquals("row", table.slots().get(1).let().code());
        assertNull(table.slots().get(2).let());

        assertEquals(1, doc.calls().size());
        var call = doc.calls().get(0);
        assertEquals(1, call.attrs().size());
        assertEquals(LiteralShape.EXPRESSION, call.attrs().get(0).shape());
        assertEquals(3, call.slots().size());
        assertEquals(LiteralShape.STRING, call.slots().get(1).attrs().get(0).shape());
    }

    @Test
    void blankInnerContentHasNoInnerBlock() {
        var doc = parse("<.card>\n  <:footer>x</:footer>\n</.card>");
        var card = (LvNode.Component) doc.nodes().get(0);
        assertEquals(1, card.slots().size());
        assertEquals("footer", card.slots().get(0).name());
        assertTrue(card.target().isLocal());
    }

    @Test
    void letErrors() {
        var dup = fails("<.list :let={a} :let={b}>x</.list>");
        assertEquals(ErrorKind.DUPLICATE_LET, dup.kind());
        assertEquals("cannot define multiple :let attributes. Another :let has already been defined at line 1",
                dup.description());
        assertEquals(ErrorKind.INVALID_LET, fails("<.list :let=\"a\">x</.list>").kind());
        assertEquals(ErrorKind.LET_WITHOUT_CONTENT, fails("<.list :let={a}/>").kind());
    }

    @Test
    void reservedSlotName() {
        var e = fails("<.card><:inner_block>x</:inner_block></.card>");
        assertEquals(ErrorKind.RESERVED_SLOT_NAME, e.kind());
        assertEquals("the slot name :inner_block is reserved", e.description());
    }

    @Test
    void invalidComponentTags() {
        assertEquals(ErrorKind.INVALID_TAG, fails("<.Card/>").kind());
        assertEquals(ErrorKind.INVALID_TAG, fails("<Ui.Card/>").kind());
        assertEquals(ErrorKind.INVALID_TAG, fails("<Card/>").kind());
    }

    @Test
    void ifElseBlock() {
        var doc = parse("<p><%= if @admin do %>admin<% else %>guest<% end %></p>");
        var p = (LvNode.Element) doc.nodes().get(0);
        var cond = assertInstanceOf(LvNode.Conditional.class, p.children().get(0));
        assertEquals("@admin", cond.condition());
        assertEquals("admin", ((LvNode.TextFragment) cond.then().get(0)).content());
        assertEquals("guest", ((LvNode.TextFragment) cond.otherwise().get(0)).content());
    }

    @Test
    void forBlock() {
        var doc = parse("<%= for x <- @xs do %><i><%= x %></i><% end %>");
        var block = assertInstanceOf(LvNode.ForBlock.class, doc.nodes().get(0));
        assertEquals("x <- @xs", block.generator());
        assertEquals(1, block.body().size());
    }

    @Test
    void blockErrors() {
        assertEquals("unexpected <% else %>", fails("<p><% else %></p>").description());
        assertEquals("unexpected <% end %>", fails("<p></p><% end %>").description());
        assertEquals(ErrorKind.MISPLACED_BLOCK,
                fails("<%= for x <- @xs do %>a<% else %>b<% end %>").kind());
        assertEquals(ErrorKind.UNCLOSED_BLOCK, fails("<%= if @x do %>a").kind());
        assertEquals(ErrorKind.INVALID_EXPRESSION, fails("<%= case @x do %><% end %>").kind());
        assertEquals(ErrorKind.INVALID_EXPRESSION, fails("<% x = 1 %>").kind());
        assertEquals(ErrorKind.UNEXPECTED_CLOSING_TAG, fails("<div><%= if @x do %></div><% end %>").kind());
    }
}
