package com.ciro.jlive.template;

import com.ciro.jlive.ast.ErrorKind;
import com.ciro.jlive.ast.TemplateCompileException;
import com.ciro.jlive.component.AttrSpec;
import com.ciro.jlive.component.AttrType;
import com.ciro.jlive.component.Diagnostic;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Locale;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TemplateCompilerTest {

    private final ComponentRegistry registry = new ComponentRegistry();

    private static List<String> messages(CompilationUnit unit) {
        return unit.warnings().stream().map(Diagnostic::message).toList();
    }

    private void compileUi() {
        new TemplateCompiler("Ui", registry)
                .component("button")
                    .requiredAttr("label", AttrType.STRING)
                    .attr("count", AttrType.INTEGER)
                    .requiredSlot("icon")
                    .template("<button><%= @label %></button>")
                .compile();
    }

    @Test
    void invalidDeclarationsAreWarnedAndDropped() {
        var unit = new TemplateCompiler("Bad", registry)
                .component("x")
                    .attr("a", AttrType.STRING)
                    .attr("a", AttrType.STRING)
                    .attr("inner_block", AttrType.ANY)
                    .attr(new AttrSpec("both", AttrType.STRING, true, true, "d"))
                    .attr("size", AttrType.INTEGER, "big")
                    .globalAttr("rest")
                    .globalAttr("more")
                    .slot("a")
                    .slot("inner_block", s -> s.attr("x", AttrType.ANY))
                    .template("<p></p>")
                .compile();

        assertEquals(List.of(
                "a duplicate attribute with name \"a\" already exists",
                "cannot define attribute called \"inner_block\". Maybe you wanted to use `slot` instead?",
                "only one of :required or :default must be given for attribute \"both\"",
                "expected the default value for attribute \"size\" to be :integer, got: big",
                "cannot define global attribute \"more\" because one is already defined",
                "cannot define a slot with name \"a\", as an attribute with that name already exists",
                "cannot define attributes in a slot with name \"inner_block\""), messages(unit));

        var spec = unit.component("x").spec();
        assertEquals(List.of("a", "rest"), spec.attrs().stream().map(AttrSpec::name).toList());
        assertEquals("Bad.x", unit.warnings().get(0).file());
    }

    @Test
    void callsAreCheckedAgainstTheDeclaration() {
        compileUi();
        var unit = new TemplateCompiler("Page", registry)
                .template("index", "<div><Ui.button kind=\"x\" count=\"3\"/></div>")
                .compile();

        assertEquals(List.of(
                "undefined attribute \"kind\" for component Ui.button",
                "attribute \"count\" in component Ui.button must be an :integer, got: string",
                "missing required attribute \"label\" for component Ui.button",
                "missing required slot \"icon\" for component Ui.button"), messages(unit));
        assertEquals("Page.index", unit.warnings().get(0).file());
        assertEquals(1, unit.warnings().get(0).span().line());
    }

    @Test
    void diagnosticsDoNotDependOnTheDefaultLocale() {
        compileUi();
        Locale saved = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            var unit = new TemplateCompiler("Page", registry)
                    .template("index", "<Ui.button label=\"ok\" count=\"3\"><:icon>*</:icon></Ui.button>")
                    .compile();
            assertEquals(List.of("attribute \"count\" in component Ui.button must be an :integer, got: string"),
                    messages(unit));
        } finally {
            Locale.setDefault(saved);
        }
    }

    @Test
    void unknownRemoteTargetsAreWarnings() {
        compileUi();
        var unit = new TemplateCompiler("Page", registry)
                .template("index", "<div><Nope.widget/><Ui.nope/></div>")
                .compile();
        assertEquals(List.of(
                "undefined component Nope.widget: module Nope is not compiled",
                "undefined function component nope in module Ui"), messages(unit));
        assertNotNull(unit.template("index"));
    }

    @Test
    void failOnWarningsAborts() {
        compileUi();
        var compiler = new TemplateCompiler("Page", registry)
                .failOnWarnings(true)
                .template("index", "<div><Ui.button kind=\"x\"><:icon/></Ui.button></div>");
        var e = assertThrows(TemplateCompileException.class, compiler::compile);
        assertEquals(ErrorKind.DECLARATION, e.kind());
        assertEquals("undefined attribute \"kind\" for component Ui.button (and 1 more warnings)", e.description());
        assertTrue(registry.unit("Page").isEmpty());
    }

    @Test
    void compileRegistersTheUnit() {
        var unit = new TemplateCompiler("Page", registry)
                .component("hello")
                    .template("<b>hi</b>")
                .template("index", "<.hello/>")
                .compile();
        assertEquals(unit, registry.unit("Page").orElseThrow());
        assertTrue(unit.warnings().isEmpty());
        assertTrue(unit.component("hello").template().root());
    }

    @Test
    void definitionErrors() {
        assertThrows(IllegalArgumentException.class, () -> new TemplateCompiler(" ", registry));

        var compiler = new TemplateCompiler("Page", registry).template("index", "<p></p>");
        assertThrows(IllegalArgumentException.class, () -> compiler.component("index"));
        assertThrows(IllegalArgumentException.class, () -> compiler.template("index", "<p></p>"));

        var withOrphan = new TemplateCompiler("Page", registry);
        withOrphan.component("orphan");
        assertThrows(IllegalStateException.class, withOrphan::compile);
    }

    @Test
    void parseErrorsAbortTheWholeModule() {
        var compiler = new TemplateCompiler("Page", registry)
                .template("ok", "<p></p>")
                .template("broken", "<div><span></div>");
        var e = assertThrows(TemplateCompileException.class, compiler::compile);
        assertEquals(ErrorKind.MISMATCHED_CLOSING_TAG, e.kind());
        assertEquals("Page.broken", e.file());
        assertTrue(registry.unit("Page").isEmpty());
    }

    @Test
    void digestFollowsSources() {
        var a = new TemplateCompiler("Page", registry).template("index", "<p><%= @x %></p>");
        var b = new TemplateCompiler("Page", registry).template("index", "<p><%= @x %></p>");
        var c = new TemplateCompiler("Page", registry).template("index", "<p><%= @y %></p>");
        assertEquals(a.digest(), b.digest());
        assertNotEquals(a.digest(), c.digest());
        assertNotEquals(a.digest(), b.failOnWarnings(true).digest());
        assertEquals(64, a.digest().length());
    }
}
