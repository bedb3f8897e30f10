package com.ciro.jlive.runtime;

import com.ciro.jlive.ast.TemplateCompileException;
import com.ciro.jlive.template.CompilationUnit;
import com.ciro.jlive.template.ComponentRegistry;
import com.ciro.jlive.template.TemplateCompiler;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

class TemplateCacheTest {

    private final ComponentRegistry registry = new ComponentRegistry();
    private final TemplateCache cache = new TemplateCache(new LiveConfig(), Runnable::run);

    private TemplateCompiler page(String source) {
        return new TemplateCompiler("Page", registry).template("index", source);
    }

    @Test
    void sameSourceCompilesOnce() {
        var compiles = new AtomicInteger();
        var compiler = page("<p><%= @x %></p>");
        CompilationUnit first = cache.get("Page", compiler.digest(), () -> {
            compiles.incrementAndGet();
            return compiler.compile();
        });
        CompilationUnit second = cache.get("Page", page("<p><%= @x %></p>").digest(), () -> {
            compiles.incrementAndGet();
            return compiler.compile();
        });
        assertSame(first, second);
        assertEquals(1, compiles.get());
        assertEquals(1, cache.size());
    }

    @Test
    void changedSourceIsANewEntry() {
        var a = page("<p>a</p>");
        var b = page("<p>b</p>");
        var ua = cache.get("Page", a.digest(), a::compile);
        var ub = cache.get("Page", b.digest(), b::compile);
        assertNotSame(ua, ub);
        assertEquals(2, cache.size());

        cache.invalidateModule("Page");
        assertEquals(0, cache.size());
        assertNull(cache.getIfPresent("Page", a.digest()));
    }

    @Test
    void compileErrorsAreNotCached() {
        var broken = page("<div><span></div>");
        assertThrows(TemplateCompileException.class, () -> cache.get("Page", broken.digest(), broken::compile));
        assertNull(cache.getIfPresent("Page", broken.digest()));
    }

    @Test
    void runtimeReusesCachedUnits() {
        var runtime = new LiveRuntime(new LiveConfig(), registry, cache, new PatchEncoder());
        var first = runtime.compile(runtime.compiler("Page").template("index", "<p></p>"));
        var second = runtime.compile(runtime.compiler("Page").template("index", "<p></p>"));
        assertSame(first, second);
        assertSame(first, registry.unit("Page").orElseThrow());
    }

    @Test
    void failOnWarningsComesFromConfig() {
        var config = new LiveConfig();
        config.setFailOnWarnings(true);
        var runtime = new LiveRuntime(config);
        var compiler = runtime.compiler("Page").template("index", "<div><Nope.widget/></div>");
        assertThrows(TemplateCompileException.class, () -> runtime.compile(compiler));
    }
}
