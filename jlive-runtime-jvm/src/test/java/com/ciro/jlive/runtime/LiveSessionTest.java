package com.ciro.jlive.runtime;

import com.ciro.jlive.component.AttrType;
import com.ciro.jlive.template.TemplateEvaluationException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LiveSessionTest {

    private final ObjectMapper mapper = ObjectMapperFactory.create();
    private LiveRuntime runtime;

    @BeforeEach
    void setUp() {
        runtime = new LiveRuntime(new LiveConfig());
    }

    private JsonNode json(String s) throws Exception {
        return mapper.readTree(s);
    }

    @Test
    void mountThenMinimalPatches() throws Exception {
        runtime.compile(runtime.compiler("Page").template("hello", "<p><%= @name %></p>"));
        var session = runtime.open("Page", "hello", Map.of("name", "Ada"));

        var mounted = json(session.mount());
        assertEquals("<p>", mounted.get("s").get(0).asText());
        assertEquals("Ada", mounted.get("0").asText());
        assertThrows(IllegalStateException.class, session::mount);

        assertTrue(session.assign("name", "Ada").isEmpty());
        assertEquals(json("{\"0\":\"Grace\"}"), json(session.assign("name", "Grace").orElseThrow()));
        assertEquals("Grace", session.bindings().get("name"));
        assertTrue(session.bindings().changed().isEmpty());

        var full = json(session.resync());
        assertEquals("Grace", full.get("0").asText());
        assertTrue(full.has("s"));

        assertTrue(session.update(b -> b.forceAssign("name", "Grace")).isPresent());
    }

    @Test
    void componentsTravelInTheComponentMap() throws Exception {
        runtime.compile(runtime.compiler("Page")
                .component("badge")
                    .attr("label", AttrType.STRING)
                    .template("<b><%= @label %></b>")
                .template("index", "<div><%= if @show do %><.badge label={@label}/><% end %></div>"));
        var session = runtime.open("Page", "index", Map.of("show", true, "label", "new"));

        var mounted = json(session.mount());
        int cid = mounted.get("0").get("0").asInt();
        var component = mounted.get("c").get(String.valueOf(cid));
        assertEquals("new", component.get("0").asText());
        assertEquals(1, component.get("r").asInt());

        var removed = json(session.assign("show", false).orElseThrow());
        assertTrue(removed.get("c").get(String.valueOf(cid)).isNull());
    }

    @Test
    void failedRenderKeepsPendingChanges() throws Exception {
        runtime.compile(runtime.compiler("Page").template("calc", "<p><%= @n + 1 %></p>"));
        var session = runtime.open("Page", "calc", Map.of("n", 1));
        session.mount();

        var e = assertThrows(TemplateEvaluationException.class, () -> session.assign("n", "x"));
        assertEquals("@n + 1", e.expression());
        assertTrue(session.bindings().changed().isChanged("n"));

        assertEquals(json("{\"0\":\"3\"}"), json(session.assign("n", 2).orElseThrow()));
    }

    @Test
    void concurrentUpdatesAreSerialized() throws Exception {
        runtime.compile(runtime.compiler("Page").template("counter", "<p><%= @n %></p>"));
        var session = runtime.open("Page", "counter", Map.of("n", 0));
        session.mount();

        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 50; i++) {
                futures.add(pool.submit(() ->
                        session.update(b -> b.assign("n", ((Number) b.get("n")).intValue() + 1))));
            }
            for (Future<?> f : futures) f.get();
        } finally {
            pool.shutdownNow();
        }
        assertEquals(50, session.bindings().get("n"));
        assertEquals("<p>50</p>", session.instance().current().toHtml());
    }

    @Test
    void openRequiresACompiledModule() {
        var e = assertThrows(IllegalArgumentException.class, () -> runtime.open("Nope", "index", Map.of()));
        assertEquals("module Nope is not compiled", e.getMessage());
    }
}
