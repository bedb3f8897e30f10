package com.ciro.jlive.template;

import com.ciro.jlive.ast.Span;
import com.ciro.jlive.expr.Deps;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Entrada de slot compilada ({@code <:col label="x" :let={row}>...</:col>} o el
 * contenido implícito inner_block).
 */
public record SlotTemplate(String name, Map<String, CompiledExpr> attrs, String let,
                           CompiledTemplate body, Deps deps, Span span) {

    public SlotTemplate {
        attrs = Collections.unmodifiableMap(new LinkedHashMap<>(attrs));
    }

    public static SlotTemplate of(String name, Map<String, CompiledExpr> attrs, String let,
                                  CompiledTemplate body, Span span) {
        Deps d = let == null ? body.deps() : body.deps().bind(let);
        for (CompiledExpr e : attrs.values()) d = d.union(e.deps());
        return new SlotTemplate(name, attrs, let, body, d, span);
    }
}
