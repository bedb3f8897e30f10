package com.ciro.jlive.template;

import com.ciro.jlive.expr.Deps;
import com.ciro.jlive.rendered.Dynamic;
import com.ciro.jlive.rendered.Rendered;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * {@code <%= render_slot(@slot, arg) %>}. Cada entrada del slot se evalúa en el
 * contexto de quien llamó al componente; el resultado es una Sequence.
 */
public record SlotRenderPart(CompiledExpr slot, CompiledExpr argument, Deps deps) implements Part {

    public static SlotRenderPart of(CompiledExpr slot, CompiledExpr argument) {
        Deps d = argument == null ? slot.deps() : slot.deps().union(argument.deps());
        return new SlotRenderPart(slot, argument, d);
    }

    @Override
    public Dynamic render(EvalContext ctx, Dynamic previous, int index) {
        List<SlotValue> entries = entries(ctx.eval(slot));
        Object arg = argument == null ? null : ctx.eval(argument);

        List<Rendered> prevItems = previous instanceof Dynamic.Sequence s ? s.items() : List.of();
        String base = ctx.path() + "/" + index;
        List<Rendered> items = new ArrayList<>(entries.size());
        boolean reused = previous != null && prevItems.size() == entries.size();
        for (int i = 0; i < entries.size(); i++) {
            Rendered prev = i < prevItems.size() ? prevItems.get(i) : null;
            Rendered r = entries.get(i).render(arg, prev, base + ":" + i);
            if (r != prev) reused = false;
            items.add(r);
        }
        return reused ? previous : new Dynamic.Sequence(items);
    }

    private List<SlotValue> entries(Object value) {
        if (value == null) return List.of();
        if (value instanceof SlotValue single) return List.of(single);
        if (value instanceof Collection<?> many) {
            List<SlotValue> out = new ArrayList<>(many.size());
            for (Object o : many) {
                if (!(o instanceof SlotValue sv)) throw notASlot(o);
                out.add(sv);
            }
            return out;
        }
        throw notASlot(value);
    }

    private TemplateEvaluationException notASlot(Object value) {
        return new TemplateEvaluationException("render_slot expects a slot entry or a list of slot entries, got: " + value,
                slot.source(), slot.file(), slot.span(), null);
    }
}
