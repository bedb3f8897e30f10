package com.ciro.jlive.template;

import com.ciro.jlive.expr.Deps;
import com.ciro.jlive.rendered.Dynamic;
import com.ciro.jlive.rendered.Rendered;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * {@code :for={x <- @xs}} y {@code <%= for x <- @xs do %>}. Produce una
 * Comprehension: los statics del cuerpo una sola vez y un árbol por item.
 */
public record ComprehensionPart(String pattern, CompiledExpr source, CompiledExpr filter,
                                CompiledTemplate body, Deps deps) implements Part {

    public static ComprehensionPart of(String pattern, CompiledExpr source, CompiledExpr filter, CompiledTemplate body) {
        Deps d = source.deps().union(body.deps().bind(pattern));
        if (filter != null) d = d.union(filter.deps().bind(pattern));
        return new ComprehensionPart(pattern, source, filter, body, d);
    }

    @Override
    public Dynamic render(EvalContext ctx, Dynamic previous, int index) {
        List<Rendered> prevItems = previous instanceof Dynamic.Comprehension c && c.fingerprint() == body.fingerprint()
                ? c.items()
                : List.of();

        String base = ctx.path() + "/" + index;
        List<Rendered> items = new ArrayList<>();
        boolean reused = previous != null;
        for (Object element : elements(ctx.eval(source))) {
            EvalContext itemCtx = ctx.child(pattern, element);
            if (filter != null && !itemCtx.test(filter)) continue;
            int i = items.size();
            Rendered prev = i < prevItems.size() ? prevItems.get(i) : null;
            Rendered r = body.render(itemCtx.withPath(base + "[" + i + "]"), prev);
            if (r != prev) reused = false;
            items.add(r);
        }
        if (reused && items.size() == prevItems.size()) return previous;
        return new Dynamic.Comprehension(body.statics(), body.fingerprint(), items);
    }

    private List<?> elements(Object value) {
        if (value == null) return List.of();
        if (value instanceof List<?> list) return list;
        if (value instanceof Map<?, ?> map) return new ArrayList<>(map.entrySet());
        if (value instanceof Iterable<?> it) {
            List<Object> out = new ArrayList<>();
            it.forEach(out::add);
            return out;
        }
        if (value.getClass().isArray()) {
            int n = Array.getLength(value);
            List<Object> out = new ArrayList<>(n);
            for (int i = 0; i < n; i++) out.add(Array.get(value, i));
            return out;
        }
        throw new TemplateEvaluationException("for expects a list, got: " + value,
                source.source(), source.file(), source.span(), null);
    }
}
