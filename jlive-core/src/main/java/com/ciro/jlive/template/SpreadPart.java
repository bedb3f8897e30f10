package com.ciro.jlive.template;

import com.ciro.jlive.expr.Atom;
import com.ciro.jlive.expr.Deps;
import com.ciro.jlive.rendered.Dynamic;

import java.util.Map;

/** {@code <div {@attrs}>}: un mapa de atributos resuelto en runtime. */
public record SpreadPart(CompiledExpr expr) implements Part {

    @Override
    public Deps deps() {
        return expr.deps();
    }

    @Override
    public Dynamic render(EvalContext ctx, Dynamic previous, int index) {
        Object v = ctx.eval(expr);
        if (v == null) return new Dynamic.Value("");
        if (!(v instanceof Map<?, ?> attrs)) {
            throw new TemplateEvaluationException("expected a map of attributes, got: " + v,
                    expr.source(), expr.file(), expr.span(), null);
        }
        StringBuilder sb = new StringBuilder();
        attrs.forEach((k, val) -> sb.append(AttrPart.fragment(attrName(k), val)));
        return new Dynamic.Value(sb.toString());
    }

    static String attrName(Object key) {
        return key instanceof Atom a ? a.name() : String.valueOf(key);
    }
}
