package com.ciro.jlive.template;

import com.ciro.jlive.expr.Deps;
import com.ciro.jlive.rendered.Dynamic;

import java.util.Collection;
import java.util.StringJoiner;

/** {@code class={...}}: acepta listas; las entradas falsas se descartan. */
public record ClassAttrPart(CompiledExpr expr) implements Part {

    @Override
    public Deps deps() {
        return expr.deps();
    }

    @Override
    public Dynamic render(EvalContext ctx, Dynamic previous, int index) {
        Object v = ctx.eval(expr);
        if (v instanceof Collection<?> items) {
            StringJoiner joined = new StringJoiner(" ");
            for (Object it : items) {
                if (EvalContext.isTruthy(it)) joined.add(String.valueOf(it));
            }
            String s = joined.toString();
            v = s.isEmpty() ? null : s;
        }
        return new Dynamic.Value(AttrPart.fragment("class", v));
    }
}
