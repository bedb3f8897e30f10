package com.ciro.jlive.template;

import com.ciro.jlive.expr.Deps;
import com.ciro.jlive.rendered.Dynamic;

/** {@code <%= expr %>} */
public record ExprPart(CompiledExpr expr) implements Part {

    @Override
    public Deps deps() {
        return expr.deps();
    }

    @Override
    public Dynamic render(EvalContext ctx, Dynamic previous, int index) {
        return new Dynamic.Value(HtmlEscaper.toOutput(ctx.eval(expr)));
    }
}
