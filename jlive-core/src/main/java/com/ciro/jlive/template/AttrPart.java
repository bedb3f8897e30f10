package com.ciro.jlive.template;

import com.ciro.jlive.expr.Deps;
import com.ciro.jlive.rendered.Dynamic;

/** {@code name={expr}} en un elemento. El hueco incluye el espacio inicial. */
public record AttrPart(String name, CompiledExpr expr) implements Part {

    @Override
    public Deps deps() {
        return expr.deps();
    }

    @Override
    public Dynamic render(EvalContext ctx, Dynamic previous, int index) {
        return new Dynamic.Value(fragment(name, ctx.eval(expr)));
    }

    /** null/false omiten el atributo, true lo deja sin valor. */
    static String fragment(String name, Object value) {
        if (value == null || Boolean.FALSE.equals(value)) return "";
        if (Boolean.TRUE.equals(value)) return " " + name;
        String text = value instanceof SafeHtml safe ? safe.html() : HtmlEscaper.escape(String.valueOf(value));
        return " " + name + "=\"" + text + "\"";
    }
}
