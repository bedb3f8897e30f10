package com.ciro.jlive.template;

import com.ciro.jlive.rendered.Rendered;

import java.util.Map;

/**
 * Entrada de slot tal como la ve el componente: sus atributos ya evaluados y el
 * contexto del llamador para renderizar el contenido. Identidad por referencia.
 */
public final class SlotValue {

    private final SlotTemplate template;
    private final Map<String, Object> attrs;
    private final EvalContext caller;

    SlotValue(SlotTemplate template, Map<String, Object> attrs, EvalContext caller) {
        this.template = template;
        this.attrs = attrs;
        this.caller = caller;
    }

    public String name() {
        return template.name();
    }

    public Map<String, Object> attrs() {
        return attrs;
    }

    Rendered render(Object argument, Rendered previous, String path) {
        EvalContext ctx = caller.withPath(path);
        if (template.let() != null) {
            ctx = ctx.child(template.let(), argument);
        }
        return template.body().render(ctx, previous, null, template.name());
    }

    @Override
    public String toString() {
        return "SlotValue{" + template.name() + ", " + attrs + "}";
    }
}
