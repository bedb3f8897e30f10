package com.ciro.jlive.ast;

import java.util.List;

/**
 * Registro de una invocación de componente encontrada al parsear.
 * Se valida contra la declaración del componente al compilar la unidad.
 */
public record ComponentCall(ComponentTarget target,
                            List<AttrShape> attrs,
                            boolean hasSpread,
                            List<SlotCall> slots,
                            Span span) {
    public ComponentCall {
        attrs = List.copyOf(attrs);
        slots = List.copyOf(slots);
    }
}
