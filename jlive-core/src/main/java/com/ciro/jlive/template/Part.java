package com.ciro.jlive.template;

import com.ciro.jlive.expr.Deps;
import com.ciro.jlive.rendered.Dynamic;

/**
 * Hueco dinámico de una plantilla compilada. Cada uno conoce sus dependencias
 * desde la compilación; {@link CompiledTemplate} solo lo re-evalúa si alguna cambió.
 */
public sealed interface Part
        permits ExprPart, AttrPart, ClassAttrPart, SpreadPart, ConditionalPart,
                ComprehensionPart, ComponentPart, SlotRenderPart {

    Deps deps();

    /**
     * @param previous el dinámico del árbol anterior en esta posición (puede ser null)
     * @param index    posición del hueco; forma parte de la ruta de montaje de componentes
     */
    Dynamic render(EvalContext ctx, Dynamic previous, int index);
}
