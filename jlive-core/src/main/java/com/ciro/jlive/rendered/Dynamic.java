package com.ciro.jlive.rendered;

import java.util.List;

/**
 * Hueco dinámico de un {@link Rendered}. La igualdad que importa al diff es la
 * de referencia: un Dynamic reutilizado del árbol anterior no se re-evaluó.
 */
public sealed interface Dynamic {

    /** Texto ya escapado */
    record Value(String value) implements Dynamic {}

    /** Sub-árbol. Si {@code rendered.componentId() != null} es un componente montado. */
    record Nested(Rendered rendered) implements Dynamic {}

    /** Lista de árboles independientes (p.ej. entradas de un slot). */
    record Sequence(List<Rendered> items) implements Dynamic {
        public Sequence {
            items = List.copyOf(items);
        }
    }

    /** Statics compartidos una sola vez; cada item aporta solo sus dinámicos. */
    record Comprehension(List<String> statics, long fingerprint, List<Rendered> items) implements Dynamic {
        public Comprehension {
            statics = List.copyOf(statics);
            items = List.copyOf(items);
        }
    }
}
