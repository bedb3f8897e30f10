package com.ciro.jlive.diff;

import java.util.Collections;
import java.util.Map;

/**
 * Parche en su forma de cable: mapas, listas, strings, enteros y null,
 * listo para serializar. Un parche vacío no genera mensaje.
 */
public final class Patch {

    private static final Patch EMPTY = new Patch(Map.of());

    private final Map<String, Object> wire;

    Patch(Map<String, Object> wire) {
        this.wire = Collections.unmodifiableMap(wire);
    }

    public static Patch empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return wire.isEmpty();
    }

    /** true si trae statics en la raíz (reemplazo completo). */
    public boolean isFull() {
        return wire.containsKey(DiffEngine.STATICS);
    }

    public Map<String, Object> toWire() {
        return wire;
    }

    @Override
    public String toString() {
        return "Patch" + wire;
    }
}
