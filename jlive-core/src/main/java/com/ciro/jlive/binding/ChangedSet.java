package com.ciro.jlive.binding;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Qué cambió desde el último ciclo: clave → {@code TRUE} o un ChangedSet anidado
 * (para mapas). Una clave ausente significa "sin cambios".
 * {@link #ALL} marca que todo cambió (primer render o resync forzado).
 */
public final class ChangedSet {

    public static final ChangedSet ALL = new ChangedSet(Map.of(), true);
    public static final ChangedSet EMPTY = new ChangedSet(Map.of(), false);

    // valor: Boolean.TRUE o ChangedSet
    private final Map<String, Object> entries;
    private final boolean all;

    private ChangedSet(Map<String, Object> entries, boolean all) {
        this.entries = entries;
        this.all = all;
    }

    public static ChangedSet of(String... keys) {
        Map<String, Object> m = new LinkedHashMap<>();
        for (String k : keys) m.put(k, Boolean.TRUE);
        return new ChangedSet(Collections.unmodifiableMap(m), false);
    }

    /**
     * Compara valor a valor dos mapas de assigns. Los mapas anidados producen
     * un ChangedSet anidado; el resto, {@code TRUE}.
     */
    public static ChangedSet compute(Map<String, ?> previous, Map<String, ?> current) {
        Set<String> keys = new HashSet<>(previous.keySet());
        keys.addAll(current.keySet());
        Map<String, Object> m = new LinkedHashMap<>();
        for (String k : keys) {
            boolean before = previous.containsKey(k);
            boolean after = current.containsKey(k);
            Object marker = before != after ? Boolean.TRUE : marker(previous.get(k), current.get(k));
            if (marker != null) m.put(k, marker);
        }
        return m.isEmpty() ? EMPTY : new ChangedSet(Collections.unmodifiableMap(m), false);
    }

    /** null si los valores son iguales, ChangedSet si ambos son mapas, TRUE en otro caso. */
    public static Object marker(Object previous, Object current) {
        if (Objects.equals(previous, current)) return null;
        if (previous instanceof Map<?, ?> a && current instanceof Map<?, ?> b) {
            ChangedSet nested = compute(stringKeys(a), stringKeys(b));
            return nested.isEmpty() ? Boolean.TRUE : nested;
        }
        return Boolean.TRUE;
    }

    private static Map<String, Object> stringKeys(Map<?, ?> m) {
        Map<String, Object> out = new LinkedHashMap<>();
        m.forEach((k, v) -> out.put(String.valueOf(k), v));
        return out;
    }

    public boolean isAll() {
        return all;
    }

    public boolean isEmpty() {
        return !all && entries.isEmpty();
    }

    public Set<String> keys() {
        return entries.keySet();
    }

    /** TRUE, ChangedSet anidado o null. */
    public Object get(String key) {
        return all ? Boolean.TRUE : entries.get(key);
    }

    public boolean isChanged(String key) {
        return all || entries.containsKey(key);
    }

    /**
     * Prueba una ruta: ausente → sin cambios; TRUE → cambiado; anidado → se desciende.
     * Leer el mapa completo cuando hay un anidado cuenta como cambiado.
     */
    public boolean isChanged(List<String> path) {
        if (all) return true;
        if (path.isEmpty()) return !entries.isEmpty();
        Object v = entries.get(path.get(0));
        if (v == null) return false;
        if (v instanceof ChangedSet nested) {
            return path.size() == 1 || nested.isChanged(path.subList(1, path.size()));
        }
        return true;
    }

    /** Copia con la clave marcada. Si ya estaba marcada queda como TRUE. */
    public ChangedSet with(String key, Object marker) {
        if (all || marker == null) return this;
        Map<String, Object> m = new LinkedHashMap<>(entries);
        m.merge(key, marker, (a, b) -> Boolean.TRUE);
        return new ChangedSet(Collections.unmodifiableMap(m), false);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ChangedSet other)) return false;
        return all == other.all && entries.equals(other.entries);
    }

    @Override
    public int hashCode() {
        return Objects.hash(entries, all);
    }

    @Override
    public String toString() {
        return all ? "ChangedSet[ALL]" : "ChangedSet" + entries;
    }
}
