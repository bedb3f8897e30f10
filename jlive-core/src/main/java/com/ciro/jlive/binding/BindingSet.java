package com.ciro.jlive.binding;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * Assigns de una instanciación más el {@link ChangedSet} acumulado desde el último ciclo.
 * Inmutable: cada assign devuelve una copia.
 */
public final class BindingSet {

    private static final BindingSet EMPTY = new BindingSet(Map.of(), ChangedSet.ALL);

    private final Map<String, Object> values;
    private final ChangedSet changed;

    private BindingSet(Map<String, Object> values, ChangedSet changed) {
        this.values = values;
        this.changed = changed;
    }

    public static BindingSet empty() {
        return EMPTY;
    }

    /** Todo lo inicial cuenta como cambiado. */
    public static BindingSet of(Map<String, ?> initial) {
        return new BindingSet(Collections.unmodifiableMap(new LinkedHashMap<>(initial)), ChangedSet.ALL);
    }

    /** Solo marca la clave si el valor es distinto al actual. */
    public BindingSet assign(String key, Object value) {
        Object marker = values.containsKey(key) ? ChangedSet.marker(values.get(key), value) : Boolean.TRUE;
        if (marker == null) return this;
        return new BindingSet(put(key, value), changed.with(key, marker));
    }

    public BindingSet assign(Map<String, ?> updates) {
        BindingSet out = this;
        for (Map.Entry<String, ?> e : updates.entrySet()) {
            out = out.assign(e.getKey(), e.getValue());
        }
        return out;
    }

    /**
     * Asigna solo si la clave no existe; el supplier no se invoca si ya está.
     * Una clave presente con valor null cuenta como existente.
     */
    public BindingSet assignNew(String key, Supplier<?> fn) {
        if (values.containsKey(key)) return this;
        return new BindingSet(put(key, fn.get()), changed.with(key, Boolean.TRUE));
    }

    /** Aplica {@code fn} al valor actual y lo asigna con la misma detección que {@link #assign}. */
    public BindingSet update(String key, UnaryOperator<Object> fn) {
        if (!values.containsKey(key)) {
            throw new IllegalArgumentException("cannot update assign @" + key + ": key not found in " + values.keySet());
        }
        return assign(key, fn.apply(values.get(key)));
    }

    /** Marca la clave como cambiada aunque el valor sea igual (datos mutados in situ). */
    public BindingSet forceAssign(String key, Object value) {
        return new BindingSet(put(key, value), changed.with(key, Boolean.TRUE));
    }

    public BindingSet clearChanged() {
        return changed.isEmpty() ? this : new BindingSet(values, ChangedSet.EMPTY);
    }

    public BindingSet markAllChanged() {
        return new BindingSet(values, ChangedSet.ALL);
    }

    public Object get(String key) {
        return values.get(key);
    }

    public boolean contains(String key) {
        return values.containsKey(key);
    }

    public Map<String, Object> values() {
        return values;
    }

    public ChangedSet changed() {
        return changed;
    }

    private Map<String, Object> put(String key, Object value) {
        Map<String, Object> m = new LinkedHashMap<>(values);
        m.put(key, value);
        return Collections.unmodifiableMap(m);
    }

    @Override
    public String toString() {
        return "BindingSet" + values + " " + changed;
    }
}
