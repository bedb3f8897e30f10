package com.ciro.jlive.runtime;

import com.ciro.jlive.binding.BindingSet;
import com.ciro.jlive.diff.Patch;
import com.ciro.jlive.template.TemplateInstance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;

/**
 * Una instanciación viva vista desde el transporte: recibe assigns, ejecuta un
 * ciclo evaluar-y-diferenciar y devuelve el parche en JSON.
 * <p>
 * Los ciclos de una sesión nunca se solapan.
 */
public final class LiveSession {

    private static final Logger log = LoggerFactory.getLogger(LiveSession.class);

    private final String id;
    private final TemplateInstance instance;
    private final PatchEncoder encoder;
    private final boolean logPatches;
    private final ReentrantLock lock = new ReentrantLock();

    private BindingSet bindings;

    LiveSession(String id, TemplateInstance instance, BindingSet initial, PatchEncoder encoder, boolean logPatches) {
        this.id = id;
        this.instance = instance;
        this.bindings = initial;
        this.encoder = encoder;
        this.logPatches = logPatches;
    }

    public String id() {
        return id;
    }

    /** Primer render: siempre un árbol completo. */
    public String mount() {
        lock.lock();
        try {
            if (instance.current() != null) {
                throw new IllegalStateException("session " + id + " is already mounted");
            }
            return cycle().orElseThrow(() -> new IllegalStateException("first render produced an empty patch"));
        } finally {
            lock.unlock();
        }
    }

    public Optional<String> assign(String key, Object value) {
        return update(b -> b.assign(key, value));
    }

    public Optional<String> assign(Map<String, ?> updates) {
        return update(b -> b.assign(updates));
    }

    /** Para cambios que no se detectan por igualdad (ej. {@link BindingSet#forceAssign}). */
    public Optional<String> update(UnaryOperator<BindingSet> change) {
        lock.lock();
        try {
            bindings = change.apply(bindings);
            return cycle();
        } finally {
            lock.unlock();
        }
    }

    /** Árbol completo para un cliente que perdió el estado. */
    public String resync() {
        lock.lock();
        try {
            String json = encoder.encode(instance.resync());
            trace("resync", json);
            return json;
        } finally {
            lock.unlock();
        }
    }

    public BindingSet bindings() {
        lock.lock();
        try {
            return bindings;
        } finally {
            lock.unlock();
        }
    }

    TemplateInstance instance() {
        return instance;
    }

    // Si el render falla el changed set se conserva para el siguiente ciclo.
    private Optional<String> cycle() {
        Patch patch = instance.render(bindings);
        bindings = bindings.clearChanged();
        if (patch.isEmpty()) {
            log.trace("session {}: nothing changed", id);
            return Optional.empty();
        }
        String json = encoder.encode(patch);
        trace("patch", json);
        return Optional.of(json);
    }

    private void trace(String what, String json) {
        if (logPatches) {
            log.debug("session {} {}: {}", id, what, json);
        } else if (log.isTraceEnabled()) {
            log.trace("session {} {}: {}", id, what, json);
        }
    }
}
