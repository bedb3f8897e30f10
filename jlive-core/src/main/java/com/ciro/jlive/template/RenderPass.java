package com.ciro.jlive.template;

import com.ciro.jlive.ast.ComponentTarget;
import com.ciro.jlive.ast.Span;

import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Estado de un único ciclo de evaluación: asigna ids de componente y acumula
 * los componentes re-renderizados. No es thread-safe; un ciclo es secuencial.
 */
public final class RenderPass {

    private final ComponentRegistry registry;
    private final ComponentTable previous;
    private final Set<MountKey> seen = new HashSet<>();
    private final Map<Integer, MountedComponent> mounted = new HashMap<>();
    private int nextCid;

    public RenderPass(ComponentRegistry registry, ComponentTable previous) {
        this.registry = registry;
        this.previous = previous;
        this.nextCid = previous.nextCid();
    }

    ComponentDefinition resolve(ComponentTarget target, String file, Span span) {
        return registry.resolve(target).orElseThrow(() -> new TemplateEvaluationException(
                "undefined component " + target + (registry.unit(target.module()).isEmpty()
                        ? ": module " + target.module() + " is not compiled" : ""),
                "<" + target + ">", file, span, null));
    }

    /** Mismo id que en el render anterior para la misma clave; uno nuevo si no existía. */
    int cidFor(MountKey key) {
        if (!seen.add(key)) {
            throw new IllegalStateException("found duplicate component key " + key
                    + " in one render; components in a comprehension need a unique id attribute");
        }
        Integer cid = previous.cid(key);
        return cid != null ? cid : nextCid++;
    }

    MountedComponent previous(int cid) {
        return previous.get(cid);
    }

    void mounted(int cid, MountedComponent component) {
        mounted.put(cid, component);
    }

    /** Nueva tabla podada a los ids vivos en el árbol nuevo. */
    public ComponentTable finish(Set<Integer> alive) {
        Map<Integer, MountedComponent> byCid = new LinkedHashMap<>();
        previous.mounted().forEach((cid, m) -> {
            if (alive.contains(cid)) byCid.put(cid, m);
        });
        mounted.forEach((cid, m) -> {
            if (alive.contains(cid)) byCid.put(cid, m);
        });
        Map<MountKey, Integer> cids = new LinkedHashMap<>();
        byCid.forEach((cid, m) -> cids.put(m.key(), cid));
        return new ComponentTable(cids, byCid, nextCid);
    }
}
