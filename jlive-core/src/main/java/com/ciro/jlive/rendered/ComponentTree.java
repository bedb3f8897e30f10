package com.ciro.jlive.rendered;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Índice de los componentes montados en un árbol, por id.
 */
public final class ComponentTree {

    private final Map<Integer, ComponentNode> byId;
    private final List<ComponentNode> roots;

    private ComponentTree(Map<Integer, ComponentNode> byId, List<ComponentNode> roots) {
        this.byId = Collections.unmodifiableMap(byId);
        this.roots = List.copyOf(roots);
    }

    public static ComponentTree collect(Rendered tree) {
        Map<Integer, ComponentNode> byId = new LinkedHashMap<>();
        Map<String, List<ComponentNode>> top = new LinkedHashMap<>();
        if (tree != null) {
            walk(tree, "", top, byId);
        }
        List<ComponentNode> roots = new ArrayList<>();
        top.values().forEach(roots::addAll);
        return new ComponentTree(byId, roots);
    }

    public static ComponentTree empty() {
        return collect(null);
    }

    public Map<Integer, ComponentNode> byId() {
        return byId;
    }

    public List<ComponentNode> roots() {
        return roots;
    }

    public Rendered rendered(int componentId) {
        ComponentNode n = byId.get(componentId);
        return n == null ? null : n.rendered();
    }

    public boolean contains(int componentId) {
        return byId.containsKey(componentId);
    }

    private static void walk(Rendered r, String slot, Map<String, List<ComponentNode>> out,
                             Map<Integer, ComponentNode> byId) {
        String via = r.slot() != null ? r.slot() : slot;
        for (Dynamic d : r.dynamics()) {
            if (d instanceof Dynamic.Nested n) {
                visit(n.rendered(), via, out, byId);
            } else if (d instanceof Dynamic.Sequence s) {
                s.items().forEach(it -> visit(it, via, out, byId));
            } else if (d instanceof Dynamic.Comprehension c) {
                c.items().forEach(it -> visit(it, via, out, byId));
            }
        }
    }

    private static void visit(Rendered r, String slot, Map<String, List<ComponentNode>> out,
                              Map<Integer, ComponentNode> byId) {
        if (!r.isComponent()) {
            walk(r, slot, out, byId);
            return;
        }
        int cid = r.componentId();
        if (byId.containsKey(cid)) {
            throw new IllegalStateException("duplicate component id " + cid + " in rendered tree");
        }
        // se reserva antes de bajar a los hijos
        byId.put(cid, null);
        Map<String, List<ComponentNode>> children = new LinkedHashMap<>();
        walk(r, "", children, byId);
        Map<String, List<ComponentNode>> frozen = new LinkedHashMap<>();
        children.forEach((k, v) -> frozen.put(k, List.copyOf(v)));
        ComponentNode node = new ComponentNode(r.fingerprint(), cid, r, Collections.unmodifiableMap(frozen));
        byId.put(cid, node);
        out.computeIfAbsent(slot, k -> new ArrayList<>()).add(node);
    }
}
