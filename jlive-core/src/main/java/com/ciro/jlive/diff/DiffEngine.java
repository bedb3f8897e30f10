package com.ciro.jlive.diff;

import com.ciro.jlive.binding.ChangedSet;
import com.ciro.jlive.rendered.ComponentTree;
import com.ciro.jlive.rendered.Dynamic;
import com.ciro.jlive.rendered.Rendered;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Calcula el parche mínimo entre dos evaluaciones sucesivas de un árbol.
 * <p>
 * Un hueco que conserva la misma referencia no se re-evaluó y no viaja. Los
 * componentes viajan por id: el hueco lleva el entero y el contenido va al mapa
 * {@code "c"} de la raíz.
 */
public final class DiffEngine {

    public static final String STATICS = "s";
    public static final String COMPONENTS = "c";
    public static final String ROOT = "r";
    public static final String DYNAMICS = "d";
    public static final String PATCHES = "p";
    public static final String LIST = "l";
    public static final String MOVES = "m";
    public static final String INSERTS = "i";

    private DiffEngine() {}

    public static Patch diff(Rendered previous, Rendered current, ChangedSet changed) {
        if (current == null) {
            throw new IllegalArgumentException("current tree is required");
        }
        ComponentTree before = ComponentTree.collect(previous);
        ComponentTree after = ComponentTree.collect(current);

        boolean full = previous == null || changed.isAll() || previous.fingerprint() != current.fingerprint();
        Map<String, Object> out = full ? fullTree(current, false) : diffTree(previous, current);

        Map<Integer, Object> byId = new TreeMap<>();
        after.byId().forEach((cid, node) -> {
            Rendered now = node.rendered();
            Rendered old = before.rendered(cid);
            if (full || old == null || old.fingerprint() != now.fingerprint()) {
                byId.put(cid, fullTree(now, true));
            } else if (old != now) {
                Map<String, Object> sub = diffTree(old, now);
                if (!sub.isEmpty()) byId.put(cid, sub);
            }
        });
        for (Integer cid : before.byId().keySet()) {
            if (!after.contains(cid)) byId.put(cid, null);
        }
        if (!byId.isEmpty()) {
            out.put(COMPONENTS, orderedByCid(byId));
        }
        return out.isEmpty() ? Patch.empty() : new Patch(out);
    }

    /** Reemplazo completo del árbol actual (reconexión del cliente). */
    public static Patch full(Rendered current) {
        return diff(null, current, ChangedSet.ALL);
    }

    // ------------------------------------------------------------------
    // Árbol completo
    // ------------------------------------------------------------------

    private static Map<String, Object> fullTree(Rendered r, boolean asComponent) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put(STATICS, r.statics());
        List<Dynamic> dyn = r.dynamics();
        for (int i = 0; i < dyn.size(); i++) {
            out.put(String.valueOf(i), fullDynamic(dyn.get(i)));
        }
        if (asComponent && r.root()) {
            out.put(ROOT, 1);
        }
        return out;
    }

    private static Object fullDynamic(Dynamic d) {
        if (d instanceof Dynamic.Value v) {
            return v.value();
        }
        if (d instanceof Dynamic.Nested n) {
            Rendered r = n.rendered();
            return r.isComponent() ? (Object) r.componentId() : fullTree(r, false);
        }
        if (d instanceof Dynamic.Sequence s) {
            List<Object> items = new ArrayList<>();
            s.items().forEach(it -> items.add(fullTree(it, false)));
            Map<String, Object> out = new LinkedHashMap<>();
            out.put(LIST, items);
            return out;
        }
        Dynamic.Comprehension c = (Dynamic.Comprehension) d;
        Map<String, Object> out = new LinkedHashMap<>();
        out.put(STATICS, c.statics());
        out.put(DYNAMICS, itemDynamics(c.items()));
        return out;
    }

    private static List<Object> itemDynamics(List<Rendered> items) {
        List<Object> out = new ArrayList<>(items.size());
        for (Rendered item : items) out.add(itemDynamics(item));
        return out;
    }

    private static List<Object> itemDynamics(Rendered item) {
        List<Object> row = new ArrayList<>(item.dynamics().size());
        for (Dynamic d : item.dynamics()) row.add(fullDynamic(d));
        return row;
    }

    // ------------------------------------------------------------------
    // Diff con mismo fingerprint
    // ------------------------------------------------------------------

    private static Map<String, Object> diffTree(Rendered previous, Rendered current) {
        Map<String, Object> out = new LinkedHashMap<>();
        if (previous == current) return out;
        if (previous.dynamics().size() != current.dynamics().size()) {
            throw new IllegalStateException("trees with fingerprint " + Long.toHexString(current.fingerprint())
                    + " disagree on dynamic count: " + previous.dynamics().size()
                    + " vs " + current.dynamics().size());
        }
        List<Dynamic> before = previous.dynamics();
        List<Dynamic> after = current.dynamics();
        for (int i = 0; i < after.size(); i++) {
            Dynamic p = before.get(i);
            Dynamic c = after.get(i);
            if (p == c) continue;
            Object d = diffDynamic(p, c);
            if (d != null) out.put(String.valueOf(i), d);
        }
        return out;
    }

    /** null = sin cambios para el cliente. */
    private static Object diffDynamic(Dynamic previous, Dynamic current) {
        if (current instanceof Dynamic.Value v) {
            return v.value();
        }
        if (current instanceof Dynamic.Nested n) {
            Rendered now = n.rendered();
            if (now.isComponent()) {
                boolean sameCid = previous instanceof Dynamic.Nested pn
                        && now.componentId().equals(pn.rendered().componentId());
                return sameCid ? null : now.componentId();
            }
            if (previous instanceof Dynamic.Nested pn && !pn.rendered().isComponent()
                    && pn.rendered().fingerprint() == now.fingerprint()) {
                Map<String, Object> sub = diffTree(pn.rendered(), now);
                return sub.isEmpty() ? null : sub;
            }
            return fullTree(now, false);
        }
        if (current instanceof Dynamic.Sequence s) {
            return diffSequence(previous, s);
        }
        return diffComprehension(previous, (Dynamic.Comprehension) current);
    }

    private static Object diffSequence(Dynamic previous, Dynamic.Sequence current) {
        if (previous instanceof Dynamic.Sequence p && sameShape(p.items(), current.items())) {
            Map<String, Object> patches = itemPatches(p.items(), current.items());
            if (patches.isEmpty()) return null;
            Map<String, Object> out = new LinkedHashMap<>();
            out.put(PATCHES, patches);
            return out;
        }
        return fullDynamic(current);
    }

    private static Object diffComprehension(Dynamic previous, Dynamic.Comprehension current) {
        if (!(previous instanceof Dynamic.Comprehension p) || p.fingerprint() != current.fingerprint()) {
            return fullDynamic(current);
        }
        List<Rendered> before = p.items();
        List<Rendered> after = current.items();

        List<Integer> beforeKeys = keys(before);
        List<Integer> afterKeys = keys(after);
        if (beforeKeys != null && afterKeys != null) {
            return keyed(before, after, beforeKeys, afterKeys);
        }

        if (before.size() == after.size()) {
            Map<String, Object> patches = itemPatches(before, after);
            if (patches.isEmpty()) return null;
            Map<String, Object> out = new LinkedHashMap<>();
            out.put(PATCHES, patches);
            return out;
        }
        // cambió la cantidad: mismos statics, todos los items
        Map<String, Object> out = new LinkedHashMap<>();
        out.put(DYNAMICS, itemDynamics(after));
        return out;
    }

    private static Object keyed(List<Rendered> before, List<Rendered> after,
                                List<Integer> beforeKeys, List<Integer> afterKeys) {
        KeyedMoves.Plan plan = KeyedMoves.plan(beforeKeys, afterKeys);
        Map<String, Object> out = new LinkedHashMap<>();
        if (!plan.removed().isEmpty()) {
            out.put(ROOT, plan.removed());
        }
        if (!plan.moves().isEmpty()) {
            List<Object> moves = new ArrayList<>();
            plan.moves().forEach(m -> moves.add(List.of(m.key(), m.to())));
            out.put(MOVES, moves);
        }
        if (!plan.inserted().isEmpty()) {
            List<Object> inserts = new ArrayList<>();
            for (int to : plan.inserted()) {
                inserts.add(List.of(to, itemDynamics(after.get(to))));
            }
            out.put(INSERTS, inserts);
        }

        Map<Integer, Rendered> old = new LinkedHashMap<>();
        for (int i = 0; i < before.size(); i++) old.put(beforeKeys.get(i), before.get(i));
        Set<Integer> insertedAt = new HashSet<>(plan.inserted());
        Map<String, Object> patches = new LinkedHashMap<>();
        for (int i = 0; i < after.size(); i++) {
            if (insertedAt.contains(i)) continue;
            Rendered prevItem = old.get(afterKeys.get(i));
            Map<String, Object> sub = diffTree(prevItem, after.get(i));
            if (!sub.isEmpty()) patches.put(String.valueOf(i), sub);
        }
        if (!patches.isEmpty()) {
            out.put(PATCHES, patches);
        }
        return out.isEmpty() ? null : out;
    }

    private static Map<String, Object> itemPatches(List<Rendered> before, List<Rendered> after) {
        Map<String, Object> patches = new LinkedHashMap<>();
        for (int i = 0; i < after.size(); i++) {
            Rendered p = before.get(i);
            Rendered c = after.get(i);
            if (p == c) continue;
            Map<String, Object> sub = p.fingerprint() == c.fingerprint() ? diffTree(p, c) : fullTree(c, false);
            if (!sub.isEmpty()) patches.put(String.valueOf(i), sub);
        }
        return patches;
    }

    private static boolean sameShape(List<Rendered> before, List<Rendered> after) {
        if (before.size() != after.size()) return false;
        for (int i = 0; i < after.size(); i++) {
            if (before.get(i).fingerprint() != after.get(i).fingerprint()) return false;
        }
        return true;
    }

    /**
     * Clave de cada item: el id del primer componente directo entre sus dinámicos.
     * null si la lista está vacía, algún item no tiene clave o hay claves repetidas.
     */
    private static List<Integer> keys(List<Rendered> items) {
        if (items.isEmpty()) return null;
        List<Integer> keys = new ArrayList<>(items.size());
        Set<Integer> seen = new HashSet<>();
        for (Rendered item : items) {
            Integer key = null;
            for (Dynamic d : item.dynamics()) {
                if (d instanceof Dynamic.Nested n && n.rendered().isComponent()) {
                    key = n.rendered().componentId();
                    break;
                }
            }
            if (key == null || !seen.add(key)) return null;
            keys.add(key);
        }
        return keys;
    }

    private static Map<String, Object> orderedByCid(Map<Integer, Object> byId) {
        Map<String, Object> out = new LinkedHashMap<>();
        byId.forEach((cid, v) -> out.put(String.valueOf(cid), v));
        return out;
    }
}
