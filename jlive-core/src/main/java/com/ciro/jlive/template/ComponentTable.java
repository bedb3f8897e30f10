package com.ciro.jlive.template;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Snapshot inmutable de los componentes montados: clave de montaje → id estable,
 * y por id los assigns y el árbol del último render.
 */
public final class ComponentTable {

    public static final ComponentTable EMPTY = new ComponentTable(Map.of(), Map.of(), 1);

    private final Map<MountKey, Integer> cids;
    private final Map<Integer, MountedComponent> mounted;
    private final int nextCid;

    ComponentTable(Map<MountKey, Integer> cids, Map<Integer, MountedComponent> mounted, int nextCid) {
        this.cids = Collections.unmodifiableMap(new LinkedHashMap<>(cids));
        this.mounted = Collections.unmodifiableMap(new LinkedHashMap<>(mounted));
        this.nextCid = nextCid;
    }

    public Integer cid(MountKey key) {
        return cids.get(key);
    }

    public MountedComponent get(int cid) {
        return mounted.get(cid);
    }

    public Map<Integer, MountedComponent> mounted() {
        return mounted;
    }

    public int nextCid() {
        return nextCid;
    }

    public int size() {
        return mounted.size();
    }
}
