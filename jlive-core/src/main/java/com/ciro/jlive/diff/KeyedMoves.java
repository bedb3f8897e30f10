package com.ciro.jlive.diff;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Plan de reordenamiento de una lista con claves (ids de componente).
 * <p>
 * Los items que sobreviven y forman la subsecuencia creciente más larga de sus
 * posiciones anteriores se quedan quietos; el resto de sobrevivientes se mueve.
 * El cliente reconstruye: quita {@code removed} y los movidos, luego inserta
 * movidos y nuevos en orden ascendente de índice destino.
 */
public final class KeyedMoves {

    public record Move(int key, int to) {}

    public record Plan(List<Integer> removed, List<Move> moves, List<Integer> inserted, Set<Integer> stable) {

        public boolean isIdentity() {
            return removed.isEmpty() && moves.isEmpty() && inserted.isEmpty();
        }
    }

    private KeyedMoves() {}

    public static Plan plan(List<Integer> previous, List<Integer> current) {
        Map<Integer, Integer> prevIndex = new HashMap<>();
        for (int i = 0; i < previous.size(); i++) prevIndex.put(previous.get(i), i);
        Set<Integer> currentKeys = new HashSet<>(current);

        List<Integer> removed = new ArrayList<>();
        for (Integer k : previous) {
            if (!currentKeys.contains(k)) removed.add(k);
        }

        // posiciones anteriores de los sobrevivientes, en el orden nuevo
        List<Integer> survivors = new ArrayList<>();
        List<Integer> positions = new ArrayList<>();
        for (Integer k : current) {
            Integer p = prevIndex.get(k);
            if (p != null) {
                survivors.add(k);
                positions.add(p);
            }
        }

        Set<Integer> stable = new HashSet<>();
        for (int idx : longestIncreasing(positions)) stable.add(survivors.get(idx));

        List<Move> moves = new ArrayList<>();
        List<Integer> inserted = new ArrayList<>();
        for (int to = 0; to < current.size(); to++) {
            Integer k = current.get(to);
            if (!prevIndex.containsKey(k)) inserted.add(to);
            else if (!stable.contains(k)) moves.add(new Move(k, to));
        }
        return new Plan(List.copyOf(removed), List.copyOf(moves), List.copyOf(inserted), Set.copyOf(stable));
    }

    /**
     * Patience sorting: índices (en {@code seq}) de una subsecuencia estrictamente
     * creciente de longitud máxima. O(n log n).
     */
    static int[] longestIncreasing(List<Integer> seq) {
        int n = seq.size();
        int[] tails = new int[n];     // índice del menor final para cada longitud
        int[] prev = new int[n];
        int len = 0;
        for (int i = 0; i < n; i++) {
            int v = seq.get(i);
            int lo = 0, hi = len;
            while (lo < hi) {
                int mid = (lo + hi) >>> 1;
                if (seq.get(tails[mid]) < v) lo = mid + 1;
                else hi = mid;
            }
            prev[i] = lo > 0 ? tails[lo - 1] : -1;
            tails[lo] = i;
            if (lo == len) len++;
        }
        int[] out = new int[len];
        int k = len > 0 ? tails[len - 1] : -1;
        for (int i = len - 1; i >= 0; i--) {
            out[i] = k;
            k = prev[k];
        }
        return out;
    }
}
