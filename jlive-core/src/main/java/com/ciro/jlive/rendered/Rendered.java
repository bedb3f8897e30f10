package com.ciro.jlive.rendered;

import java.util.List;
import java.util.Objects;

/**
 * Árbol de render: statics intercalados con dinámicos.
 * Invariante: {@code dynamics.size() == statics.size() - 1}.
 * <p>
 * {@code origin} es la identidad de la plantilla compilada que lo produjo; el
 * seguimiento de cambios solo reutiliza huecos de un árbol con el mismo origen.
 */
public final class Rendered {

    private final List<String> statics;
    private final List<Dynamic> dynamics;
    private final long fingerprint;
    private final boolean root;
    private final Integer componentId;
    private final String slot;
    private final Object origin;

    public Rendered(List<String> statics, List<Dynamic> dynamics, long fingerprint, boolean root,
                    Integer componentId, String slot, Object origin) {
        this.statics = List.copyOf(statics);
        this.dynamics = List.copyOf(dynamics);
        if (this.dynamics.size() != this.statics.size() - 1) {
            throw new IllegalStateException("rendered tree with " + this.statics.size()
                    + " statics and " + this.dynamics.size() + " dynamics");
        }
        this.fingerprint = fingerprint;
        this.root = root;
        this.componentId = componentId;
        this.slot = slot;
        this.origin = origin;
    }

    /** Árbol sin dinámicos, p.ej. {@code "<p>hi</p>"}. */
    public static Rendered ofStatic(String html) {
        List<String> statics = List.of(html);
        return new Rendered(statics, List.of(), Fingerprint.of(statics), false, null, null, null);
    }

    public List<String> statics() { return statics; }
    public List<Dynamic> dynamics() { return dynamics; }
    public long fingerprint() { return fingerprint; }
    public boolean root() { return root; }
    public Integer componentId() { return componentId; }
    public String slot() { return slot; }
    public Object origin() { return origin; }

    public boolean isComponent() {
        return componentId != null;
    }

    public String toHtml() {
        StringBuilder sb = new StringBuilder();
        appendTo(sb);
        return sb.toString();
    }

    void appendTo(StringBuilder sb) {
        sb.append(statics.get(0));
        for (int i = 0; i < dynamics.size(); i++) {
            appendDynamic(sb, dynamics.get(i));
            sb.append(statics.get(i + 1));
        }
    }

    private static void appendDynamic(StringBuilder sb, Dynamic d) {
        if (d instanceof Dynamic.Value v) {
            sb.append(v.value());
        } else if (d instanceof Dynamic.Nested n) {
            n.rendered().appendTo(sb);
        } else if (d instanceof Dynamic.Sequence s) {
            s.items().forEach(it -> it.appendTo(sb));
        } else if (d instanceof Dynamic.Comprehension c) {
            c.items().forEach(it -> it.appendTo(sb));
        }
    }

    @Override
    public String toString() {
        return "Rendered{fp=" + Long.toHexString(fingerprint)
                + (componentId != null ? ", cid=" + componentId : "")
                + ", statics=" + statics + ", dynamics=" + dynamics.size() + "}";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Rendered r)) return false;
        return fingerprint == r.fingerprint && root == r.root
                && Objects.equals(componentId, r.componentId)
                && statics.equals(r.statics) && dynamics.equals(r.dynamics);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fingerprint, componentId, dynamics);
    }
}
