package com.ciro.jlive.template;

import com.ciro.jlive.expr.Deps;
import com.ciro.jlive.rendered.Dynamic;
import com.ciro.jlive.rendered.Fingerprint;
import com.ciro.jlive.rendered.Rendered;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Plantilla compilada: statics + huecos ({@link Part}). El fingerprint se
 * calcula una vez aquí y nunca depende de valores.
 */
public final class CompiledTemplate {

    private final String name;
    private final String file;
    private final List<String> statics;
    private final List<Part> parts;
    private final long fingerprint;
    private final boolean root;
    private final Deps deps;

    public CompiledTemplate(String name, String file, List<String> statics, List<Part> parts, boolean root) {
        if (statics.size() != parts.size() + 1) {
            throw new IllegalStateException("template " + name + " has " + statics.size()
                    + " statics for " + parts.size() + " parts");
        }
        this.name = name;
        this.file = file;
        this.statics = List.copyOf(statics);
        this.parts = List.copyOf(parts);
        this.fingerprint = Fingerprint.of(this.statics);
        this.root = root;
        Deps d = Deps.EMPTY;
        for (Part p : parts) d = d.union(p.deps());
        this.deps = d;
    }

    public String name() { return name; }
    public String file() { return file; }
    public List<String> statics() { return statics; }
    public List<Part> parts() { return parts; }
    public long fingerprint() { return fingerprint; }
    public boolean root() { return root; }
    public Deps deps() { return deps; }

    public Rendered render(EvalContext ctx, Rendered previous) {
        return render(ctx, previous, null, null);
    }

    /**
     * Evalúa la plantilla. Un hueco cuyas dependencias no cambiaron conserva el
     * dinámico anterior por referencia; si ninguno cambió se devuelve {@code previous}.
     */
    public Rendered render(EvalContext ctx, Rendered previous, Integer componentId, String slot) {
        boolean reuse = previous != null
                && previous.origin() == this
                && Objects.equals(previous.componentId(), componentId)
                && !ctx.changed().isAll();

        List<Dynamic> dynamics = new ArrayList<>(parts.size());
        boolean untouched = reuse;
        for (int i = 0; i < parts.size(); i++) {
            Part part = parts.get(i);
            Dynamic before = reuse ? previous.dynamics().get(i) : null;
            if (reuse && !ctx.isChanged(part.deps())) {
                dynamics.add(before);
                continue;
            }
            Dynamic now = part.render(ctx, before, i);
            if (now != before) untouched = false;
            dynamics.add(now);
        }
        if (untouched) return previous;
        return new Rendered(statics, dynamics, fingerprint, root, componentId, slot, this);
    }

    @Override
    public String toString() {
        return "CompiledTemplate{" + name + ", parts=" + parts.size() + "}";
    }
}
