package com.ciro.jlive.template;

import com.ciro.jlive.binding.BindingSet;
import com.ciro.jlive.binding.ChangedSet;
import com.ciro.jlive.diff.DiffEngine;
import com.ciro.jlive.diff.Patch;
import com.ciro.jlive.rendered.ComponentTree;
import com.ciro.jlive.rendered.Rendered;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Una instanciación viva de una plantilla: guarda el último árbol y la tabla de
 * componentes, y cada {@link #render} produce el parche contra ellos.
 * <p>
 * Los ciclos deben ser secuenciales; quien la use serializa las llamadas.
 */
public final class TemplateInstance {

    private record Snapshot(Rendered tree, ComponentTable table) {}

    private final CompiledTemplate template;
    private final ComponentRegistry registry;
    private final AtomicReference<Snapshot> snapshot = new AtomicReference<>();

    public TemplateInstance(CompiledTemplate template, ComponentRegistry registry) {
        this.template = template;
        this.registry = registry;
    }

    public Patch render(BindingSet bindings) {
        Snapshot before = snapshot.get();
        ChangedSet changed = before == null ? ChangedSet.ALL : bindings.changed();
        ComponentTable table = before == null ? ComponentTable.EMPTY : before.table();
        Rendered previous = before == null ? null : before.tree();

        RenderPass pass = new RenderPass(registry, table);
        Rendered current = template.render(EvalContext.root(bindings.values(), changed, pass), previous);
        ComponentTree components = ComponentTree.collect(current);
        ComponentTable next = pass.finish(components.byId().keySet());

        Patch patch = DiffEngine.diff(previous, current, changed);
        snapshot.set(new Snapshot(current, next));
        return patch;
    }

    /** Árbol completo actual, para un cliente que se reconecta. */
    public Patch resync() {
        Snapshot s = snapshot.get();
        if (s == null) {
            throw new IllegalStateException("template " + template.name() + " has not been rendered yet");
        }
        return DiffEngine.full(s.tree());
    }

    /** null antes del primer render. */
    public Rendered current() {
        Snapshot s = snapshot.get();
        return s == null ? null : s.tree();
    }

    public ComponentTable components() {
        Snapshot s = snapshot.get();
        return s == null ? ComponentTable.EMPTY : s.table();
    }

    public CompiledTemplate template() {
        return template;
    }
}
