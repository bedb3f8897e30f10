package com.ciro.jlive.template;

import com.ciro.jlive.ast.ComponentTarget;
import com.ciro.jlive.ast.LvNode;
import com.ciro.jlive.ast.Span;
import com.ciro.jlive.binding.ChangedSet;
import com.ciro.jlive.component.AttrSpec;
import com.ciro.jlive.component.ComponentSpec;
import com.ciro.jlive.component.Globals;
import com.ciro.jlive.component.SlotSpec;
import com.ciro.jlive.expr.Deps;
import com.ciro.jlive.rendered.Dynamic;
import com.ciro.jlive.rendered.Rendered;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Invocación de componente. Cada invocación recibe un id estable por clave de
 * montaje y su propio ChangedSet derivado de comparar assigns con el render anterior.
 */
public record ComponentPart(ComponentTarget target,
                            Map<String, CompiledExpr> attrs,
                            List<CompiledExpr> spreads,
                            List<SlotTemplate> slots,
                            Deps deps,
                            String file,
                            Span span) implements Part {

    public static final String ID_ATTR = "id";

    public ComponentPart {
        attrs = Collections.unmodifiableMap(new LinkedHashMap<>(attrs));
        spreads = List.copyOf(spreads);
        slots = List.copyOf(slots);
    }

    public static ComponentPart of(ComponentTarget target, Map<String, CompiledExpr> attrs,
                                   List<CompiledExpr> spreads, List<SlotTemplate> slots, String file, Span span) {
        Deps d = Deps.EMPTY;
        for (CompiledExpr e : attrs.values()) d = d.union(e.deps());
        for (CompiledExpr e : spreads) d = d.union(e.deps());
        for (SlotTemplate s : slots) d = d.union(s.deps());
        return new ComponentPart(target, attrs, spreads, slots, d, file, span);
    }

    @Override
    public Dynamic render(EvalContext ctx, Dynamic previous, int index) {
        RenderPass pass = ctx.pass();
        ComponentDefinition def = pass.resolve(target, file, span);
        ComponentSpec spec = def.spec();

        Map<String, Object> assigns = new LinkedHashMap<>();
        Map<String, Object> globals = new LinkedHashMap<>();
        AttrSpec global = spec.globalAttr().orElse(null);

        // 1. defaults; lo no declarado queda en null
        for (AttrSpec a : spec.attrs()) {
            if (a.isGlobal()) {
                if (a.hasDefault() && a.defaultValue() instanceof Map<?, ?> m) {
                    m.forEach((k, v) -> globals.put(SpreadPart.attrName(k), v));
                }
            } else {
                assigns.put(a.name(), a.hasDefault() ? a.defaultValue() : null);
            }
        }

        // 2. spreads, 3. atributos con nombre
        for (CompiledExpr spread : spreads) {
            Object v = ctx.eval(spread);
            if (v == null) continue;
            if (!(v instanceof Map<?, ?> m)) {
                throw new TemplateEvaluationException("expected a map of attributes, got: " + v,
                        spread.source(), spread.file(), spread.span(), null);
            }
            m.forEach((k, val) -> place(spec, global, assigns, globals, SpreadPart.attrName(k), val));
        }
        Object explicitId = null;
        for (Map.Entry<String, CompiledExpr> e : attrs.entrySet()) {
            Object v = ctx.eval(e.getValue());
            if (e.getKey().equals(ID_ATTR)) explicitId = v;
            place(spec, global, assigns, globals, e.getKey(), v);
        }
        if (global != null) {
            assigns.put(global.name(), Collections.unmodifiableMap(globals));
        }

        // 4. slots: todo slot declarado arranca como lista vacía
        Set<String> slotNames = new HashSet<>();
        slotNames.add(LvNode.SlotEntry.INNER_BLOCK);
        for (SlotSpec s : spec.slots()) slotNames.add(s.name());
        for (SlotTemplate s : slots) slotNames.add(s.name());
        Map<String, List<SlotValue>> slotValues = new LinkedHashMap<>();
        for (String name : slotNames) slotValues.put(name, new ArrayList<>());
        for (SlotTemplate s : slots) {
            Map<String, Object> slotAttrs = new LinkedHashMap<>();
            s.attrs().forEach((k, expr) -> slotAttrs.put(k, ctx.eval(expr)));
            slotValues.get(s.name()).add(new SlotValue(s, Collections.unmodifiableMap(slotAttrs), ctx));
        }
        slotValues.forEach((k, v) -> assigns.put(k, List.copyOf(v)));

        MountKey key = explicitId != null
                ? MountKey.ofId(target, explicitId)
                : MountKey.ofPath(target, ctx.path() + "/" + index);
        int cid = pass.cidFor(key);
        MountedComponent before = pass.previous(cid);

        ChangedSet changed = before == null || ctx.changed().isAll()
                ? ChangedSet.ALL
                : derivedChanges(ctx, before.assigns(), assigns, slotNames);

        Map<String, Object> frozen = Collections.unmodifiableMap(assigns);
        EvalContext calleeCtx = ctx.forComponent(frozen, changed, "#" + cid);
        Rendered previousTree = before == null ? null : before.rendered();
        Rendered r = def.template().render(calleeCtx, previousTree, cid, null);
        pass.mounted(cid, new MountedComponent(key, frozen, r));

        if (previous instanceof Dynamic.Nested n && n.rendered() == r) return previous;
        return new Dynamic.Nested(r);
    }

    private static void place(ComponentSpec spec, AttrSpec global, Map<String, Object> assigns,
                              Map<String, Object> globals, String name, Object value) {
        if (global != null && spec.attr(name).isEmpty() && Globals.isGlobal(name)) {
            globals.put(name, value);
        } else {
            assigns.put(name, value);
        }
    }

    /**
     * Atributos: comparación valor a valor contra los assigns anteriores.
     * Slots: cambian si las dependencias del lado del llamador cambiaron.
     */
    private ChangedSet derivedChanges(EvalContext ctx, Map<String, Object> before, Map<String, Object> now,
                                      Set<String> slotNames) {
        Map<String, Object> oldAttrs = new LinkedHashMap<>(before);
        Map<String, Object> newAttrs = new LinkedHashMap<>(now);
        oldAttrs.keySet().removeAll(slotNames);
        newAttrs.keySet().removeAll(slotNames);
        ChangedSet changed = ChangedSet.compute(oldAttrs, newAttrs);

        for (String name : slotNames) {
            Object old = before.get(name);
            Object current = now.get(name);
            int oldCount = old instanceof List<?> oldList ? oldList.size() : -1;
            int newCount = current instanceof List<?> newList ? newList.size() : -1;
            boolean dirty = oldCount != newCount;
            for (SlotTemplate s : slots) {
                if (s.name().equals(name) && ctx.isChanged(s.deps())) dirty = true;
            }
            if (dirty) changed = changed.with(name, Boolean.TRUE);
        }
        return changed;
    }
}
