package com.ciro.jlive.template;

import com.ciro.jlive.ast.ComponentTarget;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Unidades compiladas por módulo. Única estructura compartida entre sesiones;
 * las unidades son inmutables.
 */
public final class ComponentRegistry {

    private final Map<String, CompilationUnit> units = new ConcurrentHashMap<>();

    public void register(CompilationUnit unit) {
        units.put(unit.module(), unit);
    }

    public Optional<CompilationUnit> unit(String module) {
        return module == null ? Optional.empty() : Optional.ofNullable(units.get(module));
    }

    public Optional<ComponentDefinition> resolve(ComponentTarget target) {
        return unit(target.module()).map(u -> u.component(target.function()));
    }

    public void remove(String module) {
        units.remove(module);
    }

    public Set<String> modules() {
        return Set.copyOf(units.keySet());
    }
}
