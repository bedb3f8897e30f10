package com.ciro.jlive.template;

import com.ciro.jlive.component.Diagnostic;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Resultado inmutable de compilar un módulo: componentes, plantillas y advertencias. */
public final class CompilationUnit {

    private final String module;
    private final Map<String, ComponentDefinition> components;
    private final Map<String, CompiledTemplate> templates;
    private final List<Diagnostic> warnings;

    public CompilationUnit(String module, Map<String, ComponentDefinition> components,
                           Map<String, CompiledTemplate> templates, List<Diagnostic> warnings) {
        this.module = module;
        this.components = Collections.unmodifiableMap(new LinkedHashMap<>(components));
        this.templates = Collections.unmodifiableMap(new LinkedHashMap<>(templates));
        this.warnings = List.copyOf(warnings);
    }

    public String module() { return module; }
    public Map<String, ComponentDefinition> components() { return components; }
    public Map<String, CompiledTemplate> templates() { return templates; }
    public List<Diagnostic> warnings() { return warnings; }

    /** null si no existe. */
    public ComponentDefinition component(String name) {
        return components.get(name);
    }

    public CompiledTemplate template(String name) {
        CompiledTemplate t = templates.get(name);
        if (t == null) {
            throw new IllegalArgumentException("no template " + name + " in module " + module
                    + ". Available: " + templates.keySet());
        }
        return t;
    }
}
