package com.ciro.jlive.template;

import com.ciro.jlive.component.ComponentSpec;

/** Declaración + plantilla compilada de un componente. */
public record ComponentDefinition(ComponentSpec spec, CompiledTemplate template) {}
