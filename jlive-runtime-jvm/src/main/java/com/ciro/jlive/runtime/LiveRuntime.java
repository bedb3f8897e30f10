package com.ciro.jlive.runtime;

import com.ciro.jlive.binding.BindingSet;
import com.ciro.jlive.template.CompilationUnit;
import com.ciro.jlive.template.ComponentRegistry;
import com.ciro.jlive.template.TemplateCompiler;
import com.ciro.jlive.template.TemplateInstance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.UUID;

/**
 * Punto de entrada del runtime: compila módulos (con caché) y abre sesiones.
 * Thread-safe; las sesiones no comparten nada mutable.
 */
public final class LiveRuntime {

    private static final Logger log = LoggerFactory.getLogger(LiveRuntime.class);

    private final LiveConfig config;
    private final ComponentRegistry registry;
    private final TemplateCache cache;
    private final PatchEncoder encoder;

    public LiveRuntime() {
        this(LiveConfig.load());
    }

    public LiveRuntime(LiveConfig config) {
        this(config, new ComponentRegistry(), new TemplateCache(config), new PatchEncoder());
    }

    LiveRuntime(LiveConfig config, ComponentRegistry registry, TemplateCache cache, PatchEncoder encoder) {
        this.config = config;
        this.registry = registry;
        this.cache = cache;
        this.encoder = encoder;
        log.debug("live runtime started with {}", config);
    }

    /** Compilador ligado al registry de este runtime y a su configuración. */
    public TemplateCompiler compiler(String module) {
        return new TemplateCompiler(module, registry).failOnWarnings(config.isFailOnWarnings());
    }

    /**
     * Compila (o toma de la caché) la unidad y la deja registrada. Una unidad en
     * caché se vuelve a registrar por si otra versión del módulo la reemplazó.
     */
    public CompilationUnit compile(TemplateCompiler compiler) {
        CompilationUnit unit = cache.get(compiler.module(), compiler.digest(), compiler::compile);
        registry.register(unit);
        return unit;
    }

    public LiveSession open(String module, String template, Map<String, ?> assigns) {
        CompilationUnit unit = registry.unit(module)
                .orElseThrow(() -> new IllegalArgumentException("module " + module + " is not compiled"));
        TemplateInstance instance = new TemplateInstance(unit.template(template), registry);
        String id = UUID.randomUUID().toString();
        log.debug("session {} opened for {}.{}", id, module, template);
        return new LiveSession(id, instance, BindingSet.of(assigns), encoder, config.isLogPatches());
    }

    public ComponentRegistry registry() {
        return registry;
    }

    public TemplateCache cache() {
        return cache;
    }

    public LiveConfig config() {
        return config;
    }
}
