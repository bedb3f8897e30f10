package com.ciro.jlive.runtime;

import com.ciro.jlive.template.CompilationUnit;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Unidades compiladas por módulo + digest de sus fuentes. Mismo fuente, misma
 * unidad: no se vuelve a parsear.
 */
public class TemplateCache {

    private static final Logger log = LoggerFactory.getLogger(TemplateCache.class);

    record Key(String module, String digest) {}

    private final Cache<Key, CompilationUnit> units;

    public TemplateCache(LiveConfig config) {
        this(config, null);
    }

    TemplateCache(LiveConfig config, Executor executor) {
        Caffeine<Key, CompilationUnit> builder = Caffeine.newBuilder()
                .expireAfterAccess(config.getCacheExpireMinutes(), TimeUnit.MINUTES)
                .maximumSize(config.getCacheMaxSize())
                .removalListener((Key k, CompilationUnit unit, RemovalCause cause) ->
                        log.debug("compiled module {} ({}) removed: {}", k.module(), k.digest(), cause));
        if (executor != null) builder = builder.executor(executor);
        this.units = builder.build();
    }

    /** Devuelve la unidad en caché o la compila; los errores de compilación no se cachean. */
    public CompilationUnit get(String module, String digest, Supplier<CompilationUnit> compile) {
        return units.get(new Key(module, digest), k -> compile.get());
    }

    public CompilationUnit getIfPresent(String module, String digest) {
        return units.getIfPresent(new Key(module, digest));
    }

    public void invalidateModule(String module) {
        units.asMap().keySet().removeIf(k -> k.module().equals(module));
    }

    public long size() {
        units.cleanUp();
        return units.estimatedSize();
    }
}
