package com.ciro.jlive.runtime;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Properties;

/**
 * Configuración del runtime. Se lee de {@code jlive.properties} en el classpath;
 * las propiedades de sistema con el mismo nombre tienen prioridad.
 */
public class LiveConfig {

    public static final String RESOURCE = "jlive.properties";

    /** Máximo de unidades compiladas en caché */
    private long cacheMaxSize = 500;
    /** Minutos sin acceso antes de expulsar una unidad */
    private long cacheExpireMinutes = 60;
    /** Las advertencias de declaración abortan la compilación */
    private boolean failOnWarnings = false;
    /** Traza cada parche en DEBUG */
    private boolean logPatches = false;

    public long getCacheMaxSize() { return cacheMaxSize; }
    public void setCacheMaxSize(long cacheMaxSize) { this.cacheMaxSize = cacheMaxSize; }

    public long getCacheExpireMinutes() { return cacheExpireMinutes; }
    public void setCacheExpireMinutes(long cacheExpireMinutes) { this.cacheExpireMinutes = cacheExpireMinutes; }

    public boolean isFailOnWarnings() { return failOnWarnings; }
    public void setFailOnWarnings(boolean failOnWarnings) { this.failOnWarnings = failOnWarnings; }

    public boolean isLogPatches() { return logPatches; }
    public void setLogPatches(boolean logPatches) { this.logPatches = logPatches; }

    public static LiveConfig load() {
        return load(RESOURCE);
    }

    public static LiveConfig load(String resource) {
        Properties props = new Properties();
        ClassLoader cl = Thread.currentThread().getContextClassLoader();
        if (cl == null) cl = LiveConfig.class.getClassLoader();
        try (InputStream in = cl.getResourceAsStream(resource)) {
            if (in != null) props.load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("cannot read " + resource, e);
        }
        return from(props);
    }

    public static LiveConfig from(Properties props) {
        LiveConfig c = new LiveConfig();
        c.setCacheMaxSize(longValue(props, "jlive.cache.max-size", c.getCacheMaxSize()));
        c.setCacheExpireMinutes(longValue(props, "jlive.cache.expire-minutes", c.getCacheExpireMinutes()));
        c.setFailOnWarnings(boolValue(props, "jlive.compiler.fail-on-warnings", c.isFailOnWarnings()));
        c.setLogPatches(boolValue(props, "jlive.patch.log", c.isLogPatches()));
        return c;
    }

    private static String raw(Properties props, String key) {
        String v = System.getProperty(key);
        if (v == null) v = props.getProperty(key);
        return v == null ? null : v.trim();
    }

    private static long longValue(Properties props, String key, long fallback) {
        String v = raw(props, key);
        if (v == null || v.isEmpty()) return fallback;
        try {
            return Long.parseLong(v);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid value for " + key + ": " + v, e);
        }
    }

    private static boolean boolValue(Properties props, String key, boolean fallback) {
        String v = raw(props, key);
        return v == null || v.isEmpty() ? fallback : Boolean.parseBoolean(v);
    }

    @Override
    public String toString() {
        return "LiveConfig{cacheMaxSize=" + cacheMaxSize + ", cacheExpireMinutes=" + cacheExpireMinutes
                + ", failOnWarnings=" + failOnWarnings + ", logPatches=" + logPatches + "}";
    }
}
