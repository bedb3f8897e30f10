package com.ciro.jlive.runtime;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LiveConfigTest {

    @AfterEach
    void clearOverrides() {
        System.clearProperty("jlive.patch.log");
    }

    @Test
    void defaultsFromBundledProperties() {
        var config = LiveConfig.load();
        assertEquals(500, config.getCacheMaxSize());
        assertEquals(60, config.getCacheExpireMinutes());
        assertFalse(config.isFailOnWarnings());
        assertFalse(config.isLogPatches());
    }

    @Test
    void readsACustomResource() {
        var config = LiveConfig.load("jlive-test.properties");
        assertEquals(10, config.getCacheMaxSize());
        assertEquals(5, config.getCacheExpireMinutes());
        assertTrue(config.isFailOnWarnings());
    }

    @Test
    void missingResourceKeepsDefaults() {
        var config = LiveConfig.load("does-not-exist.properties");
        assertEquals(500, config.getCacheMaxSize());
    }

    @Test
    void systemPropertiesWin() {
        System.setProperty("jlive.patch.log", "true");
        var props = new Properties();
        props.setProperty("jlive.patch.log", "false");
        assertTrue(LiveConfig.from(props).isLogPatches());
    }

    @Test
    void invalidNumbersAreRejected() {
        var props = new Properties();
        props.setProperty("jlive.cache.max-size", "lots");
        var e = assertThrows(IllegalArgumentException.class, () -> LiveConfig.from(props));
        assertEquals("invalid value for jlive.cache.max-size: lots", e.getMessage());
    }
}
