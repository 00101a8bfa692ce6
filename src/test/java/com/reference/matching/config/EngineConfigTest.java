package com.reference.matching.config;

import io.smallrye.config.PropertiesConfigSource;
import io.smallrye.config.SmallRyeConfigBuilder;
import org.eclipse.microprofile.config.Config;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EngineConfigTest {

    private static Config configOf(Map<String, String> values) {
        return new SmallRyeConfigBuilder()
                .withSources(new PropertiesConfigSource(values, "test", 100))
                .build();
    }

    @Test
    @DisplayName("Defaults match the documented operating values")
    void testDefaults() {
        EngineConfig config = EngineConfig.defaults();

        assertEquals(Duration.ofDays(10), config.cache().ttlFound());
        assertEquals(Duration.ofDays(4), config.cache().ttlNotFound());
        assertEquals(Path.of("cache"), config.cache().directory());
        assertEquals(7.5, config.rateLimit().minGapSeconds());
        assertEquals(2.0, config.rateLimit().slowMultiplier());
        assertEquals(0.30, config.rateLimit().circuitThreshold());
        assertEquals(20, config.rateLimit().windowSize());
        assertEquals(0.7, config.rateLimit().jitterMinSeconds());
        assertEquals(1.5, config.rateLimit().jitterMaxSeconds());
        assertEquals(0.65, config.validation().acceptThreshold());
        assertEquals(3, config.validation().minSegmentLength());
    }

    @Test
    @DisplayName("An empty config yields the defaults")
    void testEmptyConfig() {
        assertEquals(EngineConfig.defaults(), EngineConfig.fromConfig(configOf(Map.of())));
    }

    @Test
    @DisplayName("Config values override individual settings")
    void testOverrides() {
        EngineConfig config = EngineConfig.fromConfig(configOf(Map.of(
                "reference-matching.cache.directory", "/var/cache/prices",
                "reference-matching.cache.ttl-found-days", "7",
                "reference-matching.cache.enabled", "false",
                "reference-matching.rate-limit.min-gap-seconds", "3.0",
                "reference-matching.rate-limit.window-size", "10",
                "reference-matching.validation.accept-threshold", "0.8",
                "reference-matching.validation.min-segment-length", "4",
                "reference-matching.lock.stripes", "16")));

        assertEquals(Path.of("/var/cache/prices"), config.cache().directory());
        assertEquals(Duration.ofDays(7), config.cache().ttlFound());
        assertEquals(Duration.ofDays(4), config.cache().ttlNotFound());
        assertFalse(config.cache().enabled());
        assertEquals(3.0, config.rateLimit().minGapSeconds());
        assertEquals(10, config.rateLimit().windowSize());
        assertEquals(0.8, config.validation().acceptThreshold());
        assertEquals(4, config.validation().minSegmentLength());
        assertEquals(16, config.lock().stripes());
    }

    @Test
    @DisplayName("Unconvertible values fail with a configuration error naming the property")
    void testUnconvertible() {
        Config config = configOf(Map.of("reference-matching.rate-limit.window-size", "twenty"));

        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> EngineConfig.fromConfig(config));
        assertTrue(e.getMessage().contains("rate-limit.window-size"));
    }

    @Test
    @DisplayName("Out-of-range values fail with a configuration error")
    void testOutOfRange() {
        assertThrows(ConfigurationException.class, () -> EngineConfig.fromConfig(
                configOf(Map.of("reference-matching.rate-limit.circuit-threshold", "1.2"))));
        assertThrows(ConfigurationException.class, () -> EngineConfig.fromConfig(
                configOf(Map.of("reference-matching.validation.min-segment-length", "0"))));
    }
}
