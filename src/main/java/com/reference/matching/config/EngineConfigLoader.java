package com.reference.matching.config;

import io.smallrye.config.PropertiesConfigSource;
import io.smallrye.config.SmallRyeConfigBuilder;
import org.eclipse.microprofile.config.Config;
import org.eclipse.microprofile.config.ConfigProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Loads {@link EngineConfig} through SmallRye Config.
 *
 * <p>Sources by descending precedence:</p>
 * <ol>
 *   <li>JVM system properties ({@code -Dreference-matching.cache.enabled=false})</li>
 *   <li>environment variables ({@code REFERENCE_MATCHING_CACHE_ENABLED=false})</li>
 *   <li>an explicit properties file, if given</li>
 *   <li>{@code META-INF/microprofile-config.properties} on the classpath</li>
 * </ol>
 */
public final class EngineConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(EngineConfigLoader.class);

    /** Between the classpath defaults (100) and environment variables (300). */
    static final int FILE_ORDINAL = 250;

    private EngineConfigLoader() {
        // Utility class
    }

    /**
     * Loads configuration from the default sources.
     */
    public static EngineConfig load() {
        return load(null);
    }

    /**
     * Loads configuration, adding the given properties file above the classpath defaults.
     *
     * @param file optional properties file; ignored when null
     * @throws ConfigurationException if the file cannot be read or holds invalid values
     */
    public static EngineConfig load(Path file) {
        SmallRyeConfigBuilder builder = new SmallRyeConfigBuilder()
                .forClassLoader(classLoader())
                .addDefaultSources()
                .addDefaultInterceptors();
        if (file != null) {
            if (!Files.isReadable(file)) {
                throw new ConfigurationException("Cannot read configuration file " + file);
            }
            try {
                builder.withSources(new PropertiesConfigSource(file.toUri().toURL(), FILE_ORDINAL));
            } catch (IOException e) {
                throw new ConfigurationException("Cannot read configuration file " + file, e);
            }
            log.info("config.loaded source={}", file);
        }
        return EngineConfig.fromConfig(builder.build());
    }

    /**
     * Builds configuration from explicit values only, without system or classpath sources.
     */
    public static EngineConfig fromValues(Map<String, String> values) {
        Config config = new SmallRyeConfigBuilder()
                .withSources(new PropertiesConfigSource(values, "engine-values", FILE_ORDINAL))
                .build();
        return EngineConfig.fromConfig(config);
    }

    /**
     * Reads configuration from the application's MicroProfile Config, as seen
     * inside a container that already provides one.
     */
    public static EngineConfig fromProvider() {
        return EngineConfig.fromConfig(ConfigProvider.getConfig(classLoader()));
    }

    private static ClassLoader classLoader() {
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        return loader != null ? loader : EngineConfigLoader.class.getClassLoader();
    }
}
