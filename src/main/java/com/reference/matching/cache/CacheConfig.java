package com.reference.matching.cache;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * Configuration for the per-store result caches.
 *
 * @param directory      directory holding one cache file per store
 * @param ttlFound       how long an accepted verdict is served
 * @param ttlNotFound    how long a rejected verdict is served
 * @param maxSize        maximum number of entries held in memory per store
 * @param flushBatchSize number of writes after which pending changes are written to disk;
 *                       1 makes every store durable before it returns
 * @param enabled        whether caching is enabled
 */
public record CacheConfig(
        Path directory,
        Duration ttlFound,
        Duration ttlNotFound,
        int maxSize,
        int flushBatchSize,
        boolean enabled
) {

    public CacheConfig {
        Objects.requireNonNull(directory, "directory is required");
        Objects.requireNonNull(ttlFound, "ttlFound is required");
        Objects.requireNonNull(ttlNotFound, "ttlNotFound is required");
        if (ttlFound.isNegative() || ttlFound.isZero()) {
            throw new IllegalArgumentException("ttlFound must be > 0");
        }
        if (ttlNotFound.isNegative() || ttlNotFound.isZero()) {
            throw new IllegalArgumentException("ttlNotFound must be > 0");
        }
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
        if (flushBatchSize <= 0) {
            throw new IllegalArgumentException("flushBatchSize must be > 0");
        }
    }

    /**
     * Default cache configuration: ./cache, found kept 10 days, not found 4 days,
     * 100,000 entries per store, durable on every write.
     */
    public static CacheConfig defaults() {
        return new CacheConfig(Path.of("cache"), Duration.ofDays(10), Duration.ofDays(4), 100_000, 1, true);
    }

    /**
     * Disabled cache configuration.
     */
    public static CacheConfig disabled() {
        return new CacheConfig(Path.of("cache"), Duration.ofDays(10), Duration.ofDays(4), 1, 1, false);
    }

    /**
     * Returns a copy of this configuration rooted at another directory.
     */
    public CacheConfig withDirectory(Path newDirectory) {
        return new CacheConfig(newDirectory, ttlFound, ttlNotFound, maxSize, flushBatchSize, enabled);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Path directory = Path.of("cache");
        private Duration ttlFound = Duration.ofDays(10);
        private Duration ttlNotFound = Duration.ofDays(4);
        private int maxSize = 100_000;
        private int flushBatchSize = 1;
        private boolean enabled = true;

        public Builder directory(Path directory) {
            this.directory = directory;
            return this;
        }

        public Builder ttlFound(Duration ttlFound) {
            this.ttlFound = ttlFound;
            return this;
        }

        public Builder ttlNotFound(Duration ttlNotFound) {
            this.ttlNotFound = ttlNotFound;
            return this;
        }

        public Builder maxSize(int maxSize) {
            this.maxSize = maxSize;
            return this;
        }

        public Builder flushBatchSize(int flushBatchSize) {
            this.flushBatchSize = flushBatchSize;
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public CacheConfig build() {
            return new CacheConfig(directory, ttlFound, ttlNotFound, maxSize, flushBatchSize, enabled);
        }
    }
}
