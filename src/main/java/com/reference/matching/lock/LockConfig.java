package com.reference.matching.lock;

/**
 * Configuration for keyed lock implementations.
 *
 * @param timeoutMs maximum time to wait for lock acquisition; covers a full
 *                  throttled fetch by another caller
 * @param stripes   number of lock stripes
 */
public record LockConfig(long timeoutMs, int stripes) {

    public LockConfig {
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be > 0");
        }
        if (stripes <= 0) {
            throw new IllegalArgumentException("stripes must be > 0");
        }
    }

    /**
     * Default configuration: 5 minute timeout, 64 stripes.
     */
    public static LockConfig defaults() {
        return new LockConfig(300_000, 64);
    }
}
