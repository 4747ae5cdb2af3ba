package com.memory.graph.lock;

/**
 * Configuration for {@link LocalDistributedLock}.
 *
 * @param timeoutMs maximum time to wait for each lock
 * @param stripes   number of lock stripes identity keys are hashed onto
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
     * Default configuration: 5s timeout, 256 stripes.
     */
    public static LockConfig defaults() {
        return new LockConfig(5000, 256);
    }
}
