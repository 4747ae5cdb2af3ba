package com.memory.graph.dispatch;

/**
 * Sizing of the extraction worker pool.
 *
 * @param workers       number of worker threads
 * @param queueCapacity maximum number of queued jobs; submissions beyond it are rejected
 */
public record DispatcherConfig(int workers, int queueCapacity) {

    public DispatcherConfig {
        if (workers <= 0) {
            throw new IllegalArgumentException("workers must be > 0");
        }
        if (queueCapacity <= 0) {
            throw new IllegalArgumentException("queueCapacity must be > 0");
        }
    }

    /**
     * Default configuration: 4 workers, 256 queued jobs.
     */
    public static DispatcherConfig defaults() {
        return new DispatcherConfig(4, 256);
    }
}
