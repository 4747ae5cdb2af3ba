package com.memory.graph.pipeline;

import java.time.Duration;

/**
 * Waits between retries. Replaced in tests to avoid real delays.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
