package com.memory.graph.pipeline.observer;

/**
 * Lifecycle events published during an extraction run.
 */
public enum PipelineEventType {
    STARTED,
    PROVIDER_CALLED,
    FELL_BACK,
    SUCCEEDED,
    FAILED
}
