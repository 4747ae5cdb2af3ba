package com.memory.graph.pipeline;

/**
 * States of a single extraction run.
 */
public enum ExtractionState {
    IDLE,
    ASSEMBLING,
    CALLING,
    VALIDATING,
    FALLING_BACK,
    SUCCEEDED,
    FAILED
}
