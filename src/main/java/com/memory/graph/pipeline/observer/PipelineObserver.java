package com.memory.graph.pipeline.observer;

/**
 * Side-channel listener for extraction lifecycle events.
 * Observers cannot influence the pipeline; exceptions they throw are logged and ignored.
 */
@FunctionalInterface
public interface PipelineObserver {

    void onEvent(PipelineEvent event);
}
