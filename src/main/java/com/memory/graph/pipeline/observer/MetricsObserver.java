package com.memory.graph.pipeline.observer;

import com.memory.graph.metrics.MetricsService;

/**
 * Bridges pipeline events to {@link MetricsService}.
 */
public class MetricsObserver implements PipelineObserver {

    private final MetricsService metrics;

    public MetricsObserver(MetricsService metrics) {
        this.metrics = metrics;
    }

    @Override
    public void onEvent(PipelineEvent event) {
        switch (event.type()) {
            case PROVIDER_CALLED -> metrics.incrementProviderCall(event.provider());
            case FELL_BACK -> metrics.incrementFallback(event.provider(), event.errorKind());
            case SUCCEEDED -> {
                if (event.latency() != null) {
                    metrics.recordExtractionDuration(event.provider(), "succeeded", event.latency());
                }
            }
            case FAILED -> {
                metrics.incrementExtractionFailed(event.errorKind());
                if (event.latency() != null) {
                    metrics.recordExtractionDuration(event.provider(), "failed", event.latency());
                }
            }
            case STARTED -> {
                // nothing to record until the run ends
            }
        }
    }
}
