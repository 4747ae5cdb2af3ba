package com.memory.graph.metrics;

import com.memory.graph.core.model.EntityKind;

import java.time.Duration;

/**
 * Records extraction and graph-write metrics.
 * The default {@link NoOpMetricsService} does nothing, so the service runs without a
 * metrics backend.
 */
public interface MetricsService {

    void recordExtractionDuration(String provider, String outcome, Duration duration);

    void incrementProviderCall(String provider);

    void incrementFallback(String provider, String cause);

    void incrementExtractionFailed(String errorKind);

    void incrementEntityCreated(EntityKind kind);

    void incrementEntityMerged(EntityKind kind);

    void incrementRelationCreated();

    void recordPlanSize(int mutations);
}
