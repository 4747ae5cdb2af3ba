package com.memory.graph.metrics;

import com.memory.graph.core.model.EntityKind;

import java.time.Duration;

/**
 * Metrics sink used when metrics are disabled.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordExtractionDuration(String provider, String outcome, Duration duration) {
    }

    @Override
    public void incrementProviderCall(String provider) {
    }

    @Override
    public void incrementFallback(String provider, String cause) {
    }

    @Override
    public void incrementExtractionFailed(String errorKind) {
    }

    @Override
    public void incrementEntityCreated(EntityKind kind) {
    }

    @Override
    public void incrementEntityMerged(EntityKind kind) {
    }

    @Override
    public void incrementRelationCreated() {
    }

    @Override
    public void recordPlanSize(int mutations) {
    }
}
