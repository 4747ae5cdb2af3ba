package com.memory.graph.pipeline.observer;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Immutable payload delivered to {@link PipelineObserver}s.
 *
 * @param type      event type
 * @param entryId   entry being extracted
 * @param provider  provider name involved in the event
 * @param attempt   provider attempt number (1-based), 0 when not applicable
 * @param latency   time since the run started, {@code null} for STARTED
 * @param errorKind failure or fallback cause, {@code null} otherwise
 * @param message   free-form detail, may be {@code null}
 * @param timestamp when the event was created
 */
public record PipelineEvent(
        PipelineEventType type,
        String entryId,
        String provider,
        int attempt,
        Duration latency,
        String errorKind,
        String message,
        Instant timestamp
) {
    public PipelineEvent {
        Objects.requireNonNull(type, "type is required");
        Objects.requireNonNull(entryId, "entryId is required");
        timestamp = timestamp != null ? timestamp : Instant.now();
    }

    public static PipelineEvent started(String entryId, String provider) {
        return new PipelineEvent(PipelineEventType.STARTED, entryId, provider, 0, null, null, null, null);
    }

    public static PipelineEvent providerCalled(String entryId, String provider, int attempt, Duration latency) {
        return new PipelineEvent(PipelineEventType.PROVIDER_CALLED, entryId, provider, attempt, latency, null, null, null);
    }

    public static PipelineEvent fellBack(String entryId, String provider, String cause, String message, Duration latency) {
        return new PipelineEvent(PipelineEventType.FELL_BACK, entryId, provider, 0, latency, cause, message, null);
    }

    public static PipelineEvent succeeded(String entryId, String provider, int attempts, Duration latency) {
        return new PipelineEvent(PipelineEventType.SUCCEEDED, entryId, provider, attempts, latency, null, null, null);
    }

    public static PipelineEvent failed(String entryId, String provider, String errorKind, String message, Duration latency) {
        return new PipelineEvent(PipelineEventType.FAILED, entryId, provider, 0, latency, errorKind, message, null);
    }
}
