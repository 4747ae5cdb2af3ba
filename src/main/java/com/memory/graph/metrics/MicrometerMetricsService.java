package com.memory.graph.metrics;

import com.memory.graph.core.model.EntityKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code memory.extraction.duration}: Timer (tags: provider, outcome)</li>
 *   <li>{@code memory.provider.calls}: Counter (tag: provider)</li>
 *   <li>{@code memory.extraction.fallbacks}: Counter (tags: provider, cause)</li>
 *   <li>{@code memory.extraction.failures}: Counter (tag: errorKind)</li>
 *   <li>{@code memory.entity.created}: Counter (tag: kind)</li>
 *   <li>{@code memory.entity.merged}: Counter (tag: kind)</li>
 *   <li>{@code memory.relation.created}: Counter</li>
 *   <li>{@code memory.plan.size}: DistributionSummary</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Counter relationCreatedCounter;
    private final DistributionSummary planSizeSummary;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.relationCreatedCounter = Counter.builder("memory.relation.created")
                .description("Number of relations created")
                .register(registry);
        this.planSizeSummary = DistributionSummary.builder("memory.plan.size")
                .description("Mutations per applied plan")
                .register(registry);
    }

    @Override
    public void recordExtractionDuration(String provider, String outcome, Duration duration) {
        String key = provider + ":" + outcome;
        Timer timer = timerCache.computeIfAbsent(key, k ->
                Timer.builder("memory.extraction.duration")
                        .description("Duration of extraction runs")
                        .tag("provider", provider)
                        .tag("outcome", outcome)
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void incrementProviderCall(String provider) {
        counter("calls:" + provider, "memory.provider.calls", "Provider calls, retries included",
                "provider", provider).increment();
    }

    @Override
    public void incrementFallback(String provider, String cause) {
        String key = "fallback:" + provider + ":" + cause;
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("memory.extraction.fallbacks")
                        .description("Extractions served by the fallback heuristic")
                        .tag("provider", provider)
                        .tag("cause", cause)
                        .register(registry));
        counter.increment();
    }

    @Override
    public void incrementExtractionFailed(String errorKind) {
        counter("failed:" + errorKind, "memory.extraction.failures", "Failed extractions",
                "errorKind", errorKind).increment();
    }

    @Override
    public void incrementEntityCreated(EntityKind kind) {
        counter("created:" + kind.name(), "memory.entity.created", "Entities created",
                "kind", kind.name()).increment();
    }

    @Override
    public void incrementEntityMerged(EntityKind kind) {
        counter("merged:" + kind.name(), "memory.entity.merged", "Entities merged into existing nodes",
                "kind", kind.name()).increment();
    }

    @Override
    public void incrementRelationCreated() {
        relationCreatedCounter.increment();
    }

    @Override
    public void recordPlanSize(int mutations) {
        planSizeSummary.record(mutations);
    }

    private Counter counter(String key, String name, String description, String tagKey, String tagValue) {
        return counterCache.computeIfAbsent(key, k ->
                Counter.builder(name)
                        .description(description)
                        .tag(tagKey, tagValue)
                        .register(registry));
    }
}
