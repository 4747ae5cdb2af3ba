package com.memory.graph.metrics;

import com.memory.graph.core.model.EntityKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MetricsService Tests")
class MetricsServiceTest {

    @Nested
    @DisplayName("NoOpMetricsService")
    class NoOpTests {

        @Test
        @DisplayName("All methods should be callable without error")
        void allMethodsCallableWithoutError() {
            NoOpMetricsService noOp = new NoOpMetricsService();

            assertDoesNotThrow(() -> {
                noOp.recordExtractionDuration("ollama/test", "succeeded", Duration.ofMillis(100));
                noOp.incrementProviderCall("ollama/test");
                noOp.incrementFallback("ollama/test", "TIMEOUT");
                noOp.incrementExtractionFailed("AUTH_FAILURE");
                noOp.incrementEntityCreated(EntityKind.PERSON);
                noOp.incrementEntityMerged(EntityKind.LOCATION);
                noOp.incrementRelationCreated();
                noOp.recordPlanSize(3);
            });
        }
    }

    @Nested
    @DisplayName("MicrometerMetricsService")
    class MicrometerTests {

        private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
        private final MicrometerMetricsService metrics = new MicrometerMetricsService(registry);

        @Test
        @DisplayName("Extraction durations are timed per provider and outcome")
        void extractionDuration() {
            metrics.recordExtractionDuration("ollama/test", "succeeded", Duration.ofMillis(150));
            metrics.recordExtractionDuration("ollama/test", "succeeded", Duration.ofMillis(250));
            metrics.recordExtractionDuration("ollama/test", "failed", Duration.ofMillis(50));

            Timer succeeded = registry.find("memory.extraction.duration")
                    .tag("provider", "ollama/test")
                    .tag("outcome", "succeeded")
                    .timer();

            assertNotNull(succeeded);
            assertEquals(2, succeeded.count());
        }

        @Test
        @DisplayName("Entity counters are tagged by kind")
        void entityCounters() {
            metrics.incrementEntityCreated(EntityKind.PERSON);
            metrics.incrementEntityCreated(EntityKind.PERSON);
            metrics.incrementEntityMerged(EntityKind.LOCATION);

            Counter created = registry.find("memory.entity.created").tag("kind", "PERSON").counter();
            Counter merged = registry.find("memory.entity.merged").tag("kind", "LOCATION").counter();

            assertNotNull(created);
            assertEquals(2.0, created.count());
            assertNotNull(merged);
            assertEquals(1.0, merged.count());
        }

        @Test
        @DisplayName("Fallbacks and failures are counted with their cause")
        void fallbacksAndFailures() {
            metrics.incrementFallback("openai/gpt-4.1", "RATE_LIMITED");
            metrics.incrementExtractionFailed("TIMEOUT");
            metrics.incrementExtractionFailed("TIMEOUT");

            assertEquals(1.0, registry.find("memory.extraction.fallbacks")
                    .tag("cause", "RATE_LIMITED").counter().count());
            assertEquals(2.0, registry.find("memory.extraction.failures")
                    .tag("errorKind", "TIMEOUT").counter().count());
        }

        @Test
        @DisplayName("Plan sizes are summarized")
        void planSize() {
            metrics.recordPlanSize(2);
            metrics.recordPlanSize(6);
            metrics.incrementRelationCreated();

            DistributionSummary summary = registry.find("memory.plan.size").summary();
            assertNotNull(summary);
            assertEquals(2, summary.count());
            assertEquals(8.0, summary.totalAmount());
            assertEquals(1.0, registry.find("memory.relation.created").counter().count());
        }
    }
}
