package com.memory.graph.pipeline.observer;

import com.memory.graph.metrics.MetricsService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.mockito.Mockito.*;

@DisplayName("MetricsObserver Tests")
class MetricsObserverTest {

    private final MetricsService metrics = mock(MetricsService.class);
    private final MetricsObserver observer = new MetricsObserver(metrics);

    @Test
    @DisplayName("Provider calls are counted")
    void providerCalls() {
        observer.onEvent(PipelineEvent.providerCalled("e1", "ollama/test", 1, Duration.ZERO));

        verify(metrics).incrementProviderCall("ollama/test");
    }

    @Test
    @DisplayName("Fallbacks carry their cause")
    void fallback() {
        observer.onEvent(PipelineEvent.fellBack("e1", "ollama/test", "TIMEOUT", "slow", Duration.ofSeconds(1)));

        verify(metrics).incrementFallback("ollama/test", "TIMEOUT");
    }

    @Test
    @DisplayName("Terminal events record duration and outcome")
    void terminalEvents() {
        observer.onEvent(PipelineEvent.succeeded("e1", "ollama/test", 1, Duration.ofMillis(40)));
        observer.onEvent(PipelineEvent.failed("e2", "ollama/test", "AUTH_FAILURE", "bad key", Duration.ofMillis(5)));

        verify(metrics).recordExtractionDuration("ollama/test", "succeeded", Duration.ofMillis(40));
        verify(metrics).recordExtractionDuration("ollama/test", "failed", Duration.ofMillis(5));
        verify(metrics).incrementExtractionFailed("AUTH_FAILURE");
    }

    @Test
    @DisplayName("Start events record nothing")
    void started() {
        observer.onEvent(PipelineEvent.started("e1", "ollama/test"));

        verifyNoInteractions(metrics);
    }
}
