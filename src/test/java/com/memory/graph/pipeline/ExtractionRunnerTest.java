package com.memory.graph.pipeline;

import com.memory.graph.context.TokenBudget;
import com.memory.graph.pipeline.observer.PipelineEventType;
import com.memory.graph.pipeline.observer.PipelineObservers;
import com.memory.graph.provider.ExtractionProvider;
import com.memory.graph.provider.ProviderConfig;
import com.memory.graph.provider.ProviderErrorKind;
import com.memory.graph.provider.ProviderException;
import com.memory.graph.provider.ProviderKind;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@DisplayName("ExtractionRunner Tests")
class ExtractionRunnerTest {

    private static final String VALID_OUTPUT = """
            {"entities":[{"name":"Alice","kind":"PERSON"},{"name":"Paris","kind":"LOCATION"}],
             "relations":[{"source":"Alice","target":"Paris","kind":"VISITED"}]}""";

    private ExtractionProvider provider;
    private List<Duration> sleeps;
    private List<PipelineEventType> events;
    private PipelineObservers observers;
    private ExtractionRunner runner;

    @BeforeEach
    void setUp() {
        provider = mock(ExtractionProvider.class);
        when(provider.getProviderName()).thenReturn("ollama/test");
        when(provider.getKind()).thenReturn(ProviderKind.OLLAMA);
        sleeps = new ArrayList<>();
        events = new CopyOnWriteArrayList<>();
        observers = new PipelineObservers().register(event -> events.add(event.type()));
    }

    @AfterEach
    void tearDown() {
        if (runner != null) {
            runner.close();
        }
    }

    private ExtractionRunner runner(ProviderConfig config) {
        runner = ExtractionRunner.builder()
                .config(config)
                .provider(provider)
                .observers(observers)
                .sleeper(sleeps::add)
                .build();
        return runner;
    }

    private static ProviderConfig.Builder config() {
        return ProviderConfig.builder().provider(ProviderKind.OLLAMA);
    }

    @Nested
    @DisplayName("Successful runs")
    class Success {

        @Test
        @DisplayName("Valid output becomes a result on the first attempt")
        void firstAttempt() throws Exception {
            when(provider.extract(anyString(), any())).thenReturn(VALID_OUTPUT);

            ExtractionResult result = runner(config().build()).run("entry-1", "Alice visited Paris.");

            assertEquals(2, result.entities().size());
            assertEquals(1, result.relations().size());
            assertEquals("ollama/test", result.providerName());
            assertEquals(1, result.attempts());
            assertFalse(result.degraded());
            assertFalse(result.truncated());
            assertEquals(List.of(PipelineEventType.STARTED, PipelineEventType.PROVIDER_CALLED,
                    PipelineEventType.SUCCEEDED), events);
        }

        @Test
        @DisplayName("Text beyond the segment budget is dropped and flagged")
        void truncation() throws Exception {
            when(provider.extract(anyString(), any())).thenReturn("{\"entities\":[],\"relations\":[]}");
            ProviderConfig config = config()
                    .contextWindowTokens(TokenBudget.PROMPT_RESERVE_TOKENS + 5)
                    .maxSegments(1)
                    .build();

            ExtractionResult result = runner(config).run("entry-1", "Alice met Bob. Carol met Dan. Erin met Finn.");

            assertTrue(result.truncated());
            verify(provider, times(1)).extract(eq("Alice met Bob."), any());
        }

        @Test
        @DisplayName("A throwing observer does not change the outcome")
        void failingObserver() throws Exception {
            when(provider.extract(anyString(), any())).thenReturn(VALID_OUTPUT);
            observers.register(event -> {
                throw new IllegalStateException("observer broke");
            });

            ExtractionResult result = runner(config().build()).run("entry-1", "Alice visited Paris.");

            assertEquals(2, result.entities().size());
            assertTrue(events.contains(PipelineEventType.SUCCEEDED));
        }
    }

    @Nested
    @DisplayName("Retry policy")
    class Retries {

        @Test
        @DisplayName("Transient errors are retried with doubling backoff")
        void retriesTransientErrors() throws Exception {
            when(provider.extract(anyString(), any()))
                    .thenThrow(new ProviderException(ProviderErrorKind.NETWORK_ERROR, "refused"))
                    .thenThrow(new ProviderException(ProviderErrorKind.RATE_LIMITED, "slow down"))
                    .thenReturn(VALID_OUTPUT);

            ExtractionResult result = runner(config().maxRetries(2).build()).run("entry-1", "Alice visited Paris.");

            assertEquals(3, result.attempts());
            assertEquals(List.of(Duration.ofMillis(500), Duration.ofMillis(1000)), sleeps);
        }

        @Test
        @DisplayName("At most maxRetries + 1 calls are made")
        void retryBound() throws Exception {
            when(provider.extract(anyString(), any()))
                    .thenThrow(new ProviderException(ProviderErrorKind.TIMEOUT, "slow"));

            ExtractionFailedException e = assertThrows(ExtractionFailedException.class,
                    () -> runner(config().maxRetries(2).build()).run("entry-1", "Alice visited Paris."));

            assertEquals(ExtractionFailureKind.TIMEOUT, e.getKind());
            verify(provider, times(3)).extract(anyString(), any());
            assertEquals(PipelineEventType.FAILED, events.get(events.size() - 1));
        }

        @Test
        @DisplayName("Authentication failures are not retried")
        void authFailureNotRetried() throws Exception {
            when(provider.extract(anyString(), any()))
                    .thenThrow(new ProviderException(ProviderErrorKind.AUTH_FAILURE, "bad key"));

            ExtractionFailedException e = assertThrows(ExtractionFailedException.class,
                    () -> runner(config().maxRetries(3).build()).run("entry-1", "Alice visited Paris."));

            assertEquals(ExtractionFailureKind.AUTH_FAILURE, e.getKind());
            assertEquals("AUTH_FAILURE: bad key", e.toErrorDetail());
            verify(provider, times(1)).extract(anyString(), any());
            assertTrue(sleeps.isEmpty());
        }

        @Test
        @DisplayName("Invalid output is not retried")
        void invalidOutputNotRetried() throws Exception {
            when(provider.extract(anyString(), any())).thenReturn("I could not find anything.");

            ExtractionFailedException e = assertThrows(ExtractionFailedException.class,
                    () -> runner(config().maxRetries(3).build()).run("entry-1", "Alice visited Paris."));

            assertEquals(ExtractionFailureKind.INVALID_RESPONSE, e.getKind());
            verify(provider, times(1)).extract(anyString(), any());
        }

        @Test
        @DisplayName("A provider that hangs is cut off at the timeout")
        void hangingProvider() throws Exception {
            when(provider.extract(anyString(), any())).thenAnswer(invocation -> {
                Thread.sleep(5_000);
                return VALID_OUTPUT;
            });
            ProviderConfig config = config().timeout(Duration.ofMillis(100)).maxRetries(0).build();

            long start = System.nanoTime();
            ExtractionFailedException e = assertThrows(ExtractionFailedException.class,
                    () -> runner(config).run("entry-1", "Alice visited Paris."));

            assertEquals(ExtractionFailureKind.TIMEOUT, e.getKind());
            assertTrue(Duration.ofNanos(System.nanoTime() - start).compareTo(Duration.ofSeconds(2)) < 0);
        }
    }

    @Nested
    @DisplayName("Fallback")
    class Fallback {

        @Test
        @DisplayName("With fallback allowed, the heuristic result is returned as degraded")
        void degradedResult() throws Exception {
            when(provider.extract(anyString(), any()))
                    .thenThrow(new ProviderException(ProviderErrorKind.AUTH_FAILURE, "bad key"));

            ExtractionResult result = runner(config().fallbackAllowed(true).build())
                    .run("entry-1", "Alice visited Paris.");

            assertTrue(result.degraded());
            assertEquals("local-heuristic", result.providerName());
            assertEquals(List.of("Alice", "Paris"),
                    result.entities().stream().map(CandidateEntity::name).toList());
            assertTrue(events.contains(PipelineEventType.FELL_BACK));
        }

        @Test
        @DisplayName("Without fallback the provider error is final")
        void noFallback() throws Exception {
            when(provider.extract(anyString(), any()))
                    .thenThrow(new ProviderException(ProviderErrorKind.INVALID_RESPONSE, "empty generation"));

            assertThrows(ExtractionFailedException.class,
                    () -> runner(config().fallbackAllowed(false).build()).run("entry-1", "Alice visited Paris."));
            assertFalse(events.contains(PipelineEventType.FELL_BACK));
        }
    }

    @Nested
    @DisplayName("Failures before any call")
    class EarlyFailures {

        @Test
        @DisplayName("Blank text is malformed input")
        void blankText() throws Exception {
            ExtractionFailedException e = assertThrows(ExtractionFailedException.class,
                    () -> runner(config().build()).run("entry-1", "   "));

            assertEquals(ExtractionFailureKind.MALFORMED_INPUT, e.getKind());
            verify(provider, never()).extract(anyString(), any());
        }

        @Test
        @DisplayName("An interrupted caller ends the run as cancelled")
        void interrupted() throws Exception {
            ExtractionRunner interruptedRunner = runner(config().build());
            Thread.currentThread().interrupt();
            try {
                ExtractionFailedException e = assertThrows(ExtractionFailedException.class,
                        () -> interruptedRunner.run("entry-1", "Alice visited Paris."));
                assertEquals(ExtractionFailureKind.CANCELLED, e.getKind());
            } finally {
                assertTrue(Thread.interrupted());
            }
            verify(provider, never()).extract(anyString(), any());
        }
    }
}
