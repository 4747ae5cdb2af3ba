package com.memory.graph.pipeline;

import com.memory.graph.context.AssembledContext;
import com.memory.graph.context.ContextAssembler;
import com.memory.graph.core.ValidationException;
import com.memory.graph.logging.LogContext;
import com.memory.graph.pipeline.observer.PipelineEvent;
import com.memory.graph.pipeline.observer.PipelineObservers;
import com.memory.graph.provider.ExtractionProvider;
import com.memory.graph.provider.LocalHeuristicProvider;
import com.memory.graph.provider.ProviderConfig;
import com.memory.graph.provider.ProviderErrorKind;
import com.memory.graph.provider.ProviderException;
import com.memory.graph.provider.ProviderKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one extraction through the configured provider and applies the timeout, retry and
 * fallback policy.
 *
 * <p>State machine: {@code IDLE -> ASSEMBLING -> CALLING -> VALIDATING -> SUCCEEDED}, with
 * {@code FALLING_BACK} or {@code FAILED} when the provider cannot deliver valid output.</p>
 * <ul>
 *   <li>Each attempt is bounded by {@link ProviderConfig#timeout()}.</li>
 *   <li>{@code TIMEOUT}, {@code NETWORK_ERROR} and {@code RATE_LIMITED} are retried up to
 *       {@link ProviderConfig#maxRetries()} times with exponential backoff.</li>
 *   <li>Invalid output is never retried; it is handled like any other provider failure.</li>
 *   <li>With fallback allowed, the local heuristic produces a result flagged {@code degraded};
 *       otherwise the run fails with the last provider error.</li>
 *   <li>Interruption ends the run with {@link ExtractionFailureKind#CANCELLED}.</li>
 * </ul>
 *
 * <p>Usage:</p>
 * <pre>
 * ExtractionRunner runner = ExtractionRunner.builder()
 *     .config(config)
 *     .provider(new ProviderFactory(config).create(config))
 *     .observers(observers)
 *     .build();
 * ExtractionResult result = runner.run(entryId, text);
 * </pre>
 */
public class ExtractionRunner implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ExtractionRunner.class);

    private final ProviderConfig config;
    private final ExtractionProvider provider;
    private final LocalHeuristicProvider fallbackProvider;
    private final ContextAssembler assembler;
    private final ExtractionOutputParser parser;
    private final PipelineObservers observers;
    private final Sleeper sleeper;
    private final ExecutorService callExecutor;

    private ExtractionRunner(Builder builder) {
        this.config = builder.config;
        this.provider = builder.provider;
        this.fallbackProvider = builder.fallbackProvider != null ? builder.fallbackProvider : new LocalHeuristicProvider();
        this.assembler = builder.assembler != null ? builder.assembler : new ContextAssembler();
        this.parser = builder.parser != null ? builder.parser : new ExtractionOutputParser();
        this.observers = builder.observers != null ? builder.observers : new PipelineObservers();
        this.sleeper = builder.sleeper != null ? builder.sleeper : Sleeper.SYSTEM;
        this.callExecutor = Executors.newCachedThreadPool(new CallThreadFactory());
    }

    /**
     * Extracts candidates from an entry's text.
     *
     * @param entryId entry being processed, used for events and logging
     * @param text    raw entry text
     * @return the validated result
     * @throws ExtractionFailedException if the run ends in {@link ExtractionState#FAILED}
     */
    public ExtractionResult run(String entryId, String text) {
        long startNanos = System.nanoTime();
        String providerName = provider.getProviderName();
        observers.publish(PipelineEvent.started(entryId, providerName));

        try (LogContext ignored = LogContext.forExtraction(entryId, providerName)) {
            ExtractionState state = transition(entryId, ExtractionState.IDLE, ExtractionState.ASSEMBLING);
            AssembledContext context;
            try {
                context = assembler.assemble(text, config.tokenBudget());
            } catch (ValidationException e) {
                throw fail(entryId, providerName, ExtractionFailureKind.MALFORMED_INPUT, e.getMessage(), e, startNanos);
            }
            if (context.truncated()) {
                log.warn("extraction.truncated entryId={} segmentsKept={} maxSegments={}",
                        entryId, context.segments().size(), config.maxSegments());
            }

            AtomicInteger attempts = new AtomicInteger();
            try {
                state = transition(entryId, state, ExtractionState.CALLING);
                ParsedExtraction parsed = extractSegments(entryId, context, attempts, startNanos);
                transition(entryId, state, ExtractionState.SUCCEEDED);
                return succeed(entryId, providerName, parsed, context, false, attempts.get(), startNanos);
            } catch (ProviderException e) {
                if (!config.fallbackAllowed() || provider.getKind() == ProviderKind.LOCAL) {
                    transition(entryId, state, ExtractionState.FAILED);
                    throw fail(entryId, providerName, ExtractionFailureKind.from(e.getKind()),
                            e.getMessage(), e, startNanos);
                }
                transition(entryId, state, ExtractionState.FALLING_BACK);
                observers.publish(PipelineEvent.fellBack(entryId, providerName, e.getKind().name(),
                        e.getMessage(), elapsed(startNanos)));
                ParsedExtraction parsed = runFallback(entryId, context, startNanos);
                transition(entryId, ExtractionState.FALLING_BACK, ExtractionState.SUCCEEDED);
                return succeed(entryId, fallbackProvider.getProviderName(), parsed, context, true,
                        attempts.get(), startNanos);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                transition(entryId, state, ExtractionState.FAILED);
                throw fail(entryId, providerName, ExtractionFailureKind.CANCELLED,
                        "Extraction cancelled", e, startNanos);
            }
        }
    }

    @Override
    public void close() {
        callExecutor.shutdownNow();
    }

    private ParsedExtraction extractSegments(String entryId, AssembledContext context,
                                             AtomicInteger attempts, long startNanos)
            throws ProviderException, InterruptedException {
        List<ParsedExtraction> parts = new ArrayList<>();
        for (String segment : context.segments()) {
            parts.add(callWithRetry(entryId, segment, attempts, startNanos));
        }
        return parts.size() == 1 ? parts.get(0) : ParsedExtraction.combine(parts);
    }

    private ParsedExtraction callWithRetry(String entryId, String segment, AtomicInteger attempts, long startNanos)
            throws ProviderException, InterruptedException {
        int attempt = 0;
        while (true) {
            attempt++;
            attempts.incrementAndGet();
            observers.publish(PipelineEvent.providerCalled(entryId, provider.getProviderName(), attempt,
                    elapsed(startNanos)));
            try {
                String raw = callOnce(segment);
                log.debug("extraction.validating entryId={} attempt={}", entryId, attempt);
                return parser.parse(raw);
            } catch (ProviderException e) {
                if (!e.getKind().isRetryable() || attempt > config.maxRetries()) {
                    log.warn("extraction.attempt_failed entryId={} attempt={} kind={} retrying=false detail={}",
                            entryId, attempt, e.getKind(), e.getMessage());
                    throw e;
                }
                Duration backoff = config.backoffBeforeRetry(attempt);
                log.warn("extraction.attempt_failed entryId={} attempt={} kind={} retrying=true backoffMs={}",
                        entryId, attempt, e.getKind(), backoff.toMillis());
                sleeper.sleep(backoff);
            }
        }
    }

    private String callOnce(String segment) throws ProviderException, InterruptedException {
        if (Thread.currentThread().isInterrupted()) {
            throw new InterruptedException("Interrupted before provider call");
        }
        Future<String> future = callExecutor.submit(() -> provider.extract(segment, config));
        try {
            return future.get(config.timeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new ProviderException(ProviderErrorKind.TIMEOUT,
                    provider.getProviderName() + " did not answer within " + config.timeout().toMillis() + "ms");
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ProviderException providerException) {
                throw providerException;
            }
            if (cause instanceof InterruptedException) {
                throw new ProviderException(ProviderErrorKind.NETWORK_ERROR,
                        provider.getProviderName() + " call was interrupted", cause);
            }
            throw new ProviderException(ProviderErrorKind.INVALID_RESPONSE,
                    provider.getProviderName() + " raised " + cause.getClass().getSimpleName() + ": " + cause.getMessage(),
                    cause);
        }
    }

    private ParsedExtraction runFallback(String entryId, AssembledContext context, long startNanos) {
        List<ParsedExtraction> parts = new ArrayList<>();
        try {
            for (String segment : context.segments()) {
                parts.add(parser.parse(fallbackProvider.extract(segment, config)));
            }
        } catch (ProviderException e) {
            // the heuristic always emits well-formed output; reaching this is a defect
            throw fail(entryId, fallbackProvider.getProviderName(), ExtractionFailureKind.INVALID_RESPONSE,
                    e.getMessage(), e, startNanos);
        }
        return parts.size() == 1 ? parts.get(0) : ParsedExtraction.combine(parts);
    }

    private ExtractionResult succeed(String entryId, String providerName, ParsedExtraction parsed,
                                     AssembledContext context, boolean degraded, int attempts, long startNanos) {
        Duration latency = elapsed(startNanos);
        ExtractionResult result = new ExtractionResult(parsed.entities(), parsed.relations(), providerName,
                latency, context.truncated(), degraded, attempts);
        log.info("extraction.succeeded entryId={} provider={} entities={} relations={} degraded={} truncated={}",
                entryId, providerName, result.entities().size(), result.relations().size(), degraded,
                context.truncated());
        observers.publish(PipelineEvent.succeeded(entryId, providerName, attempts, latency));
        return result;
    }

    private ExtractionFailedException fail(String entryId, String providerName, ExtractionFailureKind kind,
                                           String message, Throwable cause, long startNanos) {
        observers.publish(PipelineEvent.failed(entryId, providerName, kind.name(), message, elapsed(startNanos)));
        return new ExtractionFailedException(kind, message, cause);
    }

    private static ExtractionState transition(String entryId, ExtractionState from, ExtractionState to) {
        log.debug("extraction.state entryId={} from={} to={}", entryId, from, to);
        return to;
    }

    private static Duration elapsed(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    public ProviderConfig getConfig() {
        return config;
    }

    public ExtractionProvider getProvider() {
        return provider;
    }

    public PipelineObservers getObservers() {
        return observers;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private ProviderConfig config;
        private ExtractionProvider provider;
        private LocalHeuristicProvider fallbackProvider;
        private ContextAssembler assembler;
        private ExtractionOutputParser parser;
        private PipelineObservers observers;
        private Sleeper sleeper;

        public Builder config(ProviderConfig config) {
            this.config = config;
            return this;
        }

        public Builder provider(ExtractionProvider provider) {
            this.provider = provider;
            return this;
        }

        public Builder fallbackProvider(LocalHeuristicProvider fallbackProvider) {
            this.fallbackProvider = fallbackProvider;
            return this;
        }

        public Builder assembler(ContextAssembler assembler) {
            this.assembler = assembler;
            return this;
        }

        public Builder parser(ExtractionOutputParser parser) {
            this.parser = parser;
            return this;
        }

        public Builder observers(PipelineObservers observers) {
            this.observers = observers;
            return this;
        }

        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = sleeper;
            return this;
        }

        public ExtractionRunner build() {
            Objects.requireNonNull(config, "config is required");
            Objects.requireNonNull(provider, "provider is required");
            return new ExtractionRunner(this);
        }
    }

    private static final class CallThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "extraction-call-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
