package com.memory.graph.cdi;

import com.memory.graph.api.EntryIngestionService;
import com.memory.graph.dispatch.DispatcherConfig;
import com.memory.graph.dispatch.ExtractionDispatcher;
import com.memory.graph.graph.EntryRepository;
import com.memory.graph.graph.FalkorDBConnection;
import com.memory.graph.graph.FalkorEntryRepository;
import com.memory.graph.graph.FalkorGraphRepository;
import com.memory.graph.graph.GraphConnection;
import com.memory.graph.graph.GraphRepository;
import com.memory.graph.graph.InMemoryEntryRepository;
import com.memory.graph.graph.InMemoryGraphRepository;
import com.memory.graph.graph.TimeLimitedGraphConnection;
import com.memory.graph.lock.LocalDistributedLock;
import com.memory.graph.lock.LockConfig;
import com.memory.graph.metrics.MetricsService;
import com.memory.graph.metrics.MicrometerMetricsService;
import com.memory.graph.metrics.NoOpMetricsService;
import com.memory.graph.pipeline.ExtractionRunner;
import com.memory.graph.pipeline.observer.LoggingObserver;
import com.memory.graph.pipeline.observer.MetricsObserver;
import com.memory.graph.pipeline.observer.PipelineObservers;
import com.memory.graph.pipeline.observer.TracingObserver;
import com.memory.graph.provider.ProviderConfig;
import com.memory.graph.provider.ProviderConfig.AnthropicSettings;
import com.memory.graph.provider.ProviderConfig.OllamaSettings;
import com.memory.graph.provider.ProviderConfig.OpenAiSettings;
import com.memory.graph.provider.ProviderFactory;
import com.memory.graph.provider.ProviderKind;
import com.memory.graph.resolution.ResolutionCommitter;
import io.micrometer.core.instrument.Metrics;
import io.opentelemetry.api.GlobalOpenTelemetry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

/**
 * CDI producer that wires the memory graph from MicroProfile Config properties.
 *
 * <p>Defaults ship in {@code META-INF/microprofile-config.properties}; every key can be
 * overridden by the environment, e.g. {@code MEMORY_GRAPH_EXTRACTION_PROVIDER=ollama}.</p>
 *
 * <h2>Minimal configuration</h2>
 * <pre>
 * memory-graph.store=falkordb
 * memory-graph.falkordb.uri=redis://localhost:6379
 * memory-graph.extraction.provider=local
 * </pre>
 */
@ApplicationScoped
public class MemoryGraphProducer {

    private static final Logger log = LoggerFactory.getLogger(MemoryGraphProducer.class);

    // ── Store ─────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "memory-graph.store", defaultValue = "falkordb")
    String store;

    @Inject
    @ConfigProperty(name = "memory-graph.falkordb.host", defaultValue = "localhost")
    String falkordbHost;

    @Inject
    @ConfigProperty(name = "memory-graph.falkordb.port", defaultValue = "6379")
    int falkordbPort;

    @Inject
    @ConfigProperty(name = "memory-graph.falkordb.uri")
    Optional<String> falkordbUri;

    @Inject
    @ConfigProperty(name = "memory-graph.falkordb.graph-name", defaultValue = "memory-graph")
    String falkordbGraphName;

    @Inject
    @ConfigProperty(name = "memory-graph.falkordb.query-timeout-ms", defaultValue = "10000")
    long queryTimeoutMs;

    // ── Extraction ────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "memory-graph.extraction.provider", defaultValue = "local")
    String provider;

    @Inject
    @ConfigProperty(name = "memory-graph.extraction.allow-fallback", defaultValue = "false")
    boolean allowFallback;

    @Inject
    @ConfigProperty(name = "memory-graph.extraction.timeout-seconds", defaultValue = "150")
    long timeoutSeconds;

    @Inject
    @ConfigProperty(name = "memory-graph.extraction.max-retries", defaultValue = "2")
    int maxRetries;

    @Inject
    @ConfigProperty(name = "memory-graph.extraction.initial-backoff-ms", defaultValue = "500")
    long initialBackoffMs;

    @Inject
    @ConfigProperty(name = "memory-graph.extraction.max-backoff-ms", defaultValue = "8000")
    long maxBackoffMs;

    @Inject
    @ConfigProperty(name = "memory-graph.extraction.context-window-tokens", defaultValue = "128000")
    int contextWindowTokens;

    @Inject
    @ConfigProperty(name = "memory-graph.extraction.max-segments", defaultValue = "1")
    int maxSegments;

    @Inject
    @ConfigProperty(name = "memory-graph.extraction.max-concurrent-requests", defaultValue = "4")
    int maxConcurrentRequests;

    // ── Providers ─────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "memory-graph.ollama.base-url", defaultValue = OllamaSettings.DEFAULT_BASE_URL)
    String ollamaBaseUrl;

    @Inject
    @ConfigProperty(name = "memory-graph.ollama.model", defaultValue = OllamaSettings.DEFAULT_MODEL)
    String ollamaModel;

    @Inject
    @ConfigProperty(name = "memory-graph.ollama.keep-alive", defaultValue = OllamaSettings.DEFAULT_KEEP_ALIVE)
    String ollamaKeepAlive;

    @Inject
    @ConfigProperty(name = "memory-graph.openai.base-url", defaultValue = OpenAiSettings.DEFAULT_BASE_URL)
    String openAiBaseUrl;

    @Inject
    @ConfigProperty(name = "memory-graph.openai.model", defaultValue = OpenAiSettings.DEFAULT_MODEL)
    String openAiModel;

    @Inject
    @ConfigProperty(name = "memory-graph.openai.api-key")
    Optional<String> openAiApiKey;

    @Inject
    @ConfigProperty(name = "memory-graph.anthropic.base-url", defaultValue = AnthropicSettings.DEFAULT_BASE_URL)
    String anthropicBaseUrl;

    @Inject
    @ConfigProperty(name = "memory-graph.anthropic.model", defaultValue = AnthropicSettings.DEFAULT_MODEL)
    String anthropicModel;

    @Inject
    @ConfigProperty(name = "memory-graph.anthropic.api-key")
    Optional<String> anthropicApiKey;

    @Inject
    @ConfigProperty(name = "memory-graph.anthropic.max-tokens", defaultValue = "1024")
    int anthropicMaxTokens;

    @Inject
    @ConfigProperty(name = "memory-graph.anthropic.version", defaultValue = AnthropicSettings.DEFAULT_API_VERSION)
    String anthropicVersion;

    // ── Dispatcher, locks, observability ──────────────────────

    @Inject
    @ConfigProperty(name = "memory-graph.dispatcher.workers", defaultValue = "4")
    int dispatcherWorkers;

    @Inject
    @ConfigProperty(name = "memory-graph.dispatcher.queue-capacity", defaultValue = "256")
    int dispatcherQueueCapacity;

    @Inject
    @ConfigProperty(name = "memory-graph.lock.timeout-ms", defaultValue = "5000")
    long lockTimeoutMs;

    @Inject
    @ConfigProperty(name = "memory-graph.metrics.enabled", defaultValue = "true")
    boolean metricsEnabled;

    @Inject
    @ConfigProperty(name = "memory-graph.tracing.enabled", defaultValue = "false")
    boolean tracingEnabled;

    // ══════════════════════════════════════════════════════════
    //  Producers
    // ══════════════════════════════════════════════════════════

    @Produces
    @ApplicationScoped
    public ProviderConfig providerConfig() {
        ProviderConfig config = ProviderConfig.builder()
                .provider(ProviderKind.parse(provider))
                .fallbackAllowed(allowFallback)
                .timeout(Duration.ofSeconds(timeoutSeconds))
                .maxRetries(maxRetries)
                .initialBackoff(Duration.ofMillis(initialBackoffMs))
                .maxBackoff(Duration.ofMillis(maxBackoffMs))
                .contextWindowTokens(contextWindowTokens)
                .maxSegments(maxSegments)
                .maxConcurrentRequests(maxConcurrentRequests)
                .ollama(new OllamaSettings(ollamaBaseUrl, ollamaModel, ollamaKeepAlive))
                .openAi(new OpenAiSettings(openAiBaseUrl, openAiModel, openAiApiKey.orElse(null)))
                .anthropic(new AnthropicSettings(anthropicBaseUrl, anthropicModel, anthropicApiKey.orElse(null),
                        anthropicMaxTokens, anthropicVersion))
                .build();
        log.info("Provider config: {}", config);
        return config;
    }

    @Produces
    @ApplicationScoped
    public GraphConnection graphConnection() {
        FalkorDBConnection connection = falkordbUri
                .filter(uri -> !uri.isBlank())
                .map(uri -> FalkorDBConnection.fromUri(uri, falkordbGraphName))
                .orElseGet(() -> new FalkorDBConnection(falkordbHost, falkordbPort, falkordbGraphName));
        GraphConnection bounded = new TimeLimitedGraphConnection(connection, queryTimeoutMs);
        if (usesFalkorDB()) {
            bounded.createIndexes();
        }
        return bounded;
    }

    public void closeConnection(@Disposes GraphConnection connection) {
        log.info("Closing graph connection");
        connection.close();
    }

    @Produces
    @ApplicationScoped
    public GraphRepository graphRepository(GraphConnection connection) {
        if (usesFalkorDB()) {
            return new FalkorGraphRepository(connection);
        }
        log.info("Using in-memory graph store");
        return new InMemoryGraphRepository();
    }

    @Produces
    @ApplicationScoped
    public EntryRepository entryRepository(GraphConnection connection) {
        return usesFalkorDB() ? new FalkorEntryRepository(connection) : new InMemoryEntryRepository();
    }

    @Produces
    @ApplicationScoped
    public MetricsService metricsService() {
        if (!metricsEnabled) {
            return new NoOpMetricsService();
        }
        return new MicrometerMetricsService(Metrics.globalRegistry);
    }

    @Produces
    @ApplicationScoped
    public ExtractionRunner extractionRunner(ProviderConfig config, MetricsService metrics) {
        PipelineObservers observers = new PipelineObservers()
                .register(new LoggingObserver())
                .register(new MetricsObserver(metrics));
        if (tracingEnabled) {
            observers.register(new TracingObserver(GlobalOpenTelemetry.getTracer("memory-graph")));
        }
        ProviderFactory factory = new ProviderFactory(config);
        log.info("Producing ExtractionRunner: provider={} fallback={} observers={}",
                config.provider().getConfigName(), config.fallbackAllowed(), observers.size());
        return ExtractionRunner.builder()
                .config(config)
                .provider(factory.create(config))
                .fallbackProvider(factory.localHeuristic())
                .observers(observers)
                .build();
    }

    public void closeRunner(@Disposes ExtractionRunner runner) {
        runner.close();
    }

    @Produces
    @ApplicationScoped
    public ExtractionDispatcher extractionDispatcher(ExtractionRunner runner, GraphRepository graph,
                                                     EntryRepository entries, MetricsService metrics) {
        ResolutionCommitter committer = new ResolutionCommitter(graph,
                new LocalDistributedLock(new LockConfig(lockTimeoutMs, LockConfig.defaults().stripes())),
                metrics, Clock.systemUTC());
        return new ExtractionDispatcher(runner, committer, entries,
                new DispatcherConfig(dispatcherWorkers, dispatcherQueueCapacity));
    }

    public void closeDispatcher(@Disposes ExtractionDispatcher dispatcher) {
        log.info("Closing extraction dispatcher");
        dispatcher.close();
    }

    @Produces
    @ApplicationScoped
    public EntryIngestionService entryIngestionService(EntryRepository entries, GraphRepository graph,
                                                       ExtractionDispatcher dispatcher) {
        return new EntryIngestionService(entries, graph, dispatcher);
    }

    // ══════════════════════════════════════════════════════════
    //  Internal
    // ══════════════════════════════════════════════════════════

    private boolean usesFalkorDB() {
        if ("memory".equalsIgnoreCase(store)) {
            return false;
        }
        if (!"falkordb".equalsIgnoreCase(store)) {
            log.warn("Unknown store '{}', using falkordb", store);
        }
        return true;
    }
}
