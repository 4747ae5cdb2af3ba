package com.memory.graph.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.concurrent.Semaphore;

/**
 * Creates the extraction provider selected by {@link ProviderConfig#provider()}.
 *
 * <p>HTTP providers built by the same factory share one {@link HttpClient} and one permit pool
 * sized by {@link ProviderConfig#maxConcurrentRequests()}.</p>
 */
public class ProviderFactory {
    private static final Logger log = LoggerFactory.getLogger(ProviderFactory.class);

    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);

    private final HttpClient httpClient;
    private final Semaphore permits;
    private final ObjectMapper objectMapper;

    public ProviderFactory(ProviderConfig config) {
        this(HttpClient.newBuilder()
                        .connectTimeout(CONNECT_TIMEOUT.compareTo(config.timeout()) < 0 ? CONNECT_TIMEOUT : config.timeout())
                        .build(),
                new Semaphore(config.maxConcurrentRequests(), true),
                new ObjectMapper());
    }

    public ProviderFactory(HttpClient httpClient, Semaphore permits, ObjectMapper objectMapper) {
        this.httpClient = httpClient;
        this.permits = permits;
        this.objectMapper = objectMapper;
    }

    public ExtractionProvider create(ProviderConfig config) {
        ExtractionProvider provider = switch (config.provider()) {
            case LOCAL -> localHeuristic();
            case OLLAMA -> new OllamaExtractionProvider(config.ollama(), httpClient, permits, objectMapper);
            case OPENAI -> new OpenAiExtractionProvider(config.openAi(), httpClient, permits, objectMapper);
            case ANTHROPIC -> new AnthropicExtractionProvider(config.anthropic(), httpClient, permits, objectMapper);
        };
        log.info("provider.created kind={} name={} fallbackAllowed={}",
                config.provider(), provider.getProviderName(), config.fallbackAllowed());
        if ((provider.getKind() == ProviderKind.OPENAI && config.openAi().apiKeyValue().isEmpty())
                || (provider.getKind() == ProviderKind.ANTHROPIC && config.anthropic().apiKeyValue().isEmpty())) {
            log.warn("provider.misconfigured name={} reason=missing-api-key", provider.getProviderName());
        }
        return provider;
    }

    /**
     * The deterministic provider used when fallback is enabled.
     */
    public LocalHeuristicProvider localHeuristic() {
        return new LocalHeuristicProvider(objectMapper);
    }
}
