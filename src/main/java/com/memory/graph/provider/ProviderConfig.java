package com.memory.graph.provider;

import com.memory.graph.context.TokenBudget;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Process-wide extraction configuration: which provider is active and its operational limits.
 * Built once at startup and never mutated.
 *
 * <p>Usage:</p>
 * <pre>
 * ProviderConfig config = ProviderConfig.builder()
 *     .provider(ProviderKind.OLLAMA)
 *     .timeout(Duration.ofSeconds(150))
 *     .maxRetries(2)
 *     .fallbackAllowed(true)
 *     .build();
 * </pre>
 */
public final class ProviderConfig {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(150);
    public static final int DEFAULT_MAX_RETRIES = 2;
    public static final Duration DEFAULT_INITIAL_BACKOFF = Duration.ofMillis(500);
    public static final Duration DEFAULT_MAX_BACKOFF = Duration.ofSeconds(8);
    public static final int DEFAULT_CONTEXT_WINDOW_TOKENS = 128_000;
    public static final int DEFAULT_MAX_SEGMENTS = 1;
    public static final int DEFAULT_MAX_CONCURRENT_REQUESTS = 4;

    private final ProviderKind provider;
    private final Duration timeout;
    private final int maxRetries;
    private final Duration initialBackoff;
    private final Duration maxBackoff;
    private final int contextWindowTokens;
    private final int maxSegments;
    private final boolean fallbackAllowed;
    private final int maxConcurrentRequests;
    private final OllamaSettings ollama;
    private final OpenAiSettings openAi;
    private final AnthropicSettings anthropic;

    private ProviderConfig(Builder builder) {
        this.provider = builder.provider;
        this.timeout = builder.timeout;
        this.maxRetries = builder.maxRetries;
        this.initialBackoff = builder.initialBackoff;
        this.maxBackoff = builder.maxBackoff;
        this.contextWindowTokens = builder.contextWindowTokens;
        this.maxSegments = builder.maxSegments;
        this.fallbackAllowed = builder.fallbackAllowed;
        this.maxConcurrentRequests = builder.maxConcurrentRequests;
        this.ollama = builder.ollama;
        this.openAi = builder.openAi;
        this.anthropic = builder.anthropic;
    }

    public ProviderKind provider() {
        return provider;
    }

    /**
     * Upper bound for a single provider attempt.
     */
    public Duration timeout() {
        return timeout;
    }

    /**
     * Retries after the first attempt; a provider is called at most {@code maxRetries + 1} times.
     */
    public int maxRetries() {
        return maxRetries;
    }

    public Duration initialBackoff() {
        return initialBackoff;
    }

    public Duration maxBackoff() {
        return maxBackoff;
    }

    public int contextWindowTokens() {
        return contextWindowTokens;
    }

    public int maxSegments() {
        return maxSegments;
    }

    public boolean fallbackAllowed() {
        return fallbackAllowed;
    }

    public int maxConcurrentRequests() {
        return maxConcurrentRequests;
    }

    public OllamaSettings ollama() {
        return ollama;
    }

    public OpenAiSettings openAi() {
        return openAi;
    }

    public AnthropicSettings anthropic() {
        return anthropic;
    }

    public TokenBudget tokenBudget() {
        return TokenBudget.forContextWindow(contextWindowTokens, maxSegments);
    }

    /**
     * Backoff to wait before the given retry (1-based), doubling from the initial backoff.
     */
    public Duration backoffBeforeRetry(int retry) {
        if (retry < 1) {
            throw new IllegalArgumentException("retry must be >= 1");
        }
        long factor = 1L << Math.min(retry - 1, 30);
        long millis = initialBackoff.toMillis() * factor;
        if (millis < 0 || millis > maxBackoff.toMillis()) {
            return maxBackoff;
        }
        return Duration.ofMillis(millis);
    }

    @Override
    public String toString() {
        return "ProviderConfig{" +
                "provider=" + provider +
                ", timeout=" + timeout +
                ", maxRetries=" + maxRetries +
                ", contextWindowTokens=" + contextWindowTokens +
                ", maxSegments=" + maxSegments +
                ", fallbackAllowed=" + fallbackAllowed +
                '}';
    }

    public static ProviderConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Settings for a self-hosted Ollama server.
     */
    public record OllamaSettings(String baseUrl, String model, String keepAlive) {
        public static final String DEFAULT_BASE_URL = "http://localhost:11434";
        public static final String DEFAULT_MODEL = "gpt-oss:20b";
        public static final String DEFAULT_KEEP_ALIVE = "5m";

        public OllamaSettings {
            baseUrl = baseUrl != null ? stripTrailingSlash(baseUrl) : DEFAULT_BASE_URL;
            model = model != null ? model : DEFAULT_MODEL;
            keepAlive = keepAlive != null ? keepAlive : DEFAULT_KEEP_ALIVE;
        }

        public static OllamaSettings defaults() {
            return new OllamaSettings(null, null, null);
        }
    }

    /**
     * Settings for the OpenAI chat completions API.
     */
    public record OpenAiSettings(String baseUrl, String model, String apiKey) {
        public static final String DEFAULT_BASE_URL = "https://api.openai.com/v1";
        public static final String DEFAULT_MODEL = "gpt-4.1";

        public OpenAiSettings {
            baseUrl = baseUrl != null ? stripTrailingSlash(baseUrl) : DEFAULT_BASE_URL;
            model = model != null ? model : DEFAULT_MODEL;
        }

        public Optional<String> apiKeyValue() {
            return apiKey == null || apiKey.isBlank() ? Optional.empty() : Optional.of(apiKey);
        }

        public static OpenAiSettings defaults() {
            return new OpenAiSettings(null, null, null);
        }

        @Override
        public String toString() {
            return "OpenAiSettings{baseUrl=" + baseUrl + ", model=" + model + ", apiKey=" + mask(apiKey) + "}";
        }
    }

    /**
     * Settings for the Anthropic messages API.
     */
    public record AnthropicSettings(String baseUrl, String model, String apiKey, int maxTokens, String apiVersion) {
        public static final String DEFAULT_BASE_URL = "https://api.anthropic.com/v1";
        public static final String DEFAULT_MODEL = "claude-3-opus-20240229";
        public static final int DEFAULT_MAX_TOKENS = 1024;
        public static final String DEFAULT_API_VERSION = "2023-06-01";

        public AnthropicSettings {
            baseUrl = baseUrl != null ? stripTrailingSlash(baseUrl) : DEFAULT_BASE_URL;
            model = model != null ? model : DEFAULT_MODEL;
            maxTokens = maxTokens > 0 ? maxTokens : DEFAULT_MAX_TOKENS;
            apiVersion = apiVersion != null ? apiVersion : DEFAULT_API_VERSION;
        }

        public Optional<String> apiKeyValue() {
            return apiKey == null || apiKey.isBlank() ? Optional.empty() : Optional.of(apiKey);
        }

        public static AnthropicSettings defaults() {
            return new AnthropicSettings(null, null, null, 0, null);
        }

        @Override
        public String toString() {
            return "AnthropicSettings{baseUrl=" + baseUrl + ", model=" + model + ", apiKey=" + mask(apiKey) + "}";
        }
    }

    private static String stripTrailingSlash(String url) {
        String trimmed = url.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }

    private static String mask(String secret) {
        return secret == null || secret.isBlank() ? "<unset>" : "****";
    }

    public static class Builder {
        private ProviderKind provider = ProviderKind.LOCAL;
        private Duration timeout = DEFAULT_TIMEOUT;
        private int maxRetries = DEFAULT_MAX_RETRIES;
        private Duration initialBackoff = DEFAULT_INITIAL_BACKOFF;
        private Duration maxBackoff = DEFAULT_MAX_BACKOFF;
        private int contextWindowTokens = DEFAULT_CONTEXT_WINDOW_TOKENS;
        private int maxSegments = DEFAULT_MAX_SEGMENTS;
        private boolean fallbackAllowed = false;
        private int maxConcurrentRequests = DEFAULT_MAX_CONCURRENT_REQUESTS;
        private OllamaSettings ollama = OllamaSettings.defaults();
        private OpenAiSettings openAi = OpenAiSettings.defaults();
        private AnthropicSettings anthropic = AnthropicSettings.defaults();

        public Builder provider(ProviderKind provider) {
            this.provider = provider;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder initialBackoff(Duration initialBackoff) {
            this.initialBackoff = initialBackoff;
            return this;
        }

        public Builder maxBackoff(Duration maxBackoff) {
            this.maxBackoff = maxBackoff;
            return this;
        }

        public Builder contextWindowTokens(int contextWindowTokens) {
            this.contextWindowTokens = contextWindowTokens;
            return this;
        }

        public Builder maxSegments(int maxSegments) {
            this.maxSegments = maxSegments;
            return this;
        }

        public Builder fallbackAllowed(boolean fallbackAllowed) {
            this.fallbackAllowed = fallbackAllowed;
            return this;
        }

        public Builder maxConcurrentRequests(int maxConcurrentRequests) {
            this.maxConcurrentRequests = maxConcurrentRequests;
            return this;
        }

        public Builder ollama(OllamaSettings ollama) {
            this.ollama = ollama;
            return this;
        }

        public Builder openAi(OpenAiSettings openAi) {
            this.openAi = openAi;
            return this;
        }

        public Builder anthropic(AnthropicSettings anthropic) {
            this.anthropic = anthropic;
            return this;
        }

        public ProviderConfig build() {
            Objects.requireNonNull(provider, "provider is required");
            Objects.requireNonNull(timeout, "timeout is required");
            Objects.requireNonNull(initialBackoff, "initialBackoff is required");
            Objects.requireNonNull(maxBackoff, "maxBackoff is required");
            Objects.requireNonNull(ollama, "ollama settings are required");
            Objects.requireNonNull(openAi, "openAi settings are required");
            Objects.requireNonNull(anthropic, "anthropic settings are required");
            if (timeout.isZero() || timeout.isNegative()) {
                throw new IllegalArgumentException("timeout must be positive");
            }
            if (maxRetries < 0) {
                throw new IllegalArgumentException("maxRetries must be >= 0");
            }
            if (initialBackoff.isNegative() || maxBackoff.compareTo(initialBackoff) < 0) {
                throw new IllegalArgumentException("backoff must satisfy 0 <= initialBackoff <= maxBackoff");
            }
            if (contextWindowTokens <= 0) {
                throw new IllegalArgumentException("contextWindowTokens must be > 0");
            }
            if (maxSegments <= 0) {
                throw new IllegalArgumentException("maxSegments must be > 0");
            }
            if (maxConcurrentRequests <= 0) {
                throw new IllegalArgumentException("maxConcurrentRequests must be > 0");
            }
            return new ProviderConfig(this);
        }
    }
}
