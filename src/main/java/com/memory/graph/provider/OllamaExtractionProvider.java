package com.memory.graph.provider;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.memory.graph.provider.ProviderConfig.OllamaSettings;

import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.util.concurrent.Semaphore;

/**
 * Extraction through a self-hosted Ollama server.
 *
 * <p>Calls {@code POST /api/generate} in JSON mode. The model is kept loaded between requests
 * for the configured keep-alive, and the context window is passed as {@code num_ctx}.</p>
 *
 * <p>Ollama must be running (default: http://localhost:11434) with the model pulled,
 * e.g. {@code ollama pull gpt-oss:20b}.</p>
 */
public class OllamaExtractionProvider extends HttpExtractionProvider {

    private final OllamaSettings settings;

    public OllamaExtractionProvider(OllamaSettings settings, HttpClient httpClient,
                                    Semaphore permits, ObjectMapper objectMapper) {
        super(httpClient, permits, objectMapper);
        this.settings = settings;
    }

    @Override
    public String getProviderName() {
        return "ollama/" + settings.model();
    }

    @Override
    public ProviderKind getKind() {
        return ProviderKind.OLLAMA;
    }

    @Override
    protected HttpRequest buildRequest(String text, ProviderConfig config) throws ProviderException {
        OllamaRequest payload = new OllamaRequest(
                settings.model(),
                ExtractionPrompt.combined(text),
                false,
                "json",
                settings.keepAlive(),
                new OllamaOptions(config.contextWindowTokens(), 0.0));
        return jsonPost(settings.baseUrl() + "/api/generate", payload, config).build();
    }

    @Override
    protected String readContent(String body) throws ProviderException {
        OllamaResponse response;
        try {
            response = objectMapper.readValue(body, OllamaResponse.class);
        } catch (JsonProcessingException e) {
            throw invalidResponse("returned a body that is not an Ollama response");
        }
        if (response.response() == null || response.response().isBlank()) {
            throw invalidResponse("returned an empty generation");
        }
        return response.response();
    }

    // Request/Response DTOs for Ollama API
    private record OllamaRequest(
            String model,
            String prompt,
            boolean stream,
            String format,
            @JsonProperty("keep_alive") String keepAlive,
            OllamaOptions options
    ) {}

    private record OllamaOptions(
            @JsonProperty("num_ctx") int numCtx,
            double temperature
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record OllamaResponse(
            String model,
            @JsonProperty("created_at") String createdAt,
            String response,
            boolean done
    ) {}
}
