package com.memory.graph.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.memory.graph.provider.ProviderConfig.AnthropicSettings;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.util.concurrent.Semaphore;

/**
 * Extraction through the Anthropic messages API.
 */
public class AnthropicExtractionProvider extends HttpExtractionProvider {

    private final AnthropicSettings settings;

    public AnthropicExtractionProvider(AnthropicSettings settings, HttpClient httpClient,
                                       Semaphore permits, ObjectMapper objectMapper) {
        super(httpClient, permits, objectMapper);
        this.settings = settings;
    }

    @Override
    public String getProviderName() {
        return "anthropic/" + settings.model();
    }

    @Override
    public ProviderKind getKind() {
        return ProviderKind.ANTHROPIC;
    }

    @Override
    protected HttpRequest buildRequest(String text, ProviderConfig config) throws ProviderException {
        String apiKey = settings.apiKeyValue().orElseThrow(() -> new ProviderException(
                ProviderErrorKind.AUTH_FAILURE, "No API key configured for " + getProviderName()));

        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("model", settings.model());
        payload.put("max_tokens", settings.maxTokens());
        payload.put("system", ExtractionPrompt.systemInstructions());
        payload.putArray("messages").addObject()
                .put("role", "user")
                .put("content", ExtractionPrompt.userMessage(text));

        return jsonPost(settings.baseUrl() + "/messages", payload, config)
                .header("x-api-key", apiKey)
                .header("anthropic-version", settings.apiVersion())
                .build();
    }

    @Override
    protected String readContent(String body) throws ProviderException {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (IOException e) {
            throw invalidResponse("returned a body that is not JSON");
        }
        for (JsonNode block : root.path("content")) {
            if ("text".equals(block.path("type").asText()) && !block.path("text").asText().isBlank()) {
                return block.path("text").asText();
            }
        }
        throw invalidResponse("returned no text content");
    }
}
