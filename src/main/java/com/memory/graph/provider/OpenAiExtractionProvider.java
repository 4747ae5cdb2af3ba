package com.memory.graph.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.memory.graph.provider.ProviderConfig.OpenAiSettings;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.util.concurrent.Semaphore;

/**
 * Extraction through the OpenAI chat completions API in JSON-object mode.
 */
public class OpenAiExtractionProvider extends HttpExtractionProvider {

    private final OpenAiSettings settings;

    public OpenAiExtractionProvider(OpenAiSettings settings, HttpClient httpClient,
                                    Semaphore permits, ObjectMapper objectMapper) {
        super(httpClient, permits, objectMapper);
        this.settings = settings;
    }

    @Override
    public String getProviderName() {
        return "openai/" + settings.model();
    }

    @Override
    public ProviderKind getKind() {
        return ProviderKind.OPENAI;
    }

    @Override
    protected HttpRequest buildRequest(String text, ProviderConfig config) throws ProviderException {
        String apiKey = settings.apiKeyValue().orElseThrow(() -> new ProviderException(
                ProviderErrorKind.AUTH_FAILURE, "No API key configured for " + getProviderName()));

        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("model", settings.model());
        payload.put("temperature", 0);
        payload.putObject("response_format").put("type", "json_object");
        var messages = payload.putArray("messages");
        messages.addObject().put("role", "system").put("content", ExtractionPrompt.systemInstructions());
        messages.addObject().put("role", "user").put("content", ExtractionPrompt.userMessage(text));

        return jsonPost(settings.baseUrl() + "/chat/completions", payload, config)
                .header("Authorization", "Bearer " + apiKey)
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
        JsonNode content = root.path("choices").path(0).path("message").path("content");
        if (!content.isTextual() || content.asText().isBlank()) {
            throw invalidResponse("returned no message content");
        }
        return content.asText();
    }
}
