package com.memory.graph.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.memory.graph.provider.ProviderConfig.OllamaSettings;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.concurrent.Semaphore;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("OllamaExtractionProvider Tests")
class OllamaExtractionProviderTest {

    private static final String EXTRACTION = "{\"entities\":[],\"relations\":[]}";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private StubModelServer server;
    private OllamaExtractionProvider provider;
    private ProviderConfig config;

    @BeforeEach
    void setUp() throws Exception {
        server = new StubModelServer();
        config = ProviderConfig.builder()
                .provider(ProviderKind.OLLAMA)
                .timeout(Duration.ofSeconds(5))
                .contextWindowTokens(8192)
                .build();
        provider = new OllamaExtractionProvider(
                new OllamaSettings(server.baseUrl(), "gpt-oss:20b", "10m"),
                HttpClient.newHttpClient(), new Semaphore(2), objectMapper);
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    @Test
    @DisplayName("Provider name includes model")
    void providerNameIncludesModel() {
        assertEquals("ollama/gpt-oss:20b", provider.getProviderName());
        assertEquals(ProviderKind.OLLAMA, provider.getKind());
    }

    @Nested
    @DisplayName("Successful calls")
    class Success {

        @Test
        @DisplayName("Returns the generated response text")
        void returnsGeneration() throws Exception {
            server.respond(200, objectMapper.writeValueAsString(
                    objectMapper.createObjectNode().put("model", "gpt-oss:20b").put("response", EXTRACTION).put("done", true)));

            assertEquals(EXTRACTION, provider.extract("Alice met Bob.", config));
        }

        @Test
        @DisplayName("Sends a non-streaming JSON-mode request with keep-alive and context size")
        void sendsGenerateRequest() throws Exception {
            server.respond(200, "{\"response\":\"{}\"}");

            provider.extract("Alice met Bob.", config);

            assertEquals("/api/generate", server.lastPath());
            JsonNode request = objectMapper.readTree(server.lastBody());
            assertEquals("gpt-oss:20b", request.get("model").asText());
            assertFalse(request.get("stream").asBoolean());
            assertEquals("json", request.get("format").asText());
            assertEquals("10m", request.get("keep_alive").asText());
            assertEquals(8192, request.path("options").path("num_ctx").asInt());
            assertTrue(request.get("prompt").asText().contains("Alice met Bob."));
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @ParameterizedTest(name = "HTTP {0} -> {1}")
        @CsvSource({
                "401, AUTH_FAILURE",
                "403, AUTH_FAILURE",
                "429, RATE_LIMITED",
                "500, NETWORK_ERROR",
                "503, NETWORK_ERROR",
                "400, INVALID_RESPONSE",
                "404, INVALID_RESPONSE"
        })
        void mapsStatusCodes(int status, ProviderErrorKind expected) {
            server.respond(status, "{\"error\":\"nope\"}");

            ProviderException e = assertThrows(ProviderException.class, () -> provider.extract("text", config));
            assertEquals(expected, e.getKind());
        }

        @Test
        @DisplayName("An empty generation is an invalid response")
        void emptyGeneration() {
            server.respond(200, "{\"response\":\"\"}");

            ProviderException e = assertThrows(ProviderException.class, () -> provider.extract("text", config));
            assertEquals(ProviderErrorKind.INVALID_RESPONSE, e.getKind());
        }

        @Test
        @DisplayName("A non-JSON body is an invalid response")
        void nonJsonBody() {
            server.respond(200, "<html>proxy error</html>");

            ProviderException e = assertThrows(ProviderException.class, () -> provider.extract("text", config));
            assertEquals(ProviderErrorKind.INVALID_RESPONSE, e.getKind());
        }

        @Test
        @DisplayName("A slow server times out")
        void slowServerTimesOut() {
            server.respond(200, "{\"response\":\"{}\"}").delay(1500);
            ProviderConfig fast = ProviderConfig.builder().timeout(Duration.ofMillis(200)).build();

            ProviderException e = assertThrows(ProviderException.class, () -> provider.extract("text", fast));
            assertEquals(ProviderErrorKind.TIMEOUT, e.getKind());
        }

        @Test
        @DisplayName("An unreachable server is a network error")
        void unreachableServer() {
            server.close();

            ProviderException e = assertThrows(ProviderException.class, () -> provider.extract("text", config));
            assertEquals(ProviderErrorKind.NETWORK_ERROR, e.getKind());
        }
    }
}
