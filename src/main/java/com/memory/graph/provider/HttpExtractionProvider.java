package com.memory.graph.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.util.concurrent.Semaphore;

/**
 * Base class for providers that call a model over HTTP.
 *
 * <p>All HTTP providers created by one {@link ProviderFactory} share a single {@link HttpClient}
 * and a {@link Semaphore} that bounds concurrent outbound requests. Transport failures and
 * HTTP status codes are translated into {@link ProviderErrorKind}s here so that subclasses
 * only build requests and unwrap response envelopes.</p>
 */
public abstract class HttpExtractionProvider implements ExtractionProvider {
    private static final Logger log = LoggerFactory.getLogger(HttpExtractionProvider.class);

    private static final int MAX_LOGGED_BODY = 200;

    protected final HttpClient httpClient;
    protected final ObjectMapper objectMapper;
    private final Semaphore permits;

    protected HttpExtractionProvider(HttpClient httpClient, Semaphore permits, ObjectMapper objectMapper) {
        this.httpClient = httpClient;
        this.permits = permits;
        this.objectMapper = objectMapper;
    }

    @Override
    public final String extract(String text, ProviderConfig config) throws ProviderException, InterruptedException {
        HttpRequest request = buildRequest(text, config);

        permits.acquire();
        HttpResponse<String> response;
        try {
            log.debug("provider.request provider={} uri={}", getProviderName(), request.uri());
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new ProviderException(ProviderErrorKind.TIMEOUT,
                    getProviderName() + " timed out: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new ProviderException(ProviderErrorKind.NETWORK_ERROR,
                    getProviderName() + " request failed: " + e.getMessage(), e);
        } finally {
            permits.release();
        }

        checkStatus(response);
        return readContent(response.body());
    }

    /**
     * Builds the HTTP request for the given text.
     *
     * @throws ProviderException with {@link ProviderErrorKind#AUTH_FAILURE} if credentials are missing
     */
    protected abstract HttpRequest buildRequest(String text, ProviderConfig config) throws ProviderException;

    /**
     * Unwraps the provider envelope and returns the model's raw extraction text.
     *
     * @throws ProviderException with {@link ProviderErrorKind#INVALID_RESPONSE} if the envelope is unusable
     */
    protected abstract String readContent(String body) throws ProviderException;

    protected HttpRequest.Builder jsonPost(String url, Object payload, ProviderConfig config) throws ProviderException {
        try {
            return HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .timeout(config.timeout())
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(payload)));
        } catch (IOException e) {
            throw new ProviderException(ProviderErrorKind.INVALID_RESPONSE,
                    "Could not encode request for " + getProviderName(), e);
        } catch (IllegalArgumentException e) {
            throw new ProviderException(ProviderErrorKind.NETWORK_ERROR,
                    "Invalid endpoint for " + getProviderName() + ": " + url, e);
        }
    }

    protected ProviderException invalidResponse(String detail) {
        return new ProviderException(ProviderErrorKind.INVALID_RESPONSE, getProviderName() + " " + detail);
    }

    private void checkStatus(HttpResponse<String> response) throws ProviderException {
        int status = response.statusCode();
        if (status >= 200 && status < 300) {
            return;
        }
        String detail = getProviderName() + " returned status " + status + ": " + abbreviate(response.body());
        if (status == 401 || status == 403) {
            throw new ProviderException(ProviderErrorKind.AUTH_FAILURE, detail);
        }
        if (status == 429) {
            throw new ProviderException(ProviderErrorKind.RATE_LIMITED, detail);
        }
        if (status >= 500) {
            throw new ProviderException(ProviderErrorKind.NETWORK_ERROR, detail);
        }
        throw new ProviderException(ProviderErrorKind.INVALID_RESPONSE, detail);
    }

    private static String abbreviate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() <= MAX_LOGGED_BODY ? body : body.substring(0, MAX_LOGGED_BODY) + "...";
    }
}
