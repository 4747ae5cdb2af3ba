package com.memory.graph.provider;

/**
 * A backend that turns entry text into raw structured extraction output.
 *
 * <p>Implementations return JSON text shaped as
 * {@code {"entities":[...],"relations":[...]}}. They do not validate the content beyond
 * unwrapping their transport envelope; validation belongs to the extraction pipeline.</p>
 */
public interface ExtractionProvider {

    /**
     * Extracts entities and relations from the given text.
     *
     * @param text   entry text, already fitted to the context budget
     * @param config process-wide provider configuration
     * @return raw JSON produced by the backend
     * @throws ProviderException    if the backend fails or its envelope is unusable
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    String extract(String text, ProviderConfig config) throws ProviderException, InterruptedException;

    /**
     * Human-readable name including the model, e.g. {@code ollama/gpt-oss:20b}.
     */
    String getProviderName();

    ProviderKind getKind();
}
