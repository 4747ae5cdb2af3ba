package com.memory.graph.pipeline;

import com.memory.graph.provider.ProviderErrorKind;

/**
 * Why an extraction run ended in {@link ExtractionState#FAILED}.
 */
public enum ExtractionFailureKind {
    TIMEOUT,
    INVALID_RESPONSE,
    AUTH_FAILURE,
    RATE_LIMITED,
    NETWORK_ERROR,
    MALFORMED_INPUT,
    CANCELLED;

    public static ExtractionFailureKind from(ProviderErrorKind kind) {
        return switch (kind) {
            case TIMEOUT -> TIMEOUT;
            case INVALID_RESPONSE -> INVALID_RESPONSE;
            case AUTH_FAILURE -> AUTH_FAILURE;
            case RATE_LIMITED -> RATE_LIMITED;
            case NETWORK_ERROR -> NETWORK_ERROR;
        };
    }
}
