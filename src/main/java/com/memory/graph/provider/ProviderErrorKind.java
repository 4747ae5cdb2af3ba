package com.memory.graph.provider;

/**
 * Failure categories reported by extraction providers.
 */
public enum ProviderErrorKind {
    TIMEOUT(true),
    INVALID_RESPONSE(false),
    AUTH_FAILURE(false),
    RATE_LIMITED(true),
    NETWORK_ERROR(true);

    private final boolean retryable;

    ProviderErrorKind(boolean retryable) {
        this.retryable = retryable;
    }

    /**
     * Whether another attempt against the same provider may succeed.
     */
    public boolean isRetryable() {
        return retryable;
    }
}
