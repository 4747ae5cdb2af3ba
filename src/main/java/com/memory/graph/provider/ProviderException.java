package com.memory.graph.provider;

/**
 * Raised by an {@link ExtractionProvider} when a call does not yield usable output.
 */
public class ProviderException extends Exception {

    private final ProviderErrorKind kind;

    public ProviderException(ProviderErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ProviderException(ProviderErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ProviderErrorKind getKind() {
        return kind;
    }
}
