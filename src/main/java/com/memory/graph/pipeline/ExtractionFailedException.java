package com.memory.graph.pipeline;

/**
 * Terminal failure of an extraction run. No graph mutation follows it.
 */
public class ExtractionFailedException extends RuntimeException {

    private final ExtractionFailureKind kind;

    public ExtractionFailedException(ExtractionFailureKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ExtractionFailedException(ExtractionFailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ExtractionFailureKind getKind() {
        return kind;
    }

    /**
     * Error detail recorded on the entry, e.g. {@code TIMEOUT: ollama/gpt-oss:20b timed out}.
     */
    public String toErrorDetail() {
        return kind.name() + ": " + getMessage();
    }
}
