package com.memory.graph.graph;

/**
 * Raised when the graph store rejects or cannot complete an operation.
 * A failure while applying a mutation plan means none of the plan is visible.
 */
public class StoreException extends RuntimeException {

    private final StoreErrorKind kind;

    public StoreException(StoreErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public StoreException(StoreErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public StoreErrorKind getKind() {
        return kind;
    }

    /**
     * Error detail recorded on an entry, e.g. {@code STORE_TIMEOUT: query exceeded 5000ms}.
     */
    public String toErrorDetail() {
        return "STORE_" + kind.name() + ": " + getMessage();
    }
}
