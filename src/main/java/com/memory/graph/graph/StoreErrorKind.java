package com.memory.graph.graph;

/**
 * Failure categories of the graph store.
 */
public enum StoreErrorKind {
    UNAVAILABLE,
    CONSTRAINT_VIOLATION,
    TIMEOUT
}
