package com.memory.graph.api;

/**
 * How a search request was answered.
 */
public enum SearchStrategy {
    /** Case-insensitive substring match over names and summaries. */
    SUBSTRING("substring"),
    /** Semantic search answered by the substring match; no embeddings are involved. */
    TEXT_PROXY("text-proxy");

    private final String wireValue;

    SearchStrategy(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }
}
