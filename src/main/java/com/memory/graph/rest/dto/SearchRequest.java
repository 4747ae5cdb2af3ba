package com.memory.graph.rest.dto;

/**
 * Request DTO for text and semantic search. {@code limit} is optional.
 */
public record SearchRequest(String query, Integer limit) {
}
