package com.memory.graph.rest.dto;

import com.memory.graph.api.SearchResult;

import java.util.List;

/**
 * Search results labelled with the strategy that produced them.
 */
public record SearchResponse(String strategy, List<EntityResponse> items) {

    public static SearchResponse from(SearchResult result) {
        return new SearchResponse(
                result.strategy().wireValue(),
                result.items().stream().map(EntityResponse::fromEntity).toList());
    }
}
