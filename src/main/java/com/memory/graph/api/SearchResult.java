package com.memory.graph.api;

import com.memory.graph.core.model.Entity;

import java.util.List;

public record SearchResult(SearchStrategy strategy, List<Entity> items) {

    public SearchResult {
        items = items != null ? List.copyOf(items) : List.of();
    }
}
