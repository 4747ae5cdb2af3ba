package com.memory.graph.rest.dto;

import com.memory.graph.api.Page;
import com.memory.graph.core.model.Entity;

import java.util.List;

public record EntityListResponse(List<EntityResponse> items, int offset, int limit, long total) {

    public static EntityListResponse from(Page<Entity> page) {
        return new EntityListResponse(
                page.items().stream().map(EntityResponse::fromEntity).toList(),
                page.offset(),
                page.limit(),
                page.total());
    }
}
