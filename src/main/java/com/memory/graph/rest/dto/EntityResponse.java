package com.memory.graph.rest.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.memory.graph.api.EntityView;
import com.memory.graph.core.model.Entity;

import java.util.List;

/**
 * Response DTO for an entity. {@code relations} is only present on single-entity lookups.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EntityResponse(
        String id,
        String kind,
        String name,
        String normalizedName,
        String summary,
        List<String> sourceEntryIds,
        String createdAt,
        String updatedAt,
        List<RelationResponse> relations
) {
    public static EntityResponse fromEntity(Entity entity) {
        return of(entity, null);
    }

    public static EntityResponse from(EntityView view) {
        return of(view.entity(), view.relations().stream().map(RelationResponse::from).toList());
    }

    private static EntityResponse of(Entity entity, List<RelationResponse> relations) {
        return new EntityResponse(
                entity.getId(),
                entity.getKind().name(),
                entity.getName(),
                entity.getNormalizedName(),
                entity.getSummary(),
                entity.getSourceEntryIds(),
                entity.getCreatedAt().toString(),
                entity.getUpdatedAt().toString(),
                relations
        );
    }
}
