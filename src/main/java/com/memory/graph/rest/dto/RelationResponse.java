package com.memory.graph.rest.dto;

import com.memory.graph.core.model.Relation;

public record RelationResponse(
        String id,
        String sourceId,
        String targetId,
        String kind,
        Double confidence,
        String sourceEntryId,
        String createdAt,
        String updatedAt
) {
    public static RelationResponse from(Relation relation) {
        return new RelationResponse(
                relation.getId(),
                relation.getSourceId(),
                relation.getTargetId(),
                relation.getKind(),
                relation.getConfidence(),
                relation.getSourceEntryId(),
                relation.getCreatedAt().toString(),
                relation.getUpdatedAt().toString()
        );
    }
}
