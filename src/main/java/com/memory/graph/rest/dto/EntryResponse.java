package com.memory.graph.rest.dto;

import com.memory.graph.core.model.Entry;

import java.util.List;
import java.util.Map;

/**
 * Entry with its extraction status.
 */
public record EntryResponse(
        String id,
        String text,
        String title,
        String summary,
        List<String> labels,
        String source,
        Map<String, Object> metadata,
        String status,
        String errorDetail,
        boolean degraded,
        boolean truncated,
        String provider,
        String createdAt,
        String updatedAt
) {
    public static EntryResponse from(Entry entry) {
        return new EntryResponse(
                entry.getId(),
                entry.getText(),
                entry.getTitle(),
                entry.getSummary(),
                entry.getLabels(),
                entry.getSource(),
                entry.getMetadata(),
                entry.getStatus().wireValue(),
                entry.getErrorDetail(),
                entry.isDegraded(),
                entry.isTruncated(),
                entry.getProvider(),
                entry.getCreatedAt().toString(),
                entry.getUpdatedAt().toString()
        );
    }
}
