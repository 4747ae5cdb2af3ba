package com.memory.graph.rest.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.memory.graph.api.IngestCommand;

import java.util.List;
import java.util.Map;

/**
 * Request DTO for submitting a memory entry. Only {@code text} is required.
 */
public record IngestEntryRequest(
        String text,
        String title,
        String summary,
        List<String> labels,
        String source,
        Map<String, Object> metadata,
        @JsonAlias("process_synchronously") Boolean processSynchronously
) {

    public static IngestEntryRequest of(String text) {
        return new IngestEntryRequest(text, null, null, null, null, null, null);
    }

    public IngestCommand toCommand() {
        return new IngestCommand(text, title, summary, labels, source, metadata,
                Boolean.TRUE.equals(processSynchronously));
    }
}
