package com.memory.graph.api;

import java.util.List;
import java.util.Map;

/**
 * A memory entry to ingest: the text to extract from plus optional descriptive fields.
 *
 * @param processSynchronously run the extraction on the calling thread and return the entry
 *                             in its final status
 */
public record IngestCommand(
        String text,
        String title,
        String summary,
        List<String> labels,
        String source,
        Map<String, Object> metadata,
        boolean processSynchronously
) {

    public static IngestCommand of(String text) {
        return new IngestCommand(text, null, null, null, null, null, false);
    }
}
