package com.memory.graph.rest.dto;

import com.memory.graph.core.model.Entry;

/**
 * Returned when an entry has been stored, with the status it has at that point:
 * {@code pending} when the extraction was scheduled, or the final status after synchronous
 * processing.
 */
public record EntryAcceptedResponse(String id, String status) {

    public static EntryAcceptedResponse from(Entry entry) {
        return new EntryAcceptedResponse(entry.getId(), entry.getStatus().wireValue());
    }
}
