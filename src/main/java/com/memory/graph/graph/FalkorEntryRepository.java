package com.memory.graph.graph;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.memory.graph.core.model.Entry;
import com.memory.graph.core.model.ExtractionStatus;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Entries stored as {@code :MemoryEntry} nodes in the same graph as the entities they produced.
 * Entry metadata is kept as a JSON string property.
 */
public class FalkorEntryRepository implements EntryRepository {

    private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {
    };

    private final CypherExecutor executor;
    private final ObjectMapper objectMapper;

    public FalkorEntryRepository(GraphConnection connection) {
        this(connection, new ObjectMapper());
    }

    public FalkorEntryRepository(GraphConnection connection, ObjectMapper objectMapper) {
        this.executor = new CypherExecutor(connection);
        this.objectMapper = objectMapper;
    }

    @Override
    public void save(Entry entry) {
        executor.upsertEntry(CypherExecutor.params(
                "id", entry.getId(),
                "text", entry.getText(),
                "status", entry.getStatus().wireValue(),
                "errorDetail", entry.getErrorDetail(),
                "degraded", entry.isDegraded(),
                "truncated", entry.isTruncated(),
                "provider", entry.getProvider(),
                "title", entry.getTitle(),
                "summary", entry.getSummary(),
                "labels", entry.getLabels(),
                "source", entry.getSource(),
                "metadata", writeMetadata(entry.getMetadata()),
                "createdAt", entry.getCreatedAt().toEpochMilli(),
                "updatedAt", entry.getUpdatedAt().toEpochMilli()));
    }

    @Override
    public Optional<Entry> findById(String id) {
        List<Map<String, Object>> rows = executor.findEntryById(id);
        if (rows.isEmpty()) {
            return Optional.empty();
        }
        Map<String, Object> row = rows.get(0);
        List<String> labels = new ArrayList<>();
        if (row.get("labels") instanceof List<?> stored) {
            for (Object label : stored) {
                labels.add(String.valueOf(label));
            }
        }
        return Optional.of(Entry.builder()
                .id((String) row.get("id"))
                .text((String) row.get("text"))
                .status(ExtractionStatus.fromWireValue((String) row.get("status")))
                .errorDetail((String) row.get("errorDetail"))
                .degraded(Boolean.TRUE.equals(row.get("degraded")))
                .truncated(Boolean.TRUE.equals(row.get("truncated")))
                .provider((String) row.get("provider"))
                .title((String) row.get("title"))
                .summary((String) row.get("summary"))
                .labels(labels)
                .source((String) row.get("source"))
                .metadata(readMetadata((String) row.get("metadata")))
                .createdAt(FalkorGraphRepository.instant(row.get("createdAt")))
                .updatedAt(FalkorGraphRepository.instant(row.get("updatedAt")))
                .build());
    }

    private String writeMetadata(Map<String, Object> metadata) {
        if (metadata.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            throw new StoreException(StoreErrorKind.CONSTRAINT_VIOLATION,
                    "Entry metadata is not serializable: " + e.getOriginalMessage(), e);
        }
    }

    private Map<String, Object> readMetadata(String json) {
        if (json == null || json.isEmpty()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, METADATA_TYPE);
        } catch (JsonProcessingException e) {
            throw new StoreException(StoreErrorKind.CONSTRAINT_VIOLATION,
                    "Stored entry metadata is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }
}
