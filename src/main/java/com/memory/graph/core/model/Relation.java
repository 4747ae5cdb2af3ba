package com.memory.graph.core.model;

import java.time.Instant;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A directed, typed edge between two entities.
 * At most one relation exists per (source, target, kind) triple.
 */
public final class Relation {

    /**
     * Relation kinds become relationship types in Cypher, so they are restricted to this shape.
     */
    public static final Pattern KIND_PATTERN = Pattern.compile("^[A-Z][A-Z0-9_]*$");

    private final String id;
    private final String sourceId;
    private final String targetId;
    private final String kind;
    private final Double confidence;
    private final String sourceEntryId;
    private final Instant createdAt;
    private final Instant updatedAt;

    private Relation(Builder builder) {
        this.id = builder.id;
        this.sourceId = builder.sourceId;
        this.targetId = builder.targetId;
        this.kind = builder.kind;
        this.confidence = builder.confidence;
        this.sourceEntryId = builder.sourceEntryId;
        this.createdAt = builder.createdAt != null ? builder.createdAt : Instant.now();
        this.updatedAt = builder.updatedAt != null ? builder.updatedAt : this.createdAt;
    }

    public String getId() {
        return id;
    }

    public String getSourceId() {
        return sourceId;
    }

    public String getTargetId() {
        return targetId;
    }

    public String getKind() {
        return kind;
    }

    /**
     * Confidence in [0, 1], or {@code null} when the provider gave none.
     */
    public Double getConfidence() {
        return confidence;
    }

    public String getSourceEntryId() {
        return sourceEntryId;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public String tripleKey() {
        return sourceId + "|" + kind + "|" + targetId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Relation that = (Relation) o;
        return Objects.equals(id, that.id)
                && Objects.equals(sourceId, that.sourceId)
                && Objects.equals(targetId, that.targetId)
                && Objects.equals(kind, that.kind)
                && Objects.equals(confidence, that.confidence)
                && Objects.equals(sourceEntryId, that.sourceEntryId)
                && Objects.equals(createdAt, that.createdAt)
                && Objects.equals(updatedAt, that.updatedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, sourceId, targetId, kind, confidence, sourceEntryId, createdAt, updatedAt);
    }

    @Override
    public String toString() {
        return "Relation{" +
                "id='" + id + '\'' +
                ", sourceId='" + sourceId + '\'' +
                ", kind='" + kind + '\'' +
                ", targetId='" + targetId + '\'' +
                ", confidence=" + confidence +
                '}';
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .sourceId(sourceId)
                .targetId(targetId)
                .kind(kind)
                .confidence(confidence)
                .sourceEntryId(sourceEntryId)
                .createdAt(createdAt)
                .updatedAt(updatedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String sourceId;
        private String targetId;
        private String kind;
        private Double confidence;
        private String sourceEntryId;
        private Instant createdAt;
        private Instant updatedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder sourceId(String sourceId) {
            this.sourceId = sourceId;
            return this;
        }

        public Builder targetId(String targetId) {
            this.targetId = targetId;
            return this;
        }

        public Builder kind(String kind) {
            this.kind = kind;
            return this;
        }

        public Builder confidence(Double confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder sourceEntryId(String sourceEntryId) {
            this.sourceEntryId = sourceEntryId;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Relation build() {
            Objects.requireNonNull(id, "id is required");
            Objects.requireNonNull(sourceId, "sourceId is required");
            Objects.requireNonNull(targetId, "targetId is required");
            Objects.requireNonNull(kind, "kind is required");
            if (!KIND_PATTERN.matcher(kind).matches()) {
                throw new IllegalArgumentException("Invalid relation kind: " + kind);
            }
            if (confidence != null && (confidence < 0.0 || confidence > 1.0)) {
                throw new IllegalArgumentException("confidence must be in [0, 1]: " + confidence);
            }
            return new Relation(this);
        }
    }
}
