package com.memory.graph.core.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

/**
 * An entity node in the memory graph.
 * Identity is the pair (kind, normalized name); the id is derived from it.
 * Instances are immutable, use {@link #toBuilder()} to derive a changed copy.
 */
public final class Entity {
    private final String id;
    private final EntityKind kind;
    private final String name;
    private final String normalizedName;
    private final String summary;
    private final List<String> sourceEntryIds;
    private final Instant createdAt;
    private final Instant updatedAt;

    private Entity(Builder builder) {
        this.id = builder.id;
        this.kind = builder.kind;
        this.name = builder.name;
        this.normalizedName = builder.normalizedName;
        this.summary = builder.summary;
        this.sourceEntryIds = List.copyOf(builder.sourceEntryIds);
        this.createdAt = builder.createdAt != null ? builder.createdAt : Instant.now();
        this.updatedAt = builder.updatedAt != null ? builder.updatedAt : this.createdAt;
    }

    public String getId() {
        return id;
    }

    public EntityKind getKind() {
        return kind;
    }

    public String getName() {
        return name;
    }

    public String getNormalizedName() {
        return normalizedName;
    }

    public String getSummary() {
        return summary;
    }

    /**
     * Entries that mentioned this entity, in the order they were first seen.
     */
    public List<String> getSourceEntryIds() {
        return sourceEntryIds;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    /**
     * Key used for locking and deduplication: {@code KIND:normalized name}.
     */
    public String identityKey() {
        return kind.name() + ":" + normalizedName;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Entity entity = (Entity) o;
        return Objects.equals(id, entity.id)
                && kind == entity.kind
                && Objects.equals(name, entity.name)
                && Objects.equals(normalizedName, entity.normalizedName)
                && Objects.equals(summary, entity.summary)
                && Objects.equals(sourceEntryIds, entity.sourceEntryIds)
                && Objects.equals(createdAt, entity.createdAt)
                && Objects.equals(updatedAt, entity.updatedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, kind, name, normalizedName, summary, sourceEntryIds, createdAt, updatedAt);
    }

    @Override
    public String toString() {
        return "Entity{" +
                "id='" + id + '\'' +
                ", kind=" + kind +
                ", name='" + name + '\'' +
                ", normalizedName='" + normalizedName + '\'' +
                ", sourceEntryIds=" + sourceEntryIds +
                '}';
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .kind(kind)
                .name(name)
                .normalizedName(normalizedName)
                .summary(summary)
                .sourceEntryIds(sourceEntryIds)
                .createdAt(createdAt)
                .updatedAt(updatedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private EntityKind kind;
        private String name;
        private String normalizedName;
        private String summary;
        private final List<String> sourceEntryIds = new ArrayList<>();
        private Instant createdAt;
        private Instant updatedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder kind(EntityKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder normalizedName(String normalizedName) {
            this.normalizedName = normalizedName;
            return this;
        }

        public Builder summary(String summary) {
            this.summary = summary;
            return this;
        }

        /**
         * Replaces the source entry references. Duplicates are dropped, first occurrence wins.
         */
        public Builder sourceEntryIds(Collection<String> ids) {
            this.sourceEntryIds.clear();
            if (ids != null) {
                this.sourceEntryIds.addAll(new LinkedHashSet<>(ids));
            }
            return this;
        }

        public Builder addSourceEntryId(String entryId) {
            if (entryId != null && !sourceEntryIds.contains(entryId)) {
                sourceEntryIds.add(entryId);
            }
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

        public Entity build() {
            Objects.requireNonNull(id, "id is required");
            Objects.requireNonNull(kind, "kind is required");
            Objects.requireNonNull(name, "name is required");
            Objects.requireNonNull(normalizedName, "normalizedName is required");
            return new Entity(this);
        }
    }
}
