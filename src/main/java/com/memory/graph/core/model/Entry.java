package com.memory.graph.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * A raw memory entry submitted by a user, together with the state of its extraction.
 *
 * <p>Besides the text, a client may attach a title, a summary, free-form labels, the name of
 * the originating application and arbitrary metadata. The title and summary are shown on the
 * {@link EntityKind#ENTRY} node that links the entry to what was extracted from it.</p>
 */
public final class Entry {
    /** Display name of an entry submitted without a title. */
    public static final String DEFAULT_TITLE = "Memory Entry";

    private final String id;
    private final String text;
    private final String title;
    private final String summary;
    private final List<String> labels;
    private final String source;
    private final Map<String, Object> metadata;
    private final ExtractionStatus status;
    private final String errorDetail;
    private final boolean degraded;
    private final boolean truncated;
    private final String provider;
    private final Instant createdAt;
    private final Instant updatedAt;

    private Entry(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.text = builder.text;
        this.title = builder.title;
        this.summary = builder.summary;
        this.labels = builder.labels != null ? List.copyOf(builder.labels) : List.of();
        this.source = builder.source;
        this.metadata = builder.metadata != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata))
                : Map.of();
        this.status = builder.status != null ? builder.status : ExtractionStatus.PENDING;
        this.errorDetail = builder.errorDetail;
        this.degraded = builder.degraded;
        this.truncated = builder.truncated;
        this.provider = builder.provider;
        this.createdAt = builder.createdAt != null ? builder.createdAt : Instant.now();
        this.updatedAt = builder.updatedAt != null ? builder.updatedAt : this.createdAt;
    }

    public String getId() {
        return id;
    }

    public String getText() {
        return text;
    }

    public String getTitle() {
        return title;
    }

    /**
     * @return the title, or {@link #DEFAULT_TITLE} if none was given
     */
    public String displayTitle() {
        return title != null && !title.isBlank() ? title : DEFAULT_TITLE;
    }

    public String getSummary() {
        return summary;
    }

    public List<String> getLabels() {
        return labels;
    }

    public String getSource() {
        return source;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public ExtractionStatus getStatus() {
        return status;
    }

    public String getErrorDetail() {
        return errorDetail;
    }

    public boolean isDegraded() {
        return degraded;
    }

    public boolean isTruncated() {
        return truncated;
    }

    public String getProvider() {
        return provider;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    /**
     * Starts a new extraction cycle. Outcome fields of the previous cycle are cleared.
     */
    public Entry pending(Instant now) {
        return toBuilder()
                .status(ExtractionStatus.PENDING)
                .errorDetail(null)
                .degraded(false)
                .truncated(false)
                .provider(null)
                .updatedAt(now)
                .build();
    }

    public Entry running(Instant now) {
        return toBuilder().status(ExtractionStatus.RUNNING).updatedAt(now).build();
    }

    public Entry succeeded(String provider, boolean degraded, boolean truncated, Instant now) {
        return toBuilder()
                .status(ExtractionStatus.SUCCEEDED)
                .errorDetail(null)
                .provider(provider)
                .degraded(degraded)
                .truncated(truncated)
                .updatedAt(now)
                .build();
    }

    public Entry failed(String errorDetail, Instant now) {
        return toBuilder()
                .status(ExtractionStatus.FAILED)
                .errorDetail(errorDetail)
                .updatedAt(now)
                .build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Entry entry = (Entry) o;
        return Objects.equals(id, entry.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Entry{" +
                "id='" + id + '\'' +
                ", status=" + status +
                ", degraded=" + degraded +
                ", truncated=" + truncated +
                ", errorDetail='" + errorDetail + '\'' +
                '}';
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .text(text)
                .title(title)
                .summary(summary)
                .labels(labels)
                .source(source)
                .metadata(metadata)
                .status(status)
                .errorDetail(errorDetail)
                .degraded(degraded)
                .truncated(truncated)
                .provider(provider)
                .createdAt(createdAt)
                .updatedAt(updatedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String text;
        private String title;
        private String summary;
        private List<String> labels;
        private String source;
        private Map<String, Object> metadata;
        private ExtractionStatus status;
        private String errorDetail;
        private boolean degraded;
        private boolean truncated;
        private String provider;
        private Instant createdAt;
        private Instant updatedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder text(String text) {
            this.text = text;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder summary(String summary) {
            this.summary = summary;
            return this;
        }

        public Builder labels(List<String> labels) {
            this.labels = labels;
            return this;
        }

        public Builder source(String source) {
            this.source = source;
            return this;
        }

        public Builder metadata(Map<String, Object> metadata) {
            this.metadata = metadata;
            return this;
        }

        public Builder status(ExtractionStatus status) {
            this.status = status;
            return this;
        }

        public Builder errorDetail(String errorDetail) {
            this.errorDetail = errorDetail;
            return this;
        }

        public Builder degraded(boolean degraded) {
            this.degraded = degraded;
            return this;
        }

        public Builder truncated(boolean truncated) {
            this.truncated = truncated;
            return this;
        }

        public Builder provider(String provider) {
            this.provider = provider;
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

        public Entry build() {
            Objects.requireNonNull(text, "text is required");
            return new Entry(this);
        }
    }
}
