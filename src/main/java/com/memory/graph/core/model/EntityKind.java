package com.memory.graph.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Kinds of nodes stored in the memory graph.
 * The kind doubles as the secondary node label of an entity.
 */
public enum EntityKind {
    ENTRY,
    PERSON,
    LOCATION,
    ORGANIZATION,
    OBJECT,
    EVENT,
    CONCEPT;

    /**
     * Whether a provider may emit this kind. Entries are created by ingestion only.
     */
    public boolean isExtractable() {
        return this != ENTRY;
    }

    /**
     * Parses a kind name case-insensitively.
     *
     * @param value kind name such as {@code "person"} or {@code "LOCATION"}
     * @return the kind, or empty if the value is blank or unknown
     */
    public static Optional<EntityKind> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String candidate = value.trim().toUpperCase(Locale.ROOT);
        for (EntityKind kind : values()) {
            if (kind.name().equals(candidate)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
