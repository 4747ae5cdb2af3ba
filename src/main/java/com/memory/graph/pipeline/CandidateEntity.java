package com.memory.graph.pipeline;

import com.memory.graph.core.model.EntityKind;

import java.util.Objects;

/**
 * An entity proposed by a provider, before resolution against the graph.
 *
 * @param name    display name as written in the entry
 * @param kind    entity kind, never {@link EntityKind#ENTRY}
 * @param summary short description, or {@code null}
 */
public record CandidateEntity(String name, EntityKind kind, String summary) {

    public CandidateEntity {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(kind, "kind is required");
    }
}
