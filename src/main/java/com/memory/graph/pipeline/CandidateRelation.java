package com.memory.graph.pipeline;

import java.util.Objects;

/**
 * A relation proposed by a provider. Endpoints refer to candidate entity names.
 *
 * @param source     name of the source entity
 * @param target     name of the target entity
 * @param kind       upper-snake-case relation kind
 * @param confidence confidence in [0, 1], or {@code null}
 */
public record CandidateRelation(String source, String target, String kind, Double confidence) {

    public CandidateRelation {
        Objects.requireNonNull(source, "source is required");
        Objects.requireNonNull(target, "target is required");
        Objects.requireNonNull(kind, "kind is required");
    }
}
