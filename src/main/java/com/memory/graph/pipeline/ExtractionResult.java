package com.memory.graph.pipeline;

import java.time.Duration;
import java.util.List;

/**
 * Validated output of one extraction run, consumed once by the resolver.
 *
 * @param entities     candidate entities in extraction order
 * @param relations    candidate relations in extraction order
 * @param providerName provider that produced the candidates
 * @param latency      wall time of the run, retries and fallback included
 * @param truncated    whether entry text was dropped to fit the context budget
 * @param degraded     whether the candidates come from the fallback heuristic
 * @param attempts     provider calls made, fallback excluded
 */
public record ExtractionResult(
        List<CandidateEntity> entities,
        List<CandidateRelation> relations,
        String providerName,
        Duration latency,
        boolean truncated,
        boolean degraded,
        int attempts
) {
    public ExtractionResult {
        entities = entities != null ? List.copyOf(entities) : List.of();
        relations = relations != null ? List.copyOf(relations) : List.of();
    }
}
