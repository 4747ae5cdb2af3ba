package com.memory.graph.resolution;

import java.util.List;

/**
 * Graph mutations computed for one extraction, applied atomically.
 * Entity mutations are applied before relation mutations.
 *
 * @param sourceEntryId entry the extraction came from
 * @param entities      the entry node, then entity mutations in candidate order
 * @param relations     relation mutations in candidate order, then the entry's mentions
 */
public record MutationPlan(String sourceEntryId, List<EntityMutation> entities, List<RelationMutation> relations) {

    public MutationPlan {
        entities = entities != null ? List.copyOf(entities) : List.of();
        relations = relations != null ? List.copyOf(relations) : List.of();
    }

    public static MutationPlan empty(String sourceEntryId) {
        return new MutationPlan(sourceEntryId, List.of(), List.of());
    }

    public boolean isEmpty() {
        return entities.isEmpty() && relations.isEmpty();
    }

    public int size() {
        return entities.size() + relations.size();
    }

    public long countEntities(MutationType type) {
        return entities.stream().filter(m -> m.type() == type).count();
    }

    public long countRelations(MutationType type) {
        return relations.stream().filter(m -> m.type() == type).count();
    }
}
