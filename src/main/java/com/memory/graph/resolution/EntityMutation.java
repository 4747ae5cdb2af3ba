package com.memory.graph.resolution;

import com.memory.graph.core.model.Entity;

import java.util.Objects;

/**
 * Planned change to one entity.
 *
 * @param type     create or merge
 * @param entity   state after the mutation
 * @param previous stored state before a merge, {@code null} for a create; used to compensate
 */
public record EntityMutation(MutationType type, Entity entity, Entity previous) {

    public EntityMutation {
        Objects.requireNonNull(type, "type is required");
        Objects.requireNonNull(entity, "entity is required");
        if (type == MutationType.MERGE && previous == null) {
            throw new IllegalArgumentException("merge requires the previous entity state");
        }
    }

    public static EntityMutation create(Entity entity) {
        return new EntityMutation(MutationType.CREATE, entity, null);
    }

    public static EntityMutation merge(Entity merged, Entity previous) {
        return new EntityMutation(MutationType.MERGE, merged, previous);
    }
}
