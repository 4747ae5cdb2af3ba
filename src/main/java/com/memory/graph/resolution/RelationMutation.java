package com.memory.graph.resolution;

import com.memory.graph.core.model.Relation;

import java.util.Objects;

/**
 * Planned change to one relation.
 *
 * @param type     create or merge
 * @param relation state after the mutation
 * @param previous stored state before a merge, {@code null} for a create
 */
public record RelationMutation(MutationType type, Relation relation, Relation previous) {

    public RelationMutation {
        Objects.requireNonNull(type, "type is required");
        Objects.requireNonNull(relation, "relation is required");
        if (type == MutationType.MERGE && previous == null) {
            throw new IllegalArgumentException("merge requires the previous relation state");
        }
    }

    public static RelationMutation create(Relation relation) {
        return new RelationMutation(MutationType.CREATE, relation, null);
    }

    public static RelationMutation merge(Relation merged, Relation previous) {
        return new RelationMutation(MutationType.MERGE, merged, previous);
    }

    /**
     * A merge that leaves the stored relation untouched.
     */
    public boolean isNoOp() {
        return type == MutationType.MERGE && relation.equals(previous);
    }
}
