package com.memory.graph.graph;

import com.memory.graph.core.NotFoundException;
import com.memory.graph.core.model.Entity;
import com.memory.graph.core.model.EntityKind;
import com.memory.graph.core.model.Relation;
import com.memory.graph.resolution.MutationPlan;

import java.util.List;
import java.util.Optional;

/**
 * Owns all reads and writes of entities and relations in the graph store.
 */
public interface GraphRepository {

    /**
     * Applies a mutation plan as one atomic unit: entity mutations first, then relation
     * mutations, in plan order. On failure nothing of the plan remains visible.
     *
     * @throws StoreException if the store rejects any write or is unavailable
     */
    void apply(MutationPlan plan);

    Optional<Entity> findEntity(EntityKind kind, String normalizedName);

    Optional<Relation> findRelation(String sourceId, String targetId, String kind);

    /**
     * @throws NotFoundException if no entity has this id
     */
    Entity getEntity(String id);

    /**
     * Lists entities in creation order (ties broken by id).
     */
    List<Entity> listEntities(int offset, int limit);

    long countEntities();

    /**
     * Case-insensitive substring match over name and summary, in creation order.
     */
    List<Entity> searchText(String query, int limit);

    /**
     * Relations in which the entity is the source or the target.
     */
    List<Relation> relationsOf(String entityId);
}
