package com.memory.graph.graph;

import com.memory.graph.core.NotFoundException;
import com.memory.graph.core.model.Entity;
import com.memory.graph.core.model.EntityKind;
import com.memory.graph.core.model.Relation;
import com.memory.graph.resolution.EntityMutation;
import com.memory.graph.resolution.IdentityKeys;
import com.memory.graph.resolution.MutationPlan;
import com.memory.graph.resolution.MutationType;
import com.memory.graph.resolution.RelationMutation;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory graph store.
 *
 * <p>A plan is applied to a staged copy of the indexes, which replaces the live state only
 * when every mutation succeeded. Identity uniqueness is enforced as a constraint, so a
 * create for an identity that already exists fails with
 * {@link StoreErrorKind#CONSTRAINT_VIOLATION}.</p>
 */
public class InMemoryGraphRepository implements GraphRepository {

    private static final Comparator<Entity> CREATION_ORDER =
            Comparator.comparing(Entity::getCreatedAt).thenComparing(Entity::getId);

    private Map<String, Entity> entitiesById = new HashMap<>();
    private Map<String, String> entityIdsByIdentity = new HashMap<>();
    private Map<String, Relation> relationsByTriple = new HashMap<>();

    @Override
    public synchronized void apply(MutationPlan plan) {
        Map<String, Entity> stagedEntities = new HashMap<>(entitiesById);
        Map<String, String> stagedIdentities = new HashMap<>(entityIdsByIdentity);
        Map<String, Relation> stagedRelations = new HashMap<>(relationsByTriple);

        for (EntityMutation mutation : plan.entities()) {
            Entity entity = mutation.entity();
            String identity = entity.identityKey();
            if (mutation.type() == MutationType.CREATE) {
                if (stagedIdentities.containsKey(identity) || stagedEntities.containsKey(entity.getId())) {
                    throw new StoreException(StoreErrorKind.CONSTRAINT_VIOLATION,
                            "entity already exists: " + identity);
                }
                stagedIdentities.put(identity, entity.getId());
            } else if (!stagedEntities.containsKey(entity.getId())) {
                throw new StoreException(StoreErrorKind.CONSTRAINT_VIOLATION, "merge target missing: " + identity);
            }
            stagedEntities.put(entity.getId(), entity);
        }

        for (RelationMutation mutation : plan.relations()) {
            Relation relation = mutation.relation();
            String triple = relation.tripleKey();
            if (!stagedEntities.containsKey(relation.getSourceId())
                    || !stagedEntities.containsKey(relation.getTargetId())) {
                throw new StoreException(StoreErrorKind.CONSTRAINT_VIOLATION,
                        "relation endpoint missing: " + triple);
            }
            boolean exists = stagedRelations.containsKey(triple);
            if (mutation.type() == MutationType.CREATE && exists) {
                throw new StoreException(StoreErrorKind.CONSTRAINT_VIOLATION, "relation already exists: " + triple);
            }
            if (mutation.type() == MutationType.MERGE && !exists) {
                throw new StoreException(StoreErrorKind.CONSTRAINT_VIOLATION, "merge target missing: " + triple);
            }
            stagedRelations.put(triple, relation);
        }

        entitiesById = stagedEntities;
        entityIdsByIdentity = stagedIdentities;
        relationsByTriple = stagedRelations;
    }

    @Override
    public synchronized Optional<Entity> findEntity(EntityKind kind, String normalizedName) {
        String id = entityIdsByIdentity.get(IdentityKeys.entityKey(kind, normalizedName));
        return Optional.ofNullable(id == null ? null : entitiesById.get(id));
    }

    @Override
    public synchronized Optional<Relation> findRelation(String sourceId, String targetId, String kind) {
        return Optional.ofNullable(relationsByTriple.get(sourceId + "|" + kind + "|" + targetId));
    }

    @Override
    public synchronized Entity getEntity(String id) {
        Entity entity = entitiesById.get(id);
        if (entity == null) {
            throw new NotFoundException("entity", id);
        }
        return entity;
    }

    @Override
    public synchronized List<Entity> listEntities(int offset, int limit) {
        return entitiesById.values().stream()
                .sorted(CREATION_ORDER)
                .skip(offset)
                .limit(limit)
                .toList();
    }

    @Override
    public synchronized long countEntities() {
        return entitiesById.size();
    }

    @Override
    public synchronized List<Entity> searchText(String query, int limit) {
        String needle = query.toLowerCase(Locale.ROOT);
        return entitiesById.values().stream()
                .filter(e -> e.getName().toLowerCase(Locale.ROOT).contains(needle)
                        || (e.getSummary() != null && e.getSummary().toLowerCase(Locale.ROOT).contains(needle)))
                .sorted(CREATION_ORDER)
                .limit(limit)
                .toList();
    }

    @Override
    public synchronized List<Relation> relationsOf(String entityId) {
        List<Relation> relations = new ArrayList<>();
        for (Relation relation : relationsByTriple.values()) {
            if (relation.getSourceId().equals(entityId) || relation.getTargetId().equals(entityId)) {
                relations.add(relation);
            }
        }
        relations.sort(Comparator.comparing(Relation::getCreatedAt).thenComparing(Relation::getId));
        return relations;
    }

    public synchronized int relationCount() {
        return relationsByTriple.size();
    }
}
