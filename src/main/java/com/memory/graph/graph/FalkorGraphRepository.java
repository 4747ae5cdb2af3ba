package com.memory.graph.graph;

import com.memory.graph.core.NotFoundException;
import com.memory.graph.core.model.Entity;
import com.memory.graph.core.model.EntityKind;
import com.memory.graph.core.model.Relation;
import com.memory.graph.resolution.EntityMutation;
import com.memory.graph.resolution.MutationPlan;
import com.memory.graph.resolution.MutationType;
import com.memory.graph.resolution.RelationMutation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Graph repository backed by FalkorDB.
 *
 * <p>FalkorDB has no multi-statement transactions over this client, so a plan is applied
 * statement by statement inside a {@link PlanTransaction}; a failing write rolls back the
 * writes already made. Identity uniqueness is re-checked before each create, callers hold
 * the identity locks for the duration of {@link #apply(MutationPlan)}.</p>
 */
public class FalkorGraphRepository implements GraphRepository {
    private static final Logger log = LoggerFactory.getLogger(FalkorGraphRepository.class);

    private final CypherExecutor executor;

    public FalkorGraphRepository(GraphConnection connection) {
        this(new CypherExecutor(connection));
    }

    public FalkorGraphRepository(CypherExecutor executor) {
        this.executor = executor;
    }

    @Override
    public void apply(MutationPlan plan) {
        if (plan.isEmpty()) {
            return;
        }
        try (PlanTransaction tx = new PlanTransaction(plan.sourceEntryId())) {
            for (EntityMutation mutation : plan.entities()) {
                applyEntity(tx, mutation);
            }
            for (RelationMutation mutation : plan.relations()) {
                if (!mutation.isNoOp()) {
                    applyRelation(tx, mutation);
                }
            }
            tx.commit();
            log.debug("plan.applied entryId={} writes={}", plan.sourceEntryId(), tx.appliedCount());
        } catch (StoreException e) {
            log.warn("plan.rejected entryId={} kind={} error={}", plan.sourceEntryId(), e.getKind(), e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            StoreException translated = FalkorDBConnection.translate(e);
            log.warn("plan.rejected entryId={} kind={} error={}",
                    plan.sourceEntryId(), translated.getKind(), e.getMessage());
            throw translated;
        }
    }

    private void applyEntity(PlanTransaction tx, EntityMutation mutation) {
        Entity entity = mutation.entity();
        if (mutation.type() == MutationType.CREATE) {
            tx.write("create entity " + entity.identityKey(), () -> {
                if (!executor.findEntityByIdentity(entity.getKind(), entity.getNormalizedName()).isEmpty()) {
                    throw new StoreException(StoreErrorKind.CONSTRAINT_VIOLATION,
                            "entity already exists: " + entity.identityKey());
                }
                executor.createEntity(entityProperties(entity));
            }, () -> executor.deleteEntity(entity.getId()));
        } else {
            Entity previous = mutation.previous();
            tx.write("merge entity " + entity.identityKey(), () -> {
                if (executor.findEntityById(entity.getId()).isEmpty()) {
                    throw new StoreException(StoreErrorKind.CONSTRAINT_VIOLATION,
                            "merge target missing: " + entity.identityKey());
                }
                executor.updateEntity(entityProperties(entity));
            }, () -> executor.updateEntity(entityProperties(previous)));
        }
    }

    private void applyRelation(PlanTransaction tx, RelationMutation mutation) {
        Relation relation = mutation.relation();
        if (mutation.type() == MutationType.CREATE) {
            tx.write("create relation " + relation.tripleKey(), () -> {
                if (!executor.findRelation(relation.getSourceId(), relation.getTargetId(), relation.getKind()).isEmpty()) {
                    throw new StoreException(StoreErrorKind.CONSTRAINT_VIOLATION,
                            "relation already exists: " + relation.tripleKey());
                }
                if (executor.createRelation(relationProperties(relation)).isEmpty()) {
                    throw new StoreException(StoreErrorKind.CONSTRAINT_VIOLATION,
                            "relation endpoint missing: " + relation.tripleKey());
                }
            }, () -> executor.deleteRelation(relation.getSourceId(), relation.getTargetId(),
                    relation.getKind(), relation.getId()));
        } else {
            Relation previous = mutation.previous();
            tx.write("merge relation " + relation.tripleKey(),
                    () -> executor.updateRelation(relationProperties(relation)),
                    () -> executor.updateRelation(relationProperties(previous)));
        }
    }

    @Override
    public Optional<Entity> findEntity(EntityKind kind, String normalizedName) {
        return first(executor.findEntityByIdentity(kind, normalizedName)).map(FalkorGraphRepository::toEntity);
    }

    @Override
    public Optional<Relation> findRelation(String sourceId, String targetId, String kind) {
        return first(executor.findRelation(sourceId, targetId, kind)).map(FalkorGraphRepository::toRelation);
    }

    @Override
    public Entity getEntity(String id) {
        return first(executor.findEntityById(id))
                .map(FalkorGraphRepository::toEntity)
                .orElseThrow(() -> new NotFoundException("entity", id));
    }

    @Override
    public List<Entity> listEntities(int offset, int limit) {
        return toEntities(executor.listEntities(offset, limit));
    }

    @Override
    public long countEntities() {
        return executor.countEntities();
    }

    @Override
    public List<Entity> searchText(String query, int limit) {
        return toEntities(executor.searchEntities(query.toLowerCase(Locale.ROOT), limit));
    }

    @Override
    public List<Relation> relationsOf(String entityId) {
        List<Relation> relations = new ArrayList<>();
        for (Map<String, Object> row : executor.findRelationsOf(entityId)) {
            relations.add(toRelation(row));
        }
        return relations;
    }

    // ── Row mapping ───────────────────────────────────────────

    static Map<String, Object> entityProperties(Entity entity) {
        return CypherExecutor.params(
                "id", entity.getId(),
                "kind", entity.getKind().name(),
                "name", entity.getName(),
                "normalizedName", entity.getNormalizedName(),
                "summary", entity.getSummary(),
                "sourceEntryIds", entity.getSourceEntryIds(),
                "createdAt", entity.getCreatedAt().toEpochMilli(),
                "updatedAt", entity.getUpdatedAt().toEpochMilli());
    }

    static Map<String, Object> relationProperties(Relation relation) {
        return CypherExecutor.params(
                "id", relation.getId(),
                "sourceId", relation.getSourceId(),
                "targetId", relation.getTargetId(),
                "kind", relation.getKind(),
                "confidence", relation.getConfidence(),
                "sourceEntryId", relation.getSourceEntryId(),
                "createdAt", relation.getCreatedAt().toEpochMilli(),
                "updatedAt", relation.getUpdatedAt().toEpochMilli());
    }

    static Entity toEntity(Map<String, Object> row) {
        List<String> sourceEntryIds = new ArrayList<>();
        if (row.get("sourceEntryIds") instanceof List<?> ids) {
            for (Object id : ids) {
                sourceEntryIds.add(String.valueOf(id));
            }
        }
        return Entity.builder()
                .id((String) row.get("id"))
                .kind(EntityKind.valueOf((String) row.get("kind")))
                .name((String) row.get("name"))
                .normalizedName((String) row.get("normalizedName"))
                .summary((String) row.get("summary"))
                .sourceEntryIds(sourceEntryIds)
                .createdAt(instant(row.get("createdAt")))
                .updatedAt(instant(row.get("updatedAt")))
                .build();
    }

    static Relation toRelation(Map<String, Object> row) {
        Object confidence = row.get("confidence");
        return Relation.builder()
                .id((String) row.get("id"))
                .sourceId((String) row.get("sourceId"))
                .targetId((String) row.get("targetId"))
                .kind((String) row.get("kind"))
                .confidence(confidence instanceof Number number ? number.doubleValue() : null)
                .sourceEntryId((String) row.get("sourceEntryId"))
                .createdAt(instant(row.get("createdAt")))
                .updatedAt(instant(row.get("updatedAt")))
                .build();
    }

    static Instant instant(Object epochMillis) {
        return epochMillis instanceof Number number ? Instant.ofEpochMilli(number.longValue()) : null;
    }

    private static Optional<Map<String, Object>> first(List<Map<String, Object>> rows) {
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    private static List<Entity> toEntities(List<Map<String, Object>> rows) {
        List<Entity> entities = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            entities.add(toEntity(row));
        }
        return entities;
    }
}
