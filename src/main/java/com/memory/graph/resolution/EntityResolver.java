package com.memory.graph.resolution;

import com.memory.graph.core.NameNormalizer;
import com.memory.graph.core.model.Entity;
import com.memory.graph.core.model.EntityKind;
import com.memory.graph.core.model.Entry;
import com.memory.graph.core.model.Relation;
import com.memory.graph.graph.GraphRepository;
import com.memory.graph.pipeline.CandidateEntity;
import com.memory.graph.pipeline.CandidateRelation;
import com.memory.graph.pipeline.ExtractionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Reconciles an extraction result with the current graph and computes a {@link MutationPlan}.
 *
 * <p>Entities are identified by (kind, normalized name). A known entity is merged: stored
 * fields are kept, a non-null incoming summary replaces the stored one and the source entry
 * is added to its back-references. An unknown entity is created with an id derived from its
 * identity. Relations are identified by (source, target, kind); a known relation only has
 * its confidence raised to the maximum of both values.</p>
 *
 * <p>Every plan also carries the {@link EntityKind#ENTRY} node of the source entry, keyed by the
 * entry id, and a {@value #MENTIONS} edge from it to each extracted entity, so the entry and
 * what was found in it are committed together.</p>
 *
 * <p>Planning is deterministic: the same result, graph state and timestamp give an equal plan.</p>
 */
public class EntityResolver {
    private static final Logger log = LoggerFactory.getLogger(EntityResolver.class);

    public static final String MENTIONS = "MENTIONS";

    private final GraphRepository repository;

    public EntityResolver(GraphRepository repository) {
        this.repository = repository;
    }

    public MutationPlan plan(ExtractionResult result, Entry entry, Instant now) {
        String sourceEntryId = entry.getId();
        Map<String, Candidate> candidates = collapse(result.entities());

        List<EntityMutation> entityMutations = new ArrayList<>();
        entityMutations.add(planEntryNode(entry, now));
        Map<String, String> idsByName = new HashMap<>();
        for (Candidate candidate : candidates.values()) {
            EntityMutation mutation = planEntity(candidate, sourceEntryId, now);
            entityMutations.add(mutation);
            idsByName.putIfAbsent(candidate.normalizedName(), mutation.entity().getId());
        }

        Map<String, RelationMutation> relationMutations = new LinkedHashMap<>();
        for (CandidateRelation candidate : result.relations()) {
            String sourceId = idsByName.get(NameNormalizer.normalize(candidate.source()));
            String targetId = idsByName.get(NameNormalizer.normalize(candidate.target()));
            if (sourceId == null || targetId == null) {
                log.warn("resolve.relation_skipped entryId={} source='{}' target='{}' reason=unknown-endpoint",
                        sourceEntryId, candidate.source(), candidate.target());
                continue;
            }
            if (sourceId.equals(targetId)) {
                log.debug("resolve.relation_skipped entryId={} kind={} reason=self-loop", sourceEntryId, candidate.kind());
                continue;
            }
            String key = sourceId + "|" + candidate.kind() + "|" + targetId;
            RelationMutation planned = relationMutations.get(key);
            if (planned != null) {
                relationMutations.put(key, raiseConfidence(planned, candidate.confidence(), now));
            } else {
                relationMutations.put(key, planRelation(sourceId, targetId, candidate.kind(), candidate.confidence(),
                        sourceEntryId, now));
            }
        }
        for (EntityMutation mutation : entityMutations.subList(1, entityMutations.size())) {
            String targetId = mutation.entity().getId();
            relationMutations.putIfAbsent(sourceEntryId + "|" + MENTIONS + "|" + targetId,
                    planRelation(sourceEntryId, targetId, MENTIONS, null, sourceEntryId, now));
        }

        MutationPlan plan = new MutationPlan(sourceEntryId, entityMutations, new ArrayList<>(relationMutations.values()));
        log.debug("resolve.planned entryId={} entityCreates={} entityMerges={} relationCreates={} relationMerges={}",
                sourceEntryId,
                plan.countEntities(MutationType.CREATE), plan.countEntities(MutationType.MERGE),
                plan.countRelations(MutationType.CREATE), plan.countRelations(MutationType.MERGE));
        return plan;
    }

    /**
     * Identity keys touched by a result, the entry node's included, sorted; used to lock
     * identities before planning.
     */
    public static List<String> identityKeys(ExtractionResult result, String entryId) {
        TreeSet<String> keys = new TreeSet<>();
        keys.add(IdentityKeys.entityKey(EntityKind.ENTRY, entryId));
        for (CandidateEntity entity : result.entities()) {
            String normalized = NameNormalizer.normalize(entity.name());
            if (!normalized.isEmpty()) {
                keys.add(IdentityKeys.entityKey(entity.kind(), normalized));
            }
        }
        return new ArrayList<>(keys);
    }

    private Map<String, Candidate> collapse(List<CandidateEntity> entities) {
        Map<String, Candidate> collapsed = new LinkedHashMap<>();
        for (CandidateEntity entity : entities) {
            String normalized = NameNormalizer.normalize(entity.name());
            if (normalized.isEmpty()) {
                log.warn("resolve.entity_skipped name='{}' reason=empty-normalized-name", entity.name());
                continue;
            }
            String key = IdentityKeys.entityKey(entity.kind(), normalized);
            Candidate existing = collapsed.get(key);
            if (existing == null) {
                collapsed.put(key, new Candidate(entity.name().strip(), entity.kind(), normalized, entity.summary()));
            } else if (entity.summary() != null) {
                collapsed.put(key, new Candidate(existing.name(), existing.kind(), normalized, entity.summary()));
            }
        }
        return collapsed;
    }

    /**
     * The entry node is identified by the entry id. A re-extraction refreshes its title and
     * summary.
     */
    private EntityMutation planEntryNode(Entry entry, Instant now) {
        Optional<Entity> stored = repository.findEntity(EntityKind.ENTRY, entry.getId());
        if (stored.isPresent()) {
            Entity previous = stored.get();
            Entity refreshed = previous.toBuilder()
                    .name(entry.displayTitle())
                    .summary(entry.getSummary())
                    .updatedAt(now)
                    .build();
            return EntityMutation.merge(refreshed, previous);
        }
        Entity created = Entity.builder()
                .id(entry.getId())
                .kind(EntityKind.ENTRY)
                .name(entry.displayTitle())
                .normalizedName(entry.getId())
                .summary(entry.getSummary())
                .addSourceEntryId(entry.getId())
                .createdAt(now)
                .updatedAt(now)
                .build();
        return EntityMutation.create(created);
    }

    private EntityMutation planEntity(Candidate candidate, String sourceEntryId, Instant now) {
        Optional<Entity> stored = repository.findEntity(candidate.kind(), candidate.normalizedName());
        if (stored.isPresent()) {
            Entity previous = stored.get();
            Entity merged = previous.toBuilder()
                    .summary(candidate.summary() != null ? candidate.summary() : previous.getSummary())
                    .addSourceEntryId(sourceEntryId)
                    .updatedAt(now)
                    .build();
            return EntityMutation.merge(merged, previous);
        }
        Entity created = Entity.builder()
                .id(IdentityKeys.entityId(candidate.kind(), candidate.normalizedName()))
                .kind(candidate.kind())
                .name(candidate.name())
                .normalizedName(candidate.normalizedName())
                .summary(candidate.summary())
                .addSourceEntryId(sourceEntryId)
                .createdAt(now)
                .updatedAt(now)
                .build();
        return EntityMutation.create(created);
    }

    private RelationMutation planRelation(String sourceId, String targetId, String kind, Double confidence,
                                          String sourceEntryId, Instant now) {
        Optional<Relation> stored = repository.findRelation(sourceId, targetId, kind);
        if (stored.isPresent()) {
            Relation previous = stored.get();
            Double raised = max(previous.getConfidence(), confidence);
            if (raised == null || raised.equals(previous.getConfidence())) {
                return RelationMutation.merge(previous, previous);
            }
            return RelationMutation.merge(previous.toBuilder().confidence(raised).updatedAt(now).build(), previous);
        }
        Relation created = Relation.builder()
                .id(IdentityKeys.relationId(sourceId, kind, targetId))
                .sourceId(sourceId)
                .targetId(targetId)
                .kind(kind)
                .confidence(confidence)
                .sourceEntryId(sourceEntryId)
                .createdAt(now)
                .updatedAt(now)
                .build();
        return RelationMutation.create(created);
    }

    private static RelationMutation raiseConfidence(RelationMutation planned, Double confidence, Instant now) {
        Relation relation = planned.relation();
        Double raised = max(relation.getConfidence(), confidence);
        if (raised == null || raised.equals(relation.getConfidence())) {
            return planned;
        }
        Relation updated = relation.toBuilder().confidence(raised).updatedAt(now).build();
        return new RelationMutation(planned.type(), updated, planned.previous());
    }

    private static Double max(Double a, Double b) {
        if (a == null) {
            return b;
        }
        if (b == null) {
            return a;
        }
        return Math.max(a, b);
    }

    private record Candidate(String name, EntityKind kind, String normalizedName, String summary) {}
}
