package com.memory.graph.graph;

import com.memory.graph.core.model.EntityKind;
import com.memory.graph.core.model.Relation;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Cypher statements of the memory graph.
 *
 * <p>Node labels and relationship types cannot be parameterized, so they are formatted into
 * the statement. Entity labels come from {@link EntityKind}; relation kinds are validated
 * against {@code [A-Z][A-Z0-9_]*} before they reach this class.</p>
 *
 * <p>Ingestion records are {@code :MemoryEntry} nodes, apart from the {@code :Entity:ENTRY}
 * node that links an entry to the entities it mentions.</p>
 */
public class CypherExecutor {

    static final String ENTITY_COLUMNS = """
            e.id as id, e.kind as kind, e.name as name, e.normalized_name as normalizedName,
            e.summary as summary, e.source_entry_ids as sourceEntryIds,
            e.created_at as createdAt, e.updated_at as updatedAt""";

    static final String RELATION_COLUMNS = """
            r.id as id, s.id as sourceId, t.id as targetId, r.kind as kind, r.confidence as confidence,
            r.source_entry_id as sourceEntryId, r.created_at as createdAt, r.updated_at as updatedAt""";

    static final String ENTRY_COLUMNS = """
            n.id as id, n.text as text, n.status as status, n.error_detail as errorDetail,
            n.degraded as degraded, n.truncated as truncated, n.provider as provider,
            n.title as title, n.summary as summary, n.labels as labels, n.source as source,
            n.metadata as metadata, n.created_at as createdAt, n.updated_at as updatedAt""";

    static final String ENTRY_RECORD_LABEL = "MemoryEntry";

    private final GraphConnection connection;

    public CypherExecutor(GraphConnection connection) {
        this.connection = connection;
    }

    // ── Entities ──────────────────────────────────────────────

    public void createEntity(Map<String, Object> properties) {
        String query = """
                CREATE (e:Entity:%s {id: $id, kind: $kind, name: $name, normalized_name: $normalizedName,
                        summary: $summary, source_entry_ids: $sourceEntryIds,
                        created_at: $createdAt, updated_at: $updatedAt})
                """.formatted(label(properties.get("kind")));
        connection.execute(query, properties);
    }

    /**
     * Overwrites the mutable properties of an entity. Used for merges and to restore a merge.
     */
    public void updateEntity(Map<String, Object> properties) {
        String query = """
                MATCH (e:Entity {id: $id})
                SET e.name = $name, e.summary = $summary, e.source_entry_ids = $sourceEntryIds,
                    e.updated_at = $updatedAt
                """;
        connection.execute(query, properties);
    }

    public void deleteEntity(String id) {
        connection.execute("MATCH (e:Entity {id: $id}) DETACH DELETE e", Map.of("id", id));
    }

    public List<Map<String, Object>> findEntityByIdentity(EntityKind kind, String normalizedName) {
        String query = """
                MATCH (e:Entity:%s)
                WHERE e.normalized_name = $normalizedName
                RETURN %s
                LIMIT 1
                """.formatted(kind.name(), ENTITY_COLUMNS);
        return connection.query(query, Map.of("normalizedName", normalizedName));
    }

    public List<Map<String, Object>> findEntityById(String id) {
        String query = """
                MATCH (e:Entity {id: $id})
                RETURN %s
                """.formatted(ENTITY_COLUMNS);
        return connection.query(query, Map.of("id", id));
    }

    public List<Map<String, Object>> listEntities(int offset, int limit) {
        String query = """
                MATCH (e:Entity)
                RETURN %s
                ORDER BY e.created_at, e.id
                SKIP $offset LIMIT $limit
                """.formatted(ENTITY_COLUMNS);
        return connection.query(query, Map.of("offset", offset, "limit", limit));
    }

    public long countEntities() {
        List<Map<String, Object>> rows = connection.query("MATCH (e:Entity) RETURN count(e) as total");
        if (rows.isEmpty() || rows.get(0).get("total") == null) {
            return 0L;
        }
        return ((Number) rows.get(0).get("total")).longValue();
    }

    /**
     * @param loweredQuery the search text, already lower-cased
     */
    public List<Map<String, Object>> searchEntities(String loweredQuery, int limit) {
        String query = """
                MATCH (e:Entity)
                WHERE toLower(e.name) CONTAINS $query
                   OR toLower(coalesce(e.summary, '')) CONTAINS $query
                RETURN %s
                ORDER BY e.created_at, e.id
                LIMIT $limit
                """.formatted(ENTITY_COLUMNS);
        return connection.query(query, Map.of("query", loweredQuery, "limit", limit));
    }

    // ── Relations ─────────────────────────────────────────────

    /**
     * Creates an edge between two existing entities.
     *
     * @return the created rows; empty when an endpoint does not exist
     */
    public List<Map<String, Object>> createRelation(Map<String, Object> properties) {
        String query = """
                MATCH (s:Entity {id: $sourceId}), (t:Entity {id: $targetId})
                CREATE (s)-[r:%s {id: $id, kind: $kind, confidence: $confidence,
                        source_entry_id: $sourceEntryId, created_at: $createdAt, updated_at: $updatedAt}]->(t)
                RETURN r.id as id
                """.formatted(relationType(properties.get("kind")));
        return connection.query(query, properties);
    }

    public void updateRelation(Map<String, Object> properties) {
        String query = """
                MATCH (:Entity {id: $sourceId})-[r:%s {id: $id}]->(:Entity {id: $targetId})
                SET r.confidence = $confidence, r.updated_at = $updatedAt
                """.formatted(relationType(properties.get("kind")));
        connection.execute(query, properties);
    }

    public void deleteRelation(String sourceId, String targetId, String kind, String id) {
        String query = """
                MATCH (:Entity {id: $sourceId})-[r:%s {id: $id}]->(:Entity {id: $targetId})
                DELETE r
                """.formatted(relationType(kind));
        connection.execute(query, Map.of("sourceId", sourceId, "targetId", targetId, "id", id));
    }

    public List<Map<String, Object>> findRelation(String sourceId, String targetId, String kind) {
        String query = """
                MATCH (s:Entity {id: $sourceId})-[r:%s]->(t:Entity {id: $targetId})
                RETURN %s
                LIMIT 1
                """.formatted(relationType(kind), RELATION_COLUMNS);
        return connection.query(query, Map.of("sourceId", sourceId, "targetId", targetId));
    }

    public List<Map<String, Object>> findRelationsOf(String entityId) {
        String query = """
                MATCH (s:Entity)-[r]->(t:Entity)
                WHERE s.id = $entityId OR t.id = $entityId
                RETURN %s
                ORDER BY r.created_at, r.id
                """.formatted(RELATION_COLUMNS);
        return connection.query(query, Map.of("entityId", entityId));
    }

    // ── Entries ───────────────────────────────────────────────

    public void upsertEntry(Map<String, Object> properties) {
        String query = """
                MERGE (n:%s {id: $id})
                SET n.text = $text, n.status = $status, n.error_detail = $errorDetail,
                    n.degraded = $degraded, n.truncated = $truncated, n.provider = $provider,
                    n.title = $title, n.summary = $summary, n.labels = $labels, n.source = $source,
                    n.metadata = $metadata, n.created_at = $createdAt, n.updated_at = $updatedAt
                """.formatted(ENTRY_RECORD_LABEL);
        connection.execute(query, properties);
    }

    public List<Map<String, Object>> findEntryById(String id) {
        String query = """
                MATCH (n:%s {id: $id})
                RETURN %s
                """.formatted(ENTRY_RECORD_LABEL, ENTRY_COLUMNS);
        return connection.query(query, Map.of("id", id));
    }

    static Map<String, Object> params(Object... keyValues) {
        Map<String, Object> params = new HashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            params.put((String) keyValues[i], keyValues[i + 1]);
        }
        return params;
    }

    private static String label(Object kind) {
        return EntityKind.valueOf(String.valueOf(kind)).name();
    }

    private static String relationType(Object kind) {
        String value = String.valueOf(kind);
        if (!Relation.KIND_PATTERN.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid relation kind: " + value);
        }
        return value;
    }
}
