package com.memory.graph.resolution;

import com.memory.graph.core.model.EntityKind;

import java.nio.charset.StandardCharsets;
import java.util.UUID;

/**
 * Deterministic identifiers derived from identity keys, so that resolving the same candidates
 * against the same graph always yields the same ids.
 */
public final class IdentityKeys {

    private IdentityKeys() {
    }

    public static String entityKey(EntityKind kind, String normalizedName) {
        return kind.name() + ":" + normalizedName;
    }

    public static String entityId(EntityKind kind, String normalizedName) {
        return nameUuid("entity:" + entityKey(kind, normalizedName));
    }

    public static String relationId(String sourceId, String kind, String targetId) {
        return nameUuid("relation:" + sourceId + "|" + kind + "|" + targetId);
    }

    private static String nameUuid(String key) {
        return UUID.nameUUIDFromBytes(key.getBytes(StandardCharsets.UTF_8)).toString();
    }
}
