package com.memory.graph.api;

import com.memory.graph.core.model.Entity;
import com.memory.graph.core.model.Relation;

import java.util.List;

/**
 * An entity together with the relations it takes part in, as source or target.
 */
public record EntityView(Entity entity, List<Relation> relations) {

    public EntityView {
        relations = relations != null ? List.copyOf(relations) : List.of();
    }
}
