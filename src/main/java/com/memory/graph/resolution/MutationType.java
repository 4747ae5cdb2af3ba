package com.memory.graph.resolution;

/**
 * Kind of change a mutation applies to the graph.
 */
public enum MutationType {
    CREATE,
    MERGE
}
