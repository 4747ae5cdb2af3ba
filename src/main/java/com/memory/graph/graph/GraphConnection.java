package com.memory.graph.graph;

import java.util.List;
import java.util.Map;

/**
 * Connection to the graph store executing parameterized Cypher.
 * Implementations report failures as {@link StoreException}.
 */
public interface GraphConnection extends AutoCloseable {

    /**
     * Executes a Cypher statement that modifies the graph.
     *
     * @param query  the Cypher statement, with {@code $name} placeholders
     * @param params placeholder values
     * @throws StoreException if the store fails or times out
     */
    void execute(String query, Map<String, Object> params);

    default void execute(String query) {
        execute(query, Map.of());
    }

    /**
     * Executes a Cypher query and returns its rows, one map per record keyed by column alias.
     *
     * @throws StoreException if the store fails or times out
     */
    List<Map<String, Object>> query(String query, Map<String, Object> params);

    default List<Map<String, Object>> query(String query) {
        return query(query, Map.of());
    }

    boolean isConnected();

    String getGraphName();

    /**
     * Creates the indexes used by identity lookups, ignoring those that already exist.
     */
    void createIndexes();

    @Override
    void close();
}
