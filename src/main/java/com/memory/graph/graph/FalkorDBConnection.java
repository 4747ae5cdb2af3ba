package com.memory.graph.graph;

import com.falkordb.Driver;
import com.falkordb.FalkorDB;
import com.falkordb.Graph;
import com.falkordb.Record;
import com.falkordb.ResultSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * FalkorDB implementation using the JFalkorDB client.
 */
public class FalkorDBConnection implements GraphConnection {
    private static final Logger log = LoggerFactory.getLogger(FalkorDBConnection.class);

    private static final int DEFAULT_PORT = 6379;

    private final Driver driver;
    private final Graph graph;
    private final String graphName;

    public FalkorDBConnection(String host, int port, String graphName) {
        this.driver = FalkorDB.driver(host, port);
        this.graphName = graphName;
        this.graph = driver.graph(graphName);
        log.info("FalkorDB connection initialized: {}:{} graph={}", host, port, graphName);
    }

    /**
     * Connects using a {@code redis://host:port} URI.
     */
    public static FalkorDBConnection fromUri(String uri, String graphName) {
        URI parsed = URI.create(uri);
        if (parsed.getHost() == null) {
            throw new IllegalArgumentException("FalkorDB URI has no host: " + uri);
        }
        int port = parsed.getPort() > 0 ? parsed.getPort() : DEFAULT_PORT;
        return new FalkorDBConnection(parsed.getHost(), port, graphName);
    }

    @Override
    public void execute(String query, Map<String, Object> params) {
        String processedQuery = CypherParameters.render(query, params);
        log.debug("Executing: {}", processedQuery);
        try {
            graph.query(processedQuery);
        } catch (RuntimeException e) {
            throw translate(e);
        }
    }

    @Override
    public List<Map<String, Object>> query(String query, Map<String, Object> params) {
        String processedQuery = CypherParameters.render(query, params);
        log.debug("Querying: {}", processedQuery);

        ResultSet resultSet;
        try {
            resultSet = graph.query(processedQuery);
        } catch (RuntimeException e) {
            throw translate(e);
        }
        List<Map<String, Object>> results = new ArrayList<>();
        for (Record record : resultSet) {
            Map<String, Object> row = new HashMap<>();
            for (String key : record.keys()) {
                row.put(key, record.getValue(key));
            }
            results.add(row);
        }

        log.debug("Query returned {} results", results.size());
        return results;
    }

    @Override
    public boolean isConnected() {
        try {
            graph.query("RETURN 1");
            return true;
        } catch (Exception e) {
            log.warn("Connection check failed: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public String getGraphName() {
        return graphName;
    }

    @Override
    public void createIndexes() {
        log.info("Creating memory graph indexes...");
        safeExecute("CREATE INDEX FOR (e:Entity) ON (e.id)");
        safeExecute("CREATE INDEX FOR (e:Entity) ON (e.normalized_name)");
        safeExecute("CREATE INDEX FOR (e:Entity) ON (e.created_at)");
        safeExecute("CREATE INDEX FOR (n:" + CypherExecutor.ENTRY_RECORD_LABEL + ") ON (n.id)");
        log.info("Index creation complete");
    }

    private void safeExecute(String query) {
        try {
            graph.query(query);
        } catch (Exception e) {
            // Index might already exist
            log.debug("Index creation query result: {} - {}", query, e.getMessage());
        }
    }

    /**
     * Maps client exceptions onto store error kinds using the exception chain.
     */
    static StoreException translate(RuntimeException e) {
        if (e instanceof StoreException storeException) {
            return storeException;
        }
        for (Throwable t = e; t != null; t = t.getCause()) {
            String message = t.getMessage() == null ? "" : t.getMessage().toLowerCase(Locale.ROOT);
            String type = t.getClass().getSimpleName().toLowerCase(Locale.ROOT);
            if (message.contains("timed out") || message.contains("timeout") || type.contains("timeout")) {
                return new StoreException(StoreErrorKind.TIMEOUT, "Graph query timed out: " + e.getMessage(), e);
            }
            if (message.contains("constraint") || message.contains("already exists")) {
                return new StoreException(StoreErrorKind.CONSTRAINT_VIOLATION,
                        "Graph constraint violated: " + e.getMessage(), e);
            }
        }
        return new StoreException(StoreErrorKind.UNAVAILABLE, "Graph store error: " + e.getMessage(), e);
    }

    @Override
    public void close() {
        if (driver != null) {
            try {
                driver.close();
            } catch (Exception e) {
                log.warn("Error closing FalkorDB connection", e);
            }
        }
        log.info("FalkorDB connection closed");
    }
}
