package com.invoice.memory.graph;

import java.util.List;
import java.util.Map;

/**
 * Interface for graph database connection management.
 * Abstracts the underlying graph database implementation.
 */
public interface GraphConnection extends AutoCloseable {

    /**
     * Executes a Cypher query that modifies the graph.
     *
     * @param query  the Cypher query
     * @param params query parameters
     */
    void execute(String query, Map<String, Object> params);

    /**
     * Executes a Cypher query that modifies the graph without parameters.
     *
     * @param query the Cypher query
     */
    default void execute(String query) {
        execute(query, Map.of());
    }

    /**
     * Executes a Cypher query and returns results.
     *
     * @param query  the Cypher query
     * @param params query parameters
     * @return list of result records as maps
     */
    List<Map<String, Object>> query(String query, Map<String, Object> params);

    /**
     * Checks if the connection is alive.
     */
    boolean isConnected();

    /**
     * Gets the name of the graph being used.
     */
    String getGraphName();

    /**
     * Creates the indexes used by memory lookups if they don't exist.
     */
    void createIndexes();

    @Override
    void close();
}
