package com.record.merge.graph;

import java.util.List;
import java.util.Map;

/**
 * Connection to the graph database holding CRM records, association children, aliases and audit entries.
 * Abstracts the underlying graph database implementation.
 */
public interface GraphConnection extends AutoCloseable {

    /**
     * Executes a Cypher statement that modifies the graph.
     *
     * @param query  the Cypher statement
     * @param params statement parameters, referenced as {@code $name}
     */
    void execute(String query, Map<String, Object> params);

    default void execute(String query) {
        execute(query, Map.of());
    }

    /**
     * Executes a Cypher query and returns its rows keyed by column alias.
     */
    List<Map<String, Object>> query(String query, Map<String, Object> params);

    default List<Map<String, Object>> query(String query) {
        return query(query, Map.of());
    }

    boolean isConnected();

    String getGraphName();

    /**
     * Creates the indexes used by the record merge queries if they don't exist.
     */
    void createIndexes();

    @Override
    void close();
}
