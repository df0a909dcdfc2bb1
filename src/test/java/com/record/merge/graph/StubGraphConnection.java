package com.record.merge.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;

/**
 * GraphConnection that records every statement and answers queries from a queue of canned rows.
 */
public class StubGraphConnection implements GraphConnection {
    public final List<String> executedQueries = new ArrayList<>();
    public final List<Map<String, Object>> executedParams = new ArrayList<>();
    public final Deque<List<Map<String, Object>>> queuedResults = new ArrayDeque<>();
    public List<Map<String, Object>> queryResults = List.of();
    public boolean indexesCreated;
    public boolean closed;

    public StubGraphConnection thenReturn(List<Map<String, Object>> rows) {
        queuedResults.add(rows);
        return this;
    }

    @Override
    public void execute(String query, Map<String, Object> params) {
        executedQueries.add(query);
        executedParams.add(params);
    }

    @Override
    public List<Map<String, Object>> query(String query, Map<String, Object> params) {
        executedQueries.add(query);
        executedParams.add(params);
        return queuedResults.isEmpty() ? queryResults : queuedResults.poll();
    }

    public String lastQuery() {
        return executedQueries.get(executedQueries.size() - 1);
    }

    public Map<String, Object> lastParams() {
        return executedParams.get(executedParams.size() - 1);
    }

    @Override
    public boolean isConnected() {
        return !closed;
    }

    @Override
    public String getGraphName() {
        return "test-graph";
    }

    @Override
    public void createIndexes() {
        indexesCreated = true;
    }

    @Override
    public void close() {
        closed = true;
    }
}
