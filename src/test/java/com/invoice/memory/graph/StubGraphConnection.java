package com.invoice.memory.graph;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Records executed Cypher and returns canned rows for queries.
 */
public class StubGraphConnection implements GraphConnection {

    public final List<String> executedQueries = new ArrayList<>();
    public final List<Map<String, Object>> executedParams = new ArrayList<>();
    public List<Map<String, Object>> queryResults = new ArrayList<>();
    public RuntimeException failure;
    public int indexRequests;

    @Override
    public void execute(String query, Map<String, Object> params) {
        if (failure != null) {
            throw failure;
        }
        executedQueries.add(query);
        executedParams.add(params);
    }

    @Override
    public List<Map<String, Object>> query(String query, Map<String, Object> params) {
        if (failure != null) {
            throw failure;
        }
        executedQueries.add(query);
        executedParams.add(params);
        return queryResults;
    }

    @Override
    public boolean isConnected() {
        return true;
    }

    @Override
    public String getGraphName() {
        return "test-graph";
    }

    @Override
    public void createIndexes() {
        indexRequests++;
    }

    @Override
    public void close() {
    }
}
