package com.invoice.memory.graph;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import redis.clients.jedis.JedisPooled;
import redis.clients.jedis.graph.Record;
import redis.clients.jedis.graph.ResultSet;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * FalkorDB connection speaking {@code GRAPH.QUERY} through the Jedis graph
 * commands. Memories are stored as {@code :Memory} nodes; query parameters
 * are sent as a {@code CYPHER} header rather than spliced into the query text.
 */
public class FalkorDBConnection implements GraphConnection {
    private static final Logger log = LoggerFactory.getLogger(FalkorDBConnection.class);

    private static final List<String> MEMORY_INDEXES = List.of(
            "CREATE INDEX FOR (m:Memory) ON (m.id)",
            "CREATE INDEX FOR (m:Memory) ON (m.vendor, m.pattern)");

    private final JedisPooled client;
    private final String graphName;

    public FalkorDBConnection(String host, int port, String graphName) {
        this.client = new JedisPooled(host, port);
        this.graphName = graphName;
        log.info("graph.connected graph={}", graphName);
    }

    @Override
    public void execute(String query, Map<String, Object> params) {
        log.debug("graph.execute query={} params={}", query, params.keySet());
        run(query, params);
    }

    @Override
    public List<Map<String, Object>> query(String query, Map<String, Object> params) {
        log.debug("graph.query query={} params={}", query, params.keySet());
        List<Map<String, Object>> rows = new ArrayList<>();
        for (Record record : run(query, params)) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (String key : record.keys()) {
                row.put(key, record.getValue(key));
            }
            rows.add(row);
        }
        return rows;
    }

    private ResultSet run(String query, Map<String, Object> params) {
        return params == null || params.isEmpty()
                ? client.graphQuery(graphName, query)
                : client.graphQuery(graphName, query, params);
    }

    @Override
    public boolean isConnected() {
        try {
            client.graphQuery(graphName, "RETURN 1");
            return true;
        } catch (RuntimeException e) {
            log.warn("graph.unreachable graph={}", graphName, e);
            return false;
        }
    }

    @Override
    public String getGraphName() {
        return graphName;
    }

    /**
     * Creates the memory indexes. FalkorDB rejects an index that already
     * exists, which is expected on every start after the first.
     */
    @Override
    public void createIndexes() {
        for (String statement : MEMORY_INDEXES) {
            try {
                client.graphQuery(graphName, statement);
                log.info("graph.index.created statement='{}'", statement);
            } catch (RuntimeException e) {
                log.debug("graph.index.exists statement='{}' reason={}", statement, e.getMessage());
            }
        }
    }

    @Override
    public void close() {
        client.close();
        log.info("graph.closed graph={}", graphName);
    }
}
