package com.record.merge.graph;

import com.falkordb.Driver;
import com.falkordb.FalkorDB;
import com.falkordb.Graph;
import com.falkordb.Record;
import com.falkordb.ResultSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * FalkorDB-specific implementation using JFalkorDB client.
 */
public class FalkorDBConnection implements GraphConnection {
    private static final Logger log = LoggerFactory.getLogger(FalkorDBConnection.class);

    private final Driver driver;
    private final Graph graph;
    private final String graphName;

    public FalkorDBConnection(String host, int port, String graphName) {
        this.driver = FalkorDB.driver(host, port);
        this.graphName = graphName;
        this.graph = driver.graph(graphName);
        log.info("FalkorDB connection initialized for graph: {}", graphName);
    }

    @Override
    public void execute(String query, Map<String, Object> params) {
        String rendered = CypherLiterals.render(query, params);
        log.debug("Executing: {}", rendered);
        graph.query(rendered);
    }

    @Override
    public List<Map<String, Object>> query(String query, Map<String, Object> params) {
        String rendered = CypherLiterals.render(query, params);
        log.debug("Querying: {}", rendered);

        ResultSet resultSet = graph.query(rendered);
        List<Map<String, Object>> rows = new ArrayList<>();
        for (Record record : resultSet) {
            Map<String, Object> row = new HashMap<>();
            for (String key : record.keys()) {
                row.put(key, record.getValue(key));
            }
            rows.add(row);
        }
        log.debug("Query returned {} rows", rows.size());
        return rows;
    }

    @Override
    public boolean isConnected() {
        try {
            graph.query("RETURN 1");
            return true;
        } catch (Exception e) {
            log.warn("Connection check failed", e);
            return false;
        }
    }

    @Override
    public String getGraphName() {
        return graphName;
    }

    @Override
    public void createIndexes() {
        log.info("Creating indexes for record merge...");

        safeExecute("CREATE INDEX FOR (r:CrmRecord) ON (r.id)");
        safeExecute("CREATE INDEX FOR (r:CrmRecord) ON (r.recordType)");
        safeExecute("CREATE INDEX FOR (r:CrmRecord) ON (r.attr_account_id)");

        safeExecute("CREATE INDEX FOR (c:ChildRecord) ON (c.id)");
        safeExecute("CREATE INDEX FOR (c:ChildRecord) ON (c.ownerId)");

        safeExecute("CREATE INDEX FOR (a:RecordAlias) ON (a.destroyedId)");
        safeExecute("CREATE INDEX FOR (a:RecordAlias) ON (a.targetId)");

        log.info("Index creation complete");
    }

    private void safeExecute(String query) {
        try {
            graph.query(query);
        } catch (Exception e) {
            // index may already exist
            log.debug("Index creation query result: {} - {}", query, e.getMessage());
        }
    }

    @Override
    public void close() {
        try {
            driver.close();
        } catch (Exception e) {
            log.warn("Error closing FalkorDB connection", e);
        }
        log.info("FalkorDB connection closed");
    }
}
