package com.record.merge.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.record.merge.core.model.RecordType;
import com.record.merge.graph.GraphConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Stores audit entries as {@code :AuditEntry} nodes. Details are kept as a JSON string;
 * the master id of merge entries is also copied to an indexed {@code masterId} property.
 */
public class GraphAuditRepository implements AuditRepository {
    private static final Logger log = LoggerFactory.getLogger(GraphAuditRepository.class);
    private static final TypeReference<Map<String, Object>> DETAILS_TYPE = new TypeReference<>() {};

    private static final String RETURN_ENTRY = """
            RETURN a.id as id, a.action as action, a.recordType as recordType, a.recordId as recordId,
                   a.actorId as actorId, a.details as details, a.timestamp as timestamp
            """;

    private final GraphConnection connection;
    private final ObjectMapper objectMapper;

    public GraphAuditRepository(GraphConnection connection) {
        this.connection = connection;
        this.objectMapper = new ObjectMapper();
        createIndexes();
    }

    private void createIndexes() {
        safeExecute("CREATE INDEX FOR (a:AuditEntry) ON (a.id)");
        safeExecute("CREATE INDEX FOR (a:AuditEntry) ON (a.recordId)");
        safeExecute("CREATE INDEX FOR (a:AuditEntry) ON (a.action)");
        safeExecute("CREATE INDEX FOR (a:AuditEntry) ON (a.masterId)");
        safeExecute("CREATE INDEX FOR (a:AuditEntry) ON (a.timestamp)");
    }

    private void safeExecute(String query) {
        try {
            connection.execute(query);
        } catch (Exception e) {
            log.debug("Index creation query result: {} - {}", query, e.getMessage());
        }
    }

    @Override
    public AuditEntry save(AuditEntry entry) {
        String query = """
                CREATE (a:AuditEntry {
                    id: $id,
                    action: $action,
                    recordType: $recordType,
                    recordId: $recordId,
                    actorId: $actorId,
                    masterId: $masterId,
                    details: $details,
                    timestamp: $timestamp
                })
                """;
        connection.execute(query, Map.of(
                "id", entry.id(),
                "action", entry.action().name(),
                "recordType", entry.recordType() != null ? entry.recordType().name() : "",
                "recordId", entry.recordId() != null ? entry.recordId() : "",
                "actorId", entry.actorId() != null ? entry.actorId() : "",
                "masterId", entry.masterId() != null ? entry.masterId() : "",
                "details", serializeDetails(entry.details()),
                "timestamp", entry.timestamp().toString()
        ));
        log.debug("Persisted audit entry: {} for record {}", entry.action(), entry.recordId());
        return entry;
    }

    @Override
    public List<AuditEntry> findAll() {
        return mapResults(connection.query("MATCH (a:AuditEntry)\n" + RETURN_ENTRY + "ORDER BY a.timestamp ASC"));
    }

    @Override
    public List<AuditEntry> findByRecordId(String recordId) {
        return mapResults(connection.query(
                "MATCH (a:AuditEntry {recordId: $recordId})\n" + RETURN_ENTRY + "ORDER BY a.timestamp ASC",
                Map.of("recordId", recordId)));
    }

    @Override
    public List<AuditEntry> findByAction(AuditAction action) {
        return mapResults(connection.query(
                "MATCH (a:AuditEntry {action: $action})\n" + RETURN_ENTRY + "ORDER BY a.timestamp ASC",
                Map.of("action", action.name())));
    }

    @Override
    public List<AuditEntry> findMergesInto(String masterId) {
        return mapResults(connection.query(
                "MATCH (a:AuditEntry {action: $action, masterId: $masterId})\n" + RETURN_ENTRY + "ORDER BY a.timestamp ASC",
                Map.of("action", AuditAction.RECORD_MERGED.name(), "masterId", masterId)));
    }

    @Override
    public List<AuditEntry> findByActorId(String actorId) {
        return mapResults(connection.query(
                "MATCH (a:AuditEntry {actorId: $actorId})\n" + RETURN_ENTRY + "ORDER BY a.timestamp ASC",
                Map.of("actorId", actorId)));
    }

    @Override
    public List<AuditEntry> findBetween(Instant start, Instant end) {
        String query = """
                MATCH (a:AuditEntry)
                WHERE a.timestamp >= $start AND a.timestamp <= $end
                """ + RETURN_ENTRY + "ORDER BY a.timestamp ASC";
        return mapResults(connection.query(query, Map.of(
                "start", start.toString(),
                "end", end.toString()
        )));
    }

    @Override
    public int count() {
        List<Map<String, Object>> results = connection.query("MATCH (a:AuditEntry) RETURN count(a) as cnt");
        if (results.isEmpty()) {
            return 0;
        }
        return ((Number) results.get(0).get("cnt")).intValue();
    }

    @Override
    public List<AuditEntry> findRecent(int limit) {
        String query = "MATCH (a:AuditEntry)\n" + RETURN_ENTRY + "ORDER BY a.timestamp DESC\nLIMIT $limit";
        List<AuditEntry> reversed = new ArrayList<>(mapResults(connection.query(query, Map.of("limit", limit))));
        Collections.reverse(reversed);
        return reversed;
    }

    private List<AuditEntry> mapResults(List<Map<String, Object>> rows) {
        return rows.stream().map(this::mapToAuditEntry).toList();
    }

    private AuditEntry mapToAuditEntry(Map<String, Object> row) {
        String recordType = (String) row.get("recordType");
        String recordId = (String) row.get("recordId");
        String actorId = (String) row.get("actorId");
        String timestamp = (String) row.get("timestamp");

        return new AuditEntry(
                (String) row.get("id"),
                AuditAction.valueOf((String) row.get("action")),
                recordType != null && !recordType.isEmpty() ? RecordType.valueOf(recordType) : null,
                recordId != null && !recordId.isEmpty() ? recordId : null,
                actorId != null && !actorId.isEmpty() ? actorId : null,
                deserializeDetails((String) row.get("details")),
                timestamp != null ? Instant.parse(timestamp) : Instant.now());
    }

    private String serializeDetails(Map<String, Object> details) {
        if (details == null || details.isEmpty()) {
            return "{}";
        }
        try {
            return objectMapper.writeValueAsString(details);
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize audit details: {}", e.getMessage());
            return "{}";
        }
    }

    private Map<String, Object> deserializeDetails(String json) {
        if (json == null || json.isEmpty() || "{}".equals(json)) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, DETAILS_TYPE);
        } catch (JsonProcessingException e) {
            log.warn("Failed to deserialize audit details: {}", e.getMessage());
            return Map.of();
        }
    }
}
