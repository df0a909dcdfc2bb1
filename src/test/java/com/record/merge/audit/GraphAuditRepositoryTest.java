package com.record.merge.audit;

import com.record.merge.core.model.RecordType;
import com.record.merge.graph.StubGraphConnection;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for GraphAuditRepository using a stub GraphConnection.
 */
class GraphAuditRepositoryTest {

    private StubGraphConnection connection;
    private GraphAuditRepository repository;

    @BeforeEach
    void setUp() {
        connection = new StubGraphConnection();
        repository = new GraphAuditRepository(connection);
    }

    @Test
    void constructor_createsIndexes() {
        assertEquals(5, connection.executedQueries.stream().filter(q -> q.startsWith("CREATE INDEX")).count());
    }

    @Test
    void save_executesCypherCreateWithJsonDetails() {
        AuditEntry entry = AuditEntry.builder()
                .id("audit-1")
                .action(AuditAction.RECORD_MERGED)
                .recordType(RecordType.ACCOUNT)
                .recordId("a2")
                .actorId("alice")
                .details(Map.of("masterId", "a1"))
                .timestamp(Instant.parse("2024-01-15T10:30:00Z"))
                .build();

        AuditEntry result = repository.save(entry);

        assertEquals(entry, result);
        assertTrue(connection.lastQuery().contains("CREATE (a:AuditEntry"));
        assertEquals("{\"masterId\":\"a1\"}", connection.lastParams().get("details"));
        assertEquals("ACCOUNT", connection.lastParams().get("recordType"));
        assertEquals("a1", connection.lastParams().get("masterId"));
    }

    @Test
    void findMergesInto_matchesOnMasterIdProperty() {
        connection.queryResults = List.of(Map.of("id", "audit-1", "action", "RECORD_MERGED", "recordType", "ACCOUNT",
                "recordId", "a2", "actorId", "alice", "details", "{\"masterId\":\"a1\"}",
                "timestamp", "2024-01-15T10:30:00Z"));

        List<AuditEntry> merges = repository.findMergesInto("a1");

        assertTrue(connection.lastQuery().contains("masterId: $masterId"));
        assertEquals("RECORD_MERGED", connection.lastParams().get("action"));
        assertEquals("a1", merges.get(0).masterId());
    }

    @Test
    void findByRecordId_mapsRows() {
        connection.queryResults = List.of(Map.of("id", "a1", "action", "RECORD_MERGED", "recordType", "ACCOUNT",
                "recordId", "a2", "actorId", "alice", "details", "{\"masterId\":\"a1\"}",
                "timestamp", "2024-01-15T10:30:00Z"));

        List<AuditEntry> results = repository.findByRecordId("a2");

        assertEquals(1, results.size());
        assertEquals(AuditAction.RECORD_MERGED, results.get(0).action());
        assertEquals(RecordType.ACCOUNT, results.get(0).recordType());
        assertEquals("a1", results.get(0).details().get("masterId"));
    }

    @Test
    void emptyStringsMapBackToNull() {
        connection.queryResults = List.of(Map.of("id", "a1", "action", "RECORD_CREATED", "recordType", "",
                "recordId", "", "actorId", "", "details", "{}", "timestamp", "2024-01-15T10:30:00Z"));

        AuditEntry entry = repository.findAll().get(0);

        assertNull(entry.recordType());
        assertNull(entry.recordId());
        assertNull(entry.actorId());
        assertTrue(entry.details().isEmpty());
    }

    @Test
    void count_readsCountColumn() {
        connection.queryResults = List.of(Map.of("cnt", 7L));
        assertEquals(7, repository.count());
    }
}
