package com.record.merge.graph;

import com.record.merge.core.model.Association;
import com.record.merge.core.model.ChildRecord;
import com.record.merge.core.model.RecordType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class GraphChildRecordRepositoryTest {

    private StubGraphConnection connection;
    private GraphChildRecordRepository repository;

    @BeforeEach
    void setUp() {
        connection = new StubGraphConnection();
        repository = new GraphChildRecordRepository(connection);
    }

    private static Map<String, Object> row(String id, String ownerId, String attributes) {
        return Map.of("id", id, "association", "ADDRESSES", "ownerType", "ACCOUNT",
                "ownerId", ownerId, "attributes", attributes, "createdAt", "2024-01-15T10:30:00Z");
    }

    @Test
    void save_serializesAttributesAsJson() {
        ChildRecord child = new ChildRecord("ch1", Association.ADDRESSES, RecordType.ACCOUNT, "a1",
                Map.of("address_type", "Billing"), Instant.parse("2024-01-15T10:30:00Z"));

        repository.save(child);

        assertTrue(connection.lastQuery().contains("MERGE (c:ChildRecord"));
        assertEquals("{\"address_type\":\"Billing\"}", connection.lastParams().get("attributes"));
        assertEquals("ADDRESSES", connection.lastParams().get("association"));
    }

    @Test
    void findByOwner_mapsRows() {
        connection.queryResults = List.of(row("ch1", "a1", "{\"address_type\":\"Billing\"}"));

        List<ChildRecord> found = repository.findByOwner(Association.ADDRESSES, RecordType.ACCOUNT, "a1");

        assertEquals(1, found.size());
        assertEquals("Billing", found.get(0).attributes().get("address_type"));
        assertEquals("a1", found.get(0).ownerId());
    }

    @Test
    void reassignOwner_updatesFoundIds() {
        connection.thenReturn(List.of(row("ch1", "a2", "{}"), row("ch2", "a2", "{}")));

        List<String> moved = repository.reassignOwner(Association.ADDRESSES, RecordType.ACCOUNT, "a2", "a1");

        assertEquals(List.of("ch1", "ch2"), moved);
        assertTrue(connection.lastQuery().contains("SET c.ownerId = $ownerId"));
        assertEquals("a1", connection.lastParams().get("ownerId"));
    }

    @Test
    void assignOwner_emptyIds_isNoOp() {
        repository.assignOwner(List.of(), "a1");
        assertTrue(connection.executedQueries.isEmpty());
    }

    @Test
    void findById_corruptJson_yieldsEmptyAttributes() {
        connection.queryResults = List.of(row("ch1", "a1", "{not json"));

        assertTrue(repository.findById("ch1").orElseThrow().attributes().isEmpty());
    }
}
