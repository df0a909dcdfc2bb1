package com.record.merge.graph;

import com.record.merge.core.model.CrmRecord;
import com.record.merge.core.model.RecordType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for GraphRecordRepository using a stub GraphConnection.
 */
class GraphRecordRepositoryTest {

    private StubGraphConnection connection;
    private GraphRecordRepository repository;

    @BeforeEach
    void setUp() {
        connection = new StubGraphConnection();
        repository = new GraphRecordRepository(connection);
    }

    private static Map<String, Object> row(String id, String type, Map<String, Object> extra) {
        Map<String, Object> props = new HashMap<>(Map.of(
                "id", id,
                "recordType", type,
                "tags", List.of("vip"),
                "createdAt", "2024-01-15T10:30:00Z",
                "updatedAt", "2024-01-16T10:30:00Z"));
        props.putAll(extra);
        return Map.of("props", props);
    }

    @Test
    @SuppressWarnings("unchecked")
    void save_prefixesAttributesAndSkipsNulls() {
        CrmRecord record = CrmRecord.builder()
                .id("a1").type(RecordType.ACCOUNT)
                .attribute("name", "Acme").attribute("fax", null)
                .tag("vip")
                .build();

        repository.save(record);

        assertTrue(connection.lastQuery().contains("MERGE (r:CrmRecord"));
        Map<String, Object> props = (Map<String, Object>) connection.lastParams().get("props");
        assertEquals("Acme", props.get("attr_name"));
        assertFalse(props.containsKey("attr_fax"));
        assertEquals("ACCOUNT", props.get("recordType"));
        assertEquals(List.of("vip"), props.get("tags"));
    }

    @Test
    void findById_mapsNodeProperties() {
        connection.queryResults = List.of(row("a1", "ACCOUNT", Map.of("attr_name", "Acme", "attr_rating", 4L)));

        CrmRecord record = repository.findById(RecordType.ACCOUNT, "a1").orElseThrow();

        assertEquals("a1", record.getId());
        assertEquals("Acme", record.get("name"));
        assertEquals(4L, record.get("rating"));
        assertEquals(Set.of("vip"), record.getTags());
        assertEquals("2024-01-15T10:30:00Z", record.getCreatedAt().toString());
    }

    @Test
    void findById_missing_returnsEmpty() {
        assertTrue(repository.findById(RecordType.CONTACT, "nope").isEmpty());
    }

    @Test
    void delete_missing_doesNotExecute() {
        assertFalse(repository.delete(RecordType.ACCOUNT, "nope"));
        assertTrue(connection.executedQueries.stream().noneMatch(q -> q.contains("DELETE")));
    }

    @Test
    void delete_existing_deletesNode() {
        connection.queryResults = List.of(row("a1", "ACCOUNT", Map.of()));

        assertTrue(repository.delete(RecordType.ACCOUNT, "a1"));
        assertTrue(connection.lastQuery().contains("DELETE r"));
    }

    @Test
    void reassignReference_findsThenUpdates() {
        connection.thenReturn(List.of(Map.of("id", "c1"), Map.of("id", "c2")));

        List<String> ids = repository.reassignReference(RecordType.CONTACT, "account_id", "a2", "a1");

        assertEquals(List.of("c1", "c2"), ids);
        assertTrue(connection.lastQuery().contains("SET r.attr_account_id = $value"));
        assertEquals("a1", connection.lastParams().get("value"));
        assertEquals(List.of("c1", "c2"), connection.lastParams().get("ids"));
    }

    @Test
    void reassignReference_nothingToMove_skipsUpdate() {
        assertTrue(repository.reassignReference(RecordType.CONTACT, "account_id", "a2", "a1").isEmpty());
        assertEquals(1, connection.executedQueries.size());
    }

    @Test
    void count_readsCountColumn() {
        connection.queryResults = List.of(Map.of("cnt", 3L));
        assertEquals(3, repository.count(RecordType.ACCOUNT));
    }

    @Test
    void propertyName_rejectsUnsafeAttributes() {
        assertEquals("attr_cf_region", GraphRecordRepository.propertyName("cf_region"));
        assertThrows(IllegalArgumentException.class, () -> GraphRecordRepository.propertyName("x} DELETE r //"));
    }
}
