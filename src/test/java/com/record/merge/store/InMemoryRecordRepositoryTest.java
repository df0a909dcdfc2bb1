package com.record.merge.store;

import com.record.merge.core.model.CrmRecord;
import com.record.merge.core.model.RecordType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryRecordRepositoryTest {

    private InMemoryRecordRepository repository;

    @BeforeEach
    void setUp() {
        repository = new InMemoryRecordRepository();
    }

    private CrmRecord contact(String id, String accountId) {
        return repository.save(CrmRecord.builder()
                .id(id).type(RecordType.CONTACT).attribute("account_id", accountId).build());
    }

    @Test
    void findById_returnsDetachedCopy() {
        repository.save(CrmRecord.builder().id("a1").type(RecordType.ACCOUNT).attribute("name", "Acme").build());

        CrmRecord loaded = repository.findById(RecordType.ACCOUNT, "a1").orElseThrow();
        loaded.set("name", "Changed");

        assertEquals("Acme", repository.findById(RecordType.ACCOUNT, "a1").orElseThrow().get("name"));
    }

    @Test
    void idsAreScopedByType() {
        repository.save(CrmRecord.builder().id("x").type(RecordType.ACCOUNT).build());

        assertTrue(repository.exists(RecordType.ACCOUNT, "x"));
        assertFalse(repository.exists(RecordType.CONTACT, "x"));
        assertEquals(0, repository.count(RecordType.CONTACT));
    }

    @Test
    void reassignReference_movesMatchingRecordsOnly() {
        contact("c1", "a2");
        contact("c2", "a2");
        contact("c3", "a9");

        List<String> changed = repository.reassignReference(RecordType.CONTACT, "account_id", "a2", "a1");

        assertEquals(2, changed.size());
        assertEquals(2, repository.findByAttribute(RecordType.CONTACT, "account_id", "a1").size());
        assertEquals(1, repository.findByAttribute(RecordType.CONTACT, "account_id", "a9").size());
    }

    @Test
    void assignReference_setsValueOnGivenIds() {
        contact("c1", "a1");
        contact("c2", "a1");

        repository.assignReference(RecordType.CONTACT, "account_id", List.of("c1", "missing"), "a2");

        assertEquals("a2", repository.findById(RecordType.CONTACT, "c1").orElseThrow().get("account_id"));
        assertEquals("a1", repository.findById(RecordType.CONTACT, "c2").orElseThrow().get("account_id"));
    }

    @Test
    void delete_reportsWhetherRemoved() {
        contact("c1", null);

        assertTrue(repository.delete(RecordType.CONTACT, "c1"));
        assertFalse(repository.delete(RecordType.CONTACT, "c1"));
    }
}
