package com.record.merge.api;

import com.record.merge.audit.AuditAction;
import com.record.merge.cache.MergeListener;
import com.record.merge.core.model.Association;
import com.record.merge.core.model.ChildRecord;
import com.record.merge.core.model.CrmRecord;
import com.record.merge.core.model.RecordType;
import com.record.merge.graph.StubGraphConnection;
import com.record.merge.merge.AttributeSource;
import com.record.merge.merge.MergeOutcome;
import com.record.merge.merge.MergeRequest;
import com.record.merge.merge.MergeResult;
import com.record.merge.preview.MergePreview;
import com.record.merge.store.RecordInvalidException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("RecordMergeService Tests")
class RecordMergeServiceTest {

    private RecordMergeService service;

    @BeforeEach
    void setUp() {
        service = RecordMergeService.builder().build();
    }

    @AfterEach
    void tearDown() {
        service.close();
    }

    private CrmRecord account(String id, String name) {
        return service.createRecord(CrmRecord.builder()
                .id(id)
                .type(RecordType.ACCOUNT)
                .attribute("name", name)
                .build());
    }

    @Nested
    @DisplayName("Records and children")
    class RecordsAndChildren {

        @Test
        @DisplayName("Should store a valid record and audit it")
        void createRecord() {
            account("a1", "Acme");

            assertTrue(service.getRecord(RecordType.ACCOUNT, "a1").isPresent());
            assertEquals(1, service.getAuditService().getEntriesByAction(AuditAction.RECORD_CREATED).size());
        }

        @Test
        @DisplayName("Should refuse a record missing required attributes")
        void createInvalidRecord() {
            CrmRecord nameless = CrmRecord.builder().id("a1").type(RecordType.ACCOUNT).build();

            RecordInvalidException e = assertThrows(RecordInvalidException.class,
                    () -> service.createRecord(nameless));

            assertEquals(List.of("name can't be blank"), e.getViolations());
            assertTrue(service.getRecord(RecordType.ACCOUNT, "a1").isEmpty());
        }

        @Test
        @DisplayName("Should add children only on declared associations")
        void addChild() {
            CrmRecord acme = account("a1", "Acme");
            ChildRecord email = service.addChild(Association.EMAILS, acme, Map.of("subject", "Hello"));

            assertEquals(List.of(email), service.getChildren(RecordType.ACCOUNT, "a1", Association.EMAILS));
            assertEquals(1, service.getAuditService().getEntriesByAction(AuditAction.CHILD_CREATED).size());

            CrmRecord contact = service.createRecord(CrmRecord.builder()
                    .id("c1")
                    .type(RecordType.CONTACT)
                    .attribute("first_name", "Ann")
                    .attribute("last_name", "Lee")
                    .build());
            assertThrows(IllegalArgumentException.class,
                    () -> service.addChild(Association.CONTACTS, contact, Map.of()));
        }

        @Test
        @DisplayName("Contacts are read through the account reference")
        void contacts() {
            account("a1", "Acme");
            service.createRecord(CrmRecord.builder()
                    .id("c1")
                    .type(RecordType.CONTACT)
                    .attribute("first_name", "Ann")
                    .attribute("last_name", "Lee")
                    .attribute("account_id", "a1")
                    .build());

            assertEquals(1, service.getContacts("a1").size());
            assertEquals(1, service.countChildren(RecordType.ACCOUNT, "a1").get(Association.CONTACTS));
            assertThrows(IllegalArgumentException.class,
                    () -> service.getChildren(RecordType.ACCOUNT, "a1", Association.CONTACTS));
        }
    }

    @Nested
    @DisplayName("Merging")
    class Merging {

        @Test
        @DisplayName("A merged-away id resolves to the master")
        void mergeThenResolve() {
            CrmRecord master = account("a1", "Acme");
            CrmRecord duplicate = account("a2", "Acme Inc");
            service.addChild(Association.TASKS, duplicate, Map.of("name", "Call back"));

            MergeResult result = service.merge(MergeRequest.builder()
                    .type(RecordType.ACCOUNT)
                    .duplicateId("a2")
                    .masterId("a1")
                    .build());

            assertEquals(MergeOutcome.MERGED, result.outcome());
            assertEquals("a1", service.resolveId(RecordType.ACCOUNT, "a2").orElseThrow());
            assertEquals(master.getId(), service.resolve(RecordType.ACCOUNT, "a2").orElseThrow().getId());
            assertEquals(1, service.getChildren(RecordType.ACCOUNT, "a1", Association.TASKS).size());
            assertFalse(service.getRecord(RecordType.ACCOUNT, duplicate.getId()).isPresent());
        }

        @Test
        @DisplayName("The record-pair merge reports success as a boolean")
        void booleanMerge() {
            CrmRecord master = account("a1", "Acme");
            CrmRecord duplicate = account("a2", "Acme Inc");

            assertTrue(service.merge(duplicate, master, List.of("name")));
            assertFalse(service.merge(master, master));
        }

        @Test
        @DisplayName("Registered listeners hear about merges")
        void listenerNotified() {
            MergeListener listener = mock(MergeListener.class);
            try (RecordMergeService listened = RecordMergeService.builder().mergeListener(listener).build()) {
                listened.createRecord(CrmRecord.builder().id("a1").type(RecordType.ACCOUNT)
                        .attribute("name", "Acme").build());
                listened.createRecord(CrmRecord.builder().id("a2").type(RecordType.ACCOUNT)
                        .attribute("name", "Acme Inc").build());

                listened.merge(MergeRequest.builder()
                        .type(RecordType.ACCOUNT)
                        .duplicateId("a2")
                        .masterId("a1")
                        .choose("name", AttributeSource.DUPLICATE)
                        .build());

                verify(listener).onMerge(RecordType.ACCOUNT, "a2", "a1");
                assertEquals("Acme Inc", listened.getRecord(RecordType.ACCOUNT, "a1").orElseThrow().get("name"));
            }
        }

        @Test
        @DisplayName("Preview compares both records without changing them")
        void preview() {
            account("a1", "Acme");
            account("a2", "Acme Inc");

            MergePreview preview = service.preview(RecordType.ACCOUNT, "a2", "a1").orElseThrow();

            assertEquals("a1", preview.masterId());
            assertTrue(preview.attributes().stream().anyMatch(row -> row.name().equals("name")));
            assertTrue(service.getRecord(RecordType.ACCOUNT, "a2").isPresent());
            assertTrue(service.preview(RecordType.ACCOUNT, "a2", "missing").isEmpty());
        }
    }

    @Nested
    @DisplayName("Configuration")
    class Configuration {

        @Test
        @DisplayName("Graph storage creates indexes and leaves a borrowed connection open")
        void graphConnection() {
            StubGraphConnection connection = new StubGraphConnection();

            RecordMergeService graphService = RecordMergeService.builder().graphConnection(connection).build();
            graphService.close();

            assertTrue(connection.indexesCreated);
            assertFalse(connection.closed);
            assertSame(connection, graphService.getConnection());
        }

        @Test
        @DisplayName("Index creation can be skipped")
        void skipIndexes() {
            StubGraphConnection connection = new StubGraphConnection();

            RecordMergeService.builder().graphConnection(connection).createIndexes(false).build();

            assertFalse(connection.indexesCreated);
        }

        @Test
        @DisplayName("Options are validated when built")
        void invalidOptions() {
            assertThrows(IllegalArgumentException.class,
                    () -> MergeOptions.builder().maxAliasHops(0).build());
            assertThrows(IllegalArgumentException.class,
                    () -> MergeOptions.builder().defaultActor(" ").build());
            assertFalse(MergeOptions.builder().aliasCacheEnabled(false).build().toCacheConfig().enabled());
        }
    }
}
