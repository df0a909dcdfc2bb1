package com.record.merge.store;

import com.record.merge.core.model.Association;
import com.record.merge.core.model.ChildRecord;
import com.record.merge.core.model.CrmRecord;
import com.record.merge.core.model.RecordAlias;
import com.record.merge.core.model.RecordType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryChildAndAliasRepositoryTest {

    @Nested
    @DisplayName("InMemoryChildRecordRepository")
    class Children {

        private final InMemoryChildRecordRepository repository = new InMemoryChildRecordRepository();
        private final CrmRecord account = CrmRecord.builder().id("a1").type(RecordType.ACCOUNT).build();
        private final CrmRecord contact = CrmRecord.builder().id("a1").type(RecordType.CONTACT).build();

        @Test
        @DisplayName("Owners are matched on association and owner type")
        void findByOwner_matchesAssociationAndType() {
            repository.save(ChildRecord.of(Association.EMAILS, account));
            repository.save(ChildRecord.of(Association.TASKS, account));
            repository.save(ChildRecord.of(Association.EMAILS, contact));

            assertEquals(1, repository.countByOwner(Association.EMAILS, RecordType.ACCOUNT, "a1"));
            assertEquals(1, repository.countByOwner(Association.EMAILS, RecordType.CONTACT, "a1"));
        }

        @Test
        @DisplayName("reassignOwner moves only the given association")
        void reassignOwner() {
            ChildRecord email = repository.save(ChildRecord.of(Association.EMAILS, account));
            repository.save(ChildRecord.of(Association.TASKS, account));

            List<String> moved = repository.reassignOwner(Association.EMAILS, RecordType.ACCOUNT, "a1", "a0");

            assertEquals(List.of(email.id()), moved);
            assertEquals("a0", repository.findById(email.id()).orElseThrow().ownerId());
            assertEquals(1, repository.countByOwner(Association.TASKS, RecordType.ACCOUNT, "a1"));
        }

        @Test
        @DisplayName("delete removes the child")
        void delete() {
            ChildRecord email = repository.save(ChildRecord.of(Association.EMAILS, account));

            assertTrue(repository.delete(email.id()));
            assertTrue(repository.findById(email.id()).isEmpty());
        }
    }

    @Nested
    @DisplayName("InMemoryAliasRepository")
    class Aliases {

        private final InMemoryAliasRepository repository = new InMemoryAliasRepository();

        @Test
        @DisplayName("Lookups are scoped by type")
        void scopedByType() {
            repository.save(RecordAlias.of(RecordType.ACCOUNT, "a2", "a1"));

            assertTrue(repository.findByDestroyedId(RecordType.ACCOUNT, "a2").isPresent());
            assertTrue(repository.findByDestroyedId(RecordType.CONTACT, "a2").isEmpty());
            assertEquals(1, repository.findByTargetId(RecordType.ACCOUNT, "a1").size());
        }

        @Test
        @DisplayName("Saving the same id replaces the alias")
        void saveReplaces() {
            RecordAlias alias = repository.save(RecordAlias.of(RecordType.ACCOUNT, "a2", "a1"));
            repository.save(alias.withTarget("a0"));

            assertEquals(1, repository.count(RecordType.ACCOUNT));
            assertEquals("a0", repository.findById(alias.id()).orElseThrow().targetId());
        }
    }
}
