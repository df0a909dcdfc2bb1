package com.record.merge.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CrmRecord Tests")
class CrmRecordTest {

    @Test
    @DisplayName("Builder generates an id and accepts scalar attributes")
    void builderDefaults() {
        CrmRecord record = CrmRecord.builder()
                .type(RecordType.ACCOUNT)
                .attribute("name", "Acme")
                .attribute("rating", 3)
                .attribute("access", null)
                .build();

        assertNotNull(record.getId());
        assertEquals("Acme", record.get("name"));
        assertEquals("3", record.getString("rating"));
        assertTrue(record.getAttributes().containsKey("access"));
        assertEquals(record.getCreatedAt(), record.getUpdatedAt());
    }

    @Test
    @DisplayName("Type is required")
    void typeRequired() {
        assertThrows(NullPointerException.class, () -> CrmRecord.builder().build());
    }

    @Test
    @DisplayName("Non-scalar attribute values are rejected")
    void unsupportedValueRejected() {
        CrmRecord record = CrmRecord.builder().type(RecordType.CONTACT).build();
        assertThrows(IllegalArgumentException.class, () -> record.set("born_on", List.of(1)));
    }

    @Test
    @DisplayName("Tag list is split, trimmed and deduplicated")
    void tagList() {
        CrmRecord record = CrmRecord.builder()
                .type(RecordType.ACCOUNT)
                .tagList("vip, partner,,vip ")
                .build();

        assertEquals(Set.of("vip", "partner"), record.getTags());
    }

    @Test
    @DisplayName("Merge attributes list declared fields and custom fields without permanent exclusions")
    void mergeAttributes() {
        CrmRecord record = CrmRecord.builder()
                .type(RecordType.ACCOUNT)
                .attribute("name", "Acme")
                .attribute("cf_region", "EMEA")
                .attribute("subscribed_users", "1,2")
                .build();

        Map<String, Object> merge = record.getMergeAttributes();

        assertTrue(merge.containsKey("website"));
        assertNull(merge.get("website"));
        assertEquals("EMEA", merge.get("cf_region"));
        assertFalse(merge.containsKey("subscribed_users"));
        assertEquals("user_id", merge.keySet().iterator().next());
    }

    @Test
    @DisplayName("Copies are independent of the original")
    void copyIsDeep() {
        Instant created = Instant.parse("2024-01-01T00:00:00Z");
        CrmRecord original = CrmRecord.builder()
                .id("a1").type(RecordType.ACCOUNT).attribute("name", "Acme").tag("vip").createdAt(created)
                .build();

        CrmRecord copy = original.copy();
        copy.set("name", "Other");
        copy.addTags(List.of("new"));

        assertEquals(original, copy);
        assertEquals("Acme", original.get("name"));
        assertEquals(Set.of("vip"), original.getTags());
        assertEquals(created, copy.getCreatedAt());
    }
}
