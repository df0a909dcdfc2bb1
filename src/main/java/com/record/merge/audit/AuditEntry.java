package com.record.merge.audit;

import com.record.merge.core.model.RecordType;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable record of an auditable operation.
 *
 * @param recordType type of the audited record, null for type-less actions
 * @param recordId   id of the audited record; for merges, the duplicate
 * @param details    action-specific data; merge entries carry {@value #MASTER_ID}
 */
public record AuditEntry(
        String id,
        AuditAction action,
        RecordType recordType,
        String recordId,
        String actorId,
        Map<String, Object> details,
        Instant timestamp
) {
    public AuditEntry {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(action, "action is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
        details = details != null ? Map.copyOf(details) : Map.of();
    }

    public static final String MASTER_ID = "masterId";

    /**
     * The surviving record of a merge entry, or null for other entries.
     */
    public String masterId() {
        Object masterId = details.get(MASTER_ID);
        return masterId != null ? masterId.toString() : null;
    }

    /**
     * Whether this is a committed merge that absorbed a record into {@code masterId}.
     */
    public boolean isMergeInto(String masterId) {
        return action == AuditAction.RECORD_MERGED && masterId.equals(masterId());
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id = UUID.randomUUID().toString();
        private AuditAction action;
        private RecordType recordType;
        private String recordId;
        private String actorId;
        private Map<String, Object> details;
        private Instant timestamp = Instant.now();

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder action(AuditAction action) {
            this.action = action;
            return this;
        }

        public Builder recordType(RecordType recordType) {
            this.recordType = recordType;
            return this;
        }

        public Builder recordId(String recordId) {
            this.recordId = recordId;
            return this;
        }

        public Builder actorId(String actorId) {
            this.actorId = actorId;
            return this;
        }

        public Builder details(Map<String, Object> details) {
            this.details = details;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public AuditEntry build() {
            return new AuditEntry(id, action, recordType, recordId, actorId, details, timestamp);
        }
    }
}
