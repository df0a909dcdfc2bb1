package com.record.merge.core.model;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Persistent redirect from the id of a record removed by a merge to the record that survived it.
 *
 * @param id          alias id
 * @param recordType  type of both records
 * @param destroyedId id of the record that no longer exists
 * @param targetId    id of the surviving record
 * @param createdAt   creation time
 */
public record RecordAlias(
        String id,
        RecordType recordType,
        String destroyedId,
        String targetId,
        Instant createdAt
) {
    public RecordAlias {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(recordType, "recordType is required");
        Objects.requireNonNull(destroyedId, "destroyedId is required");
        Objects.requireNonNull(targetId, "targetId is required");
        Objects.requireNonNull(createdAt, "createdAt is required");
    }

    public RecordAlias withTarget(String newTargetId) {
        return new RecordAlias(id, recordType, destroyedId, newTargetId, createdAt);
    }

    public static RecordAlias of(RecordType recordType, String destroyedId, String targetId) {
        return new RecordAlias(UUID.randomUUID().toString(), recordType, destroyedId, targetId, Instant.now());
    }
}
