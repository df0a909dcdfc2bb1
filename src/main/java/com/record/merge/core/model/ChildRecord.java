package com.record.merge.core.model;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * A record owned by a CRM record through a has-many association
 * (an email, comment, address, task or opportunity).
 *
 * @param id         child id
 * @param association association the child belongs to
 * @param ownerType  type of the owning record
 * @param ownerId    id of the owning record
 * @param attributes free-form payload, e.g. {@code address_type} or {@code subject}
 * @param createdAt  creation time
 */
public record ChildRecord(
        String id,
        Association association,
        RecordType ownerType,
        String ownerId,
        Map<String, Object> attributes,
        Instant createdAt
) {
    public ChildRecord {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(association, "association is required");
        Objects.requireNonNull(ownerType, "ownerType is required");
        Objects.requireNonNull(ownerId, "ownerId is required");
        Objects.requireNonNull(createdAt, "createdAt is required");
        if (association.isRecordReference()) {
            throw new IllegalArgumentException(association + " children are CRM records, not child rows");
        }
        attributes = attributes != null ? Map.copyOf(attributes) : Map.of();
    }

    /**
     * Returns a copy of this child owned by another record.
     */
    public ChildRecord withOwner(String newOwnerId) {
        return new ChildRecord(id, association, ownerType, newOwnerId, attributes, createdAt);
    }

    public static ChildRecord of(Association association, CrmRecord owner, Map<String, Object> attributes) {
        return new ChildRecord(UUID.randomUUID().toString(), association, owner.getType(),
                owner.getId(), attributes, Instant.now());
    }

    public static ChildRecord of(Association association, CrmRecord owner) {
        return of(association, owner, Map.of());
    }
}
