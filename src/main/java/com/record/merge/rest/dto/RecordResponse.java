package com.record.merge.rest.dto;

import com.record.merge.core.model.CrmRecord;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Response DTO for a CRM record.
 */
public record RecordResponse(
        String id,
        String recordType,
        Map<String, Object> attributes,
        List<String> tags,
        Instant createdAt,
        Instant updatedAt
) {
    public static RecordResponse from(CrmRecord record) {
        return new RecordResponse(
                record.getId(),
                record.getType().name(),
                Collections.unmodifiableMap(new LinkedHashMap<>(record.getAttributes())),
                List.copyOf(record.getTags()),
                record.getCreatedAt(),
                record.getUpdatedAt()
        );
    }
}
