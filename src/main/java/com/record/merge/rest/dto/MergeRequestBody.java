package com.record.merge.rest.dto;

import com.record.merge.core.model.RecordType;
import com.record.merge.merge.AttributeSource;
import com.record.merge.merge.MergeRequest;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Request DTO for merging two records.
 *
 * @param ignoredAttributes attributes the master keeps as they are
 * @param choices           per-attribute selection, {@code "master"} or {@code "duplicate"}
 * @param triggeredBy       actor recorded in the audit trail
 */
public record MergeRequestBody(
        List<String> ignoredAttributes,
        Map<String, String> choices,
        String triggeredBy
) {
    public MergeRequestBody {
        ignoredAttributes = ignoredAttributes != null ? List.copyOf(ignoredAttributes) : List.of();
        choices = choices != null ? Collections.unmodifiableMap(new LinkedHashMap<>(choices)) : Map.of();
        choices.forEach((attribute, side) -> parseSource(attribute, side));
    }

    public static MergeRequestBody empty() {
        return new MergeRequestBody(null, null, null);
    }

    public MergeRequest toRequest(RecordType type, String duplicateId, String masterId) {
        Map<String, AttributeSource> parsed = new LinkedHashMap<>();
        choices.forEach((attribute, side) -> parsed.put(attribute, parseSource(attribute, side)));
        return MergeRequest.builder()
                .type(type)
                .duplicateId(duplicateId)
                .masterId(masterId)
                .ignoredAttributes(ignoredAttributes)
                .choices(parsed)
                .triggeredBy(triggeredBy)
                .build();
    }

    private static AttributeSource parseSource(String attribute, String side) {
        if (side == null) {
            throw new IllegalArgumentException("choice for '" + attribute + "' is required");
        }
        return switch (side.trim().toLowerCase(Locale.ROOT)) {
            case "master" -> AttributeSource.MASTER;
            case "duplicate" -> AttributeSource.DUPLICATE;
            default -> throw new IllegalArgumentException("choice for '" + attribute
                    + "' must be 'master' or 'duplicate', got '" + side + "'");
        };
    }
}
