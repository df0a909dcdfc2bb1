package com.record.merge.rest.dto;

import com.record.merge.merge.MergeResult;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Response DTO for a committed merge.
 */
public record MergeResponse(
        String outcome,
        String recordType,
        String duplicateId,
        String masterId,
        RecordResponse master,
        List<String> copiedAttributes,
        Map<String, Integer> movedChildren,
        String aliasId,
        int repointedAliases
) {
    public static MergeResponse from(MergeResult result) {
        Map<String, Integer> moved = new LinkedHashMap<>();
        result.movedChildren().forEach((association, count) -> moved.put(association.getLabel(), count));
        return new MergeResponse(
                result.outcome().name(),
                result.type().name(),
                result.duplicateId(),
                result.masterId(),
                result.master() != null ? RecordResponse.from(result.master()) : null,
                result.copiedAttributes(),
                moved,
                result.aliasId(),
                result.repointedAliases()
        );
    }
}
