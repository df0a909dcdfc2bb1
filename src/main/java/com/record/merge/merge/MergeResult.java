package com.record.merge.merge;

import com.record.merge.core.model.Association;
import com.record.merge.core.model.CrmRecord;
import com.record.merge.core.model.RecordType;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Result of a merge attempt.
 *
 * @param outcome          what happened
 * @param type             type of the master
 * @param duplicateId      record merged away (or that would have been)
 * @param masterId         surviving record
 * @param master           the master as saved, null unless merged
 * @param copiedAttributes attributes whose value came from the duplicate
 * @param movedChildren    children re-parented per association
 * @param aliasId          id of the alias from the duplicate to the master, null unless merged
 * @param repointedAliases number of older aliases moved onto the master
 * @param violations       validation violations when the master could not be saved
 * @param message          human-readable reason for a failure
 */
public record MergeResult(
        MergeOutcome outcome,
        RecordType type,
        String duplicateId,
        String masterId,
        CrmRecord master,
        List<String> copiedAttributes,
        Map<Association, Integer> movedChildren,
        String aliasId,
        int repointedAliases,
        List<String> violations,
        String message
) {
    public MergeResult {
        Objects.requireNonNull(outcome, "outcome is required");
        copiedAttributes = copiedAttributes != null ? List.copyOf(copiedAttributes) : List.of();
        movedChildren = movedChildren != null && !movedChildren.isEmpty()
                ? Collections.unmodifiableMap(new EnumMap<>(movedChildren)) : Map.of();
        violations = violations != null ? List.copyOf(violations) : List.of();
    }

    public static MergeResult merged(CrmRecord master, String duplicateId, List<String> copiedAttributes,
                                     Map<Association, Integer> movedChildren, String aliasId, int repointedAliases) {
        return new MergeResult(MergeOutcome.MERGED, master.getType(), duplicateId, master.getId(), master,
                copiedAttributes, movedChildren, aliasId, repointedAliases, List.of(), null);
    }

    public static MergeResult rejected(MergeOutcome outcome, RecordType type, String duplicateId,
                                       String masterId, String message) {
        return new MergeResult(outcome, type, duplicateId, masterId, null,
                List.of(), Map.of(), null, 0, List.of(), message);
    }

    public static MergeResult invalid(RecordType type, String duplicateId, String masterId, List<String> violations) {
        return new MergeResult(MergeOutcome.VALIDATION_FAILED, type, duplicateId, masterId, null,
                List.of(), Map.of(), null, 0, violations, "Master record is invalid: " + String.join("; ", violations));
    }

    public boolean isSuccess() {
        return outcome.isSuccess();
    }

    public int totalChildrenMoved() {
        return movedChildren.values().stream().mapToInt(Integer::intValue).sum();
    }
}
