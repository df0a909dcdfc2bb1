package com.record.merge.merge;

/**
 * Outcome of a merge attempt. Only {@link #MERGED} is a success.
 */
public enum MergeOutcome {
    MERGED,
    SELF_MERGE,
    TYPE_MISMATCH,
    NOT_FOUND,
    VALIDATION_FAILED;

    public boolean isSuccess() {
        return this == MERGED;
    }
}
