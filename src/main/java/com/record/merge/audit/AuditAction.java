package com.record.merge.audit;

/**
 * Types of auditable actions in the record merge system.
 */
public enum AuditAction {
    RECORD_CREATED,
    CHILD_CREATED,
    RECORD_MERGED,
    MERGE_REJECTED,
    MERGE_ROLLED_BACK
}
