package com.record.merge.merge;

import com.record.merge.core.model.RecordType;

/**
 * Thrown when a merge fails unexpectedly. All completed steps have been compensated
 * by the time this is thrown; the cause is the original failure.
 */
public class MergeException extends RuntimeException {

    private final RecordType recordType;
    private final String duplicateId;
    private final String masterId;
    private final String failedStep;

    public MergeException(RecordType recordType, String duplicateId, String masterId,
                          String failedStep, Throwable cause) {
        super("Merge of " + recordType.getLabel() + " " + duplicateId + " into " + masterId
                + " failed at step '" + failedStep + "': " + cause.getMessage(), cause);
        this.recordType = recordType;
        this.duplicateId = duplicateId;
        this.masterId = masterId;
        this.failedStep = failedStep;
    }

    public RecordType getRecordType() {
        return recordType;
    }

    public String getDuplicateId() {
        return duplicateId;
    }

    public String getMasterId() {
        return masterId;
    }

    public String getFailedStep() {
        return failedStep;
    }
}
