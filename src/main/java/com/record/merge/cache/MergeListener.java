package com.record.merge.cache;

import com.record.merge.core.model.RecordType;

/**
 * Listener for record merge events, e.g. to invalidate cached lookups.
 */
public interface MergeListener {

    /**
     * Called after a merge has committed.
     *
     * @param type        type of both records
     * @param duplicateId the record that was merged away
     * @param masterId    the record that survived
     */
    void onMerge(RecordType type, String duplicateId, String masterId);
}
