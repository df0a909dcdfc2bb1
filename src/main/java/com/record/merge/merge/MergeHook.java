package com.record.merge.merge;

import com.record.merge.core.model.CrmRecord;

/**
 * Type-specific extension point run after attributes, tags and associations are merged
 * and before the master is saved. Changes made to {@code master} are persisted with it;
 * an exception rolls the whole merge back.
 */
@FunctionalInterface
public interface MergeHook {

    MergeHook NONE = (master, duplicate) -> { };

    void onMerge(CrmRecord master, CrmRecord duplicate);
}
