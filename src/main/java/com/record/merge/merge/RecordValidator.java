package com.record.merge.merge;

import com.record.merge.core.model.CrmRecord;

import java.util.List;

/**
 * Validates a record before it is saved by a merge.
 */
@FunctionalInterface
public interface RecordValidator {

    RecordValidator ALWAYS_VALID = record -> List.of();

    /**
     * @return human-readable violations, empty when the record is valid
     */
    List<String> validate(CrmRecord record);
}
