package com.record.merge.store;

import com.record.merge.core.model.CrmRecord;
import com.record.merge.core.model.RecordType;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for CRM record persistence.
 * Implementations provide different storage backends (in-memory, graph DB, etc.).
 * Records handed out are detached copies: mutating them has no effect until {@link #save} is called.
 */
public interface RecordRepository {

    /**
     * Inserts or replaces a record.
     *
     * @throws RecordInvalidException if the backend rejects the record
     */
    CrmRecord save(CrmRecord record);

    Optional<CrmRecord> findById(RecordType type, String id);

    default boolean exists(RecordType type, String id) {
        return findById(type, id).isPresent();
    }

    /**
     * Deletes a record.
     *
     * @return true if a record was removed
     */
    boolean delete(RecordType type, String id);

    /**
     * Finds records of a type whose attribute equals the given value.
     */
    List<CrmRecord> findByAttribute(RecordType type, String attribute, Object value);

    /**
     * Rewrites a reference attribute from one value to another on every record of a type
     * that currently holds {@code fromValue}.
     *
     * @return ids of the records that were changed
     */
    List<String> reassignReference(RecordType type, String attribute, String fromValue, String toValue);

    /**
     * Sets a reference attribute on the given records.
     */
    void assignReference(RecordType type, String attribute, Collection<String> ids, String value);

    int count(RecordType type);
}
