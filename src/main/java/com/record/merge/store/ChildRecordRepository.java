package com.record.merge.store;

import com.record.merge.core.model.Association;
import com.record.merge.core.model.ChildRecord;
import com.record.merge.core.model.RecordType;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for association children (emails, comments, addresses, tasks, opportunities).
 */
public interface ChildRecordRepository {

    ChildRecord save(ChildRecord child);

    Optional<ChildRecord> findById(String id);

    List<ChildRecord> findByOwner(Association association, RecordType ownerType, String ownerId);

    /**
     * Moves every child of an association from one owner to another.
     *
     * @return ids of the moved children
     */
    List<String> reassignOwner(Association association, RecordType ownerType, String fromOwnerId, String toOwnerId);

    /**
     * Sets the owner of the given children.
     */
    void assignOwner(Collection<String> childIds, String ownerId);

    boolean delete(String id);

    default int countByOwner(Association association, RecordType ownerType, String ownerId) {
        return findByOwner(association, ownerType, ownerId).size();
    }
}
