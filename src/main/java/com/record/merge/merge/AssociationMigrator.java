package com.record.merge.merge;

import com.record.merge.core.model.Association;
import com.record.merge.core.model.RecordType;
import com.record.merge.store.ChildRecordRepository;
import com.record.merge.store.RecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Moves every association child of a duplicate onto the master.
 * Children are never de-duplicated, so the master ends up with both sets.
 */
public class AssociationMigrator {
    private static final Logger log = LoggerFactory.getLogger(AssociationMigrator.class);

    private final RecordRepository recordRepository;
    private final ChildRecordRepository childRepository;

    public AssociationMigrator(RecordRepository recordRepository, ChildRecordRepository childRepository) {
        this.recordRepository = recordRepository;
        this.childRepository = childRepository;
    }

    /**
     * Re-parents the children of every association the type declares.
     * If one association fails, the ones already moved are handed back before the error propagates.
     *
     * @return ids of the moved children per association, empty lists included
     */
    public Map<Association, List<String>> migrate(RecordType type, String duplicateId, String masterId) {
        Map<Association, List<String>> moved = new EnumMap<>(Association.class);
        for (Association association : Association.values()) {
            if (!type.declares(association)) {
                continue;
            }
            List<String> ids;
            try {
                ids = association.isRecordReference()
                        ? recordRepository.reassignReference(RecordType.CONTACT, RecordType.ACCOUNT_REFERENCE,
                                duplicateId, masterId)
                        : childRepository.reassignOwner(association, type, duplicateId, masterId);
            } catch (RuntimeException e) {
                log.warn("Moving {} from {} to {} failed; restoring {} associations already moved",
                        association.getLabel(), duplicateId, masterId, moved.size());
                try {
                    restore(type, moved, duplicateId);
                } catch (RuntimeException restoreFailure) {
                    e.addSuppressed(restoreFailure);
                }
                throw e;
            }
            moved.put(association, List.copyOf(ids));
            if (!ids.isEmpty()) {
                log.debug("Moved {} {} from {} to {}", ids.size(), association.getLabel(), duplicateId, masterId);
            }
        }
        return moved;
    }

    /**
     * Hands the previously moved children back to the duplicate.
     */
    public void restore(RecordType type, Map<Association, List<String>> moved, String duplicateId) {
        moved.forEach((association, ids) -> {
            if (ids.isEmpty()) {
                return;
            }
            if (association.isRecordReference()) {
                recordRepository.assignReference(RecordType.CONTACT, RecordType.ACCOUNT_REFERENCE, ids, duplicateId);
            } else {
                childRepository.assignOwner(ids, duplicateId);
            }
            log.debug("Restored {} {} to {} {}", ids.size(), association.getLabel(), type.getLabel(), duplicateId);
        });
    }

    /**
     * Counts the children of every association the type declares.
     */
    public Map<Association, Integer> countChildren(RecordType type, String ownerId) {
        Map<Association, Integer> counts = new EnumMap<>(Association.class);
        for (Association association : Association.values()) {
            if (!type.declares(association)) {
                continue;
            }
            int count = association.isRecordReference()
                    ? recordRepository.findByAttribute(RecordType.CONTACT, RecordType.ACCOUNT_REFERENCE, ownerId).size()
                    : childRepository.countByOwner(association, type, ownerId);
            counts.put(association, count);
        }
        return counts;
    }
}
