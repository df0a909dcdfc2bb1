package com.record.merge.audit;

import java.time.Instant;
import java.util.List;

/**
 * Repository interface for audit entry persistence.
 * Implementations provide different storage backends (in-memory, graph DB, etc.).
 */
public interface AuditRepository {

    AuditEntry save(AuditEntry entry);

    List<AuditEntry> findAll();

    /**
     * Gets audit entries for a specific record.
     */
    List<AuditEntry> findByRecordId(String recordId);

    List<AuditEntry> findByAction(AuditAction action);

    /**
     * Committed merges whose surviving record is {@code masterId}, oldest first.
     */
    List<AuditEntry> findMergesInto(String masterId);

    List<AuditEntry> findByActorId(String actorId);

    /**
     * Gets audit entries within a time range, both ends inclusive.
     */
    List<AuditEntry> findBetween(Instant start, Instant end);

    int count();

    /**
     * Gets the most recent entries in chronological order, up to the specified limit.
     */
    List<AuditEntry> findRecent(int limit);
}
