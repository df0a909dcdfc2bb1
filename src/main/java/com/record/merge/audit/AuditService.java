package com.record.merge.audit;

import com.record.merge.core.model.RecordType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Service for recording and querying audit entries.
 * Storage is append-only and delegated to an {@link AuditRepository}.
 */
public class AuditService {
    private static final Logger log = LoggerFactory.getLogger(AuditService.class);

    private final AuditRepository repository;

    public AuditService() {
        this(new InMemoryAuditRepository());
    }

    public AuditService(AuditRepository repository) {
        this.repository = repository;
    }

    public AuditEntry record(AuditEntry entry) {
        repository.save(entry);
        log.debug("Audit entry recorded: {} for {} {} by {}",
                entry.action(), entry.recordType(), entry.recordId(), entry.actorId());
        return entry;
    }

    public AuditEntry record(AuditAction action, RecordType recordType, String recordId,
                             String actorId, Map<String, Object> details) {
        return record(AuditEntry.builder()
                .action(action)
                .recordType(recordType)
                .recordId(recordId)
                .actorId(actorId)
                .details(details)
                .build());
    }

    public AuditEntry record(AuditAction action, RecordType recordType, String recordId, String actorId) {
        return record(action, recordType, recordId, actorId, null);
    }

    public List<AuditEntry> getAllEntries() {
        return repository.findAll();
    }

    public List<AuditEntry> getEntriesForRecord(String recordId) {
        return repository.findByRecordId(recordId);
    }

    /**
     * Everything that happened to a record: its own entries plus the merges it absorbed,
     * oldest first.
     */
    public List<AuditEntry> getHistory(String recordId) {
        List<AuditEntry> history = new ArrayList<>(repository.findByRecordId(recordId));
        history.addAll(repository.findMergesInto(recordId));
        history.sort(Comparator.comparing(AuditEntry::timestamp));
        return history;
    }

    public List<AuditEntry> getMergesInto(String masterId) {
        return repository.findMergesInto(masterId);
    }

    public List<AuditEntry> getEntriesByAction(AuditAction action) {
        return repository.findByAction(action);
    }

    public List<AuditEntry> getEntriesByActor(String actorId) {
        return repository.findByActorId(actorId);
    }

    public List<AuditEntry> getEntriesBetween(Instant start, Instant end) {
        return repository.findBetween(start, end);
    }

    public int size() {
        return repository.count();
    }

    public List<AuditEntry> getRecentEntries(int limit) {
        return repository.findRecent(limit);
    }
}
