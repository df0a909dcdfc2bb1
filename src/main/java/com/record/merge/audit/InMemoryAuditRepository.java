package com.record.merge.audit;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Append-only audit storage for in-memory deployments and tests.
 */
public class InMemoryAuditRepository implements AuditRepository {

    private final List<AuditEntry> entries = new CopyOnWriteArrayList<>();

    @Override
    public AuditEntry save(AuditEntry entry) {
        entries.add(entry);
        return entry;
    }

    @Override
    public List<AuditEntry> findAll() {
        return Collections.unmodifiableList(new ArrayList<>(entries));
    }

    @Override
    public List<AuditEntry> findByRecordId(String recordId) {
        return entries.stream()
                .filter(e -> recordId.equals(e.recordId()))
                .toList();
    }

    @Override
    public List<AuditEntry> findByAction(AuditAction action) {
        return entries.stream()
                .filter(e -> e.action() == action)
                .toList();
    }

    @Override
    public List<AuditEntry> findMergesInto(String masterId) {
        return entries.stream()
                .filter(e -> e.isMergeInto(masterId))
                .toList();
    }

    @Override
    public List<AuditEntry> findByActorId(String actorId) {
        return entries.stream()
                .filter(e -> actorId.equals(e.actorId()))
                .toList();
    }

    @Override
    public List<AuditEntry> findBetween(Instant start, Instant end) {
        return entries.stream()
                .filter(e -> !e.timestamp().isBefore(start) && !e.timestamp().isAfter(end))
                .toList();
    }

    @Override
    public int count() {
        return entries.size();
    }

    @Override
    public List<AuditEntry> findRecent(int limit) {
        List<AuditEntry> snapshot = new ArrayList<>(entries);
        int size = snapshot.size();
        if (size <= limit) {
            return Collections.unmodifiableList(snapshot);
        }
        return Collections.unmodifiableList(new ArrayList<>(snapshot.subList(size - limit, size)));
    }
}
