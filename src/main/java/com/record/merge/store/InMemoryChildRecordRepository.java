package com.record.merge.store;

import com.record.merge.core.model.Association;
import com.record.merge.core.model.ChildRecord;
import com.record.merge.core.model.RecordType;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of ChildRecordRepository.
 */
public class InMemoryChildRecordRepository implements ChildRecordRepository {

    private final Map<String, ChildRecord> children = new ConcurrentHashMap<>();

    @Override
    public ChildRecord save(ChildRecord child) {
        children.put(child.id(), child);
        return child;
    }

    @Override
    public Optional<ChildRecord> findById(String id) {
        return Optional.ofNullable(children.get(id));
    }

    @Override
    public List<ChildRecord> findByOwner(Association association, RecordType ownerType, String ownerId) {
        return children.values().stream()
                .filter(c -> c.association() == association)
                .filter(c -> c.ownerType() == ownerType)
                .filter(c -> c.ownerId().equals(ownerId))
                .sorted(Comparator.comparing(ChildRecord::createdAt))
                .toList();
    }

    @Override
    public synchronized List<String> reassignOwner(Association association, RecordType ownerType,
                                                   String fromOwnerId, String toOwnerId) {
        List<String> moved = new ArrayList<>();
        for (ChildRecord child : findByOwner(association, ownerType, fromOwnerId)) {
            children.put(child.id(), child.withOwner(toOwnerId));
            moved.add(child.id());
        }
        return moved;
    }

    @Override
    public synchronized void assignOwner(Collection<String> childIds, String ownerId) {
        for (String id : childIds) {
            children.computeIfPresent(id, (k, child) -> child.withOwner(ownerId));
        }
    }

    @Override
    public boolean delete(String id) {
        return children.remove(id) != null;
    }
}
