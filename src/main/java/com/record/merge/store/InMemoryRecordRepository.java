package com.record.merge.store;

import com.record.merge.core.model.CrmRecord;
import com.record.merge.core.model.RecordType;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of RecordRepository.
 * Thread-safe via ConcurrentHashMap. Stores and returns copies so callers never share state with the store.
 */
public class InMemoryRecordRepository implements RecordRepository {

    private final Map<RecordKey, CrmRecord> records = new ConcurrentHashMap<>();

    @Override
    public CrmRecord save(CrmRecord record) {
        records.put(RecordKey.of(record.getType(), record.getId()), record.copy());
        return record;
    }

    @Override
    public Optional<CrmRecord> findById(RecordType type, String id) {
        CrmRecord stored = records.get(RecordKey.of(type, id));
        return stored != null ? Optional.of(stored.copy()) : Optional.empty();
    }

    @Override
    public boolean exists(RecordType type, String id) {
        return records.containsKey(RecordKey.of(type, id));
    }

    @Override
    public boolean delete(RecordType type, String id) {
        return records.remove(RecordKey.of(type, id)) != null;
    }

    @Override
    public List<CrmRecord> findByAttribute(RecordType type, String attribute, Object value) {
        return records.values().stream()
                .filter(r -> r.getType() == type)
                .filter(r -> Objects.equals(r.get(attribute), value))
                .sorted(Comparator.comparing(CrmRecord::getCreatedAt))
                .map(CrmRecord::copy)
                .toList();
    }

    @Override
    public synchronized List<String> reassignReference(RecordType type, String attribute,
                                                       String fromValue, String toValue) {
        List<String> changed = new ArrayList<>();
        for (CrmRecord record : records.values()) {
            if (record.getType() == type && Objects.equals(record.get(attribute), fromValue)) {
                record.set(attribute, toValue);
                changed.add(record.getId());
            }
        }
        return changed;
    }

    @Override
    public synchronized void assignReference(RecordType type, String attribute, Collection<String> ids, String value) {
        for (String id : ids) {
            CrmRecord record = records.get(RecordKey.of(type, id));
            if (record != null) {
                record.set(attribute, value);
            }
        }
    }

    @Override
    public int count(RecordType type) {
        return (int) records.keySet().stream().filter(k -> k.type() == type).count();
    }

    private record RecordKey(RecordType type, String id) {
        static RecordKey of(RecordType type, String id) {
            return new RecordKey(Objects.requireNonNull(type, "type is required"),
                    Objects.requireNonNull(id, "id is required"));
        }
    }
}
