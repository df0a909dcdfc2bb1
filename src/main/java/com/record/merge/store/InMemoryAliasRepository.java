package com.record.merge.store;

import com.record.merge.core.model.RecordAlias;
import com.record.merge.core.model.RecordType;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of AliasRepository.
 */
public class InMemoryAliasRepository implements AliasRepository {

    private final Map<String, RecordAlias> aliases = new ConcurrentHashMap<>();

    @Override
    public RecordAlias save(RecordAlias alias) {
        aliases.put(alias.id(), alias);
        return alias;
    }

    @Override
    public Optional<RecordAlias> findById(String id) {
        return Optional.ofNullable(aliases.get(id));
    }

    @Override
    public Optional<RecordAlias> findByDestroyedId(RecordType type, String destroyedId) {
        return aliases.values().stream()
                .filter(a -> a.recordType() == type && a.destroyedId().equals(destroyedId))
                .min(Comparator.comparing(RecordAlias::createdAt));
    }

    @Override
    public List<RecordAlias> findByTargetId(RecordType type, String targetId) {
        return aliases.values().stream()
                .filter(a -> a.recordType() == type && a.targetId().equals(targetId))
                .sorted(Comparator.comparing(RecordAlias::createdAt))
                .toList();
    }

    @Override
    public boolean delete(String id) {
        return aliases.remove(id) != null;
    }

    @Override
    public int count(RecordType type) {
        return (int) aliases.values().stream().filter(a -> a.recordType() == type).count();
    }
}
