package com.record.merge.store;

import com.record.merge.core.model.RecordAlias;
import com.record.merge.core.model.RecordType;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for alias records (destroyed id to surviving id redirects).
 */
public interface AliasRepository {

    /**
     * Inserts an alias, or replaces the alias with the same id.
     */
    RecordAlias save(RecordAlias alias);

    Optional<RecordAlias> findById(String id);

    Optional<RecordAlias> findByDestroyedId(RecordType type, String destroyedId);

    /**
     * Finds every alias that currently redirects to the given record.
     */
    List<RecordAlias> findByTargetId(RecordType type, String targetId);

    boolean delete(String id);

    int count(RecordType type);
}
