package com.record.merge.merge;

import com.record.merge.core.model.RecordAlias;
import com.record.merge.core.model.RecordType;
import com.record.merge.store.AliasRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Keeps alias bookkeeping for a merged-away record: one alias from the duplicate's id to the
 * master, and every older alias that pointed at the duplicate moved onto the master.
 */
public class AliasKeeper {
    private static final Logger log = LoggerFactory.getLogger(AliasKeeper.class);

    private final AliasRepository aliasRepository;

    public AliasKeeper(AliasRepository aliasRepository) {
        this.aliasRepository = aliasRepository;
    }

    public AliasChange record(RecordType type, String duplicateId, String masterId) {
        return record(type, duplicateId, masterId, true);
    }

    /**
     * Creates or updates the duplicate's alias and, when asked, repoints aliases targeting the duplicate.
     * A failing save undoes the saves before it and then propagates.
     */
    public AliasChange record(RecordType type, String duplicateId, String masterId, boolean repointExisting) {
        Optional<RecordAlias> existing = aliasRepository.findByDestroyedId(type, duplicateId);
        RecordAlias alias = aliasRepository.save(existing
                .map(previous -> previous.withTarget(masterId))
                .orElseGet(() -> RecordAlias.of(type, duplicateId, masterId)));
        log.debug("{} alias {} -> {}", existing.isPresent() ? "Updated" : "Created", duplicateId, masterId);

        List<RecordAlias> repointed = new ArrayList<>();
        if (repointExisting) {
            try {
                for (RecordAlias previous : aliasRepository.findByTargetId(type, duplicateId)) {
                    aliasRepository.save(previous.withTarget(masterId));
                    repointed.add(previous);
                }
            } catch (RuntimeException e) {
                log.warn("Repointing aliases of {} failed after {} saves; reverting", duplicateId, repointed.size());
                try {
                    revert(new AliasChange(alias, existing.orElse(null), repointed));
                } catch (RuntimeException revertFailure) {
                    e.addSuppressed(revertFailure);
                }
                throw e;
            }
            if (!repointed.isEmpty()) {
                log.debug("Repointed {} aliases from {} to {}", repointed.size(), duplicateId, masterId);
            }
        }
        return new AliasChange(alias, existing.orElse(null), repointed);
    }

    /**
     * Restores the alias state that existed before {@link #record}.
     */
    public void revert(AliasChange change) {
        for (RecordAlias previous : change.repointed()) {
            aliasRepository.save(previous);
        }
        if (change.previous() != null) {
            aliasRepository.save(change.previous());
        } else {
            aliasRepository.delete(change.alias().id());
        }
    }

    /**
     * Alias changes made by one merge.
     *
     * @param alias     the alias from the duplicate to the master, as saved
     * @param previous  the duplicate's alias before the merge, or null if it was created
     * @param repointed aliases that targeted the duplicate, in their pre-merge state
     */
    public record AliasChange(RecordAlias alias, RecordAlias previous, List<RecordAlias> repointed) {
        public AliasChange {
            repointed = List.copyOf(repointed);
        }

        public boolean created() {
            return previous == null;
        }
    }
}
