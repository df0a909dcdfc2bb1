package com.record.merge.merge;

import com.record.merge.audit.AuditAction;
import com.record.merge.audit.AuditService;
import com.record.merge.cache.MergeListener;
import com.record.merge.core.model.Association;
import com.record.merge.core.model.CrmRecord;
import com.record.merge.core.model.RecordType;
import com.record.merge.logging.LogContext;
import com.record.merge.metrics.MetricsService;
import com.record.merge.metrics.NoOpMetricsService;
import com.record.merge.store.AliasRepository;
import com.record.merge.store.ChildRecordRepository;
import com.record.merge.store.RecordInvalidException;
import com.record.merge.store.RecordRepository;
import com.record.merge.tracing.NoOpTracingService;
import com.record.merge.tracing.Span;
import com.record.merge.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Merges a duplicate CRM record into a master record.
 * Uses {@link MergeTransaction} so a merge either commits fully or leaves storage untouched.
 *
 * Merge process:
 * 1. Resolve attribute precedence (permanent plus caller-ignored attributes excluded)
 * 2. Copy duplicate-sourced values onto an in-memory copy of the master
 * 3. Union the tag sets
 * 4. Re-parent association children from duplicate to master
 * 5. Record the duplicate's alias and repoint aliases that targeted it
 * 6. Run the type's merge hook
 * 7. Validate and save the master
 * 8. Delete the duplicate
 */
public class RecordMerger {
    private static final Logger log = LoggerFactory.getLogger(RecordMerger.class);

    static final String ERROR_OUTCOME = "ERROR";

    private final RecordRepository recordRepository;
    private final AttributePrecedenceResolver precedenceResolver;
    private final AssociationMigrator associationMigrator;
    private final AliasKeeper aliasKeeper;
    private final MergeHooks hooks;
    private final RecordValidator validator;
    private final AuditService auditService;
    private final MetricsService metricsService;
    private final TracingService tracingService;
    private final boolean repointAliases;
    private final String defaultActor;
    private final List<MergeListener> mergeListeners = new CopyOnWriteArrayList<>();

    private RecordMerger(Builder builder) {
        this.recordRepository = Objects.requireNonNull(builder.recordRepository, "recordRepository is required");
        this.precedenceResolver = builder.precedenceResolver;
        this.associationMigrator = new AssociationMigrator(recordRepository,
                Objects.requireNonNull(builder.childRepository, "childRepository is required"));
        this.aliasKeeper = new AliasKeeper(Objects.requireNonNull(builder.aliasRepository, "aliasRepository is required"));
        this.hooks = builder.hooks;
        this.validator = builder.validator;
        this.auditService = builder.auditService;
        this.metricsService = builder.metricsService;
        this.tracingService = builder.tracingService;
        this.repointAliases = builder.repointAliases;
        this.defaultActor = builder.defaultActor;
    }

    /**
     * Merges {@code duplicate} into {@code master}.
     * Both records are merged as they are stored; unsaved changes on the passed instances are
     * not part of the merge. On success the committed attributes and tags are copied onto
     * {@code master}.
     *
     * @return true if the merge committed; false for a self-merge, a type mismatch,
     *         a missing record or a master that fails validation
     * @throws MergeException if a step fails unexpectedly (all changes are rolled back first)
     */
    public boolean merge(CrmRecord duplicate, CrmRecord master) {
        return merge(duplicate, master, List.of());
    }

    /**
     * Same as {@link #merge(CrmRecord, CrmRecord)}, keeping the master's value for {@code ignoredAttributes}.
     */
    public boolean merge(CrmRecord duplicate, CrmRecord master, Collection<String> ignoredAttributes) {
        Objects.requireNonNull(duplicate, "duplicate is required");
        Objects.requireNonNull(master, "master is required");
        MergeResult result = merge(MergeRequest.builder()
                .type(master.getType())
                .duplicateType(duplicate.getType())
                .duplicateId(duplicate.getId())
                .masterId(master.getId())
                .ignoredAttributes(ignoredAttributes)
                .build());
        if (!result.isSuccess()) {
            return false;
        }
        result.master().getAttributes().forEach(master::set);
        master.setTags(result.master().getTags());
        return true;
    }

    /**
     * Merges the request's duplicate into its master.
     *
     * @throws MergeException           if a step fails unexpectedly (all changes are rolled back first)
     * @throws IllegalArgumentException if a choice names an attribute the type cannot carry
     */
    public MergeResult merge(MergeRequest request) {
        Objects.requireNonNull(request, "request is required");
        RecordType type = request.type();
        String duplicateId = request.duplicateId();
        String masterId = request.masterId();
        String actor = request.triggeredBy() != null ? request.triggeredBy() : defaultActor;
        long startNanos = System.nanoTime();

        try (LogContext logCtx = LogContext.forMerge(
                LogContext.generateCorrelationId(), type.name(), duplicateId, masterId);
             Span span = tracingService.startMergeSpan(type, duplicateId, masterId)) {
            log.info("merge.starting type={} duplicateId={} masterId={} triggeredBy={}",
                    type, duplicateId, masterId, actor);

            if (request.isSelfMerge()) {
                return reject(request, actor, span, startNanos, MergeResult.rejected(MergeOutcome.SELF_MERGE,
                        type, duplicateId, masterId, "A record cannot be merged into itself"));
            }
            if (request.duplicateType() != type) {
                return reject(request, actor, span, startNanos, MergeResult.rejected(MergeOutcome.TYPE_MISMATCH,
                        type, duplicateId, masterId, "Cannot merge a " + request.duplicateType().getLabel()
                                + " into a " + type.getLabel()));
            }

            Optional<CrmRecord> duplicateOpt = recordRepository.findById(type, duplicateId);
            Optional<CrmRecord> masterOpt = recordRepository.findById(type, masterId);
            if (duplicateOpt.isEmpty() || masterOpt.isEmpty()) {
                String missing = duplicateOpt.isEmpty() ? duplicateId : masterId;
                return reject(request, actor, span, startNanos, MergeResult.rejected(MergeOutcome.NOT_FOUND,
                        type, duplicateId, masterId, type.getLabel() + " not found: " + missing));
            }

            CrmRecord duplicate = duplicateOpt.get();
            CrmRecord master = masterOpt.get();
            AttributePlan plan = precedenceResolver.plan(duplicate, master,
                    request.ignoredAttributes(), request.choices());

            MergeResult result;
            try {
                result = apply(duplicate, master, plan, span);
            } catch (MergeException e) {
                log.error("merge.failed type={} duplicateId={} masterId={} step={} error={}",
                        type, duplicateId, masterId, e.getFailedStep(), e.getCause().getMessage());
                span.recordException(e);
                span.setStatus(Span.SpanStatus.ERROR);
                metricsService.incrementMergeRejected(type, ERROR_OUTCOME);
                metricsService.recordMergeDuration(type, ERROR_OUTCOME, elapsedSince(startNanos));
                audit(AuditAction.MERGE_ROLLED_BACK, type, duplicateId, actor, Map.of(
                        "masterId", masterId,
                        "step", e.getFailedStep(),
                        "error", String.valueOf(e.getCause().getMessage())));
                throw e;
            }

            if (!result.isSuccess()) {
                return reject(request, actor, span, startNanos, result);
            }

            span.setAttribute("childrenMoved", result.totalChildrenMoved());
            span.setAttribute("aliasesRepointed", result.repointedAliases());
            span.setStatus(Span.SpanStatus.OK);
            metricsService.incrementMergeCompleted(type);
            metricsService.recordChildrenMoved(type, result.totalChildrenMoved());
            metricsService.recordMergeDuration(type, MergeOutcome.MERGED.name(), elapsedSince(startNanos));
            audit(AuditAction.RECORD_MERGED, type, duplicateId, actor, Map.of(
                    "masterId", masterId,
                    "recordType", type.name(),
                    "movedChildren", labelled(result.movedChildren()),
                    "repointedAliases", result.repointedAliases(),
                    "copiedAttributes", result.copiedAttributes()));
            log.info("merge.completed type={} duplicateId={} masterId={} copied={} childrenMoved={}",
                    type, duplicateId, masterId, result.copiedAttributes().size(), result.totalChildrenMoved());

            notifyMergeListeners(type, duplicateId, masterId);
            return result;
        }
    }

    private MergeResult apply(CrmRecord duplicate, CrmRecord master, AttributePlan plan, Span span) {
        RecordType type = master.getType();
        String duplicateId = duplicate.getId();
        String masterId = master.getId();
        CrmRecord masterSnapshot = master.copy();
        CrmRecord duplicateSnapshot = duplicate.copy();
        CrmRecord merged = master.copy();

        MergeTransaction tx = new MergeTransaction(span::addEvent);
        try (tx) {
            List<String> copied = new ArrayList<>();
            tx.executeNoCompensation("copy attributes",
                    () -> copied.addAll(plan.applyTo(merged, duplicate)));

            tx.executeNoCompensation("union tags",
                    () -> merged.addTags(duplicate.getTags()));

            Map<Association, List<String>> moved = tx.execute("re-parent associations",
                    () -> associationMigrator.migrate(type, duplicateId, masterId),
                    m -> associationMigrator.restore(type, m, duplicateId));

            AliasKeeper.AliasChange aliasChange = tx.execute("record alias",
                    () -> aliasKeeper.record(type, duplicateId, masterId, repointAliases),
                    aliasKeeper::revert);

            tx.executeNoCompensation("merge hook",
                    () -> hooks.forType(type).onMerge(merged, duplicate));

            List<String> violations = new ArrayList<>();
            tx.executeNoCompensation("validate master",
                    () -> violations.addAll(validator.validate(merged)));
            if (!violations.isEmpty()) {
                return MergeResult.invalid(type, duplicateId, masterId, violations);
            }

            try {
                tx.execute("save master",
                        () -> recordRepository.save(merged),
                        () -> recordRepository.save(masterSnapshot));
            } catch (RecordInvalidException e) {
                return MergeResult.invalid(type, duplicateId, masterId, e.getViolations());
            }

            tx.execute("delete duplicate",
                    () -> {
                        if (!recordRepository.delete(type, duplicateId)) {
                            throw new IllegalStateException(type.getLabel() + " " + duplicateId
                                    + " disappeared during merge");
                        }
                    },
                    () -> recordRepository.save(duplicateSnapshot));

            tx.markSuccess();

            Map<Association, Integer> movedCounts = new EnumMap<>(Association.class);
            moved.forEach((association, ids) -> movedCounts.put(association, ids.size()));
            return MergeResult.merged(merged, duplicateId, copied, movedCounts,
                    aliasChange.alias().id(), aliasChange.repointed().size());
        } catch (RuntimeException e) {
            String step = tx.getFailedStep() != null ? tx.getFailedStep() : "unknown";
            throw new MergeException(type, duplicateId, masterId, step, e);
        }
    }

    private MergeResult reject(MergeRequest request, String actor, Span span, long startNanos, MergeResult result) {
        RecordType type = request.type();
        log.info("merge.rejected type={} duplicateId={} masterId={} outcome={} reason={}",
                type, request.duplicateId(), request.masterId(), result.outcome(), result.message());
        span.setAttribute("outcome", result.outcome().name());
        span.setStatus(Span.SpanStatus.ERROR);
        metricsService.incrementMergeRejected(type, result.outcome().name());
        metricsService.recordMergeDuration(type, result.outcome().name(), elapsedSince(startNanos));

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("masterId", request.masterId());
        details.put("reason", result.outcome().name());
        if (result.message() != null) {
            details.put("message", result.message());
        }
        if (!result.violations().isEmpty()) {
            details.put("violations", result.violations());
        }
        audit(AuditAction.MERGE_REJECTED, type, request.duplicateId(), actor, details);
        return result;
    }

    private void audit(AuditAction action, RecordType type, String recordId, String actor, Map<String, Object> details) {
        try {
            auditService.record(action, type, recordId, actor, details);
        } catch (Exception e) {
            log.warn("Audit entry {} for {} {} could not be recorded: {}", action, type, recordId, e.getMessage());
        }
    }

    private static Map<String, Object> labelled(Map<Association, Integer> moved) {
        Map<String, Object> labelled = new LinkedHashMap<>();
        moved.forEach((association, count) -> labelled.put(association.getLabel(), count));
        return labelled;
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    /**
     * Adds a listener that will be notified after committed merges.
     */
    public void addMergeListener(MergeListener listener) {
        if (listener != null) {
            mergeListeners.add(listener);
        }
    }

    private void notifyMergeListeners(RecordType type, String duplicateId, String masterId) {
        for (MergeListener listener : mergeListeners) {
            try {
                listener.onMerge(type, duplicateId, masterId);
            } catch (Exception e) {
                log.warn("Merge listener notification failed: {}", e.getMessage());
            }
        }
    }

    public AttributePrecedenceResolver getPrecedenceResolver() {
        return precedenceResolver;
    }

    public AssociationMigrator getAssociationMigrator() {
        return associationMigrator;
    }

    public AuditService getAuditService() {
        return auditService;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private RecordRepository recordRepository;
        private ChildRecordRepository childRepository;
        private AliasRepository aliasRepository;
        private AttributePrecedenceResolver precedenceResolver = new AttributePrecedenceResolver();
        private MergeHooks hooks = MergeHooks.none();
        private RecordValidator validator = new RequiredAttributesValidator();
        private AuditService auditService = new AuditService();
        private MetricsService metricsService = new NoOpMetricsService();
        private TracingService tracingService = new NoOpTracingService();
        private boolean repointAliases = true;
        private String defaultActor = "system";

        public Builder recordRepository(RecordRepository recordRepository) {
            this.recordRepository = recordRepository;
            return this;
        }

        public Builder childRepository(ChildRecordRepository childRepository) {
            this.childRepository = childRepository;
            return this;
        }

        public Builder aliasRepository(AliasRepository aliasRepository) {
            this.aliasRepository = aliasRepository;
            return this;
        }

        public Builder precedenceResolver(AttributePrecedenceResolver precedenceResolver) {
            this.precedenceResolver = Objects.requireNonNull(precedenceResolver);
            return this;
        }

        public Builder hooks(MergeHooks hooks) {
            this.hooks = Objects.requireNonNull(hooks);
            return this;
        }

        public Builder validator(RecordValidator validator) {
            this.validator = Objects.requireNonNull(validator);
            return this;
        }

        public Builder auditService(AuditService auditService) {
            this.auditService = Objects.requireNonNull(auditService);
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = Objects.requireNonNull(metricsService);
            return this;
        }

        public Builder tracingService(TracingService tracingService) {
            this.tracingService = Objects.requireNonNull(tracingService);
            return this;
        }

        public Builder repointAliases(boolean repointAliases) {
            this.repointAliases = repointAliases;
            return this;
        }

        public Builder defaultActor(String defaultActor) {
            this.defaultActor = Objects.requireNonNull(defaultActor);
            return this;
        }

        public RecordMerger build() {
            return new RecordMerger(this);
        }
    }
}
