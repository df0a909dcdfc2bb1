package com.record.merge.api;

import com.record.merge.alias.AliasResolver;
import com.record.merge.audit.AuditAction;
import com.record.merge.audit.AuditRepository;
import com.record.merge.audit.AuditService;
import com.record.merge.audit.GraphAuditRepository;
import com.record.merge.cache.MergeListener;
import com.record.merge.core.model.Association;
import com.record.merge.core.model.ChildRecord;
import com.record.merge.core.model.CrmRecord;
import com.record.merge.core.model.RecordType;
import com.record.merge.graph.FalkorDBConnection;
import com.record.merge.graph.GraphAliasRepository;
import com.record.merge.graph.GraphChildRecordRepository;
import com.record.merge.graph.GraphConnection;
import com.record.merge.graph.GraphRecordRepository;
import com.record.merge.merge.MergeHook;
import com.record.merge.merge.MergeHooks;
import com.record.merge.merge.MergeRequest;
import com.record.merge.merge.MergeResult;
import com.record.merge.merge.RecordMerger;
import com.record.merge.merge.RecordValidator;
import com.record.merge.merge.RequiredAttributesValidator;
import com.record.merge.metrics.MetricsService;
import com.record.merge.metrics.NoOpMetricsService;
import com.record.merge.preview.FieldGroup;
import com.record.merge.preview.MergePreview;
import com.record.merge.preview.MergePreviewService;
import com.record.merge.store.AliasRepository;
import com.record.merge.store.ChildRecordRepository;
import com.record.merge.store.InMemoryAliasRepository;
import com.record.merge.store.InMemoryChildRecordRepository;
import com.record.merge.store.InMemoryRecordRepository;
import com.record.merge.store.RecordInvalidException;
import com.record.merge.store.RecordRepository;
import com.record.merge.tracing.NoOpTracingService;
import com.record.merge.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Main entry point for merging duplicate CRM records.
 * Wires storage, the merge orchestrator, alias resolution, preview and audit behind one API.
 *
 * <h2>Example usage:</h2>
 * <pre>
 * RecordMergeService service = RecordMergeService.builder()
 *     .falkorDB("localhost", 6379, "crm")
 *     .hook(RecordType.ACCOUNT, (master, duplicate) -&gt; master.set("rating", 5))
 *     .build();
 *
 * MergePreview preview = service.preview(RecordType.ACCOUNT, duplicateId, masterId).orElseThrow();
 * MergeResult result = service.merge(MergeRequest.builder()
 *     .type(RecordType.ACCOUNT)
 *     .duplicateId(duplicateId)
 *     .masterId(masterId)
 *     .ignore("website")
 *     .build());
 * </pre>
 *
 * Without a graph connection the service runs on in-memory repositories.
 */
public class RecordMergeService implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(RecordMergeService.class);

    private final RecordRepository recordRepository;
    private final ChildRecordRepository childRepository;
    private final AliasRepository aliasRepository;
    private final GraphConnection connection;
    private final boolean ownsConnection;
    private final MergeOptions options;
    private final RecordValidator validator;
    private final AuditService auditService;
    private final RecordMerger merger;
    private final AliasResolver aliasResolver;
    private final MergePreviewService previewService;

    private RecordMergeService(Builder builder) {
        this.connection = builder.connection;
        this.ownsConnection = builder.ownsConnection;
        this.options = builder.options;
        this.validator = builder.validator;

        if (connection != null) {
            this.recordRepository = new GraphRecordRepository(connection);
            this.childRepository = new GraphChildRecordRepository(connection);
            this.aliasRepository = new GraphAliasRepository(connection);
            if (builder.createIndexes) {
                connection.createIndexes();
            }
        } else {
            this.recordRepository = builder.recordRepository != null
                    ? builder.recordRepository : new InMemoryRecordRepository();
            this.childRepository = builder.childRepository != null
                    ? builder.childRepository : new InMemoryChildRecordRepository();
            this.aliasRepository = builder.aliasRepository != null
                    ? builder.aliasRepository : new InMemoryAliasRepository();
        }

        if (builder.auditService != null) {
            this.auditService = builder.auditService;
        } else if (builder.auditRepository != null) {
            this.auditService = new AuditService(builder.auditRepository);
        } else if (connection != null) {
            this.auditService = new AuditService(new GraphAuditRepository(connection));
        } else {
            this.auditService = new AuditService();
        }

        this.merger = RecordMerger.builder()
                .recordRepository(recordRepository)
                .childRepository(childRepository)
                .aliasRepository(aliasRepository)
                .hooks(builder.hooks)
                .validator(validator)
                .auditService(auditService)
                .metricsService(builder.metricsService)
                .tracingService(builder.tracingService)
                .repointAliases(options.isRepointAliases())
                .defaultActor(options.getDefaultActor())
                .build();

        this.aliasResolver = new AliasResolver(recordRepository, aliasRepository,
                options.toCacheConfig(), options.getMaxAliasHops(), builder.metricsService);
        merger.addMergeListener(aliasResolver);
        builder.mergeListeners.forEach(merger::addMergeListener);

        this.previewService = new MergePreviewService(recordRepository, merger.getAssociationMigrator(),
                merger.getPrecedenceResolver());
        builder.fieldGroups.forEach(previewService::registerFieldGroup);

        log.info("RecordMergeService initialized with {} storage",
                connection != null ? "graph '" + connection.getGraphName() + "'" : "in-memory");
    }

    // ========== Records ==========

    /**
     * Validates and stores a new record.
     *
     * @throws RecordInvalidException if the record fails validation
     */
    public CrmRecord createRecord(CrmRecord record) {
        Objects.requireNonNull(record, "record is required");
        List<String> violations = validator.validate(record);
        if (!violations.isEmpty()) {
            throw new RecordInvalidException(record.getType().getLabel() + " is invalid", violations);
        }
        recordRepository.save(record);
        auditService.record(AuditAction.RECORD_CREATED, record.getType(), record.getId(), options.getDefaultActor());
        log.debug("Created {} {}", record.getType().getLabel(), record.getId());
        return record;
    }

    public Optional<CrmRecord> getRecord(RecordType type, String id) {
        return recordRepository.findById(type, id);
    }

    /**
     * Returns the live record for an id, following aliases left by merges.
     */
    public Optional<CrmRecord> resolve(RecordType type, String id) {
        return aliasResolver.resolve(type, id);
    }

    public Optional<String> resolveId(RecordType type, String id) {
        return aliasResolver.resolveId(type, id);
    }

    // ========== Associations ==========

    /**
     * Adds a child (email, comment, address, task or opportunity) to a record.
     *
     * @throws IllegalArgumentException if the owner's type does not declare the association,
     *                                  or the association holds CRM records
     */
    public ChildRecord addChild(Association association, CrmRecord owner, Map<String, Object> attributes) {
        Objects.requireNonNull(association, "association is required");
        Objects.requireNonNull(owner, "owner is required");
        if (!owner.getType().declares(association)) {
            throw new IllegalArgumentException(owner.getType().getLabel() + " has no " + association.getLabel());
        }
        ChildRecord child = childRepository.save(ChildRecord.of(association, owner, attributes));
        auditService.record(AuditAction.CHILD_CREATED, owner.getType(), owner.getId(), options.getDefaultActor(),
                Map.of("childId", child.id(), "association", association.getLabel()));
        return child;
    }

    public List<ChildRecord> getChildren(RecordType ownerType, String ownerId, Association association) {
        if (association.isRecordReference()) {
            throw new IllegalArgumentException(association.getLabel() + " are records; use getContacts");
        }
        return childRepository.findByOwner(association, ownerType, ownerId);
    }

    /**
     * Contacts linked to an account.
     */
    public List<CrmRecord> getContacts(String accountId) {
        return recordRepository.findByAttribute(RecordType.CONTACT, RecordType.ACCOUNT_REFERENCE, accountId);
    }

    public Map<Association, Integer> countChildren(RecordType type, String id) {
        return merger.getAssociationMigrator().countChildren(type, id);
    }

    // ========== Merge ==========

    public MergeResult merge(MergeRequest request) {
        return merger.merge(request);
    }

    public boolean merge(CrmRecord duplicate, CrmRecord master) {
        return merger.merge(duplicate, master);
    }

    public boolean merge(CrmRecord duplicate, CrmRecord master, Collection<String> ignoredAttributes) {
        return merger.merge(duplicate, master, ignoredAttributes);
    }

    public Optional<MergePreview> preview(RecordType type, String duplicateId, String masterId) {
        return previewService.preview(type, duplicateId, masterId);
    }

    // ========== Accessors ==========

    public AuditService getAuditService() {
        return auditService;
    }

    public AliasResolver getAliasResolver() {
        return aliasResolver;
    }

    public MergePreviewService getPreviewService() {
        return previewService;
    }

    public MergeOptions getOptions() {
        return options;
    }

    public GraphConnection getConnection() {
        return connection;
    }

    @Override
    public void close() {
        if (ownsConnection && connection != null) {
            connection.close();
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private GraphConnection connection;
        private boolean ownsConnection = false;
        private boolean createIndexes = true;
        private RecordRepository recordRepository;
        private ChildRecordRepository childRepository;
        private AliasRepository aliasRepository;
        private AuditService auditService;
        private AuditRepository auditRepository;
        private MergeOptions options = MergeOptions.defaults();
        private final MergeHooks hooks = MergeHooks.none();
        private RecordValidator validator = new RequiredAttributesValidator();
        private MetricsService metricsService = new NoOpMetricsService();
        private TracingService tracingService = new NoOpTracingService();
        private final List<MergeListener> mergeListeners = new ArrayList<>();
        private final List<FieldGroup> fieldGroups = new ArrayList<>();

        /**
         * Uses graph storage over an existing connection. The caller keeps ownership of it.
         */
        public Builder graphConnection(GraphConnection connection) {
            this.connection = connection;
            this.ownsConnection = false;
            return this;
        }

        /**
         * Opens a FalkorDB connection that is closed with the service.
         */
        public Builder falkorDB(String host, int port, String graphName) {
            this.connection = new FalkorDBConnection(host, port, graphName);
            this.ownsConnection = true;
            return this;
        }

        public Builder createIndexes(boolean createIndexes) {
            this.createIndexes = createIndexes;
            return this;
        }

        /**
         * Custom record storage, used only when no graph connection is set.
         */
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

        public Builder auditService(AuditService auditService) {
            this.auditService = auditService;
            return this;
        }

        public Builder auditRepository(AuditRepository auditRepository) {
            this.auditRepository = auditRepository;
            return this;
        }

        public Builder options(MergeOptions options) {
            this.options = Objects.requireNonNull(options);
            return this;
        }

        public Builder hook(RecordType type, MergeHook hook) {
            this.hooks.register(type, hook);
            return this;
        }

        public Builder validator(RecordValidator validator) {
            this.validator = Objects.requireNonNull(validator);
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

        public Builder mergeListener(MergeListener listener) {
            this.mergeListeners.add(Objects.requireNonNull(listener));
            return this;
        }

        public Builder fieldGroup(FieldGroup group) {
            this.fieldGroups.add(Objects.requireNonNull(group));
            return this;
        }

        public RecordMergeService build() {
            return new RecordMergeService(this);
        }
    }
}
