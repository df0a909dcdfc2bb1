package com.record.merge.cdi;

import com.record.merge.api.MergeOptions;
import com.record.merge.api.RecordMergeService;
import com.record.merge.audit.AuditService;
import com.record.merge.metrics.MicrometerMetricsService;
import com.record.merge.tracing.OpenTelemetryTracingService;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.OpenTelemetry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * CDI producer that wires the record merge library from MicroProfile Config properties.
 *
 * <h2>Configuration</h2>
 * <pre>
 * record-merge.falkordb.enabled=true
 * record-merge.falkordb.host=localhost
 * record-merge.falkordb.port=6379
 * record-merge.falkordb.graph-name=crm
 * </pre>
 *
 * <p>With {@code record-merge.falkordb.enabled=false} records are kept in memory.
 * A {@link MeterRegistry} or {@link OpenTelemetry} bean, when the container has one,
 * is picked up for merge metrics and spans.</p>
 */
@ApplicationScoped
public class RecordMergeProducer {

    private static final Logger log = LoggerFactory.getLogger(RecordMergeProducer.class);

    // ── FalkorDB ──────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "record-merge.falkordb.enabled", defaultValue = "true")
    boolean falkordbEnabled;

    @Inject
    @ConfigProperty(name = "record-merge.falkordb.host", defaultValue = "localhost")
    String falkordbHost;

    @Inject
    @ConfigProperty(name = "record-merge.falkordb.port", defaultValue = "6379")
    int falkordbPort;

    @Inject
    @ConfigProperty(name = "record-merge.falkordb.graph-name", defaultValue = "crm")
    String falkordbGraphName;

    // ── Alias cache ───────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "record-merge.alias-cache.enabled", defaultValue = "true")
    boolean aliasCacheEnabled;

    @Inject
    @ConfigProperty(name = "record-merge.alias-cache.max-size", defaultValue = "10000")
    int aliasCacheMaxSize;

    @Inject
    @ConfigProperty(name = "record-merge.alias-cache.ttl-seconds", defaultValue = "600")
    int aliasCacheTtlSeconds;

    // ── Merge ─────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "record-merge.merge.max-alias-hops", defaultValue = "16")
    int maxAliasHops;

    @Inject
    @ConfigProperty(name = "record-merge.merge.default-actor", defaultValue = "system")
    String defaultActor;

    @Inject
    @ConfigProperty(name = "record-merge.merge.repoint-aliases", defaultValue = "true")
    boolean repointAliases;

    @Inject
    Instance<MeterRegistry> meterRegistry;

    @Inject
    Instance<OpenTelemetry> openTelemetry;

    // ══════════════════════════════════════════════════════════
    //  Producers
    // ══════════════════════════════════════════════════════════

    @Produces
    @ApplicationScoped
    public RecordMergeService recordMergeService() {
        MergeOptions options = MergeOptions.builder()
                .aliasCacheEnabled(aliasCacheEnabled)
                .aliasCacheSize(aliasCacheMaxSize)
                .aliasCacheTtlSeconds(aliasCacheTtlSeconds)
                .maxAliasHops(maxAliasHops)
                .defaultActor(defaultActor)
                .repointAliases(repointAliases)
                .build();

        RecordMergeService.Builder builder = RecordMergeService.builder().options(options);

        if (falkordbEnabled) {
            log.info("Producing RecordMergeService: falkordb={}:{}/{}", falkordbHost, falkordbPort, falkordbGraphName);
            builder.falkorDB(falkordbHost, falkordbPort, falkordbGraphName);
        } else {
            log.info("Producing RecordMergeService: in-memory storage");
        }

        if (meterRegistry != null && meterRegistry.isResolvable()) {
            builder.metricsService(new MicrometerMetricsService(meterRegistry.get()));
            log.info("Merge metrics enabled");
        }
        if (openTelemetry != null && openTelemetry.isResolvable()) {
            builder.tracingService(new OpenTelemetryTracingService(openTelemetry.get()));
            log.info("Merge tracing enabled");
        }

        return builder.build();
    }

    public void closeService(@Disposes RecordMergeService service) {
        log.info("Closing RecordMergeService");
        service.close();
    }

    @Produces
    @ApplicationScoped
    public AuditService auditService(RecordMergeService service) {
        return service.getAuditService();
    }
}
