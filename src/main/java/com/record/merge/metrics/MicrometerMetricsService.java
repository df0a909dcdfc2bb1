package com.record.merge.metrics;

import com.record.merge.core.model.RecordType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code record.merge.duration} - Timer (tags: recordType, outcome)</li>
 *   <li>{@code record.merge.completed} - Counter (tag: recordType)</li>
 *   <li>{@code record.merge.rejected} - Counter (tags: recordType, reason)</li>
 *   <li>{@code record.merge.children.moved} - DistributionSummary (tag: recordType)</li>
 *   <li>{@code record.alias.cache.hit} - Counter</li>
 *   <li>{@code record.alias.cache.miss} - Counter</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Map<RecordType, DistributionSummary> childrenMovedCache = new ConcurrentHashMap<>();
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.cacheHitCounter = Counter.builder("record.alias.cache.hit")
                .description("Number of alias redirects served from cache")
                .register(registry);
        this.cacheMissCounter = Counter.builder("record.alias.cache.miss")
                .description("Number of alias lookups that went to the repository")
                .register(registry);
    }

    @Override
    public void recordMergeDuration(RecordType type, String outcome, Duration duration) {
        String key = type.name() + ":" + outcome;
        Timer timer = timerCache.computeIfAbsent(key, k ->
                Timer.builder("record.merge.duration")
                        .description("Duration of record merge operations")
                        .tag("recordType", type.name())
                        .tag("outcome", outcome)
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void incrementMergeCompleted(RecordType type) {
        String key = "completed:" + type.name();
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("record.merge.completed")
                        .description("Number of successful record merges")
                        .tag("recordType", type.name())
                        .register(registry));
        counter.increment();
    }

    @Override
    public void incrementMergeRejected(RecordType type, String reason) {
        String key = "rejected:" + type.name() + ":" + reason;
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("record.merge.rejected")
                        .description("Number of record merges that were refused or rolled back")
                        .tag("recordType", type.name())
                        .tag("reason", reason)
                        .register(registry));
        counter.increment();
    }

    @Override
    public void recordChildrenMoved(RecordType type, int count) {
        DistributionSummary summary = childrenMovedCache.computeIfAbsent(type, t ->
                DistributionSummary.builder("record.merge.children.moved")
                        .description("Association children re-parented per merge")
                        .tag("recordType", t.name())
                        .register(registry));
        summary.record(count);
    }

    @Override
    public void recordAliasCacheHit() {
        cacheHitCounter.increment();
    }

    @Override
    public void recordAliasCacheMiss() {
        cacheMissCounter.increment();
    }
}
