package com.record.merge.metrics;

import com.record.merge.core.model.RecordType;

import java.time.Duration;

/**
 * Interface for recording record merge metrics.
 * The default {@link NoOpMetricsService} does nothing, so merges work
 * without any metrics backend configured.
 */
public interface MetricsService {

    /**
     * @param outcome merge outcome name, or {@code ERROR} for a merge that was rolled back by an exception
     */
    void recordMergeDuration(RecordType type, String outcome, Duration duration);

    void incrementMergeCompleted(RecordType type);

    void incrementMergeRejected(RecordType type, String reason);

    void recordChildrenMoved(RecordType type, int count);

    void recordAliasCacheHit();

    void recordAliasCacheMiss();
}
