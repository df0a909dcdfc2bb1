package com.record.merge.metrics;

import com.record.merge.core.model.RecordType;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordMergeDuration(RecordType type, String outcome, Duration duration) {
    }

    @Override
    public void incrementMergeCompleted(RecordType type) {
    }

    @Override
    public void incrementMergeRejected(RecordType type, String reason) {
    }

    @Override
    public void recordChildrenMoved(RecordType type, int count) {
    }

    @Override
    public void recordAliasCacheHit() {
    }

    @Override
    public void recordAliasCacheMiss() {
    }
}
