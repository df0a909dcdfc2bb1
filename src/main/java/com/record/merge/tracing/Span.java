package com.record.merge.tracing;

/**
 * A unit of work in a trace. Closing the span ends it, so spans fit try-with-resources.
 *
 * <pre>
 * try (Span span = tracingService.startMergeSpan(RecordType.ACCOUNT, duplicateId, masterId)) {
 *     span.addEvent("re-parent associations");
 *     span.setStatus(SpanStatus.OK);
 * }
 * </pre>
 */
public interface Span extends AutoCloseable {

    void setAttribute(String key, String value);

    void setAttribute(String key, long value);

    void setAttribute(String key, boolean value);

    /**
     * Marks a point in time within the span, e.g. a completed merge step.
     */
    void addEvent(String name);

    void setStatus(SpanStatus status);

    void recordException(Throwable t);

    @Override
    void close();

    enum SpanStatus { OK, ERROR }
}
