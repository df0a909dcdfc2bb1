package com.record.merge.tracing;

import java.util.Map;

/**
 * Used when no tracer is configured. Every span is the same inert instance.
 */
public class NoOpTracingService implements TracingService {

    @Override
    public Span startSpan(String operationName) {
        return InertSpan.INSTANCE;
    }

    @Override
    public Span startSpan(String operationName, Map<String, String> attributes) {
        return InertSpan.INSTANCE;
    }

    private enum InertSpan implements Span {
        INSTANCE;

        @Override
        public void setAttribute(String key, String value) {
        }

        @Override
        public void setAttribute(String key, long value) {
        }

        @Override
        public void setAttribute(String key, boolean value) {
        }

        @Override
        public void addEvent(String name) {
        }

        @Override
        public void setStatus(SpanStatus status) {
        }

        @Override
        public void recordException(Throwable t) {
        }

        @Override
        public void close() {
        }
    }
}
