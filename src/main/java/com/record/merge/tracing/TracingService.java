package com.record.merge.tracing;

import com.record.merge.core.model.RecordType;

import java.util.Map;

/**
 * Tracing integration used by the merge orchestrator.
 * {@link NoOpTracingService} is the default when no tracer is configured.
 */
public interface TracingService {

    String MERGE_SPAN = "record.merge";

    Span startSpan(String operationName);

    Span startSpan(String operationName, Map<String, String> attributes);

    /**
     * Starts the span covering one merge, tagged with the record type and both ids.
     */
    default Span startMergeSpan(RecordType type, String duplicateId, String masterId) {
        return startSpan(MERGE_SPAN, Map.of(
                "recordType", type.name(),
                "duplicateId", duplicateId,
                "masterId", masterId));
    }
}
