package com.whereq.arbiter.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.Map;

/**
 * Unit of work handed to an {@link com.whereq.arbiter.executor.AnalysisExecutor}
 */
@Value
@Builder
public class AnalysisJob {
    String requestId;
    String userId;

    /**
     * Opaque job reference, e.g. the memory file to analyse
     */
    String payload;

    RequestPriority priority;
    Map<String, Object> metadata;

    /**
     * Execution budget the executor should honour; not enforced by the scheduler
     */
    Duration workerTimeout;
}
