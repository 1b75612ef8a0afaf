package com.whereq.arbiter.metrics;

import com.whereq.arbiter.model.AnalysisResult;

import java.util.Map;

/**
 * Optional timing hooks around each analysis execution.
 *
 * Never required for correctness: the scheduler ignores failures raised here.
 */
public interface MetricsSink {

    /**
     * Record the start of an operation
     *
     * @param operationType operation name, e.g. {@code queue_analysis}
     * @param tags low-cardinality attributes of the operation
     * @return handle passed back to {@link #completeOperation}
     */
    String startOperation(String operationType, Map<String, String> tags);

    /**
     * Record the end of an operation
     *
     * @param operationId handle from {@link #startOperation}
     * @param result executor result, null on failure
     * @param error failure cause, null on success
     */
    void completeOperation(String operationId, AnalysisResult result, Throwable error);
}
