package com.whereq.arbiter.service;

import com.whereq.arbiter.executor.AnalysisExecutor;
import com.whereq.arbiter.metrics.MetricsSink;
import com.whereq.arbiter.model.AnalysisJob;
import com.whereq.arbiter.model.AnalysisResult;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Runs one job through the executor, wrapped in the metrics hooks
 */
@Slf4j
class AnalysisTask implements Callable<AnalysisResult> {

    static final String OPERATION_TYPE = "queue_analysis";

    private final AnalysisJob job;
    private final AnalysisExecutor executor;
    private final MetricsSink metricsSink;

    AnalysisTask(AnalysisJob job, AnalysisExecutor executor, MetricsSink metricsSink) {
        this.job = job;
        this.executor = executor;
        this.metricsSink = metricsSink;
    }

    @Override
    public AnalysisResult call() throws Exception {
        String operationId = startOperation();
        try {
            AnalysisResult result = executor.execute(job);
            completeOperation(operationId, result, null);
            return result;
        } catch (Exception | Error e) {
            completeOperation(operationId, null, e);
            throw e;
        }
    }

    private String startOperation() {
        try {
            return metricsSink.startOperation(OPERATION_TYPE, Map.of(
                "request_id", job.getRequestId(),
                "priority", job.getPriority().name()));
        } catch (RuntimeException e) {
            log.warn("Metrics sink failed to start operation for request {}: {}", job.getRequestId(), e.getMessage());
            return null;
        }
    }

    private void completeOperation(String operationId, AnalysisResult result, Throwable error) {
        if (operationId == null) {
            return;
        }
        try {
            metricsSink.completeOperation(operationId, result, error);
        } catch (RuntimeException e) {
            log.warn("Metrics sink failed to complete operation for request {}: {}", job.getRequestId(), e.getMessage());
        }
    }
}
