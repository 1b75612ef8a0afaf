package com.whereq.arbiter.metrics;

import com.whereq.arbiter.model.AnalysisResult;

import java.util.Map;

public class NoOpMetricsSink implements MetricsSink {

    public static final NoOpMetricsSink INSTANCE = new NoOpMetricsSink();

    @Override
    public String startOperation(String operationType, Map<String, String> tags) {
        return operationType;
    }

    @Override
    public void completeOperation(String operationId, AnalysisResult result, Throwable error) {
        // nothing to record
    }
}
