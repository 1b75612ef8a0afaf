package com.whereq.arbiter.metrics;

import com.whereq.arbiter.model.AnalysisResult;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Records analysis executions as Micrometer timers and counters
 */
@Slf4j
public class MicrometerMetricsSink implements MetricsSink {

    private static final String PRIORITY_TAG = "priority";

    private final MeterRegistry meterRegistry;
    private final Map<String, PendingOperation> pending = new ConcurrentHashMap<>();

    private final Counter successCounter;
    private final Counter failureCounter;
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;

    public MicrometerMetricsSink(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        successCounter = Counter.builder("arbiter.analysis.succeeded")
            .description("Number of successfully completed analyses")
            .register(meterRegistry);

        failureCounter = Counter.builder("arbiter.analysis.failed")
            .description("Number of failed analyses")
            .register(meterRegistry);

        cacheHitCounter = Counter.builder("arbiter.analysis.cache.hits")
            .description("Cache hits reported by the analysis executor")
            .register(meterRegistry);

        cacheMissCounter = Counter.builder("arbiter.analysis.cache.misses")
            .description("Cache misses reported by the analysis executor")
            .register(meterRegistry);
    }

    @Override
    public String startOperation(String operationType, Map<String, String> tags) {
        String operationId = operationType + "-" + UUID.randomUUID();
        String priority = tags != null ? tags.getOrDefault(PRIORITY_TAG, "UNKNOWN") : "UNKNOWN";
        pending.put(operationId, new PendingOperation(operationType, priority, Timer.start(meterRegistry)));
        return operationId;
    }

    @Override
    public void completeOperation(String operationId, AnalysisResult result, Throwable error) {
        PendingOperation operation = pending.remove(operationId);
        if (operation == null) {
            log.warn("Attempted to complete unknown operation {}", operationId);
            return;
        }

        operation.getSample().stop(Timer.builder("arbiter.analysis.execution.time")
            .description("Analysis execution time")
            .tag("operation", operation.getType())
            .tag(PRIORITY_TAG, operation.getPriority())
            .tag("outcome", error == null ? "success" : "failure")
            .register(meterRegistry));

        if (error != null) {
            failureCounter.increment();
            return;
        }

        successCounter.increment();
        if (result != null) {
            cacheHitCounter.increment(result.getCacheHits());
            cacheMissCounter.increment(result.getCacheMisses());
        }
    }

    int pendingOperations() {
        return pending.size();
    }

    @Value
    private static class PendingOperation {
        String type;
        String priority;
        Timer.Sample sample;
    }
}
