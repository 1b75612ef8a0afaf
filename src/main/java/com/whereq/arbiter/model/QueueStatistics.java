package com.whereq.arbiter.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.Map;

/**
 * Queue metrics derived from running counters and request history at query time
 */
@Value
@Builder
public class QueueStatistics {
    long totalRequests;
    long completedRequests;
    long failedRequests;
    long cancelledRequests;
    long timeoutRequests;
    long boostedRequests;

    /**
     * Sum of all lane sizes
     */
    int currentQueueSize;

    /**
     * High-water mark of {@link #currentQueueSize}
     */
    int peakQueueSize;

    int activeRequests;

    /**
     * Active requests divided by the worker count
     */
    double workerUtilization;

    /**
     * Requests completed successfully within the trailing hour
     */
    long throughputPerHour;

    /**
     * Seconds, over the most recent successful requests
     */
    double averageWaitTime;

    /**
     * Seconds, over the most recent successful requests
     */
    double averageProcessingTime;

    Map<RequestPriority, Integer> queueBreakdown;

    ConfigurationSummary configuration;

    @Value
    @Builder
    public static class ConfigurationSummary {
        int maxQueueSize;
        int maxConcurrentWorkers;
        Duration workerTimeout;
        Duration queueTimeout;
    }
}
