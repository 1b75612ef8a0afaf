package com.whereq.arbiter.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Scheduler configuration, fixed for the lifetime of a queue
 */
@Value
@Builder(toBuilder = true)
public class QueueConfiguration {

    @Builder.Default
    int maxQueueSize = 100;

    @Builder.Default
    int maxConcurrentWorkers = 3;

    /**
     * Passed to the executor; the scheduler does not enforce it
     */
    @Builder.Default
    Duration workerTimeout = Duration.ofMinutes(5);

    @Builder.Default
    Duration queueTimeout = Duration.ofMinutes(10);

    @Builder.Default
    Duration priorityBoostThreshold = Duration.ofSeconds(60);

    @Builder.Default
    Duration cleanupInterval = Duration.ofMinutes(5);

    @Builder.Default
    Duration dispatchInterval = Duration.ofSeconds(1);

    /**
     * Pause applied to the dispatcher after a resource denial
     */
    @Builder.Default
    Duration resourceBackoff = Duration.ofSeconds(5);

    @Builder.Default
    Duration completedRetention = Duration.ofHours(24);

    @Builder.Default
    int historyLimit = 1000;

    /**
     * Number of trailing history entries used for average wait/processing times
     */
    @Builder.Default
    int statisticsWindow = 100;

    @Builder.Default
    double maxCpuPercent = 80.0;

    @Builder.Default
    double maxMemoryPercent = 85.0;

    @Builder.Default
    boolean adaptiveScaling = true;

    @Builder.Default
    boolean priorityBoosting = true;

    /**
     * Interrupt the worker thread when an in-flight request is cancelled
     */
    @Builder.Default
    boolean interruptOnCancel = true;

    @Builder.Default
    Duration shutdownTimeout = Duration.ofSeconds(30);

    /**
     * Bound on waiting for each background loop during shutdown
     */
    @Builder.Default
    Duration loopJoinTimeout = Duration.ofSeconds(5);

    public static QueueConfiguration defaults() {
        return QueueConfiguration.builder().build();
    }

    /**
     * @throws IllegalArgumentException if any value is out of range
     */
    public QueueConfiguration validate() {
        require(maxQueueSize > 0, "maxQueueSize must be positive");
        require(maxConcurrentWorkers > 0, "maxConcurrentWorkers must be positive");
        require(historyLimit > 0, "historyLimit must be positive");
        require(statisticsWindow > 0, "statisticsWindow must be positive");
        requireNonNegative(workerTimeout, "workerTimeout");
        requireNonNegative(queueTimeout, "queueTimeout");
        requireNonNegative(priorityBoostThreshold, "priorityBoostThreshold");
        requireNonNegative(resourceBackoff, "resourceBackoff");
        requireNonNegative(completedRetention, "completedRetention");
        requireNonNegative(shutdownTimeout, "shutdownTimeout");
        requireNonNegative(loopJoinTimeout, "loopJoinTimeout");
        requirePositive(cleanupInterval, "cleanupInterval");
        requirePositive(dispatchInterval, "dispatchInterval");
        require(maxCpuPercent > 0 && maxCpuPercent <= 100, "maxCpuPercent must be in (0, 100]");
        require(maxMemoryPercent > 0 && maxMemoryPercent <= 100, "maxMemoryPercent must be in (0, 100]");
        return this;
    }

    private static void requireNonNegative(Duration value, String name) {
        require(value != null && !value.isNegative(), name + " must not be negative");
    }

    private static void requirePositive(Duration value, String name) {
        require(value != null && !value.isNegative() && !value.isZero(), name + " must be positive");
    }

    private static void require(boolean condition, String message) {
        if (!condition) {
            throw new IllegalArgumentException(message);
        }
    }
}
