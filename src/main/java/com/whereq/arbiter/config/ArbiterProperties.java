package com.whereq.arbiter.config;

import com.whereq.arbiter.model.QueueConfiguration;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for WhereQ Arbiter.
 *
 * @author WhereQ Inc.
 */
@ConfigurationProperties(prefix = "arbiter")
@Validated
@Data
public class ArbiterProperties {

    @Valid
    private QueueConfig queue = new QueueConfig();

    @Valid
    private CleanupConfig cleanup = new CleanupConfig();

    @Valid
    private ResourcesConfig resources = new ResourcesConfig();

    @Valid
    private ShutdownConfig shutdown = new ShutdownConfig();

    @Data
    public static class QueueConfig {
        /**
         * Maximum number of queued plus active requests.
         */
        @Min(1)
        private int maxSize = 100;

        /**
         * Number of analyses that may run at once.
         */
        @Min(1)
        private int maxConcurrentWorkers = 3;

        /**
         * Execution budget handed to the analysis executor.
         */
        @NotNull
        private Duration workerTimeout = Duration.ofMinutes(5);

        /**
         * Requests waiting longer than this are expired before dispatch.
         */
        @NotNull
        private Duration queueTimeout = Duration.ofMinutes(10);

        /**
         * Waiting time after which a request moves up one priority tier.
         */
        @NotNull
        private Duration priorityBoostThreshold = Duration.ofSeconds(60);

        private boolean priorityBoosting = true;

        /**
         * Dispatcher tick.
         */
        @NotNull
        private Duration dispatchInterval = Duration.ofSeconds(1);

        /**
         * Dispatcher pause after a resource denial.
         */
        @NotNull
        private Duration resourceBackoff = Duration.ofSeconds(5);

        /**
         * Interrupt the worker when a processing request is cancelled.
         */
        private boolean interruptOnCancel = true;

        /**
         * Number of recent requests averaged in statistics.
         */
        @Min(1)
        private int statisticsWindow = 100;
    }

    @Data
    public static class CleanupConfig {
        @NotNull
        private Duration interval = Duration.ofMinutes(5);

        /**
         * How long completed requests stay queryable.
         */
        @NotNull
        private Duration retention = Duration.ofHours(24);

        @Min(1)
        private int historyLimit = 1000;
    }

    @Data
    public static class ResourcesConfig {
        /**
         * Gate dispatch on host CPU and memory usage.
         */
        private boolean adaptiveScaling = true;

        @DecimalMin(value = "0", inclusive = false)
        @DecimalMax("100")
        private double maxCpuPercent = 80.0;

        @DecimalMin(value = "0", inclusive = false)
        @DecimalMax("100")
        private double maxMemoryPercent = 85.0;
    }

    @Data
    public static class ShutdownConfig {
        @NotNull
        private Duration timeout = Duration.ofSeconds(30);

        /**
         * Bound on waiting for each background loop.
         */
        @NotNull
        private Duration loopJoinTimeout = Duration.ofSeconds(5);
    }

    /**
     * Immutable scheduler configuration built from these properties
     */
    public QueueConfiguration toQueueConfiguration() {
        return QueueConfiguration.builder()
            .maxQueueSize(queue.getMaxSize())
            .maxConcurrentWorkers(queue.getMaxConcurrentWorkers())
            .workerTimeout(queue.getWorkerTimeout())
            .queueTimeout(queue.getQueueTimeout())
            .priorityBoostThreshold(queue.getPriorityBoostThreshold())
            .priorityBoosting(queue.isPriorityBoosting())
            .dispatchInterval(queue.getDispatchInterval())
            .resourceBackoff(queue.getResourceBackoff())
            .interruptOnCancel(queue.isInterruptOnCancel())
            .statisticsWindow(queue.getStatisticsWindow())
            .cleanupInterval(cleanup.getInterval())
            .completedRetention(cleanup.getRetention())
            .historyLimit(cleanup.getHistoryLimit())
            .adaptiveScaling(resources.isAdaptiveScaling())
            .maxCpuPercent(resources.getMaxCpuPercent())
            .maxMemoryPercent(resources.getMaxMemoryPercent())
            .shutdownTimeout(shutdown.getTimeout())
            .loopJoinTimeout(shutdown.getLoopJoinTimeout())
            .build()
            .validate();
    }
}
