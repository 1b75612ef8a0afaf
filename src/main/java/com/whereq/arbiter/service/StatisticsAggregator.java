package com.whereq.arbiter.service;

import com.whereq.arbiter.model.AnalysisRequest;
import com.whereq.arbiter.model.QueueConfiguration;
import com.whereq.arbiter.model.QueueStatistics;
import com.whereq.arbiter.model.RequestStatus;
import com.whereq.arbiter.queue.RequestRegistry;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.function.Function;

/**
 * Computes queue statistics on demand from counters and history
 */
class StatisticsAggregator {

    private static final Duration THROUGHPUT_WINDOW = Duration.ofHours(1);

    private final QueueState state;

    StatisticsAggregator(QueueState state) {
        this.state = state;
    }

    QueueStatistics compute() {
        QueueConfiguration config = state.getConfig();
        Instant now = state.now();

        state.getLock().lock();
        try {
            RequestRegistry registry = state.getRegistry();
            QueueCounters counters = state.getCounters();
            int activeRequests = registry.activeCount();

            Instant throughputCutoff = now.minus(THROUGHPUT_WINDOW);
            long completedLastHour = registry.history().stream()
                .filter(r -> r.getStatus() == RequestStatus.COMPLETED)
                .filter(r -> r.getCompletedAt() != null && !r.getCompletedAt().isBefore(throughputCutoff))
                .count();

            List<AnalysisRequest> recent = registry.recentHistory(config.getStatisticsWindow()).stream()
                .filter(r -> r.getStatus() == RequestStatus.COMPLETED)
                .toList();

            return QueueStatistics.builder()
                .totalRequests(counters.getTotalRequests())
                .completedRequests(counters.getCompletedRequests())
                .failedRequests(counters.getFailedRequests())
                .cancelledRequests(counters.getCancelledRequests())
                .timeoutRequests(counters.getTimeoutRequests())
                .boostedRequests(counters.getBoostedRequests())
                .currentQueueSize(state.getLanes().size())
                .peakQueueSize(counters.getPeakQueueSize())
                .activeRequests(activeRequests)
                .workerUtilization((double) activeRequests / config.getMaxConcurrentWorkers())
                .throughputPerHour(completedLastHour)
                .averageWaitTime(average(recent, AnalysisRequest::getWaitTime))
                .averageProcessingTime(average(recent, AnalysisRequest::getProcessingTime))
                .queueBreakdown(state.getLanes().breakdown())
                .configuration(QueueStatistics.ConfigurationSummary.builder()
                    .maxQueueSize(config.getMaxQueueSize())
                    .maxConcurrentWorkers(config.getMaxConcurrentWorkers())
                    .workerTimeout(config.getWorkerTimeout())
                    .queueTimeout(config.getQueueTimeout())
                    .build())
                .build();
        } finally {
            state.getLock().unlock();
        }
    }

    private static double average(List<AnalysisRequest> requests, Function<AnalysisRequest, Double> field) {
        OptionalDouble average = requests.stream()
            .map(field)
            .filter(Objects::nonNull)
            .mapToDouble(Double::doubleValue)
            .average();
        return average.orElse(0.0);
    }
}
