package com.whereq.arbiter.service;

import com.whereq.arbiter.model.RequestStatus;
import lombok.Getter;

/**
 * Running request counters. Guarded by the queue lock.
 */
@Getter
class QueueCounters {
    private long totalRequests;
    private long completedRequests;
    private long failedRequests;
    private long cancelledRequests;
    private long timeoutRequests;
    private long boostedRequests;
    private int peakQueueSize;

    void recordSubmitted(int queueSizeAfterSubmit) {
        totalRequests++;
        peakQueueSize = Math.max(peakQueueSize, queueSizeAfterSubmit);
    }

    void recordBoosted() {
        boostedRequests++;
    }

    void recordTerminal(RequestStatus status) {
        switch (status) {
            case COMPLETED -> completedRequests++;
            case FAILED -> failedRequests++;
            case CANCELLED -> cancelledRequests++;
            case TIMEOUT -> timeoutRequests++;
            default -> throw new IllegalArgumentException("Not a terminal status: " + status);
        }
    }
}
