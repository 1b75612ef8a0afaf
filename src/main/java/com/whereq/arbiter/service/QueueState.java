package com.whereq.arbiter.service;

import com.whereq.arbiter.model.AnalysisRequest;
import com.whereq.arbiter.model.QueueConfiguration;
import com.whereq.arbiter.queue.PriorityLanes;
import com.whereq.arbiter.queue.RequestRegistry;
import lombok.Getter;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Shared scheduler state. Lanes, registry and counters are only touched while
 * holding {@link #getLock()}.
 */
@Getter
class QueueState {
    private final ReentrantLock lock = new ReentrantLock();
    private final PriorityLanes lanes = new PriorityLanes();
    private final RequestRegistry registry = new RequestRegistry();
    private final QueueCounters counters = new QueueCounters();
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private final QueueConfiguration config;
    private final Clock clock;

    QueueState(QueueConfiguration config, Clock clock) {
        this.config = config;
        this.clock = clock;
    }

    Instant now() {
        return clock.instant();
    }

    boolean isStopped() {
        return stopped.get();
    }

    /**
     * Record a request that just reached a terminal status. Caller holds the lock.
     */
    void finalizeRequest(AnalysisRequest request) {
        registry.complete(request);
        counters.recordTerminal(request.getStatus());
    }
}
