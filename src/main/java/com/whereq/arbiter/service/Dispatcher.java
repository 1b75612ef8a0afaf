package com.whereq.arbiter.service;

import com.whereq.arbiter.executor.AnalysisExecutor;
import com.whereq.arbiter.executor.WorkerPool;
import com.whereq.arbiter.executor.WorkerTask;
import com.whereq.arbiter.metrics.MetricsSink;
import com.whereq.arbiter.model.AnalysisRequest;
import com.whereq.arbiter.model.QueueConfiguration;
import com.whereq.arbiter.model.RequestPriority;
import com.whereq.arbiter.queue.PriorityLanes;
import com.whereq.arbiter.queue.RequestRegistry;
import com.whereq.arbiter.resource.ResourceGovernor;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Background loop that moves requests from the priority lanes to the worker pool.
 *
 * Each tick admits at most one request. Lanes are scanned URGENT first; expired
 * entries are timed out and long-waiting ones boosted on the way. A boosted request
 * is not dispatched in the tick that boosted it.
 */
@Slf4j
class Dispatcher {

    private final QueueState state;
    private final ResourceGovernor governor;
    private final PriorityBooster booster;
    private final WorkerPool workerPool;
    private final AnalysisExecutor executor;
    private final MetricsSink metricsSink;
    private final BackgroundLoop loop;

    private final AtomicLong workerSequence = new AtomicLong();

    /**
     * Dispatch is suspended until this instant after a resource denial
     */
    private volatile Instant pausedUntil;

    Dispatcher(QueueState state, ResourceGovernor governor, PriorityBooster booster, WorkerPool workerPool,
               AnalysisExecutor executor, MetricsSink metricsSink) {
        this.state = state;
        this.governor = governor;
        this.booster = booster;
        this.workerPool = workerPool;
        this.executor = executor;
        this.metricsSink = metricsSink;
        this.loop = new BackgroundLoop("arbiter-dispatcher", state.getConfig().getDispatchInterval(), this::tick);
    }

    void start() {
        loop.start();
    }

    boolean stop(Duration timeout) {
        return loop.stop(timeout);
    }

    /**
     * One dispatch pass
     */
    void tick() {
        try {
            if (state.isStopped()) {
                return;
            }

            Instant now = state.now();
            if (pausedUntil != null) {
                if (now.isBefore(pausedUntil)) {
                    return;
                }
                pausedUntil = null;
            }

            state.getLock().lock();
            try {
                dispatchNext(now);
            } finally {
                state.getLock().unlock();
            }
        } catch (RuntimeException e) {
            log.error("Error in queue management: {}", e.getMessage(), e);
        }
    }

    private void dispatchNext(Instant now) {
        QueueConfiguration config = state.getConfig();
        int workers = config.getMaxConcurrentWorkers();
        if (state.getRegistry().activeCount() >= workers || workerPool.occupiedSlots() >= workers) {
            return;
        }

        AnalysisRequest request = nextCandidate(now);
        if (request == null) {
            return;
        }

        boolean admitted;
        try {
            admitted = governor.admit();
        } catch (RuntimeException e) {
            state.getLanes().requeue(request);
            throw e;
        }

        if (!admitted) {
            state.getLanes().requeue(request);
            pausedUntil = now.plus(config.getResourceBackoff());
            log.info("Deferring request {}: resources unavailable, pausing dispatch for {}",
                request.getRequestId(), config.getResourceBackoff());
            return;
        }

        startProcessing(request, now);
    }

    /**
     * Take the next dispatchable request, expiring and boosting entries along the way
     */
    private AnalysisRequest nextCandidate(Instant now) {
        PriorityLanes lanes = state.getLanes();
        Duration queueTimeout = state.getConfig().getQueueTimeout();

        for (RequestPriority priority : PriorityLanes.highestFirst()) {
            AnalysisRequest request;
            while ((request = lanes.poll(priority)) != null) {
                if (request.age(now).compareTo(queueTimeout) > 0) {
                    request.expire(now);
                    state.finalizeRequest(request);
                    log.warn("Request {} timed out after waiting {}", request.getRequestId(), request.age(now));
                    continue;
                }

                if (booster.shouldBoost(request, now) && request.boost()) {
                    lanes.offer(request);
                    state.getCounters().recordBoosted();
                    log.info("Boosted priority of request {} to {}", request.getRequestId(), request.getPriority());
                    continue;
                }

                return request;
            }
        }
        return null;
    }

    private void startProcessing(AnalysisRequest request, Instant now) {
        RequestRegistry registry = state.getRegistry();
        String workerId = "worker-" + workerSequence.incrementAndGet();

        request.startProcessing(workerId, now);
        registry.activate(request);

        AnalysisTask work = new AnalysisTask(
            request.toJob(state.getConfig().getWorkerTimeout()), executor, metricsSink);
        try {
            WorkerTask task = workerPool.submit(request.getRequestId(), work);
            registry.attachTask(request.getRequestId(), task);
            log.info("Started processing request {} with {} after waiting {}s",
                request.getRequestId(), workerId, request.getWaitTime());
            if (log.isDebugEnabled()) {
                log.debug("Resources at dispatch: {}", governor.getResourceSummary());
            }
        } catch (RejectedExecutionException e) {
            registry.deactivate(request.getRequestId());
            request.fail("Worker pool is not accepting work", now);
            state.finalizeRequest(request);
            log.warn("Worker pool rejected request {}", request.getRequestId());
        }
    }
}
