package com.whereq.arbiter.service;

import com.whereq.arbiter.exception.QueueFullException;
import com.whereq.arbiter.executor.AnalysisExecutor;
import com.whereq.arbiter.executor.WorkerPool;
import com.whereq.arbiter.executor.WorkerTask;
import com.whereq.arbiter.metrics.MetricsSink;
import com.whereq.arbiter.metrics.NoOpMetricsSink;
import com.whereq.arbiter.model.AnalysisRequest;
import com.whereq.arbiter.model.QueueConfiguration;
import com.whereq.arbiter.model.QueueStatistics;
import com.whereq.arbiter.model.RequestPriority;
import com.whereq.arbiter.model.RequestSnapshot;
import com.whereq.arbiter.queue.PriorityLanes;
import com.whereq.arbiter.queue.RequestRegistry;
import com.whereq.arbiter.resource.ResourceGovernor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Priority queue and dispatcher for analysis requests.
 *
 * Requests wait in one of four priority lanes until the dispatcher admits them to a
 * fixed pool of workers. Admission is gated by worker capacity and host resource
 * usage; requests that wait too long are boosted or expired. The owning application
 * constructs one instance, calls {@link #start()}, and {@link #close()} on exit.
 */
@Slf4j
public class AnalysisQueue implements AutoCloseable {

    static final String UNFINISHED_AT_SHUTDOWN = "Analysis did not finish before shutdown";

    private final QueueConfiguration config;
    private final QueueState state;
    private final WorkerPool workerPool;
    private final Dispatcher dispatcher;
    private final CompletionHandler completionHandler;
    private final Reaper reaper;
    private final StatisticsAggregator statistics;

    private final AtomicLong sequence = new AtomicLong();
    private final AtomicBoolean started = new AtomicBoolean(false);

    public AnalysisQueue(QueueConfiguration config, AnalysisExecutor executor, ResourceGovernor governor) {
        this(config, executor, governor, NoOpMetricsSink.INSTANCE, Clock.systemUTC());
    }

    public AnalysisQueue(QueueConfiguration config, AnalysisExecutor executor, ResourceGovernor governor,
                         MetricsSink metricsSink, Clock clock) {
        this.config = config.validate();
        this.state = new QueueState(config, clock);
        this.workerPool = new WorkerPool(config.getMaxConcurrentWorkers());
        this.dispatcher = new Dispatcher(state, governor, new PriorityBooster(config), workerPool,
            executor, metricsSink != null ? metricsSink : NoOpMetricsSink.INSTANCE);
        this.completionHandler = new CompletionHandler(state, workerPool);
        this.reaper = new Reaper(state);
        this.statistics = new StatisticsAggregator(state);

        log.info("Analysis queue initialized with {} workers, capacity {}",
            config.getMaxConcurrentWorkers(), config.getMaxQueueSize());
    }

    /**
     * Start the completion consumer, dispatcher and cleanup loops
     */
    public void start() {
        if (state.isStopped()) {
            throw new IllegalStateException("Analysis queue has been shut down");
        }
        if (!started.compareAndSet(false, true)) {
            return;
        }
        completionHandler.start();
        dispatcher.start();
        reaper.start();
        log.info("Analysis queue started: dispatch every {}, cleanup every {}",
            config.getDispatchInterval(), config.getCleanupInterval());
    }

    /**
     * Submit a request with NORMAL priority
     */
    public String submit(String payload) {
        return submit(payload, null, RequestPriority.NORMAL, null);
    }

    /**
     * Submit an analysis request
     *
     * @param payload job reference passed to the executor, e.g. a memory file path
     * @param userId submitting user (optional)
     * @param priority request priority, NORMAL if null
     * @param metadata additional metadata (optional)
     * @return request id for tracking
     * @throws QueueFullException if queued plus active requests reach the capacity
     * @throws IllegalStateException if the queue has been shut down
     */
    public String submit(String payload, String userId, RequestPriority priority, Map<String, Object> metadata) {
        if (state.isStopped()) {
            throw new IllegalStateException("Analysis queue has been shut down");
        }

        RequestPriority effectivePriority = priority != null ? priority : RequestPriority.NORMAL;

        state.getLock().lock();
        try {
            PriorityLanes lanes = state.getLanes();
            if (lanes.size() + state.getRegistry().activeCount() >= config.getMaxQueueSize()) {
                log.warn("Rejected request from user {}: queue is at capacity ({})", userId, config.getMaxQueueSize());
                throw new QueueFullException(config.getMaxQueueSize());
            }

            AnalysisRequest request = AnalysisRequest.builder()
                .requestId(generateRequestId())
                .userId(userId)
                .payload(payload)
                .priority(effectivePriority)
                .createdAt(state.now())
                .metadata(metadata)
                .sequence(sequence.incrementAndGet())
                .build();

            lanes.offer(request);
            state.getCounters().recordSubmitted(lanes.size());

            log.info("Submitted analysis request {} with priority {}", request.getRequestId(), effectivePriority);
            return request.getRequestId();
        } finally {
            state.getLock().unlock();
        }
    }

    /**
     * Get status of a request: active first, then completed, then the lanes
     *
     * @return snapshot, or empty if the request is unknown or already evicted
     */
    public Optional<RequestSnapshot> getStatus(String requestId) {
        state.getLock().lock();
        try {
            RequestRegistry registry = state.getRegistry();

            AnalysisRequest active = registry.getActive(requestId);
            if (active != null) {
                return Optional.of(active.snapshot());
            }

            AnalysisRequest completed = registry.getCompleted(requestId);
            if (completed != null) {
                return Optional.of(completed.snapshot());
            }

            return state.getLanes().find(requestId).map(AnalysisRequest::snapshot);
        } finally {
            state.getLock().unlock();
        }
    }

    /**
     * Cancel a queued or processing request
     *
     * A processing request is finalised at once, but its worker slot stays taken
     * until the job actually returns.
     *
     * @return true if the request was cancelled; false if it is unknown, already
     * finished, or could not be interrupted
     */
    public boolean cancel(String requestId) {
        state.getLock().lock();
        try {
            Instant now = state.now();
            RequestRegistry registry = state.getRegistry();

            AnalysisRequest active = registry.getActive(requestId);
            if (active != null) {
                WorkerTask task = registry.getTask(requestId);
                if (task != null && task.cancel(config.isInterruptOnCancel())) {
                    registry.deactivate(requestId);
                    active.cancel(now);
                    state.finalizeRequest(active);
                    log.info("Cancelled processing request {}", requestId);
                    return true;
                }
                log.warn("Could not cancel processing request {}", requestId);
                return false;
            }

            Optional<AnalysisRequest> queued = state.getLanes().remove(requestId);
            if (queued.isPresent()) {
                AnalysisRequest request = queued.get();
                request.cancel(now);
                state.finalizeRequest(request);
                log.info("Cancelled queued request {}", requestId);
                return true;
            }

            return false;
        } finally {
            state.getLock().unlock();
        }
    }

    /**
     * Current queue statistics
     */
    public QueueStatistics getStatistics() {
        return statistics.compute();
    }

    /**
     * Total number of requests waiting in all lanes
     */
    public int getQueueSize() {
        state.getLock().lock();
        try {
            return state.getLanes().size();
        } finally {
            state.getLock().unlock();
        }
    }

    public int getActiveCount() {
        state.getLock().lock();
        try {
            return state.getRegistry().activeCount();
        } finally {
            state.getLock().unlock();
        }
    }

    public QueueConfiguration getConfiguration() {
        return config;
    }

    public boolean isShutdown() {
        return state.isStopped();
    }

    /**
     * Shut down gracefully: cancel queued requests, let in-flight ones finish, stop
     * the background loops. Safe to call more than once.
     *
     * @param timeout overall bound on the time spent waiting
     */
    public void shutdown(Duration timeout) {
        if (!state.getStopped().compareAndSet(false, true)) {
            return;
        }
        log.info("Shutting down analysis queue...");
        long deadline = System.nanoTime() + timeout.toNanos();

        cancelQueuedRequests();

        workerPool.shutdown();
        try {
            if (!workerPool.awaitTermination(remaining(deadline))) {
                log.warn("In-flight analyses did not finish within {}, interrupting workers", timeout);
                workerPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workerPool.shutdownNow();
        }

        Duration joinTimeout = config.getLoopJoinTimeout();
        dispatcher.stop(min(joinTimeout, remaining(deadline)));
        reaper.stop(min(joinTimeout, remaining(deadline)));
        completionHandler.stop(min(joinTimeout, remaining(deadline)));

        failUnfinishedRequests();

        log.info("Analysis queue shutdown complete");
    }

    @Override
    public void close() {
        shutdown(config.getShutdownTimeout());
    }

    /**
     * Run one dispatcher pass immediately
     */
    void dispatchOnce() {
        dispatcher.tick();
    }

    /**
     * Run one cleanup pass immediately
     */
    void cleanupOnce() {
        reaper.sweep();
    }

    private void cancelQueuedRequests() {
        state.getLock().lock();
        try {
            Instant now = state.now();
            List<AnalysisRequest> drained = state.getLanes().drainAll();
            for (AnalysisRequest request : drained) {
                request.cancel(now);
                state.finalizeRequest(request);
            }
            if (!drained.isEmpty()) {
                log.info("Cancelled {} queued requests", drained.size());
            }
        } finally {
            state.getLock().unlock();
        }
    }

    /**
     * Finish requests whose completion was never consumed, e.g. jobs that ignored
     * the interrupt and outlived the shutdown timeout
     */
    private void failUnfinishedRequests() {
        state.getLock().lock();
        try {
            Instant now = state.now();
            RequestRegistry registry = state.getRegistry();
            List<AnalysisRequest> unfinished = registry.activeRequests();
            for (AnalysisRequest request : unfinished) {
                registry.deactivate(request.getRequestId());
                request.forceFail(UNFINISHED_AT_SHUTDOWN, now);
                state.finalizeRequest(request);
            }
            if (!unfinished.isEmpty()) {
                log.warn("Failed {} requests still processing at shutdown", unfinished.size());
            }
        } finally {
            state.getLock().unlock();
        }
    }

    private static Duration remaining(long deadlineNanos) {
        return Duration.ofNanos(Math.max(0L, deadlineNanos - System.nanoTime()));
    }

    private static Duration min(Duration a, Duration b) {
        return a.compareTo(b) <= 0 ? a : b;
    }

    private static String generateRequestId() {
        return "req-" + UUID.randomUUID();
    }
}
