package com.whereq.arbiter.service;

import com.whereq.arbiter.executor.WorkerPool;
import com.whereq.arbiter.executor.WorkerTask;
import com.whereq.arbiter.model.AnalysisRequest;
import com.whereq.arbiter.model.AnalysisResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Single consumer of finished worker tasks.
 *
 * Moves each request from active to completed with its final status. A request
 * is never left active: if handling fails it is completed as FAILED.
 */
@Slf4j
class CompletionHandler {

    private static final Duration POLL_INTERVAL = Duration.ofMillis(100);
    private static final int MAX_ERROR_LENGTH = 500;

    private final QueueState state;
    private final WorkerPool workerPool;

    private ExecutorService consumer;
    private volatile boolean running;

    CompletionHandler(QueueState state, WorkerPool workerPool) {
        this.state = state;
        this.workerPool = workerPool;
    }

    synchronized void start() {
        if (consumer != null) {
            return;
        }
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("arbiter-completions-");
        threadFactory.setDaemon(true);
        consumer = Executors.newSingleThreadExecutor(threadFactory);
        running = true;
        consumer.execute(this::consume);
    }

    /**
     * Stop after handling every completion already published
     *
     * @return true if the consumer finished within the timeout
     */
    synchronized boolean stop(Duration timeout) {
        if (consumer == null) {
            return true;
        }
        running = false;
        consumer.shutdown();
        try {
            if (consumer.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                return true;
            }
            log.warn("Completion consumer did not stop within {}, interrupting", timeout);
            consumer.shutdownNow();
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            consumer.shutdownNow();
            return false;
        } finally {
            consumer = null;
        }
    }

    private void consume() {
        while (running || workerPool.hasPendingCompletions()) {
            try {
                WorkerTask task = workerPool.pollCompleted(POLL_INTERVAL);
                if (task != null) {
                    handle(task);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (RuntimeException e) {
                log.error("Error in completion consumer", e);
            }
        }
    }

    /**
     * Record the outcome of a finished task
     */
    void handle(WorkerTask task) {
        String requestId = task.getRequestId();
        state.getLock().lock();
        try {
            AnalysisRequest request = state.getRegistry().deactivate(requestId);
            if (request == null) {
                // cancel() already finalised it
                log.debug("Ignoring completion of request {}: no longer active", requestId);
                return;
            }

            Instant now = state.now();
            try {
                classify(task, request, now);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                forceFail(request, e, now);
            } catch (RuntimeException e) {
                forceFail(request, e, now);
            }

            state.finalizeRequest(request);
        } finally {
            state.getLock().unlock();
        }
    }

    private void classify(WorkerTask task, AnalysisRequest request, Instant now) throws InterruptedException {
        String requestId = request.getRequestId();

        if (task.isCancelled()) {
            request.cancel(now);
            log.info("Request {} cancelled during processing", requestId);
            return;
        }

        try {
            AnalysisResult result = task.get();
            request.complete(result, now);
            log.info("Request {} completed successfully in {}s", requestId, request.getProcessingTime());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            String error = sanitize(cause);
            request.fail(error, now);
            log.error("Request {} failed: {}", requestId, error);
        }
    }

    private void forceFail(AnalysisRequest request, Exception e, Instant now) {
        log.error("Error handling completion of request {}", request.getRequestId(), e);
        if (!request.getStatus().isTerminal()) {
            request.forceFail("Completion handling failed: " + sanitize(e), now);
        }
    }

    /**
     * Single-line, length-bounded description of a failure
     */
    static String sanitize(Throwable error) {
        String message = error.getMessage();
        String text = message == null || message.isBlank()
            ? error.getClass().getSimpleName()
            : error.getClass().getSimpleName() + ": " + message;
        text = text.replaceAll("\\s+", " ").trim();
        if (text.length() > MAX_ERROR_LENGTH) {
            text = text.substring(0, MAX_ERROR_LENGTH - 3) + "...";
        }
        return text;
    }
}
