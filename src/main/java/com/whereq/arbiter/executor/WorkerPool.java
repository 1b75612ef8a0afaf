package com.whereq.arbiter.executor;

import com.whereq.arbiter.model.AnalysisResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Callable;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed-size pool of analysis workers.
 *
 * Finished tasks (including cancelled ones) are collected in a single completion
 * queue so that one consumer handles every outcome. A task occupies a worker slot
 * from submission until its thread leaves it, whether or not it was cancelled.
 */
@Slf4j
public class WorkerPool {

    private final ThreadPoolExecutor executor;
    private final BlockingQueue<WorkerTask> completions = new LinkedBlockingQueue<>();
    private final AtomicInteger occupied = new AtomicInteger();

    public WorkerPool(int size) {
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("analysis-worker-");
        threadFactory.setDaemon(true);

        this.executor = new ThreadPoolExecutor(size, size, 0L, TimeUnit.MILLISECONDS,
            new LinkedBlockingQueue<>(), threadFactory);
    }

    /**
     * Submit work for a request
     *
     * @throws RejectedExecutionException if the pool has been shut down
     */
    public WorkerTask submit(String requestId, Callable<AnalysisResult> work) {
        WorkerTask task = new WorkerTask(requestId, work, this::release);
        occupied.incrementAndGet();
        try {
            executor.execute(task);
        } catch (RejectedExecutionException e) {
            occupied.decrementAndGet();
            throw e;
        }
        return task;
    }

    /**
     * Number of submitted tasks whose worker has not yet let go of them
     */
    public int occupiedSlots() {
        return occupied.get();
    }

    /**
     * Wait up to {@code timeout} for the next finished task
     *
     * @return the task, or null if none finished in time
     */
    public WorkerTask pollCompleted(Duration timeout) throws InterruptedException {
        return completions.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public boolean hasPendingCompletions() {
        return !completions.isEmpty();
    }

    /**
     * Stop accepting new work; in-flight tasks keep running
     */
    public void shutdown() {
        executor.shutdown();
    }

    /**
     * @return true if every task finished within the timeout
     */
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        return executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Interrupt running tasks and cancel the ones that never started
     */
    public void shutdownNow() {
        List<Runnable> neverStarted = executor.shutdownNow();
        for (Runnable runnable : neverStarted) {
            if (runnable instanceof WorkerTask task) {
                task.cancel(false);
                release(task);
            }
        }
        if (!neverStarted.isEmpty()) {
            log.warn("Cancelled {} analysis tasks that never started", neverStarted.size());
        }
    }

    private void release(WorkerTask task) {
        occupied.decrementAndGet();
        completions.offer(task);
    }
}
