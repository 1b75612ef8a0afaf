package com.whereq.arbiter.queue;

import com.whereq.arbiter.model.AnalysisRequest;
import com.whereq.arbiter.executor.WorkerTask;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Active and completed requests plus the bounded completion history.
 *
 * Not thread-safe; callers hold the queue lock.
 */
public class RequestRegistry {

    private final Map<String, AnalysisRequest> active = new LinkedHashMap<>();
    private final Map<String, WorkerTask> activeTasks = new LinkedHashMap<>();
    private final Map<String, AnalysisRequest> completed = new LinkedHashMap<>();
    private final Deque<AnalysisRequest> history = new ArrayDeque<>();

    public void activate(AnalysisRequest request) {
        active.put(request.getRequestId(), request);
    }

    public void attachTask(String requestId, WorkerTask task) {
        activeTasks.put(requestId, task);
    }

    public AnalysisRequest getActive(String requestId) {
        return active.get(requestId);
    }

    public WorkerTask getTask(String requestId) {
        return activeTasks.get(requestId);
    }

    /**
     * Drop a request from the active set
     *
     * @return the request, or null if it was not active
     */
    public AnalysisRequest deactivate(String requestId) {
        activeTasks.remove(requestId);
        return active.remove(requestId);
    }

    /**
     * Record a request that reached a terminal status
     */
    public void complete(AnalysisRequest request) {
        completed.put(request.getRequestId(), request);
        history.addLast(request);
    }

    public AnalysisRequest getCompleted(String requestId) {
        return completed.get(requestId);
    }

    /**
     * Evict completed requests finished before {@code cutoff}
     *
     * @return number of evicted requests
     */
    public int evictCompletedBefore(Instant cutoff) {
        int removed = 0;
        Iterator<AnalysisRequest> it = completed.values().iterator();
        while (it.hasNext()) {
            AnalysisRequest request = it.next();
            if (request.getCompletedAt() != null && request.getCompletedAt().isBefore(cutoff)) {
                it.remove();
                removed++;
            }
        }
        return removed;
    }

    /**
     * Keep only the most recent {@code limit} history entries
     *
     * @return number of dropped entries
     */
    public int trimHistory(int limit) {
        int dropped = 0;
        while (history.size() > limit) {
            history.pollFirst();
            dropped++;
        }
        return dropped;
    }

    /**
     * Up to {@code count} most recent history entries, oldest first
     */
    public List<AnalysisRequest> recentHistory(int count) {
        List<AnalysisRequest> all = new ArrayList<>(history);
        return all.subList(Math.max(0, all.size() - count), all.size());
    }

    public List<AnalysisRequest> history() {
        return new ArrayList<>(history);
    }

    /**
     * Active requests in dispatch order
     */
    public List<AnalysisRequest> activeRequests() {
        return new ArrayList<>(active.values());
    }

    public int activeCount() {
        return active.size();
    }

    public int completedCount() {
        return completed.size();
    }

    public int historySize() {
        return history.size();
    }
}
