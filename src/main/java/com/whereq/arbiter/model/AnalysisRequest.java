package com.whereq.arbiter.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Analysis request with lifecycle and resource tracking.
 *
 * Not thread-safe: every mutation happens under the owning queue's lock.
 */
@Getter
@ToString(of = {"requestId", "priority", "status", "workerId"})
public class AnalysisRequest {

    private final String requestId;
    private final String userId;
    private final String payload;
    private final Instant createdAt;
    private final Map<String, Object> metadata;

    /**
     * Submission order, used to break ties between requests created in the same instant
     */
    private final long sequence;

    private RequestPriority priority;
    private RequestStatus status = RequestStatus.QUEUED;

    private Instant startedAt;
    private Instant completedAt;
    private String workerId;
    private AnalysisResult result;
    private String error;

    /**
     * Seconds between creation and dispatch
     */
    private Double waitTime;

    /**
     * Seconds between dispatch and completion
     */
    private Double processingTime;

    private long cacheHits;
    private long cacheMisses;
    private double memoryUsageMb;
    private double cpuUsagePercent;

    @Builder
    private AnalysisRequest(String requestId, String userId, String payload, RequestPriority priority,
                            Instant createdAt, Map<String, Object> metadata, long sequence) {
        this.requestId = Objects.requireNonNull(requestId, "requestId");
        this.userId = userId;
        this.payload = payload;
        this.priority = priority != null ? priority : RequestPriority.NORMAL;
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
        this.metadata = metadata != null
            ? Collections.unmodifiableMap(new HashMap<>(metadata))
            : Collections.emptyMap();
        this.sequence = sequence;
    }

    /**
     * Mark request as started processing
     */
    public void startProcessing(String workerId, Instant now) {
        transitionTo(RequestStatus.PROCESSING);
        this.workerId = workerId;
        this.startedAt = now;
        this.waitTime = seconds(createdAt, now);
    }

    /**
     * Mark request as completed with the executor's result
     */
    public void complete(AnalysisResult result, Instant now) {
        transitionTo(RequestStatus.COMPLETED);
        this.result = result;
        if (result != null) {
            this.cacheHits = result.getCacheHits();
            this.cacheMisses = result.getCacheMisses();
            this.memoryUsageMb = result.getMemoryUsageMb();
            this.cpuUsagePercent = result.getCpuUsagePercent();
        }
        finish(now);
    }

    /**
     * Mark request as failed
     */
    public void fail(String error, Instant now) {
        transitionTo(RequestStatus.FAILED);
        this.error = error;
        finish(now);
    }

    /**
     * Fail a request whose completion could not be handled normally. Skips the
     * transition check so that no request is left non-terminal.
     */
    public void forceFail(String error, Instant now) {
        if (status.isTerminal()) {
            throw new IllegalStateException("Request " + requestId + " already finished with status " + status);
        }
        this.status = RequestStatus.FAILED;
        this.error = error;
        finish(now);
    }

    /**
     * Mark request as cancelled, either from its lane or while processing
     */
    public void cancel(Instant now) {
        transitionTo(RequestStatus.CANCELLED);
        finish(now);
    }

    /**
     * Mark a queued request as expired
     */
    public void expire(Instant now) {
        transitionTo(RequestStatus.TIMEOUT);
        this.error = "Request exceeded queue timeout";
        finish(now);
    }

    /**
     * Raise priority one tier. Only queued requests can be boosted.
     *
     * @return true if the priority changed
     */
    public boolean boost() {
        if (status != RequestStatus.QUEUED) {
            throw new IllegalStateException("Cannot boost request " + requestId + " in status " + status);
        }
        RequestPriority boosted = priority.boost();
        if (boosted == priority) {
            return false;
        }
        this.priority = boosted;
        return true;
    }

    /**
     * Time spent since creation
     */
    public Duration age(Instant now) {
        return Duration.between(createdAt, now);
    }

    /**
     * Job view handed to the executor
     */
    public AnalysisJob toJob(Duration workerTimeout) {
        return AnalysisJob.builder()
            .requestId(requestId)
            .userId(userId)
            .payload(payload)
            .priority(priority)
            .metadata(metadata)
            .workerTimeout(workerTimeout)
            .build();
    }

    /**
     * Immutable copy of the current state
     */
    public RequestSnapshot snapshot() {
        return RequestSnapshot.builder()
            .requestId(requestId)
            .userId(userId)
            .payload(payload)
            .priority(priority)
            .status(status)
            .createdAt(createdAt)
            .startedAt(startedAt)
            .completedAt(completedAt)
            .waitTime(waitTime)
            .processingTime(processingTime)
            .workerId(workerId)
            .result(result != null ? result.copy() : null)
            .error(error)
            .memoryUsageMb(memoryUsageMb)
            .cpuUsagePercent(cpuUsagePercent)
            .cacheHits(cacheHits)
            .cacheMisses(cacheMisses)
            .metadata(metadata)
            .build();
    }

    private void finish(Instant now) {
        this.completedAt = now;
        if (startedAt != null) {
            this.processingTime = seconds(startedAt, now);
        }
    }

    private void transitionTo(RequestStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException(
                "Illegal transition for request " + requestId + ": " + status + " -> " + next);
        }
        this.status = next;
    }

    private static double seconds(Instant from, Instant to) {
        return Duration.between(from, to).toNanos() / 1_000_000_000.0;
    }
}
