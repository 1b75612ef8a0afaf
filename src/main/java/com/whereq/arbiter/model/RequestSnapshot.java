package com.whereq.arbiter.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Point-in-time view of a request, safe to hand outside the queue lock
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RequestSnapshot {
    String requestId;
    String userId;
    String payload;
    RequestPriority priority;
    RequestStatus status;
    Instant createdAt;
    Instant startedAt;
    Instant completedAt;
    Double waitTime;
    Double processingTime;
    String workerId;
    AnalysisResult result;
    String error;
    double memoryUsageMb;
    double cpuUsagePercent;
    long cacheHits;
    long cacheMisses;
    Map<String, Object> metadata;
}
