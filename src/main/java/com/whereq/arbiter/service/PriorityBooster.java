package com.whereq.arbiter.service;

import com.whereq.arbiter.model.AnalysisRequest;
import com.whereq.arbiter.model.QueueConfiguration;

import java.time.Duration;
import java.time.Instant;

/**
 * Decides when a waiting request is promoted to the next tier
 */
public class PriorityBooster {

    private final boolean enabled;
    private final Duration threshold;

    public PriorityBooster(QueueConfiguration config) {
        this.enabled = config.isPriorityBoosting();
        this.threshold = config.getPriorityBoostThreshold();
    }

    /**
     * Check if a request has waited past the boost threshold and can still move up
     */
    public boolean shouldBoost(AnalysisRequest request, Instant now) {
        return enabled
            && !request.getPriority().isHighest()
            && request.age(now).compareTo(threshold) > 0;
    }
}
