package com.whereq.arbiter.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Request lifecycle states
 *
 * State transitions:
 * QUEUED → PROCESSING → {COMPLETED, FAILED, CANCELLED}
 * QUEUED → {CANCELLED, TIMEOUT}
 */
public enum RequestStatus {
    /**
     * Waiting in a priority lane
     */
    QUEUED,

    /**
     * Admitted and handed to a worker
     */
    PROCESSING,

    /**
     * Executor returned a result
     */
    COMPLETED,

    /**
     * Executor raised an error, or completion handling failed
     */
    FAILED,

    /**
     * Cancelled while queued, while processing, or by shutdown
     */
    CANCELLED,

    /**
     * Waited in its lane longer than the queue timeout
     */
    TIMEOUT;

    /**
     * Check if this is a terminal state
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED || this == TIMEOUT;
    }

    /**
     * Check if moving from this state to {@code next} is a legal lifecycle step
     */
    public boolean canTransitionTo(RequestStatus next) {
        return allowedTransitions().contains(next);
    }

    private Set<RequestStatus> allowedTransitions() {
        return switch (this) {
            case QUEUED -> EnumSet.of(PROCESSING, CANCELLED, TIMEOUT);
            case PROCESSING -> EnumSet.of(COMPLETED, FAILED, CANCELLED);
            case COMPLETED, FAILED, CANCELLED, TIMEOUT -> EnumSet.noneOf(RequestStatus.class);
        };
    }
}
