package com.whereq.arbiter.exception;

/**
 * Exception thrown when a submission is rejected because the queue is at capacity
 */
public class QueueFullException extends ArbiterException {

    private final int capacity;

    public QueueFullException(int capacity) {
        super("Queue is at capacity (" + capacity + ")");
        this.capacity = capacity;
    }

    public int getCapacity() {
        return capacity;
    }
}
