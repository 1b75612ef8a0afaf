package com.whereq.arbiter.model;

/**
 * Priority tiers for analysis requests, ordered from lowest to highest.
 */
public enum RequestPriority {
    LOW(1),
    NORMAL(2),
    HIGH(3),
    URGENT(4);

    private final int level;

    RequestPriority(int level) {
        this.level = level;
    }

    public int getLevel() {
        return level;
    }

    /**
     * Next tier up, saturating at {@link #URGENT}
     */
    public RequestPriority boost() {
        return switch (this) {
            case LOW -> NORMAL;
            case NORMAL -> HIGH;
            case HIGH, URGENT -> URGENT;
        };
    }

    /**
     * Check if this tier is already the highest one
     */
    public boolean isHighest() {
        return this == URGENT;
    }
}
