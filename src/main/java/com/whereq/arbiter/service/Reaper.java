package com.whereq.arbiter.service;

import com.whereq.arbiter.model.QueueConfiguration;
import com.whereq.arbiter.queue.RequestRegistry;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;

/**
 * Periodically evicts stale completed requests and caps the history
 */
@Slf4j
class Reaper {

    private final QueueState state;
    private final BackgroundLoop loop;

    Reaper(QueueState state) {
        this.state = state;
        this.loop = new BackgroundLoop("arbiter-cleanup", state.getConfig().getCleanupInterval(), this::sweep);
    }

    void start() {
        loop.start();
    }

    boolean stop(Duration timeout) {
        return loop.stop(timeout);
    }

    /**
     * One cleanup pass
     */
    void sweep() {
        try {
            QueueConfiguration config = state.getConfig();
            Instant cutoff = state.now().minus(config.getCompletedRetention());

            state.getLock().lock();
            try {
                RequestRegistry registry = state.getRegistry();
                int evicted = registry.evictCompletedBefore(cutoff);
                int trimmed = registry.trimHistory(config.getHistoryLimit());

                if (evicted > 0) {
                    log.info("Cleaned up {} old completed requests", evicted);
                }
                if (trimmed > 0) {
                    log.debug("Trimmed {} entries from request history", trimmed);
                }
            } finally {
                state.getLock().unlock();
            }
        } catch (RuntimeException e) {
            log.error("Error in cleanup loop: {}", e.getMessage(), e);
        }
    }
}
