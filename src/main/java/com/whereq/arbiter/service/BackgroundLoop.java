package com.whereq.arbiter.service;

import lombok.extern.slf4j.Slf4j;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;

/**
 * Fixed-rate loop on its own daemon thread. The body must not throw.
 */
@Slf4j
class BackgroundLoop {

    private final String name;
    private final Duration period;
    private final Runnable body;

    private Scheduler scheduler;
    private Disposable subscription;

    BackgroundLoop(String name, Duration period, Runnable body) {
        this.name = name;
        this.period = period;
        this.body = body;
    }

    synchronized void start() {
        if (subscription != null) {
            return;
        }
        scheduler = Schedulers.newSingle(name, true);
        subscription = Flux.interval(period, scheduler)
            .subscribe(
                tick -> body.run(),
                error -> log.error("Loop {} terminated unexpectedly", name, error));
        log.debug("Started loop {} with period {}", name, period);
    }

    /**
     * Stop ticking and wait for a running tick to finish
     *
     * @return true if the loop stopped within the timeout
     */
    synchronized boolean stop(Duration timeout) {
        if (subscription == null) {
            return true;
        }
        subscription.dispose();
        try {
            scheduler.disposeGracefully().timeout(timeout).block();
            log.debug("Stopped loop {}", name);
            return true;
        } catch (RuntimeException e) {
            log.warn("Loop {} did not stop within {}, forcing", name, timeout);
            scheduler.dispose();
            return false;
        } finally {
            subscription = null;
            scheduler = null;
        }
    }
}
