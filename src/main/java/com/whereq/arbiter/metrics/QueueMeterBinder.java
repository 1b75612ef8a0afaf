package com.whereq.arbiter.metrics;

import com.whereq.arbiter.resource.ResourceTelemetry;
import com.whereq.arbiter.service.AnalysisQueue;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import lombok.extern.slf4j.Slf4j;

import java.util.function.DoubleSupplier;

/**
 * Queue depth, worker usage and host resource gauges
 */
@Slf4j
public class QueueMeterBinder implements MeterBinder {

    private final AnalysisQueue queue;
    private final ResourceTelemetry telemetry;

    public QueueMeterBinder(AnalysisQueue queue, ResourceTelemetry telemetry) {
        this.queue = queue;
        this.telemetry = telemetry;
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        int workers = queue.getConfiguration().getMaxConcurrentWorkers();

        Gauge.builder("arbiter.queue.size", queue, AnalysisQueue::getQueueSize)
            .description("Requests waiting in all priority lanes")
            .register(registry);

        Gauge.builder("arbiter.queue.active", queue, AnalysisQueue::getActiveCount)
            .description("Requests currently processing")
            .register(registry);

        Gauge.builder("arbiter.queue.capacity", () -> queue.getConfiguration().getMaxQueueSize())
            .description("Maximum queued plus active requests")
            .register(registry);

        Gauge.builder("arbiter.queue.utilization", queue, q -> (double) q.getActiveCount() / workers)
            .description("Active requests divided by worker count")
            .register(registry);

        Gauge.builder("arbiter.resources.cpu.utilization", () -> read(telemetry::cpuPercent))
            .description("Host CPU utilization percentage")
            .register(registry);

        Gauge.builder("arbiter.resources.memory.utilization", () -> read(telemetry::memoryPercent))
            .description("Host memory utilization percentage")
            .register(registry);

        log.info("Registered analysis queue gauges for {} workers", workers);
    }

    private static double read(DoubleSupplier probe) {
        try {
            return probe.getAsDouble();
        } catch (RuntimeException e) {
            log.debug("Resource probe unavailable: {}", e.getMessage());
            return Double.NaN;
        }
    }
}
