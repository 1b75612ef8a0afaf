package com.whereq.arbiter.resource;

import com.whereq.arbiter.model.QueueConfiguration;
import lombok.extern.slf4j.Slf4j;

/**
 * Admission predicate based on host CPU and memory usage.
 *
 * Probe failures admit the request: liveness wins over strict enforcement.
 */
@Slf4j
public class ResourceGovernor {

    private final ResourceTelemetry telemetry;
    private final boolean adaptiveScaling;
    private final double maxCpuPercent;
    private final double maxMemoryPercent;

    public ResourceGovernor(ResourceTelemetry telemetry, QueueConfiguration config) {
        this.telemetry = telemetry;
        this.adaptiveScaling = config.isAdaptiveScaling();
        this.maxCpuPercent = config.getMaxCpuPercent();
        this.maxMemoryPercent = config.getMaxMemoryPercent();

        log.info("ResourceGovernor initialized: adaptive scaling={}, CPU ceiling={}%, memory ceiling={}%",
            adaptiveScaling, maxCpuPercent, maxMemoryPercent);
    }

    /**
     * Check if system resources allow another worker to start
     *
     * @return true if the next request may be dispatched
     */
    public boolean admit() {
        if (!adaptiveScaling) {
            return true;
        }

        try {
            double memoryPercent = telemetry.memoryPercent();
            if (memoryPercent > maxMemoryPercent) {
                log.warn("Memory usage too high: {}% (ceiling {}%)", format(memoryPercent), format(maxMemoryPercent));
                return false;
            }

            double cpuPercent = telemetry.cpuPercent();
            if (cpuPercent > maxCpuPercent) {
                log.warn("CPU usage too high: {}% (ceiling {}%)", format(cpuPercent), format(maxCpuPercent));
                return false;
            }

            return true;
        } catch (RuntimeException e) {
            log.error("Error checking resource constraints, admitting request: {}", e.getMessage());
            return true;
        }
    }

    /**
     * Current resource usage summary, for logging
     */
    public String getResourceSummary() {
        try {
            return String.format("CPU: %.1f%% (ceiling %.1f%%), Memory: %.1f%% (ceiling %.1f%%)",
                telemetry.cpuPercent(), maxCpuPercent, telemetry.memoryPercent(), maxMemoryPercent);
        } catch (RuntimeException e) {
            return "resource usage unavailable (" + e.getMessage() + ")";
        }
    }

    private static String format(double percent) {
        return String.format("%.1f", percent);
    }
}
