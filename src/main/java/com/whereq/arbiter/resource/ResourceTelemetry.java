package com.whereq.arbiter.resource;

import com.whereq.arbiter.exception.TelemetryException;

/**
 * Read-only probe of host-wide resource usage
 */
public interface ResourceTelemetry {

    /**
     * @return current CPU usage, 0-100
     * @throws TelemetryException if the reading is unavailable
     */
    double cpuPercent();

    /**
     * @return current memory usage, 0-100
     * @throws TelemetryException if the reading is unavailable
     */
    double memoryPercent();
}
