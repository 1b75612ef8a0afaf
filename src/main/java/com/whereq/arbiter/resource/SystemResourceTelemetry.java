package com.whereq.arbiter.resource;

import com.sun.management.OperatingSystemMXBean;
import com.whereq.arbiter.exception.TelemetryException;

import java.lang.management.ManagementFactory;

/**
 * Host CPU and memory usage as reported by the JVM's operating system bean
 */
public class SystemResourceTelemetry implements ResourceTelemetry {

    private final java.lang.management.OperatingSystemMXBean os;

    public SystemResourceTelemetry() {
        this(ManagementFactory.getOperatingSystemMXBean());
    }

    SystemResourceTelemetry(java.lang.management.OperatingSystemMXBean os) {
        this.os = os;
    }

    @Override
    public double cpuPercent() {
        double load = extended().getCpuLoad();
        if (load < 0) {
            throw new TelemetryException("CPU load not available yet");
        }
        return load * 100.0;
    }

    @Override
    public double memoryPercent() {
        OperatingSystemMXBean bean = extended();
        long total = bean.getTotalMemorySize();
        if (total <= 0) {
            throw new TelemetryException("Total memory size not available");
        }
        long used = total - bean.getFreeMemorySize();
        return (used * 100.0) / total;
    }

    private OperatingSystemMXBean extended() {
        if (os instanceof OperatingSystemMXBean bean) {
            return bean;
        }
        throw new TelemetryException("Operating system bean does not expose resource usage: "
            + os.getClass().getName());
    }
}
