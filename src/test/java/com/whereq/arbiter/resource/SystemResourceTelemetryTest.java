package com.whereq.arbiter.resource;

import com.sun.management.OperatingSystemMXBean;
import com.whereq.arbiter.exception.TelemetryException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class SystemResourceTelemetryTest {

    @Test
    void convertsLoadToPercent() {
        OperatingSystemMXBean os = mock(OperatingSystemMXBean.class);
        when(os.getCpuLoad()).thenReturn(0.42);

        assertThat(new SystemResourceTelemetry(os).cpuPercent()).isCloseTo(42.0, within(1e-9));
    }

    @Test
    void memoryPercentIsUsedOverTotal() {
        OperatingSystemMXBean os = mock(OperatingSystemMXBean.class);
        when(os.getTotalMemorySize()).thenReturn(1000L);
        when(os.getFreeMemorySize()).thenReturn(250L);

        assertThat(new SystemResourceTelemetry(os).memoryPercent()).isCloseTo(75.0, within(1e-9));
    }

    @Test
    void negativeLoadIsReportedAsUnavailable() {
        OperatingSystemMXBean os = mock(OperatingSystemMXBean.class);
        when(os.getCpuLoad()).thenReturn(-1.0);

        assertThatThrownBy(() -> new SystemResourceTelemetry(os).cpuPercent())
            .isInstanceOf(TelemetryException.class);
    }

    @Test
    void plainBeanCannotReportUsage() {
        java.lang.management.OperatingSystemMXBean os = mock(java.lang.management.OperatingSystemMXBean.class);

        assertThatThrownBy(() -> new SystemResourceTelemetry(os).memoryPercent())
            .isInstanceOf(TelemetryException.class)
            .hasMessageContaining("does not expose resource usage");
    }

    @Test
    void readsTheRunningJvm() {
        double memory = new SystemResourceTelemetry().memoryPercent();

        assertThat(memory).isBetween(0.0, 100.0);
    }
}
