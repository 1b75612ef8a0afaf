package com.whereq.arbiter.metrics;

import com.whereq.arbiter.exception.TelemetryException;
import com.whereq.arbiter.model.QueueConfiguration;
import com.whereq.arbiter.resource.ResourceGovernor;
import com.whereq.arbiter.resource.ResourceTelemetry;
import com.whereq.arbiter.service.AnalysisQueue;
import com.whereq.arbiter.support.ScriptedAnalysisExecutor;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class QueueMeterBinderTest {

    private ResourceTelemetry telemetry;
    private AnalysisQueue queue;
    private SimpleMeterRegistry registry;

    @BeforeEach
    void setUp() {
        telemetry = mock(ResourceTelemetry.class);
        QueueConfiguration config = QueueConfiguration.defaults().toBuilder()
            .maxQueueSize(10)
            .maxConcurrentWorkers(2)
            .adaptiveScaling(false)
            .dispatchInterval(Duration.ofHours(1))
            .build();
        queue = new AnalysisQueue(config, new ScriptedAnalysisExecutor(), new ResourceGovernor(telemetry, config));
        registry = new SimpleMeterRegistry();
        new QueueMeterBinder(queue, telemetry).bindTo(registry);
    }

    @AfterEach
    void tearDown() {
        queue.shutdown(Duration.ofSeconds(5));
    }

    @Test
    void queueGaugesFollowSubmissions() {
        queue.submit("/tmp/a.json");
        queue.submit("/tmp/b.json");

        assertThat(registry.get("arbiter.queue.size").gauge().value()).isEqualTo(2.0);
        assertThat(registry.get("arbiter.queue.active").gauge().value()).isZero();
        assertThat(registry.get("arbiter.queue.capacity").gauge().value()).isEqualTo(10.0);
        assertThat(registry.get("arbiter.queue.utilization").gauge().value()).isZero();
    }

    @Test
    void resourceGaugesReportNaNWhenProbeFails() {
        when(telemetry.cpuPercent()).thenReturn(12.5);
        when(telemetry.memoryPercent()).thenThrow(new TelemetryException("unavailable"));

        assertThat(registry.get("arbiter.resources.cpu.utilization").gauge().value()).isEqualTo(12.5);
        assertThat(registry.get("arbiter.resources.memory.utilization").gauge().value()).isNaN();
    }
}
