package com.whereq.arbiter;

import com.whereq.arbiter.model.RequestSnapshot;
import com.whereq.arbiter.model.RequestStatus;
import com.whereq.arbiter.service.AnalysisQueue;
import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

@SpringBootTest(properties = {
    "arbiter.resources.adaptive-scaling=false",
    "arbiter.queue.dispatch-interval=100ms"
})
class ArbiterApplicationTests {

    @Autowired
    private AnalysisQueue queue;

    @Autowired
    private MeterRegistry meterRegistry;

    @Test
    void contextStartsRunningQueue() {
        assertThat(queue.isShutdown()).isFalse();
        assertThat(queue.getConfiguration().getMaxConcurrentWorkers()).isEqualTo(3);
        assertThat(meterRegistry.find("arbiter.queue.size").gauge()).isNotNull();
        assertThat(meterRegistry.find("arbiter.resources.cpu.utilization").gauge()).isNotNull();
    }

    @Test
    void requestFailsWithoutAnExecutor() {
        String id = queue.submit("/data/memory.json");

        await().atMost(Duration.ofSeconds(10)).until(() -> queue.getStatus(id)
            .map(RequestSnapshot::getStatus)
            .filter(RequestStatus::isTerminal)
            .isPresent());

        RequestSnapshot snapshot = queue.getStatus(id).orElseThrow();
        assertThat(snapshot.getStatus()).isEqualTo(RequestStatus.FAILED);
        assertThat(snapshot.getError()).isEqualTo("IllegalStateException: Analysis executor not available");
        assertThat(meterRegistry.get("arbiter.analysis.failed").counter().count()).isGreaterThanOrEqualTo(1.0);
    }
}
