package com.whereq.arbiter.model;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QueueConfigurationTest {

    @Test
    void defaultsMatchDocumentedValues() {
        QueueConfiguration config = QueueConfiguration.defaults().validate();

        assertThat(config.getMaxQueueSize()).isEqualTo(100);
        assertThat(config.getMaxConcurrentWorkers()).isEqualTo(3);
        assertThat(config.getWorkerTimeout()).isEqualTo(Duration.ofSeconds(300));
        assertThat(config.getQueueTimeout()).isEqualTo(Duration.ofSeconds(600));
        assertThat(config.getPriorityBoostThreshold()).isEqualTo(Duration.ofSeconds(60));
        assertThat(config.getCleanupInterval()).isEqualTo(Duration.ofSeconds(300));
        assertThat(config.getCompletedRetention()).isEqualTo(Duration.ofHours(24));
        assertThat(config.getHistoryLimit()).isEqualTo(1000);
        assertThat(config.getMaxCpuPercent()).isEqualTo(80.0);
        assertThat(config.getMaxMemoryPercent()).isEqualTo(85.0);
        assertThat(config.isAdaptiveScaling()).isTrue();
        assertThat(config.isPriorityBoosting()).isTrue();
    }

    @Test
    void zeroQueueTimeoutIsAllowed() {
        QueueConfiguration config = QueueConfiguration.builder().queueTimeout(Duration.ZERO).build();

        assertThat(config.validate().getQueueTimeout()).isZero();
    }

    @Test
    void rejectsOutOfRangeValues() {
        assertThatThrownBy(() -> QueueConfiguration.builder().maxConcurrentWorkers(0).build().validate())
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("maxConcurrentWorkers");
        assertThatThrownBy(() -> QueueConfiguration.builder().maxCpuPercent(120).build().validate())
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> QueueConfiguration.builder().dispatchInterval(Duration.ZERO).build().validate())
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> QueueConfiguration.builder().queueTimeout(Duration.ofSeconds(-1)).build().validate())
            .isInstanceOf(IllegalArgumentException.class);
    }
}
