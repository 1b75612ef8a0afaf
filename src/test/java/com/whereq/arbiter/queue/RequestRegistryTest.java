package com.whereq.arbiter.queue;

import com.whereq.arbiter.model.AnalysisRequest;
import com.whereq.arbiter.model.RequestPriority;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class RequestRegistryTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    private AnalysisRequest finished(String id, Instant completedAt) {
        AnalysisRequest request = AnalysisRequest.builder()
            .requestId(id)
            .priority(RequestPriority.NORMAL)
            .createdAt(T0)
            .build();
        request.cancel(completedAt);
        return request;
    }

    @Test
    void activeRequestsMoveToCompleted() {
        RequestRegistry registry = new RequestRegistry();
        AnalysisRequest request = AnalysisRequest.builder()
            .requestId("r1")
            .createdAt(T0)
            .build();
        request.startProcessing("worker-1", T0.plusSeconds(1));

        registry.activate(request);
        assertThat(registry.getActive("r1")).isSameAs(request);
        assertThat(registry.activeCount()).isEqualTo(1);

        assertThat(registry.deactivate("r1")).isSameAs(request);
        assertThat(registry.deactivate("r1")).isNull();

        request.cancel(T0.plusSeconds(2));
        registry.complete(request);
        assertThat(registry.getCompleted("r1")).isSameAs(request);
        assertThat(registry.historySize()).isEqualTo(1);
    }

    @Test
    void evictsOnlyEntriesOlderThanCutoff() {
        RequestRegistry registry = new RequestRegistry();
        registry.complete(finished("old", T0));
        registry.complete(finished("recent", T0.plus(Duration.ofHours(20))));

        int evicted = registry.evictCompletedBefore(T0.plus(Duration.ofHours(1)));

        assertThat(evicted).isEqualTo(1);
        assertThat(registry.getCompleted("old")).isNull();
        assertThat(registry.getCompleted("recent")).isNotNull();
        assertThat(registry.completedCount()).isEqualTo(1);
        // history is capped separately from eviction
        assertThat(registry.historySize()).isEqualTo(2);
    }

    @Test
    void trimHistoryKeepsMostRecentEntries() {
        RequestRegistry registry = new RequestRegistry();
        for (int i = 0; i < 5; i++) {
            registry.complete(finished("r" + i, T0.plusSeconds(i)));
        }

        assertThat(registry.trimHistory(3)).isEqualTo(2);

        assertThat(registry.history()).extracting(AnalysisRequest::getRequestId)
            .containsExactly("r2", "r3", "r4");
        assertThat(registry.recentHistory(2)).extracting(AnalysisRequest::getRequestId)
            .containsExactly("r3", "r4");
        assertThat(registry.recentHistory(10)).hasSize(3);
    }
}
