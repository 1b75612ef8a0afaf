package com.whereq.arbiter.service;

import com.whereq.arbiter.executor.WorkerPool;
import com.whereq.arbiter.executor.WorkerTask;
import com.whereq.arbiter.model.AnalysisRequest;
import com.whereq.arbiter.model.AnalysisResult;
import com.whereq.arbiter.model.QueueConfiguration;
import com.whereq.arbiter.model.RequestStatus;
import com.whereq.arbiter.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class CompletionHandlerTest {

    private MutableClock clock;
    private QueueState state;
    private WorkerPool workerPool;
    private CompletionHandler handler;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-03-01T08:00:00Z");
        state = new QueueState(QueueConfiguration.defaults(), clock);
        workerPool = new WorkerPool(1);
        handler = new CompletionHandler(state, workerPool);
    }

    @AfterEach
    void tearDown() {
        workerPool.shutdownNow();
    }

    private AnalysisRequest activeRequest(String id, boolean started) {
        AnalysisRequest request = AnalysisRequest.builder()
            .requestId(id)
            .createdAt(clock.instant())
            .build();
        if (started) {
            request.startProcessing("worker-1", clock.instant());
        }
        state.getRegistry().activate(request);
        return request;
    }

    private WorkerTask finishedTask(String id, boolean succeed) throws InterruptedException {
        workerPool.submit(id, () -> {
            if (!succeed) {
                throw new IllegalArgumentException("bad\n  input");
            }
            return AnalysisResult.builder().cacheHits(1).build();
        });
        return workerPool.pollCompleted(Duration.ofSeconds(5));
    }

    @Test
    void successfulTaskCompletesRequest() throws Exception {
        AnalysisRequest request = activeRequest("r1", true);

        handler.handle(finishedTask("r1", true));

        assertThat(request.getStatus()).isEqualTo(RequestStatus.COMPLETED);
        assertThat(request.getCacheHits()).isEqualTo(1);
        assertThat(state.getRegistry().getActive("r1")).isNull();
        assertThat(state.getRegistry().getCompleted("r1")).isSameAs(request);
        assertThat(state.getCounters().getCompletedRequests()).isEqualTo(1);
    }

    @Test
    void failedTaskRecordsSanitizedCause() throws Exception {
        AnalysisRequest request = activeRequest("r1", true);

        handler.handle(finishedTask("r1", false));

        assertThat(request.getStatus()).isEqualTo(RequestStatus.FAILED);
        assertThat(request.getError()).isEqualTo("IllegalArgumentException: bad input");
        assertThat(state.getCounters().getFailedRequests()).isEqualTo(1);
    }

    @Test
    void unhandledCompletionStillFinishesRequest() throws Exception {
        // never marked as processing, so the normal transition is illegal
        AnalysisRequest request = activeRequest("r1", false);

        handler.handle(finishedTask("r1", true));

        assertThat(request.getStatus()).isEqualTo(RequestStatus.FAILED);
        assertThat(request.getError()).startsWith("Completion handling failed: IllegalStateException");
        assertThat(state.getRegistry().activeCount()).isZero();
        assertThat(state.getRegistry().getCompleted("r1")).isSameAs(request);
    }

    @Test
    void completionOfInactiveRequestIsIgnored() throws Exception {
        handler.handle(finishedTask("gone", true));

        assertThat(state.getRegistry().getCompleted("gone")).isNull();
        assertThat(state.getCounters().getCompletedRequests()).isZero();
    }

    @Test
    void sanitizeCollapsesWhitespaceAndBoundsLength() {
        assertThat(CompletionHandler.sanitize(new IllegalStateException("line one\n\tline two")))
            .isEqualTo("IllegalStateException: line one line two");
        assertThat(CompletionHandler.sanitize(new NullPointerException()))
            .isEqualTo("NullPointerException");
        assertThat(CompletionHandler.sanitize(new RuntimeException("x".repeat(2000))))
            .hasSize(500)
            .endsWith("...");
    }
}
