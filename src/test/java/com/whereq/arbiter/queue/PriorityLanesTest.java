package com.whereq.arbiter.queue;

import com.whereq.arbiter.model.AnalysisRequest;
import com.whereq.arbiter.model.RequestPriority;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PriorityLanesTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    private long sequence;

    private AnalysisRequest request(String id, RequestPriority priority, Instant createdAt) {
        return AnalysisRequest.builder()
            .requestId(id)
            .priority(priority)
            .createdAt(createdAt)
            .sequence(++sequence)
            .build();
    }

    @Test
    void lanesAreFifoWithinATier() {
        PriorityLanes lanes = new PriorityLanes();
        lanes.offer(request("a", RequestPriority.NORMAL, T0));
        lanes.offer(request("b", RequestPriority.NORMAL, T0.plusSeconds(1)));
        lanes.offer(request("c", RequestPriority.NORMAL, T0.plusSeconds(2)));

        assertThat(lanes.poll(RequestPriority.NORMAL).getRequestId()).isEqualTo("a");
        assertThat(lanes.poll(RequestPriority.NORMAL).getRequestId()).isEqualTo("b");
        assertThat(lanes.poll(RequestPriority.NORMAL).getRequestId()).isEqualTo("c");
        assertThat(lanes.poll(RequestPriority.NORMAL)).isNull();
    }

    @Test
    void sameInstantArrivalsKeepSubmissionOrder() {
        PriorityLanes lanes = new PriorityLanes();
        lanes.offer(request("first", RequestPriority.HIGH, T0));
        lanes.offer(request("second", RequestPriority.HIGH, T0));

        assertThat(lanes.poll(RequestPriority.HIGH).getRequestId()).isEqualTo("first");
    }

    @Test
    void requeuedRequestReturnsToTheHead() {
        PriorityLanes lanes = new PriorityLanes();
        lanes.offer(request("a", RequestPriority.LOW, T0));
        lanes.offer(request("b", RequestPriority.LOW, T0.plusSeconds(1)));

        AnalysisRequest head = lanes.poll(RequestPriority.LOW);
        lanes.requeue(head);

        assertThat(lanes.poll(RequestPriority.LOW).getRequestId()).isEqualTo("a");
    }

    @Test
    void dispatchOrderIsUrgentFirst() {
        assertThat(PriorityLanes.highestFirst()).containsExactly(
            RequestPriority.URGENT, RequestPriority.HIGH, RequestPriority.NORMAL, RequestPriority.LOW);
    }

    @Test
    void findAndRemoveScanEveryLane() {
        PriorityLanes lanes = new PriorityLanes();
        lanes.offer(request("low", RequestPriority.LOW, T0));
        lanes.offer(request("urgent", RequestPriority.URGENT, T0));

        assertThat(lanes.find("low")).isPresent();
        assertThat(lanes.size()).isEqualTo(2);

        assertThat(lanes.remove("low")).isPresent();
        assertThat(lanes.find("low")).isEmpty();
        assertThat(lanes.remove("missing")).isEmpty();
        assertThat(lanes.size()).isEqualTo(1);
    }

    @Test
    void breakdownSumsToTotalSize() {
        PriorityLanes lanes = new PriorityLanes();
        lanes.offer(request("a", RequestPriority.LOW, T0));
        lanes.offer(request("b", RequestPriority.LOW, T0));
        lanes.offer(request("c", RequestPriority.HIGH, T0));

        assertThat(lanes.breakdown())
            .containsEntry(RequestPriority.LOW, 2)
            .containsEntry(RequestPriority.NORMAL, 0)
            .containsEntry(RequestPriority.HIGH, 1)
            .containsEntry(RequestPriority.URGENT, 0);
        assertThat(lanes.breakdown().values().stream().mapToInt(Integer::intValue).sum()).isEqualTo(lanes.size());
    }

    @Test
    void drainAllEmptiesHighestTierFirst() {
        PriorityLanes lanes = new PriorityLanes();
        lanes.offer(request("low", RequestPriority.LOW, T0));
        lanes.offer(request("urgent", RequestPriority.URGENT, T0.plusSeconds(5)));

        List<AnalysisRequest> drained = lanes.drainAll();

        assertThat(drained).extracting(AnalysisRequest::getRequestId).containsExactly("urgent", "low");
        assertThat(lanes.size()).isZero();
    }
}
