package com.whereq.arbiter.queue;

import com.whereq.arbiter.model.AnalysisRequest;
import com.whereq.arbiter.model.RequestPriority;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.PriorityQueue;

/**
 * One holding lane per priority tier, each ordered by arrival.
 *
 * Not thread-safe; callers hold the queue lock.
 */
public class PriorityLanes {

    private static final Comparator<AnalysisRequest> ARRIVAL_ORDER = Comparator
        .comparing(AnalysisRequest::getCreatedAt)
        .thenComparingLong(AnalysisRequest::getSequence);

    private final Map<RequestPriority, PriorityQueue<AnalysisRequest>> lanes = new EnumMap<>(RequestPriority.class);

    public PriorityLanes() {
        for (RequestPriority priority : RequestPriority.values()) {
            lanes.put(priority, new PriorityQueue<>(ARRIVAL_ORDER));
        }
    }

    /**
     * Add a request to the lane of its current priority
     */
    public void offer(AnalysisRequest request) {
        lanes.get(request.getPriority()).offer(request);
    }

    /**
     * Put back a request taken with {@link #poll}. Arrival order puts it back at the head.
     */
    public void requeue(AnalysisRequest request) {
        offer(request);
    }

    /**
     * Take the earliest arrival of a single tier
     */
    public AnalysisRequest poll(RequestPriority priority) {
        return lanes.get(priority).poll();
    }

    /**
     * Scan every lane for a request
     */
    public Optional<AnalysisRequest> find(String requestId) {
        for (PriorityQueue<AnalysisRequest> lane : lanes.values()) {
            for (AnalysisRequest request : lane) {
                if (request.getRequestId().equals(requestId)) {
                    return Optional.of(request);
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Remove a request from whichever lane holds it
     */
    public Optional<AnalysisRequest> remove(String requestId) {
        for (PriorityQueue<AnalysisRequest> lane : lanes.values()) {
            Iterator<AnalysisRequest> it = lane.iterator();
            while (it.hasNext()) {
                AnalysisRequest request = it.next();
                if (request.getRequestId().equals(requestId)) {
                    it.remove();
                    return Optional.of(request);
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Empty every lane, highest tier first
     */
    public List<AnalysisRequest> drainAll() {
        List<AnalysisRequest> drained = new ArrayList<>();
        for (RequestPriority priority : highestFirst()) {
            PriorityQueue<AnalysisRequest> lane = lanes.get(priority);
            AnalysisRequest request;
            while ((request = lane.poll()) != null) {
                drained.add(request);
            }
        }
        return drained;
    }

    public int size() {
        int total = 0;
        for (PriorityQueue<AnalysisRequest> lane : lanes.values()) {
            total += lane.size();
        }
        return total;
    }

    /**
     * Lane sizes by tier
     */
    public Map<RequestPriority, Integer> breakdown() {
        Map<RequestPriority, Integer> breakdown = new EnumMap<>(RequestPriority.class);
        lanes.forEach((priority, lane) -> breakdown.put(priority, lane.size()));
        return breakdown;
    }

    /**
     * Tiers in dispatch order: URGENT, HIGH, NORMAL, LOW
     */
    public static List<RequestPriority> highestFirst() {
        List<RequestPriority> order = new ArrayList<>(List.of(RequestPriority.values()));
        order.sort(Comparator.comparingInt(RequestPriority::getLevel).reversed());
        return order;
    }
}
