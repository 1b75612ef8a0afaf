package com.whereq.arbiter.model;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Output of a single analysis execution
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AnalysisResult {
    /**
     * Structured analysis output (connections, patterns, recommendations...)
     */
    private JsonNode data;

    /**
     * Cache hits reported by the executor
     */
    private long cacheHits;

    /**
     * Cache misses reported by the executor
     */
    private long cacheMisses;

    /**
     * Memory used by the execution in MB
     */
    private double memoryUsageMb;

    /**
     * CPU used by the execution in percent
     */
    private double cpuUsagePercent;

    /**
     * Size of the analysed data in MB
     */
    private double dataSizeMb;

    /**
     * Number of chunks the data was split into
     */
    private int chunkCount;

    /**
     * Time spent waiting on the model, in seconds
     */
    private Double aiResponseTime;

    /**
     * Independent copy, including the JSON tree
     */
    public AnalysisResult copy() {
        return toBuilder()
            .data(data != null ? data.deepCopy() : null)
            .build();
    }
}
