package com.whereq.arbiter.executor;

import com.whereq.arbiter.model.AnalysisJob;
import com.whereq.arbiter.model.AnalysisResult;

/**
 * Performs the actual analysis for a dispatched request
 */
public interface AnalysisExecutor {
    /**
     * Execute a job synchronously (blocking)
     *
     * Implementations that can stop early should honour thread interruption;
     * otherwise a cancelled job runs to natural completion.
     *
     * @param job the dispatched job
     * @return analysis result
     * @throws Exception if the analysis fails
     */
    AnalysisResult execute(AnalysisJob job) throws Exception;
}
