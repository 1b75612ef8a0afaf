package com.whereq.arbiter.executor;

import com.whereq.arbiter.model.AnalysisJob;
import com.whereq.arbiter.model.AnalysisResult;

/**
 * Fallback used when the application does not provide an executor; fails every job
 */
public class DisabledAnalysisExecutor implements AnalysisExecutor {

    @Override
    public AnalysisResult execute(AnalysisJob job) {
        throw new IllegalStateException("Analysis executor not available");
    }
}
