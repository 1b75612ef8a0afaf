package com.whereq.arbiter.executor;

import com.whereq.arbiter.model.AnalysisResult;

import java.util.concurrent.Callable;
import java.util.concurrent.FutureTask;
import java.util.function.Consumer;

/**
 * Execution unit for one request.
 *
 * Hands itself back to the pool once its worker thread has left {@link #run()},
 * so a job cancelled while running keeps its worker slot until it really stops.
 */
public class WorkerTask extends FutureTask<AnalysisResult> {

    private final String requestId;
    private final Consumer<WorkerTask> onExit;

    WorkerTask(String requestId, Callable<AnalysisResult> work, Consumer<WorkerTask> onExit) {
        super(work);
        this.requestId = requestId;
        this.onExit = onExit;
    }

    public String getRequestId() {
        return requestId;
    }

    @Override
    public void run() {
        try {
            super.run();
        } finally {
            onExit.accept(this);
        }
    }
}
