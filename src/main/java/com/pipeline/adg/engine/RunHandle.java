package com.pipeline.adg.engine;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Handle on a submitted run.
 *
 * {@link #cancel()} stops scheduling: invocations that have not started end as
 * {@link InvocationStatus#CANCELLED}, in-flight computations finish or observe
 * {@link com.pipeline.adg.api.StepContext#isCancelled()}. The future always
 * completes with a {@link RunResult}, also after cancellation.
 */
public final class RunHandle {
    private final String runId;
    private final RunExecution execution;

    RunHandle(String runId, RunExecution execution) {
        this.runId = runId;
        this.execution = execution;
    }

    public String runId() {
        return runId;
    }

    public CompletableFuture<RunResult> future() {
        return execution.future();
    }

    public void cancel() {
        execution.cancel();
    }

    public boolean isCancelled() {
        return execution.isCancelled();
    }

    public boolean isDone() {
        return execution.future().isDone();
    }

    /** Blocks until the run terminates. */
    public RunResult await() {
        try {
            return execution.future().get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while waiting for run " + runId);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Run " + runId + " terminated abnormally", e.getCause());
        }
    }

    public RunResult await(long timeout, TimeUnit unit) throws TimeoutException {
        try {
            return execution.future().get(timeout, unit);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while waiting for run " + runId);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Run " + runId + " terminated abnormally", e.getCause());
        }
    }
}
