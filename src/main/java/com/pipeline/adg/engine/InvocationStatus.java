package com.pipeline.adg.engine;

/**
 * Lifecycle of one step invocation within a run.
 *
 * PENDING -> RUNNING -> {SUCCEEDED, FAILED}, with RUNNING re-entered on each
 * retry. SKIPPED is reached from PENDING when every requested output lost a
 * loaded input; FAILED is also reached from PENDING when an upstream failed.
 * CANCELLED is reached when the run is cancelled before the invocation ran.
 */
public enum InvocationStatus {
    PENDING,
    RUNNING,
    SUCCEEDED,
    FAILED,
    SKIPPED,
    CANCELLED;

    public boolean isTerminal() {
        return this != PENDING && this != RUNNING;
    }
}
