package com.pipeline.adg.api;

import com.pipeline.adg.asset.MaterializationEvent;
import com.pipeline.adg.engine.InvocationResult;
import com.pipeline.adg.engine.RunResult;
import com.pipeline.adg.plan.ExecutionPlan;

/**
 * Observer of run progress (UI, telemetry, sensors).
 *
 * Listeners registered with the engine are called from a dispatcher thread, never
 * from a worker, so a slow listener cannot hold up execution. Events may be
 * dropped if a listener falls far behind.
 */
public interface RunListener {

    default void onRunStart(String runId, ExecutionPlan plan) {
    }

    default void onMaterialization(MaterializationEvent event) {
    }

    default void onInvocationFinished(String runId, InvocationResult result) {
    }

    default void onRunEnd(RunResult result) {
    }
}
