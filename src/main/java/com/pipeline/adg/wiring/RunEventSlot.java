package com.pipeline.adg.wiring;

import com.pipeline.adg.asset.MaterializationEvent;
import com.pipeline.adg.engine.InvocationResult;
import com.pipeline.adg.engine.RunResult;
import com.pipeline.adg.plan.ExecutionPlan;

/**
 * A mutable holder for one run event inside the dispatcher's ring buffer.
 *
 * Pattern: Flyweight / Mutable Event
 *
 * Slots are allocated once when the ring buffer is built and reused for every
 * event. Only the fields relevant to {@link #type()} are set; {@link #clear()}
 * drops the references once the event was dispatched so finished runs can be
 * collected.
 */
public final class RunEventSlot {

    public enum Type {
        RUN_START, MATERIALIZATION, INVOCATION_FINISHED, RUN_END
    }

    private Type type;
    private String runId;
    private ExecutionPlan plan;
    private MaterializationEvent event;
    private InvocationResult invocation;
    private RunResult runResult;

    void setRunStart(String runId, ExecutionPlan plan) {
        this.type = Type.RUN_START;
        this.runId = runId;
        this.plan = plan;
    }

    void setMaterialization(MaterializationEvent event) {
        this.type = Type.MATERIALIZATION;
        this.runId = event.runId();
        this.event = event;
    }

    void setInvocationFinished(String runId, InvocationResult invocation) {
        this.type = Type.INVOCATION_FINISHED;
        this.runId = runId;
        this.invocation = invocation;
    }

    void setRunEnd(RunResult result) {
        this.type = Type.RUN_END;
        this.runId = result.runId();
        this.runResult = result;
    }

    public Type type() {
        return type;
    }

    public String runId() {
        return runId;
    }

    public ExecutionPlan plan() {
        return plan;
    }

    public MaterializationEvent event() {
        return event;
    }

    public InvocationResult invocation() {
        return invocation;
    }

    public RunResult runResult() {
        return runResult;
    }

    public void clear() {
        type = null;
        runId = null;
        plan = null;
        event = null;
        invocation = null;
        runResult = null;
    }
}
