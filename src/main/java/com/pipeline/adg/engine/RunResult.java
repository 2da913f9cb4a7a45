package com.pipeline.adg.engine;

import com.pipeline.adg.asset.AssetKey;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Complete outcome of a run: every planned invocation with its terminal state.
 *
 * Execution errors never escape the engine; they are enumerated here together
 * with the chain of dependents each failure short-circuited.
 */
public final class RunResult {

    public enum RunStatus {
        SUCCEEDED, FAILED, CANCELED
    }

    private final String runId;
    private final RunStatus status;
    private final Map<String, InvocationResult> invocations;
    private final Instant startedAt;
    private final Instant finishedAt;

    public RunResult(String runId, RunStatus status, Map<String, InvocationResult> invocations,
            Instant startedAt, Instant finishedAt) {
        this.runId = runId;
        this.status = status;
        this.invocations = Collections.unmodifiableMap(new LinkedHashMap<>(invocations));
        this.startedAt = startedAt;
        this.finishedAt = finishedAt;
    }

    public String runId() {
        return runId;
    }

    public RunStatus status() {
        return status;
    }

    public boolean isSuccess() {
        return status == RunStatus.SUCCEEDED;
    }

    /** Invocation results by step name, in plan order. */
    public Map<String, InvocationResult> invocations() {
        return invocations;
    }

    /** @return the step's result, or null if the step was not part of the plan. */
    public InvocationResult invocation(String stepName) {
        return invocations.get(stepName);
    }

    public InvocationStatus statusOf(String stepName) {
        InvocationResult r = invocations.get(stepName);
        return r == null ? null : r.status();
    }

    /** @return the outcome of a requested slot, or null if no invocation requested it. */
    public SlotOutcome outcome(AssetKey key) {
        for (InvocationResult r : invocations.values()) {
            SlotOutcome o = r.outcome(key);
            if (o != null)
                return o;
        }
        return null;
    }

    /** Every slot some invocation was asked to consider. */
    public Set<AssetKey> executedKeys() {
        Set<AssetKey> keys = new LinkedHashSet<>();
        for (InvocationResult r : invocations.values())
            keys.addAll(r.outcomes().keySet());
        return keys;
    }

    public Set<AssetKey> materializedKeys() {
        return keysWith(SlotOutcome.Kind.MATERIALIZED);
    }

    public Set<AssetKey> skippedKeys() {
        return keysWith(SlotOutcome.Kind.SKIPPED);
    }

    public Set<AssetKey> failedKeys() {
        return keysWith(SlotOutcome.Kind.FAILED);
    }

    private Set<AssetKey> keysWith(SlotOutcome.Kind kind) {
        Set<AssetKey> keys = new LinkedHashSet<>();
        for (InvocationResult r : invocations.values())
            for (SlotOutcome o : r.outcomes().values())
                if (o.kind() == kind)
                    keys.add(o.key());
        return keys;
    }

    /** Invocations that failed on their own, excluding short-circuited dependents. */
    public List<InvocationResult> originFailures() {
        List<InvocationResult> result = new ArrayList<>();
        for (InvocationResult r : invocations.values())
            if (r.status() == InvocationStatus.FAILED && !r.isShortCircuited())
                result.add(r);
        return result;
    }

    /** Steps failed without execution because {@code originStep} failed. */
    public List<String> shortCircuitedBy(String originStep) {
        List<String> result = new ArrayList<>();
        for (InvocationResult r : invocations.values())
            if (originStep.equals(r.failedUpstream()))
                result.add(r.stepName());
        return result;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Instant finishedAt() {
        return finishedAt;
    }

    public Duration elapsed() {
        return Duration.between(startedAt, finishedAt);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("RunResult[").append(runId).append(", ").append(status);
        for (InvocationResult r : invocations.values())
            sb.append(", ").append(r.stepName()).append('=').append(r.status());
        return sb.append(']').toString();
    }
}
