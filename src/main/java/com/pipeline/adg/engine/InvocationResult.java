package com.pipeline.adg.engine;

import com.pipeline.adg.asset.AssetKey;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Terminal state of one step invocation.
 *
 * @param stepName       Invoked step.
 * @param status         Terminal status.
 * @param outcomes       Outcome per requested output slot, in the step's output order.
 * @param attempts       Attempts started; 0 when the invocation was never started.
 * @param retryDelays    Delay waited before each retry, in order.
 * @param error          Error that failed the invocation, null unless FAILED.
 * @param failedUpstream Step whose failure short-circuited this one, null otherwise.
 * @param startedAt      First time the invocation entered RUNNING, null if it never did.
 * @param finishedAt     Time the invocation reached its terminal state.
 */
public record InvocationResult(
        String stepName,
        InvocationStatus status,
        Map<AssetKey, SlotOutcome> outcomes,
        int attempts,
        List<Duration> retryDelays,
        Throwable error,
        String failedUpstream,
        Instant startedAt,
        Instant finishedAt) {

    public InvocationResult {
        outcomes = Collections.unmodifiableMap(new LinkedHashMap<>(outcomes));
        retryDelays = List.copyOf(retryDelays);
    }

    public SlotOutcome outcome(AssetKey key) {
        return outcomes.get(key);
    }

    /** True when at least one attempt started. */
    public boolean wasInvoked() {
        return attempts > 0;
    }

    /** True when this invocation was failed because an upstream invocation failed. */
    public boolean isShortCircuited() {
        return failedUpstream != null;
    }

    /** Wall time between first start and the terminal state, zero if it never started. */
    public Duration elapsed() {
        if (startedAt == null || finishedAt == null)
            return Duration.ZERO;
        return Duration.between(startedAt, finishedAt);
    }
}
