package com.pipeline.adg.api;

import com.pipeline.adg.asset.AssetKey;
import com.pipeline.adg.config.StepConfig;

import java.util.Set;

/**
 * Everything a computation can see during one attempt.
 */
public interface StepContext {

    String runId();

    String stepName();

    /** 1 for the initial attempt, incremented on each retry. */
    int attempt();

    /** The outputs this invocation must consider. A subset for subsetted invocations. */
    Set<AssetKey> requestedOutputs();

    default boolean isRequested(AssetKey key) {
        return requestedOutputs().contains(key);
    }

    /** True when a value was loaded for the parameter. */
    boolean hasInput(String parameterName);

    /**
     * Loaded value of a {@code LOADED} input.
     *
     * @throws IllegalArgumentException if the parameter is unknown, not loaded, or
     *                                  its upstream declined.
     */
    <T> T input(String parameterName);

    /** Outcome of the upstream bound to a parameter, for either dependency kind. */
    UpstreamOutcome upstreamOutcome(String parameterName);

    StepConfig config();

    /** Set once the run was cancelled. Long computations should poll it. */
    boolean isCancelled();
}
