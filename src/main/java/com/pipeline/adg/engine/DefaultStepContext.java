package com.pipeline.adg.engine;

import com.pipeline.adg.api.StepContext;
import com.pipeline.adg.api.UpstreamOutcome;
import com.pipeline.adg.asset.AssetKey;
import com.pipeline.adg.config.StepConfig;
import com.pipeline.adg.plan.InputBinding;

import java.util.Map;
import java.util.Set;
import java.util.function.BooleanSupplier;

final class DefaultStepContext implements StepContext {
    private final String runId;
    private final String stepName;
    private final int attempt;
    private final Set<AssetKey> requestedOutputs;
    private final Map<String, InputBinding> bindings;
    private final Map<String, Object> values;
    private final Map<String, UpstreamOutcome> outcomes;
    private final StepConfig config;
    private final BooleanSupplier cancelled;

    DefaultStepContext(String runId, String stepName, int attempt, Set<AssetKey> requestedOutputs,
            Map<String, InputBinding> bindings, Map<String, Object> values, Map<String, UpstreamOutcome> outcomes,
            StepConfig config, BooleanSupplier cancelled) {
        this.runId = runId;
        this.stepName = stepName;
        this.attempt = attempt;
        this.requestedOutputs = requestedOutputs;
        this.bindings = bindings;
        this.values = values;
        this.outcomes = outcomes;
        this.config = config;
        this.cancelled = cancelled;
    }

    @Override
    public String runId() {
        return runId;
    }

    @Override
    public String stepName() {
        return stepName;
    }

    @Override
    public int attempt() {
        return attempt;
    }

    @Override
    public Set<AssetKey> requestedOutputs() {
        return requestedOutputs;
    }

    @Override
    public boolean hasInput(String parameterName) {
        return values.containsKey(parameterName);
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> T input(String parameterName) {
        InputBinding binding = bindings.get(parameterName);
        if (binding == null)
            throw new IllegalArgumentException("Step " + stepName + " has no input '" + parameterName
                    + "' for the requested outputs " + requestedOutputs);
        if (binding.mode() != InputBinding.Mode.WAIT_AND_FETCH)
            throw new IllegalArgumentException("Input '" + parameterName + "' of step " + stepName
                    + " is an explicit dependency and carries no value");
        if (!values.containsKey(parameterName))
            throw new IllegalArgumentException("Input '" + parameterName + "' of step " + stepName
                    + " has no value: upstream " + binding.upstreamKey() + " was not materialized in this run");
        return (T) values.get(parameterName);
    }

    @Override
    public UpstreamOutcome upstreamOutcome(String parameterName) {
        UpstreamOutcome outcome = outcomes.get(parameterName);
        if (outcome == null)
            throw new IllegalArgumentException("Step " + stepName + " has no input '" + parameterName + "'");
        return outcome;
    }

    @Override
    public StepConfig config() {
        return config;
    }

    @Override
    public boolean isCancelled() {
        return cancelled.getAsBoolean();
    }
}
