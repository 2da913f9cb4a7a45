package com.pipeline.adg.plan;

import com.pipeline.adg.asset.AssetKey;
import com.pipeline.adg.asset.Step;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * One scheduled invocation of a step.
 *
 * @param step                Step to invoke.
 * @param requestedOutputs    Output slots requested, in the step's declaration order.
 * @param inputs              Bindings for every input feeding a requested output.
 * @param upstreamInvocations Steps of the same plan this one waits on.
 */
public record PlannedInvocation(
        Step step,
        Set<AssetKey> requestedOutputs,
        List<InputBinding> inputs,
        Set<String> upstreamInvocations) {

    public PlannedInvocation {
        requestedOutputs = Collections.unmodifiableSet(new LinkedHashSet<>(requestedOutputs));
        inputs = List.copyOf(inputs);
        upstreamInvocations = Collections.unmodifiableSet(new LinkedHashSet<>(upstreamInvocations));
    }

    public String stepName() {
        return step.name();
    }

    /** True when only some of the step's outputs are requested. */
    public boolean isSubset() {
        return requestedOutputs.size() < step.outputKeys().size();
    }

    /** Bindings feeding the given output. */
    public List<InputBinding> inputsFor(AssetKey output) {
        Set<AssetKey> feeding = step.inputKeysFor(output);
        List<InputBinding> result = new ArrayList<>();
        for (InputBinding b : inputs)
            if (feeding.contains(b.upstreamKey()))
                result.add(b);
        return result;
    }

    public InputBinding input(String parameterName) {
        for (InputBinding b : inputs)
            if (b.parameterName().equals(parameterName))
                return b;
        return null;
    }
}
