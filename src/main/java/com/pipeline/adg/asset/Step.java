package com.pipeline.adg.asset;

import com.pipeline.adg.api.AssetComputation;
import com.pipeline.adg.config.ConfigSchema;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * The unit of computation: one computation producing one or more output slots.
 *
 * A step is resolved once, with every input parameter already bound to an upstream
 * asset key, and is immutable afterwards.
 *
 * Internal dependencies narrow which inputs feed which outputs. When a step was
 * declared without them, every input feeds every output.
 */
public final class Step {
    private final String name;
    private final List<OutputSlot> outputs;
    private final Map<AssetKey, OutputSlot> outputsByKey;
    private final List<InputSlot> inputs;
    private final boolean subsettable;
    private final Map<AssetKey, Set<AssetKey>> internalDependencies;
    private final RetryPolicy retryPolicy;
    private final ConfigSchema configSchema;
    private final AssetComputation computation;

    public Step(String name, List<OutputSlot> outputs, List<InputSlot> inputs, boolean subsettable,
            Map<AssetKey, Set<AssetKey>> internalDependencies, RetryPolicy retryPolicy,
            ConfigSchema configSchema, AssetComputation computation) {
        this.name = Objects.requireNonNull(name, "name");
        if (outputs.isEmpty())
            throw new IllegalArgumentException("Step " + name + " declares no outputs");
        this.outputs = List.copyOf(outputs);
        this.inputs = List.copyOf(inputs);
        this.subsettable = subsettable;
        this.retryPolicy = retryPolicy;
        this.configSchema = configSchema == null ? ConfigSchema.EMPTY : configSchema;
        this.computation = Objects.requireNonNull(computation, "computation");

        Map<AssetKey, OutputSlot> byKey = new LinkedHashMap<>();
        for (OutputSlot slot : this.outputs)
            byKey.put(slot.key(), slot);
        this.outputsByKey = Collections.unmodifiableMap(byKey);

        Set<AssetKey> allInputs = new LinkedHashSet<>();
        for (InputSlot in : this.inputs)
            allInputs.add(in.key());
        Map<AssetKey, Set<AssetKey>> deps = new LinkedHashMap<>();
        for (OutputSlot slot : this.outputs) {
            Set<AssetKey> declared = internalDependencies == null ? null : internalDependencies.get(slot.key());
            deps.put(slot.key(), Collections.unmodifiableSet(
                    new LinkedHashSet<>(declared == null ? allInputs : declared)));
        }
        this.internalDependencies = Collections.unmodifiableMap(deps);
    }

    public String name() {
        return name;
    }

    public List<OutputSlot> outputs() {
        return outputs;
    }

    public Set<AssetKey> outputKeys() {
        return outputsByKey.keySet();
    }

    /** The slot for the given key, or null if this step does not produce it. */
    public OutputSlot output(AssetKey key) {
        return outputsByKey.get(key);
    }

    public boolean produces(AssetKey key) {
        return outputsByKey.containsKey(key);
    }

    public List<InputSlot> inputs() {
        return inputs;
    }

    public boolean isSubsettable() {
        return subsettable;
    }

    public Map<AssetKey, Set<AssetKey>> internalDependencies() {
        return internalDependencies;
    }

    /** Upstream keys feeding a single output. */
    public Set<AssetKey> inputKeysFor(AssetKey output) {
        Set<AssetKey> keys = internalDependencies.get(output);
        if (keys == null)
            throw new IllegalArgumentException("Step " + name + " does not produce " + output);
        return keys;
    }

    /**
     * Inputs needed to compute the given outputs, in declaration order.
     */
    public List<InputSlot> inputsFor(Collection<AssetKey> requestedOutputs) {
        Set<AssetKey> needed = new LinkedHashSet<>();
        for (AssetKey out : requestedOutputs)
            needed.addAll(inputKeysFor(out));
        List<InputSlot> result = new ArrayList<>();
        for (InputSlot in : inputs)
            if (needed.contains(in.key()))
                result.add(in);
        return result;
    }

    /** Retry policy declared on the step, or null to fall back to the engine default. */
    public RetryPolicy retryPolicy() {
        return retryPolicy;
    }

    public ConfigSchema configSchema() {
        return configSchema;
    }

    public AssetComputation computation() {
        return computation;
    }

    @Override
    public String toString() {
        return "Step[" + name + " -> " + outputsByKey.keySet() + (subsettable ? ", subsettable" : "") + "]";
    }
}
