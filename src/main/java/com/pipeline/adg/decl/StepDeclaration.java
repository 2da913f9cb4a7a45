package com.pipeline.adg.decl;

import com.pipeline.adg.api.AssetComputation;
import com.pipeline.adg.asset.AssetKey;
import com.pipeline.adg.asset.RetryPolicy;
import com.pipeline.adg.config.ConfigSchema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A declared step: its outputs, its inputs and the computation behind them.
 *
 * Internal dependencies are expressed as input references: either an input's
 * parameter name or the display form of an input's asset key. Outputs without an
 * entry depend on every input.
 */
public final class StepDeclaration {
    private final String name;
    private final List<OutputDeclaration> outputs;
    private final List<InputDeclaration> inputs;
    private final boolean subsettable;
    private final Map<AssetKey, Set<String>> internalDependencies;
    private final RetryPolicy retryPolicy;
    private final ConfigSchema configSchema;
    private final AssetComputation computation;
    private final String site;

    private StepDeclaration(Builder b, String site) {
        this.name = b.name;
        this.outputs = List.copyOf(b.outputs);
        this.inputs = List.copyOf(b.inputs);
        this.subsettable = b.subsettable;
        Map<AssetKey, Set<String>> deps = new LinkedHashMap<>();
        b.internalDependencies.forEach((k, v) -> deps.put(k, Collections.unmodifiableSet(new LinkedHashSet<>(v))));
        this.internalDependencies = Collections.unmodifiableMap(deps);
        this.retryPolicy = b.retryPolicy;
        this.configSchema = b.configSchema;
        this.computation = b.computation;
        this.site = site;
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String name() {
        return name;
    }

    public List<OutputDeclaration> outputs() {
        return outputs;
    }

    public List<InputDeclaration> inputs() {
        return inputs;
    }

    public boolean subsettable() {
        return subsettable;
    }

    public Map<AssetKey, Set<String>> internalDependencies() {
        return internalDependencies;
    }

    public RetryPolicy retryPolicy() {
        return retryPolicy;
    }

    public ConfigSchema configSchema() {
        return configSchema;
    }

    public AssetComputation computation() {
        return computation;
    }

    /** Where the step was declared, used in error messages. */
    public String site() {
        return site;
    }

    public StepDeclaration withSite(String site) {
        return new StepDeclaration(toBuilder(), site);
    }

    public Builder toBuilder() {
        Builder b = new Builder(name);
        b.outputs.addAll(outputs);
        b.inputs.addAll(inputs);
        b.subsettable = subsettable;
        internalDependencies.forEach((k, v) -> b.internalDependencies.put(k, new LinkedHashSet<>(v)));
        b.retryPolicy = retryPolicy;
        b.configSchema = configSchema;
        b.computation = computation;
        b.site = site;
        return b;
    }

    @Override
    public String toString() {
        return "StepDeclaration[" + name + " @ " + site + "]";
    }

    public static final class Builder {
        private final String name;
        private final List<OutputDeclaration> outputs = new ArrayList<>();
        private final List<InputDeclaration> inputs = new ArrayList<>();
        private final Map<AssetKey, Set<String>> internalDependencies = new LinkedHashMap<>();
        private boolean subsettable;
        private RetryPolicy retryPolicy;
        private ConfigSchema configSchema;
        private AssetComputation computation;
        private String site;

        private Builder(String name) {
            this.name = Objects.requireNonNull(name, "name");
            if (name.isEmpty())
                throw new IllegalArgumentException("Step name must be non-empty");
        }

        public Builder output(OutputDeclaration output) {
            outputs.add(output);
            return this;
        }

        public Builder input(InputDeclaration input) {
            inputs.add(input);
            return this;
        }

        public Builder subsettable(boolean subsettable) {
            this.subsettable = subsettable;
            return this;
        }

        /**
         * Narrows the inputs feeding {@code output} to the referenced ones. Each
         * reference is an input parameter name or an input key's display form.
         */
        public Builder internalDependency(AssetKey output, String... inputReferences) {
            Set<String> refs = internalDependencies.computeIfAbsent(output, k -> new LinkedHashSet<>());
            Collections.addAll(refs, inputReferences);
            return this;
        }

        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        public Builder configSchema(ConfigSchema configSchema) {
            this.configSchema = configSchema;
            return this;
        }

        public Builder compute(AssetComputation computation) {
            this.computation = computation;
            return this;
        }

        public Builder site(String site) {
            this.site = site;
            return this;
        }

        public StepDeclaration build() {
            if (outputs.isEmpty())
                throw new IllegalArgumentException("Step " + name + " declares no outputs");
            if (computation == null)
                throw new IllegalArgumentException("Step " + name + " has no computation");
            return new StepDeclaration(this, site == null ? "step " + name : site);
        }
    }
}
