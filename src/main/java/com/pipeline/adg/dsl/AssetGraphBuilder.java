package com.pipeline.adg.dsl;

import com.pipeline.adg.api.StepOutputs;
import com.pipeline.adg.asset.AssetKey;
import com.pipeline.adg.decl.Declarations;
import com.pipeline.adg.decl.InputDeclaration;
import com.pipeline.adg.decl.OutputDeclaration;
import com.pipeline.adg.decl.SourceDeclaration;
import com.pipeline.adg.decl.StepDeclaration;
import com.pipeline.adg.engine.AssetGraph;
import com.pipeline.adg.engine.GraphResolver;

import java.util.ArrayList;
import java.util.List;

/**
 * Fluent entry point for declaring an asset graph in code.
 *
 * Usage Pattern:
 * 1. Create a builder: {@code AssetGraphBuilder g = AssetGraphBuilder.create("sales");}
 * 2. Declare sources: {@code g.source("raw/orders");}
 * 3. Declare assets: {@code g.asset("orders", ctx -> clean(ctx.input("raw_orders")), "raw_orders");}
 * 4. Declare multi-output steps with {@link #step(StepDeclaration)}.
 * 5. Build: {@code AssetGraph graph = g.build();}
 *
 * Inputs given as plain strings are loaded dependencies bound by name: the
 * parameter name must equal the last segment of exactly one asset key.
 */
public final class AssetGraphBuilder {
    private final String graphName;
    private final List<SourceDeclaration> sources = new ArrayList<>();
    private final List<StepDeclaration> steps = new ArrayList<>();
    private boolean built;

    private AssetGraphBuilder(String graphName) {
        this.graphName = graphName;
    }

    public static AssetGraphBuilder create(String graphName) {
        return new AssetGraphBuilder(graphName);
    }

    // ── Sources ──────────────────────────────────────────────────

    /**
     * Declares a source asset from its display form, e.g. {@code "raw/orders"}.
     */
    public AssetKey source(String key) {
        return source(SourceDeclaration.of(AssetKey.parse(key)));
    }

    public AssetKey source(SourceDeclaration source) {
        checkNotBuilt();
        sources.add(source);
        return source.key();
    }

    // ── Single-output assets ─────────────────────────────────────

    /**
     * Declares a required asset computed by one function from name-matched
     * loaded inputs.
     *
     * @param key          Display form of the asset key; also the step name.
     * @param fn           Function producing the value.
     * @param loadedInputs Parameter names, each matching an upstream key's last segment.
     */
    public AssetKey asset(String key, AssetFunction fn, String... loadedInputs) {
        InputDeclaration[] inputs = new InputDeclaration[loadedInputs.length];
        for (int i = 0; i < loadedInputs.length; i++)
            inputs[i] = InputDeclaration.loaded(loadedInputs[i]);
        return asset(OutputDeclaration.required(AssetKey.parse(key)), fn, inputs);
    }

    /**
     * Declares a single-output asset with full control over the output slot and
     * the inputs.
     */
    public AssetKey asset(OutputDeclaration output, AssetFunction fn, InputDeclaration... inputs) {
        AssetKey key = output.key();
        StepDeclaration.Builder b = StepDeclaration.builder(key.toUserString()).output(output);
        for (InputDeclaration in : inputs)
            b.input(in);
        b.compute(ctx -> StepOutputs.single(key, fn.apply(ctx)));
        return step(b.build()).outputs().get(0).key();
    }

    // ── Multi-output steps ───────────────────────────────────────

    public StepDeclaration step(StepDeclaration step) {
        checkNotBuilt();
        steps.add(step);
        return step;
    }

    public String graphName() {
        return graphName;
    }

    /** The declarations collected so far. */
    public Declarations declarations() {
        return Declarations.of(sources, steps);
    }

    /**
     * Resolves the collected declarations. The builder can't be modified after.
     */
    public AssetGraph build() {
        checkNotBuilt();
        built = true;
        return new GraphResolver().resolve(graphName, declarations());
    }

    private void checkNotBuilt() {
        if (built)
            throw new IllegalStateException("Graph '" + graphName + "' already built");
    }
}
