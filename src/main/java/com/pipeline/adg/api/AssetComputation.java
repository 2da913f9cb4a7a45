package com.pipeline.adg.api;

/**
 * The body of a step.
 *
 * Called once per attempt with a context exposing the loaded inputs, the validated
 * config and the subset of outputs requested for this invocation. For each
 * requested output the computation either produces a value or declines.
 *
 * Any exception raised here is treated as a failure and is retried according to
 * the step's retry policy. Declining is not a failure.
 */
@FunctionalInterface
public interface AssetComputation {

    StepOutputs compute(StepContext context) throws Exception;
}
