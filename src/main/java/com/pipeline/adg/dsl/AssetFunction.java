package com.pipeline.adg.dsl;

import com.pipeline.adg.api.StepContext;

/**
 * Body of a single-output asset: returns the value to materialize.
 */
@FunctionalInterface
public interface AssetFunction {

    Object apply(StepContext context) throws Exception;
}
