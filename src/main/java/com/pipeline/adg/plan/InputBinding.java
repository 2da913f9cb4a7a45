package com.pipeline.adg.plan;

import com.pipeline.adg.asset.AssetKey;
import com.pipeline.adg.asset.DependencyKind;

/**
 * How one planned invocation waits on, and optionally reads, an upstream asset.
 *
 * @param parameterName Computation parameter bound to the upstream.
 * @param upstreamKey   Upstream asset.
 * @param kind          Dependency kind of the binding.
 * @param producerStep  Step producing the upstream within this plan, or null when
 *                      the value comes from outside the run (source asset or an
 *                      earlier materialization).
 * @param ioManagerKey  I/O manager that loads the upstream.
 */
public record InputBinding(
        String parameterName,
        AssetKey upstreamKey,
        DependencyKind kind,
        String producerStep,
        String ioManagerKey) {

    public enum Mode {
        WAIT_ONLY, WAIT_AND_FETCH
    }

    public Mode mode() {
        return kind == DependencyKind.LOADED ? Mode.WAIT_AND_FETCH : Mode.WAIT_ONLY;
    }

    public boolean isExternal() {
        return producerStep == null;
    }
}
