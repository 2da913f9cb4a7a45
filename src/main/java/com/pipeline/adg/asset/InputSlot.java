package com.pipeline.adg.asset;

import java.util.Objects;

/**
 * A resolved input of a step: the parameter the computation reads and the upstream
 * asset bound to it at resolution time.
 */
public record InputSlot(String parameterName, AssetKey key, DependencyKind kind) {

    public InputSlot {
        Objects.requireNonNull(parameterName, "parameterName");
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(kind, "kind");
    }

    public boolean isLoaded() {
        return kind == DependencyKind.LOADED;
    }
}
