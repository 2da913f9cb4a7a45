package com.pipeline.adg.asset;

import java.util.Objects;

/**
 * A directed dependency from {@code downstream} onto {@code upstream}.
 */
public record DependencyEdge(AssetKey upstream, AssetKey downstream, DependencyKind kind) {

    public DependencyEdge {
        Objects.requireNonNull(upstream, "upstream");
        Objects.requireNonNull(downstream, "downstream");
        Objects.requireNonNull(kind, "kind");
        if (upstream.equals(downstream))
            throw new IllegalArgumentException("Asset cannot depend on itself: " + upstream);
    }

    public boolean isLoaded() {
        return kind == DependencyKind.LOADED;
    }

    @Override
    public String toString() {
        return upstream + " -" + (isLoaded() ? "loaded" : "explicit") + "-> " + downstream;
    }
}
