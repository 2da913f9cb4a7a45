package com.pipeline.adg.error;

import com.pipeline.adg.asset.AssetKey;

import java.util.List;
import java.util.stream.Collectors;

/**
 * The declared dependencies form a cycle. The cycle starts and ends on the same key.
 */
public class CyclicDependencyException extends AssetGraphException {
    private final List<AssetKey> cycle;

    public CyclicDependencyException(List<AssetKey> cycle) {
        super("Cyclic dependency: " + cycle.stream().map(AssetKey::toUserString)
                .collect(Collectors.joining(" -> ")));
        this.cycle = List.copyOf(cycle);
    }

    public List<AssetKey> cycle() {
        return cycle;
    }
}
