package com.pipeline.adg.select;

import com.pipeline.adg.asset.AssetKey;
import com.pipeline.adg.asset.Step;
import com.pipeline.adg.engine.AssetGraph;

import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Computes the closed set of keys a run has to consider.
 *
 * The result is always a subset of the graph's keys, in topological order. A
 * selected output of a step that cannot be subsetted pulls in every sibling
 * output of that step; outputs of subsettable steps are kept as selected.
 */
public final class SelectionEngine {
    private static final Logger log = LogManager.getLogger(SelectionEngine.class);

    public Set<AssetKey> select(AssetGraph graph, AssetSelection selection) {
        return select(graph, selection.resolve(graph));
    }

    public Set<AssetKey> select(AssetGraph graph, Collection<AssetKey> keys) {
        Set<AssetKey> selected = new HashSet<>();
        for (AssetKey key : keys)
            selected.add(graph.requireNode(key).key());

        for (AssetKey key : Set.copyOf(selected)) {
            Step step = graph.stepFor(key);
            if (step != null && !step.isSubsettable() && selected.addAll(step.outputKeys()))
                log.debug("Selection of {} expanded to all outputs of non-subsettable step {}", key, step.name());
        }

        Set<AssetKey> ordered = new LinkedHashSet<>();
        for (AssetKey key : graph.topologicalOrder())
            if (selected.contains(key))
                ordered.add(key);
        return Collections.unmodifiableSet(ordered);
    }
}
