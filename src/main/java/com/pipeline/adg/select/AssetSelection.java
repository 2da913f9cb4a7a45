package com.pipeline.adg.select;

import com.pipeline.adg.asset.AssetKey;
import com.pipeline.adg.engine.AssetGraph;
import com.pipeline.adg.engine.TopologicalOrder;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * An already-parsed selection query over an asset graph.
 *
 * Selections compose: {@code AssetSelection.keys(k).upstream().or(AssetSelection.groups("raw"))}.
 * Resolving a selection yields a subset of the graph's keys; unknown keys fail with
 * {@link com.pipeline.adg.error.UnknownDependencyException}.
 */
public interface AssetSelection {

    /** Unlimited traversal depth for lineage closures. */
    int UNBOUNDED = -1;

    Set<AssetKey> resolve(AssetGraph graph);

    static AssetSelection all() {
        return graph -> new LinkedHashSet<>(graph.topologicalOrder());
    }

    static AssetSelection keys(AssetKey... keys) {
        return new KeySelection(List.of(keys));
    }

    /** Keys given in display form, e.g. {@code "warehouse/orders"}. */
    static AssetSelection keys(String... userStrings) {
        return new KeySelection(Arrays.stream(userStrings).map(AssetKey::parse).toList());
    }

    static AssetSelection groups(String... groups) {
        return new GroupSelection(List.of(groups));
    }

    default AssetSelection upstream() {
        return upstream(UNBOUNDED);
    }

    /** This selection plus everything up to {@code depth} hops upstream. */
    default AssetSelection upstream(int depth) {
        return new LineageSelection(this, true, depth);
    }

    default AssetSelection downstream() {
        return downstream(UNBOUNDED);
    }

    /** This selection plus everything up to {@code depth} hops downstream. */
    default AssetSelection downstream(int depth) {
        return new LineageSelection(this, false, depth);
    }

    default AssetSelection or(AssetSelection other) {
        AssetSelection self = this;
        return graph -> {
            Set<AssetKey> result = self.resolve(graph);
            result.addAll(other.resolve(graph));
            return result;
        };
    }

    default AssetSelection and(AssetSelection other) {
        AssetSelection self = this;
        return graph -> {
            Set<AssetKey> result = self.resolve(graph);
            result.retainAll(other.resolve(graph));
            return result;
        };
    }

    default AssetSelection minus(AssetSelection other) {
        AssetSelection self = this;
        return graph -> {
            Set<AssetKey> result = self.resolve(graph);
            result.removeAll(other.resolve(graph));
            return result;
        };
    }

    /** This selection without source assets. */
    default AssetSelection withoutSources() {
        AssetSelection self = this;
        return graph -> {
            Set<AssetKey> result = self.resolve(graph);
            result.removeIf(graph::isSource);
            return result;
        };
    }

    record KeySelection(List<AssetKey> keys) implements AssetSelection {
        @Override
        public Set<AssetKey> resolve(AssetGraph graph) {
            Set<AssetKey> result = new LinkedHashSet<>();
            for (AssetKey key : keys)
                result.add(graph.requireNode(key).key());
            return result;
        }
    }

    record GroupSelection(List<String> groups) implements AssetSelection {
        @Override
        public Set<AssetKey> resolve(AssetGraph graph) {
            Set<AssetKey> result = new LinkedHashSet<>();
            for (String group : groups)
                result.addAll(graph.keysInGroup(group));
            return result;
        }
    }

    /** Breadth-first closure over parents or children, bounded by {@code depth} hops. */
    record LineageSelection(AssetSelection base, boolean towardsParents, int depth) implements AssetSelection {
        @Override
        public Set<AssetKey> resolve(AssetGraph graph) {
            TopologicalOrder topo = graph.topology();
            Set<AssetKey> result = base.resolve(graph);
            Deque<int[]> queue = new ArrayDeque<>();
            for (AssetKey key : result)
                queue.add(new int[] { topo.topoIndex(key), 0 });
            while (!queue.isEmpty()) {
                int[] item = queue.poll();
                int ti = item[0];
                if (depth != UNBOUNDED && item[1] >= depth)
                    continue;
                int count = towardsParents ? topo.parentCount(ti) : topo.childCount(ti);
                for (int i = 0; i < count; i++) {
                    int next = towardsParents ? topo.parent(ti, i) : topo.child(ti, i);
                    if (result.add(topo.key(next)))
                        queue.add(new int[] { next, item[1] + 1 });
                }
            }
            return result;
        }
    }
}
