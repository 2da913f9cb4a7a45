package com.pipeline.adg.engine;

import com.pipeline.adg.asset.AssetKey;
import com.pipeline.adg.asset.AssetNode;
import com.pipeline.adg.asset.DependencyEdge;
import com.pipeline.adg.asset.DependencyKind;
import com.pipeline.adg.asset.Step;
import com.pipeline.adg.decl.Declarations;
import com.pipeline.adg.error.UnknownDependencyException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A resolved, validated asset graph.
 *
 * Holds the nodes in topological order, the steps that produce them and the CSR
 * topology used for lineage traversal. A graph never changes after resolution; a
 * new declaration set yields a new graph.
 *
 * Thread Safety:
 * Immutable, safe to share between runs and threads.
 */
public final class AssetGraph {
    private final String name;
    private final Map<AssetKey, AssetNode> nodes;
    private final Map<String, Step> steps;
    private final Map<AssetKey, Step> stepByKey;
    private final TopologicalOrder topology;
    private final Declarations declarations;

    AssetGraph(String name, Map<AssetKey, AssetNode> nodes, Map<String, Step> steps,
            TopologicalOrder topology, Declarations declarations) {
        this.name = name;
        this.nodes = Collections.unmodifiableMap(new LinkedHashMap<>(nodes));
        this.steps = Collections.unmodifiableMap(new LinkedHashMap<>(steps));
        this.topology = topology;
        this.declarations = declarations;
        Map<AssetKey, Step> byKey = new LinkedHashMap<>();
        for (Step step : steps.values())
            for (AssetKey key : step.outputKeys())
                byKey.put(key, step);
        this.stepByKey = Collections.unmodifiableMap(byKey);
    }

    public String name() {
        return name;
    }

    /** Nodes keyed by asset key, iterated in topological order. */
    public Map<AssetKey, AssetNode> nodes() {
        return nodes;
    }

    public Map<String, Step> steps() {
        return steps;
    }

    public TopologicalOrder topology() {
        return topology;
    }

    /** The declarations this graph was resolved from. */
    public Declarations declarations() {
        return declarations;
    }

    public int size() {
        return nodes.size();
    }

    public boolean contains(AssetKey key) {
        return nodes.containsKey(key);
    }

    /**
     * @return the node, or null if the key is not part of this graph.
     */
    public AssetNode node(AssetKey key) {
        return nodes.get(key);
    }

    /**
     * @throws UnknownDependencyException if the key is not part of this graph.
     */
    public AssetNode requireNode(AssetKey key) {
        AssetNode node = nodes.get(key);
        if (node == null)
            throw new UnknownDependencyException(key.toUserString(), "Unknown asset " + key + " in graph " + name);
        return node;
    }

    /**
     * @return the step that produces {@code key}, or null for sources and unknown keys.
     */
    public Step stepFor(AssetKey key) {
        return stepByKey.get(key);
    }

    public Step step(String stepName) {
        return steps.get(stepName);
    }

    public boolean isSource(AssetKey key) {
        return requireNode(key).source();
    }

    /** All keys, in topological order. */
    public List<AssetKey> topologicalOrder() {
        return topology.keys();
    }

    public Set<AssetKey> sourceKeys() {
        Set<AssetKey> result = new LinkedHashSet<>();
        for (AssetNode node : nodes.values())
            if (node.source())
                result.add(node.key());
        return Collections.unmodifiableSet(result);
    }

    public Set<AssetKey> keysInGroup(String group) {
        Set<AssetKey> result = new LinkedHashSet<>();
        for (AssetNode node : nodes.values())
            if (node.group().equals(group))
                result.add(node.key());
        return Collections.unmodifiableSet(result);
    }

    /** Direct upstream keys of {@code key}. */
    public List<AssetKey> parents(AssetKey key) {
        int ti = topology.topoIndex(key);
        List<AssetKey> result = new ArrayList<>(topology.parentCount(ti));
        for (int i = 0; i < topology.parentCount(ti); i++)
            result.add(topology.key(topology.parent(ti, i)));
        return result;
    }

    /** Direct downstream keys of {@code key}. */
    public List<AssetKey> children(AssetKey key) {
        int ti = topology.topoIndex(key);
        List<AssetKey> result = new ArrayList<>(topology.childCount(ti));
        for (int i = 0; i < topology.childCount(ti); i++)
            result.add(topology.key(topology.child(ti, i)));
        return result;
    }

    /** Every dependency edge of the graph, grouped by downstream in topological order. */
    public List<DependencyEdge> edges() {
        List<DependencyEdge> result = new ArrayList<>(topology.edgeCount());
        for (int ti = 0; ti < topology.nodeCount(); ti++) {
            AssetKey downstream = topology.key(ti);
            for (int i = 0; i < topology.parentCount(ti); i++) {
                DependencyKind kind = topology.parentKind(ti, i);
                result.add(new DependencyEdge(topology.key(topology.parent(ti, i)), downstream, kind));
            }
        }
        return result;
    }

    @Override
    public String toString() {
        return "AssetGraph[" + name + ", " + nodes.size() + " nodes, " + steps.size() + " steps]";
    }
}
