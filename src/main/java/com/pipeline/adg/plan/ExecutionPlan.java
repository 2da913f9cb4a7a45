package com.pipeline.adg.plan;

import com.pipeline.adg.asset.AssetKey;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A DAG of step invocations compiled from a selection.
 *
 * Invocations are listed in a valid execution order. Each step appears at most
 * once.
 */
public final class ExecutionPlan {
    private final String graphName;
    private final Map<String, PlannedInvocation> invocations;
    private final Map<String, List<String>> downstream;
    private final Set<AssetKey> selectedKeys;

    ExecutionPlan(String graphName, List<PlannedInvocation> ordered, Set<AssetKey> selectedKeys) {
        this.graphName = graphName;
        Map<String, PlannedInvocation> byStep = new LinkedHashMap<>();
        for (PlannedInvocation inv : ordered) {
            if (byStep.put(inv.stepName(), inv) != null)
                throw new IllegalArgumentException("Step planned twice: " + inv.stepName());
        }
        this.invocations = Collections.unmodifiableMap(byStep);

        Map<String, List<String>> down = new LinkedHashMap<>();
        for (PlannedInvocation inv : ordered)
            down.put(inv.stepName(), new ArrayList<>());
        for (PlannedInvocation inv : ordered)
            for (String up : inv.upstreamInvocations())
                down.get(up).add(inv.stepName());
        down.replaceAll((k, v) -> List.copyOf(v));
        this.downstream = Collections.unmodifiableMap(down);
        this.selectedKeys = Collections.unmodifiableSet(new LinkedHashSet<>(selectedKeys));
    }

    public String graphName() {
        return graphName;
    }

    /** Invocations in execution order. */
    public List<PlannedInvocation> invocations() {
        return List.copyOf(invocations.values());
    }

    public PlannedInvocation invocation(String stepName) {
        return invocations.get(stepName);
    }

    /** Invocations that wait directly on the given step. */
    public List<String> downstreamOf(String stepName) {
        return downstream.getOrDefault(stepName, List.of());
    }

    /** Computed keys the plan requests, in topological order. */
    public Set<AssetKey> selectedKeys() {
        return selectedKeys;
    }

    public int size() {
        return invocations.size();
    }

    public boolean isEmpty() {
        return invocations.isEmpty();
    }

    @Override
    public String toString() {
        return "ExecutionPlan[" + graphName + ", steps=" + invocations.keySet() + "]";
    }
}
