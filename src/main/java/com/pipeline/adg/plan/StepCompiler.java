package com.pipeline.adg.plan;

import com.pipeline.adg.asset.AssetKey;
import com.pipeline.adg.asset.InputSlot;
import com.pipeline.adg.asset.Step;
import com.pipeline.adg.engine.AssetGraph;

import java.util.*;

import lombok.extern.log4j.Log4j2;

/**
 * Groups selected asset keys into step invocations.
 *
 * Each step with at least one selected output is planned once, requesting the
 * selected outputs (all of them for a step that cannot be subsetted). Its inputs
 * are the ones feeding those outputs; an input is waited on within the plan only
 * when its producer is planned and requested to emit it, otherwise it is read
 * from outside the run. Source keys in the selection are accepted and ignored:
 * they never run.
 */
@Log4j2
public final class StepCompiler {

    public ExecutionPlan compile(AssetGraph graph, Collection<AssetKey> selectedKeys) {
        Map<String, Set<AssetKey>> requestedByStep = new HashMap<>();
        for (AssetKey key : selectedKeys) {
            graph.requireNode(key);
            Step step = graph.stepFor(key);
            if (step == null)
                continue;
            Set<AssetKey> requested = requestedByStep.computeIfAbsent(step.name(), k -> new HashSet<>());
            if (step.isSubsettable())
                requested.add(key);
            else
                requested.addAll(step.outputKeys());
        }

        Map<String, PlannedInvocation> planned = new HashMap<>();
        for (var entry : requestedByStep.entrySet()) {
            Step step = graph.step(entry.getKey());
            Set<AssetKey> requested = new LinkedHashSet<>();
            for (AssetKey key : step.outputKeys())
                if (entry.getValue().contains(key))
                    requested.add(key);

            List<InputBinding> bindings = new ArrayList<>();
            Set<String> upstream = new TreeSet<>();
            for (InputSlot in : step.inputsFor(requested)) {
                Step producer = graph.stepFor(in.key());
                String producerName = null;
                if (producer != null) {
                    Set<AssetKey> producerRequested = requestedByStep.get(producer.name());
                    if (producerRequested != null && producerRequested.contains(in.key())) {
                        producerName = producer.name();
                        upstream.add(producerName);
                    }
                }
                bindings.add(new InputBinding(in.parameterName(), in.key(), in.kind(), producerName,
                        graph.node(in.key()).ioManagerKey()));
            }
            planned.put(step.name(), new PlannedInvocation(step, requested, bindings, upstream));
        }

        List<PlannedInvocation> ordered = order(graph, planned);
        Set<AssetKey> keys = new LinkedHashSet<>();
        for (AssetKey key : graph.topologicalOrder())
            for (PlannedInvocation inv : ordered)
                if (inv.requestedOutputs().contains(key))
                    keys.add(key);

        ExecutionPlan plan = new ExecutionPlan(graph.name(), ordered, keys);
        log.debug("Compiled plan for {} selected keys: {}", selectedKeys.size(), plan);
        return plan;
    }

    /** Kahn's algorithm over planned steps, earliest output in topological order first. */
    private static List<PlannedInvocation> order(AssetGraph graph, Map<String, PlannedInvocation> planned) {
        Map<String, Integer> rank = new HashMap<>();
        for (PlannedInvocation inv : planned.values()) {
            int min = Integer.MAX_VALUE;
            for (AssetKey key : inv.requestedOutputs())
                min = Math.min(min, graph.topology().topoIndex(key));
            rank.put(inv.stepName(), min);
        }

        Map<String, Integer> waiting = new HashMap<>();
        Map<String, List<String>> dependents = new HashMap<>();
        for (PlannedInvocation inv : planned.values()) {
            waiting.put(inv.stepName(), inv.upstreamInvocations().size());
            for (String up : inv.upstreamInvocations())
                dependents.computeIfAbsent(up, k -> new ArrayList<>()).add(inv.stepName());
        }

        PriorityQueue<String> ready = new PriorityQueue<>(
                Comparator.<String>comparingInt(rank::get).thenComparing(Comparator.naturalOrder()));
        for (var e : waiting.entrySet())
            if (e.getValue() == 0)
                ready.add(e.getKey());

        List<PlannedInvocation> ordered = new ArrayList<>(planned.size());
        while (!ready.isEmpty()) {
            String name = ready.poll();
            ordered.add(planned.get(name));
            for (String down : dependents.getOrDefault(name, List.of()))
                if (waiting.merge(down, -1, Integer::sum) == 0)
                    ready.add(down);
        }
        if (ordered.size() != planned.size())
            throw new IllegalStateException("Plan has a cycle between steps; the graph should have rejected it");
        return ordered;
    }
}
