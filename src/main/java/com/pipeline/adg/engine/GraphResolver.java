package com.pipeline.adg.engine;

import com.pipeline.adg.asset.AssetKey;
import com.pipeline.adg.asset.AssetNode;
import com.pipeline.adg.asset.DependencyEdge;
import com.pipeline.adg.asset.DependencyKind;
import com.pipeline.adg.asset.InputSlot;
import com.pipeline.adg.asset.OutputSlot;
import com.pipeline.adg.asset.Step;
import com.pipeline.adg.decl.Declarations;
import com.pipeline.adg.decl.InputDeclaration;
import com.pipeline.adg.decl.OutputDeclaration;
import com.pipeline.adg.decl.SourceDeclaration;
import com.pipeline.adg.decl.StepDeclaration;
import com.pipeline.adg.error.CyclicDependencyException;
import com.pipeline.adg.error.DuplicateKeyException;
import com.pipeline.adg.error.UnknownDependencyException;

import java.util.*;
import java.util.stream.Collectors;

import lombok.extern.log4j.Log4j2;

/**
 * Turns a declaration set into an {@link AssetGraph}, or fails without returning a
 * partially usable graph.
 *
 * Resolution:
 * 1. Claim keys: every output and source key must be unique; step names too.
 * 2. Bind inputs: an input with an explicit key binds to it, a name-matched input
 * binds to the single asset whose last segment equals the parameter name. The
 * bindings are stored on the step so nothing is matched by name at run time.
 * 3. Resolve internal dependencies of each output onto the step's bound inputs.
 * 4. Build asset-level edges from the internal dependencies, reject cycles, and
 * compute the topological order.
 * 5. Reject cycles between steps. A step runs at most once per plan, so a step
 * cannot consume its own output or sit on a loop through other steps.
 */
@Log4j2
public final class GraphResolver {

    public AssetGraph resolve(Declarations declarations) {
        return resolve("default", declarations);
    }

    public AssetGraph resolve(String graphName, Declarations declarations) {
        Map<AssetKey, String> sites = claimKeys(declarations);
        Map<String, List<AssetKey>> byLastSegment = new HashMap<>();
        for (AssetKey key : sites.keySet())
            byLastSegment.computeIfAbsent(key.lastSegment(), k -> new ArrayList<>()).add(key);

        Map<AssetKey, AssetNode> nodes = new HashMap<>();
        Map<String, Step> steps = new LinkedHashMap<>();
        TopologicalOrder.Builder topo = TopologicalOrder.builder();

        for (SourceDeclaration src : declarations.sources()) {
            nodes.put(src.key(), AssetNode.source(src.key(), src.group(), src.ioManagerKey(), src.description()));
            topo.addNode(src.key()).markSource(src.key());
        }

        for (StepDeclaration decl : declarations.steps()) {
            List<InputSlot> inputs = bindInputs(decl, sites, byLastSegment);
            Map<AssetKey, Set<AssetKey>> internal = resolveInternalDependencies(decl, inputs);

            List<OutputSlot> outputs = new ArrayList<>(decl.outputs().size());
            for (OutputDeclaration out : decl.outputs())
                outputs.add(new OutputSlot(out.key(), out.required(), out.codeVersion(), out.ioManagerKey()));

            Step step = new Step(decl.name(), outputs, inputs, decl.subsettable(), internal,
                    decl.retryPolicy(), decl.configSchema(), decl.computation());
            steps.put(step.name(), step);

            for (OutputDeclaration out : decl.outputs()) {
                List<DependencyEdge> edges = edgesFor(step, out.key());
                nodes.put(out.key(), new AssetNode(out.key(), edges, out.codeVersion(), out.group(), false,
                        step.name(), out.ioManagerKey(), out.description()));
                topo.addNode(out.key());
            }
        }

        for (AssetNode node : nodes.values())
            for (DependencyEdge edge : node.dependencies())
                topo.addEdge(edge.upstream(), edge.downstream(), edge.kind());

        TopologicalOrder order = topo.build();
        checkStepCycles(steps);

        Map<AssetKey, AssetNode> ordered = new LinkedHashMap<>();
        for (AssetKey key : order.keys())
            ordered.put(key, nodes.get(key));

        AssetGraph graph = new AssetGraph(graphName, ordered, steps, order, declarations);
        log.info("Resolved graph '{}': {} assets ({} sources), {} steps, {} edges",
                graphName, ordered.size(), declarations.sources().size(), steps.size(), order.edgeCount());
        return graph;
    }

    /**
     * Resolves declarations from several locations into one graph.
     *
     * A source declared in one location whose key is computed in another is a
     * weak reference: it is dropped in favour of the computed node, and the
     * referencing steps bind to that node by key. A key computed by two locations
     * fails with {@link DuplicateKeyException} naming both sites.
     */
    public AssetGraph compose(String graphName, Map<String, Declarations> locations) {
        Set<AssetKey> computed = new HashSet<>();
        for (Declarations d : locations.values())
            for (StepDeclaration step : d.steps())
                for (OutputDeclaration out : step.outputs())
                    computed.add(out.key());

        List<SourceDeclaration> sources = new ArrayList<>();
        List<StepDeclaration> steps = new ArrayList<>();
        Set<AssetKey> seenSources = new HashSet<>();
        for (var entry : locations.entrySet()) {
            Declarations relocated = entry.getValue().relocate(entry.getKey());
            for (SourceDeclaration src : relocated.sources()) {
                if (computed.contains(src.key())) {
                    log.debug("Source {} in location '{}' refers to a computed asset", src.key(), entry.getKey());
                    continue;
                }
                if (seenSources.add(src.key()))
                    sources.add(src);
            }
            steps.addAll(relocated.steps());
        }
        return resolve(graphName, Declarations.of(sources, steps));
    }

    private Map<AssetKey, String> claimKeys(Declarations declarations) {
        Map<AssetKey, String> sites = new HashMap<>();
        Map<String, String> stepSites = new HashMap<>();
        for (SourceDeclaration src : declarations.sources()) {
            String previous = sites.putIfAbsent(src.key(), src.site());
            if (previous != null)
                throw new DuplicateKeyException(src.key().toUserString(), previous, src.site());
        }
        for (StepDeclaration step : declarations.steps()) {
            String previousStep = stepSites.putIfAbsent(step.name(), step.site());
            if (previousStep != null)
                throw new DuplicateKeyException(step.name(), previousStep, step.site());
            for (OutputDeclaration out : step.outputs()) {
                String previous = sites.putIfAbsent(out.key(), step.site());
                if (previous != null)
                    throw new DuplicateKeyException(out.key().toUserString(), previous, step.site());
            }
        }
        return sites;
    }

    private List<InputSlot> bindInputs(StepDeclaration decl, Map<AssetKey, String> sites,
            Map<String, List<AssetKey>> byLastSegment) {
        List<InputSlot> inputs = new ArrayList<>(decl.inputs().size());
        Set<String> parameters = new HashSet<>();
        for (InputDeclaration in : decl.inputs()) {
            if (!parameters.add(in.parameterName()))
                throw new DuplicateKeyException(in.parameterName(), decl.site(), decl.site() + " (input parameter)");
            AssetKey key;
            if (in.isNameMatched()) {
                List<AssetKey> candidates = byLastSegment.getOrDefault(in.parameterName(), List.of());
                if (candidates.isEmpty())
                    throw new UnknownDependencyException(in.parameterName(),
                            "Step " + decl.name() + " input '" + in.parameterName() + "' matches no asset");
                if (candidates.size() > 1)
                    throw new UnknownDependencyException(in.parameterName(),
                            "Step " + decl.name() + " input '" + in.parameterName() + "' is ambiguous between "
                                    + candidates.stream().sorted().map(AssetKey::toUserString)
                                            .collect(Collectors.joining(", "))
                                    + "; bind it to an explicit key");
                key = candidates.get(0);
            } else {
                key = in.key();
                if (!sites.containsKey(key))
                    throw new UnknownDependencyException(key.toUserString(),
                            "Step " + decl.name() + " depends on unknown asset " + key);
            }
            inputs.add(new InputSlot(in.parameterName(), key, in.kind()));
        }
        return inputs;
    }

    private Map<AssetKey, Set<AssetKey>> resolveInternalDependencies(StepDeclaration decl, List<InputSlot> inputs) {
        Map<AssetKey, Set<AssetKey>> resolved = new LinkedHashMap<>();
        Set<AssetKey> outputKeys = decl.outputs().stream().map(OutputDeclaration::key).collect(Collectors.toSet());
        for (var entry : decl.internalDependencies().entrySet()) {
            if (!outputKeys.contains(entry.getKey()))
                throw new UnknownDependencyException(entry.getKey().toUserString(),
                        "Step " + decl.name() + " declares internal dependencies for " + entry.getKey()
                                + " which is not one of its outputs");
            Set<AssetKey> keys = new LinkedHashSet<>();
            for (String ref : entry.getValue()) {
                InputSlot match = null;
                for (InputSlot in : inputs)
                    if (in.parameterName().equals(ref) || in.key().toUserString().equals(ref))
                        match = in;
                if (match == null)
                    throw new UnknownDependencyException(ref,
                            "Step " + decl.name() + " output " + entry.getKey() + " depends on '" + ref
                                    + "' which is not one of the step's inputs");
                keys.add(match.key());
            }
            resolved.put(entry.getKey(), keys);
        }
        return resolved;
    }

    private static List<DependencyEdge> edgesFor(Step step, AssetKey output) {
        Map<AssetKey, DependencyKind> kinds = new TreeMap<>();
        Set<AssetKey> feeding = step.inputKeysFor(output);
        for (InputSlot in : step.inputs())
            if (feeding.contains(in.key()))
                kinds.merge(in.key(), in.kind(), DependencyKind::strongest);
        List<DependencyEdge> edges = new ArrayList<>(kinds.size());
        for (var e : kinds.entrySet()) {
            if (e.getKey().equals(output))
                throw new CyclicDependencyException(List.of(output, output));
            edges.add(new DependencyEdge(e.getKey(), output, e.getValue()));
        }
        return edges;
    }

    private static void checkStepCycles(Map<String, Step> steps) {
        Map<AssetKey, String> producer = new HashMap<>();
        for (Step step : steps.values())
            for (AssetKey key : step.outputKeys())
                producer.put(key, step.name());

        // step -> (upstream step -> first key it consumes from that step)
        Map<String, Map<String, AssetKey>> upstreams = new TreeMap<>();
        for (Step step : steps.values()) {
            Map<String, AssetKey> ups = new TreeMap<>();
            for (InputSlot in : step.inputs()) {
                String p = producer.get(in.key());
                if (p != null)
                    ups.putIfAbsent(p, in.key());
            }
            upstreams.put(step.name(), ups);
        }

        Map<String, Integer> state = new HashMap<>();
        Deque<String> path = new ArrayDeque<>();
        for (String start : upstreams.keySet()) {
            List<String> cycle = visitStep(start, upstreams, state, path);
            if (cycle != null) {
                // cycle lists steps downstream-first; report keys upstream-first
                List<AssetKey> keys = new ArrayList<>();
                for (int i = cycle.size() - 1; i > 0; i--)
                    keys.add(upstreams.get(cycle.get(i - 1)).get(cycle.get(i)));
                keys.add(keys.get(0));
                throw new CyclicDependencyException(keys);
            }
        }
    }

    private static List<String> visitStep(String start, Map<String, Map<String, AssetKey>> upstreams,
            Map<String, Integer> state, Deque<String> path) {
        Integer s = state.get(start);
        if (s != null && s == 2)
            return null;
        Deque<Iterator<String>> pending = new ArrayDeque<>();
        state.put(start, 1);
        path.addLast(start);
        pending.addLast(upstreams.get(start).keySet().iterator());
        while (!pending.isEmpty()) {
            Iterator<String> ups = pending.peekLast();
            if (!ups.hasNext()) {
                pending.removeLast();
                state.put(path.removeLast(), 2);
                continue;
            }
            String up = ups.next();
            Integer us = state.get(up);
            if (us != null && us == 1) {
                List<String> cycle = new ArrayList<>();
                boolean on = false;
                for (String p : path) {
                    if (p.equals(up))
                        on = true;
                    if (on)
                        cycle.add(p);
                }
                cycle.add(up);
                return cycle;
            }
            if (us == null) {
                state.put(up, 1);
                path.addLast(up);
                pending.addLast(upstreams.get(up).keySet().iterator());
            }
        }
        return null;
    }
}
