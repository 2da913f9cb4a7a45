package com.pipeline.adg.util;

import com.pipeline.adg.api.MaterializationLog;
import com.pipeline.adg.asset.AssetKey;
import com.pipeline.adg.asset.AssetNode;
import com.pipeline.adg.asset.DependencyKind;
import com.pipeline.adg.asset.MaterializationEvent;
import com.pipeline.adg.asset.Step;
import com.pipeline.adg.engine.AssetGraph;
import com.pipeline.adg.engine.InvocationResult;
import com.pipeline.adg.engine.RunResult;
import com.pipeline.adg.engine.SlotOutcome;
import com.pipeline.adg.engine.TopologicalOrder;
import com.pipeline.adg.plan.ExecutionPlan;
import com.pipeline.adg.plan.InputBinding;
import com.pipeline.adg.plan.PlannedInvocation;

/**
 * Diagnostic renderings of a resolved graph, a compiled plan and a run result.
 *
 * <p>
 * <b>Usage:</b> Intended for debug logging and troubleshooting sessions. Every
 * call walks the whole structure and allocates strings.
 */
public final class GraphExplain {
    private final AssetGraph graph;
    private final TopologicalOrder topology;
    private final MaterializationLog eventLog;

    public GraphExplain(AssetGraph graph) {
        this(graph, null);
    }

    /** With an event log, node explanations include the current materialization. */
    public GraphExplain(AssetGraph graph, MaterializationLog eventLog) {
        this.graph = graph;
        this.topology = graph.topology();
        this.eventLog = eventLog;
    }

    /**
     * Dumps the declaration and current state of a single asset.
     */
    public String explainNode(AssetKey key) {
        AssetNode node = graph.requireNode(key);
        int idx = topology.topoIndex(key);
        StringBuilder sb = new StringBuilder(256);
        sb.append("Asset: ").append(key).append('\n')
                .append("  Topo index: ").append(idx).append('\n')
                .append("  Group: ").append(node.group()).append('\n')
                .append("  Is source: ").append(node.source()).append('\n')
                .append("  I/O manager: ").append(node.ioManagerKey()).append('\n');
        if (!node.source()) {
            Step step = graph.stepFor(key);
            sb.append("  Step: ").append(step.name())
                    .append(step.isSubsettable() ? " (subsettable)" : "").append('\n')
                    .append("  Required: ").append(step.output(key).required()).append('\n')
                    .append("  Code version: ").append(node.codeVersion()).append('\n');
        }
        if (node.description() != null)
            sb.append("  Description: ").append(node.description()).append('\n');
        sb.append("  Upstream (").append(topology.parentCount(idx)).append("): ");
        for (int i = 0; i < topology.parentCount(idx); i++) {
            if (i > 0)
                sb.append(", ");
            sb.append(topology.key(topology.parent(idx, i)));
            if (topology.parentKind(idx, i) == DependencyKind.EXPLICIT)
                sb.append(" (explicit)");
        }
        sb.append('\n');
        sb.append("  Downstream (").append(topology.childCount(idx)).append("): ");
        for (int i = 0; i < topology.childCount(idx); i++) {
            if (i > 0)
                sb.append(", ");
            sb.append(topology.key(topology.child(idx, i)));
        }
        sb.append('\n');
        if (eventLog != null) {
            MaterializationEvent latest = eventLog.latest(key);
            sb.append("  Latest materialization: ")
                    .append(latest == null ? "none"
                            : latest.runId() + " at " + latest.timestamp() + " (version " + latest.codeVersion() + ")")
                    .append('\n');
        }
        return sb.toString();
    }

    /**
     * Dumps the entire topology in text form, one asset per line.
     */
    public String dumpTopology() {
        StringBuilder sb = new StringBuilder(1024);
        sb.append("Graph '").append(graph.name()).append("' (").append(topology.nodeCount()).append(" assets, ")
                .append(graph.steps().size()).append(" steps):\n");
        for (int i = 0; i < topology.nodeCount(); i++) {
            AssetKey key = topology.key(i);
            sb.append("  [").append(i).append("] ").append(key);
            if (topology.isSource(i))
                sb.append(" (SRC)");
            else
                sb.append(" <").append(graph.stepFor(key).name()).append('>');
            int cc = topology.childCount(i);
            if (cc > 0) {
                sb.append(" -> ");
                for (int j = 0; j < cc; j++) {
                    if (j > 0)
                        sb.append(", ");
                    sb.append(topology.key(topology.child(i, j)));
                }
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    /**
     * Generates a Mermaid graph diagram. Loaded edges are solid, explicit edges
     * dotted, source assets drawn as stadiums.
     */
    public String toMermaid() {
        StringBuilder sb = new StringBuilder(4096);
        sb.append("graph TD;\n");
        for (int i = 0; i < topology.nodeCount(); i++) {
            AssetKey key = topology.key(i);
            String id = sanitize(key);
            if (topology.isSource(i))
                sb.append("  ").append(id).append("([\"").append(key).append("\"]);\n");
            else
                sb.append("  ").append(id).append("[\"").append(key).append("<br/><i>")
                        .append(graph.stepFor(key).name()).append("</i>\"];\n");
        }
        for (int i = 0; i < topology.nodeCount(); i++) {
            String child = sanitize(topology.key(i));
            for (int j = 0; j < topology.parentCount(i); j++) {
                String parent = sanitize(topology.key(topology.parent(i, j)));
                String arrow = topology.parentKind(i, j) == DependencyKind.LOADED ? " --> " : " -.-> ";
                sb.append("  ").append(parent).append(arrow).append(child).append(";\n");
            }
        }
        return sb.toString();
    }

    /**
     * Lists each planned invocation with its requested outputs and how it waits on
     * its inputs.
     */
    public static String explainPlan(ExecutionPlan plan) {
        StringBuilder sb = new StringBuilder(512);
        sb.append("Plan for '").append(plan.graphName()).append("' (").append(plan.size()).append(" invocations):\n");
        int n = 0;
        for (PlannedInvocation inv : plan.invocations()) {
            sb.append("  ").append(++n).append(". ").append(inv.stepName()).append(' ')
                    .append(inv.requestedOutputs());
            if (inv.isSubset())
                sb.append(" (subset)");
            sb.append('\n');
            for (InputBinding b : inv.inputs()) {
                sb.append("       ").append(b.parameterName()).append(" <- ").append(b.upstreamKey()).append(' ')
                        .append(b.mode());
                sb.append(b.isExternal() ? " [external]" : " [after " + b.producerStep() + "]");
                sb.append('\n');
            }
        }
        return sb.toString();
    }

    /**
     * Summarizes a run: status per invocation, then outcome per slot.
     */
    public static String explainRun(RunResult result) {
        StringBuilder sb = new StringBuilder(512);
        sb.append("Run ").append(result.runId()).append(": ").append(result.status()).append(" in ")
                .append(result.elapsed().toMillis()).append(" ms\n");
        for (InvocationResult r : result.invocations().values()) {
            sb.append("  ").append(r.stepName()).append(": ").append(r.status());
            if (r.attempts() > 1)
                sb.append(" after ").append(r.attempts()).append(" attempts");
            if (r.isShortCircuited())
                sb.append(" (upstream ").append(r.failedUpstream()).append(" failed)");
            else if (r.error() != null)
                sb.append(" (").append(r.error().getMessage()).append(')');
            sb.append('\n');
            for (SlotOutcome o : r.outcomes().values()) {
                sb.append("      ").append(o.key()).append(' ').append(o.kind());
                if (o.kind() == SlotOutcome.Kind.SKIPPED)
                    sb.append(": ").append(o.reason());
                sb.append('\n');
            }
        }
        return sb.toString();
    }

    private static String sanitize(AssetKey key) {
        return key.toUserString().replaceAll("[^a-zA-Z0-9_]", "_");
    }
}
