package com.pipeline.adg;

import com.pipeline.adg.api.IoManager;
import com.pipeline.adg.api.MaterializationLog;
import com.pipeline.adg.api.RunListener;
import com.pipeline.adg.asset.AssetKey;
import com.pipeline.adg.asset.AssetNode;
import com.pipeline.adg.config.EngineConfig;
import com.pipeline.adg.config.RunConfig;
import com.pipeline.adg.decl.Declarations;
import com.pipeline.adg.engine.AssetGraph;
import com.pipeline.adg.engine.ExecutionEngine;
import com.pipeline.adg.engine.GraphResolver;
import com.pipeline.adg.engine.RunHandle;
import com.pipeline.adg.engine.RunResult;
import com.pipeline.adg.engine.StalenessTracker;
import com.pipeline.adg.plan.ExecutionPlan;
import com.pipeline.adg.plan.StepCompiler;
import com.pipeline.adg.select.AssetSelection;
import com.pipeline.adg.select.SelectionEngine;
import com.pipeline.adg.storage.InMemoryMaterializationLog;
import com.pipeline.adg.util.GraphExplain;
import com.pipeline.adg.util.RunMetricsListener;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Single entry point tying graph resolution, selection, compilation, execution
 * and staleness together.
 * <p>
 * This class handles:
 * <ul>
 * <li>Resolving declarations into the current {@link AssetGraph}</li>
 * <li>Swapping in a new graph on {@link #reload(Declarations)}; runs already
 * started keep the graph they were planned against</li>
 * <li>Turning selections into plans and submitting runs</li>
 * <li>Answering staleness queries against the shared event log</li>
 * </ul>
 */
public final class Materializer implements AutoCloseable {
    private static final Logger log = LogManager.getLogger(Materializer.class);

    private final String graphName;
    private final GraphResolver resolver = new GraphResolver();
    private final SelectionEngine selectionEngine = new SelectionEngine();
    private final StepCompiler compiler = new StepCompiler();
    private final ExecutionEngine engine;
    private final MaterializationLog eventLog;
    private volatile AssetGraph graph;

    private Materializer(Builder b) {
        this.graphName = b.graphName;
        this.eventLog = b.eventLog != null ? b.eventLog : new InMemoryMaterializationLog();
        this.graph = resolver.resolve(graphName, b.declarations);
        this.engine = new ExecutionEngine(b.engineConfig, b.ioManagers, eventLog);
        for (RunListener l : b.listeners)
            engine.addListener(l);
        if (log.isDebugEnabled())
            log.debug("\n{}", new GraphExplain(graph).dumpTopology());
    }

    public static Builder builder(Declarations declarations) {
        return new Builder(declarations);
    }

    /** The current graph. */
    public AssetGraph graph() {
        return graph;
    }

    /**
     * Resolves a new declaration set and makes it current. The previous graph is
     * left untouched; on a resolution error the current graph stays in place.
     */
    public AssetGraph reload(Declarations declarations) {
        AssetGraph next = resolver.resolve(graphName, declarations);
        graph = next;
        log.info("Reloaded graph '{}'", graphName);
        return next;
    }

    public Set<AssetKey> select(AssetSelection selection) {
        return selectionEngine.select(graph, selection);
    }

    public ExecutionPlan plan(AssetSelection selection) {
        AssetGraph current = graph;
        return plan(current, selectionEngine.select(current, selection));
    }

    public ExecutionPlan plan(Collection<AssetKey> keys) {
        AssetGraph current = graph;
        return plan(current, selectionEngine.select(current, keys));
    }

    private ExecutionPlan plan(AssetGraph current, Set<AssetKey> selected) {
        ExecutionPlan plan = compiler.compile(current, selected);
        if (log.isDebugEnabled())
            log.debug("\n{}", GraphExplain.explainPlan(plan));
        return plan;
    }

    public RunResult submitRun(AssetSelection selection, String runId) {
        return submitRun(plan(selection), runId, RunConfig.empty());
    }

    public RunResult submitRun(AssetSelection selection, String runId, RunConfig runConfig) {
        return submitRun(plan(selection), runId, runConfig);
    }

    public RunResult submitRun(ExecutionPlan plan, String runId) {
        return submitRun(plan, runId, RunConfig.empty());
    }

    /**
     * Executes a plan and blocks until it terminates.
     *
     * @throws IllegalArgumentException if {@code runId} was used before.
     */
    public RunResult submitRun(ExecutionPlan plan, String runId, RunConfig runConfig) {
        RunResult result = engine.execute(plan, runId, runConfig);
        if (log.isDebugEnabled())
            log.debug("\n{}", GraphExplain.explainRun(result));
        return result;
    }

    public RunHandle submitRunAsync(AssetSelection selection, String runId, RunConfig runConfig) {
        return engine.executeAsync(plan(selection), runId, runConfig);
    }

    public RunHandle submitRunAsync(ExecutionPlan plan, String runId, RunConfig runConfig) {
        return engine.executeAsync(plan, runId, runConfig);
    }

    public boolean isStale(AssetKey key) {
        return staleness().isStale(key);
    }

    /** Staleness of the current graph against the event log. */
    public StalenessTracker staleness() {
        return new StalenessTracker(graph, eventLog);
    }

    public MaterializationLog eventLog() {
        return eventLog;
    }

    public GraphExplain explain() {
        return new GraphExplain(graph, eventLog);
    }

    public void addListener(RunListener listener) {
        engine.addListener(listener);
    }

    /**
     * Registers a {@link RunMetricsListener}. Use the returned listener to read or
     * dump the counters.
     */
    public RunMetricsListener enableRunMetrics() {
        RunMetricsListener metrics = new RunMetricsListener();
        engine.addListener(metrics);
        return metrics;
    }

    public ExecutionEngine engine() {
        return engine;
    }

    @Override
    public void close() {
        engine.close();
    }

    public static final class Builder {
        private final Declarations declarations;
        private String graphName = "default";
        private EngineConfig engineConfig = EngineConfig.defaults();
        private final Map<String, IoManager> ioManagers = new LinkedHashMap<>();
        private MaterializationLog eventLog;
        private final List<RunListener> listeners = new ArrayList<>();

        private Builder(Declarations declarations) {
            this.declarations = declarations;
        }

        public Builder graphName(String graphName) {
            this.graphName = graphName;
            return this;
        }

        public Builder engineConfig(EngineConfig engineConfig) {
            this.engineConfig = engineConfig;
            return this;
        }

        /** Registers the I/O manager under the default key. */
        public Builder ioManager(IoManager ioManager) {
            return ioManager(AssetNode.DEFAULT_IO_MANAGER, ioManager);
        }

        public Builder ioManager(String key, IoManager ioManager) {
            ioManagers.put(key, ioManager);
            return this;
        }

        public Builder eventLog(MaterializationLog eventLog) {
            this.eventLog = eventLog;
            return this;
        }

        public Builder listener(RunListener listener) {
            listeners.add(listener);
            return this;
        }

        public Materializer build() {
            if (ioManagers.isEmpty())
                throw new IllegalStateException("At least one I/O manager is required");
            return new Materializer(this);
        }
    }
}
