package com.pipeline.adg.engine;

import com.lmax.disruptor.util.DaemonThreadFactory;
import com.pipeline.adg.api.IoManager;
import com.pipeline.adg.api.MaterializationLog;
import com.pipeline.adg.api.RunListener;
import com.pipeline.adg.asset.AssetNode;
import com.pipeline.adg.asset.OutputSlot;
import com.pipeline.adg.config.EngineConfig;
import com.pipeline.adg.config.RunConfig;
import com.pipeline.adg.config.StepConfig;
import com.pipeline.adg.plan.ExecutionPlan;
import com.pipeline.adg.plan.InputBinding;
import com.pipeline.adg.plan.PlannedInvocation;
import com.pipeline.adg.wiring.AsyncRunEventDispatcher;

import java.time.Clock;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Runs execution plans with bounded parallelism.
 *
 * <p>
 * Each run is a state machine over its planned invocations. An invocation becomes
 * eligible once every upstream invocation it waits on reached a terminal state;
 * eligible invocations run concurrently on a fixed pool of
 * {@link EngineConfig#getMaxParallelism()} workers. Retry delays are timer tasks,
 * so a waiting retry never occupies a worker.
 *
 * <p>
 * Execution errors never escape {@link #execute}: each one is captured in the
 * {@link RunResult}. Only request validation throws: a reused run id, a run
 * config that does not satisfy a step's schema, or an unknown I/O manager key.
 *
 * <p>
 * Run events go to listeners through an {@link AsyncRunEventDispatcher}, so a
 * slow listener never holds up a worker.
 */
public final class ExecutionEngine implements AutoCloseable {
    private static final Logger log = LogManager.getLogger(ExecutionEngine.class);

    private final EngineConfig config;
    private final Map<String, IoManager> ioManagers;
    private final MaterializationLog eventLog;
    private final AsyncRunEventDispatcher dispatcher;
    private final ExecutorService workers;
    private final ScheduledExecutorService timer;
    private final Clock clock;
    private final Set<String> usedRunIds = ConcurrentHashMap.newKeySet();
    private final Map<String, RunExecution> activeRuns = new ConcurrentHashMap<>();
    private volatile boolean closed;

    public ExecutionEngine(EngineConfig config, Map<String, IoManager> ioManagers, MaterializationLog eventLog) {
        this(config, ioManagers, eventLog, Clock.systemUTC());
    }

    public ExecutionEngine(EngineConfig config, Map<String, IoManager> ioManagers, MaterializationLog eventLog,
            Clock clock) {
        this.config = config.validate();
        this.ioManagers = Map.copyOf(ioManagers);
        this.eventLog = Objects.requireNonNull(eventLog, "eventLog");
        this.clock = clock;
        this.dispatcher = new AsyncRunEventDispatcher(config.getEventBufferSize(), config.getShutdownTimeoutMillis(),
                config.getObserverErrorLogIntervalMillis());
        AtomicInteger threadId = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(config.getMaxParallelism(), r -> {
            Thread t = new Thread(r, "adg-worker-" + threadId.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.timer = Executors.newSingleThreadScheduledExecutor(DaemonThreadFactory.INSTANCE);
        log.info("Execution engine started: {} worker(s), I/O managers {}", config.getMaxParallelism(),
                this.ioManagers.keySet());
    }

    /** An engine with a single I/O manager registered under the default key. */
    public static ExecutionEngine withIoManager(EngineConfig config, IoManager ioManager, MaterializationLog eventLog) {
        return new ExecutionEngine(config, Map.of(AssetNode.DEFAULT_IO_MANAGER, ioManager), eventLog);
    }

    public void addListener(RunListener listener) {
        dispatcher.addListener(listener);
    }

    public boolean removeListener(RunListener listener) {
        return dispatcher.removeListener(listener);
    }

    public MaterializationLog eventLog() {
        return eventLog;
    }

    public IoManager ioManager(String key) {
        return ioManagers.get(key);
    }

    /** Run events dropped because listeners fell behind. */
    public long droppedEventCount() {
        return dispatcher.droppedCount();
    }

    public Set<String> activeRunIds() {
        return Set.copyOf(activeRuns.keySet());
    }

    public RunResult execute(ExecutionPlan plan, String runId) {
        return execute(plan, runId, RunConfig.empty());
    }

    /** Runs the plan and blocks until every invocation reached a terminal state. */
    public RunResult execute(ExecutionPlan plan, String runId, RunConfig runConfig) {
        return executeAsync(plan, runId, runConfig).await();
    }

    public RunHandle executeAsync(ExecutionPlan plan, String runId) {
        return executeAsync(plan, runId, RunConfig.empty());
    }

    /**
     * Validates and starts a run.
     *
     * @throws IllegalArgumentException if the run id was already used or the plan
     *                                  references an unregistered I/O manager.
     * @throws com.pipeline.adg.error.ConfigValidationException if the run config
     *                                  does not satisfy a planned step's schema.
     * @throws IllegalStateException    if the engine is closed.
     */
    public RunHandle executeAsync(ExecutionPlan plan, String runId, RunConfig runConfig) {
        if (closed)
            throw new IllegalStateException("Execution engine is closed");
        if (runId == null || runId.isBlank())
            throw new IllegalArgumentException("Run id must not be blank");
        Map<String, StepConfig> configs = validateConfig(plan, runConfig);
        checkIoManagers(plan);
        if (!usedRunIds.add(runId))
            throw new IllegalArgumentException("Run id already used: " + runId);

        RunExecution execution = new RunExecution(runId, plan, configs, ioManagers, eventLog, dispatcher,
                workers, timer, config.defaultRetryPolicy(), clock);
        activeRuns.put(runId, execution);
        execution.future().whenComplete((result, error) -> activeRuns.remove(runId));
        execution.start();
        return new RunHandle(runId, execution);
    }

    private static Map<String, StepConfig> validateConfig(ExecutionPlan plan, RunConfig runConfig) {
        Map<String, StepConfig> configs = new HashMap<>();
        for (PlannedInvocation inv : plan.invocations()) {
            String step = inv.stepName();
            configs.put(step, inv.step().configSchema().validate(step, runConfig.forStep(step)));
        }
        for (String step : runConfig.stepNames())
            if (plan.invocation(step) == null)
                log.debug("Run config for step '{}' ignored: step is not part of the plan", step);
        return configs;
    }

    private void checkIoManagers(ExecutionPlan plan) {
        Set<String> missing = new TreeSet<>();
        for (PlannedInvocation inv : plan.invocations()) {
            for (OutputSlot slot : inv.step().outputs())
                if (inv.requestedOutputs().contains(slot.key()) && !ioManagers.containsKey(slot.ioManagerKey()))
                    missing.add(slot.ioManagerKey() + " (output " + slot.key() + ")");
            for (InputBinding b : inv.inputs())
                if (b.mode() == InputBinding.Mode.WAIT_AND_FETCH && !ioManagers.containsKey(b.ioManagerKey()))
                    missing.add(b.ioManagerKey() + " (input " + b.upstreamKey() + " of " + inv.stepName() + ")");
        }
        if (!missing.isEmpty())
            throw new IllegalArgumentException("Plan references unregistered I/O managers: " + missing);
    }

    /**
     * Cancels active runs, waits for in-flight computations, then drains queued
     * run events to the listeners.
     */
    @Override
    public void close() {
        if (closed)
            return;
        closed = true;
        for (RunExecution run : activeRuns.values())
            run.cancel();
        workers.shutdown();
        try {
            if (!workers.awaitTermination(config.getShutdownTimeoutMillis(), TimeUnit.MILLISECONDS))
                log.warn("Workers still busy after {} ms", config.getShutdownTimeoutMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        timer.shutdownNow();
        dispatcher.close();
        log.info("Execution engine closed");
    }
}
