package com.pipeline.adg.engine;

import com.pipeline.adg.api.IoManager;
import com.pipeline.adg.api.MaterializationLog;
import com.pipeline.adg.api.OutputResult;
import com.pipeline.adg.api.RunListener;
import com.pipeline.adg.api.StepOutputs;
import com.pipeline.adg.api.UpstreamOutcome;
import com.pipeline.adg.asset.AssetKey;
import com.pipeline.adg.asset.MaterializationEvent;
import com.pipeline.adg.asset.OutputSlot;
import com.pipeline.adg.asset.RetryPolicy;
import com.pipeline.adg.asset.Step;
import com.pipeline.adg.config.StepConfig;
import com.pipeline.adg.error.LoadException;
import com.pipeline.adg.error.MissingRequiredOutputException;
import com.pipeline.adg.error.StepFailedException;
import com.pipeline.adg.error.StoreException;
import com.pipeline.adg.error.UpstreamFailedException;
import com.pipeline.adg.plan.ExecutionPlan;
import com.pipeline.adg.plan.InputBinding;
import com.pipeline.adg.plan.PlannedInvocation;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * State machine of one run.
 *
 * Scheduling state (statuses, pending upstream counts, slot outcomes) is guarded
 * by this object's monitor. Input loading, the computation itself and storing
 * outputs happen on a worker thread without holding the monitor, so independent
 * invocations run in parallel. A retry delay is a timer task that re-enqueues the
 * attempt; no worker waits during the delay.
 */
final class RunExecution {
    private static final Logger log = LogManager.getLogger(RunExecution.class);

    private final String runId;
    private final ExecutionPlan plan;
    private final Map<String, StepConfig> configs;
    private final Map<String, IoManager> ioManagers;
    private final MaterializationLog eventLog;
    private final RunListener listener;
    private final ExecutorService workers;
    private final ScheduledExecutorService timer;
    private final RetryPolicy defaultRetry;
    private final Clock clock;

    private final Map<String, State> states = new LinkedHashMap<>();
    private final CompletableFuture<RunResult> future = new CompletableFuture<>();
    private volatile boolean cancelled;
    private int remaining;
    private Instant startedAt;

    RunExecution(String runId, ExecutionPlan plan, Map<String, StepConfig> configs,
            Map<String, IoManager> ioManagers, MaterializationLog eventLog, RunListener listener,
            ExecutorService workers, ScheduledExecutorService timer, RetryPolicy defaultRetry,
            Clock clock) {
        this.runId = runId;
        this.plan = plan;
        this.configs = configs;
        this.ioManagers = ioManagers;
        this.eventLog = eventLog;
        this.listener = listener;
        this.workers = workers;
        this.timer = timer;
        this.defaultRetry = defaultRetry;
        this.clock = clock;
        for (PlannedInvocation inv : plan.invocations())
            states.put(inv.stepName(), new State(inv));
    }

    CompletableFuture<RunResult> future() {
        return future;
    }

    boolean isCancelled() {
        return cancelled;
    }

    void start() {
        startedAt = clock.instant();
        log.info("Run {} started: {} invocation(s) over {} key(s) of graph '{}'",
                runId, plan.size(), plan.selectedKeys().size(), plan.graphName());
        listener.onRunStart(runId, plan);
        synchronized (this) {
            remaining = states.size();
            if (remaining == 0) {
                finishRun();
                return;
            }
            for (State s : states.values())
                if (s.waiting == 0 && s.status == InvocationStatus.PENDING)
                    schedule(s);
        }
    }

    synchronized void cancel() {
        if (cancelled || future.isDone())
            return;
        cancelled = true;
        log.info("Run {} cancellation requested", runId);
        for (State s : states.values())
            if (s.status == InvocationStatus.PENDING
                    || (s.status == InvocationStatus.RUNNING && s.awaitingRetry))
                cancelInvocation(s);
    }

    // ---- scheduling, under the monitor ----

    private void schedule(State s) {
        if (cancelled) {
            cancelInvocation(s);
            return;
        }
        PlannedInvocation inv = s.invocation;
        Map<AssetKey, String> blocked = new LinkedHashMap<>();
        for (AssetKey out : inv.requestedOutputs()) {
            for (InputBinding b : inv.inputsFor(out)) {
                if (b.mode() == InputBinding.Mode.WAIT_AND_FETCH && !b.isExternal() && !materializedInRun(b)) {
                    blocked.put(out, "loaded input " + b.upstreamKey() + " was not materialized");
                    break;
                }
            }
        }

        if (blocked.size() == inv.requestedOutputs().size()) {
            blocked.forEach((key, reason) -> s.outcomes.put(key, SlotOutcome.skipped(key, reason)));
            log.debug("Run {} step '{}' skipped without invocation: {}", runId, inv.stepName(), blocked.values());
            terminate(s, InvocationStatus.SKIPPED);
            return;
        }

        Set<AssetKey> effective = new LinkedHashSet<>(inv.requestedOutputs());
        if (!blocked.isEmpty() && inv.step().isSubsettable()) {
            effective.removeAll(blocked.keySet());
            blocked.forEach((key, reason) -> s.outcomes.put(key, SlotOutcome.skipped(key, reason)));
            log.debug("Run {} step '{}' narrowed to {}", runId, inv.stepName(), effective);
        }
        s.effectiveOutputs = Collections.unmodifiableSet(effective);
        s.status = InvocationStatus.RUNNING;
        s.startedAt = clock.instant();
        submit(s);
    }

    private void submit(State s) {
        try {
            workers.execute(() -> runAttempt(s));
        } catch (RejectedExecutionException e) {
            fail(s, new IllegalStateException("Execution engine is shut down", e));
        }
    }

    private boolean materializedInRun(InputBinding b) {
        State producer = states.get(b.producerStep());
        SlotOutcome outcome = producer == null ? null : producer.outcomes.get(b.upstreamKey());
        return outcome != null && outcome.isMaterialized();
    }

    private UpstreamOutcome upstreamOutcome(InputBinding b) {
        if (b.isExternal())
            return UpstreamOutcome.EXTERNAL;
        return materializedInRun(b) ? UpstreamOutcome.PRODUCED : UpstreamOutcome.DECLINED;
    }

    private void cancelInvocation(State s) {
        for (AssetKey key : s.invocation.requestedOutputs())
            s.outcomes.putIfAbsent(key, SlotOutcome.skipped(key, "run cancelled"));
        terminate(s, InvocationStatus.CANCELLED);
    }

    private synchronized void fail(State s, Throwable error) {
        if (s.status.isTerminal())
            return;
        s.error = error;
        for (AssetKey key : s.invocation.requestedOutputs())
            s.outcomes.putIfAbsent(key, SlotOutcome.failed(key, error));
        log.error("Run {} step '{}' failed: {}", runId, s.invocation.stepName(), error.getMessage());
        terminate(s, InvocationStatus.FAILED);

        String origin = s.invocation.stepName();
        Deque<String> queue = new ArrayDeque<>(plan.downstreamOf(origin));
        while (!queue.isEmpty()) {
            State d = states.get(queue.poll());
            if (d.status != InvocationStatus.PENDING)
                continue;
            UpstreamFailedException upstreamFailed = new UpstreamFailedException(d.invocation.stepName(), origin);
            d.error = upstreamFailed;
            d.failedUpstream = origin;
            for (AssetKey key : d.invocation.requestedOutputs())
                d.outcomes.putIfAbsent(key, SlotOutcome.failed(key, upstreamFailed));
            log.warn("Run {} step '{}' short-circuited by failure of '{}'", runId, d.invocation.stepName(), origin);
            terminate(d, InvocationStatus.FAILED);
            queue.addAll(plan.downstreamOf(d.invocation.stepName()));
        }
    }

    private void terminate(State s, InvocationStatus status) {
        s.status = status;
        s.awaitingRetry = false;
        s.finishedAt = clock.instant();
        log.debug("Run {} step '{}' -> {}", runId, s.invocation.stepName(), status);
        listener.onInvocationFinished(runId, s.toResult());

        if (status != InvocationStatus.FAILED) {
            for (String down : plan.downstreamOf(s.invocation.stepName())) {
                State d = states.get(down);
                if (--d.waiting == 0 && d.status == InvocationStatus.PENDING)
                    schedule(d);
            }
        }
        if (--remaining == 0)
            finishRun();
    }

    private void finishRun() {
        boolean anyFailed = false, anyCancelled = false;
        Map<String, InvocationResult> results = new LinkedHashMap<>();
        for (State s : states.values()) {
            results.put(s.invocation.stepName(), s.toResult());
            anyFailed |= s.status == InvocationStatus.FAILED;
            anyCancelled |= s.status == InvocationStatus.CANCELLED;
        }
        RunResult.RunStatus status = cancelled && anyCancelled ? RunResult.RunStatus.CANCELED
                : anyFailed ? RunResult.RunStatus.FAILED
                : RunResult.RunStatus.SUCCEEDED;
        RunResult result = new RunResult(runId, status, results, startedAt, clock.instant());
        log.info("Run {} finished {} in {} ms", runId, status, result.elapsed().toMillis());
        listener.onRunEnd(result);
        future.complete(result);
    }

    // ---- one attempt, on a worker thread ----

    private void runAttempt(State s) {
        PlannedInvocation inv = s.invocation;
        Step step = inv.step();
        int attempt;
        Set<AssetKey> effective;
        Map<String, InputBinding> bindings = new LinkedHashMap<>();
        Map<String, UpstreamOutcome> outcomes = new LinkedHashMap<>();
        List<InputBinding> toLoad = new ArrayList<>();
        synchronized (this) {
            if (s.status != InvocationStatus.RUNNING)
                return;
            s.awaitingRetry = false;
            attempt = ++s.attempts;
            effective = s.effectiveOutputs;
            Set<AssetKey> feeding = new HashSet<>();
            for (AssetKey out : effective)
                feeding.addAll(step.inputKeysFor(out));
            for (InputBinding b : inv.inputs()) {
                UpstreamOutcome outcome = upstreamOutcome(b);
                outcomes.put(b.parameterName(), outcome);
                if (!feeding.contains(b.upstreamKey()))
                    continue;
                bindings.put(b.parameterName(), b);
                if (b.mode() == InputBinding.Mode.WAIT_AND_FETCH && outcome != UpstreamOutcome.DECLINED)
                    toLoad.add(b);
            }
        }
        log.debug("Run {} step '{}' attempt {} requesting {}", runId, step.name(), attempt, effective);

        Map<String, Object> values = new HashMap<>();
        for (InputBinding b : toLoad) {
            try {
                values.put(b.parameterName(), ioManagers.get(b.ioManagerKey()).load(b.upstreamKey()));
            } catch (LoadException e) {
                fail(s, e);
                return;
            } catch (RuntimeException e) {
                fail(s, new LoadException("Failed to load " + b.upstreamKey() + " for step " + step.name(), e));
                return;
            }
        }

        DefaultStepContext context = new DefaultStepContext(runId, step.name(), attempt, effective, bindings,
                values, outcomes, configs.getOrDefault(step.name(), StepConfig.EMPTY), this::isCancelled);
        StepOutputs outputs;
        try {
            outputs = step.computation().compute(context);
        } catch (Exception e) {
            onRaised(s, e);
            return;
        } catch (Error e) {
            fail(s, new StepFailedException(step.name(), attempt, e));
            return;
        }
        commit(s, effective, outputs == null ? StepOutputs.none() : outputs);
    }

    private synchronized void onRaised(State s, Exception e) {
        Step step = s.invocation.step();
        if (cancelled) {
            log.warn("Run {} step '{}' raised after cancellation: {}", runId, step.name(), e.toString());
            cancelInvocation(s);
            return;
        }
        RetryPolicy policy = step.retryPolicy() != null ? step.retryPolicy() : defaultRetry;
        if (policy != null && policy.allowsRetry(s.attempts)) {
            Duration delay = policy.delayFor(s.attempts);
            s.retryDelays.add(delay);
            s.awaitingRetry = true;
            log.warn("Run {} step '{}' attempt {} failed, retry {}/{} in {} ms: {}", runId, step.name(), s.attempts,
                    s.attempts, policy.maxRetries(), delay.toMillis(), e.toString());
            try {
                timer.schedule(() -> resubmit(s), delay.toMillis(), TimeUnit.MILLISECONDS);
            } catch (RejectedExecutionException rejected) {
                fail(s, new IllegalStateException("Execution engine is shut down", rejected));
            }
            return;
        }
        fail(s, new StepFailedException(step.name(), s.attempts, e));
    }

    private synchronized void resubmit(State s) {
        if (s.status == InvocationStatus.RUNNING && s.awaitingRetry)
            submit(s);
    }

    private void commit(State s, Set<AssetKey> effective, StepOutputs outputs) {
        Step step = s.invocation.step();
        for (AssetKey key : effective) {
            OutputResult r = outputs.get(key);
            if ((r == null || !r.isProduced()) && step.output(key).required()) {
                fail(s, new MissingRequiredOutputException(step.name(), key));
                return;
            }
        }
        for (AssetKey key : outputs.results().keySet())
            if (!effective.contains(key))
                log.warn("Run {} step '{}' emitted {} which was not requested, ignored", runId, step.name(), key);

        for (AssetKey key : effective) {
            OutputResult r = outputs.get(key);
            if (r instanceof OutputResult.Produced produced) {
                OutputSlot slot = step.output(key);
                try {
                    ioManagers.get(slot.ioManagerKey()).store(key, produced.value(), produced.metadata());
                } catch (StoreException e) {
                    fail(s, e);
                    return;
                } catch (RuntimeException e) {
                    fail(s, new StoreException("Failed to store " + key + " for step " + step.name(), e));
                    return;
                }
                MaterializationEvent event = new MaterializationEvent(key, runId, step.name(), clock.instant(),
                        slot.codeVersion(), produced.metadata());
                eventLog.append(event);
                listener.onMaterialization(event);
                synchronized (this) {
                    s.outcomes.put(key, SlotOutcome.materialized(event));
                }
            } else {
                synchronized (this) {
                    s.outcomes.put(key, SlotOutcome.skipped(key, "declined"));
                }
            }
        }
        synchronized (this) {
            terminate(s, InvocationStatus.SUCCEEDED);
        }
    }

    private static final class State {
        final PlannedInvocation invocation;
        InvocationStatus status = InvocationStatus.PENDING;
        int waiting;
        int attempts;
        boolean awaitingRetry;
        Set<AssetKey> effectiveOutputs;
        final List<Duration> retryDelays = new ArrayList<>();
        final Map<AssetKey, SlotOutcome> outcomes = new HashMap<>();
        Throwable error;
        String failedUpstream;
        Instant startedAt;
        Instant finishedAt;

        State(PlannedInvocation invocation) {
            this.invocation = invocation;
            this.waiting = invocation.upstreamInvocations().size();
        }

        InvocationResult toResult() {
            Map<AssetKey, SlotOutcome> ordered = new LinkedHashMap<>();
            for (AssetKey key : invocation.requestedOutputs()) {
                SlotOutcome o = outcomes.get(key);
                if (o != null)
                    ordered.put(key, o);
            }
            return new InvocationResult(invocation.stepName(), status, ordered, attempts, retryDelays, error,
                    failedUpstream, startedAt, finishedAt);
        }
    }
}
