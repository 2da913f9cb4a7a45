package com.pipeline.adg.engine;

import com.pipeline.adg.api.RunListener;
import com.pipeline.adg.api.StepOutputs;
import com.pipeline.adg.api.UpstreamOutcome;
import com.pipeline.adg.asset.AssetKey;
import com.pipeline.adg.asset.MaterializationEvent;
import com.pipeline.adg.asset.RetryPolicy;
import com.pipeline.adg.config.ConfigSchema;
import com.pipeline.adg.config.EngineConfig;
import com.pipeline.adg.config.FieldType;
import com.pipeline.adg.config.RunConfig;
import com.pipeline.adg.decl.Declarations;
import com.pipeline.adg.decl.InputDeclaration;
import com.pipeline.adg.decl.OutputDeclaration;
import com.pipeline.adg.decl.SourceDeclaration;
import com.pipeline.adg.decl.StepDeclaration;
import com.pipeline.adg.error.ConfigValidationException;
import com.pipeline.adg.error.LoadException;
import com.pipeline.adg.error.MissingRequiredOutputException;
import com.pipeline.adg.error.StepFailedException;
import com.pipeline.adg.error.StoreException;
import com.pipeline.adg.error.UpstreamFailedException;
import com.pipeline.adg.plan.ExecutionPlan;
import com.pipeline.adg.plan.StepCompiler;
import com.pipeline.adg.storage.InMemoryIoManager;
import com.pipeline.adg.storage.InMemoryMaterializationLog;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.Assert.*;

public class ExecutionEngineTest {
    private static final AssetKey RAW = AssetKey.of("raw");
    private static final AssetKey A = AssetKey.of("a");
    private static final AssetKey B = AssetKey.of("b");
    private static final AssetKey C = AssetKey.of("c");
    private static final AssetKey D = AssetKey.of("d");

    private InMemoryIoManager io;
    private InMemoryMaterializationLog eventLog;
    private ExecutionEngine engine;

    @Before
    public void setUp() {
        io = new InMemoryIoManager();
        eventLog = new InMemoryMaterializationLog();
        EngineConfig config = EngineConfig.defaults();
        config.setMaxParallelism(4);
        config.setEventBufferSize(256);
        engine = ExecutionEngine.withIoManager(config, io, eventLog);
    }

    @After
    public void tearDown() {
        engine.close();
    }

    private static ExecutionPlan plan(Declarations declarations, Collection<AssetKey> keys) {
        AssetGraph graph = new GraphResolver().resolve(declarations);
        return new StepCompiler().compile(graph, keys);
    }

    private static ExecutionPlan planAll(Declarations declarations) {
        AssetGraph graph = new GraphResolver().resolve(declarations);
        return new StepCompiler().compile(graph, graph.topologicalOrder());
    }

    private static Declarations decls(StepDeclaration... steps) {
        return Declarations.of(List.of(SourceDeclaration.of(RAW)), List.of(steps));
    }

    private static StepDeclaration.Builder step(AssetKey output, boolean required) {
        return StepDeclaration.builder(output.toUserString())
                .output(required ? OutputDeclaration.required(output) : OutputDeclaration.optional(output));
    }

    @Test
    public void testSourceToComputedAsset() {
        io.put(RAW, List.of(1, 2, 3));
        StepDeclaration appended = step(A, true)
                .input(InputDeclaration.loaded("raw"))
                .compute(ctx -> {
                    List<Integer> values = new ArrayList<>(ctx.<List<Integer>>input("raw"));
                    values.add(4);
                    return StepOutputs.single(A, values);
                })
                .build();

        RunResult result = engine.execute(planAll(decls(appended)), "run-1");

        assertTrue(result.toString(), result.isSuccess());
        assertEquals(List.of(1, 2, 3, 4), io.load(A));
        assertEquals(Set.of(A), result.materializedKeys());
        MaterializationEvent event = eventLog.latest(A);
        assertEquals("run-1", event.runId());
        assertEquals("a", event.stepName());
        assertEquals(event, result.outcome(A).event());
        assertEquals(1, result.invocation("a").attempts());
    }

    @Test
    public void testDeclinedOutputSkipsLoadedChain() {
        AtomicInteger downstreamCalls = new AtomicInteger();
        StepDeclaration a = step(A, false).compute(ctx -> StepOutputs.builder().decline(A).build()).build();
        StepDeclaration b = step(B, false).input(InputDeclaration.loaded("a")).compute(ctx -> {
            downstreamCalls.incrementAndGet();
            return StepOutputs.single(B, 1);
        }).build();
        StepDeclaration c = step(C, false).input(InputDeclaration.loaded("b")).compute(ctx -> {
            downstreamCalls.incrementAndGet();
            return StepOutputs.single(C, 2);
        }).build();

        RunResult result = engine.execute(planAll(decls(a, b, c)), "run-skip");

        assertTrue(result.isSuccess());
        assertEquals(InvocationStatus.SUCCEEDED, result.statusOf("a"));
        assertEquals("declined", result.outcome(A).reason());
        assertEquals(InvocationStatus.SKIPPED, result.statusOf("b"));
        assertEquals(InvocationStatus.SKIPPED, result.statusOf("c"));
        assertEquals(0, result.invocation("b").attempts());
        assertEquals(0, result.invocation("c").attempts());
        assertTrue(result.outcome(B).reason(), result.outcome(B).reason().contains("a"));
        assertEquals(0, downstreamCalls.get());
        assertEquals(Set.of(A, B, C), result.skippedKeys());
        assertEquals(0, eventLog.size());
    }

    @Test
    public void testExplicitDependencyRunsAfterDecline() {
        AtomicReference<UpstreamOutcome> seen = new AtomicReference<>();
        StepDeclaration a = step(A, false).compute(ctx -> StepOutputs.none()).build();
        StepDeclaration b = step(B, true).input(InputDeclaration.explicit(A)).compute(ctx -> {
            seen.set(ctx.upstreamOutcome("a"));
            return StepOutputs.single(B, "ran");
        }).build();
        StepDeclaration c = step(C, true).input(InputDeclaration.loaded("b"))
                .compute(ctx -> StepOutputs.single(C, ctx.<String>input("b") + "!"))
                .build();

        RunResult result = engine.execute(planAll(decls(a, b, c)), "run-explicit");

        assertTrue(result.isSuccess());
        assertEquals(UpstreamOutcome.DECLINED, seen.get());
        assertEquals(InvocationStatus.SUCCEEDED, result.statusOf("b"));
        assertEquals("ran!", io.load(C));
    }

    @Test
    public void testRetryWithExponentialBackoff() {
        RetryPolicy policy = new RetryPolicy(3, Duration.ofMillis(10), RetryPolicy.Backoff.EXPONENTIAL,
                RetryPolicy.Jitter.NONE);
        StepDeclaration flaky = step(A, true).retryPolicy(policy).compute(ctx -> {
            if (ctx.attempt() < 4)
                throw new IllegalStateException("transient " + ctx.attempt());
            return StepOutputs.single(A, "done");
        }).build();

        RunResult result = engine.execute(planAll(decls(flaky)), "run-retry");

        InvocationResult inv = result.invocation("a");
        assertEquals(InvocationStatus.SUCCEEDED, inv.status());
        assertEquals(4, inv.attempts());
        assertEquals(List.of(Duration.ofMillis(10), Duration.ofMillis(20), Duration.ofMillis(40)), inv.retryDelays());
        assertEquals("done", io.load(A));
    }

    @Test
    public void testRetriesExhausted() {
        StepDeclaration broken = step(A, true).retryPolicy(RetryPolicy.of(1)).compute(ctx -> {
            throw new IllegalStateException("always");
        }).build();

        RunResult result = engine.execute(planAll(decls(broken)), "run-exhausted");

        assertEquals(RunResult.RunStatus.FAILED, result.status());
        InvocationResult inv = result.invocation("a");
        assertEquals(2, inv.attempts());
        assertTrue(inv.error() instanceof StepFailedException);
        assertEquals(2, ((StepFailedException) inv.error()).attempts());
        assertEquals("always", inv.error().getCause().getMessage());
        assertEquals(SlotOutcome.Kind.FAILED, result.outcome(A).kind());
    }

    @Test
    public void testThreeExponentialRetriesThenFailure() {
        AtomicInteger calls = new AtomicInteger();
        RetryPolicy policy = RetryPolicy.of(3, Duration.ofMillis(5)).withBackoff(RetryPolicy.Backoff.EXPONENTIAL);
        StepDeclaration broken = step(A, true).retryPolicy(policy).compute(ctx -> {
            calls.incrementAndGet();
            throw new IllegalStateException("always");
        }).build();

        RunResult result = engine.execute(planAll(decls(broken)), "run-backoff-exhausted");

        assertEquals(RunResult.RunStatus.FAILED, result.status());
        InvocationResult inv = result.invocation("a");
        assertEquals(InvocationStatus.FAILED, inv.status());
        assertEquals(4, inv.attempts());
        assertEquals(4, calls.get());
        assertEquals(List.of(Duration.ofMillis(5), Duration.ofMillis(10), Duration.ofMillis(20)), inv.retryDelays());
        assertEquals(4, ((StepFailedException) inv.error()).attempts());
        assertFalse(io.contains(A));
        assertEquals(0, eventLog.size());
    }

    @Test
    public void testMissingRequiredOutputIsNotRetried() {
        StepDeclaration silent = step(A, true).retryPolicy(RetryPolicy.of(3))
                .compute(ctx -> StepOutputs.none())
                .build();

        RunResult result = engine.execute(planAll(decls(silent)), "run-missing");

        InvocationResult inv = result.invocation("a");
        assertEquals(InvocationStatus.FAILED, inv.status());
        assertEquals(1, inv.attempts());
        assertTrue(inv.error() instanceof MissingRequiredOutputException);
        assertEquals(A, ((MissingRequiredOutputException) inv.error()).key());
        assertFalse(io.contains(A));
        assertEquals(0, eventLog.size());
    }

    @Test
    public void testFailureShortCircuitsDownstream() {
        StepDeclaration a = step(A, true).compute(ctx -> {
            throw new IllegalArgumentException("bad data");
        }).build();
        StepDeclaration b = step(B, true).input(InputDeclaration.loaded("a"))
                .compute(ctx -> StepOutputs.single(B, 1)).build();
        StepDeclaration c = step(C, true).input(InputDeclaration.explicit(B))
                .compute(ctx -> StepOutputs.single(C, 1)).build();
        io.put(RAW, "x");
        StepDeclaration d = step(D, true).input(InputDeclaration.loaded("raw"))
                .compute(ctx -> StepOutputs.single(D, ctx.input("raw"))).build();

        RunResult result = engine.execute(planAll(decls(a, b, c, d)), "run-fail");

        assertEquals(RunResult.RunStatus.FAILED, result.status());
        assertEquals(InvocationStatus.SUCCEEDED, result.statusOf("d"));
        assertEquals(List.of("a"), result.originFailures().stream().map(InvocationResult::stepName).toList());
        assertEquals(List.of("b", "c"), result.shortCircuitedBy("a"));

        InvocationResult c1 = result.invocation("c");
        assertEquals(InvocationStatus.FAILED, c1.status());
        assertEquals(0, c1.attempts());
        assertTrue(c1.isShortCircuited());
        assertEquals("a", ((UpstreamFailedException) c1.error()).originStep());
        assertEquals(Set.of(A, B, C), result.failedKeys());
    }

    @Test
    public void testSubsetRequestsOnlySelectedOutput() {
        List<Set<AssetKey>> requested = new CopyOnWriteArrayList<>();
        StepDeclaration multi = StepDeclaration.builder("multi")
                .output(OutputDeclaration.optional(A))
                .output(OutputDeclaration.optional(B))
                .subsettable(true)
                .compute(ctx -> {
                    requested.add(ctx.requestedOutputs());
                    StepOutputs.Builder out = StepOutputs.builder();
                    for (AssetKey key : ctx.requestedOutputs())
                        out.produce(key, key.toUserString());
                    return out.build();
                })
                .build();

        RunResult result = engine.execute(plan(decls(multi), List.of(A)), "run-subset");

        assertEquals(List.of(Set.of(A)), requested);
        assertEquals(Set.of(A), result.executedKeys());
        assertTrue(io.contains(A));
        assertFalse(io.contains(B));
    }

    @Test
    public void testSubsettableStepNarrowedAroundDeclinedInput() {
        AtomicReference<Set<AssetKey>> requested = new AtomicReference<>();
        StepDeclaration up = StepDeclaration.builder("up")
                .output(OutputDeclaration.optional(A))
                .output(OutputDeclaration.optional(B))
                .subsettable(true)
                .compute(ctx -> StepOutputs.builder().decline(A).produce(B, "b").build())
                .build();
        StepDeclaration down = StepDeclaration.builder("down")
                .output(OutputDeclaration.optional(C))
                .output(OutputDeclaration.optional(D))
                .input(InputDeclaration.loaded("a"))
                .input(InputDeclaration.loaded("b"))
                .internalDependency(C, "a")
                .internalDependency(D, "b")
                .subsettable(true)
                .compute(ctx -> {
                    requested.set(ctx.requestedOutputs());
                    return StepOutputs.single(D, ctx.<String>input("b") + "d");
                })
                .build();

        RunResult result = engine.execute(planAll(decls(up, down)), "run-narrow");

        assertEquals(Set.of(D), requested.get());
        assertEquals(InvocationStatus.SUCCEEDED, result.statusOf("down"));
        assertEquals(SlotOutcome.Kind.SKIPPED, result.outcome(C).kind());
        assertTrue(result.outcome(C).reason().contains("a"));
        assertEquals("bd", io.load(D));
    }

    @Test
    public void testWholeStepSeesDeclinedInput() {
        AtomicReference<UpstreamOutcome> seen = new AtomicReference<>();
        AtomicReference<Boolean> hadInput = new AtomicReference<>();
        StepDeclaration up = StepDeclaration.builder("up")
                .output(OutputDeclaration.optional(A))
                .output(OutputDeclaration.optional(B))
                .compute(ctx -> StepOutputs.builder().produce(B, "b").build())
                .build();
        StepDeclaration down = StepDeclaration.builder("down")
                .output(OutputDeclaration.optional(C))
                .output(OutputDeclaration.optional(D))
                .input(InputDeclaration.loaded("a"))
                .input(InputDeclaration.loaded("b"))
                .internalDependency(C, "a")
                .internalDependency(D, "b")
                .compute(ctx -> {
                    seen.set(ctx.upstreamOutcome("a"));
                    hadInput.set(ctx.hasInput("a"));
                    try {
                        ctx.input("a");
                        fail("declined input must not be readable");
                    } catch (IllegalArgumentException expected) {
                    }
                    return StepOutputs.single(D, "d");
                })
                .build();

        RunResult result = engine.execute(planAll(decls(up, down)), "run-whole");

        assertTrue(result.isSuccess());
        assertEquals(UpstreamOutcome.DECLINED, seen.get());
        assertFalse(hadInput.get());
        assertEquals(Set.of(C, D), result.invocation("down").outcomes().keySet());
        assertEquals("declined", result.outcome(C).reason());
    }

    @Test
    public void testLoadFailure() {
        AtomicInteger calls = new AtomicInteger();
        StepDeclaration a = step(A, true).input(InputDeclaration.loaded("raw")).compute(ctx -> {
            calls.incrementAndGet();
            return StepOutputs.single(A, 1);
        }).build();

        RunResult result = engine.execute(planAll(decls(a)), "run-load");

        assertEquals(InvocationStatus.FAILED, result.statusOf("a"));
        assertTrue(result.invocation("a").error() instanceof LoadException);
        assertEquals(0, calls.get());
    }

    @Test
    public void testStoreFailure() {
        InMemoryIoManager failing = new InMemoryIoManager() {
            @Override
            public void store(AssetKey key, Object value, Map<String, Object> meta) {
                throw new IllegalStateException("disk full");
            }
        };
        try (ExecutionEngine other = ExecutionEngine.withIoManager(EngineConfig.defaults(), failing, eventLog)) {
            StepDeclaration a = step(A, true).compute(ctx -> StepOutputs.single(A, 1)).build();
            RunResult result = other.execute(planAll(decls(a)), "run-store");

            InvocationResult inv = result.invocation("a");
            assertEquals(InvocationStatus.FAILED, inv.status());
            assertTrue(inv.error() instanceof StoreException);
            assertEquals("disk full", inv.error().getCause().getMessage());
            assertEquals(0, eventLog.size());
        }
    }

    @Test
    public void testIndependentStepsRunConcurrently() {
        CountDownLatch bothRunning = new CountDownLatch(2);
        StepDeclaration a = step(A, true).compute(ctx -> {
            bothRunning.countDown();
            if (!bothRunning.await(5, TimeUnit.SECONDS))
                throw new IllegalStateException("sibling never started");
            return StepOutputs.single(A, 1);
        }).build();
        StepDeclaration b = step(B, true).compute(ctx -> {
            bothRunning.countDown();
            if (!bothRunning.await(5, TimeUnit.SECONDS))
                throw new IllegalStateException("sibling never started");
            return StepOutputs.single(B, 2);
        }).build();

        RunResult result = engine.execute(planAll(decls(a, b)), "run-parallel");

        assertTrue(result.toString(), result.isSuccess());
    }

    @Test
    public void testCancellation() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        StepDeclaration a = step(A, true).compute(ctx -> {
            started.countDown();
            while (!ctx.isCancelled())
                Thread.sleep(5);
            throw new InterruptedException("cancelled");
        }).build();
        StepDeclaration b = step(B, true).input(InputDeclaration.loaded("a"))
                .compute(ctx -> StepOutputs.single(B, 1)).build();

        RunHandle handle = engine.executeAsync(planAll(decls(a, b)), "run-cancel");
        assertTrue(started.await(5, TimeUnit.SECONDS));
        handle.cancel();
        RunResult result = handle.await(5, TimeUnit.SECONDS);

        assertTrue(handle.isCancelled());
        assertEquals(RunResult.RunStatus.CANCELED, result.status());
        assertEquals(InvocationStatus.CANCELLED, result.statusOf("a"));
        assertEquals(InvocationStatus.CANCELLED, result.statusOf("b"));
        assertEquals("run cancelled", result.outcome(B).reason());
        assertFalse(io.contains(A));
    }

    @Test
    public void testRunConfigValidatedBeforeStart() {
        AtomicInteger limit = new AtomicInteger();
        StepDeclaration a = step(A, true)
                .configSchema(ConfigSchema.builder().required("limit", FieldType.INT).build())
                .compute(ctx -> {
                    limit.set(ctx.config().getInt("limit"));
                    return StepOutputs.single(A, 1);
                })
                .build();
        ExecutionPlan plan = planAll(decls(a));

        try {
            engine.execute(plan, "run-bad-config");
            fail("missing required field must be rejected");
        } catch (ConfigValidationException e) {
            assertFalse(e.problems().isEmpty());
        }
        assertEquals(0, eventLog.size());

        RunResult result = engine.execute(plan, "run-good-config", RunConfig.builder().set("a", "limit", 5).build());
        assertTrue(result.isSuccess());
        assertEquals(5, limit.get());
    }

    @Test
    public void testRunIdCannotBeReused() {
        ExecutionPlan plan = planAll(decls(step(A, true).compute(ctx -> StepOutputs.single(A, 1)).build()));
        engine.execute(plan, "run-once");
        try {
            engine.execute(plan, "run-once");
            fail("run id reuse must be rejected");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage().contains("run-once"));
        }
        assertEquals(1, eventLog.size());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownIoManagerRejected() {
        StepDeclaration a = StepDeclaration.builder("a")
                .output(OutputDeclaration.required(A).withIoManager("warehouse"))
                .compute(ctx -> StepOutputs.single(A, 1))
                .build();
        engine.execute(planAll(decls(a)), "run-io");
    }

    @Test
    public void testEmptyPlanSucceeds() {
        RunResult result = engine.execute(plan(decls(), List.of(RAW)), "run-empty");
        assertTrue(result.isSuccess());
        assertTrue(result.invocations().isEmpty());
    }

    @Test
    public void testDefaultRetryFromEngineConfig() {
        try (ExecutionEngine other = ExecutionEngine.withIoManager(EngineConfig.fromResource("engine-test.json"), io,
                eventLog)) {
            StepDeclaration broken = step(A, true).compute(ctx -> {
                throw new IllegalStateException("down");
            }).build();
            InvocationResult inv = other.execute(planAll(decls(broken)), "run-default-retry").invocation("a");
            assertEquals(3, inv.attempts());
            assertEquals(List.of(Duration.ofMillis(5), Duration.ofMillis(10)), inv.retryDelays());
        }
    }

    @Test
    public void testListenersReceiveRunEvents() {
        List<String> events = new CopyOnWriteArrayList<>();
        engine.addListener(new RunListener() {
            @Override
            public void onRunStart(String runId, ExecutionPlan plan) {
                events.add("start " + runId);
            }

            @Override
            public void onMaterialization(MaterializationEvent event) {
                events.add("materialized " + event.key());
            }

            @Override
            public void onInvocationFinished(String runId, InvocationResult result) {
                events.add("finished " + result.stepName() + " " + result.status());
            }

            @Override
            public void onRunEnd(RunResult result) {
                events.add("end " + result.status());
            }
        });
        StepDeclaration a = step(A, true).compute(ctx -> StepOutputs.single(A, 1)).build();
        engine.execute(planAll(decls(a)), "run-events");
        engine.close();

        assertEquals(List.of("start run-events", "materialized " + A, "finished a SUCCEEDED", "end SUCCEEDED"),
                events);
    }

    @Test(expected = IllegalStateException.class)
    public void testClosedEngineRejectsRuns() {
        engine.close();
        engine.execute(planAll(decls(step(A, true).compute(ctx -> StepOutputs.single(A, 1)).build())), "late");
    }
}
