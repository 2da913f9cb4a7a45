package com.pipeline.adg;

import com.pipeline.adg.api.StepOutputs;
import com.pipeline.adg.asset.AssetKey;
import com.pipeline.adg.config.EngineConfig;
import com.pipeline.adg.config.RunConfig;
import com.pipeline.adg.decl.Declarations;
import com.pipeline.adg.decl.InputDeclaration;
import com.pipeline.adg.decl.OutputDeclaration;
import com.pipeline.adg.decl.SourceDeclaration;
import com.pipeline.adg.decl.StepDeclaration;
import com.pipeline.adg.engine.InvocationStatus;
import com.pipeline.adg.engine.RunHandle;
import com.pipeline.adg.engine.RunResult;
import com.pipeline.adg.error.CyclicDependencyException;
import com.pipeline.adg.select.AssetSelection;
import com.pipeline.adg.storage.InMemoryIoManager;
import com.pipeline.adg.util.RunMetricsListener;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.*;

public class MaterializerTest {
    private static final AssetKey RAW = AssetKey.of("raw");
    private static final AssetKey DOUBLED = AssetKey.of("doubled");
    private static final AssetKey TOTAL = AssetKey.of("total");

    private InMemoryIoManager io;
    private Materializer materializer;

    private static Declarations declarations(String totalVersion) {
        StepDeclaration doubled = StepDeclaration.builder("doubled")
                .output(OutputDeclaration.required(DOUBLED).withCodeVersion("1"))
                .input(InputDeclaration.loaded("raw"))
                .compute(ctx -> StepOutputs.single(DOUBLED, ctx.<Integer>input("raw") * 2))
                .build();
        StepDeclaration total = StepDeclaration.builder("total")
                .output(OutputDeclaration.required(TOTAL).withCodeVersion(totalVersion))
                .input(InputDeclaration.loaded("doubled"))
                .compute(ctx -> StepOutputs.single(TOTAL, ctx.<Integer>input("doubled") + 1))
                .build();
        return Declarations.of(List.of(SourceDeclaration.of(RAW)), List.of(doubled, total));
    }

    @Before
    public void setUp() {
        io = new InMemoryIoManager().put(RAW, 20);
        materializer = Materializer.builder(declarations("1"))
                .graphName("numbers")
                .engineConfig(EngineConfig.defaults())
                .ioManager(io)
                .build();
    }

    @After
    public void tearDown() {
        materializer.close();
    }

    @Test
    public void testRunSelectionAndStaleness() {
        assertEquals(Set.of(DOUBLED, TOTAL), materializer.staleness().staleKeys());

        RunResult result = materializer.submitRun(AssetSelection.keys(TOTAL).upstream(), "run-1");

        assertTrue(result.isSuccess());
        assertEquals(41, io.load(TOTAL));
        assertTrue(materializer.staleness().staleKeys().isEmpty());
        assertEquals(2, materializer.eventLog().eventsForRun("run-1").size());
    }

    @Test
    public void testReloadWithNewVersionMakesKeyStale() {
        materializer.submitRun(AssetSelection.all(), "run-1");
        assertFalse(materializer.isStale(TOTAL));

        materializer.reload(declarations("2"));

        assertTrue(materializer.isStale(TOTAL));
        assertFalse(materializer.isStale(DOUBLED));
        RunResult rerun = materializer.submitRun(AssetSelection.keys(TOTAL), "run-2");
        assertEquals(Set.of(TOTAL), rerun.executedKeys());
        assertFalse(materializer.isStale(TOTAL));
    }

    @Test
    public void testFailedReloadKeepsCurrentGraph() {
        StepDeclaration loop = StepDeclaration.builder("loop")
                .output(OutputDeclaration.required(AssetKey.of("loop")))
                .input(InputDeclaration.loaded("loop2"))
                .compute(ctx -> StepOutputs.none())
                .build();
        StepDeclaration loop2 = StepDeclaration.builder("loop2")
                .output(OutputDeclaration.required(AssetKey.of("loop2")))
                .input(InputDeclaration.loaded("loop"))
                .compute(ctx -> StepOutputs.none())
                .build();
        try {
            materializer.reload(Declarations.of(List.of(), List.of(loop, loop2)));
            fail("cyclic declarations must be rejected");
        } catch (CyclicDependencyException expected) {
        }
        assertEquals(3, materializer.graph().size());
        assertEquals("numbers", materializer.graph().name());
    }

    @Test
    public void testRunIdReuseRejected() {
        materializer.submitRun(AssetSelection.keys(DOUBLED), "same");
        try {
            materializer.submitRun(AssetSelection.keys(DOUBLED), "same");
            fail("run id reuse must be rejected");
        } catch (IllegalArgumentException expected) {
        }
    }

    @Test
    public void testAsyncRunAndMetrics() throws Exception {
        RunMetricsListener metrics = materializer.enableRunMetrics();
        RunHandle handle = materializer.submitRunAsync(materializer.plan(AssetSelection.all()), "async-1",
                RunConfig.empty());
        RunResult result = handle.await(5, TimeUnit.SECONDS);
        assertEquals(InvocationStatus.SUCCEEDED, result.statusOf("total"));
        assertTrue(handle.isDone());

        materializer.close();
        assertEquals(1, metrics.totalRuns());
        assertEquals(2, metrics.materializations());
        assertEquals(2, metrics.invocations(InvocationStatus.SUCCEEDED));
    }

    @Test
    public void testExplainUsesEventLog() {
        materializer.submitRun(AssetSelection.keys(DOUBLED), "run-x");
        assertTrue(materializer.explain().explainNode(DOUBLED).contains("run-x"));
        assertTrue(materializer.explain().dumpTopology().contains("Graph 'numbers'"));
    }

    @Test(expected = IllegalStateException.class)
    public void testIoManagerRequired() {
        Materializer.builder(declarations("1")).build();
    }
}
