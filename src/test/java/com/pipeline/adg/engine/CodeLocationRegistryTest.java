package com.pipeline.adg.engine;

import com.pipeline.adg.api.StepOutputs;
import com.pipeline.adg.asset.AssetKey;
import com.pipeline.adg.asset.DependencyKind;
import com.pipeline.adg.decl.Declarations;
import com.pipeline.adg.decl.InputDeclaration;
import com.pipeline.adg.decl.OutputDeclaration;
import com.pipeline.adg.decl.SourceDeclaration;
import com.pipeline.adg.decl.StepDeclaration;
import com.pipeline.adg.error.DuplicateKeyException;
import com.pipeline.adg.error.UnknownDependencyException;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class CodeLocationRegistryTest {
    private static final AssetKey EVENTS = AssetKey.of("events");
    private static final AssetKey SESSIONS = AssetKey.of("sessions");
    private static final AssetKey DASHBOARD = AssetKey.of("dashboard");

    private final CodeLocationRegistry registry = new CodeLocationRegistry(new GraphResolver());

    private static StepDeclaration step(AssetKey output, InputDeclaration... inputs) {
        StepDeclaration.Builder b = StepDeclaration.builder(output.toUserString()).output(OutputDeclaration.required(output));
        for (InputDeclaration in : inputs)
            b.input(in);
        return b.compute(ctx -> StepOutputs.none()).build();
    }

    private static Declarations ingest() {
        return Declarations.of(List.of(SourceDeclaration.of(EVENTS)),
                List.of(step(SESSIONS, InputDeclaration.loaded("events"))));
    }

    private static Declarations reporting() {
        // sessions is computed by the ingest location; here it is only a source reference
        return Declarations.of(List.of(SourceDeclaration.of(SESSIONS)),
                List.of(step(DASHBOARD, InputDeclaration.loaded("sessions"))));
    }

    @Test
    public void testLocationsResolveIndependently() {
        registry.register("ingest", ingest());
        registry.register("reporting", reporting());

        assertTrue(registry.locationGraph("reporting").isSource(SESSIONS));
        assertFalse(registry.locationGraph("ingest").isSource(SESSIONS));
        assertEquals(2, registry.locationGraphs().size());
    }

    @Test
    public void testWorkspaceBindsSourceReferenceToComputedAsset() {
        registry.register("ingest", ingest());
        registry.register("reporting", reporting());

        AssetGraph workspace = registry.workspaceGraph();
        assertEquals("workspace", workspace.name());
        assertEquals(3, workspace.size());
        assertFalse(workspace.isSource(SESSIONS));
        assertEquals(List.of(SESSIONS), workspace.parents(DASHBOARD));
        assertEquals(DependencyKind.LOADED, workspace.node(DASHBOARD).dependencies().get(0).kind());
        assertEquals(List.of(EVENTS, SESSIONS, DASHBOARD), workspace.topologicalOrder());
    }

    @Test
    public void testOwnerPrefersComputingLocation() {
        registry.register("reporting", reporting());
        registry.register("ingest", ingest());
        assertEquals("ingest", registry.owner(SESSIONS));
        assertEquals("reporting", registry.owner(DASHBOARD));
        assertEquals("ingest", registry.owner(EVENTS));
        assertNull(registry.owner(AssetKey.of("unknown")));
    }

    @Test
    public void testKeyComputedTwiceNamesBothLocations() {
        registry.register("ingest", ingest());
        registry.register("copy", Declarations.of(List.of(SourceDeclaration.of(EVENTS)),
                List.of(step(SESSIONS, InputDeclaration.loaded("events")).withSite("copy.py:3"))));
        try {
            registry.workspaceGraph();
            fail("duplicate computed key must be rejected");
        } catch (DuplicateKeyException e) {
            assertTrue(e.firstSite(), e.firstSite().startsWith("ingest:"));
            assertEquals("copy:copy.py:3", e.secondSite());
        }
    }

    @Test
    public void testBrokenLocationRejectedWithoutTouchingOthers() {
        registry.register("ingest", ingest());
        try {
            registry.register("broken", Declarations.of(List.of(),
                    List.of(step(DASHBOARD, InputDeclaration.loaded("missing")))));
            fail("unresolvable location must be rejected");
        } catch (UnknownDependencyException expected) {
        }
        assertNull(registry.locationGraph("broken"));
        assertEquals(2, registry.workspaceGraph().size());
    }

    @Test
    public void testUnregister() {
        registry.register("ingest", ingest());
        registry.register("reporting", reporting());
        assertTrue(registry.unregister("ingest"));
        assertFalse(registry.unregister("ingest"));
        assertTrue(registry.workspaceGraph().isSource(SESSIONS));
    }
}
