package com.pipeline.adg.engine;

import com.pipeline.adg.api.StepOutputs;
import com.pipeline.adg.asset.AssetKey;
import com.pipeline.adg.asset.MaterializationEvent;
import com.pipeline.adg.decl.Declarations;
import com.pipeline.adg.decl.InputDeclaration;
import com.pipeline.adg.decl.OutputDeclaration;
import com.pipeline.adg.decl.SourceDeclaration;
import com.pipeline.adg.decl.StepDeclaration;
import com.pipeline.adg.error.UnknownDependencyException;
import com.pipeline.adg.storage.InMemoryMaterializationLog;
import org.junit.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.Assert.*;

public class StalenessTrackerTest {
    private static final AssetKey RAW = AssetKey.of("raw");
    private static final AssetKey CLEAN = AssetKey.of("clean");

    private final InMemoryMaterializationLog eventLog = new InMemoryMaterializationLog();

    private static AssetGraph graph(String cleanVersion) {
        StepDeclaration clean = StepDeclaration.builder("clean")
                .output(OutputDeclaration.required(CLEAN).withCodeVersion(cleanVersion))
                .input(InputDeclaration.loaded("raw"))
                .compute(ctx -> StepOutputs.none())
                .build();
        return new GraphResolver().resolve(Declarations.of(List.of(SourceDeclaration.of(RAW)), List.of(clean)));
    }

    private void materialize(AssetKey key, String version) {
        eventLog.append(new MaterializationEvent(key, "run-" + eventLog.size(), "clean", Instant.now(), version,
                Map.of()));
    }

    @Test
    public void testNeverMaterializedIsStale() {
        StalenessTracker tracker = new StalenessTracker(graph("1"), eventLog);
        StalenessTracker.Status status = tracker.status(CLEAN);
        assertTrue(status.isStale());
        assertEquals(StalenessTracker.Reason.NEVER_MATERIALIZED, status.reason());
        assertEquals("1", status.declaredVersion());
        assertNull(status.latest());
    }

    @Test
    public void testMatchingVersionIsFresh() {
        materialize(CLEAN, "1");
        StalenessTracker tracker = new StalenessTracker(graph("1"), eventLog);
        assertFalse(tracker.isStale(CLEAN));
        assertEquals(StalenessTracker.Reason.FRESH, tracker.status(CLEAN).reason());
    }

    @Test
    public void testVersionBumpMakesStale() {
        materialize(CLEAN, "1");
        StalenessTracker tracker = new StalenessTracker(graph("2"), eventLog);
        StalenessTracker.Status status = tracker.status(CLEAN);
        assertTrue(status.isStale());
        assertEquals(StalenessTracker.Reason.CODE_VERSION_CHANGED, status.reason());
        assertEquals("2", status.declaredVersion());
        assertEquals("1", status.recordedVersion());
    }

    @Test
    public void testLatestEventWins() {
        materialize(CLEAN, "1");
        materialize(CLEAN, "2");
        assertFalse(new StalenessTracker(graph("2"), eventLog).isStale(CLEAN));
    }

    @Test
    public void testSourceNeverStale() {
        StalenessTracker tracker = new StalenessTracker(graph("1"), eventLog);
        assertFalse(tracker.isStale(RAW));
        assertEquals(StalenessTracker.Reason.SOURCE, tracker.status(RAW).reason());
        assertEquals(Set.of(CLEAN), tracker.staleKeys());
        assertEquals(List.of(RAW, CLEAN), List.copyOf(tracker.report().keySet()));
    }

    @Test(expected = UnknownDependencyException.class)
    public void testUnknownKey() {
        new StalenessTracker(graph("1"), eventLog).isStale(AssetKey.of("nope"));
    }
}
