package com.pipeline.adg.engine;

import com.pipeline.adg.api.MaterializationLog;
import com.pipeline.adg.asset.AssetKey;
import com.pipeline.adg.asset.AssetNode;
import com.pipeline.adg.asset.MaterializationEvent;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Compares declared code versions with the versions stamped on the latest
 * materializations.
 *
 * Purely informational: the engine never re-executes anything because a key is
 * stale.
 */
public final class StalenessTracker {

    public enum Reason {
        /** Source assets have no code version and are never stale. */
        SOURCE,
        NEVER_MATERIALIZED,
        CODE_VERSION_CHANGED,
        FRESH;

        public boolean isStale() {
            return this == NEVER_MATERIALIZED || this == CODE_VERSION_CHANGED;
        }
    }

    /**
     * @param key             Checked asset.
     * @param reason          Why the key is (not) stale.
     * @param declaredVersion Code version on the current declaration.
     * @param recordedVersion Code version on the latest event, null without one.
     * @param latest          Latest event, null when never materialized.
     */
    public record Status(AssetKey key, Reason reason, String declaredVersion, String recordedVersion,
            MaterializationEvent latest) {

        public boolean isStale() {
            return reason.isStale();
        }
    }

    private final AssetGraph graph;
    private final MaterializationLog eventLog;

    public StalenessTracker(AssetGraph graph, MaterializationLog eventLog) {
        this.graph = graph;
        this.eventLog = eventLog;
    }

    /**
     * @throws com.pipeline.adg.error.UnknownDependencyException if the key is not
     *         part of the graph.
     */
    public boolean isStale(AssetKey key) {
        return status(key).isStale();
    }

    public Status status(AssetKey key) {
        AssetNode node = graph.requireNode(key);
        if (node.source())
            return new Status(key, Reason.SOURCE, null, null, null);
        MaterializationEvent latest = eventLog.latest(key);
        if (latest == null)
            return new Status(key, Reason.NEVER_MATERIALIZED, node.codeVersion(), null, null);
        Reason reason = Objects.equals(node.codeVersion(), latest.codeVersion())
                ? Reason.FRESH
                : Reason.CODE_VERSION_CHANGED;
        return new Status(key, reason, node.codeVersion(), latest.codeVersion(), latest);
    }

    /** Status of every key, in topological order. */
    public Map<AssetKey, Status> report() {
        Map<AssetKey, Status> result = new LinkedHashMap<>();
        for (AssetKey key : graph.topologicalOrder())
            result.put(key, status(key));
        return Collections.unmodifiableMap(result);
    }

    public Set<AssetKey> staleKeys() {
        Set<AssetKey> result = new LinkedHashSet<>();
        for (Status s : report().values())
            if (s.isStale())
                result.add(s.key());
        return Collections.unmodifiableSet(result);
    }
}
