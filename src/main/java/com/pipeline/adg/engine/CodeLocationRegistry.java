package com.pipeline.adg.engine;

import com.pipeline.adg.asset.AssetKey;
import com.pipeline.adg.decl.Declarations;
import com.pipeline.adg.decl.OutputDeclaration;
import com.pipeline.adg.decl.SourceDeclaration;
import com.pipeline.adg.decl.StepDeclaration;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Shared registry of the declaration sets of several code locations.
 *
 * Each location is resolved on its own when registered, so a broken location is
 * rejected without touching the others. The workspace graph composes all
 * locations: a source in one location that names a key computed in another is a
 * weak reference to that computed asset, which stays authoritative.
 */
public final class CodeLocationRegistry {
    private static final Logger log = LogManager.getLogger(CodeLocationRegistry.class);

    private final GraphResolver resolver;
    private final Map<String, Declarations> locations = new LinkedHashMap<>();
    private final Map<String, AssetGraph> graphs = new LinkedHashMap<>();

    public CodeLocationRegistry(GraphResolver resolver) {
        this.resolver = resolver;
    }

    /**
     * Resolves and registers a location, replacing a previous registration of the
     * same name.
     */
    public synchronized AssetGraph register(String location, Declarations declarations) {
        AssetGraph graph = resolver.resolve(location, declarations);
        locations.put(location, declarations);
        graphs.put(location, graph);
        log.info("Registered code location '{}' with {} assets", location, graph.size());
        return graph;
    }

    public synchronized boolean unregister(String location) {
        graphs.remove(location);
        return locations.remove(location) != null;
    }

    public synchronized Map<String, AssetGraph> locationGraphs() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(graphs));
    }

    public synchronized AssetGraph locationGraph(String location) {
        return graphs.get(location);
    }

    /**
     * The location computing {@code key}, or else the first one declaring it as a
     * source; null if no location knows the key.
     */
    public synchronized String owner(AssetKey key) {
        for (var e : locations.entrySet())
            for (StepDeclaration step : e.getValue().steps())
                for (OutputDeclaration out : step.outputs())
                    if (out.key().equals(key))
                        return e.getKey();
        for (var e : locations.entrySet())
            for (SourceDeclaration src : e.getValue().sources())
                if (src.key().equals(key))
                    return e.getKey();
        return null;
    }

    /** Composes every registered location into one graph. */
    public synchronized AssetGraph workspaceGraph() {
        return resolver.compose("workspace", locations);
    }
}
