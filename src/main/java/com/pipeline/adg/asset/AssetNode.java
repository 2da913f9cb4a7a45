package com.pipeline.adg.asset;

import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * One declared asset inside a resolved graph.
 *
 * Computed nodes name the step that produces them; source nodes have no step and
 * their value is supplied from outside the graph. Nodes are immutable for the
 * lifetime of the graph that owns them.
 *
 * @param key          Unique key across the graph.
 * @param dependencies Edges onto upstream assets, ordered by upstream key.
 * @param codeVersion  Declared code version, or null when unversioned.
 * @param group        Group name, {@link #DEFAULT_GROUP} unless declared otherwise.
 * @param source       True for externally supplied assets.
 * @param stepName     Producing step, null for source nodes.
 * @param ioManagerKey Key of the I/O manager that stores and loads this asset.
 * @param description  Free-form description, may be null.
 */
public record AssetNode(
        AssetKey key,
        List<DependencyEdge> dependencies,
        String codeVersion,
        String group,
        boolean source,
        String stepName,
        String ioManagerKey,
        String description) {

    public static final String DEFAULT_GROUP = "default";
    public static final String DEFAULT_IO_MANAGER = "io_manager";

    public AssetNode {
        Objects.requireNonNull(key, "key");
        dependencies = List.copyOf(dependencies);
        group = group == null ? DEFAULT_GROUP : group;
        ioManagerKey = ioManagerKey == null ? DEFAULT_IO_MANAGER : ioManagerKey;
        if (source && stepName != null)
            throw new IllegalArgumentException("Source asset " + key + " cannot be produced by step " + stepName);
        if (!source && stepName == null)
            throw new IllegalArgumentException("Computed asset " + key + " needs a producing step");
        if (source && !dependencies.isEmpty())
            throw new IllegalArgumentException("Source asset " + key + " cannot declare dependencies");
    }

    public static AssetNode source(AssetKey key, String group, String ioManagerKey, String description) {
        return new AssetNode(key, List.of(), null, group, true, null, ioManagerKey, description);
    }

    public Set<AssetKey> upstreamKeys() {
        return dependencies.stream().map(DependencyEdge::upstream).collect(Collectors.toUnmodifiableSet());
    }
}
