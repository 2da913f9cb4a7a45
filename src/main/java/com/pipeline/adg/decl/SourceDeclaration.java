package com.pipeline.adg.decl;

import com.pipeline.adg.asset.AssetKey;

import java.util.Objects;

/**
 * An externally supplied asset, or a reference to an asset owned elsewhere.
 *
 * @param key          Asset key.
 * @param group        Group, null for the default group.
 * @param ioManagerKey I/O manager that can load it, null for the default.
 * @param description  Free-form description, may be null.
 * @param site         Where it was declared, used in error messages.
 */
public record SourceDeclaration(AssetKey key, String group, String ioManagerKey, String description, String site) {

    public SourceDeclaration {
        Objects.requireNonNull(key, "key");
        site = site == null ? "source " + key : site;
    }

    public static SourceDeclaration of(AssetKey key) {
        return new SourceDeclaration(key, null, null, null, null);
    }

    public SourceDeclaration withGroup(String group) {
        return new SourceDeclaration(key, group, ioManagerKey, description, site);
    }

    public SourceDeclaration withIoManager(String ioManagerKey) {
        return new SourceDeclaration(key, group, ioManagerKey, description, site);
    }

    public SourceDeclaration withDescription(String description) {
        return new SourceDeclaration(key, group, ioManagerKey, description, site);
    }

    public SourceDeclaration withSite(String site) {
        return new SourceDeclaration(key, group, ioManagerKey, description, site);
    }
}
