package com.pipeline.adg.decl;

import com.pipeline.adg.asset.AssetKey;

import java.util.Objects;

/**
 * A declared output slot of a step.
 */
public record OutputDeclaration(
        AssetKey key,
        boolean required,
        String codeVersion,
        String group,
        String ioManagerKey,
        String description) {

    public OutputDeclaration {
        Objects.requireNonNull(key, "key");
    }

    public static OutputDeclaration required(AssetKey key) {
        return new OutputDeclaration(key, true, null, null, null, null);
    }

    public static OutputDeclaration optional(AssetKey key) {
        return new OutputDeclaration(key, false, null, null, null, null);
    }

    public OutputDeclaration withCodeVersion(String codeVersion) {
        return new OutputDeclaration(key, required, codeVersion, group, ioManagerKey, description);
    }

    public OutputDeclaration withGroup(String group) {
        return new OutputDeclaration(key, required, codeVersion, group, ioManagerKey, description);
    }

    public OutputDeclaration withIoManager(String ioManagerKey) {
        return new OutputDeclaration(key, required, codeVersion, group, ioManagerKey, description);
    }

    public OutputDeclaration withDescription(String description) {
        return new OutputDeclaration(key, required, codeVersion, group, ioManagerKey, description);
    }
}
