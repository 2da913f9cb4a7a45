package com.pipeline.adg.decl;

import com.pipeline.adg.asset.AssetKey;
import com.pipeline.adg.asset.DependencyKind;

import java.util.Objects;

/**
 * A declared input of a step.
 *
 * With an explicit {@code key} the input binds to that asset. Without one, the
 * resolver binds it to the single asset whose last key segment equals
 * {@code parameterName}.
 */
public record InputDeclaration(String parameterName, AssetKey key, DependencyKind kind) {

    public InputDeclaration {
        Objects.requireNonNull(parameterName, "parameterName");
        Objects.requireNonNull(kind, "kind");
        if (parameterName.isEmpty())
            throw new IllegalArgumentException("Input parameter name must be non-empty");
    }

    /** Loaded input bound by name to the asset whose last segment is {@code parameterName}. */
    public static InputDeclaration loaded(String parameterName) {
        return new InputDeclaration(parameterName, null, DependencyKind.LOADED);
    }

    public static InputDeclaration loaded(String parameterName, AssetKey key) {
        return new InputDeclaration(parameterName, key, DependencyKind.LOADED);
    }

    /** Ordering-only dependency on {@code key}; the parameter is the key's display form. */
    public static InputDeclaration explicit(AssetKey key) {
        return new InputDeclaration(key.toUserString(), key, DependencyKind.EXPLICIT);
    }

    public boolean isNameMatched() {
        return key == null;
    }
}
