package com.pipeline.adg.error;

import com.pipeline.adg.asset.AssetKey;

/**
 * A step declined an output slot that is declared required.
 */
public class MissingRequiredOutputException extends AssetGraphException {
    private final AssetKey key;

    public MissingRequiredOutputException(String stepName, AssetKey key) {
        super("Step " + stepName + " did not emit required output " + key);
        this.key = key;
    }

    public AssetKey key() {
        return key;
    }
}
