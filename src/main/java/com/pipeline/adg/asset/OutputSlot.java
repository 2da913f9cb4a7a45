package com.pipeline.adg.asset;

import java.util.Objects;

/**
 * One output of a step. Each slot maps 1:1 to a computed {@link AssetNode}.
 *
 * @param key          The asset this slot materializes.
 * @param required     Whether the step must emit this slot whenever it is requested.
 * @param codeVersion  Code version stamped on events for this slot, may be null.
 * @param ioManagerKey I/O manager used to persist the slot's value.
 */
public record OutputSlot(AssetKey key, boolean required, String codeVersion, String ioManagerKey) {

    public OutputSlot {
        Objects.requireNonNull(key, "key");
        ioManagerKey = ioManagerKey == null ? AssetNode.DEFAULT_IO_MANAGER : ioManagerKey;
    }
}
