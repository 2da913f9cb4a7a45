package com.pipeline.adg.engine;

import com.pipeline.adg.asset.AssetKey;
import com.pipeline.adg.asset.MaterializationEvent;

import java.util.Objects;

/**
 * Terminal outcome of one requested output slot.
 *
 * @param key    The output slot's asset key.
 * @param kind   What happened to the slot.
 * @param event  The recorded event, only for {@link Kind#MATERIALIZED}.
 * @param error  The originating error, only for {@link Kind#FAILED}.
 * @param reason Human readable reason for {@link Kind#SKIPPED}.
 */
public record SlotOutcome(AssetKey key, Kind kind, MaterializationEvent event, Throwable error, String reason) {

    public enum Kind {
        MATERIALIZED, SKIPPED, FAILED
    }

    public SlotOutcome {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(kind, "kind");
    }

    public static SlotOutcome materialized(MaterializationEvent event) {
        return new SlotOutcome(event.key(), Kind.MATERIALIZED, event, null, null);
    }

    public static SlotOutcome skipped(AssetKey key, String reason) {
        return new SlotOutcome(key, Kind.SKIPPED, null, null, reason);
    }

    public static SlotOutcome failed(AssetKey key, Throwable error) {
        return new SlotOutcome(key, Kind.FAILED, null, error, error.getMessage());
    }

    public boolean isMaterialized() {
        return kind == Kind.MATERIALIZED;
    }
}
