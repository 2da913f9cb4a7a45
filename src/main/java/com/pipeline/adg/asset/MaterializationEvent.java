package com.pipeline.adg.asset;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable record of one output slot being durably produced.
 *
 * Events are created only by the execution engine and appended to a
 * {@link com.pipeline.adg.api.MaterializationLog}; the latest event per key is
 * that key's current materialization.
 *
 * @param key         The materialized asset.
 * @param runId       Run that produced it.
 * @param stepName    Step that produced it.
 * @param timestamp   Time the value was stored.
 * @param codeVersion Code version active at production time, may be null.
 * @param metadata    Metadata emitted alongside the value.
 */
public record MaterializationEvent(
        AssetKey key,
        String runId,
        String stepName,
        Instant timestamp,
        String codeVersion,
        Map<String, Object> metadata) {

    public MaterializationEvent {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(runId, "runId");
        Objects.requireNonNull(timestamp, "timestamp");
        metadata = metadata == null || metadata.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }
}
