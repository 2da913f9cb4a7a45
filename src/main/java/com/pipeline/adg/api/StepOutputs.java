package com.pipeline.adg.api;

import com.pipeline.adg.asset.AssetKey;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The per-slot results returned by one computation attempt.
 *
 * A requested slot missing from the outputs counts as declined.
 */
public final class StepOutputs {
    private static final StepOutputs NONE = new StepOutputs(Map.of());

    private final Map<AssetKey, OutputResult> results;

    private StepOutputs(Map<AssetKey, OutputResult> results) {
        this.results = results;
    }

    public static StepOutputs none() {
        return NONE;
    }

    public static StepOutputs single(AssetKey key, Object value) {
        return builder().produce(key, value).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** The result recorded for the slot, or null if the computation said nothing about it. */
    public OutputResult get(AssetKey key) {
        return results.get(key);
    }

    public Map<AssetKey, OutputResult> results() {
        return results;
    }

    public static final class Builder {
        private final Map<AssetKey, OutputResult> results = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder produce(AssetKey key, Object value) {
            results.put(key, OutputResult.produced(value));
            return this;
        }

        public Builder produce(AssetKey key, Object value, Map<String, Object> metadata) {
            results.put(key, OutputResult.produced(value, metadata));
            return this;
        }

        public Builder decline(AssetKey key) {
            results.put(key, OutputResult.declined());
            return this;
        }

        public StepOutputs build() {
            return new StepOutputs(Collections.unmodifiableMap(new LinkedHashMap<>(results)));
        }
    }
}
