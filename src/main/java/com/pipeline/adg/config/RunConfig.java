package com.pipeline.adg.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Per-run config: step name to field values.
 *
 * <pre>
 * { "orders": { "limit": 100, "region": "eu" } }
 * </pre>
 */
public final class RunConfig {
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final RunConfig EMPTY = new RunConfig(Map.of());

    private final Map<String, Map<String, Object>> steps;

    private RunConfig(Map<String, Map<String, Object>> steps) {
        this.steps = steps;
    }

    public static RunConfig empty() {
        return EMPTY;
    }

    public static RunConfig fromJson(String json) {
        try {
            Map<String, Map<String, Object>> parsed = MAPPER.readValue(json,
                    new TypeReference<Map<String, Map<String, Object>>>() {
                    });
            return of(parsed == null ? Map.of() : parsed);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed run config: " + e.getOriginalMessage(), e);
        }
    }

    public static RunConfig of(Map<String, Map<String, Object>> steps) {
        Map<String, Map<String, Object>> copy = new LinkedHashMap<>();
        steps.forEach((step, values) -> copy.put(step,
                Collections.unmodifiableMap(new LinkedHashMap<>(values == null ? Map.of() : values))));
        return new RunConfig(Collections.unmodifiableMap(copy));
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Raw values for a step; empty when the run carries none. */
    public Map<String, Object> forStep(String stepName) {
        return steps.getOrDefault(stepName, Map.of());
    }

    public Set<String> stepNames() {
        return steps.keySet();
    }

    public static final class Builder {
        private final Map<String, Map<String, Object>> steps = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder set(String stepName, String field, Object value) {
            steps.computeIfAbsent(stepName, k -> new LinkedHashMap<>()).put(field, value);
            return this;
        }

        public RunConfig build() {
            return of(steps);
        }
    }
}
