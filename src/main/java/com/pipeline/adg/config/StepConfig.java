package com.pipeline.adg.config;

import java.util.Map;

/**
 * Validated config values for one step invocation.
 */
public final class StepConfig {
    public static final StepConfig EMPTY = new StepConfig(Map.of());

    private final Map<String, Object> values;

    StepConfig(Map<String, Object> values) {
        this.values = values;
    }

    public Map<String, Object> values() {
        return values;
    }

    public boolean has(String field) {
        return values.containsKey(field);
    }

    @SuppressWarnings("unchecked")
    public <T> T get(String field) {
        return (T) values.get(field);
    }

    public String getString(String field) {
        return (String) values.get(field);
    }

    public int getInt(String field) {
        return (Integer) require(field);
    }

    public long getLong(String field) {
        return (Long) require(field);
    }

    public double getDouble(String field) {
        return (Double) require(field);
    }

    public boolean getBoolean(String field) {
        return (Boolean) require(field);
    }

    private Object require(String field) {
        Object v = values.get(field);
        if (v == null)
            throw new IllegalArgumentException("No value for config field '" + field + "'");
        return v;
    }

    @Override
    public String toString() {
        return "StepConfig" + values;
    }
}
