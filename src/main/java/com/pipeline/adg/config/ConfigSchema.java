package com.pipeline.adg.config;

import com.pipeline.adg.error.ConfigValidationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Declared shape of a step's config: field name to type, required flag and default.
 *
 * Run config is validated against the schema once per run, before anything
 * executes, and handed to the computation as a {@link StepConfig}.
 */
public final class ConfigSchema {
    public static final ConfigSchema EMPTY = new ConfigSchema(Map.of());

    /** One declared field. {@code defaultValue} applies only to optional fields. */
    public record Field(String name, FieldType type, boolean required, Object defaultValue) {
        public Field {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(type, "type");
        }
    }

    private final Map<String, Field> fields;

    private ConfigSchema(Map<String, Field> fields) {
        this.fields = fields;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Map<String, Field> fields() {
        return fields;
    }

    /**
     * Checks {@code values} against the schema and fills in defaults.
     *
     * @throws ConfigValidationException listing every problem found.
     */
    public StepConfig validate(String stepName, Map<String, Object> values) {
        Map<String, Object> raw = values == null ? Map.of() : values;
        List<String> problems = new ArrayList<>();
        Map<String, Object> resolved = new LinkedHashMap<>();

        for (String name : raw.keySet())
            if (!fields.containsKey(name))
                problems.add("unknown field '" + name + "'");

        for (Field field : fields.values()) {
            Object value = raw.get(field.name());
            if (value == null) {
                if (field.required())
                    problems.add("missing required field '" + field.name() + "'");
                else if (field.defaultValue() != null)
                    resolved.put(field.name(), field.defaultValue());
                continue;
            }
            Object coerced = field.type().coerce(value);
            if (coerced == null)
                problems.add("field '" + field.name() + "' expects " + field.type() + " but got "
                        + value.getClass().getSimpleName());
            else
                resolved.put(field.name(), coerced);
        }

        if (!problems.isEmpty())
            throw new ConfigValidationException(stepName, problems);
        return new StepConfig(Collections.unmodifiableMap(resolved));
    }

    public static final class Builder {
        private final Map<String, Field> fields = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder required(String name, FieldType type) {
            return add(new Field(name, type, true, null));
        }

        public Builder optional(String name, FieldType type) {
            return add(new Field(name, type, false, null));
        }

        public Builder optional(String name, FieldType type, Object defaultValue) {
            Object coerced = type.coerce(defaultValue);
            if (coerced == null)
                throw new IllegalArgumentException("Default for '" + name + "' is not a " + type);
            return add(new Field(name, type, false, coerced));
        }

        private Builder add(Field field) {
            if (fields.putIfAbsent(field.name(), field) != null)
                throw new IllegalArgumentException("Field declared twice: " + field.name());
            return this;
        }

        public ConfigSchema build() {
            return new ConfigSchema(Collections.unmodifiableMap(new LinkedHashMap<>(fields)));
        }
    }
}
