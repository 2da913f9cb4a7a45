package com.pipeline.adg.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Value types a config field can declare.
 */
public enum FieldType {
    STRING, INT, LONG, DOUBLE, BOOLEAN, LIST, MAP;

    /**
     * Converts a raw config value to this type's canonical Java representation.
     *
     * @return the converted value, or null if {@code value} is not acceptable.
     */
    Object coerce(Object value) {
        return switch (this) {
            case STRING -> value instanceof String ? value : null;
            case BOOLEAN -> value instanceof Boolean ? value : null;
            case INT -> {
                if (value instanceof Integer || value instanceof Short || value instanceof Byte)
                    yield ((Number) value).intValue();
                if (value instanceof Long l && l >= Integer.MIN_VALUE && l <= Integer.MAX_VALUE)
                    yield l.intValue();
                yield null;
            }
            case LONG -> value instanceof Integer || value instanceof Long || value instanceof Short
                    ? ((Number) value).longValue()
                    : null;
            case DOUBLE -> value instanceof Number n ? n.doubleValue() : null;
            case LIST -> value instanceof List<?> list ? Collections.unmodifiableList(new ArrayList<>(list)) : null;
            case MAP -> value instanceof Map<?, ?> map ? Collections.unmodifiableMap(new LinkedHashMap<>(map)) : null;
        };
    }
}
