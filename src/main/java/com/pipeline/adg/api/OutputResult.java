package com.pipeline.adg.api;

import java.util.Map;

/**
 * What a computation did with one requested output slot.
 */
public interface OutputResult {

    boolean isProduced();

    static Produced produced(Object value) {
        return new Produced(value, Map.of());
    }

    static Produced produced(Object value, Map<String, Object> metadata) {
        return new Produced(value, metadata);
    }

    static Declined declined() {
        return Declined.INSTANCE;
    }

    /** A value to persist, with metadata to stamp on the materialization event. */
    record Produced(Object value, Map<String, Object> metadata) implements OutputResult {
        public Produced {
            metadata = metadata == null ? Map.of() : metadata;
        }

        @Override
        public boolean isProduced() {
            return true;
        }
    }

    /** Deliberate non-emission. */
    record Declined() implements OutputResult {
        static final Declined INSTANCE = new Declined();

        @Override
        public boolean isProduced() {
            return false;
        }
    }
}
