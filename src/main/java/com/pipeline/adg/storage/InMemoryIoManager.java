package com.pipeline.adg.storage;

import com.pipeline.adg.api.IoManager;
import com.pipeline.adg.asset.AssetKey;
import com.pipeline.adg.error.LoadException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * {@link IoManager} keeping values in a concurrent map.
 *
 * Source asset values are seeded with {@link #put(AssetKey, Object)}. Null values
 * are stored as a marker so a produced null is still distinguishable from a
 * missing key.
 */
public class InMemoryIoManager implements IoManager {
    private static final Logger log = LogManager.getLogger(InMemoryIoManager.class);
    private static final Object NULL = new Object();

    private final Map<AssetKey, Object> values = new ConcurrentHashMap<>();
    private final Map<AssetKey, Map<String, Object>> metadata = new ConcurrentHashMap<>();

    /** Seeds an externally supplied value, e.g. for a source asset. */
    public InMemoryIoManager put(AssetKey key, Object value) {
        values.put(key, value == null ? NULL : value);
        return this;
    }

    @Override
    public void store(AssetKey key, Object value, Map<String, Object> meta) {
        values.put(key, value == null ? NULL : value);
        metadata.put(key, meta == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(meta)));
        log.debug("Stored {}", key);
    }

    @Override
    public Object load(AssetKey key) {
        Object value = values.get(key);
        if (value == null)
            throw new LoadException("No value stored for " + key);
        return value == NULL ? null : value;
    }

    public boolean contains(AssetKey key) {
        return values.containsKey(key);
    }

    /** Metadata passed with the last store of {@code key}, empty if none. */
    public Map<String, Object> metadata(AssetKey key) {
        return metadata.getOrDefault(key, Map.of());
    }

    public int size() {
        return values.size();
    }
}
